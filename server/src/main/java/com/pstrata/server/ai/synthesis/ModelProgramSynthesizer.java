package com.pstrata.server.ai.synthesis;

import com.pstrata.server.ai.ConfigurationException;
import com.pstrata.server.ai.SynthesisException;
import com.pstrata.server.ai.family.FamilyLinkEntry;
import com.pstrata.server.ai.family.OutcomeFamily;
import com.pstrata.server.ai.family.ValueDomain;
import com.pstrata.server.ai.prior.ModelPriors;
import com.pstrata.server.ai.prior.PriorSerializer;
import com.pstrata.server.ai.prior.PriorSpec;
import com.pstrata.server.ai.strata.GroupRow;
import com.pstrata.server.ai.strata.GroupTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Emits a Stan program and its data payload for a principal stratification model.
 *
 * <p>Each group of the {@link GroupTable} gets its own intercept, coefficient row and,
 * when the family has one, auxiliary parameter. A unit's likelihood is the log-sum-exp
 * over the strata whose declared intermediate value under the unit's treatment equals
 * the observed one, each term weighted by the stratum membership probability from a
 * multinomial logit with the first stratum as reference. Generated quantities re-derive
 * per-group mean outcomes (or survival probabilities and restricted mean survival) from
 * the same table, so draws can be mapped back onto strata and treatments by group id.
 */
public class ModelProgramSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(ModelProgramSynthesizer.class);

    public static final String MEAN_EFFECT = "mean_effect";
    public static final String MEAN_SURV_PROB = "mean_surv_prob";
    public static final String MEAN_RACE = "mean_RACE";

    private static final String INDENT = "  ";

    public SynthesizedModel synthesize(ModelSpecification spec, StructuralDesign design) {
        return synthesize(spec.getGroupTable(), spec.getFamily(), spec.getPriors(), design,
                spec.getStrataNames(), spec.getTreatmentNames(), spec.getTimePoints());
    }

    public SynthesizedModel synthesize(GroupTable table, FamilyLinkEntry family, ModelPriors priors,
            StructuralDesign design, List<String> strataNames, List<String> treatmentNames,
            SurvivalTimePoints timePoints) {
        checkTable(table, strataNames, treatmentNames);
        PriorSpec auxPrior = priors.auxiliaryFor(family);
        validateData(table, family, design);

        double[] time = null;
        if (family.getFamily().isSurvival()) {
            SurvivalTimePoints tp = timePoints == null ? SurvivalTimePoints.defaults() : timePoints;
            time = tp.resolve(design.getResponse());
        }

        Map<Integer, TreeSet<Integer>> patterns = observedPatterns(design);
        List<Integer> wildcardOnly = groupsWithoutLikelihood(table);
        if (!wildcardOnly.isEmpty() && priors.getIntercept().isFlat()) {
            logger.warn("Groups {} hold only wildcard cells and get no likelihood term; with a flat intercept prior "
                    + "their alpha_G draws are improper. Declare a proper intercept prior to use their outcomes.",
                    wildcardOnly);
        }

        StringBuilder sb = new StringBuilder();
        writeFunctions(sb, family);
        writeData(sb, family, table.getTreatmentCount());
        writeTransformedData(sb, table);
        writeParameters(sb, family);
        writeModel(sb, table, family, priors, auxPrior, patterns);
        writeGeneratedQuantities(sb, family);

        Map<String, Object> data = buildPayload(table, family, design, time);
        logger.info("Synthesized {} program: {} strata, {} treatments, {} groups, {} units",
                family.getKernelName(), table.getStratumCount(), table.getTreatmentCount(),
                table.getGroupCount(), design.getUnitCount());
        return new SynthesizedModel(sb.toString(), data, table, family, strataNames, treatmentNames, time);
    }

    // Groups whose rows are all wildcard cells: no unit's likelihood ever reaches them.
    static List<Integer> groupsWithoutLikelihood(GroupTable table) {
        TreeSet<Integer> ids = new TreeSet<>();
        for (GroupRow r : table.getRows()) {
            ids.add(r.getGroupId());
        }
        for (GroupRow r : table.getRows()) {
            if (!r.isWildcard()) {
                ids.remove(r.getGroupId());
            }
        }
        return new ArrayList<>(ids);
    }

    // Every group referenced by a row must have a parameter block and no block may be orphaned.
    private static void checkTable(GroupTable table, List<String> strataNames, List<String> treatmentNames) {
        if (strataNames.size() != table.getStratumCount()) {
            throw new SynthesisException("Group table has " + table.getStratumCount() + " strata but "
                    + strataNames.size() + " stratum names were given");
        }
        if (treatmentNames.size() != table.getTreatmentCount()) {
            throw new SynthesisException("Group table has " + table.getTreatmentCount() + " treatments but "
                    + treatmentNames.size() + " treatment names were given");
        }
        int groups = table.getGroupCount();
        boolean[] seen = new boolean[groups];
        for (GroupRow r : table.getRows()) {
            int g = r.getGroupId();
            if (g < 1 || g > groups) {
                throw new SynthesisException("Group " + g + " of " + r + " has no parameter block (1.." + groups + ")");
            }
            if (table.stratumOfGroup(g) != r.getStratumId()) {
                throw new SynthesisException("Group " + g + " is shared across strata");
            }
            seen[g - 1] = true;
        }
        for (int g = 0; g < groups; g++) {
            if (!seen[g]) {
                throw new SynthesisException("Parameter block for group " + (g + 1) + " is not referenced by any cell");
            }
        }
    }

    private static void validateData(GroupTable table, FamilyLinkEntry family, StructuralDesign design) {
        OutcomeFamily f = family.getFamily();
        double[] y = design.getResponse();
        int[] z = design.getTreatment();
        int[] d = design.getIntermediate();
        for (int n = 0; n < y.length; n++) {
            if (z[n] < 0 || z[n] >= table.getTreatmentCount()) {
                throw new ConfigurationException("Unit " + (n + 1) + " has treatment code " + z[n]
                        + " outside 0.." + (table.getTreatmentCount() - 1));
            }
            if (d[n] < 0) {
                throw new ConfigurationException("Unit " + (n + 1) + " has a negative intermediate outcome");
            }
            if (!Double.isFinite(y[n])) {
                throw new ConfigurationException("Unit " + (n + 1) + " has a non-finite response");
            }
            if (f.isIntegerOutcome() && (y[n] != Math.rint(y[n]) || y[n] < 0)) {
                throw new ConfigurationException("Family " + f.getFamilyName()
                        + " needs non-negative integer responses, unit " + (n + 1) + " has " + y[n]);
            }
            if (f == OutcomeFamily.BINOMIAL && y[n] > 1) {
                throw new ConfigurationException("Binomial responses must be 0 or 1, unit " + (n + 1) + " has " + y[n]);
            }
            if (f.getLocationDomain() == ValueDomain.POSITIVE || f.isSurvival()) {
                if (y[n] <= 0) {
                    throw new ConfigurationException("Family " + f.getFamilyName()
                            + " needs positive responses, unit " + (n + 1) + " has " + y[n]);
                }
            }
            if (table.consistentWith(z[n], d[n]).isEmpty()) {
                throw new ConfigurationException("Unit " + (n + 1) + " (treatment " + z[n] + ", intermediate "
                        + d[n] + ") is not consistent with any declared stratum");
            }
        }
        if (f.isSurvival()) {
            int[] delta = design.getEventIndicator();
            if (delta == null) {
                throw new ConfigurationException("Survival family " + f.getFamilyName() + " needs an event indicator");
            }
            for (int n = 0; n < delta.length; n++) {
                if (delta[n] != 0 && delta[n] != 1) {
                    throw new ConfigurationException("Event indicator must be 0 or 1, unit " + (n + 1) + " has " + delta[n]);
                }
            }
        }
    }

    private static Map<Integer, TreeSet<Integer>> observedPatterns(StructuralDesign design) {
        Map<Integer, TreeSet<Integer>> patterns = new TreeMap<>();
        int[] z = design.getTreatment();
        int[] d = design.getIntermediate();
        for (int n = 0; n < z.length; n++) {
            patterns.computeIfAbsent(z[n], k -> new TreeSet<>()).add(d[n]);
        }
        return patterns;
    }

    private static void writeFunctions(StringBuilder sb, FamilyLinkEntry family) {
        List<String> fns = new ArrayList<>();
        String k = family.getKernelName();
        switch (family.getLink()) {
            case CAUCHIT:
                fns.add("real inv_cauchit(real x) {\n"
                        + INDENT + INDENT + "return atan(x) / pi() + 0.5;\n"
                        + INDENT + "}");
                break;
            default:
                break;
        }
        switch (family.getFamily()) {
            case INVERSE_GAUSSIAN:
                fns.add("real " + k + "_lpdf(real y, real mu, real lambda) {\n"
                        + INDENT + INDENT + "return 0.5 * log(lambda / (2 * pi() * y^3))"
                        + " - lambda * square(y - mu) / (2 * square(mu) * y);\n"
                        + INDENT + "}");
                break;
            case SURVIVAL_COX:
                // Weibull proportional hazards: shape exp(theta), hazard multiplier exp(mu)
                fns.add("real " + k + "_lpdf(real y, real mu, real theta, int delta) {\n"
                        + INDENT + INDENT + "real log_surv = -pow(y, exp(theta)) * exp(mu);\n"
                        + INDENT + INDENT + "real log_density = theta + (exp(theta) - 1) * log(y) + mu + log_surv;\n"
                        + INDENT + INDENT + "return delta * log_density + (1 - delta) * log_surv;\n"
                        + INDENT + "}");
                fns.add("real " + k + "_surv(real t, real mu, real theta) {\n"
                        + INDENT + INDENT + "return exp(-pow(t, exp(theta)) * exp(mu));\n"
                        + INDENT + "}");
                break;
            case SURVIVAL_AFT:
                // log T ~ normal(mu, sigma)
                fns.add("real " + k + "_lpdf(real y, real mu, real sigma, int delta) {\n"
                        + INDENT + INDENT + "real log_density = normal_lpdf(log(y) | mu, sigma) - log(y);\n"
                        + INDENT + INDENT + "real log_surv = normal_lccdf(log(y) | mu, sigma);\n"
                        + INDENT + INDENT + "return delta * log_density + (1 - delta) * log_surv;\n"
                        + INDENT + "}");
                fns.add("real " + k + "_surv(real t, real mu, real sigma) {\n"
                        + INDENT + INDENT + "return t > 0 ? 1 - Phi((log(t) - mu) / sigma) : 1.0;\n"
                        + INDENT + "}");
                break;
            default:
                break;
        }
        if (fns.isEmpty()) {
            return;
        }
        sb.append("functions {\n");
        for (String fn : fns) {
            sb.append(INDENT).append(fn).append('\n');
        }
        sb.append("}\n");
    }

    private static void writeData(StringBuilder sb, FamilyLinkEntry family, int treatmentCount) {
        OutcomeFamily f = family.getFamily();
        sb.append("data {\n");
        line(sb, 1, "int<lower=1> N;");
        line(sb, 1, "int<lower=1> S;");
        line(sb, 1, "int<lower=1> G;");
        line(sb, 1, "int<lower=0> PS;");
        line(sb, 1, "int<lower=0> PG;");
        line(sb, 1, "array[N] int<lower=0, upper=" + (treatmentCount - 1) + "> Z;");
        line(sb, 1, "array[N] int<lower=0> D;");
        if (f.isIntegerOutcome()) {
            line(sb, 1, "array[N] int<lower=0> Y;");
        } else if (f.isSurvival() || f.getLocationDomain() == ValueDomain.POSITIVE) {
            line(sb, 1, "vector<lower=0>[N] Y;");
        } else {
            line(sb, 1, "vector[N] Y;");
        }
        line(sb, 1, "matrix[N, PS] XS;");
        line(sb, 1, "matrix[N, PG] XG;");
        if (f.isSurvival()) {
            line(sb, 1, "array[N] int<lower=0, upper=1> delta;");
            line(sb, 1, "int<lower=1> n_time;");
            line(sb, 1, "vector<lower=0>[n_time] time_points;");
        }
        sb.append("}\n");
    }

    private static void writeTransformedData(StringBuilder sb, GroupTable table) {
        StringBuilder ids = new StringBuilder();
        for (int g = 1; g <= table.getGroupCount(); g++) {
            if (g > 1) {
                ids.append(", ");
            }
            ids.append(table.stratumOfGroup(g) + 1);
        }
        sb.append("transformed data {\n");
        line(sb, 1, "array[G] int group_stratum = {" + ids + "};");
        sb.append("}\n");
    }

    private static void writeParameters(StringBuilder sb, FamilyLinkEntry family) {
        sb.append("parameters {\n");
        line(sb, 1, "vector[S - 1] alpha_S;");
        line(sb, 1, "matrix[S - 1, PS] beta_S;");
        line(sb, 1, "vector[G] alpha_G;");
        line(sb, 1, "matrix[G, PG] beta_G;");
        if (family.hasAuxiliary()) {
            String bound = family.getAuxiliaryDomain() == ValueDomain.POSITIVE ? "<lower=0>" : "";
            line(sb, 1, "vector" + bound + "[G] " + family.getAuxiliaryName() + ";");
        }
        sb.append("}\n");
    }

    private static void writeModel(StringBuilder sb, GroupTable table, FamilyLinkEntry family, ModelPriors priors,
            PriorSpec auxPrior, Map<Integer, TreeSet<Integer>> patterns) {
        sb.append("model {\n");
        prior(sb, priors.getIntercept(), "alpha_S");
        prior(sb, priors.getCoefficient(), "to_vector(beta_S)");
        prior(sb, priors.getIntercept(), "alpha_G");
        prior(sb, priors.getCoefficient(), "to_vector(beta_G)");
        if (auxPrior != null) {
            prior(sb, auxPrior, family.getAuxiliaryName());
        }

        line(sb, 1, "for (n in 1:N) {");
        line(sb, 2, "vector[S] log_prob = log_softmax(append_row(0, alpha_S + beta_S * XS[n]'));");
        line(sb, 2, "vector[G] mu;");
        line(sb, 2, "for (g in 1:G) {");
        line(sb, 3, "mu[g] = " + family.getLink().applyInverse("alpha_G[g] + dot_product(XG[n], beta_G[g])") + ";");
        line(sb, 2, "}");

        boolean first = true;
        for (Map.Entry<Integer, TreeSet<Integer>> e : patterns.entrySet()) {
            int z = e.getKey();
            for (int d : e.getValue()) {
                List<GroupRow> rows = table.consistentWith(z, d);
                String cond = "if (Z[n] == " + z + " && D[n] == " + d + ") {";
                line(sb, 2, first ? cond : "} else " + cond);
                first = false;
                if (rows.size() == 1) {
                    line(sb, 3, "target += " + term(family, rows.get(0)) + ";");
                } else {
                    StringBuilder terms = new StringBuilder();
                    for (int i = 0; i < rows.size(); i++) {
                        if (i > 0) {
                            terms.append(",\n").append(INDENT.repeat(5));
                        }
                        terms.append(term(family, rows.get(i)));
                    }
                    line(sb, 3, "target += log_sum_exp({" + terms + "});");
                }
            }
        }
        line(sb, 2, "} else {");
        line(sb, 3, "reject(\"unit \", n, \" matches no declared stratum\");");
        line(sb, 2, "}");
        line(sb, 1, "}");
        sb.append("}\n");
    }

    private static String term(FamilyLinkEntry family, GroupRow row) {
        return "log_prob[" + (row.getStratumId() + 1) + "] + " + kernelCall(family, row.getGroupId());
    }

    /**
     * Log-likelihood of unit n under group g, with mu[g] already on the location scale.
     */
    static String kernelCall(FamilyLinkEntry family, int g) {
        OutcomeFamily f = family.getFamily();
        String loc = "mu[" + g + "]";
        String aux = family.hasAuxiliary() ? family.getAuxiliaryName() + "[" + g + "]" : null;
        String suffix = f.isIntegerOutcome() ? "_lpmf" : "_lpdf";
        StringBuilder call = new StringBuilder(family.getKernelName()).append(suffix).append("(Y[n] | ");
        if (f == OutcomeFamily.GAMMA) {
            // shape alpha, rate alpha / mu gives mean mu
            call.append(aux).append(", ").append(aux).append(" / ").append(loc);
        } else {
            call.append(loc);
            if (aux != null) {
                call.append(", ").append(aux);
            }
        }
        if (f.isSurvival()) {
            call.append(", delta[n]");
        }
        return call.append(')').toString();
    }

    private static void writeGeneratedQuantities(StringBuilder sb, FamilyLinkEntry family) {
        String location = family.getLink().applyInverse("alpha_G[g] + dot_product(XG[n], beta_G[g])");
        String prob = "vector[S] prob = softmax(append_row(0, alpha_S + beta_S * XS[n]'));";
        sb.append("generated quantities {\n");
        if (!family.getFamily().isSurvival()) {
            line(sb, 1, "vector[G] " + MEAN_EFFECT + ";");
            line(sb, 1, "{");
            line(sb, 2, "vector[G] numer = rep_vector(0, G);");
            line(sb, 2, "vector[G] denom = rep_vector(0, G);");
            line(sb, 2, "for (n in 1:N) {");
            line(sb, 3, prob);
            line(sb, 3, "for (g in 1:G) {");
            line(sb, 4, "real w = prob[group_stratum[g]];");
            line(sb, 4, "numer[g] += w * " + location + ";");
            line(sb, 4, "denom[g] += w;");
            line(sb, 3, "}");
            line(sb, 2, "}");
            line(sb, 2, MEAN_EFFECT + " = numer ./ denom;");
            line(sb, 1, "}");
        } else {
            String surv = family.getKernelName() + "_surv(time_points[t], mu_g, "
                    + family.getAuxiliaryName() + "[g])";
            line(sb, 1, "matrix[G, n_time] " + MEAN_SURV_PROB + ";");
            line(sb, 1, "matrix[G, n_time] " + MEAN_RACE + ";");
            line(sb, 1, "{");
            line(sb, 2, "matrix[G, n_time] numer = rep_matrix(0, G, n_time);");
            line(sb, 2, "vector[G] denom = rep_vector(0, G);");
            line(sb, 2, "for (n in 1:N) {");
            line(sb, 3, prob);
            line(sb, 3, "for (g in 1:G) {");
            line(sb, 4, "real w = prob[group_stratum[g]];");
            line(sb, 4, "real mu_g = " + location + ";");
            line(sb, 4, "for (t in 1:n_time) {");
            line(sb, 5, "numer[g, t] += w * " + surv + ";");
            line(sb, 4, "}");
            line(sb, 4, "denom[g] += w;");
            line(sb, 3, "}");
            line(sb, 2, "}");
            line(sb, 2, "for (g in 1:G) {");
            line(sb, 3, "real area = 0;");
            line(sb, 3, "real prev_time = 0;");
            line(sb, 3, "real prev_surv = 1;");
            line(sb, 3, "for (t in 1:n_time) {");
            line(sb, 4, MEAN_SURV_PROB + "[g, t] = numer[g, t] / denom[g];");
            line(sb, 4, "area += (time_points[t] - prev_time) * (" + MEAN_SURV_PROB + "[g, t] + prev_surv) / 2;");
            line(sb, 4, MEAN_RACE + "[g, t] = area;");
            line(sb, 4, "prev_time = time_points[t];");
            line(sb, 4, "prev_surv = " + MEAN_SURV_PROB + "[g, t];");
            line(sb, 3, "}");
            line(sb, 2, "}");
            line(sb, 1, "}");
        }
        sb.append("}\n");
    }

    private static Map<String, Object> buildPayload(GroupTable table, FamilyLinkEntry family,
            StructuralDesign design, double[] time) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("N", design.getUnitCount());
        data.put("S", table.getStratumCount());
        data.put("G", table.getGroupCount());
        data.put("PS", design.getStratumCovariateNames().size());
        data.put("PG", design.getOutcomeCovariateNames().size());
        data.put("Z", design.getTreatment());
        data.put("D", design.getIntermediate());
        double[] y = design.getResponse();
        if (family.getFamily().isIntegerOutcome()) {
            int[] yi = new int[y.length];
            for (int n = 0; n < y.length; n++) {
                yi[n] = (int) y[n];
            }
            data.put("Y", yi);
        } else {
            data.put("Y", y);
        }
        data.put("XS", design.getStratumCovariates());
        data.put("XG", design.getOutcomeCovariates());
        if (time != null) {
            data.put("delta", design.getEventIndicator());
            data.put("n_time", time.length);
            data.put("time_points", time);
        }
        return data;
    }

    private static void prior(StringBuilder sb, PriorSpec prior, String target) {
        String stmt = PriorSerializer.statement(prior, target);
        if (stmt != null) {
            line(sb, 1, stmt);
        }
    }

    private static void line(StringBuilder sb, int depth, String text) {
        sb.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
