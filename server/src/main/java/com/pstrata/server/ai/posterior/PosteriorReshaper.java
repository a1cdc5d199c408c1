package com.pstrata.server.ai.posterior;

import com.pstrata.server.ai.DimensionMismatchException;
import com.pstrata.server.ai.inference.ParameterDraws;
import com.pstrata.server.ai.inference.PosteriorDraws;
import com.pstrata.server.ai.strata.GroupTable;
import com.pstrata.server.ai.synthesis.ModelProgramSynthesizer;
import com.pstrata.server.ai.synthesis.SynthesizedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Projects group-indexed draws onto the Stratum x Treatment [x Time] grid. Every cell
 * reads the draws of the group the table assigns it, so cells sharing a group are
 * element-wise equal.
 */
public final class PosteriorReshaper {

    private static final Logger logger = LoggerFactory.getLogger(PosteriorReshaper.class);

    private PosteriorReshaper() {
    }

    /**
     * Picks the generated quantity matching the model's family and {@code type} and
     * reshapes it.
     */
    public static PosteriorOutcomeArray reshape(PosteriorDraws draws, SynthesizedModel model, OutcomeType type) {
        return reshape(draws, model.getGroupTable(), model.getStrataNames(), model.getTreatmentNames(),
                model.getTimePoints(), type);
    }

    public static PosteriorOutcomeArray reshape(PosteriorDraws draws, GroupTable table, List<String> strataNames,
            List<String> treatmentNames, double[] timePoints, OutcomeType type) {
        String parameter;
        if (timePoints == null) {
            parameter = ModelProgramSynthesizer.MEAN_EFFECT;
        } else if (type == OutcomeType.RACE) {
            parameter = ModelProgramSynthesizer.MEAN_RACE;
        } else {
            parameter = ModelProgramSynthesizer.MEAN_SURV_PROB;
        }
        return reshape(draws.get(parameter), table, strataNames, treatmentNames, timePoints);
    }

    /**
     * @param raw        draws with dims [G] or, when {@code timePoints} is given, [G, T]
     * @param timePoints null for outcomes without a time axis
     */
    public static PosteriorOutcomeArray reshape(ParameterDraws raw, GroupTable table, List<String> strataNames,
            List<String> treatmentNames, double[] timePoints) {
        if (strataNames.size() != table.getStratumCount() || treatmentNames.size() != table.getTreatmentCount()) {
            throw new DimensionMismatchException("Labels (" + strataNames.size() + " strata, " + treatmentNames.size()
                    + " treatments) do not match the group table (" + table.getStratumCount() + " x "
                    + table.getTreatmentCount() + ")");
        }
        int[] dims = raw.getDims();
        int expectedRank = timePoints == null ? 1 : 2;
        if (dims.length != expectedRank) {
            throw new DimensionMismatchException(raw.getName() + " has " + dims.length + " axes, expected "
                    + expectedRank);
        }
        int g = table.getGroupCount();
        if (dims[0] != g) {
            throw new DimensionMismatchException(raw.getName() + " has group axis of size " + dims[0] + " but the table has "
                    + g + " groups");
        }
        int tc = 1;
        if (timePoints != null) {
            tc = timePoints.length;
            if (dims[1] != tc) {
                throw new DimensionMismatchException(raw.getName() + " has time axis of size " + dims[1] + " but "
                        + tc + " time points were requested");
            }
        }

        int s = table.getStratumCount();
        int z = table.getTreatmentCount();
        int iters = raw.getIterationCount();
        double[] values = new double[s * z * tc * iters];
        int k = 0;
        for (int si = 0; si < s; si++) {
            for (int zi = 0; zi < z; zi++) {
                int groupIdx = table.groupOf(si, zi) - 1;
                for (int t = 0; t < tc; t++) {
                    double[] col = timePoints == null ? raw.column(groupIdx) : raw.column(groupIdx, t);
                    System.arraycopy(col, 0, values, k, iters);
                    k += iters;
                }
            }
        }
        logger.debug("Reshaped {} onto {} x {} x {} x {}", raw.getName(), s, z, tc, iters);
        return new PosteriorOutcomeArray(strataNames, treatmentNames, timePoints, iters, values);
    }
}
