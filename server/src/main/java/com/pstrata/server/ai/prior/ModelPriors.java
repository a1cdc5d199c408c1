package com.pstrata.server.ai.prior;

import com.pstrata.server.ai.UnsupportedCombinationException;
import com.pstrata.server.ai.family.FamilyLinkEntry;
import com.pstrata.server.ai.family.ValueDomain;

/**
 * The priors of one model: intercepts, coefficients, and one slot per auxiliary parameter
 * name a family may introduce.
 */
public class ModelPriors {

    private final PriorSpec intercept;
    private final PriorSpec coefficient;
    private final PriorSpec sigma;
    private final PriorSpec alpha;
    private final PriorSpec lambda;
    private final PriorSpec theta;

    private ModelPriors(Builder b) {
        this.intercept = b.intercept;
        this.coefficient = b.coefficient;
        this.sigma = b.sigma;
        this.alpha = b.alpha;
        this.lambda = b.lambda;
        this.theta = b.theta;
    }

    public static ModelPriors defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public PriorSpec getIntercept() {
        return intercept;
    }

    public PriorSpec getCoefficient() {
        return coefficient;
    }

    public PriorSpec getSigma() {
        return sigma;
    }

    public PriorSpec getAlpha() {
        return alpha;
    }

    public PriorSpec getLambda() {
        return lambda;
    }

    public PriorSpec getTheta() {
        return theta;
    }

    /**
     * Prior for the family's auxiliary parameter, checked against that parameter's domain.
     * Null when the family has no auxiliary parameter.
     */
    public PriorSpec auxiliaryFor(FamilyLinkEntry entry) {
        if (!entry.hasAuxiliary()) {
            return null;
        }
        PriorSpec prior;
        switch (entry.getAuxiliaryName()) {
            case "sigma":
                prior = sigma;
                break;
            case "alpha":
                prior = alpha;
                break;
            case "lambda":
                prior = lambda;
                break;
            case "theta":
                prior = theta;
                break;
            default:
                throw new UnsupportedCombinationException("No prior slot for auxiliary parameter "
                        + entry.getAuxiliaryName());
        }
        checkDomain(prior, entry.getAuxiliaryDomain(), entry.getAuxiliaryName());
        return prior;
    }

    /**
     * Rejects a prior whose support differs from the parameter's. Flat priors fit anything.
     */
    public static void checkDomain(PriorSpec prior, ValueDomain parameterDomain, String parameterName) {
        if (prior.isFlat()) {
            return;
        }
        if (prior.getDomain() != parameterDomain) {
            throw new UnsupportedCombinationException("Prior " + prior.getName() + " has "
                    + prior.getDomain().getLabel() + " support but parameter " + parameterName + " is "
                    + parameterDomain.getLabel());
        }
    }

    public static class Builder {
        private PriorSpec intercept = Priors.flat();
        private PriorSpec coefficient = Priors.normal();
        private PriorSpec sigma = Priors.invGamma();
        private PriorSpec alpha = Priors.invGamma();
        private PriorSpec lambda = Priors.invGamma();
        private PriorSpec theta = Priors.normal();

        private Builder() {
        }

        public Builder intercept(PriorSpec prior) {
            this.intercept = nonNull(prior);
            return this;
        }

        public Builder coefficient(PriorSpec prior) {
            this.coefficient = nonNull(prior);
            return this;
        }

        public Builder sigma(PriorSpec prior) {
            this.sigma = nonNull(prior);
            return this;
        }

        public Builder alpha(PriorSpec prior) {
            this.alpha = nonNull(prior);
            return this;
        }

        public Builder lambda(PriorSpec prior) {
            this.lambda = nonNull(prior);
            return this;
        }

        public Builder theta(PriorSpec prior) {
            this.theta = nonNull(prior);
            return this;
        }

        private static PriorSpec nonNull(PriorSpec prior) {
            if (prior == null) {
                throw new IllegalArgumentException("prior must not be null, use Priors.flat()");
            }
            return prior;
        }

        public ModelPriors build() {
            checkDomain(intercept, ValueDomain.REAL, "intercept");
            checkDomain(coefficient, ValueDomain.REAL, "coefficient");
            return new ModelPriors(this);
        }
    }
}
