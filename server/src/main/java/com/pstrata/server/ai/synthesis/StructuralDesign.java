package com.pstrata.server.ai.synthesis;

import com.pstrata.server.ai.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Response, treatment, intermediate outcome and covariate matrices for one data set, as
 * produced by the formula layer. Covariate matrices exclude the intercept column.
 */
public class StructuralDesign {

    private final double[] response;
    private final int[] treatment;
    private final int[] intermediate;
    private final double[][] stratumCovariates;
    private final List<String> stratumCovariateNames;
    private final double[][] outcomeCovariates;
    private final List<String> outcomeCovariateNames;
    // 1 = event observed, 0 = right-censored; null outside survival models
    private final int[] eventIndicator;

    private StructuralDesign(Builder b) {
        this.response = b.response;
        this.treatment = b.treatment;
        this.intermediate = b.intermediate;
        this.stratumCovariates = b.stratumCovariates;
        this.stratumCovariateNames = Collections.unmodifiableList(new ArrayList<>(b.stratumCovariateNames));
        this.outcomeCovariates = b.outcomeCovariates;
        this.outcomeCovariateNames = Collections.unmodifiableList(new ArrayList<>(b.outcomeCovariateNames));
        this.eventIndicator = b.eventIndicator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getUnitCount() {
        return response.length;
    }

    public double[] getResponse() {
        return response.clone();
    }

    public int[] getTreatment() {
        return treatment.clone();
    }

    public int[] getIntermediate() {
        return intermediate.clone();
    }

    public double[][] getStratumCovariates() {
        return deepCopy(stratumCovariates);
    }

    public List<String> getStratumCovariateNames() {
        return stratumCovariateNames;
    }

    public double[][] getOutcomeCovariates() {
        return deepCopy(outcomeCovariates);
    }

    public List<String> getOutcomeCovariateNames() {
        return outcomeCovariateNames;
    }

    public boolean hasEventIndicator() {
        return eventIndicator != null;
    }

    public int[] getEventIndicator() {
        return eventIndicator == null ? null : eventIndicator.clone();
    }

    private static double[][] deepCopy(double[][] m) {
        double[][] copy = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            copy[i] = m[i].clone();
        }
        return copy;
    }

    public static class Builder {
        private double[] response;
        private int[] treatment;
        private int[] intermediate;
        private double[][] stratumCovariates;
        private List<String> stratumCovariateNames = Collections.emptyList();
        private double[][] outcomeCovariates;
        private List<String> outcomeCovariateNames = Collections.emptyList();
        private int[] eventIndicator;

        private Builder() {
        }

        public Builder response(double[] response) {
            this.response = response;
            return this;
        }

        public Builder treatment(int[] treatment) {
            this.treatment = treatment;
            return this;
        }

        public Builder intermediate(int[] intermediate) {
            this.intermediate = intermediate;
            return this;
        }

        public Builder stratumCovariates(double[][] covariates, List<String> names) {
            this.stratumCovariates = covariates;
            this.stratumCovariateNames = names == null ? Collections.emptyList() : names;
            return this;
        }

        public Builder outcomeCovariates(double[][] covariates, List<String> names) {
            this.outcomeCovariates = covariates;
            this.outcomeCovariateNames = names == null ? Collections.emptyList() : names;
            return this;
        }

        public Builder eventIndicator(int[] eventIndicator) {
            this.eventIndicator = eventIndicator;
            return this;
        }

        public StructuralDesign build() {
            if (response == null || treatment == null || intermediate == null) {
                throw new ConfigurationException("Response, treatment and intermediate outcome are required");
            }
            int n = response.length;
            if (n == 0) {
                throw new ConfigurationException("Design has no units");
            }
            if (treatment.length != n || intermediate.length != n) {
                throw new ConfigurationException("Response, treatment and intermediate outcome lengths differ: "
                        + n + ", " + treatment.length + ", " + intermediate.length);
            }
            if (eventIndicator != null && eventIndicator.length != n) {
                throw new ConfigurationException("Event indicator has " + eventIndicator.length + " entries, expected " + n);
            }
            response = response.clone();
            treatment = treatment.clone();
            intermediate = intermediate.clone();
            eventIndicator = eventIndicator == null ? null : eventIndicator.clone();
            stratumCovariates = checkMatrix("stratum", stratumCovariates, stratumCovariateNames, n);
            outcomeCovariates = checkMatrix("outcome", outcomeCovariates, outcomeCovariateNames, n);
            return new StructuralDesign(this);
        }

        private static double[][] checkMatrix(String what, double[][] m, List<String> names, int n) {
            if (m == null) {
                if (!names.isEmpty()) {
                    throw new ConfigurationException("Names given for missing " + what + " covariates");
                }
                return new double[n][0];
            }
            if (m.length != n) {
                throw new ConfigurationException("The " + what + " covariate matrix has " + m.length + " rows, expected " + n);
            }
            double[][] copy = new double[n][];
            for (int i = 0; i < n; i++) {
                if (m[i] == null || m[i].length != names.size()) {
                    throw new ConfigurationException("Row " + i + " of the " + what + " covariate matrix does not have "
                            + names.size() + " columns");
                }
                copy[i] = m[i].clone();
            }
            return copy;
        }
    }
}
