package com.pstrata.server.ai.prior;

import com.pstrata.server.ai.family.ValueDomain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A prior distribution as an immutable value. Each distribution is its own variant with
 * typed, validated hyperparameters; {@link PriorSerializer} turns a variant into program
 * text. Instances may be shared between any number of model parameters.
 */
public interface PriorSpec {

    /**
     * Distribution name as the program language spells it.
     */
    String getName();

    /**
     * Support of the distribution, either {@link ValueDomain#REAL} or {@link ValueDomain#POSITIVE}.
     */
    ValueDomain getDomain();

    /**
     * Named hyperparameters in declaration order. Empty for the flat prior.
     */
    Map<String, Double> getHyperparameters();

    /**
     * Hyperparameter values in the positional order the distribution call expects.
     */
    List<Double> getCallArguments();

    default boolean isFlat() {
        return false;
    }

    abstract class Base implements PriorSpec {

        private final String name;
        private final ValueDomain domain;
        private final Map<String, Double> hyperparameters;

        protected Base(String name, ValueDomain domain, Map<String, Double> hyperparameters) {
            this.name = name;
            this.domain = domain;
            this.hyperparameters = Collections.unmodifiableMap(new LinkedHashMap<>(hyperparameters));
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public ValueDomain getDomain() {
            return domain;
        }

        @Override
        public Map<String, Double> getHyperparameters() {
            return hyperparameters;
        }

        @Override
        public List<Double> getCallArguments() {
            return List.copyOf(hyperparameters.values());
        }

        static double finite(String what, double v) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException(what + " must be finite, got " + v);
            }
            return v;
        }

        static double positive(String what, double v) {
            if (!(v > 0) || Double.isInfinite(v)) {
                throw new IllegalArgumentException(what + " must be positive, got " + v);
            }
            return v;
        }

        static Map<String, Double> args(String k1, double v1) {
            Map<String, Double> m = new LinkedHashMap<>();
            m.put(k1, v1);
            return m;
        }

        static Map<String, Double> args(String k1, double v1, String k2, double v2) {
            Map<String, Double> m = args(k1, v1);
            m.put(k2, v2);
            return m;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Base other = (Base) o;
            return name.equals(other.name) && domain == other.domain && hyperparameters.equals(other.hyperparameters);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + hyperparameters.hashCode();
        }

        @Override
        public String toString() {
            return name + hyperparameters;
        }
    }

    /**
     * No explicit prior: the parameter keeps the program's default (improper) prior.
     */
    final class Flat extends Base {
        Flat() {
            super("flat", ValueDomain.REAL, Collections.emptyMap());
        }

        @Override
        public boolean isFlat() {
            return true;
        }
    }

    /**
     * Shared shape of the real-line location/scale families.
     */
    abstract class LocationScale extends Base {
        private final double mu;
        private final double sigma;

        LocationScale(String name, double mu, double sigma) {
            super(name, ValueDomain.REAL, args("mu", finite("mu", mu), "sigma", positive("sigma", sigma)));
            this.mu = mu;
            this.sigma = sigma;
        }

        public double getMu() {
            return mu;
        }

        public double getSigma() {
            return sigma;
        }
    }

    final class Normal extends LocationScale {
        Normal(double mu, double sigma) {
            super("normal", mu, sigma);
        }
    }

    final class Cauchy extends LocationScale {
        Cauchy(double mu, double sigma) {
            super("cauchy", mu, sigma);
        }
    }

    /**
     * Laplace prior, written as {@code double_exponential}.
     */
    final class Lasso extends LocationScale {
        Lasso(double mu, double sigma) {
            super("double_exponential", mu, sigma);
        }
    }

    final class Logistic extends LocationScale {
        Logistic(double mu, double sigma) {
            super("logistic", mu, sigma);
        }
    }

    final class StudentT extends Base {
        private final double mu;
        private final double sigma;
        private final double df;

        StudentT(double mu, double sigma, double df) {
            super("student_t", ValueDomain.REAL, studentArgs(mu, sigma, df));
            this.mu = mu;
            this.sigma = sigma;
            this.df = df;
        }

        private static Map<String, Double> studentArgs(double mu, double sigma, double df) {
            Map<String, Double> m = args("mu", finite("mu", mu), "sigma", positive("sigma", sigma));
            m.put("df", positive("df", df));
            return m;
        }

        // student_t(df, mu, sigma)
        @Override
        public List<Double> getCallArguments() {
            return List.of(df, mu, sigma);
        }

        public double getMu() {
            return mu;
        }

        public double getSigma() {
            return sigma;
        }

        public double getDf() {
            return df;
        }
    }

    final class ChiSquare extends Base {
        ChiSquare(double df) {
            super("chi_square", ValueDomain.POSITIVE, args("df", positive("df", df)));
        }
    }

    final class InvChiSquare extends Base {
        InvChiSquare(double df) {
            super("inv_chi_square", ValueDomain.POSITIVE, args("df", positive("df", df)));
        }
    }

    final class Exponential extends Base {
        Exponential(double beta) {
            super("exponential", ValueDomain.POSITIVE, args("beta", positive("beta", beta)));
        }
    }

    /**
     * Shape/scale style families on the positive half-line.
     */
    abstract class ShapeScale extends Base {
        ShapeScale(String name, String shapeName, double shape, String scaleName, double scale) {
            super(name, ValueDomain.POSITIVE, args(shapeName, positive(shapeName, shape),
                    scaleName, positive(scaleName, scale)));
        }
    }

    final class Gamma extends ShapeScale {
        Gamma(double alpha, double beta) {
            super("gamma", "alpha", alpha, "beta", beta);
        }
    }

    final class InvGamma extends ShapeScale {
        InvGamma(double alpha, double beta) {
            super("inv_gamma", "alpha", alpha, "beta", beta);
        }
    }

    final class Weibull extends ShapeScale {
        Weibull(double alpha, double sigma) {
            super("weibull", "alpha", alpha, "sigma", sigma);
        }
    }
}
