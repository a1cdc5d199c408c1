package com.pstrata.server.ai.prior;

import com.pstrata.server.ai.UnsupportedCombinationException;

import java.util.Collections;
import java.util.Map;

/**
 * Constructors for every supported prior. Defaults match the no-argument overloads.
 */
public final class Priors {

    private static final PriorSpec FLAT = new PriorSpec.Flat();

    private Priors() {
    }

    public static PriorSpec flat() {
        return FLAT;
    }

    public static PriorSpec normal() {
        return normal(0, 1);
    }

    public static PriorSpec normal(double mu, double sigma) {
        return new PriorSpec.Normal(mu, sigma);
    }

    public static PriorSpec t() {
        return t(0, 1, 1);
    }

    public static PriorSpec t(double mu, double sigma, double df) {
        return new PriorSpec.StudentT(mu, sigma, df);
    }

    public static PriorSpec cauchy() {
        return cauchy(0, 1);
    }

    public static PriorSpec cauchy(double mu, double sigma) {
        return new PriorSpec.Cauchy(mu, sigma);
    }

    public static PriorSpec lasso() {
        return lasso(0, 1);
    }

    public static PriorSpec lasso(double mu, double sigma) {
        return new PriorSpec.Lasso(mu, sigma);
    }

    public static PriorSpec logistic() {
        return logistic(0, 1);
    }

    public static PriorSpec logistic(double mu, double sigma) {
        return new PriorSpec.Logistic(mu, sigma);
    }

    public static PriorSpec chisq() {
        return chisq(1);
    }

    public static PriorSpec chisq(double df) {
        return new PriorSpec.ChiSquare(df);
    }

    public static PriorSpec invChisq() {
        return invChisq(1);
    }

    public static PriorSpec invChisq(double df) {
        return new PriorSpec.InvChiSquare(df);
    }

    public static PriorSpec exponential() {
        return exponential(1);
    }

    public static PriorSpec exponential(double beta) {
        return new PriorSpec.Exponential(beta);
    }

    public static PriorSpec gamma() {
        return gamma(1, 1);
    }

    public static PriorSpec gamma(double alpha, double beta) {
        return new PriorSpec.Gamma(alpha, beta);
    }

    public static PriorSpec invGamma() {
        return invGamma(1, 1);
    }

    public static PriorSpec invGamma(double alpha, double beta) {
        return new PriorSpec.InvGamma(alpha, beta);
    }

    public static PriorSpec weibull() {
        return weibull(1, 1);
    }

    public static PriorSpec weibull(double alpha, double sigma) {
        return new PriorSpec.Weibull(alpha, sigma);
    }

    /**
     * Builds a prior from a distribution name and a (possibly partial) argument map, as it
     * arrives in a JSON request. Missing arguments take their defaults.
     */
    public static PriorSpec fromConfig(String name, Map<String, Double> args) {
        Map<String, Double> a = args == null ? Collections.emptyMap() : args;
        if (name == null) {
            throw new UnsupportedCombinationException("Prior name must be given");
        }
        switch (name) {
            case "flat":
                return flat();
            case "normal":
                return normal(arg(a, "mu", 0), arg(a, "sigma", 1));
            case "t":
            case "student_t":
                return t(arg(a, "mu", 0), arg(a, "sigma", 1), arg(a, "df", 1));
            case "cauchy":
                return cauchy(arg(a, "mu", 0), arg(a, "sigma", 1));
            case "lasso":
            case "double_exponential":
                return lasso(arg(a, "mu", 0), arg(a, "sigma", 1));
            case "logistic":
                return logistic(arg(a, "mu", 0), arg(a, "sigma", 1));
            case "chisq":
            case "chi_square":
                return chisq(arg(a, "df", 1));
            case "inv_chisq":
            case "inv_chi_square":
                return invChisq(arg(a, "df", 1));
            case "exponential":
                return exponential(arg(a, "beta", 1));
            case "gamma":
                return gamma(arg(a, "alpha", 1), arg(a, "beta", 1));
            case "inv_gamma":
                return invGamma(arg(a, "alpha", 1), arg(a, "beta", 1));
            case "weibull":
                return weibull(arg(a, "alpha", 1), arg(a, "sigma", 1));
            default:
                throw new UnsupportedCombinationException("Unknown prior distribution: " + name);
        }
    }

    private static double arg(Map<String, Double> args, String key, double fallback) {
        Double v = args.get(key);
        return v != null ? v : fallback;
    }
}
