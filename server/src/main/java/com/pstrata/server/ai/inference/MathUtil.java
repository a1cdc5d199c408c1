package com.pstrata.server.ai.inference;

import java.util.Arrays;

public class MathUtil {

    public static double mean(double[] x) {
        if (x.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double v : x) {
            sum += v;
        }
        return sum / x.length;
    }

    /**
     * Sample standard deviation (n - 1 denominator). NaN for fewer than two values.
     */
    public static double sd(double[] x) {
        if (x.length < 2) {
            return Double.NaN;
        }
        double m = mean(x);
        double ss = 0.0;
        for (double v : x) {
            ss += (v - m) * (v - m);
        }
        return Math.sqrt(ss / (x.length - 1));
    }

    /**
     * Type-7 quantile: linear interpolation between order statistics at h = (n - 1) * p.
     */
    public static double quantile(double[] x, double p) {
        if (p < 0 || p > 1) {
            throw new IllegalArgumentException("Probability must lie in [0, 1]");
        }
        if (x.length == 0) {
            return Double.NaN;
        }
        double[] sorted = x.clone();
        Arrays.sort(sorted);
        return quantileSorted(sorted, p);
    }

    /**
     * Same as {@link #quantile(double[], double)} for input that is already sorted.
     */
    public static double quantileSorted(double[] sorted, double p) {
        if (sorted.length == 0) {
            return Double.NaN;
        }
        double h = (sorted.length - 1) * p;
        int lo = (int) Math.floor(h);
        int hi = Math.min(lo + 1, sorted.length - 1);
        return sorted[lo] + (h - lo) * (sorted[hi] - sorted[lo]);
    }

    /**
     * {@code n} equally spaced values from {@code from} to {@code to}, both included.
     */
    public static double[] linspace(double from, double to, int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be positive");
        }
        double[] out = new double[n];
        if (n == 1) {
            out[0] = from;
            return out;
        }
        double step = (to - from) / (n - 1);
        for (int i = 0; i < n; i++) {
            out[i] = from + i * step;
        }
        out[n - 1] = to;
        return out;
    }
}
