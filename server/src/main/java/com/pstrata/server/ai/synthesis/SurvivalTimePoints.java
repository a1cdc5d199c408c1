package com.pstrata.server.ai.synthesis;

import com.pstrata.server.ai.ConfigurationException;
import com.pstrata.server.ai.inference.MathUtil;

/**
 * Time points at which survival outputs are evaluated: either a count of equally spaced
 * points from 0 to the 90th percentile of the observed times, or an explicit list.
 */
public final class SurvivalTimePoints {

    public static final int DEFAULT_COUNT = 50;
    public static final double UPPER_QUANTILE = 0.9;

    private final int count;
    private final double[] explicit;

    private SurvivalTimePoints(int count, double[] explicit) {
        this.count = count;
        this.explicit = explicit;
    }

    public static SurvivalTimePoints defaults() {
        return count(DEFAULT_COUNT);
    }

    public static SurvivalTimePoints count(int count) {
        if (count < 1) {
            throw new ConfigurationException("Number of survival time points must be positive, got " + count);
        }
        return new SurvivalTimePoints(count, null);
    }

    public static SurvivalTimePoints explicit(double... timePoints) {
        if (timePoints == null || timePoints.length == 0) {
            throw new ConfigurationException("Explicit survival time points must not be empty");
        }
        double previous = 0.0;
        for (double t : timePoints) {
            if (!Double.isFinite(t) || t < 0) {
                throw new ConfigurationException("Survival time points must be finite and non-negative, got " + t);
            }
            if (t < previous) {
                throw new ConfigurationException("Survival time points must be non-decreasing");
            }
            previous = t;
        }
        return new SurvivalTimePoints(timePoints.length, timePoints.clone());
    }

    public boolean isExplicit() {
        return explicit != null;
    }

    public int getCount() {
        return count;
    }

    public double[] resolve(double[] observedTimes) {
        if (explicit != null) {
            return explicit.clone();
        }
        if (observedTimes == null || observedTimes.length == 0) {
            throw new ConfigurationException("Cannot choose survival time points without observed times");
        }
        double upper = MathUtil.quantile(observedTimes, UPPER_QUANTILE);
        return MathUtil.linspace(0.0, upper, count);
    }
}
