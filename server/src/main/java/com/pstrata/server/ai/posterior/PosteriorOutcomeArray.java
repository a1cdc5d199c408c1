package com.pstrata.server.ai.posterior;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable Stratum x Treatment [x Time] x Iteration array of posterior outcome draws.
 * Values are stored row-major; non-survival arrays have no time axis.
 */
public class PosteriorOutcomeArray {

    private final List<String> strataNames;
    private final List<String> treatmentNames;
    private final double[] timePoints;
    private final int iterations;
    private final double[] values;

    /**
     * @param timePoints null for arrays without a time axis
     * @param values     row-major [S][Z][T][I], or [S][Z][I] when there is no time axis
     */
    public PosteriorOutcomeArray(List<String> strataNames, List<String> treatmentNames, double[] timePoints,
            int iterations, double[] values) {
        this.strataNames = List.copyOf(strataNames);
        this.treatmentNames = List.copyOf(treatmentNames);
        this.timePoints = timePoints == null ? null : timePoints.clone();
        this.iterations = iterations;
        int expected = this.strataNames.size() * this.treatmentNames.size()
                * (timePoints == null ? 1 : timePoints.length) * iterations;
        if (values.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " values, got " + values.length);
        }
        this.values = values.clone();
    }

    public List<String> getStrataNames() {
        return strataNames;
    }

    public List<String> getTreatmentNames() {
        return treatmentNames;
    }

    public int getStratumCount() {
        return strataNames.size();
    }

    public int getTreatmentCount() {
        return treatmentNames.size();
    }

    public int getTimeCount() {
        return timePoints == null ? 0 : timePoints.length;
    }

    public int getIterationCount() {
        return iterations;
    }

    public boolean isSurvival() {
        return timePoints != null;
    }

    public double[] getTimePoints() {
        return timePoints == null ? null : timePoints.clone();
    }

    /**
     * Axis sizes in order Stratum, Treatment, [Time,] Iteration.
     */
    public int[] getShape() {
        if (isSurvival()) {
            return new int[]{getStratumCount(), getTreatmentCount(), getTimeCount(), iterations};
        }
        return new int[]{getStratumCount(), getTreatmentCount(), iterations};
    }

    public double get(int s, int z, int iteration) {
        if (isSurvival()) {
            throw new IllegalArgumentException("Array has a time axis; pass a time index");
        }
        return values[offset(s, z, 0, iteration)];
    }

    public double get(int s, int z, int t, int iteration) {
        if (!isSurvival()) {
            throw new IllegalArgumentException("Array has no time axis");
        }
        return values[offset(s, z, t, iteration)];
    }

    public double[] cell(String stratum, String treatment) {
        if (isSurvival()) {
            throw new IllegalArgumentException("Array has a time axis; pass a time index");
        }
        return slice(indexOf(strataNames, stratum, "stratum"), indexOf(treatmentNames, treatment, "treatment"), 0);
    }

    public double[] cell(String stratum, String treatment, int timeIndex) {
        if (!isSurvival()) {
            throw new IllegalArgumentException("Array has no time axis");
        }
        checkIndex(timeIndex, getTimeCount(), "time");
        return slice(indexOf(strataNames, stratum, "stratum"), indexOf(treatmentNames, treatment, "treatment"),
                timeIndex);
    }

    /**
     * Iteration vector at integer coordinates; the time index is ignored without a time axis.
     */
    double[] slice(int s, int z, int t) {
        int from = offset(s, z, t, 0);
        return Arrays.copyOfRange(values, from, from + iterations);
    }

    /**
     * Sub-array keeping only the selected labels on each axis. Axes the selection leaves
     * unset are kept whole.
     */
    public PosteriorOutcomeArray select(Selection selection) {
        int[] sIdx = selection.strata == null ? range(getStratumCount())
                : resolve(selection.strata, strataNames, "stratum");
        int[] zIdx = selection.treatments == null ? range(getTreatmentCount())
                : resolve(selection.treatments, treatmentNames, "treatment");
        int[] tIdx;
        if (!isSurvival()) {
            if (selection.timeIndices != null) {
                throw new IllegalArgumentException("Array has no time axis");
            }
            tIdx = new int[]{0};
        } else {
            tIdx = selection.timeIndices == null ? range(getTimeCount()) : checked(selection.timeIndices,
                    getTimeCount(), "time");
        }
        int[] iIdx = selection.iterations == null ? range(iterations)
                : checked(selection.iterations, iterations, "iteration");

        double[] out = new double[sIdx.length * zIdx.length * tIdx.length * iIdx.length];
        int k = 0;
        for (int s : sIdx) {
            for (int z : zIdx) {
                for (int t : tIdx) {
                    for (int i : iIdx) {
                        out[k++] = values[offset(s, z, t, i)];
                    }
                }
            }
        }

        List<String> strata = new ArrayList<>();
        for (int s : sIdx) {
            strata.add(strataNames.get(s));
        }
        List<String> treatments = new ArrayList<>();
        for (int z : zIdx) {
            treatments.add(treatmentNames.get(z));
        }
        double[] times = null;
        if (isSurvival()) {
            times = new double[tIdx.length];
            for (int j = 0; j < tIdx.length; j++) {
                times[j] = timePoints[tIdx[j]];
            }
        }
        return new PosteriorOutcomeArray(strata, treatments, times, iIdx.length, out);
    }

    private int offset(int s, int z, int t, int i) {
        checkIndex(s, getStratumCount(), "stratum");
        checkIndex(z, getTreatmentCount(), "treatment");
        checkIndex(i, iterations, "iteration");
        int tc = isSurvival() ? getTimeCount() : 1;
        if (isSurvival()) {
            checkIndex(t, tc, "time");
        }
        return ((s * getTreatmentCount() + z) * tc + (isSurvival() ? t : 0)) * iterations + i;
    }

    private static void checkIndex(int idx, int size, String axis) {
        if (idx < 0 || idx >= size) {
            throw new IndexOutOfBoundsException(axis + " index " + idx + " outside 0.." + (size - 1));
        }
    }

    private static int indexOf(List<String> names, String label, String axis) {
        int idx = names.indexOf(label);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown " + axis + " label: " + label);
        }
        return idx;
    }

    private static int[] resolve(List<String> labels, List<String> names, String axis) {
        int[] out = new int[labels.size()];
        for (int j = 0; j < out.length; j++) {
            out[j] = indexOf(names, labels.get(j), axis);
        }
        return out;
    }

    private static int[] checked(List<Integer> indices, int size, String axis) {
        int[] out = new int[indices.size()];
        for (int j = 0; j < out.length; j++) {
            int idx = indices.get(j);
            if (idx < 0 || idx >= size) {
                throw new IllegalArgumentException("Unknown " + axis + " index: " + idx);
            }
            out[j] = idx;
        }
        return out;
    }

    private static int[] range(int n) {
        int[] r = new int[n];
        for (int i = 0; i < n; i++) {
            r[i] = i;
        }
        return r;
    }

    /**
     * Labels to keep per axis. Order is preserved and duplicates are allowed.
     */
    public static class Selection {
        private List<String> strata;
        private List<String> treatments;
        private List<Integer> timeIndices;
        private List<Integer> iterations;

        public Selection strata(String... names) {
            this.strata = List.of(names);
            return this;
        }

        public Selection treatments(String... names) {
            this.treatments = List.of(names);
            return this;
        }

        public Selection timeIndices(Integer... indices) {
            this.timeIndices = List.of(indices);
            return this;
        }

        public Selection iterations(Integer... indices) {
            this.iterations = List.of(indices);
            return this;
        }
    }
}
