package com.pstrata.server.ai.inference;

import java.util.Arrays;

/**
 * Draws of one (possibly array-valued) parameter. Values are stored per iteration with
 * the parameter's own indices flattened row-major, 0-based.
 */
public class ParameterDraws {

    private final String name;
    private final int[] dims;
    private final double[][] values;

    public ParameterDraws(String name, int[] dims, double[][] values) {
        this.name = name;
        this.dims = dims.clone();
        int width = 1;
        for (int d : dims) {
            if (d < 0) {
                throw new IllegalArgumentException("Negative dimension for " + name);
            }
            width *= d;
        }
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != width) {
                throw new IllegalArgumentException("Iteration " + i + " of " + name + " has " + values[i].length
                        + " values, expected " + width);
            }
            this.values[i] = values[i].clone();
        }
    }

    public String getName() {
        return name;
    }

    public int[] getDims() {
        return dims.clone();
    }

    public int getIterationCount() {
        return values.length;
    }

    public int getWidth() {
        return values.length == 0 ? Arrays.stream(dims).reduce(1, (a, b) -> a * b) : values[0].length;
    }

    public double get(int iteration, int... index) {
        return values[iteration][offset(index)];
    }

    /**
     * All iterations of one element, as a fresh array.
     */
    public double[] column(int... index) {
        int off = offset(index);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i][off];
        }
        return out;
    }

    /**
     * Copy of the iteration-major matrix.
     */
    public double[][] toMatrix() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    private int offset(int[] index) {
        if (index.length != dims.length) {
            throw new IllegalArgumentException(name + " has " + dims.length + " indices, got " + index.length);
        }
        int off = 0;
        for (int k = 0; k < dims.length; k++) {
            if (index[k] < 0 || index[k] >= dims[k]) {
                throw new IndexOutOfBoundsException("Index " + index[k] + " outside dimension " + dims[k] + " of " + name);
            }
            off = off * dims[k] + index[k];
        }
        return off;
    }
}
