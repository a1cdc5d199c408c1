package com.pstrata.util;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;

/**
 * Blob layout for an iteration-major draw matrix: a big-endian int iteration count, then
 * every row's doubles in order. All rows share one width.
 */
public class DrawMatrixCodec {

    public static byte[] toBytes(double[][] draws) {
        if (draws == null) {
            return null;
        }
        int width = draws.length == 0 ? 0 : draws[0].length;
        ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES + draws.length * width * Double.BYTES);
        buffer.putInt(draws.length);
        DoubleBuffer doubles = buffer.asDoubleBuffer();
        for (double[] row : draws) {
            if (row.length != width) {
                throw new IllegalArgumentException("Ragged draw matrix: row width " + row.length + " vs " + width);
            }
            doubles.put(row);
        }
        return buffer.array();
    }

    public static double[][] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        int iterations = buffer.getInt();
        DoubleBuffer doubles = buffer.asDoubleBuffer();
        int total = doubles.remaining();
        if (iterations < 0 || (iterations == 0 ? total != 0 : total % iterations != 0)) {
            throw new IllegalArgumentException("Blob holds " + total + " values, not divisible into "
                    + iterations + " iterations");
        }
        int width = iterations == 0 ? 0 : total / iterations;
        double[][] draws = new double[iterations][width];
        for (int i = 0; i < iterations; i++) {
            doubles.get(draws[i]);
        }
        return draws;
    }
}
