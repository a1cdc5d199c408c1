package com.pstrata.server.ai;

/**
 * Posterior draws whose shape disagrees with the group table or time grid they are
 * reshaped against.
 */
public class DimensionMismatchException extends PStrataException {

    public DimensionMismatchException(String message) {
        super(message);
    }
}
