package com.pstrata.server.ai;

/**
 * Base type for every failure raised while compiling a principal stratification model
 * or interpreting its posterior. None of these are retried.
 */
public class PStrataException extends RuntimeException {

    public PStrataException(String message) {
        super(message);
    }

    public PStrataException(String message, Throwable cause) {
        super(message, cause);
    }
}
