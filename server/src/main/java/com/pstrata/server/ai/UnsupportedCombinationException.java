package com.pstrata.server.ai;

/**
 * Raised for an unregistered family/link pair, or a prior whose domain does not fit the
 * parameter it is applied to.
 */
public class UnsupportedCombinationException extends PStrataException {

    public UnsupportedCombinationException(String message) {
        super(message);
    }
}
