package com.pstrata.server.ai;

/**
 * Internal mismatch between the group table and the emitted program. Always a defect.
 */
public class SynthesisException extends PStrataException {

    public SynthesisException(String message) {
        super(message);
    }
}
