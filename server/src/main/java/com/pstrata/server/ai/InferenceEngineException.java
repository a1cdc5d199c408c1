package com.pstrata.server.ai;

public class InferenceEngineException extends PStrataException {

    // raw engine output, never rewritten
    private final String diagnostics;

    public InferenceEngineException(String message, String diagnostics) {
        super(message);
        this.diagnostics = diagnostics;
    }

    public InferenceEngineException(String message, String diagnostics, Throwable cause) {
        super(message, cause);
        this.diagnostics = diagnostics;
    }

    public String getDiagnostics() {
        return diagnostics;
    }
}
