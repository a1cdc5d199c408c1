package com.pstrata.server.ai.inference;

import com.pstrata.server.ai.InferenceEngineException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Draws returned by an inference engine, keyed by parameter name.
 */
public class PosteriorDraws {

    private final Map<String, ParameterDraws> parameters;
    private final String diagnostics;

    public PosteriorDraws(Map<String, ParameterDraws> parameters, String diagnostics) {
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.diagnostics = diagnostics == null ? "" : diagnostics;
    }

    public Set<String> getParameterNames() {
        return parameters.keySet();
    }

    public boolean has(String name) {
        return parameters.containsKey(name);
    }

    /**
     * Draws for {@code name}; a missing parameter means the engine returned an incomplete
     * result.
     */
    public ParameterDraws get(String name) {
        ParameterDraws p = parameters.get(name);
        if (p == null) {
            throw new InferenceEngineException("Posterior draws do not contain parameter '" + name + "'", diagnostics);
        }
        return p;
    }

    public String getDiagnostics() {
        return diagnostics;
    }
}
