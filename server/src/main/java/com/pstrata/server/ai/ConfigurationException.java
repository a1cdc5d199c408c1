package com.pstrata.server.ai;

/**
 * Inconsistent strata, treatment or data declarations.
 */
public class ConfigurationException extends PStrataException {

    public ConfigurationException(String message) {
        super(message);
    }
}
