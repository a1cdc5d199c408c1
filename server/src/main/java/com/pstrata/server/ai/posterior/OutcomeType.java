package com.pstrata.server.ai.posterior;

/**
 * Which generated quantity a survival fit is reshaped from. Non-survival fits always use
 * the per-group mean outcome.
 */
public enum OutcomeType {
    PROBABILITY,
    RACE;

    /**
     * Case-insensitive lookup; null or blank means {@link #PROBABILITY}.
     */
    public static OutcomeType fromName(String name) {
        if (name == null || name.isBlank()) {
            return PROBABILITY;
        }
        for (OutcomeType t : values()) {
            if (t.name().equalsIgnoreCase(name.trim())) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown outcome type: " + name);
    }
}
