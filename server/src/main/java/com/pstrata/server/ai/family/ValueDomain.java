package com.pstrata.server.ai.family;

/**
 * Support of a parameter or of a link inverse's range.
 */
public enum ValueDomain {
    REAL("real"),
    NONNEGATIVE("nonnegative"),
    POSITIVE("positive"),
    UNIT_INTERVAL("unit");

    private final String label;

    ValueDomain(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * True when every value of this domain also lies in {@code outer}.
     */
    public boolean isWithin(ValueDomain outer) {
        switch (outer) {
            case REAL:
                return true;
            case NONNEGATIVE:
                return this != REAL;
            case POSITIVE:
                return this == POSITIVE || this == UNIT_INTERVAL;
            case UNIT_INTERVAL:
                return this == UNIT_INTERVAL;
            default:
                return false;
        }
    }

    public static ValueDomain fromLabel(String label) {
        for (ValueDomain d : values()) {
            if (d.label.equalsIgnoreCase(label)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown domain: " + label);
    }
}
