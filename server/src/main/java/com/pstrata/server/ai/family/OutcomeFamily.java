package com.pstrata.server.ai.family;

/**
 * Outcome distribution families. The kernel's location domain is what the link inverse
 * has to map onto.
 */
public enum OutcomeFamily {
    GAUSSIAN("gaussian", ValueDomain.REAL, false, false),
    BINOMIAL("binomial", ValueDomain.UNIT_INTERVAL, true, false),
    GAMMA("Gamma", ValueDomain.POSITIVE, false, false),
    POISSON("poisson", ValueDomain.NONNEGATIVE, true, false),
    INVERSE_GAUSSIAN("inverse.gaussian", ValueDomain.POSITIVE, false, false),
    SURVIVAL_COX("survival_Cox", ValueDomain.REAL, false, true),
    SURVIVAL_AFT("survival_AFT", ValueDomain.REAL, false, true);

    private final String familyName;
    private final ValueDomain locationDomain;
    private final boolean integerOutcome;
    private final boolean survival;

    OutcomeFamily(String familyName, ValueDomain locationDomain, boolean integerOutcome, boolean survival) {
        this.familyName = familyName;
        this.locationDomain = locationDomain;
        this.integerOutcome = integerOutcome;
        this.survival = survival;
    }

    public String getFamilyName() {
        return familyName;
    }

    public ValueDomain getLocationDomain() {
        return locationDomain;
    }

    public boolean isIntegerOutcome() {
        return integerOutcome;
    }

    public boolean isSurvival() {
        return survival;
    }

    /**
     * Looks up a family by its user-facing name, or null when there is none.
     */
    public static OutcomeFamily fromName(String name) {
        for (OutcomeFamily f : values()) {
            if (f.familyName.equals(name)) {
                return f;
            }
        }
        return null;
    }
}
