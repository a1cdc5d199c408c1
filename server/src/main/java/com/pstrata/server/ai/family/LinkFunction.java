package com.pstrata.server.ai.family;

/**
 * Link functions with the Stan function that inverts them and the range of that inverse.
 * An empty inverse name means the linear predictor is used as is.
 */
public enum LinkFunction {
    IDENTITY("identity", "", ValueDomain.REAL),
    LOG("log", "exp", ValueDomain.POSITIVE),
    INVERSE("inverse", "inv", ValueDomain.REAL),
    INVERSE_SQUARED("1/mu^2", "inv_sqrt", ValueDomain.POSITIVE),
    LOGIT("logit", "inv_logit", ValueDomain.UNIT_INTERVAL),
    PROBIT("probit", "Phi", ValueDomain.UNIT_INTERVAL),
    CAUCHIT("cauchit", "inv_cauchit", ValueDomain.UNIT_INTERVAL),
    CLOGLOG("cloglog", "inv_cloglog", ValueDomain.UNIT_INTERVAL),
    SQRT("sqrt", "square", ValueDomain.NONNEGATIVE);

    private final String linkName;
    private final String inverseName;
    private final ValueDomain inverseRange;

    LinkFunction(String linkName, String inverseName, ValueDomain inverseRange) {
        this.linkName = linkName;
        this.inverseName = inverseName;
        this.inverseRange = inverseRange;
    }

    public String getLinkName() {
        return linkName;
    }

    public String getInverseName() {
        return inverseName;
    }

    public ValueDomain getInverseRange() {
        return inverseRange;
    }

    /**
     * Wraps a linear predictor expression in the link inverse.
     */
    public String applyInverse(String linearPredictor) {
        if (inverseName.isEmpty()) {
            return linearPredictor;
        }
        return inverseName + "(" + linearPredictor + ")";
    }

    public static LinkFunction fromName(String name) {
        for (LinkFunction l : values()) {
            if (l.linkName.equals(name)) {
                return l;
            }
        }
        return null;
    }
}
