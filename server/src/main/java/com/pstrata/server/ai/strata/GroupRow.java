package com.pstrata.server.ai.strata;

/**
 * One (stratum, treatment, intermediate value, group) tuple. Ids for stratum and treatment
 * are 0-based, group ids start at 1.
 */
public final class GroupRow {

    private final int stratumId;
    private final int treatmentId;
    private final int intermediateValue;
    private final int groupId;

    public GroupRow(int stratumId, int treatmentId, int intermediateValue, int groupId) {
        this.stratumId = stratumId;
        this.treatmentId = treatmentId;
        this.intermediateValue = intermediateValue;
        this.groupId = groupId;
    }

    public int getStratumId() {
        return stratumId;
    }

    public int getTreatmentId() {
        return treatmentId;
    }

    public int getIntermediateValue() {
        return intermediateValue;
    }

    public boolean isWildcard() {
        return intermediateValue == StrataInfo.WILDCARD;
    }

    public int getGroupId() {
        return groupId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroupRow)) {
            return false;
        }
        GroupRow other = (GroupRow) o;
        return stratumId == other.stratumId && treatmentId == other.treatmentId
                && intermediateValue == other.intermediateValue && groupId == other.groupId;
    }

    @Override
    public int hashCode() {
        int h = stratumId;
        h = 31 * h + treatmentId;
        h = 31 * h + intermediateValue;
        return 31 * h + groupId;
    }

    @Override
    public String toString() {
        return "GroupRow{S=" + stratumId + ", Z=" + treatmentId + ", D="
                + (isWildcard() ? "?" : String.valueOf(intermediateValue)) + ", G=" + groupId + '}';
    }
}
