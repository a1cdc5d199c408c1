package com.pstrata.server.ai.strata;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Canonical (stratum, treatment, intermediate, group) table. Rows are in stratum-major,
 * treatment-minor order and every (stratum, treatment) cell appears exactly once.
 * Instances are only produced by {@link GroupEnumerator}.
 */
public class GroupTable {

    private final List<GroupRow> rows;
    private final int stratumCount;
    private final int treatmentCount;
    private final int groupCount;
    // [stratum][treatment] -> row index
    private final int[][] cellIndex;
    // group id - 1 -> owning stratum
    private final int[] groupStratum;

    GroupTable(GroupRow[] rows, int stratumCount, int treatmentCount, int groupCount) {
        this.rows = Collections.unmodifiableList(Arrays.asList(rows.clone()));
        this.stratumCount = stratumCount;
        this.treatmentCount = treatmentCount;
        this.groupCount = groupCount;
        this.cellIndex = new int[stratumCount][treatmentCount];
        this.groupStratum = new int[groupCount];
        for (int i = 0; i < rows.length; i++) {
            GroupRow r = rows[i];
            cellIndex[r.getStratumId()][r.getTreatmentId()] = i;
            groupStratum[r.getGroupId() - 1] = r.getStratumId();
        }
    }

    public List<GroupRow> getRows() {
        return rows;
    }

    public int getStratumCount() {
        return stratumCount;
    }

    public int getTreatmentCount() {
        return treatmentCount;
    }

    /**
     * Number of distinct group ids, i.e. outcome-model parameter blocks.
     */
    public int getGroupCount() {
        return groupCount;
    }

    public GroupRow row(int stratumId, int treatmentId) {
        return rows.get(cellIndex[stratumId][treatmentId]);
    }

    public int groupOf(int stratumId, int treatmentId) {
        return row(stratumId, treatmentId).getGroupId();
    }

    /**
     * Stratum a group belongs to. Groups never span strata.
     */
    public int stratumOfGroup(int groupId) {
        if (groupId < 1 || groupId > groupCount) {
            throw new IllegalArgumentException("Group id " + groupId + " outside 1.." + groupCount);
        }
        return groupStratum[groupId - 1];
    }

    /**
     * Rows a unit observed with treatment {@code treatmentId} and intermediate value
     * {@code intermediateValue} may belong to. Wildcard cells never match.
     */
    public List<GroupRow> consistentWith(int treatmentId, int intermediateValue) {
        List<GroupRow> matches = new ArrayList<>();
        for (int s = 0; s < stratumCount; s++) {
            GroupRow r = row(s, treatmentId);
            if (!r.isWildcard() && r.getIntermediateValue() == intermediateValue) {
                matches.add(r);
            }
        }
        return matches;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroupTable)) {
            return false;
        }
        GroupTable other = (GroupTable) o;
        return treatmentCount == other.treatmentCount && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return 31 * rows.hashCode() + treatmentCount;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("GroupTable{groups=").append(groupCount);
        for (GroupRow r : rows) {
            sb.append("\n  ").append(r);
        }
        return sb.append('}').toString();
    }
}
