package com.pstrata.server.ai.strata;

import com.pstrata.server.ai.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds the {@link GroupTable} for a set of declared strata.
 *
 * <p>Strata are visited in declared order and, within a stratum, treatment levels in
 * ascending order. A cell reuses the group of an earlier cell only when its stratum is
 * exclusion-restricted and that earlier cell belongs to the same stratum and carries the
 * same concrete intermediate value; the first such cell wins. Every other cell, including
 * every wildcard cell, opens a fresh group. Group ids are handed out from 1 without gaps.
 */
public final class GroupEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(GroupEnumerator.class);

    private GroupEnumerator() {
    }

    public static GroupTable enumerate(StrataInfo strata) {
        int stratumCount = strata.getStratumCount();
        int treatmentCount = strata.getTreatmentCount();
        GroupRow[] rows = new GroupRow[stratumCount * treatmentCount];
        int nextGroup = 0;
        int i = 0;

        for (int s = 0; s < stratumCount; s++) {
            // intermediate value -> first group seen for it within this stratum
            Map<Integer, Integer> firstGroupByValue = new HashMap<>();
            boolean er = strata.isExclusionRestricted(s);
            for (int z = 0; z < treatmentCount; z++) {
                int d = strata.getIntermediateValue(s, z);
                Integer reuse = null;
                if (er && d != StrataInfo.WILDCARD) {
                    reuse = firstGroupByValue.get(d);
                }
                int g;
                if (reuse != null) {
                    g = reuse;
                } else {
                    g = ++nextGroup;
                    if (d != StrataInfo.WILDCARD) {
                        firstGroupByValue.putIfAbsent(d, g);
                    }
                }
                rows[i++] = new GroupRow(s, z, d, g);
            }
        }

        logger.debug("Enumerated {} groups for {} strata x {} treatments", nextGroup, stratumCount, treatmentCount);
        return new GroupTable(rows, stratumCount, treatmentCount, nextGroup);
    }

    /**
     * Enumerates after checking that the observed treatment variable has as many levels as
     * the strata declare.
     */
    public static GroupTable enumerate(StrataInfo strata, TreatmentCoding treatment) {
        if (treatment.getLevelCount() != strata.getTreatmentCount()) {
            throw new ConfigurationException("Strata declare " + strata.getTreatmentCount()
                    + " treatment levels but the treatment variable has " + treatment.getLevelCount());
        }
        return enumerate(strata);
    }
}
