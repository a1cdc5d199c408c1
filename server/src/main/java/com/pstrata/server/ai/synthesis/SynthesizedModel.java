package com.pstrata.server.ai.synthesis;

import com.pstrata.server.ai.family.FamilyLinkEntry;
import com.pstrata.server.ai.strata.GroupTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Program text plus data payload ready for an inference engine, together with the labels
 * needed to read the draws back.
 */
public class SynthesizedModel {

    private final String programText;
    private final Map<String, Object> data;
    private final GroupTable groupTable;
    private final FamilyLinkEntry family;
    private final List<String> strataNames;
    private final List<String> treatmentNames;
    private final double[] timePoints;

    public SynthesizedModel(String programText, Map<String, Object> data, GroupTable groupTable,
            FamilyLinkEntry family, List<String> strataNames, List<String> treatmentNames, double[] timePoints) {
        this.programText = programText;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.groupTable = groupTable;
        this.family = family;
        this.strataNames = List.copyOf(strataNames);
        this.treatmentNames = List.copyOf(treatmentNames);
        this.timePoints = timePoints == null ? null : timePoints.clone();
    }

    public String getProgramText() {
        return programText;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public GroupTable getGroupTable() {
        return groupTable;
    }

    public FamilyLinkEntry getFamily() {
        return family;
    }

    public List<String> getStrataNames() {
        return strataNames;
    }

    public List<String> getTreatmentNames() {
        return treatmentNames;
    }

    public boolean isSurvival() {
        return timePoints != null;
    }

    /**
     * Survival evaluation grid, or null for non-survival families.
     */
    public double[] getTimePoints() {
        return timePoints == null ? null : timePoints.clone();
    }
}
