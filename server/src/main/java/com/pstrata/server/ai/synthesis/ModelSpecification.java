package com.pstrata.server.ai.synthesis;

import com.pstrata.server.ai.family.FamilyLinkEntry;
import com.pstrata.server.ai.prior.ModelPriors;
import com.pstrata.server.ai.strata.GroupEnumerator;
import com.pstrata.server.ai.strata.GroupTable;
import com.pstrata.server.ai.strata.StrataInfo;
import com.pstrata.server.ai.strata.TreatmentCoding;

import java.util.List;

/**
 * Everything that defines a principal stratification model apart from the data: strata,
 * treatment levels, outcome family, priors and the survival time grid. The group table is
 * derived here and never set independently.
 */
public class ModelSpecification {

    private final StrataInfo strata;
    private final List<String> treatmentNames;
    private final GroupTable groupTable;
    private final FamilyLinkEntry family;
    private final ModelPriors priors;
    private final SurvivalTimePoints timePoints;

    private ModelSpecification(StrataInfo strata, List<String> treatmentNames, GroupTable groupTable,
            FamilyLinkEntry family, ModelPriors priors, SurvivalTimePoints timePoints) {
        this.strata = strata;
        this.treatmentNames = treatmentNames;
        this.groupTable = groupTable;
        this.family = family;
        this.priors = priors;
        this.timePoints = timePoints;
    }

    public static ModelSpecification create(StrataInfo strata, TreatmentCoding treatment, FamilyLinkEntry family,
            ModelPriors priors, SurvivalTimePoints timePoints) {
        GroupTable table = GroupEnumerator.enumerate(strata, treatment);
        return new ModelSpecification(strata, treatment.getLevelNames(), table, family,
                priors == null ? ModelPriors.defaults() : priors,
                timePoints == null ? SurvivalTimePoints.defaults() : timePoints);
    }

    public StrataInfo getStrata() {
        return strata;
    }

    public List<String> getStrataNames() {
        return strata.getStrataNames();
    }

    public List<String> getTreatmentNames() {
        return treatmentNames;
    }

    public GroupTable getGroupTable() {
        return groupTable;
    }

    public FamilyLinkEntry getFamily() {
        return family;
    }

    public ModelPriors getPriors() {
        return priors;
    }

    public SurvivalTimePoints getTimePoints() {
        return timePoints;
    }

    public boolean isSurvival() {
        return family.getFamily().isSurvival();
    }
}
