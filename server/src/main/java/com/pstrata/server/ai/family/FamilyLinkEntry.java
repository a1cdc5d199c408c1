package com.pstrata.server.ai.family;

import java.util.Objects;

/**
 * A resolved (family, link) combination: which likelihood kernel to call, how the linear
 * predictor reaches the kernel's location parameter, and the family's auxiliary parameter.
 */
public final class FamilyLinkEntry {

    private final OutcomeFamily family;
    private final LinkFunction link;
    private final String kernelName;
    private final String auxiliaryName;
    private final ValueDomain auxiliaryDomain;

    public FamilyLinkEntry(OutcomeFamily family, LinkFunction link, String kernelName,
            String auxiliaryName, ValueDomain auxiliaryDomain) {
        this.family = Objects.requireNonNull(family, "family");
        this.link = Objects.requireNonNull(link, "link");
        this.kernelName = Objects.requireNonNull(kernelName, "kernelName");
        if ((auxiliaryName == null) != (auxiliaryDomain == null)) {
            throw new IllegalArgumentException("Auxiliary parameter name and domain must be given together");
        }
        this.auxiliaryName = auxiliaryName;
        this.auxiliaryDomain = auxiliaryDomain;
    }

    public OutcomeFamily getFamily() {
        return family;
    }

    public LinkFunction getLink() {
        return link;
    }

    public String getKernelName() {
        return kernelName;
    }

    public String getLinkInverseName() {
        return link.getInverseName();
    }

    public boolean hasAuxiliary() {
        return auxiliaryName != null;
    }

    public String getAuxiliaryName() {
        return auxiliaryName;
    }

    public ValueDomain getAuxiliaryDomain() {
        return auxiliaryDomain;
    }

    /**
     * Arguments the kernel takes after the outcome: location, the auxiliary parameter if
     * any, and the censoring indicator for survival families.
     */
    public int getArity() {
        int arity = 1;
        if (hasAuxiliary()) {
            arity++;
        }
        if (family.isSurvival()) {
            arity++;
        }
        return arity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FamilyLinkEntry)) {
            return false;
        }
        FamilyLinkEntry other = (FamilyLinkEntry) o;
        return family == other.family && link == other.link && kernelName.equals(other.kernelName)
                && Objects.equals(auxiliaryName, other.auxiliaryName) && auxiliaryDomain == other.auxiliaryDomain;
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, link, kernelName, auxiliaryName, auxiliaryDomain);
    }

    @Override
    public String toString() {
        return "FamilyLinkEntry{" + family.getFamilyName() + "/" + link.getLinkName()
                + ", kernel=" + kernelName
                + (hasAuxiliary() ? ", aux=" + auxiliaryName + "<" + auxiliaryDomain.getLabel() + ">" : "")
                + '}';
    }
}
