package com.pstrata.server.ai.family;

import com.pstrata.server.ai.UnsupportedCombinationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FamilyLinkRegistryTest {

    private final FamilyLinkRegistry registry = FamilyLinkRegistry.getDefault();

    @Test
    public void testBinomialProbitResolvesToBernoulliWithPhi() {
        FamilyLinkEntry entry = registry.resolve("binomial", "probit");
        assertEquals(OutcomeFamily.BINOMIAL, entry.getFamily());
        assertEquals(LinkFunction.PROBIT, entry.getLink());
        assertEquals("bernoulli", entry.getKernelName());
        assertEquals("Phi", entry.getLinkInverseName());
        assertFalse(entry.hasAuxiliary());
        assertEquals(1, entry.getArity());
    }

    @Test
    public void testPoissonLogitIsUnsupported() {
        assertThrows(UnsupportedCombinationException.class, () -> registry.resolve("poisson", "logit"));
        assertThrows(UnsupportedCombinationException.class, () -> registry.resolve("weibull", "log"));
        assertThrows(UnsupportedCombinationException.class, () -> registry.resolve("gaussian", "nonsense"));
    }

    @Test
    public void testEveryAdvertisedPairResolvesConsistently() {
        assertEquals(OutcomeFamily.values().length, registry.supportedFamilies().size());
        int count = 0;
        for (String family : registry.supportedFamilies()) {
            Set<String> links = registry.supportedLinks(family);
            assertFalse(links.isEmpty(), family + " has no links");
            for (String link : links) {
                FamilyLinkEntry entry = registry.resolve(family, link);
                assertTrue(entry.getLink().getInverseRange().isWithin(entry.getFamily().getLocationDomain()),
                        family + "/" + link + " link inverse leaves the location domain");
                count++;
            }
        }
        assertEquals(registry.size(), count);
    }

    @Test
    public void testAuxiliaryParameters() {
        FamilyLinkEntry gaussian = registry.resolve("gaussian", "identity");
        assertEquals("sigma", gaussian.getAuxiliaryName());
        assertEquals(ValueDomain.POSITIVE, gaussian.getAuxiliaryDomain());

        FamilyLinkEntry gamma = registry.resolve("Gamma", "log");
        assertEquals("alpha", gamma.getAuxiliaryName());

        FamilyLinkEntry ig = registry.resolve("inverse.gaussian", "1/mu^2");
        assertEquals("lambda", ig.getAuxiliaryName());
        assertEquals("inv_sqrt", ig.getLinkInverseName());
    }

    @Test
    public void testSurvivalFamiliesTakeCensoringIndicator() {
        FamilyLinkEntry cox = registry.resolve("survival_Cox", "identity");
        assertTrue(cox.getFamily().isSurvival());
        assertEquals("theta", cox.getAuxiliaryName());
        assertEquals(ValueDomain.REAL, cox.getAuxiliaryDomain());
        assertEquals(3, cox.getArity());

        FamilyLinkEntry aft = registry.resolve("survival_AFT", "identity");
        assertEquals("lognormal_aft", aft.getKernelName());
        assertEquals("sigma", aft.getAuxiliaryName());
    }

    @Test
    public void testSupportedLinksOfUnknownFamilyIsEmpty() {
        assertTrue(registry.supportedLinks("negbin").isEmpty());
        assertEquals(Set.of("log", "sqrt"), registry.supportedLinks("poisson"));
    }

    @Test
    public void testInconsistentRowIsRejectedAtLoad() {
        FamilyLinkRegistry.TableRow row = new FamilyLinkRegistry.TableRow();
        row.family = "poisson";
        row.link = "identity";
        row.kernel = "poisson";
        row.linkInverse = "";
        List<FamilyLinkRegistry.TableRow> rows = new ArrayList<>();
        rows.add(row);
        assertThrows(IllegalStateException.class, () -> FamilyLinkRegistry.fromRows(rows));
    }

    @Test
    public void testDuplicateRowIsRejectedAtLoad() {
        List<FamilyLinkRegistry.TableRow> rows = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            FamilyLinkRegistry.TableRow row = new FamilyLinkRegistry.TableRow();
            row.family = "binomial";
            row.link = "logit";
            row.kernel = "bernoulli";
            row.linkInverse = "inv_logit";
            rows.add(row);
        }
        assertThrows(IllegalStateException.class, () -> FamilyLinkRegistry.fromRows(rows));
        assertEquals(1, FamilyLinkRegistry.fromRows(rows.subList(0, 1)).size());
    }

    @Test
    public void testWrongLinkInverseIsRejectedAtLoad() {
        FamilyLinkRegistry.TableRow row = new FamilyLinkRegistry.TableRow();
        row.family = "binomial";
        row.link = "logit";
        row.kernel = "bernoulli";
        row.linkInverse = "Phi";
        assertThrows(IllegalStateException.class, () -> FamilyLinkRegistry.fromRows(List.of(row)));
    }
}
