package com.pstrata.server.ai.prior;

import com.pstrata.server.ai.UnsupportedCombinationException;
import com.pstrata.server.ai.family.FamilyLinkEntry;
import com.pstrata.server.ai.family.FamilyLinkRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ModelPriorsTest {

    private final FamilyLinkRegistry registry = FamilyLinkRegistry.getDefault();

    @Test
    public void testDefaults() {
        ModelPriors priors = ModelPriors.defaults();
        assertTrue(priors.getIntercept().isFlat());
        assertEquals(Priors.normal(), priors.getCoefficient());
        assertEquals(Priors.invGamma(), priors.getSigma());
        assertEquals(Priors.normal(), priors.getTheta());
    }

    @Test
    public void testAuxiliaryPriorFollowsFamily() {
        ModelPriors priors = ModelPriors.builder().sigma(Priors.exponential(2)).build();
        FamilyLinkEntry gaussian = registry.resolve("gaussian", "identity");
        assertEquals(Priors.exponential(2), priors.auxiliaryFor(gaussian));

        FamilyLinkEntry cox = registry.resolve("survival_Cox", "identity");
        assertEquals(Priors.normal(), priors.auxiliaryFor(cox));

        assertNull(priors.auxiliaryFor(registry.resolve("binomial", "logit")));
    }

    @Test
    public void testDomainMismatchIsUnsupported() {
        ModelPriors realSigma = ModelPriors.builder().sigma(Priors.normal()).build();
        FamilyLinkEntry gaussian = registry.resolve("gaussian", "identity");
        assertThrows(UnsupportedCombinationException.class, () -> realSigma.auxiliaryFor(gaussian));

        ModelPriors positiveTheta = ModelPriors.builder().theta(Priors.gamma()).build();
        FamilyLinkEntry cox = registry.resolve("survival_Cox", "identity");
        assertThrows(UnsupportedCombinationException.class, () -> positiveTheta.auxiliaryFor(cox));

        assertThrows(UnsupportedCombinationException.class,
                () -> ModelPriors.builder().coefficient(Priors.exponential()).build());
    }

    @Test
    public void testFlatPriorFitsAnyDomain() {
        ModelPriors priors = ModelPriors.builder().sigma(Priors.flat()).build();
        assertTrue(priors.auxiliaryFor(registry.resolve("gaussian", "log")).isFlat());
    }

    @Test
    public void testFromConfig() {
        assertEquals(Priors.normal(1, 2), Priors.fromConfig("normal", Map.of("mu", 1.0, "sigma", 2.0)));
        assertEquals(Priors.t(0, 1, 5), Priors.fromConfig("student_t", Map.of("df", 5.0)));
        assertEquals(Priors.invGamma(), Priors.fromConfig("inv_gamma", null));
        assertTrue(Priors.fromConfig("flat", null).isFlat());
        assertThrows(UnsupportedCombinationException.class, () -> Priors.fromConfig("beta", null));
    }
}
