package com.pstrata.server.ai.posterior;

import com.pstrata.server.ai.DimensionMismatchException;
import com.pstrata.server.ai.inference.ParameterDraws;
import com.pstrata.server.ai.inference.PosteriorDraws;
import com.pstrata.server.ai.strata.GroupEnumerator;
import com.pstrata.server.ai.strata.GroupTable;
import com.pstrata.server.ai.strata.StrataInfo;
import com.pstrata.server.ai.synthesis.ModelProgramSynthesizer;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PosteriorReshaperTest {

    private static final List<String> STRATA = List.of("n", "c", "a");
    private static final List<String> ARMS = List.of("0", "1");

    private static GroupTable noncompliance() {
        Map<String, String> decl = new LinkedHashMap<>();
        decl.put("n", "00*");
        decl.put("c", "01");
        decl.put("a", "11*");
        return GroupEnumerator.enumerate(StrataInfo.parse(decl));
    }

    // draw i of group g is 10 * g + i
    private static ParameterDraws groupDraws(int groups, int iterations) {
        double[][] values = new double[iterations][groups];
        for (int i = 0; i < iterations; i++) {
            for (int g = 0; g < groups; g++) {
                values[i][g] = 10 * (g + 1) + i;
            }
        }
        return new ParameterDraws(ModelProgramSynthesizer.MEAN_EFFECT, new int[]{groups}, values);
    }

    @Test
    public void testCellsSharingAGroupAreIdentical() {
        GroupTable table = noncompliance();
        PosteriorOutcomeArray array = PosteriorReshaper.reshape(groupDraws(4, 5), table, STRATA, ARMS, null);

        assertFalse(array.isSurvival());
        assertArrayEquals(new int[]{3, 2, 5}, array.getShape());
        assertArrayEquals(array.cell("n", "0"), array.cell("n", "1"), 0.0);
        assertArrayEquals(array.cell("a", "0"), array.cell("a", "1"), 0.0);
        for (int i = 0; i < 5; i++) {
            assertEquals(10 + i, array.get(0, 0, i), 0.0);
            assertEquals(20 + i, array.get(1, 0, i), 0.0);
            assertEquals(30 + i, array.get(1, 1, i), 0.0);
            assertEquals(40 + i, array.get(2, 1, i), 0.0);
        }
    }

    @Test
    public void testSurvivalTimeAxis() {
        GroupTable table = noncompliance();
        int iters = 2;
        double[][] values = new double[iters][4 * 3];
        for (int i = 0; i < iters; i++) {
            for (int g = 0; g < 4; g++) {
                for (int t = 0; t < 3; t++) {
                    values[i][g * 3 + t] = 100 * (g + 1) + 10 * t + i;
                }
            }
        }
        Map<String, ParameterDraws> params = new LinkedHashMap<>();
        params.put(ModelProgramSynthesizer.MEAN_SURV_PROB,
                new ParameterDraws(ModelProgramSynthesizer.MEAN_SURV_PROB, new int[]{4, 3}, values));
        params.put(ModelProgramSynthesizer.MEAN_RACE,
                new ParameterDraws(ModelProgramSynthesizer.MEAN_RACE, new int[]{4, 3}, values));
        PosteriorDraws draws = new PosteriorDraws(params, "");

        double[] times = {1.0, 2.0, 5.0};
        PosteriorOutcomeArray array = PosteriorReshaper.reshape(draws, table, STRATA, ARMS, times,
                OutcomeType.PROBABILITY);
        assertTrue(array.isSurvival());
        assertEquals(3, array.getTimeCount());
        assertArrayEquals(new int[]{3, 2, 3, 2}, array.getShape());
        assertArrayEquals(times, array.getTimePoints(), 0.0);
        assertEquals(321, array.get(1, 1, 2, 1), 0.0);
        assertArrayEquals(array.cell("a", "0", 1), array.cell("a", "1", 1), 0.0);

        PosteriorOutcomeArray race = PosteriorReshaper.reshape(draws, table, STRATA, ARMS, times, OutcomeType.RACE);
        assertEquals(3, race.getTimeCount());
    }

    @Test
    public void testGroupAxisMismatch() {
        GroupTable table = noncompliance();
        assertThrows(DimensionMismatchException.class,
                () -> PosteriorReshaper.reshape(groupDraws(3, 2), table, STRATA, ARMS, null));
        assertThrows(DimensionMismatchException.class,
                () -> PosteriorReshaper.reshape(groupDraws(5, 2), table, STRATA, ARMS, null));
    }

    @Test
    public void testTimeAxisMismatch() {
        GroupTable table = noncompliance();
        ParameterDraws raw = new ParameterDraws("mean_surv_prob", new int[]{4, 2}, new double[1][8]);
        assertThrows(DimensionMismatchException.class,
                () -> PosteriorReshaper.reshape(raw, table, STRATA, ARMS, new double[]{1, 2, 3}));
        // group-only draws against a time grid
        assertThrows(DimensionMismatchException.class,
                () -> PosteriorReshaper.reshape(groupDraws(4, 1), table, STRATA, ARMS, new double[]{1}));
    }

    @Test
    public void testLabelCountMismatch() {
        assertThrows(DimensionMismatchException.class,
                () -> PosteriorReshaper.reshape(groupDraws(4, 1), noncompliance(), List.of("n", "c"), ARMS, null));
    }
}
