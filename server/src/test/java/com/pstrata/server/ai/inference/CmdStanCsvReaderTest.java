package com.pstrata.server.ai.inference;

import com.pstrata.server.ai.InferenceEngineException;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CmdStanCsvReaderTest {

    private static final String CHAIN_1 = String.join("\n",
            "# model = pstrata_model",
            "# method = sample (Default)",
            "lp__,accept_stat__,mean_effect.1,mean_effect.2,m.1.1,m.2.1,m.1.2,m.2.2",
            "-10.5,0.9,1.0,2.0,11,21,12,22",
            "# Adaptation terminated",
            "-11.0,0.8,1.5,2.5,111,121,112,122",
            "");

    private static final String CHAIN_2 = String.join("\n",
            "lp__,accept_stat__,mean_effect.1,mean_effect.2,m.1.1,m.2.1,m.1.2,m.2.2",
            "-9.0,0.7,3.0,4.0,211,221,212,222");

    @Test
    public void testColumnsAreRegroupedPerParameter() {
        PosteriorDraws draws = new CmdStanCsvReader().read(List.of(new StringReader(CHAIN_1)), "log");

        assertFalse(draws.has("lp__"));
        assertFalse(draws.has("accept_stat__"));
        assertEquals("log", draws.getDiagnostics());

        ParameterDraws effect = draws.get("mean_effect");
        assertArrayEquals(new int[]{2}, effect.getDims());
        assertEquals(2, effect.getIterationCount());
        assertArrayEquals(new double[]{1.0, 1.5}, effect.column(0), 0.0);
        assertArrayEquals(new double[]{2.0, 2.5}, effect.column(1), 0.0);

        ParameterDraws m = draws.get("m");
        assertArrayEquals(new int[]{2, 2}, m.getDims());
        assertEquals(21, m.get(0, 1, 0), 0.0);
        assertEquals(12, m.get(0, 0, 1), 0.0);
        assertEquals(122, m.get(1, 1, 1), 0.0);
    }

    @Test
    public void testChainsAreConcatenated() {
        PosteriorDraws draws = new CmdStanCsvReader().read(
                List.of(new StringReader(CHAIN_1), new StringReader(CHAIN_2)), "");
        assertEquals(3, draws.get("mean_effect").getIterationCount());
        assertEquals(3.0, draws.get("mean_effect").get(2, 0), 0.0);
    }

    @Test
    public void testMalformedOutput() {
        CmdStanCsvReader reader = new CmdStanCsvReader();
        assertThrows(InferenceEngineException.class,
                () -> reader.read(List.of(new StringReader("# only comments\n")), "x"));
        assertThrows(InferenceEngineException.class,
                () -> reader.read(List.of(new StringReader("a,b\n1,2,3\n")), "x"));
        assertThrows(InferenceEngineException.class,
                () -> reader.read(List.of(new StringReader("a,b\n1,oops\n")), "x"));
        assertThrows(InferenceEngineException.class,
                () -> reader.read(List.of(new StringReader(CHAIN_1), new StringReader("a\n1\n")), "x"));
        // m.2.2 missing
        assertThrows(InferenceEngineException.class,
                () -> reader.read(List.of(new StringReader("m.1.1,m.2.1,m.1.2\n1,2,3\n")), "x"));
    }

    @Test
    public void testMissingParameterCarriesDiagnostics() {
        PosteriorDraws draws = new CmdStanCsvReader().read(List.of(new StringReader(CHAIN_2)), "engine said no");
        InferenceEngineException e = assertThrows(InferenceEngineException.class, () -> draws.get("mean_RACE"));
        assertEquals("engine said no", e.getDiagnostics());
    }
}
