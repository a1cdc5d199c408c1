package com.pstrata.server.ai.inference;

import com.pstrata.server.ai.InferenceEngineException;
import com.pstrata.server.ai.PStrataConfig;
import com.pstrata.server.ai.synthesis.SynthesizedModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the adapter against shell scripts standing in for CmdStan's make and for the
 * compiled sampler.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
public class CmdStanInferenceEngineTest {

    // writes a CSV whose first column is the chain id to the path after "output file="
    private static final String SAMPLER = String.join("\n",
            "#!/bin/sh",
            "section=''",
            "out=''",
            "id=0",
            "for a in \"$@\"; do",
            "  case \"$a\" in",
            "    output) section=output ;;",
            "    data|random) section=$a ;;",
            "    file=*) if [ \"$section\" = output ]; then out=\"${a#file=}\"; fi ;;",
            "    id=*) id=\"${a#id=}\" ;;",
            "  esac",
            "done",
            "echo \"sampling chain $id\"",
            "echo '# stub sampler' > \"$out\"",
            "echo 'lp__,accept_stat__,mean_effect.1,mean_effect.2' >> \"$out\"",
            "echo \"-1.0,0.9,$id,0.5\" >> \"$out\"",
            "echo \"-2.0,0.8,$id,0.25\" >> \"$out\"",
            "");

    @TempDir
    Path tmp;

    private Path cmdstanHome;
    private Path sampler;

    @BeforeEach
    public void setUp() throws IOException {
        cmdstanHome = Files.createDirectories(tmp.resolve("cmdstan"));
        sampler = script("sampler.sh", SAMPLER);
    }

    private Path script(String name, String text) throws IOException {
        Path file = tmp.resolve(name);
        Files.writeString(file, text, StandardCharsets.UTF_8);
        assertTrue(file.toFile().setExecutable(true));
        return file;
    }

    private Path makeThatInstallsSampler(String extraLines) throws IOException {
        return script("make.sh", String.join("\n",
                "#!/bin/sh",
                extraLines,
                "cp '" + sampler + "' \"$1\"",
                "chmod +x \"$1\"",
                ""));
    }

    private PStrataConfig.EngineConfig config(Path make) {
        PStrataConfig.EngineConfig cfg = new PStrataConfig.EngineConfig();
        cfg.cmdstanHome = cmdstanHome.toString();
        cfg.workDirectory = tmp.resolve("work").toString();
        cfg.makeCommand = make.toString();
        cfg.chains = 3;
        cfg.iterWarmup = 10;
        cfg.iterSampling = 2;
        cfg.timeoutSeconds = 30;
        return cfg;
    }

    private static SynthesizedModel model(String program) {
        return new SynthesizedModel(program, Map.of("N", 2), null, null, List.of(), List.of(), null);
    }

    @Test
    public void testChainsAreBuiltSampledAndMerged() throws IOException {
        Path make = makeThatInstallsSampler("echo compiling");
        CmdStanInferenceEngine engine = new CmdStanInferenceEngine(config(make));

        PosteriorDraws draws = engine.sample(model("model { }"));

        ParameterDraws effect = draws.get("mean_effect");
        assertEquals(6, effect.getIterationCount());
        assertArrayEquals(new double[]{1, 1, 2, 2, 3, 3}, effect.column(0), 0.0);
        assertArrayEquals(new double[]{0.5, 0.25, 0.5, 0.25, 0.5, 0.25}, effect.column(1), 0.0);
        assertFalse(draws.has("lp__"));
        assertTrue(draws.getDiagnostics().contains("compiling"));
        assertTrue(draws.getDiagnostics().contains("sampling chain 3"));
    }

    @Test
    public void testBuiltProgramIsReused() throws IOException {
        Path count = tmp.resolve("builds.txt");
        Path make = makeThatInstallsSampler("echo build >> '" + count + "'");
        CmdStanInferenceEngine engine = new CmdStanInferenceEngine(config(make));

        engine.sample(model("model { }"));
        engine.sample(model("model { }"));
        assertEquals(1, Files.readAllLines(count).size());

        engine.sample(model("model { target += 0; }"));
        assertEquals(2, Files.readAllLines(count).size());
    }

    @Test
    public void testConcurrentFitsBuildOnce() throws Exception {
        Path count = tmp.resolve("builds.txt");
        Path make = makeThatInstallsSampler("echo build >> '" + count + "'\nsleep 1");
        CmdStanInferenceEngine engine = new CmdStanInferenceEngine(config(make));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<PosteriorDraws> a = pool.submit(() -> engine.sample(model("model { }")));
            Future<PosteriorDraws> b = pool.submit(() -> engine.sample(model("model { }")));
            assertEquals(6, a.get(60, TimeUnit.SECONDS).get("mean_effect").getIterationCount());
            assertEquals(6, b.get(60, TimeUnit.SECONDS).get("mean_effect").getIterationCount());
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, Files.readAllLines(count).size());
    }

    @Test
    public void testBuildFailureKeepsCompilerOutput() throws IOException {
        Path make = script("make.sh", "#!/bin/sh\necho 'Semantic error in model.stan line 3'\nexit 2\n");
        CmdStanInferenceEngine engine = new CmdStanInferenceEngine(config(make));

        InferenceEngineException e = assertThrows(InferenceEngineException.class,
                () -> engine.sample(model("model { }")));
        assertTrue(e.getMessage().contains("build failed with exit code 2"), e.getMessage());
        assertTrue(e.getDiagnostics().contains("Semantic error in model.stan line 3"));
    }

    @Test
    public void testSamplerFailureKeepsItsOutput() throws IOException {
        Path failing = script("failing.sh", "#!/bin/sh\necho 'Rejecting initial value' >&2\nexit 70\n");
        Path make = script("make.sh", "#!/bin/sh\ncp '" + failing + "' \"$1\"\nchmod +x \"$1\"\n");
        CmdStanInferenceEngine engine = new CmdStanInferenceEngine(config(make));

        InferenceEngineException e = assertThrows(InferenceEngineException.class,
                () -> engine.sample(model("model { }")));
        assertTrue(e.getMessage().contains("chain 1 failed with exit code 70"), e.getMessage());
        assertTrue(e.getDiagnostics().contains("Rejecting initial value"));
    }

    @Test
    public void testBuildWithoutExecutableFails() throws IOException {
        Path make = script("make.sh", "#!/bin/sh\necho 'nothing to be done'\n");
        CmdStanInferenceEngine engine = new CmdStanInferenceEngine(config(make));

        InferenceEngineException e = assertThrows(InferenceEngineException.class,
                () -> engine.sample(model("model { }")));
        assertTrue(e.getMessage().contains("produced no executable"), e.getMessage());
        assertTrue(e.getDiagnostics().contains("nothing to be done"));
    }

    @Test
    public void testHungProcessIsKilledAtTimeout() throws IOException {
        Path make = script("make.sh", "#!/bin/sh\necho 'starting build'\nexec sleep 30\n");
        PStrataConfig.EngineConfig cfg = config(make);
        cfg.timeoutSeconds = 1;
        CmdStanInferenceEngine engine = new CmdStanInferenceEngine(cfg);

        long start = System.nanoTime();
        InferenceEngineException e = assertThrows(InferenceEngineException.class,
                () -> engine.sample(model("model { }")));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(e.getMessage().contains("timed out"), e.getMessage());
        assertTrue(e.getDiagnostics().contains("starting build"));
        assertTrue(elapsedMillis < 15_000, "took " + elapsedMillis + " ms");
    }

    @Test
    public void testMissingChainOutputIsReported() throws IOException {
        Path silent = script("silent.sh", "#!/bin/sh\necho 'done'\n");
        Path make = script("make.sh", "#!/bin/sh\ncp '" + silent + "' \"$1\"\nchmod +x \"$1\"\n");
        CmdStanInferenceEngine engine = new CmdStanInferenceEngine(config(make));

        InferenceEngineException e = assertThrows(InferenceEngineException.class,
                () -> engine.sample(model("model { }")));
        assertTrue(e.getMessage().contains("Cannot open sampler output"), e.getMessage());
    }
}
