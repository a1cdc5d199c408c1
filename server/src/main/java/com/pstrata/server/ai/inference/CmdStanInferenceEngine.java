package com.pstrata.server.ai.inference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pstrata.server.ai.InferenceEngineException;
import com.pstrata.server.ai.PStrataConfig;
import com.pstrata.server.ai.synthesis.SynthesizedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs synthesized programs through a local CmdStan installation: the program is built
 * once per distinct text with CmdStan's make, then every chain is sampled as a separate
 * process and the CSV outputs are merged.
 * <p>
 * Process output goes to a log file next to the outputs, so the timeout applies while the
 * process is still running. The log is appended to the diagnostics after the process ends
 * or is killed.
 */
public class CmdStanInferenceEngine implements InferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(CmdStanInferenceEngine.class);

    // one build at a time per model directory within this JVM
    private static final ConcurrentMap<Path, Object> BUILD_LOCKS = new ConcurrentHashMap<>();

    private final Path cmdstanHome;
    private final Path workDirectory;
    private final String makeCommand;
    private final int chains;
    private final int iterWarmup;
    private final int iterSampling;
    private final long seed;
    private final Duration timeout;

    public CmdStanInferenceEngine(PStrataConfig.EngineConfig config) {
        String home = config.cmdstanHome != null ? config.cmdstanHome : System.getenv("CMDSTAN");
        this.cmdstanHome = home != null ? Paths.get(home) : null;
        this.workDirectory = Paths.get(config.workDirectory != null ? config.workDirectory
                : System.getProperty("java.io.tmpdir") + File.separator + "pstrata");
        this.makeCommand = config.makeCommand != null && !config.makeCommand.isBlank() ? config.makeCommand : "make";
        this.chains = config.chains != null ? config.chains : 4;
        this.iterWarmup = config.iterWarmup != null ? config.iterWarmup : 1000;
        this.iterSampling = config.iterSampling != null ? config.iterSampling : 1000;
        this.seed = config.seed != null ? config.seed : 20240101L;
        if (config.timeoutSeconds != null) {
            this.timeout = Duration.ofSeconds(config.timeoutSeconds);
        } else {
            this.timeout = Duration.ofMinutes(config.timeoutMinutes != null ? config.timeoutMinutes : 60);
        }
    }

    public int getChains() {
        return chains;
    }

    public int getIterSampling() {
        return iterSampling;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public PosteriorDraws sample(SynthesizedModel model) {
        if (cmdstanHome == null) {
            throw new InferenceEngineException("CmdStan home is not configured (engine.cmdstanHome or $CMDSTAN)", "");
        }
        String hash = programHash(model.getProgramText());
        Path modelDir = workDirectory.resolve("model_" + hash.substring(0, 16)).toAbsolutePath().normalize();
        Path executable = modelDir.resolve("model");
        StringBuilder diagnostics = new StringBuilder();
        try {
            Files.createDirectories(modelDir);
            ensureBuilt(model, modelDir, executable, diagnostics);

            String runId = "run_" + System.nanoTime();
            Path dataFile = modelDir.resolve(runId + "_data.json");
            new ObjectMapper().writeValue(dataFile.toFile(), model.getData());

            List<Path> outputs = new ArrayList<>();
            for (int c = 1; c <= chains; c++) {
                Path out = modelDir.resolve(runId + "_output_" + c + ".csv");
                List<String> cmd = List.of(executable.toString(),
                        "sample", "num_warmup=" + iterWarmup, "num_samples=" + iterSampling,
                        "data", "file=" + dataFile,
                        "output", "file=" + out,
                        "random", "seed=" + seed, "id=" + c);
                run(cmd, modelDir, modelDir.resolve(runId + "_chain_" + c + ".log"), diagnostics, "chain " + c);
                outputs.add(out);
            }

            PosteriorDraws draws = new CmdStanCsvReader().readFiles(outputs, diagnostics.toString());
            logger.info("Sampling finished: {} chains x {} iterations, {} parameters", chains, iterSampling,
                    draws.getParameterNames().size());
            return draws;
        } catch (IOException e) {
            throw new InferenceEngineException("CmdStan I/O failure: " + e.getMessage(), diagnostics.toString(), e);
        }
    }

    private void ensureBuilt(SynthesizedModel model, Path modelDir, Path executable, StringBuilder diagnostics)
            throws IOException {
        Object lock = BUILD_LOCKS.computeIfAbsent(modelDir, k -> new Object());
        synchronized (lock) {
            if (Files.isExecutable(executable)) {
                logger.debug("Reusing built program in {}", modelDir);
                return;
            }
            Files.writeString(modelDir.resolve("model.stan"), model.getProgramText(), StandardCharsets.UTF_8);
            logger.info("Building Stan program in {}", modelDir);
            run(List.of(makeCommand, executable.toString()), cmdstanHome, modelDir.resolve("build.log"),
                    diagnostics, "build");
            if (!Files.isExecutable(executable)) {
                throw new InferenceEngineException("CmdStan build produced no executable at " + executable,
                        diagnostics.toString());
            }
        }
    }

    private void run(List<String> command, Path dir, Path log, StringBuilder diagnostics, String step)
            throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command).directory(dir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(log.toFile());
        Process process = pb.start();
        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            appendLog(log, diagnostics);
            throw new InferenceEngineException("Interrupted during CmdStan " + step, diagnostics.toString(), e);
        }
        if (!finished) {
            process.destroyForcibly();
            appendLog(log, diagnostics);
            logger.warn("CmdStan {} killed after {}", step, timeout);
            throw new InferenceEngineException("CmdStan " + step + " timed out after " + timeout,
                    diagnostics.toString());
        }
        appendLog(log, diagnostics);
        if (process.exitValue() != 0) {
            throw new InferenceEngineException("CmdStan " + step + " failed with exit code " + process.exitValue(),
                    diagnostics.toString());
        }
    }

    private static void appendLog(Path log, StringBuilder diagnostics) throws IOException {
        if (Files.exists(log)) {
            diagnostics.append(new String(Files.readAllBytes(log), StandardCharsets.UTF_8));
        }
    }

    static String programHash(String programText) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(programText.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
