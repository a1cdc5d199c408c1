package com.pstrata.server.ai;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * JSON-backed configuration read from {@code /pstrata_config.json}. Fields left out of the
 * file keep the defaults below.
 */
public class PStrataConfig {

    private static final Logger logger = LoggerFactory.getLogger(PStrataConfig.class);

    public static final String RESOURCE = "/pstrata_config.json";

    public static class EngineConfig {
        public String type = "cmdstan";
        public String cmdstanHome;
        public String workDirectory;
        public String makeCommand;
        public Integer chains;
        public Integer iterWarmup;
        public Integer iterSampling;
        public Long seed;
        public Integer timeoutMinutes;
        // takes precedence over timeoutMinutes when set
        public Integer timeoutSeconds;
    }

    public static class DefaultsConfig {
        public Integer survivalTimePoints;
        public String outcomeType;
    }

    public static class ConfigRoot {
        public String data_directory;
        public EngineConfig engine;
        public DefaultsConfig defaults;
    }

    private PStrataConfig() {
    }

    public static ConfigRoot load(InputStream jsonStream) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        ConfigRoot root = mapper.readValue(jsonStream, ConfigRoot.class);
        if (root.engine == null) {
            root.engine = new EngineConfig();
        }
        if (root.defaults == null) {
            root.defaults = new DefaultsConfig();
        }
        return root;
    }

    /**
     * Loads the classpath configuration, or an all-defaults one when the resource is absent.
     */
    public static ConfigRoot loadDefault() {
        try (InputStream is = PStrataConfig.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                logger.warn("{} not found, using built-in defaults", RESOURCE);
                ConfigRoot root = new ConfigRoot();
                root.engine = new EngineConfig();
                root.defaults = new DefaultsConfig();
                return root;
            }
            return load(is);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + RESOURCE, e);
        }
    }
}
