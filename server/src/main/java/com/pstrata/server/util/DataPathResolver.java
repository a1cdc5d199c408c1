package com.pstrata.server.util;

import com.pstrata.server.ai.PStrataConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Locates the draw cache. The directory comes from the {@code pstrata.data.dir} system
 * property when set, otherwise from {@code data_directory} of the loaded configuration,
 * otherwise the working directory.
 */
public final class DataPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(DataPathResolver.class);

    public static final String DATA_DIR_PROPERTY = "pstrata.data.dir";
    public static final String DB_FILE_NAME = "pstrata_draws.db";

    private DataPathResolver() {
    }

    public static Path dataDirectory(PStrataConfig.ConfigRoot config) {
        String override = System.getProperty(DATA_DIR_PROPERTY);
        if (!isBlank(override)) {
            return Paths.get(override);
        }
        if (config != null && !isBlank(config.data_directory)) {
            return Paths.get(config.data_directory);
        }
        return Paths.get(".");
    }

    /**
     * Path of the SQLite draw cache, creating its directory when it does not exist yet.
     */
    public static Path drawCachePath(PStrataConfig.ConfigRoot config) {
        Path dir = dataDirectory(config);
        if (!Files.isDirectory(dir)) {
            try {
                Files.createDirectories(dir);
                logger.info("Created data directory {}", dir.toAbsolutePath());
            } catch (IOException e) {
                throw new RuntimeException("Cannot create data directory " + dir, e);
            }
        }
        return dir.resolve(DB_FILE_NAME);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
