package com.trading.brain.persistence;

import com.trading.brain.config.BrainConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolves the directory holding the brain snapshots: the configured one when it is
 * writable, otherwise {@code ${java.io.tmpdir}/strategy-brain}.
 */
public final class BrainDataDirectory {
    private static final Logger logger = LoggerFactory.getLogger(BrainDataDirectory.class);

    static final String FALLBACK_NAME = "strategy-brain";

    private BrainDataDirectory() {}

    public static Path resolve(BrainConfig config) {
        Path configured = Path.of(config.getDataDir());
        if (isWritable(configured)) {
            return configured;
        }
        Path fallback = Path.of(System.getProperty("java.io.tmpdir"), FALLBACK_NAME);
        logger.warn("Brain data dir {} is not writable, using {}", configured.toAbsolutePath(), fallback);
        return fallback;
    }

    private static boolean isWritable(Path dir) {
        try {
            Files.createDirectories(dir);
            return Files.isWritable(dir);
        } catch (IOException | SecurityException e) {
            logger.debug("Cannot create {}: {}", dir, e.getMessage());
            return false;
        }
    }
}
