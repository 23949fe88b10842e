package com.trading.brain.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Learning and allocation parameters loaded from {@code brain.properties}.
 * All tunables of the learner, the signal gate and the auto-allocator are read through this class.
 *
 * Lookup order: working directory, then classpath, then built-in defaults.
 * Instances are immutable and safe to share between threads.
 */
public final class BrainConfig {
    private static final Logger logger = LoggerFactory.getLogger(BrainConfig.class);

    public static final String FILE_NAME = "brain.properties";

    private final String dataDir;
    private final List<String> strategyCodes;
    private final List<String> allocationStrategyCodes;

    // Learner
    private final int maxTradeHistory;
    private final int maxInsights;
    private final int minTradesForAdjustment;
    private final int streakWarningThreshold;
    private final int confidenceLookback;
    private final int minTradesForPattern;

    // Exploration
    private final double explorationRate;
    private final boolean explorationDecayEnabled;
    private final long explorationDecayAfterTrades;
    private final double explorationDecayTarget;

    // Allocator
    private final int rebalanceInterval;
    private final double maxChangePerRebalance;
    private final double minAllocationPct;
    private final double maxAllocationPct;

    private final long autosaveIntervalSeconds;

    private BrainConfig(Properties props) {
        this.dataDir = parseString(props, "BRAIN_DATA_DIR", "data/brain");
        this.strategyCodes = parseCodes(props, "STRATEGY_CODES", "A,B,C,D,E");
        this.allocationStrategyCodes = parseCodes(props, "ALLOCATION_STRATEGY_CODES", "A,B,C,D");

        this.maxTradeHistory = parseInt(props, "MAX_TRADE_HISTORY", 200);
        this.maxInsights = parseInt(props, "MAX_INSIGHTS", 100);
        this.minTradesForAdjustment = parseInt(props, "MIN_TRADES_FOR_ADJUSTMENT", 5);
        this.streakWarningThreshold = parseInt(props, "STREAK_WARNING_THRESHOLD", 3);
        this.confidenceLookback = parseInt(props, "CONFIDENCE_LOOKBACK", 20);
        this.minTradesForPattern = parseInt(props, "MIN_TRADES_FOR_PATTERN", 5);

        this.explorationRate = parseDouble(props, "EXPLORATION_RATE", 0.10);
        this.explorationDecayEnabled = parseBoolean(props, "EXPLORATION_DECAY_ENABLED", false);
        this.explorationDecayAfterTrades = parseInt(props, "EXPLORATION_DECAY_AFTER_TRADES", 500);
        this.explorationDecayTarget = parseDouble(props, "EXPLORATION_DECAY_TARGET", 0.02);

        this.rebalanceInterval = parseInt(props, "REBALANCE_INTERVAL", 10);
        this.maxChangePerRebalance = parseDouble(props, "MAX_CHANGE_PER_REBALANCE", 5.0);
        this.minAllocationPct = parseDouble(props, "MIN_ALLOCATION_PCT", 5.0);
        this.maxAllocationPct = parseDouble(props, "MAX_ALLOCATION_PCT", 50.0);

        this.autosaveIntervalSeconds = parseInt(props, "AUTOSAVE_INTERVAL_SECONDS", 300);

        logger.info("Brain configuration loaded: history={} lookback={} minTrades={} exploration={} rebalanceEvery={} allocation=[{}..{}] step={}",
            maxTradeHistory, confidenceLookback, minTradesForAdjustment, explorationRate,
            rebalanceInterval, minAllocationPct, maxAllocationPct, maxChangePerRebalance);
    }

    /**
     * Load configuration from brain.properties.
     */
    public static BrainConfig load() {
        Properties props = new Properties();

        Path configPath = Path.of(FILE_NAME);
        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded brain config from: {}", configPath.toAbsolutePath());
                return new BrainConfig(props);
            } catch (IOException e) {
                logger.warn("Failed to load {} from filesystem: {}", FILE_NAME, e.getMessage());
            }
        }

        try (InputStream is = BrainConfig.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded brain config from classpath");
                return new BrainConfig(props);
            }
        } catch (IOException e) {
            logger.warn("Failed to load {} from classpath: {}", FILE_NAME, e.getMessage());
        }

        logger.warn("No {} found, using defaults", FILE_NAME);
        return new BrainConfig(new Properties());
    }

    /**
     * Create an instance from explicit properties. Missing keys fall back to defaults.
     */
    public static BrainConfig forTest(Properties testProps) {
        return new BrainConfig(testProps);
    }

    public static BrainConfig defaults() {
        return new BrainConfig(new Properties());
    }

    private static String parseString(Properties props, String key, String defaultValue) {
        String value = props.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static List<String> parseCodes(Properties props, String key, String defaultValue) {
        String raw = parseString(props, key, defaultValue);
        List<String> codes = Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .distinct()
            .toList();
        if (codes.isEmpty()) {
            logger.warn("Empty {} value, using default {}", key, defaultValue);
            return parseCodes(new Properties(), key, defaultValue);
        }
        return codes;
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                logger.warn("Negative {} value '{}', using default {}", key, value, defaultValue);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static double parseDouble(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static boolean parseBoolean(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    // ========== Getters ==========

    /** Directory for the JSON snapshots (created on demand). */
    public String getDataDir() {
        return dataDir;
    }

    /** Strategy codes the learner always reports on, even before their first trade. */
    public List<String> getStrategyCodes() {
        return strategyCodes;
    }

    /** Strategy codes that take part in capital allocation. */
    public List<String> getAllocationStrategyCodes() {
        return allocationStrategyCodes;
    }

    public int getMaxTradeHistory() {
        return maxTradeHistory;
    }

    public int getMaxInsights() {
        return maxInsights;
    }

    public int getMinTradesForAdjustment() {
        return minTradesForAdjustment;
    }

    public int getStreakWarningThreshold() {
        return streakWarningThreshold;
    }

    /** Per-strategy trade window used for the base confidence adjustment. */
    public int getConfidenceLookback() {
        return confidenceLookback;
    }

    public int getMinTradesForPattern() {
        return minTradesForPattern;
    }

    /** Probability (0-1) that the signal gate lets a signal through unconditionally. */
    public double getExplorationRate() {
        return explorationRate;
    }

    public boolean isExplorationDecayEnabled() {
        return explorationDecayEnabled;
    }

    public long getExplorationDecayAfterTrades() {
        return explorationDecayAfterTrades;
    }

    public double getExplorationDecayTarget() {
        return explorationDecayTarget;
    }

    public int getRebalanceInterval() {
        return rebalanceInterval;
    }

    /** Maximum percentage-point move of a single allocation per rebalance. */
    public double getMaxChangePerRebalance() {
        return maxChangePerRebalance;
    }

    public double getMinAllocationPct() {
        return minAllocationPct;
    }

    public double getMaxAllocationPct() {
        return maxAllocationPct;
    }

    public long getAutosaveIntervalSeconds() {
        return autosaveIntervalSeconds;
    }
}
