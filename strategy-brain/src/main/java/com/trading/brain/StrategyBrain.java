package com.trading.brain;

import com.trading.brain.allocation.AllocationStatus;
import com.trading.brain.allocation.AllocationStore;
import com.trading.brain.allocation.AutoAllocator;
import com.trading.brain.allocation.ExperienceFacts;
import com.trading.brain.allocation.RebalanceResult;
import com.trading.brain.config.BrainConfig;
import com.trading.brain.learning.TradeLearner;
import com.trading.brain.metrics.BrainMetrics;
import com.trading.brain.model.ClosedTrade;
import com.trading.brain.model.ConfidenceAdjustment;
import com.trading.brain.model.IndicatorSnapshot;
import com.trading.brain.model.LearningStats;
import com.trading.brain.model.SignalDecision;
import com.trading.brain.model.TradeAnalysis;
import com.trading.brain.persistence.AllocationSnapshot;
import com.trading.brain.persistence.AsyncSnapshotWriter;
import com.trading.brain.persistence.BanditSnapshot;
import com.trading.brain.persistence.BrainDataDirectory;
import com.trading.brain.persistence.LearnerSnapshot;
import com.trading.brain.persistence.LoadResult;
import com.trading.brain.persistence.SaveResult;
import com.trading.brain.persistence.SnapshotStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.SynchronizedRandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Entry point of the learning and allocation core. One instance is built at startup and owns
 * the learner, the auto-allocator and their snapshots.
 *
 * Usage:
 *   try (var brain = StrategyBrain.create(BrainConfig.load(), allocations -> db.update(allocations))) {
 *       brain.start();
 *       var analysis = brain.recordTrade(trade, "TRENDING_UP", "LONDON", indicators);
 *       brain.onTradeCompleted(experience, currentAllocations);
 *   }
 */
public class StrategyBrain implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StrategyBrain.class);

    public static final int DEFAULT_INSIGHT_LIMIT = 20;

    private final BrainConfig config;
    private final BrainMetrics metrics;
    private final SnapshotStore store;
    private final AsyncSnapshotWriter snapshotWriter;
    private final TradeLearner learner;
    private final AutoAllocator allocator;

    private ScheduledFuture<?> autosave;
    private volatile boolean closed;

    public StrategyBrain(BrainConfig config, RandomGenerator random, Clock clock, MeterRegistry registry,
                         AllocationStore allocationStore, Path dataDir) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(random, "random");
        Objects.requireNonNull(clock, "clock");

        this.metrics = new BrainMetrics(registry != null ? registry : new SimpleMeterRegistry());
        this.store = new SnapshotStore(dataDir != null ? dataDir : BrainDataDirectory.resolve(config));
        this.snapshotWriter = new AsyncSnapshotWriter(store, metrics);

        RandomGenerator shared = random instanceof SynchronizedRandomGenerator
            ? random
            : new SynchronizedRandomGenerator(random);
        this.learner = new TradeLearner(config, shared, clock, metrics, snapshotWriter);
        this.allocator = new AutoAllocator(config, allocationStore, clock, metrics, snapshotWriter);

        logger.info("🧠 StrategyBrain initialized, snapshots in {}", store.getDirectory().toAbsolutePath());
    }

    /** Production wiring: unseeded generator, UTC clock, in-memory metrics, configured data dir. */
    public static StrategyBrain create(BrainConfig config, AllocationStore allocationStore) {
        return new StrategyBrain(config, new Well19937c(), Clock.systemUTC(), new SimpleMeterRegistry(),
            allocationStore, null);
    }

    // ===== LIFECYCLE =====

    /**
     * Restores the three snapshots and schedules the periodic learner save. A missing or
     * unreadable snapshot leaves that component with fresh state.
     */
    public void start() {
        restoreFrom(LearnerSnapshot.FILE_NAME, LearnerSnapshot.class, learner::restore);
        restoreFrom(BanditSnapshot.FILE_NAME, BanditSnapshot.class, learner::restoreBandit);
        restoreFrom(AllocationSnapshot.FILE_NAME, AllocationSnapshot.class, allocator::restore);

        long interval = config.getAutosaveIntervalSeconds();
        if (interval > 0 && autosave == null) {
            autosave = snapshotWriter.scheduleEvery(Duration.ofSeconds(interval), LearnerSnapshot.FILE_NAME,
                learner::snapshot);
            logger.info("Autosave scheduled every {}s", interval);
        }
    }

    private <T> boolean restoreFrom(String fileName, Class<T> type, Consumer<T> restore) {
        LoadResult<T> result = store.load(fileName, type);
        if (result instanceof LoadResult.Loaded<T> loaded) {
            try {
                restore.accept(loaded.value());
                return true;
            } catch (RuntimeException e) {
                metrics.recordSnapshotFailure(fileName);
                logger.error("Snapshot {} could not be applied, starting fresh", loaded.path(), e);
                return false;
            }
        }
        if (result instanceof LoadResult.Failed<T> failed) {
            metrics.recordSnapshotFailure(fileName);
            logger.error("Snapshot {} unreadable, starting fresh: {}", failed.path(), failed.cause().toString());
        } else {
            logger.info("No snapshot at {}, starting fresh", result.path());
        }
        return false;
    }

    /** Writes all snapshots synchronously. */
    public List<SaveResult> save() {
        return List.of(
            snapshotWriter.write(LearnerSnapshot.FILE_NAME, learner.snapshot()),
            snapshotWriter.write(BanditSnapshot.FILE_NAME, learner.banditSnapshot()),
            snapshotWriter.write(AllocationSnapshot.FILE_NAME, allocator.snapshot()));
    }

    /** Waits for queued background writes. */
    public void flush() {
        snapshotWriter.flush();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (autosave != null) {
            autosave.cancel(false);
        }
        snapshotWriter.flush();
        save();
        snapshotWriter.close();
        logger.info("🧠 StrategyBrain stopped");
    }

    // ===== TRADES AND SIGNALS =====

    public TradeAnalysis recordTrade(ClosedTrade trade, String regime, String session, IndicatorSnapshot indicators) {
        return learner.recordTrade(trade, regime, session, indicators);
    }

    public SignalDecision shouldOverrideSignal(String strategy, String regime, IndicatorSnapshot indicators) {
        return learner.shouldOverrideSignal(strategy, regime, indicators);
    }

    public void notifyRegimeChange(String fromRegime, String toRegime) {
        learner.notifyRegimeChange(fromRegime, toRegime);
    }

    // ===== ALLOCATION =====

    /** Counts a completed trade, feeding the allocator with the learner's current view. */
    public Optional<RebalanceResult> onTradeCompleted(Map<String, ExperienceFacts> experience,
                                                      Map<String, Double> currentAllocations) {
        if (!allocator.isEnabled()) {
            return Optional.empty();
        }
        LearningStats stats = learner.getRlStats();
        return allocator.onTradeCompleted(experience, stats.confidenceAdjustments(), stats, currentAllocations);
    }

    public Optional<RebalanceResult> onTradeCompleted(Map<String, ExperienceFacts> experience,
                                                      Map<String, ConfidenceAdjustment> adjustments,
                                                      LearningStats learningStats,
                                                      Map<String, Double> currentAllocations) {
        return allocator.onTradeCompleted(experience, adjustments, learningStats, currentAllocations);
    }

    public AllocationStatus getAutoAllocationStatus() {
        return allocator.getStatus();
    }

    public void setAutoAllocationEnabled(boolean enabled) {
        allocator.setEnabled(enabled);
    }

    // ===== QUERIES =====

    public Map<String, ConfidenceAdjustment> getStrategyConfidenceAdjustments() {
        return learner.getStrategyConfidenceAdjustments();
    }

    public LearningStats getRlStats() {
        return learner.getRlStats();
    }

    public List<String> getLearnedInsights() {
        return learner.getLearnedInsights(DEFAULT_INSIGHT_LIMIT);
    }

    public List<String> getLearnedInsights(int limit) {
        return learner.getLearnedInsights(limit);
    }

    public String getMarketMemory(String currentRegime) {
        return learner.getMarketMemory(currentRegime);
    }

    public TradeLearner getLearner() {
        return learner;
    }

    public AutoAllocator getAllocator() {
        return allocator;
    }

    public BrainMetrics getMetrics() {
        return metrics;
    }

    public Path getDataDirectory() {
        return store.getDirectory();
    }
}
