package com.trading.brain.allocation;

import com.trading.brain.config.BrainConfig;
import com.trading.brain.metrics.BrainMetrics;
import com.trading.brain.model.ConfidenceAdjustment;
import com.trading.brain.model.LearningStats;
import com.trading.brain.model.Rounding;
import com.trading.brain.persistence.AllocationSnapshot;
import com.trading.brain.persistence.AsyncSnapshotWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rebalances capital across strategies every N completed trades.
 *
 * Scores each strategy with {@link FitnessScorer}, turns the scores into a target split and
 * smooths the move from the current split with {@link AllocationCalculator}. The result goes
 * to the {@link AllocationStore}; state is persisted after every rebalance.
 */
public class AutoAllocator {
    private static final Logger logger = LoggerFactory.getLogger(AutoAllocator.class);

    static final int HISTORY_CAP = 20;
    static final int STATUS_HISTORY = 10;

    private final BrainConfig config;
    private final List<String> codes;
    private final AllocationCalculator calculator;
    private final AllocationStore store;
    private final Clock clock;
    private final BrainMetrics metrics;
    private final AsyncSnapshotWriter snapshotWriter;

    private final ReentrantLock lock = new ReentrantLock();

    private boolean enabled = true;
    private int tradesSinceRebalance;
    private long totalRebalances;
    private Instant lastRebalanceTime;
    private Map<String, FitnessScore> lastFitnessScores = Map.of();
    private Map<String, Double> lastAllocations = Map.of();
    private final ArrayDeque<RebalanceEvent> history = new ArrayDeque<>();

    public AutoAllocator(BrainConfig config, AllocationStore store, Clock clock,
                         BrainMetrics metrics, AsyncSnapshotWriter snapshotWriter) {
        this.config = Objects.requireNonNull(config, "config");
        this.codes = List.copyOf(config.getAllocationStrategyCodes());
        this.calculator = new AllocationCalculator(config);
        this.store = store != null ? store : AllocationStore.NONE;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.snapshotWriter = snapshotWriter;

        logger.info("⚖️ AutoAllocator initialized (every {} trades, step {}%, bounds {}-{}%)",
            config.getRebalanceInterval(), config.getMaxChangePerRebalance(),
            config.getMinAllocationPct(), config.getMaxAllocationPct());
    }

    /**
     * Counts one completed trade and rebalances when the interval is reached.
     *
     * @param experience         per-strategy facts from the leveling collaborator
     * @param adjustments        current confidence adjustments; strategies missing here fall back
     *                           to the ones inside {@code learningStats}
     * @param learningStats      learner status, may be null
     * @param currentAllocations current split as stored by the host
     * @return the new split, or empty when disabled or not yet due
     */
    public Optional<RebalanceResult> onTradeCompleted(Map<String, ExperienceFacts> experience,
                                                      Map<String, ConfidenceAdjustment> adjustments,
                                                      LearningStats learningStats,
                                                      Map<String, Double> currentAllocations) {
        RebalanceResult result;
        AllocationSnapshot snapshot;
        lock.lock();
        try {
            if (!enabled) {
                return Optional.empty();
            }
            if (tradesSinceRebalance + 1 < config.getRebalanceInterval()) {
                tradesSinceRebalance++;
                return Optional.empty();
            }
            long rebalanceNumber = totalRebalances + 1;

            Map<String, ConfidenceAdjustment> merged = new LinkedHashMap<>();
            if (learningStats != null && learningStats.confidenceAdjustments() != null) {
                merged.putAll(learningStats.confidenceAdjustments());
            }
            if (adjustments != null) {
                merged.putAll(adjustments);
            }
            Map<String, Double> current = currentAllocations != null ? currentAllocations : Map.of();

            Map<String, FitnessScore> fitness = calculateFitnessScores(
                experience != null ? experience : Map.of(), merged);
            Map<String, Double> scores = scoresOf(fitness);
            Map<String, Double> target = calculator.targetAllocations(scores, codes);
            Map<String, Double> allocations = calculator.smooth(current, target, codes);

            double equal = AllocationCalculator.TOTAL / codes.size();
            Map<String, AllocationChange> changes = new LinkedHashMap<>();
            for (String code : codes) {
                double from = AllocationCalculator.valueOr(current.get(code), equal);
                double to = allocations.get(code);
                changes.put(code, new AllocationChange(from, to, Rounding.round(to - from, 1)));
            }

            Instant now = clock.instant();
            tradesSinceRebalance = 0;
            totalRebalances = rebalanceNumber;
            lastRebalanceTime = now;
            lastFitnessScores = fitness;
            lastAllocations = allocations;
            history.addLast(new RebalanceEvent(now, totalRebalances, allocations, scores, changes));
            while (history.size() > HISTORY_CAP) {
                history.removeFirst();
            }

            result = new RebalanceResult(allocations, fitness, totalRebalances, changes, now);
            snapshot = snapshotLocked();
        } finally {
            lock.unlock();
        }

        metrics.recordRebalance();
        persist(snapshot);
        try {
            store.applyAllocations(result.allocations());
        } catch (RuntimeException e) {
            logger.error("Allocation store rejected rebalance #{}", result.rebalanceNumber(), e);
        }

        logger.atInfo()
            .addKeyValue("rebalanceNumber", result.rebalanceNumber())
            .addKeyValue("allocations", result.allocations())
            .addKeyValue("fitness", scoresOf(result.fitnessScores()))
            .log("🔄 Auto rebalance executed");
        return Optional.of(result);
    }

    public Map<String, FitnessScore> calculateFitnessScores(Map<String, ExperienceFacts> experience,
                                                            Map<String, ConfidenceAdjustment> adjustments) {
        Map<String, FitnessScore> scores = new LinkedHashMap<>();
        for (String code : codes) {
            scores.put(code, FitnessScorer.score(
                experience.getOrDefault(code, ExperienceFacts.newcomer()), adjustments.get(code)));
        }
        return scores;
    }

    public AllocationStatus getStatus() {
        lock.lock();
        try {
            List<RebalanceEvent> recent = new ArrayList<>(history);
            if (recent.size() > STATUS_HISTORY) {
                recent = recent.subList(recent.size() - STATUS_HISTORY, recent.size());
            }
            int interval = config.getRebalanceInterval();
            return new AllocationStatus(
                enabled,
                tradesSinceRebalance,
                interval,
                Math.max(0, interval - tradesSinceRebalance),
                totalRebalances,
                lastRebalanceTime,
                lastFitnessScores,
                lastAllocations,
                List.copyOf(recent),
                new AllocationStatus.Settings(interval, config.getMaxChangePerRebalance(),
                    config.getMinAllocationPct(), config.getMaxAllocationPct(), FitnessScorer.weights()));
        } finally {
            lock.unlock();
        }
    }

    public boolean isEnabled() {
        lock.lock();
        try {
            return enabled;
        } finally {
            lock.unlock();
        }
    }

    public void setEnabled(boolean enabled) {
        AllocationSnapshot snapshot;
        lock.lock();
        try {
            this.enabled = enabled;
            snapshot = snapshotLocked();
        } finally {
            lock.unlock();
        }
        persist(snapshot);
        logger.info("Auto-allocation {}", enabled ? "enabled" : "disabled");
    }

    // ===== SNAPSHOTS =====

    public AllocationSnapshot snapshot() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    public void restore(AllocationSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        lock.lock();
        try {
            enabled = snapshot.enabled();
            tradesSinceRebalance = Math.max(0, snapshot.tradesSinceRebalance());
            totalRebalances = Math.max(0, snapshot.totalRebalances());
            lastRebalanceTime = snapshot.lastRebalanceTime();
            lastFitnessScores = new LinkedHashMap<>(snapshot.lastFitnessScores());
            lastAllocations = new LinkedHashMap<>(snapshot.lastAllocations());
            history.clear();
            snapshot.rebalanceHistory().forEach(history::addLast);
            while (history.size() > HISTORY_CAP) {
                history.removeFirst();
            }
        } finally {
            lock.unlock();
        }
        logger.info("Auto-allocation state restored: {} rebalances, enabled={}", totalRebalances, enabled);
    }

    private AllocationSnapshot snapshotLocked() {
        return new AllocationSnapshot(enabled, tradesSinceRebalance, totalRebalances, lastRebalanceTime,
            new LinkedHashMap<>(lastFitnessScores), new LinkedHashMap<>(lastAllocations),
            new ArrayList<>(history), clock.instant());
    }

    private void persist(AllocationSnapshot snapshot) {
        if (snapshotWriter != null) {
            snapshotWriter.submit(AllocationSnapshot.FILE_NAME, snapshot);
        }
    }

    private static Map<String, Double> scoresOf(Map<String, FitnessScore> fitness) {
        Map<String, Double> scores = new LinkedHashMap<>();
        fitness.forEach((code, score) -> scores.put(code, score.score()));
        return scores;
    }
}
