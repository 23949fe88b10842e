package com.trading.brain.learning;

import com.trading.brain.config.BrainConfig;
import com.trading.brain.metrics.BrainMetrics;
import com.trading.brain.model.BucketStats;
import com.trading.brain.model.ClosedTrade;
import com.trading.brain.model.ConfidenceAdjustment;
import com.trading.brain.model.IndicatorSnapshot;
import com.trading.brain.model.LearningStats;
import com.trading.brain.model.PerformanceCell;
import com.trading.brain.model.Preset;
import com.trading.brain.model.PresetStats;
import com.trading.brain.model.RegimeTransition;
import com.trading.brain.model.Rounding;
import com.trading.brain.model.SignalDecision;
import com.trading.brain.model.StreakInfo;
import com.trading.brain.model.StreakType;
import com.trading.brain.model.TradeAnalysis;
import com.trading.brain.model.TradeInsight;
import com.trading.brain.model.TradeOutcome;
import com.trading.brain.model.TransitionPerformance;
import com.trading.brain.patterns.PatternDetector;
import com.trading.brain.persistence.AsyncSnapshotWriter;
import com.trading.brain.persistence.BanditSnapshot;
import com.trading.brain.persistence.LearnerSnapshot;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.StampedLock;

/**
 * Learns from every closed trade which strategy works under which market conditions.
 *
 * Keeps a capped log of enriched trade outcomes plus aggregate tables, feeds a Thompson
 * sampling bandit per (strategy, regime), derives bounded confidence adjustments and gates
 * pending signals.
 *
 * Thread-safety: one StampedLock guards all state. {@link #recordTrade},
 * {@link #notifyRegimeChange} and {@link #restore} take the write lock, every query the read lock.
 */
public class TradeLearner {
    private static final Logger logger = LoggerFactory.getLogger(TradeLearner.class);

    private static final double DECAY_CONSTANT = 300.0;
    private static final double STRONG_PRESET_EV = 0.65;
    private static final double POOR_PRESET_EV = 0.35;

    private final BrainConfig config;
    private final Clock clock;
    private final BrainMetrics metrics;
    private final AsyncSnapshotWriter snapshotWriter;

    private final ParameterAdapter adapter;
    private final ConfidenceCalculator confidence;
    private final SignalGate gate;
    private final InsightGenerator insightGenerator;

    private final LearnerState state = new LearnerState();
    private final StampedLock lock = new StampedLock();

    public TradeLearner(BrainConfig config, RandomGenerator random, Clock clock,
                        BrainMetrics metrics, AsyncSnapshotWriter snapshotWriter) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.snapshotWriter = snapshotWriter;
        Objects.requireNonNull(random, "random");

        this.adapter = new ParameterAdapter(random);
        this.confidence = new ConfidenceCalculator(config, adapter);
        this.gate = new SignalGate(config, adapter, random);
        this.insightGenerator = new InsightGenerator(config.getStreakWarningThreshold());

        config.getStrategyCodes().forEach(code -> state.confidenceAdjustments.put(code, 0.0));
        state.explorationRate = config.getExplorationRate();

        logger.info("📊 TradeLearner initialized - strategies={} history cap={}",
            config.getStrategyCodes(), config.getMaxTradeHistory());
    }

    // ===== HOT PATH =====

    /**
     * Records one closed trade: appends it to the log, updates the aggregate tables, credits
     * the bandit with the trade's reward, recomputes every strategy's adjustment and queues a
     * bandit snapshot.
     */
    public TradeAnalysis recordTrade(ClosedTrade trade, String regime, String session, IndicatorSnapshot indicators) {
        Objects.requireNonNull(trade, "trade");
        Instant now = clock.instant();
        TradeOutcome outcome = TradeOutcome.from(trade, regime, session, indicators,
            trade.closedAt() != null ? trade.closedAt() : now);

        TradeAnalysis analysis;
        BanditSnapshot banditSnapshot;
        long stamp = lock.writeLock();
        try {
            state.append(outcome, config.getMaxTradeHistory());
            state.accumulate(outcome);

            state.totalTradeCount++;
            applyExplorationDecay();

            double reward = RewardCalculator.calculate(trade);
            state.rlTotalTrades++;
            state.rlTotalReward += reward;

            // The preset drawn for this trade is credited with this trade's own reward.
            Preset preset = adapter.selectPreset(outcome.strategy(), outcome.regime());
            adapter.update(outcome.strategy(), outcome.regime(), preset, reward);

            Map<String, Double> adjustments = confidence.recompute(state);
            state.confidenceAdjustments.clear();
            state.confidenceAdjustments.putAll(adjustments);

            StreakInfo streak = PatternDetector.detectStreaks(state.history)
                .getOrDefault(outcome.strategy(), StreakInfo.NONE);
            InsightGenerator.Insight insight = insightGenerator.explain(outcome, streak);
            state.appendInsight(new TradeInsight(now, insight.text(), Math.abs(insight.adjustment()),
                outcome.strategy(), TradeInsight.TRADE_ANALYSIS, reward), config.getMaxInsights());

            analysis = new TradeAnalysis(insight.text(), insight.adjustment(), outcome.strategy(), reward, preset.key());
            banditSnapshot = banditSnapshotLocked(now);
        } finally {
            lock.unlockWrite(stamp);
        }

        metrics.recordTradeAnalyzed(outcome.strategy(), analysis.reward());
        if (snapshotWriter != null) {
            snapshotWriter.submit(BanditSnapshot.FILE_NAME, banditSnapshot);
        }

        logger.atInfo()
            .addKeyValue("strategy", outcome.strategy())
            .addKeyValue("regime", outcome.regime())
            .addKeyValue("session", outcome.session())
            .addKeyValue("profit", outcome.profit())
            .addKeyValue("won", outcome.won())
            .addKeyValue("reward", analysis.reward())
            .addKeyValue("preset", analysis.chosenPreset())
            .addKeyValue("confidenceDelta", analysis.confidenceDelta())
            .log("Trade analyzed");
        return analysis;
    }

    /**
     * Remembers a regime change; trades closing within the next 60 minutes are attributed to it.
     */
    public void notifyRegimeChange(String fromRegime, String toRegime) {
        RegimeTransition transition = new RegimeTransition(fromRegime, toRegime, clock.instant());
        long stamp = lock.writeLock();
        try {
            state.lastTransition = transition;
        } finally {
            lock.unlockWrite(stamp);
        }
        logger.info("Regime transition recorded: {}", transition.key());
    }

    private void applyExplorationDecay() {
        state.explorationRate = effectiveExplorationRate(state.totalTradeCount);
    }

    double effectiveExplorationRate(long totalTrades) {
        double base = config.getExplorationRate();
        if (!config.isExplorationDecayEnabled() || totalTrades < config.getExplorationDecayAfterTrades()) {
            return base;
        }
        double target = config.getExplorationDecayTarget();
        double since = totalTrades - config.getExplorationDecayAfterTrades();
        return Rounding.round(target + (base - target) * Math.exp(-since / DECAY_CONSTANT), 4);
    }

    // ===== SIGNAL GATE =====

    /**
     * Decides whether a pending signal should be skipped. Never mutates learner state.
     */
    public SignalDecision shouldOverrideSignal(String strategy, String regime, IndicatorSnapshot indicators) {
        SignalDecision decision;
        long stamp = lock.readLock();
        try {
            decision = gate.evaluate(state, strategy, regime, indicators, state.explorationRate);
        } finally {
            lock.unlockRead(stamp);
        }
        metrics.recordSignalEvaluated(strategy != null ? strategy : TradeOutcome.UNKNOWN, decision.check().name());
        if (decision.skip()) {
            logger.info("🚫 Signal skipped for {} in {}: {}", strategy, regime, decision.reason());
        }
        return decision;
    }

    // ===== QUERIES =====

    /** Display-oriented adjustments with reasons, one per configured strategy. */
    public Map<String, ConfidenceAdjustment> getStrategyConfidenceAdjustments() {
        long stamp = lock.readLock();
        try {
            return confidence.describe(state, clock.instant());
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /** Raw adjustments as last recomputed on the trade path. */
    public Map<String, Double> getRawConfidenceAdjustments() {
        long stamp = lock.readLock();
        try {
            return new LinkedHashMap<>(state.confidenceAdjustments);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public LearningStats getRlStats() {
        long stamp = lock.readLock();
        try {
            return new LearningStats(
                adapter.getAllDistributions(),
                state.rlTotalTrades,
                Rounding.round(state.rlTotalReward, 4),
                Rounding.round(Rounding.safeDiv(state.rlTotalReward, state.rlTotalTrades), 4),
                state.explorationRate,
                confidence.describe(state, clock.instant()));
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public Map<String, Map<String, PresetStats>> getAllDistributions() {
        long stamp = lock.readLock();
        try {
            return adapter.getAllDistributions();
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public double getExpectedValue(String strategy, String regime, String preset) {
        long stamp = lock.readLock();
        try {
            return adapter.expectedValue(strategy, regime, preset);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public double getExplorationRate() {
        long stamp = lock.readLock();
        try {
            return state.explorationRate;
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public List<TradeOutcome> getTradeHistory() {
        long stamp = lock.readLock();
        try {
            return List.copyOf(state.history);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public int getTradeCount() {
        long stamp = lock.readLock();
        try {
            return state.history.size();
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public long getTotalTradeCount() {
        long stamp = lock.readLock();
        try {
            return state.totalTradeCount;
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public List<TradeInsight> getInsights() {
        long stamp = lock.readLock();
        try {
            return List.copyOf(state.insights);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public Map<String, StreakInfo> getStreaks() {
        long stamp = lock.readLock();
        try {
            return PatternDetector.detectStreaks(state.history);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public Map<String, Map<String, PerformanceCell>> getRegimePerformance() {
        long stamp = lock.readLock();
        try {
            return cells(state.regimeStats);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public Map<String, Map<String, PerformanceCell>> getSessionPerformance() {
        long stamp = lock.readLock();
        try {
            return cells(state.sessionStats);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public Map<String, Map<String, PerformanceCell>> getRsiZonePerformance() {
        long stamp = lock.readLock();
        try {
            return cells(state.rsiZoneStats);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /** strategy -> symbol -> UTC hour -> performance */
    public Map<String, Map<String, Map<Integer, PerformanceCell>>> getHourPerformance() {
        long stamp = lock.readLock();
        try {
            return timeCells(state.hourStats);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /** strategy -> symbol -> ISO weekday (1 = Monday) -> performance */
    public Map<String, Map<String, Map<Integer, PerformanceCell>>> getDayOfWeekPerformance() {
        long stamp = lock.readLock();
        try {
            return timeCells(state.dowStats);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public TransitionPerformance getTransitionPerformance() {
        long stamp = lock.readLock();
        try {
            return new TransitionPerformance(
                cells(state.transitionStats),
                state.lastTransition,
                state.isWithinTransitionWindow(clock.instant()));
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /**
     * Everything the learner can say in plain words, pattern sentences first and the stored
     * per-trade insights newest first. Duplicates are dropped.
     */
    public List<String> getLearnedInsights(int limit) {
        long stamp = lock.readLock();
        try {
            return learnedInsightsLocked(limit);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public String getMarketMemory(String currentRegime) {
        long stamp = lock.readLock();
        try {
            return PatternDetector.generateMarketMemory(new ArrayList<>(state.history), currentRegime);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private List<String> learnedInsightsLocked(int limit) {
        int minTrades = config.getMinTradesForPattern();
        ZonedDateTime utc = clock.instant().atZone(ZoneOffset.UTC);

        List<String> all = new ArrayList<>();
        all.addAll(PatternDetector.detectRegimeBias(state.history, minTrades));
        all.addAll(PatternDetector.detectTimePatterns(state.history, minTrades));
        all.addAll(PatternDetector.detectIndicatorPatterns(state.history, minTrades));
        all.addAll(PatternDetector.detectHourPatterns(state.hourStats, utc.getHour()));
        all.addAll(PatternDetector.detectDayOfWeekPatterns(state.dowStats, utc.getDayOfWeek()));

        int threshold = config.getStreakWarningThreshold();
        PatternDetector.detectStreaks(state.history).forEach((strategy, streak) -> {
            if (streak.currentStreak() < threshold) {
                return;
            }
            if (streak.type() == StreakType.LOSS) {
                all.add("Strategy " + strategy + " is on a " + streak.currentStreak()
                    + "-trade losing streak. Consider pausing or reducing allocation.");
            } else if (streak.type() == StreakType.WIN) {
                all.add("Strategy " + strategy + " is hot with " + streak.currentStreak()
                    + " consecutive wins. Confidence elevated.");
            }
        });

        adapter.getAllDistributions().forEach((context, presets) -> {
            String bestPreset = null;
            double bestEv = Double.NEGATIVE_INFINITY;
            for (Map.Entry<String, PresetStats> e : presets.entrySet()) {
                if (e.getValue().expected() > bestEv) {
                    bestEv = e.getValue().expected();
                    bestPreset = e.getKey();
                }
            }
            if (bestEv >= STRONG_PRESET_EV) {
                all.add("RL: " + context + " strongly favors '" + bestPreset + "' preset (expected value: "
                    + ConfidenceCalculator.pct(bestEv) + ")");
            } else if (bestEv <= POOR_PRESET_EV) {
                all.add("RL: " + context + " shows poor performance across all presets (best EV: "
                    + ConfidenceCalculator.pct(bestEv) + "). Consider regime avoidance.");
            }
        });

        String currentTransition = state.lastTransition != null ? state.lastTransition.key() : null;
        all.addAll(PatternDetector.detectTransitionPatterns(state.transitionStats, currentTransition));

        Iterator<TradeInsight> newestFirst = state.insights.descendingIterator();
        while (newestFirst.hasNext()) {
            all.add(newestFirst.next().text());
        }

        Set<String> unique = new LinkedHashSet<>(all);
        return unique.stream().limit(Math.max(0, limit)).toList();
    }

    // ===== SNAPSHOTS =====

    public LearnerSnapshot snapshot() {
        long stamp = lock.readLock();
        try {
            return new LearnerSnapshot(
                List.copyOf(state.history),
                copyTable(state.regimeStats),
                copyTable(state.sessionStats),
                copyTable(state.rsiZoneStats),
                copyTimeTable(state.hourStats),
                copyTimeTable(state.dowStats),
                copyTable(state.transitionStats),
                List.copyOf(state.insights),
                new LinkedHashMap<>(state.confidenceAdjustments),
                state.totalTradeCount,
                state.explorationRate,
                state.lastTransition,
                clock.instant());
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public BanditSnapshot banditSnapshot() {
        long stamp = lock.readLock();
        try {
            return banditSnapshotLocked(clock.instant());
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private BanditSnapshot banditSnapshotLocked(Instant now) {
        return new BanditSnapshot(adapter.toSnapshot(), state.rlTotalTrades, state.rlTotalReward,
            state.explorationRate, now);
    }

    /** Replaces the learner state; the trade log is trimmed to the configured cap. */
    public void restore(LearnerSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        long stamp = lock.writeLock();
        try {
            long totalTrades = state.rlTotalTrades;
            double totalReward = state.rlTotalReward;
            state.clear();
            state.rlTotalTrades = totalTrades;
            state.rlTotalReward = totalReward;

            snapshot.tradeHistory().stream()
                .filter(Objects::nonNull)
                .forEach(t -> state.append(t, config.getMaxTradeHistory()));
            restoreTable(state.regimeStats, snapshot.regimeStats());
            restoreTable(state.sessionStats, snapshot.sessionStats());
            restoreTable(state.rsiZoneStats, snapshot.rsiZoneStats());
            restoreTimeTable(state.hourStats, snapshot.hourStats());
            restoreTimeTable(state.dowStats, snapshot.dowStats());
            restoreTable(state.transitionStats, snapshot.transitionStats());
            snapshot.insights().stream()
                .filter(Objects::nonNull)
                .forEach(i -> state.appendInsight(i, config.getMaxInsights()));
            snapshot.confidenceAdjustments().forEach((strategy, adj) -> {
                if (adj != null && state.confidenceAdjustments.containsKey(strategy)) {
                    state.confidenceAdjustments.put(strategy, ConfidenceCalculator.clamp(adj));
                }
            });
            state.totalTradeCount = Math.max(snapshot.totalTradeCount(), state.history.size());
            state.explorationRate = effectiveExplorationRate(state.totalTradeCount);
            state.lastTransition = snapshot.lastRegimeTransition();
        } finally {
            lock.unlockWrite(stamp);
        }
        logger.info("📚 Learner restored: {} trades, {} insights", snapshot.tradeHistory().size(),
            snapshot.insights().size());
    }

    public void restoreBandit(BanditSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        long stamp = lock.writeLock();
        try {
            adapter.restore(snapshot.parameterAdapter());
            state.rlTotalTrades = Math.max(0, snapshot.totalTrades());
            state.rlTotalReward = Double.isFinite(snapshot.totalReward()) ? snapshot.totalReward() : 0.0;
        } finally {
            lock.unlockWrite(stamp);
        }
        logger.info("🎰 Bandit restored: {} trades analyzed, total reward {}", snapshot.totalTrades(),
            Rounding.round(snapshot.totalReward(), 4));
    }

    // ===== HELPERS =====

    private static Map<String, Map<String, PerformanceCell>> cells(Map<String, Map<String, BucketStats>> table) {
        Map<String, Map<String, PerformanceCell>> result = new TreeMap<>();
        table.forEach((outer, inner) -> {
            Map<String, PerformanceCell> row = new TreeMap<>();
            inner.forEach((key, stats) -> row.put(key, PerformanceCell.of(stats)));
            result.put(outer, row);
        });
        return result;
    }

    private static Map<String, Map<String, Map<Integer, PerformanceCell>>> timeCells(
            Map<String, Map<String, Map<Integer, BucketStats>>> table) {
        Map<String, Map<String, Map<Integer, PerformanceCell>>> result = new TreeMap<>();
        table.forEach((strategy, symbols) -> {
            Map<String, Map<Integer, PerformanceCell>> bySymbol = new TreeMap<>();
            symbols.forEach((symbol, buckets) -> {
                Map<Integer, PerformanceCell> row = new TreeMap<>();
                buckets.forEach((bucket, stats) -> row.put(bucket, PerformanceCell.of(stats)));
                bySymbol.put(symbol, row);
            });
            result.put(strategy, bySymbol);
        });
        return result;
    }

    private static Map<String, Map<String, BucketStats>> copyTable(Map<String, Map<String, BucketStats>> table) {
        Map<String, Map<String, BucketStats>> copy = new TreeMap<>();
        table.forEach((k, v) -> copy.put(k, new TreeMap<>(v)));
        return copy;
    }

    private static Map<String, Map<String, Map<Integer, BucketStats>>> copyTimeTable(
            Map<String, Map<String, Map<Integer, BucketStats>>> table) {
        Map<String, Map<String, Map<Integer, BucketStats>>> copy = new TreeMap<>();
        table.forEach((strategy, symbols) -> {
            Map<String, Map<Integer, BucketStats>> bySymbol = new TreeMap<>();
            symbols.forEach((symbol, buckets) -> bySymbol.put(symbol, new TreeMap<>(buckets)));
            copy.put(strategy, bySymbol);
        });
        return copy;
    }

    private static void restoreTable(Map<String, Map<String, BucketStats>> target,
                                     Map<String, Map<String, BucketStats>> source) {
        source.forEach((outer, inner) -> {
            if (outer == null || inner == null) {
                return;
            }
            Map<String, BucketStats> row = new TreeMap<>();
            inner.forEach((key, stats) -> {
                if (key != null && stats != null) {
                    row.put(key, stats);
                }
            });
            target.put(outer, row);
        });
    }

    private static void restoreTimeTable(Map<String, Map<String, Map<Integer, BucketStats>>> target,
                                         Map<String, Map<String, Map<Integer, BucketStats>>> source) {
        source.forEach((strategy, symbols) -> {
            if (strategy == null || symbols == null) {
                return;
            }
            Map<String, Map<Integer, BucketStats>> bySymbol = new TreeMap<>();
            symbols.forEach((symbol, buckets) -> {
                if (symbol != null && buckets != null) {
                    Map<Integer, BucketStats> row = new TreeMap<>();
                    buckets.forEach((bucket, stats) -> {
                        if (bucket != null && stats != null) {
                            row.put(bucket, stats);
                        }
                    });
                    bySymbol.put(symbol, row);
                }
            });
            target.put(strategy, bySymbol);
        });
    }
}
