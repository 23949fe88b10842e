package com.trading.brain.learning;

import com.trading.brain.model.BucketStats;
import com.trading.brain.model.RegimeTransition;
import com.trading.brain.model.RsiZone;
import com.trading.brain.model.TradeInsight;
import com.trading.brain.model.TradeOutcome;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable learning state owned by {@link TradeLearner}. Every derived statistic comes from
 * the capped trade log and the aggregate tables kept here. Guarded by the learner's lock.
 */
final class LearnerState {

    static final Duration TRANSITION_WINDOW = Duration.ofMinutes(60);

    final ArrayDeque<TradeOutcome> history = new ArrayDeque<>();

    // strategy -> regime / session / rsi zone -> stats
    final Map<String, Map<String, BucketStats>> regimeStats = new TreeMap<>();
    final Map<String, Map<String, BucketStats>> sessionStats = new TreeMap<>();
    final Map<String, Map<String, BucketStats>> rsiZoneStats = new TreeMap<>();

    // strategy -> symbol -> UTC hour (0-23) / ISO weekday (1-7) -> stats
    final Map<String, Map<String, Map<Integer, BucketStats>>> hourStats = new TreeMap<>();
    final Map<String, Map<String, Map<Integer, BucketStats>>> dowStats = new TreeMap<>();

    // "FROM->TO" -> strategy -> stats
    final Map<String, Map<String, BucketStats>> transitionStats = new TreeMap<>();

    final ArrayDeque<TradeInsight> insights = new ArrayDeque<>();
    final Map<String, Double> confidenceAdjustments = new LinkedHashMap<>();

    long totalTradeCount;
    double explorationRate;
    RegimeTransition lastTransition;

    long rlTotalTrades;
    double rlTotalReward;

    void append(TradeOutcome outcome, int maxHistory) {
        history.addLast(outcome);
        while (history.size() > maxHistory) {
            history.removeFirst();
        }
    }

    void appendInsight(TradeInsight insight, int maxInsights) {
        insights.addLast(insight);
        while (insights.size() > maxInsights) {
            insights.removeFirst();
        }
    }

    void accumulate(TradeOutcome outcome) {
        String strategy = outcome.strategy();
        merge(regimeStats, strategy, outcome.regime(), outcome);
        merge(sessionStats, strategy, outcome.session(), outcome);
        merge(rsiZoneStats, strategy, outcome.indicators().rsiZone().key(), outcome);

        ZonedDateTime utc = outcome.timestamp().atZone(ZoneOffset.UTC);
        mergeTimeBucket(hourStats, outcome, utc.getHour());
        mergeTimeBucket(dowStats, outcome, utc.getDayOfWeek().getValue());

        if (isWithinTransitionWindow(outcome.timestamp())) {
            transitionStats.computeIfAbsent(lastTransition.key(), k -> new TreeMap<>())
                .merge(strategy, single(outcome), BucketStats::plus);
        }
    }

    /** True when {@code at} lies in the 60 minutes following the last regime change. */
    boolean isWithinTransitionWindow(Instant at) {
        if (lastTransition == null || lastTransition.changedAt() == null) {
            return false;
        }
        Duration elapsed = Duration.between(lastTransition.changedAt(), at);
        return !elapsed.isNegative() && elapsed.compareTo(TRANSITION_WINDOW) <= 0;
    }

    /** Regime of the most recent trade, or null on an empty log. */
    String currentRegime() {
        TradeOutcome last = history.peekLast();
        return last != null ? last.regime() : null;
    }

    /** Last {@code n} trades in chronological order. */
    List<TradeOutcome> recent(int n) {
        List<TradeOutcome> result = new ArrayList<>(Math.min(n, history.size()));
        int skip = Math.max(0, history.size() - n);
        Iterator<TradeOutcome> it = history.iterator();
        for (int i = 0; it.hasNext(); i++) {
            TradeOutcome trade = it.next();
            if (i >= skip) {
                result.add(trade);
            }
        }
        return result;
    }

    /** Newest-first walk over at most {@code n} trades of one strategy. */
    List<TradeOutcome> latestForStrategy(String strategy, int n) {
        List<TradeOutcome> result = new ArrayList<>();
        Iterator<TradeOutcome> it = history.descendingIterator();
        while (it.hasNext() && result.size() < n) {
            TradeOutcome trade = it.next();
            if (trade.strategy().equals(strategy)) {
                result.add(trade);
            }
        }
        return result;
    }

    BucketStats rsiZoneBucket(String strategy, RsiZone zone) {
        return rsiZoneStats.getOrDefault(strategy, Map.of()).getOrDefault(zone.key(), BucketStats.EMPTY);
    }

    BucketStats transitionBucket(String strategy) {
        if (lastTransition == null) {
            return BucketStats.EMPTY;
        }
        return transitionStats.getOrDefault(lastTransition.key(), Map.of()).getOrDefault(strategy, BucketStats.EMPTY);
    }

    void clear() {
        history.clear();
        regimeStats.clear();
        sessionStats.clear();
        rsiZoneStats.clear();
        hourStats.clear();
        dowStats.clear();
        transitionStats.clear();
        insights.clear();
        confidenceAdjustments.replaceAll((k, v) -> 0.0);
        totalTradeCount = 0;
        lastTransition = null;
        rlTotalTrades = 0;
        rlTotalReward = 0.0;
    }

    static String weekdayName(DayOfWeek day) {
        String name = day.name();
        return name.charAt(0) + name.substring(1).toLowerCase();
    }

    private static void merge(Map<String, Map<String, BucketStats>> table, String strategy, String bucket,
                              TradeOutcome outcome) {
        table.computeIfAbsent(strategy, k -> new TreeMap<>()).merge(bucket, single(outcome), BucketStats::plus);
    }

    private static void mergeTimeBucket(Map<String, Map<String, Map<Integer, BucketStats>>> table,
                                        TradeOutcome outcome, int bucket) {
        table.computeIfAbsent(outcome.strategy(), k -> new TreeMap<>())
            .computeIfAbsent(outcome.symbol(), k -> new TreeMap<>())
            .merge(bucket, single(outcome), BucketStats::plus);
    }

    private static BucketStats single(TradeOutcome outcome) {
        return BucketStats.EMPTY.record(outcome.won(), outcome.profit());
    }
}
