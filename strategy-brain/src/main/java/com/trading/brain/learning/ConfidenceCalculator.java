package com.trading.brain.learning;

import com.trading.brain.config.BrainConfig;
import com.trading.brain.model.BucketStats;
import com.trading.brain.model.ConfidenceAdjustment;
import com.trading.brain.model.Rounding;
import com.trading.brain.model.StreakInfo;
import com.trading.brain.model.StreakType;
import com.trading.brain.model.TradeOutcome;
import com.trading.brain.patterns.PatternDetector;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the bounded per-strategy confidence bias from recent win rate, streaks and the
 * bandit's expected values. Stateless: everything is read from {@link LearnerState}.
 */
final class ConfidenceCalculator {

    static final double MAX_ADJUSTMENT = 0.3;

    private static final double WIN_RATE_SCALE = 0.4;
    private static final double LOSS_STREAK_STEP = 0.05;
    private static final double WIN_STREAK_STEP = 0.02;
    private static final int MAX_STREAK_STEPS = 3;
    private static final double BANDIT_SCALE = 0.2;

    private static final int REGIME_WINDOW = 50;
    private static final int OVERALL_WINDOW = 30;
    private static final double REGIME_STRONG = 0.60;
    private static final double REGIME_WEAK = 0.35;
    private static final double REGIME_BUMP = 0.2;
    private static final double OVERALL_STRONG = 0.65;
    private static final double OVERALL_WEAK = 0.35;

    private static final int TIME_BUCKET_MIN_TRADES = 8;
    private static final double TIME_BUCKET_WEAK = 0.30;
    private static final double TIME_BUCKET_PENALTY = 0.1;
    private static final int TRANSITION_MIN_TRADES = 5;
    private static final double TRANSITION_WEAK = 0.35;
    private static final double TRANSITION_PENALTY = 0.15;

    private final BrainConfig config;
    private final ParameterAdapter adapter;

    ConfidenceCalculator(BrainConfig config, ParameterAdapter adapter) {
        this.config = config;
        this.adapter = adapter;
    }

    /**
     * Recomputes the raw adjustment of every configured strategy. A strategy with fewer than
     * the minimum trades in its lookback window keeps its previous value.
     */
    Map<String, Double> recompute(LearnerState state) {
        Map<String, Double> result = new LinkedHashMap<>();
        if (state.history.isEmpty()) {
            config.getStrategyCodes().forEach(code -> result.put(code, 0.0));
            return result;
        }

        Map<String, StreakInfo> streaks = PatternDetector.detectStreaks(state.history);
        String currentRegime = state.currentRegime();

        for (String strategy : config.getStrategyCodes()) {
            double previous = state.confidenceAdjustments.getOrDefault(strategy, 0.0);
            List<TradeOutcome> trades = state.latestForStrategy(strategy, config.getConfidenceLookback());
            if (trades.size() < config.getMinTradesForAdjustment()) {
                result.put(strategy, previous);
                continue;
            }

            double adj = (winRate(trades) - 0.5) * WIN_RATE_SCALE;
            adj += streakModifier(streaks.getOrDefault(strategy, StreakInfo.NONE));
            if (currentRegime != null) {
                adj += (adapter.bestExpected(strategy, currentRegime).expectedValue() - 0.5) * BANDIT_SCALE;
            }
            result.put(strategy, clamp(adj));
        }
        return result;
    }

    double streakModifier(StreakInfo streak) {
        int threshold = config.getStreakWarningThreshold();
        int steps = Math.min(streak.currentStreak() - 2, MAX_STREAK_STEPS);
        if (streak.isLosingStreakOf(threshold)) {
            return -LOSS_STREAK_STEP * steps;
        }
        if (streak.isWinningStreakOf(threshold)) {
            return WIN_STREAK_STEP * steps;
        }
        return 0.0;
    }

    /**
     * Display-oriented adjustments with reasons. Starts from the stored raw value and adds the
     * in-regime bump plus the hour, weekday and transition penalties, then clamps again.
     */
    Map<String, ConfidenceAdjustment> describe(LearnerState state, Instant now) {
        Map<String, StreakInfo> streaks = PatternDetector.detectStreaks(state.history);
        String regime = state.currentRegime() != null ? state.currentRegime() : TradeOutcome.UNKNOWN;
        List<TradeOutcome> regimeWindow = state.recent(REGIME_WINDOW);
        List<TradeOutcome> overallWindow = state.recent(OVERALL_WINDOW);
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        boolean inTransition = state.isWithinTransitionWindow(now);
        int minTrades = config.getMinTradesForAdjustment();

        Map<String, ConfidenceAdjustment> result = new LinkedHashMap<>();
        for (String strategy : config.getStrategyCodes()) {
            double adj = state.confidenceAdjustments.getOrDefault(strategy, 0.0);
            List<String> reasons = new ArrayList<>();

            BucketStats inRegime = bucket(regimeWindow, strategy, regime);
            if (inRegime.total() > 0) {
                String counts = inRegime.wins() + "/" + inRegime.total() + " wins";
                double rate = inRegime.winRate();
                if (rate > REGIME_STRONG && inRegime.total() >= minTrades) {
                    reasons.add("strong in " + regime + " (" + counts + ")");
                    adj += REGIME_BUMP;
                } else if (rate < REGIME_WEAK && inRegime.total() >= minTrades) {
                    reasons.add("weak in " + regime + " (" + counts + ")");
                    adj -= REGIME_BUMP;
                } else {
                    reasons.add("moderate in " + regime + " (" + counts + ")");
                }
            } else {
                reasons.add("no trades in " + regime + " yet (exploring)");
            }

            BucketStats overall = bucket(overallWindow, strategy, null);
            if (overall.total() > 0) {
                String counts = overall.wins() + "/" + overall.total() + " wins";
                if (overall.winRate() >= OVERALL_STRONG) {
                    reasons.add("strong overall (" + counts + ")");
                } else if (overall.winRate() <= OVERALL_WEAK) {
                    reasons.add("poor overall (" + counts + ")");
                }
            }

            StreakInfo streak = streaks.getOrDefault(strategy, StreakInfo.NONE);
            if (streak.currentStreak() >= config.getStreakWarningThreshold()) {
                reasons.add(streak.currentStreak() + "-trade " + (streak.type() == StreakType.LOSS ? "losing" : "winning") + " streak");
            }

            BucketStats hour = PatternDetector.aggregate(
                state.hourStats.getOrDefault(strategy, Map.of()).values(), utc.getHour());
            if (hour.total() >= TIME_BUCKET_MIN_TRADES && hour.winRate() < TIME_BUCKET_WEAK) {
                adj -= TIME_BUCKET_PENALTY;
                reasons.add(String.format(Locale.ROOT, "poor at hour %02d:00 UTC (%d/%d wins, %s)",
                    utc.getHour(), hour.wins(), hour.total(), pct(hour.winRate())));
            }

            BucketStats day = PatternDetector.aggregate(
                state.dowStats.getOrDefault(strategy, Map.of()).values(), utc.getDayOfWeek().getValue());
            if (day.total() >= TIME_BUCKET_MIN_TRADES && day.winRate() < TIME_BUCKET_WEAK) {
                adj -= TIME_BUCKET_PENALTY;
                reasons.add(String.format(Locale.ROOT, "poor on %s (%d/%d wins, %s)",
                    LearnerState.weekdayName(utc.getDayOfWeek()), day.wins(), day.total(), pct(day.winRate())));
            }

            if (inTransition) {
                BucketStats transition = state.transitionBucket(strategy);
                if (transition.total() >= TRANSITION_MIN_TRADES && transition.winRate() < TRANSITION_WEAK) {
                    adj -= TRANSITION_PENALTY;
                    reasons.add(String.format(Locale.ROOT, "transition penalty: %d/%d wins after %s (%s)",
                        transition.wins(), transition.total(), state.lastTransition.key(), pct(transition.winRate())));
                }
            }

            ParameterAdapter.BestPreset best = adapter.bestExpected(strategy, regime);
            reasons.add(String.format(Locale.ROOT, "RL favors '%s' (EV: %s)",
                best.preset().key(), pct(best.expectedValue())));

            result.put(strategy, new ConfidenceAdjustment(
                clamp(adj),
                capitalize(String.join("; ", reasons)),
                best.preset().key(),
                Rounding.round(best.expectedValue(), 3)));
        }
        return result;
    }

    static double clamp(double adj) {
        return Rounding.round(Rounding.clamp(adj, -MAX_ADJUSTMENT, MAX_ADJUSTMENT), 3);
    }

    private static BucketStats bucket(List<TradeOutcome> window, String strategy, String regime) {
        BucketStats stats = BucketStats.EMPTY;
        for (TradeOutcome trade : window) {
            if (trade.strategy().equals(strategy) && (regime == null || trade.regime().equals(regime))) {
                stats = stats.record(trade.won(), trade.profit());
            }
        }
        return stats;
    }

    private static double winRate(List<TradeOutcome> trades) {
        long wins = trades.stream().filter(TradeOutcome::won).count();
        return Rounding.safeDiv(wins, trades.size());
    }

    private static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    static String pct(double rate) {
        return String.format(Locale.ROOT, "%.0f%%", rate * 100);
    }
}
