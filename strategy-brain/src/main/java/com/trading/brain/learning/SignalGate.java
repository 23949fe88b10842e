package com.trading.brain.learning;

import com.trading.brain.config.BrainConfig;
import com.trading.brain.model.BucketStats;
import com.trading.brain.model.IndicatorSnapshot;
import com.trading.brain.model.RsiZone;
import com.trading.brain.model.SignalDecision;
import com.trading.brain.model.SignalDecision.GateCheck;
import com.trading.brain.model.StreakInfo;
import com.trading.brain.model.TradeOutcome;
import com.trading.brain.patterns.PatternDetector;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a pending entry signal should be suppressed. Checks run in a fixed order
 * and the first one that matches decides. Pure read over the learner state apart from the
 * exploration draw.
 */
final class SignalGate {

    static final double REGIME_WIN_RATE_FLOOR = 0.25;
    static final int REGIME_MIN_TRADES = 5;
    static final int LOSS_STREAK_LIMIT = 4;
    static final double RSI_ZONE_FLOOR = 0.15;
    static final double BANDIT_FLOOR = 0.25;
    static final int BANDIT_MIN_TRADES = 10;

    private static final int WINDOW = 50;

    private final BrainConfig config;
    private final ParameterAdapter adapter;
    private final RandomGenerator random;

    SignalGate(BrainConfig config, ParameterAdapter adapter, RandomGenerator random) {
        this.config = config;
        this.adapter = adapter;
        this.random = random;
    }

    SignalDecision evaluate(LearnerState state, String strategy, String regime,
                            IndicatorSnapshot indicators, double explorationRate) {
        // Exploration comes first so poor history never blocks data gathering.
        if (random.nextDouble() < explorationRate) {
            return SignalDecision.of(GateCheck.EXPLORATION,
                "RL exploration: allowing signal despite potential concerns (exploration rate)");
        }

        BucketStats inRegime = BucketStats.EMPTY;
        List<TradeOutcome> window = state.recent(WINDOW);
        for (TradeOutcome trade : window) {
            if (trade.strategy().equals(strategy) && trade.regime().equals(regime)) {
                inRegime = inRegime.record(trade.won(), trade.profit());
            }
        }

        int minTrades = config.getMinTradesForAdjustment();
        if (inRegime.total() < minTrades) {
            return SignalDecision.of(GateCheck.INSUFFICIENT_DATA, "Insufficient data to override");
        }

        double winRate = inRegime.winRate();
        int total = inRegime.total();
        if (winRate < REGIME_WIN_RATE_FLOOR && total >= REGIME_MIN_TRADES) {
            return SignalDecision.of(GateCheck.REGIME_WIN_RATE, String.format(Locale.ROOT,
                "RL override: Strategy %s has %s win rate in %s over %d trades (below %s threshold). Signal skipped.",
                strategy, pct(winRate), regime, total, pct(REGIME_WIN_RATE_FLOOR)));
        }
        if (winRate == 0.0 && total >= REGIME_MIN_TRADES) {
            return SignalDecision.of(GateCheck.REGIME_ZERO_WINS, String.format(Locale.ROOT,
                "RL override: Strategy %s has 0%% win rate in %s over last %d trades. Skipping signal.",
                strategy, regime, total));
        }

        StreakInfo streak = PatternDetector.detectStreaks(state.history).getOrDefault(strategy, StreakInfo.NONE);
        if (streak.isLosingStreakOf(LOSS_STREAK_LIMIT)) {
            return SignalDecision.of(GateCheck.LOSS_STREAK, String.format(Locale.ROOT,
                "RL override: Strategy %s is on a %d-trade losing streak (threshold: %d). "
                    + "Signal overridden until streak breaks.",
                strategy, streak.currentStreak(), LOSS_STREAK_LIMIT));
        }

        IndicatorSnapshot snapshot = indicators != null ? indicators : IndicatorSnapshot.empty();
        RsiZone zone = snapshot.rsiZone();
        if (zone != RsiZone.UNKNOWN) {
            BucketStats zoneStats = state.rsiZoneBucket(strategy, zone);
            if (zoneStats.total() >= minTrades && zoneStats.winRate() <= RSI_ZONE_FLOOR) {
                return SignalDecision.of(GateCheck.RSI_ZONE, String.format(Locale.ROOT,
                    "RL override: Strategy %s has %s win rate in %s RSI zone. Skipping signal.",
                    strategy, pct(zoneStats.winRate()), zone.key()));
            }
        }

        double bestEv = adapter.bestExpected(strategy, regime).expectedValue();
        if (bestEv < BANDIT_FLOOR && total >= BANDIT_MIN_TRADES) {
            return SignalDecision.of(GateCheck.BANDIT_PESSIMISM, String.format(Locale.ROOT,
                "RL override: Thompson Sampling shows very low expected value (%s) for %s in %s. Signal skipped.",
                pct(bestEv), strategy, regime));
        }

        return SignalDecision.of(GateCheck.APPROVED, "Signal approved by RL learning engine");
    }

    private static String pct(double rate) {
        return String.format(Locale.ROOT, "%.0f%%", rate * 100);
    }
}
