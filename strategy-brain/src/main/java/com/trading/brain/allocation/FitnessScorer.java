package com.trading.brain.allocation;

import com.trading.brain.model.ConfidenceAdjustment;
import com.trading.brain.model.Rounding;
import com.trading.brain.model.StreakType;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Combines experience level, win rate, approximate profit factor, bandit expected value and
 * streak into one weighted fitness score per strategy.
 */
public final class FitnessScorer {

    public static final double WEIGHT_LEVEL = 0.20;
    public static final double WEIGHT_WIN_RATE = 0.30;
    public static final double WEIGHT_PROFIT_FACTOR = 0.20;
    public static final double WEIGHT_RL_EXPECTED = 0.20;
    public static final double WEIGHT_STREAK = 0.10;

    static final double PROFIT_FACTOR_CAP = 3.0;
    static final double PROFITABLE_NO_LOSSES = 0.7;
    static final double NO_PROFIT_FACTOR_DATA = 0.3;
    static final double NEUTRAL = 0.5;
    static final double STREAK_STEP = 0.1;

    private FitnessScorer() {}

    public static Map<String, Double> weights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("level", WEIGHT_LEVEL);
        weights.put("win_rate", WEIGHT_WIN_RATE);
        weights.put("profit_factor", WEIGHT_PROFIT_FACTOR);
        weights.put("rl_expected", WEIGHT_RL_EXPECTED);
        weights.put("streak", WEIGHT_STREAK);
        return weights;
    }

    /**
     * @param facts      experience facts of the strategy
     * @param adjustment current confidence adjustment, may be null; its preset expected value
     *                   feeds the bandit term (0.5 when absent)
     */
    public static FitnessScore score(ExperienceFacts facts, ConfidenceAdjustment adjustment) {
        ExperienceFacts f = facts != null ? facts : ExperienceFacts.newcomer();

        double levelScore = f.level() / 10.0;
        double winRateScore = Math.min(1.0, f.winRate());
        double profitFactorScore = profitFactorScore(f);
        double rlExpected = adjustment != null ? adjustment.presetExpectedValue() : NEUTRAL;
        double rlScore = Rounding.clamp(rlExpected, 0.0, 1.0);
        double streakScore = streakScore(f.currentStreakType(), f.currentStreak());

        double composite = WEIGHT_LEVEL * levelScore
            + WEIGHT_WIN_RATE * winRateScore
            + WEIGHT_PROFIT_FACTOR * profitFactorScore
            + WEIGHT_RL_EXPECTED * rlScore
            + WEIGHT_STREAK * streakScore;

        Map<String, FitnessComponent> breakdown = new LinkedHashMap<>();
        breakdown.put("level", new FitnessComponent(
            String.valueOf(f.level()), Rounding.round(levelScore, 3), WEIGHT_LEVEL));
        breakdown.put("win_rate", new FitnessComponent(
            fmt(f.winRate(), 3), Rounding.round(winRateScore, 3), WEIGHT_WIN_RATE));
        breakdown.put("profit_factor", new FitnessComponent(
            fmt(profitFactorScore * PROFIT_FACTOR_CAP, 2), Rounding.round(profitFactorScore, 3), WEIGHT_PROFIT_FACTOR));
        breakdown.put("rl_expected", new FitnessComponent(
            fmt(rlExpected, 3), Rounding.round(rlScore, 3), WEIGHT_RL_EXPECTED));
        breakdown.put("streak", new FitnessComponent(
            f.currentStreakType().key() + ":" + f.currentStreak(), Rounding.round(streakScore, 3), WEIGHT_STREAK));

        return new FitnessScore(Rounding.round(composite, 4), breakdown, f.totalTrades(),
            Rounding.round(f.totalProfit(), 2));
    }

    static double profitFactorScore(ExperienceFacts facts) {
        if (facts.wins() > 0 && facts.losses() > 0) {
            double profitFactor = (double) facts.wins() / facts.losses();
            return Math.min(1.0, profitFactor / PROFIT_FACTOR_CAP);
        }
        if (facts.totalProfit() > 0) {
            return PROFITABLE_NO_LOSSES;
        }
        return NO_PROFIT_FACTOR_DATA;
    }

    static double streakScore(StreakType type, int length) {
        if (type == StreakType.WIN) {
            return Math.min(1.0, NEUTRAL + length * STREAK_STEP);
        }
        if (type == StreakType.LOSS) {
            return Math.max(0.0, NEUTRAL - length * STREAK_STEP);
        }
        return NEUTRAL;
    }

    private static String fmt(double value, int places) {
        return String.format(Locale.ROOT, "%." + places + "f", value);
    }
}
