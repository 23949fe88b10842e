package com.trading.brain.learning;

import com.trading.brain.model.ClosedTrade;
import com.trading.brain.model.Rounding;

/**
 * Turns a closed trade into the scalar reward the bandit learns from.
 *
 * reward = R-multiple + win bonus + time bonus, rounded to 4 decimals.
 */
public final class RewardCalculator {

    static final double WIN_BONUS = 0.2;
    static final double LOSS_PENALTY = -0.1;
    static final double FAST_TRADE_BONUS = 0.1;
    static final long FAST_TRADE_SECONDS = 1800;

    private RewardCalculator() {}

    public static double calculate(ClosedTrade trade) {
        return calculate(trade.profit(), trade.stopLossDistanceOrDefault(), trade.durationSecondsOrDefault());
    }

    public static double calculate(double profit, double stopLossDistance, long durationSeconds) {
        double rMultiple = stopLossDistance > 0 ? profit / stopLossDistance : 0.0;
        double winBonus = profit > 0 ? WIN_BONUS : LOSS_PENALTY;
        double timeBonus = durationSeconds < FAST_TRADE_SECONDS ? FAST_TRADE_BONUS : 0.0;
        return Rounding.round(rMultiple + winBonus + timeBonus, 4);
    }
}
