package com.trading.brain.learning;

import com.trading.brain.model.Rounding;
import com.trading.brain.model.StreakInfo;
import com.trading.brain.model.TradeOutcome;

import java.util.Locale;
import java.util.Set;

/**
 * Explains a single trade outcome in one or two sentences and suggests a confidence nudge.
 */
final class InsightGenerator {

    private static final Set<String> TRENDING = Set.of("TRENDING_UP", "TRENDING_DOWN");

    record Insight(String text, double adjustment) {}

    private final int streakThreshold;

    InsightGenerator(int streakThreshold) {
        this.streakThreshold = streakThreshold;
    }

    Insight explain(TradeOutcome trade, StreakInfo streak) {
        String strategy = trade.strategy();
        String regime = trade.regime();
        Double rsi = trade.rsi();
        Double adx = trade.adx();

        StringBuilder text = new StringBuilder()
            .append("Strategy ").append(strategy)
            .append(trade.won() ? " won" : " lost")
            .append(" in ").append(regime)
            .append(" during ").append(trade.session());
        if (rsi != null) {
            text.append(String.format(Locale.ROOT, " with RSI %.0f", rsi));
        }
        if (adx != null) {
            text.append(String.format(Locale.ROOT, " (ADX %.0f)", adx));
        }
        text.append(". ");

        double adjustment;
        if (!trade.won()) {
            if ("B".equals(strategy) && TRENDING.contains(regime)) {
                text.append("Mean reversion underperforms in strong trends.");
                adjustment = -0.1;
            } else if ("A".equals(strategy) && "RANGING".equals(regime)) {
                text.append("Trend following struggles in ranging conditions.");
                adjustment = -0.1;
            } else if ("C".equals(strategy) && "QUIET".equals(regime)) {
                text.append("Breakout strategies fail in low-volatility environments.");
                adjustment = -0.08;
            } else if (adx != null && adx < 20) {
                text.append(String.format(Locale.ROOT, "Weak trend strength (ADX %.0f) didn't support the setup.", adx));
                adjustment = -0.05;
            } else if (rsi != null && rsi < 25) {
                text.append("Deeply oversold RSI didn't produce the expected reversal.");
                adjustment = -0.05;
            } else {
                text.append(String.format(Locale.ROOT, "$%.2f loss recorded. Monitoring for pattern.", Math.abs(trade.profit())));
                adjustment = -0.03;
            }
        } else {
            if ("A".equals(strategy) && TRENDING.contains(regime)) {
                text.append("Trend following shines in directional markets.");
                adjustment = 0.05;
            } else if ("B".equals(strategy) && "RANGING".equals(regime)) {
                text.append("Mean reversion works well in range-bound conditions.");
                adjustment = 0.05;
            } else if ("D".equals(strategy) && rsi != null && (rsi < 30 || rsi > 70)) {
                text.append("Volatility harvesting at RSI extremes paid off.");
                adjustment = 0.05;
            } else {
                text.append(String.format(Locale.ROOT, "+$%.2f profit. Reinforcing confidence.", trade.profit()));
                adjustment = 0.03;
            }
        }

        if (streak.isLosingStreakOf(streakThreshold)) {
            text.append(" WARNING: ").append(streak.currentStreak())
                .append(" consecutive losses for Strategy ").append(strategy).append('.');
            adjustment = Math.min(adjustment, -0.1);
        } else if (streak.isWinningStreakOf(streakThreshold)) {
            text.append(" Hot streak: ").append(streak.currentStreak())
                .append(" wins in a row for Strategy ").append(strategy).append('.');
            adjustment = Math.max(adjustment, 0.05);
        }

        return new Insight(text.toString(), Rounding.round(adjustment, 3));
    }
}
