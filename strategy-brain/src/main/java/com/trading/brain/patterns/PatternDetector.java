package com.trading.brain.patterns;

import com.trading.brain.model.BucketStats;
import com.trading.brain.model.StreakInfo;
import com.trading.brain.model.StreakType;
import com.trading.brain.model.TradeOutcome;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stateless pattern recognition over the chronologically ordered trade log.
 * Produces streak data used by the confidence engine and advisory sentences for dashboards.
 */
public final class PatternDetector {

    public static final int DEFAULT_MIN_TRADES = 5;

    private static final double EXCELS = 0.65;
    private static final double STRUGGLES = 0.35;
    private static final int MEMORY_MIN_TRADES = 3;
    private static final int TIME_BUCKET_MIN_TRADES = 8;

    private static final Map<String, String> SESSION_HOURS = Map.of(
        "ASIAN", "00:00-08:00 UTC",
        "LONDON", "08:00-16:00 UTC",
        "NEWYORK", "13:00-22:00 UTC"
    );

    private PatternDetector() {}

    // ===== STREAKS =====

    /**
     * Current and maximum win/loss streaks per strategy. The current streak is the
     * longest suffix of identical outcomes.
     */
    public static Map<String, StreakInfo> detectStreaks(Collection<TradeOutcome> history) {
        Map<String, List<Boolean>> outcomesByStrategy = new TreeMap<>();
        for (TradeOutcome trade : history) {
            outcomesByStrategy.computeIfAbsent(trade.strategy(), k -> new ArrayList<>()).add(trade.won());
        }

        Map<String, StreakInfo> result = new TreeMap<>();
        outcomesByStrategy.forEach((strategy, outcomes) -> result.put(strategy, streakOf(outcomes)));
        return result;
    }

    static StreakInfo streakOf(List<Boolean> outcomes) {
        if (outcomes.isEmpty()) {
            return StreakInfo.NONE;
        }
        int maxWin = 0;
        int maxLoss = 0;
        int runWin = 0;
        int runLoss = 0;
        for (boolean won : outcomes) {
            if (won) {
                runWin++;
                runLoss = 0;
                maxWin = Math.max(maxWin, runWin);
            } else {
                runLoss++;
                runWin = 0;
                maxLoss = Math.max(maxLoss, runLoss);
            }
        }

        boolean last = outcomes.get(outcomes.size() - 1);
        int current = 1;
        for (int i = outcomes.size() - 2; i >= 0 && outcomes.get(i) == last; i--) {
            current++;
        }
        return new StreakInfo(current, last ? StreakType.WIN : StreakType.LOSS, maxWin, maxLoss);
    }

    // ===== REGIME BIAS =====

    public static List<String> detectRegimeBias(Collection<TradeOutcome> history, int minTrades) {
        if (history.isEmpty()) {
            return List.of("Not enough trade data yet to detect regime bias.");
        }

        Map<String, Map<String, BucketStats>> stats = new TreeMap<>();
        for (TradeOutcome trade : history) {
            stats.computeIfAbsent(trade.strategy(), k -> new LinkedHashMap<>())
                .merge(trade.regime(), BucketStats.EMPTY.record(trade.won(), trade.profit()), BucketStats::plus);
        }

        List<String> insights = new ArrayList<>();
        stats.forEach((strategy, regimes) -> regimes.forEach((regime, bucket) -> {
            if (bucket.total() < minTrades) {
                return;
            }
            double rate = bucket.winRate();
            if (rate >= EXCELS) {
                insights.add(String.format(Locale.ROOT,
                    "Strategy %s excels in %s (%s win rate over %d trades, avg profit $%+.2f)",
                    strategy, regime, pct(rate), bucket.total(), bucket.avgProfit()));
            } else if (rate <= STRUGGLES) {
                insights.add(String.format(Locale.ROOT,
                    "Strategy %s struggles in %s (%s win rate over %d trades, avg loss $%+.2f)",
                    strategy, regime, pct(rate), bucket.total(), bucket.avgProfit()));
            }
        }));

        if (insights.isEmpty()) {
            return List.of("Regime bias patterns are still forming. Need more trades per regime.");
        }
        return insights;
    }

    // ===== SESSIONS =====

    public static List<String> detectTimePatterns(Collection<TradeOutcome> history, int minTrades) {
        if (history.isEmpty()) {
            return List.of("Not enough trade data yet to detect time patterns.");
        }

        Map<String, BucketStats> bySession = new LinkedHashMap<>();
        Map<String, Map<String, BucketStats>> byStrategySession = new TreeMap<>();
        for (TradeOutcome trade : history) {
            BucketStats one = BucketStats.EMPTY.record(trade.won(), trade.profit());
            bySession.merge(trade.session(), one, BucketStats::plus);
            byStrategySession.computeIfAbsent(trade.strategy(), k -> new LinkedHashMap<>())
                .merge(trade.session(), one, BucketStats::plus);
        }

        List<String> insights = new ArrayList<>();

        String bestSession = null;
        double bestRate = 0.0;
        for (Map.Entry<String, BucketStats> e : bySession.entrySet()) {
            if (e.getValue().total() < minTrades) {
                continue;
            }
            double rate = e.getValue().winRate();
            if (rate > bestRate) {
                bestRate = rate;
                bestSession = e.getKey();
            }
        }
        if (bestSession != null && bestRate > 0.5) {
            insights.add(String.format(Locale.ROOT,
                "Most winning trades occur during %s session (%s) with %s win rate over %d trades",
                bestSession, SESSION_HOURS.getOrDefault(bestSession, ""), pct(bestRate),
                bySession.get(bestSession).total()));
        }

        byStrategySession.forEach((strategy, sessions) -> sessions.forEach((session, bucket) -> {
            if (bucket.total() < minTrades) {
                return;
            }
            double rate = bucket.winRate();
            String hours = SESSION_HOURS.getOrDefault(session, "");
            if (rate >= 0.70) {
                insights.add(String.format(Locale.ROOT,
                    "Strategy %s performs best during %s session (%s): %s win rate over %d trades",
                    strategy, session, hours, pct(rate), bucket.total()));
            } else if (rate <= 0.30) {
                insights.add(String.format(Locale.ROOT,
                    "Strategy %s underperforms during %s session (%s): %s win rate over %d trades",
                    strategy, session, hours, pct(rate), bucket.total()));
            }
        }));

        if (insights.isEmpty()) {
            return List.of("Session-based patterns are still forming. Need more data per session.");
        }
        return insights;
    }

    // ===== INDICATORS =====

    private enum RsiBand {
        DEEPLY_OVERSOLD(0, 25, "RSI < 25"),
        OVERSOLD(25, 30, "RSI 25-30"),
        LOW_NEUTRAL(30, 45, "RSI 30-45"),
        NEUTRAL(45, 55, "RSI 45-55"),
        HIGH_NEUTRAL(55, 70, "RSI 55-70"),
        OVERBOUGHT(70, 75, "RSI 70-75"),
        DEEPLY_OVERBOUGHT(75, Double.POSITIVE_INFINITY, "RSI > 75");

        final double low;
        final double high;
        final String label;

        RsiBand(double low, double high, String label) {
            this.low = low;
            this.high = high;
            this.label = label;
        }
    }

    private enum AdxBand {
        WEAK(0, 20, "ADX < 20 (weak trend)"),
        MODERATE(20, 30, "ADX 20-30 (moderate trend)"),
        STRONG(30, 40, "ADX 30-40 (strong trend)"),
        VERY_STRONG(40, Double.POSITIVE_INFINITY, "ADX > 40 (very strong trend)");

        final double low;
        final double high;
        final String label;

        AdxBand(double low, double high, String label) {
            this.low = low;
            this.high = high;
            this.label = label;
        }
    }

    public static List<String> detectIndicatorPatterns(Collection<TradeOutcome> history, int minTrades) {
        if (history.isEmpty()) {
            return List.of("Not enough trade data yet to detect indicator patterns.");
        }

        Map<RsiBand, BucketStats> rsiBands = new LinkedHashMap<>();
        Map<AdxBand, BucketStats> adxBands = new LinkedHashMap<>();
        Map<String, BucketStats> oversoldByStrategy = new TreeMap<>();

        for (TradeOutcome trade : history) {
            BucketStats one = BucketStats.EMPTY.record(trade.won(), trade.profit());
            Double rsi = trade.rsi();
            Double adx = trade.adx();
            if (rsi != null) {
                for (RsiBand band : RsiBand.values()) {
                    if (band.low <= rsi && rsi < band.high) {
                        rsiBands.merge(band, one, BucketStats::plus);
                        break;
                    }
                }
                if (rsi < 30) {
                    oversoldByStrategy.merge(trade.strategy(), one, BucketStats::plus);
                }
            }
            if (adx != null) {
                for (AdxBand band : AdxBand.values()) {
                    if (band.low <= adx && adx < band.high) {
                        adxBands.merge(band, one, BucketStats::plus);
                        break;
                    }
                }
            }
        }

        List<String> insights = new ArrayList<>();
        for (RsiBand band : RsiBand.values()) {
            BucketStats bucket = rsiBands.getOrDefault(band, BucketStats.EMPTY);
            if (bucket.total() < minTrades) {
                continue;
            }
            double rate = bucket.winRate();
            if (rate >= EXCELS) {
                insights.add(String.format(Locale.ROOT, "Trades entered when %s have %s win rate (%d trades)",
                    band.label, pct(rate), bucket.total()));
            } else if (rate <= STRUGGLES) {
                insights.add(String.format(Locale.ROOT,
                    "Trades entered when %s have poor results: only %s win rate (%d trades)",
                    band.label, pct(rate), bucket.total()));
            }
        }
        for (AdxBand band : AdxBand.values()) {
            BucketStats bucket = adxBands.getOrDefault(band, BucketStats.EMPTY);
            if (bucket.total() < minTrades) {
                continue;
            }
            double rate = bucket.winRate();
            if (rate >= EXCELS) {
                insights.add(String.format(Locale.ROOT, "%s significantly improves trade outcomes: %s win rate (%d trades)",
                    band.label, pct(rate), bucket.total()));
            } else if (rate <= STRUGGLES) {
                insights.add(String.format(Locale.ROOT, "%s correlates with poor outcomes: only %s win rate (%d trades)",
                    band.label, pct(rate), bucket.total()));
            }
        }
        oversoldByStrategy.forEach((strategy, bucket) -> {
            if (bucket.total() < minTrades) {
                return;
            }
            double rate = bucket.winRate();
            if (rate >= EXCELS) {
                insights.add(String.format(Locale.ROOT,
                    "Strategy %s thrives in oversold conditions (RSI < 30): %s win rate", strategy, pct(rate)));
            } else if (rate <= 0.30) {
                insights.add(String.format(Locale.ROOT,
                    "Strategy %s fails in oversold conditions (RSI < 30): only %s win rate", strategy, pct(rate)));
            }
        });

        if (insights.isEmpty()) {
            return List.of("Indicator-based patterns are still forming. Need more data.");
        }
        return insights;
    }

    // ===== HOUR / WEEKDAY / TRANSITION =====

    /**
     * Sentences for strategies that are markedly strong or weak in the given UTC hour.
     *
     * @param hourStats strategy -> symbol -> hour (0-23) -> stats
     */
    public static List<String> detectHourPatterns(Map<String, Map<String, Map<Integer, BucketStats>>> hourStats,
                                                  int currentHour) {
        List<String> insights = new ArrayList<>();
        new TreeMap<>(hourStats).forEach((strategy, symbols) -> {
            BucketStats bucket = aggregate(symbols.values(), currentHour);
            if (bucket.total() < TIME_BUCKET_MIN_TRADES) {
                return;
            }
            double rate = bucket.winRate();
            if (rate >= EXCELS) {
                insights.add(String.format(Locale.ROOT, "Strategy %s performs well at %02d:00 UTC (%d/%d wins, %s)",
                    strategy, currentHour, bucket.wins(), bucket.total(), pct(rate)));
            } else if (rate < 0.30) {
                insights.add(String.format(Locale.ROOT, "Strategy %s struggles at %02d:00 UTC (%d/%d wins, %s)",
                    strategy, currentHour, bucket.wins(), bucket.total(), pct(rate)));
            }
        });
        return insights;
    }

    /**
     * Sentences for strategies that are markedly strong or weak on the given weekday.
     *
     * @param dowStats strategy -> symbol -> ISO weekday (1 = Monday) -> stats
     */
    public static List<String> detectDayOfWeekPatterns(Map<String, Map<String, Map<Integer, BucketStats>>> dowStats,
                                                       DayOfWeek today) {
        List<String> insights = new ArrayList<>();
        String dayName = today.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        new TreeMap<>(dowStats).forEach((strategy, symbols) -> {
            BucketStats bucket = aggregate(symbols.values(), today.getValue());
            if (bucket.total() < TIME_BUCKET_MIN_TRADES) {
                return;
            }
            double rate = bucket.winRate();
            if (rate >= EXCELS) {
                insights.add(String.format(Locale.ROOT, "Strategy %s performs well on %s (%d/%d wins, %s)",
                    strategy, dayName, bucket.wins(), bucket.total(), pct(rate)));
            } else if (rate < 0.30) {
                insights.add(String.format(Locale.ROOT, "Strategy %s struggles on %s (%d/%d wins, %s)",
                    strategy, dayName, bucket.wins(), bucket.total(), pct(rate)));
            }
        });
        return insights;
    }

    /**
     * Sentences for the transition currently in progress, if any.
     *
     * @param transitionStats "FROM->TO" -> strategy -> stats
     * @param currentTransition key of the last transition, or null when none was observed
     */
    public static List<String> detectTransitionPatterns(Map<String, Map<String, BucketStats>> transitionStats,
                                                        String currentTransition) {
        if (currentTransition == null) {
            return List.of();
        }
        Map<String, BucketStats> byStrategy = transitionStats.get(currentTransition);
        if (byStrategy == null) {
            return List.of();
        }
        List<String> insights = new ArrayList<>();
        new TreeMap<>(byStrategy).forEach((strategy, bucket) -> {
            if (bucket.total() < DEFAULT_MIN_TRADES) {
                return;
            }
            double rate = bucket.winRate();
            if (rate >= EXCELS) {
                insights.add(String.format(Locale.ROOT, "Strategy %s adapts well after %s (%d/%d wins, %s)",
                    strategy, currentTransition, bucket.wins(), bucket.total(), pct(rate)));
            } else if (rate < STRUGGLES) {
                insights.add(String.format(Locale.ROOT, "Strategy %s struggles right after %s (%d/%d wins, %s)",
                    strategy, currentTransition, bucket.wins(), bucket.total(), pct(rate)));
            }
        });
        return insights;
    }

    /** Sums one time bucket across all symbols of a strategy. */
    public static BucketStats aggregate(Collection<Map<Integer, BucketStats>> perSymbol, int bucketKey) {
        BucketStats total = BucketStats.EMPTY;
        for (Map<Integer, BucketStats> buckets : perSymbol) {
            total = total.plus(buckets.getOrDefault(bucketKey, BucketStats.EMPTY));
        }
        return total;
    }

    // ===== MARKET MEMORY =====

    /**
     * One paragraph summarising what the log says about the current regime.
     */
    public static String generateMarketMemory(List<TradeOutcome> history, String currentRegime) {
        if (history.isEmpty()) {
            return "The brain has no trade history yet. All strategies start with equal "
                + "confidence. Observing and learning from each trade as it comes.";
        }

        int totalWins = 0;
        Map<String, BucketStats> inRegime = new LinkedHashMap<>();
        Map<String, BucketStats> bySession = new LinkedHashMap<>();
        TradeOutcome lastInRegime = null;
        for (TradeOutcome trade : history) {
            BucketStats one = BucketStats.EMPTY.record(trade.won(), trade.profit());
            if (trade.won()) {
                totalWins++;
            }
            bySession.merge(trade.session(), one, BucketStats::plus);
            if (trade.regime().equals(currentRegime)) {
                inRegime.merge(trade.strategy(), one, BucketStats::plus);
                lastInRegime = trade;
            }
        }

        String best = null;
        double bestRate = 0.0;
        String worst = null;
        double worstRate = 1.0;
        for (Map.Entry<String, BucketStats> e : inRegime.entrySet()) {
            if (e.getValue().total() < MEMORY_MIN_TRADES) {
                continue;
            }
            double rate = e.getValue().winRate();
            if (rate > bestRate) {
                bestRate = rate;
                best = e.getKey();
            }
            if (rate < worstRate) {
                worstRate = rate;
                worst = e.getKey();
            }
        }

        String bestSession = null;
        double bestSessionRate = 0.0;
        for (Map.Entry<String, BucketStats> e : bySession.entrySet()) {
            if (e.getValue().total() < MEMORY_MIN_TRADES) {
                continue;
            }
            double rate = e.getValue().winRate();
            if (rate > bestSessionRate) {
                bestSessionRate = rate;
                bestSession = e.getKey();
            }
        }

        List<String> parts = new ArrayList<>();
        parts.add(String.format(Locale.ROOT, "Over the last %d trades, the brain has observed an overall %s win rate",
            history.size(), pct((double) totalWins / history.size())));
        if (best != null) {
            parts.add(String.format(Locale.ROOT, "%s conditions favor Strategy %s (%s win rate)",
                currentRegime, best, pct(bestRate)));
        }
        if (worst != null && !worst.equals(best)) {
            parts.add(String.format(Locale.ROOT, "while Strategy %s consistently underperforms (%s win rate)",
                worst, pct(worstRate)));
        }
        if (bestSession != null && bestSessionRate > 0.5) {
            parts.add(String.format(Locale.ROOT, "The most profitable entry window is during %s session (%s win rate)",
                bestSession, pct(bestSessionRate)));
        }
        if (lastInRegime != null) {
            List<String> context = new ArrayList<>();
            if (lastInRegime.rsi() != null) {
                context.add(String.format(Locale.ROOT, "RSI %.0f", lastInRegime.rsi()));
            }
            if (lastInRegime.adx() != null) {
                context.add(String.format(Locale.ROOT, "ADX %.0f", lastInRegime.adx()));
            }
            if (!context.isEmpty()) {
                parts.add(String.format(Locale.ROOT,
                    "Current market conditions (%s, %s) are being monitored for optimal entry setups",
                    currentRegime, String.join(", ", context)));
            }
        }
        return String.join(". ", parts) + ".";
    }

    static String pct(double rate) {
        return String.format(Locale.ROOT, "%.0f%%", rate * 100);
    }
}
