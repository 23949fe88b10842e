package com.trading.brain.patterns;

import com.trading.brain.model.BucketStats;
import com.trading.brain.model.IndicatorSnapshot;
import com.trading.brain.model.StreakInfo;
import com.trading.brain.model.StreakType;
import com.trading.brain.model.TradeOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PatternDetector Tests")
class PatternDetectorTest {

    private static int sequence;

    private static TradeOutcome outcome(String strategy, boolean won, String regime, String session,
                                        Double rsi, Double adx) {
        return new TradeOutcome(strategy, "EURUSD", regime, session, IndicatorSnapshot.of(rsi, adx),
            won ? 15.0 : -10.0, won, "BUY", null, 10.0, 900, Instant.EPOCH.plusSeconds(sequence++));
    }

    private static TradeOutcome outcome(String strategy, boolean won) {
        return outcome(strategy, won, "RANGING", "LONDON", null, null);
    }

    private static List<TradeOutcome> repeat(int times, String strategy, boolean won, String regime, String session,
                                             Double rsi, Double adx) {
        List<TradeOutcome> result = new ArrayList<>();
        for (int i = 0; i < times; i++) {
            result.add(outcome(strategy, won, regime, session, rsi, adx));
        }
        return result;
    }

    // ========================================================================
    // STREAKS
    // ========================================================================

    @Nested
    @DisplayName("Streaks")
    class Streaks {

        @Test
        @DisplayName("Current streak is the trailing run, maxima track the longest runs")
        void currentAndMax() {
            List<TradeOutcome> history = List.of(
                outcome("A", true), outcome("A", true), outcome("A", true),
                outcome("A", false), outcome("A", false),
                outcome("A", true), outcome("A", false), outcome("A", false));

            StreakInfo streak = PatternDetector.detectStreaks(history).get("A");

            assertThat(streak.currentStreak()).isEqualTo(2);
            assertThat(streak.type()).isEqualTo(StreakType.LOSS);
            assertThat(streak.maxWinStreak()).isEqualTo(3);
            assertThat(streak.maxLossStreak()).isEqualTo(2);
        }

        @Test
        @DisplayName("Strategies are tracked independently of interleaving")
        void interleaved() {
            List<TradeOutcome> history = List.of(
                outcome("A", true), outcome("B", false), outcome("A", true), outcome("B", false),
                outcome("A", true), outcome("B", true));

            Map<String, StreakInfo> streaks = PatternDetector.detectStreaks(history);

            assertThat(streaks).containsOnlyKeys("A", "B");
            assertThat(streaks.get("A")).isEqualTo(new StreakInfo(3, StreakType.WIN, 3, 0));
            assertThat(streaks.get("B")).isEqualTo(new StreakInfo(1, StreakType.WIN, 1, 2));
        }

        @Test
        @DisplayName("Empty history has no streaks")
        void empty() {
            assertThat(PatternDetector.detectStreaks(List.of())).isEmpty();
            assertThat(PatternDetector.streakOf(List.of())).isEqualTo(StreakInfo.NONE);
        }
    }

    // ========================================================================
    // SENTENCES
    // ========================================================================

    @Nested
    @DisplayName("Regime bias")
    class RegimeBias {

        @Test
        @DisplayName("Reports strategies that excel or struggle in a regime")
        void excelsAndStruggles() {
            List<TradeOutcome> history = new ArrayList<>();
            history.addAll(repeat(4, "A", true, "TRENDING_UP", "LONDON", null, null));
            history.addAll(repeat(1, "A", false, "TRENDING_UP", "LONDON", null, null));
            history.addAll(repeat(5, "B", false, "TRENDING_UP", "LONDON", null, null));

            List<String> insights = PatternDetector.detectRegimeBias(history, 5);

            assertThat(insights).containsExactly(
                "Strategy A excels in TRENDING_UP (80% win rate over 5 trades, avg profit $+10.00)",
                "Strategy B struggles in TRENDING_UP (0% win rate over 5 trades, avg loss $-10.00)");
        }

        @Test
        @DisplayName("Buckets under the minimum produce the still-forming sentence")
        void tooFewTrades() {
            List<TradeOutcome> history = repeat(4, "A", true, "RANGING", "LONDON", null, null);

            assertThat(PatternDetector.detectRegimeBias(history, 5))
                .containsExactly("Regime bias patterns are still forming. Need more trades per regime.");
            assertThat(PatternDetector.detectRegimeBias(List.of(), 5))
                .containsExactly("Not enough trade data yet to detect regime bias.");
        }
    }

    @Nested
    @DisplayName("Sessions and indicators")
    class SessionsAndIndicators {

        @Test
        @DisplayName("Best session and per-strategy session strength are reported")
        void sessions() {
            List<TradeOutcome> history = new ArrayList<>();
            history.addAll(repeat(6, "C", true, "VOLATILE", "NEWYORK", null, null));
            history.addAll(repeat(5, "C", false, "VOLATILE", "ASIAN", null, null));

            List<String> insights = PatternDetector.detectTimePatterns(history, 5);

            assertThat(insights).contains(
                "Most winning trades occur during NEWYORK session (13:00-22:00 UTC) with 100% win rate over 6 trades",
                "Strategy C performs best during NEWYORK session (13:00-22:00 UTC): 100% win rate over 6 trades",
                "Strategy C underperforms during ASIAN session (00:00-08:00 UTC): 0% win rate over 5 trades");
        }

        @Test
        @DisplayName("RSI and ADX bands plus oversold behaviour per strategy")
        void indicators() {
            List<TradeOutcome> history = new ArrayList<>();
            history.addAll(repeat(5, "D", true, "RANGING", "LONDON", 22.0, 45.0));
            history.addAll(repeat(5, "E", false, "RANGING", "LONDON", 80.0, 12.0));

            List<String> insights = PatternDetector.detectIndicatorPatterns(history, 5);

            assertThat(insights).contains(
                "Trades entered when RSI < 25 have 100% win rate (5 trades)",
                "Trades entered when RSI > 75 have poor results: only 0% win rate (5 trades)",
                "ADX > 40 (very strong trend) significantly improves trade outcomes: 100% win rate (5 trades)",
                "ADX < 20 (weak trend) correlates with poor outcomes: only 0% win rate (5 trades)",
                "Strategy D thrives in oversold conditions (RSI < 30): 100% win rate");
        }

        @Test
        @DisplayName("Trades without indicator readings are ignored")
        void missingIndicators() {
            List<TradeOutcome> history = repeat(10, "A", true, "RANGING", "LONDON", null, null);

            assertThat(PatternDetector.detectIndicatorPatterns(history, 5))
                .containsExactly("Indicator-based patterns are still forming. Need more data.");
        }
    }

    @Nested
    @DisplayName("Time buckets and transitions")
    class TimeBuckets {

        private Map<String, Map<String, Map<Integer, BucketStats>>> stats(int bucket, BucketStats eurusd,
                                                                         BucketStats gbpusd) {
            return Map.of("A", Map.of(
                "EURUSD", Map.of(bucket, eurusd),
                "GBPUSD", Map.of(bucket, gbpusd)));
        }

        @Test
        @DisplayName("Hour patterns aggregate all symbols and need 8 trades")
        void hourPatterns() {
            var hourStats = stats(14, new BucketStats(1, 4, -20.0), new BucketStats(1, 2, -5.0));

            assertThat(PatternDetector.detectHourPatterns(hourStats, 14))
                .containsExactly("Strategy A struggles at 14:00 UTC (2/8 wins, 25%)");
            assertThat(PatternDetector.detectHourPatterns(hourStats, 15)).isEmpty();
        }

        @Test
        @DisplayName("Weekday patterns use ISO day numbers")
        void dayPatterns() {
            var dowStats = stats(DayOfWeek.WEDNESDAY.getValue(), new BucketStats(5, 1, 30.0),
                new BucketStats(2, 0, 10.0));

            assertThat(PatternDetector.detectDayOfWeekPatterns(dowStats, DayOfWeek.WEDNESDAY))
                .containsExactly("Strategy A performs well on Wednesday (7/8 wins, 88%)");
        }

        @Test
        @DisplayName("Transition patterns only speak about the current transition")
        void transitionPatterns() {
            Map<String, Map<String, BucketStats>> transitions = Map.of(
                "RANGING->TRENDING_UP", Map.of("B", new BucketStats(1, 5, -30.0)),
                "QUIET->VOLATILE", Map.of("B", new BucketStats(6, 0, 40.0)));

            assertThat(PatternDetector.detectTransitionPatterns(transitions, "RANGING->TRENDING_UP"))
                .containsExactly("Strategy B struggles right after RANGING->TRENDING_UP (1/6 wins, 17%)");
            assertThat(PatternDetector.detectTransitionPatterns(transitions, null)).isEmpty();
            assertThat(PatternDetector.detectTransitionPatterns(transitions, "X->Y")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Market memory")
    class MarketMemory {

        @Test
        @DisplayName("Names the best and worst strategy of the current regime")
        void narrative() {
            List<TradeOutcome> history = new ArrayList<>();
            history.addAll(repeat(3, "A", true, "TRENDING_UP", "LONDON", 55.0, 32.0));
            history.addAll(repeat(3, "B", false, "TRENDING_UP", "LONDON", 61.0, 28.0));

            String memory = PatternDetector.generateMarketMemory(history, "TRENDING_UP");

            assertThat(memory)
                .startsWith("Over the last 6 trades, the brain has observed an overall 50% win rate")
                .contains("TRENDING_UP conditions favor Strategy A (100% win rate)")
                .contains("while Strategy B consistently underperforms (0% win rate)")
                .contains("Current market conditions (TRENDING_UP, RSI 61, ADX 28)")
                .endsWith(".");
        }
    }
}
