package com.trading.brain.allocation;

import com.trading.brain.model.ConfidenceAdjustment;
import com.trading.brain.model.StreakType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("FitnessScorer Tests")
class FitnessScorerTest {

    private static ExperienceFacts facts(int level, double winRate, int wins, int losses, double profit,
                                         int streak, StreakType type) {
        return new ExperienceFacts(level, winRate, wins + losses, profit, wins, losses, streak, type);
    }

    @Test
    @DisplayName("Weights sum to 1.0")
    void weightsSumToOne() {
        double sum = FitnessScorer.weights().values().stream().mapToDouble(Double::doubleValue).sum();

        assertThat(sum).isCloseTo(1.0, within(1e-9));
        assertThat(FitnessScorer.weights()).containsOnlyKeys("level", "win_rate", "profit_factor", "rl_expected", "streak");
    }

    @Test
    @DisplayName("Composite is the weighted sum of the five components")
    void composite() {
        ExperienceFacts f = facts(6, 0.6, 12, 8, 140.0, 2, StreakType.WIN);
        ConfidenceAdjustment adjustment = new ConfidenceAdjustment(0.1, "test", "aggressive", 0.7);

        FitnessScore score = FitnessScorer.score(f, adjustment);

        // 0.2*0.6 + 0.3*0.6 + 0.2*(1.5/3) + 0.2*0.7 + 0.1*0.7
        assertThat(score.score()).isEqualTo(0.61);
        assertThat(score.totalTrades()).isEqualTo(20);
        assertThat(score.totalProfit()).isEqualTo(140.0);
        assertThat(score.breakdown()).containsOnlyKeys("level", "win_rate", "profit_factor", "rl_expected", "streak");
        assertThat(score.breakdown().get("profit_factor").score()).isEqualTo(0.5);
        assertThat(score.breakdown().get("profit_factor").value()).isEqualTo("1.50");
        assertThat(score.breakdown().get("streak").value()).isEqualTo("win:2");
    }

    @Test
    @DisplayName("Unknown strategy scores as a newcomer with a neutral bandit term")
    void newcomer() {
        FitnessScore score = FitnessScorer.score(null, null);

        // 0.2*0.1 + 0 + 0.2*0.3 + 0.2*0.5 + 0.1*0.5
        assertThat(score.score()).isEqualTo(0.23);
    }

    @Nested
    @DisplayName("Profit factor")
    class ProfitFactor {

        @Test
        @DisplayName("Wins over losses divided by 3, capped at 1")
        void ratio() {
            assertThat(FitnessScorer.profitFactorScore(facts(1, 0, 3, 3, 0, 0, null))).isCloseTo(1.0 / 3, within(1e-9));
            assertThat(FitnessScorer.profitFactorScore(facts(1, 0, 10, 2, 0, 0, null))).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Profitable without losses scores 0.7, otherwise 0.3")
        void fallbacks() {
            assertThat(FitnessScorer.profitFactorScore(facts(1, 1, 4, 0, 25.0, 0, null))).isEqualTo(0.7);
            assertThat(FitnessScorer.profitFactorScore(facts(1, 0, 0, 4, -25.0, 0, null))).isEqualTo(0.3);
            assertThat(FitnessScorer.profitFactorScore(ExperienceFacts.newcomer())).isEqualTo(0.3);
        }
    }

    @Nested
    @DisplayName("Streak")
    class Streak {

        @Test
        @DisplayName("Win streaks raise and loss streaks lower the neutral 0.5")
        void direction() {
            assertThat(FitnessScorer.streakScore(StreakType.WIN, 3)).isCloseTo(0.8, within(1e-9));
            assertThat(FitnessScorer.streakScore(StreakType.LOSS, 2)).isCloseTo(0.3, within(1e-9));
            assertThat(FitnessScorer.streakScore(StreakType.NONE, 7)).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Streak score stays within [0, 1]")
        void bounded() {
            assertThat(FitnessScorer.streakScore(StreakType.WIN, 12)).isEqualTo(1.0);
            assertThat(FitnessScorer.streakScore(StreakType.LOSS, 12)).isEqualTo(0.0);
        }
    }

    @Test
    @DisplayName("Win rate and bandit terms are clamped to 1")
    void clamping() {
        ExperienceFacts f = facts(10, 1.4, 5, 0, 50.0, 0, StreakType.NONE);
        ConfidenceAdjustment adjustment = new ConfidenceAdjustment(0.0, "test", "moderate", 1.7);

        FitnessScore score = FitnessScorer.score(f, adjustment);

        assertThat(score.breakdown().get("win_rate").score()).isEqualTo(1.0);
        assertThat(score.breakdown().get("rl_expected").score()).isEqualTo(1.0);
        assertThat(score.score()).isLessThanOrEqualTo(1.0);
    }
}
