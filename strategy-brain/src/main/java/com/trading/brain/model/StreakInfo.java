package com.trading.brain.model;

/**
 * Current and historical streaks of one strategy.
 */
public record StreakInfo(int currentStreak, StreakType type, int maxWinStreak, int maxLossStreak) {

    public static final StreakInfo NONE = new StreakInfo(0, StreakType.NONE, 0, 0);

    public boolean isLosingStreakOf(int threshold) {
        return type == StreakType.LOSS && currentStreak >= threshold;
    }

    public boolean isWinningStreakOf(int threshold) {
        return type == StreakType.WIN && currentStreak >= threshold;
    }
}
