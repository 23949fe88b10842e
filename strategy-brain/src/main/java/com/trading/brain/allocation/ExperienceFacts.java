package com.trading.brain.allocation;

import com.trading.brain.model.StreakType;

/**
 * Per-strategy experience supplied by the leveling collaborator. This core never computes them.
 *
 * @param level             experience level, 1-10
 * @param winRate           lifetime win rate, 0-1
 * @param currentStreak     length of the running streak
 * @param currentStreakType direction of the running streak
 */
public record ExperienceFacts(
    int level,
    double winRate,
    int totalTrades,
    double totalProfit,
    int wins,
    int losses,
    int currentStreak,
    StreakType currentStreakType
) {
    private static final ExperienceFacts NEWCOMER = new ExperienceFacts(1, 0.0, 0, 0.0, 0, 0, 0, StreakType.NONE);

    public ExperienceFacts {
        currentStreakType = currentStreakType == null ? StreakType.NONE : currentStreakType;
    }

    /** Facts for a strategy the leveling system knows nothing about yet. */
    public static ExperienceFacts newcomer() {
        return NEWCOMER;
    }
}
