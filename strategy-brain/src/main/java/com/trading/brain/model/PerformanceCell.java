package com.trading.brain.model;

/**
 * Read-only view of one {@link BucketStats} for dashboards, values rounded for display.
 */
public record PerformanceCell(
    int wins,
    int losses,
    int totalTrades,
    double totalProfit,
    double avgProfit,
    double winRate
) {
    public static PerformanceCell of(BucketStats stats) {
        return new PerformanceCell(
            stats.wins(),
            stats.losses(),
            stats.total(),
            Rounding.round(stats.profit(), 2),
            Rounding.round(stats.avgProfit(), 2),
            Rounding.round(stats.winRate(), 3)
        );
    }
}
