package com.trading.brain.allocation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Dashboard view of the auto-allocator.
 */
public record AllocationStatus(
    boolean enabled,
    int tradesSinceRebalance,
    int rebalanceInterval,
    int tradesUntilNext,
    long totalRebalances,
    Instant lastRebalanceTime,
    Map<String, FitnessScore> lastFitnessScores,
    Map<String, Double> lastAllocations,
    List<RebalanceEvent> rebalanceHistory,
    Settings config
) {
    public record Settings(
        int rebalanceInterval,
        double maxChangePerRebalance,
        double minAllocationPct,
        double maxAllocationPct,
        Map<String, Double> weights
    ) {}
}
