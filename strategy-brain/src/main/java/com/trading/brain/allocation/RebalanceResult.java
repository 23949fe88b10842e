package com.trading.brain.allocation;

import java.time.Instant;
import java.util.Map;

/**
 * New allocation split produced by a rebalance, handed to the {@link AllocationStore}.
 */
public record RebalanceResult(
    Map<String, Double> allocations,
    Map<String, FitnessScore> fitnessScores,
    long rebalanceNumber,
    Map<String, AllocationChange> changes,
    Instant timestamp
) {}
