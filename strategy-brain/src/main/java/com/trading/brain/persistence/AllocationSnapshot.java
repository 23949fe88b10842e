package com.trading.brain.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trading.brain.allocation.FitnessScore;
import com.trading.brain.allocation.RebalanceEvent;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted auto-allocator state.
 */
public record AllocationSnapshot(
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("trades_since_rebalance") int tradesSinceRebalance,
    @JsonProperty("total_rebalances") long totalRebalances,
    @JsonProperty("last_rebalance_time") Instant lastRebalanceTime,
    @JsonProperty("last_fitness_scores") Map<String, FitnessScore> lastFitnessScores,
    @JsonProperty("last_allocations") Map<String, Double> lastAllocations,
    @JsonProperty("rebalance_history") List<RebalanceEvent> rebalanceHistory,
    @JsonProperty("saved_at") Instant savedAt
) {
    public static final String FILE_NAME = "auto_allocation.json";

    public AllocationSnapshot {
        lastFitnessScores = lastFitnessScores == null ? Map.of() : lastFitnessScores;
        lastAllocations = lastAllocations == null ? Map.of() : lastAllocations;
        rebalanceHistory = rebalanceHistory == null
            ? List.of()
            : rebalanceHistory.stream().filter(Objects::nonNull).toList();
    }
}
