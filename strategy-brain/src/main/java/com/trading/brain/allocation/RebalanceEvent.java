package com.trading.brain.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * History entry for one executed rebalance.
 */
public record RebalanceEvent(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("rebalance_number") long rebalanceNumber,
    @JsonProperty("allocations") Map<String, Double> allocations,
    @JsonProperty("fitness_scores") Map<String, Double> fitnessScores,
    @JsonProperty("changes") Map<String, AllocationChange> changes
) {}
