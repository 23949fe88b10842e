package com.trading.brain.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Composite 0-1 fitness of one strategy plus the weighted terms it was built from.
 */
public record FitnessScore(
    @JsonProperty("score") double score,
    @JsonProperty("breakdown") Map<String, FitnessComponent> breakdown,
    @JsonProperty("total_trades") int totalTrades,
    @JsonProperty("total_profit") double totalProfit
) {
    public FitnessScore {
        breakdown = breakdown == null ? Map.of() : breakdown;
    }
}
