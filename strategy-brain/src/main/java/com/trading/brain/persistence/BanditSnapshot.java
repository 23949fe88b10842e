package com.trading.brain.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted bandit state: {@code "strategy|regime" -> preset -> [alpha, beta]} plus reward totals.
 */
public record BanditSnapshot(
    @JsonProperty("parameter_adapter") Map<String, Map<String, List<Double>>> parameterAdapter,
    @JsonProperty("rl_total_trades") long totalTrades,
    @JsonProperty("rl_total_reward") double totalReward,
    @JsonProperty("rl_exploration_rate") double explorationRate,
    @JsonProperty("saved_at") Instant savedAt
) {
    public static final String FILE_NAME = "rl_state.json";

    public BanditSnapshot {
        parameterAdapter = parameterAdapter == null ? Map.of() : parameterAdapter;
    }
}
