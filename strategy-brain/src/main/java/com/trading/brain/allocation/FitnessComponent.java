package com.trading.brain.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One weighted term of a fitness score. {@code value} is the raw input as shown on the dashboard.
 */
public record FitnessComponent(
    @JsonProperty("value") String value,
    @JsonProperty("score") double score,
    @JsonProperty("weight") double weight
) {}
