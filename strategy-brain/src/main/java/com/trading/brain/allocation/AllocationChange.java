package com.trading.brain.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AllocationChange(
    @JsonProperty("from") double from,
    @JsonProperty("to") double to,
    @JsonProperty("delta") double delta
) {}
