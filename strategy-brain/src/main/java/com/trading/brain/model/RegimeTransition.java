package com.trading.brain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Last observed regime change.
 */
public record RegimeTransition(
    @JsonProperty("from_regime") String fromRegime,
    @JsonProperty("to_regime") String toRegime,
    @JsonProperty("changed_at") Instant changedAt
) {

    /** Stats key, e.g. {@code RANGING->TRENDING_UP}. */
    public String key() {
        return fromRegime + "->" + toRegime;
    }
}
