package com.trading.brain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable history entry: a closed trade enriched with its market context.
 * This is the unit the learner keeps in its capped trade log.
 */
public record TradeOutcome(
    @JsonProperty("strategy") String strategy,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("regime") String regime,
    @JsonProperty("session") String session,
    @JsonProperty("indicators") IndicatorSnapshot indicators,
    @JsonProperty("profit") double profit,
    @JsonProperty("won") boolean won,
    @JsonProperty("direction") String direction,
    @JsonProperty("ticket") String ticket,
    @JsonProperty("sl_distance") double stopLossDistance,
    @JsonProperty("duration_seconds") long durationSeconds,
    @JsonProperty("timestamp") Instant timestamp
) {
    public static final String UNKNOWN = "UNKNOWN";

    public TradeOutcome {
        strategy = strategy == null ? "?" : strategy;
        symbol = symbol == null ? UNKNOWN : symbol;
        regime = regime == null ? UNKNOWN : regime;
        session = session == null ? UNKNOWN : session;
        indicators = indicators == null ? IndicatorSnapshot.empty() : indicators;
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
    }

    public static TradeOutcome from(ClosedTrade trade, String regime, String session,
                                    IndicatorSnapshot indicators, Instant timestamp) {
        return new TradeOutcome(
            trade.strategy(),
            trade.symbol(),
            regime,
            session,
            indicators,
            trade.profit(),
            trade.isWon(),
            trade.direction(),
            trade.ticket(),
            trade.stopLossDistanceOrDefault(),
            trade.durationSecondsOrDefault(),
            timestamp
        );
    }

    public Double rsi() {
        return indicators.rsi();
    }

    public Double adx() {
        return indicators.adx();
    }
}
