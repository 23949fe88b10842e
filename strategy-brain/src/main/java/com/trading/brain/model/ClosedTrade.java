package com.trading.brain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Raw result of a closed trade as handed over by the execution engine.
 * Optional fields are nullable and resolved to defaults by {@link #isWon()},
 * {@link #stopLossDistanceOrDefault()} and {@link #durationSecondsOrDefault()}.
 */
public record ClosedTrade(
    String strategy,
    String symbol,
    String direction,
    Double entryPrice,
    Double exitPrice,
    double profit,
    Boolean won,
    Double stopLossDistance,
    Long durationSeconds,
    String ticket,
    Instant closedAt
) {
    public static final double DEFAULT_SL_DISTANCE = 1.0;
    public static final long DEFAULT_DURATION_SECONDS = 3600;

    public ClosedTrade {
        Objects.requireNonNull(strategy, "strategy");
    }

    /** Explicit flag when provided, otherwise profit > 0. */
    public boolean isWon() {
        return won != null ? won : profit > 0;
    }

    public double stopLossDistanceOrDefault() {
        return stopLossDistance != null ? stopLossDistance : DEFAULT_SL_DISTANCE;
    }

    public long durationSecondsOrDefault() {
        return durationSeconds != null ? durationSeconds : DEFAULT_DURATION_SECONDS;
    }

    public static Builder builder(String strategy) {
        return new Builder(strategy);
    }

    public static final class Builder {
        private final String strategy;
        private String symbol;
        private String direction;
        private Double entryPrice;
        private Double exitPrice;
        private double profit;
        private Boolean won;
        private Double stopLossDistance;
        private Long durationSeconds;
        private String ticket;
        private Instant closedAt;

        private Builder(String strategy) {
            this.strategy = strategy;
        }

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder direction(String direction) {
            this.direction = direction;
            return this;
        }

        public Builder prices(double entryPrice, double exitPrice) {
            this.entryPrice = entryPrice;
            this.exitPrice = exitPrice;
            return this;
        }

        public Builder profit(double profit) {
            this.profit = profit;
            return this;
        }

        public Builder won(boolean won) {
            this.won = won;
            return this;
        }

        public Builder stopLossDistance(double stopLossDistance) {
            this.stopLossDistance = stopLossDistance;
            return this;
        }

        public Builder durationSeconds(long durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder ticket(String ticket) {
            this.ticket = ticket;
            return this;
        }

        public Builder closedAt(Instant closedAt) {
            this.closedAt = closedAt;
            return this;
        }

        public ClosedTrade build() {
            return new ClosedTrade(strategy, symbol, direction, entryPrice, exitPrice, profit,
                won, stopLossDistance, durationSeconds, ticket, closedAt);
        }
    }
}
