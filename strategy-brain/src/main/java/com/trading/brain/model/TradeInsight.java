package com.trading.brain.model;

import java.time.Instant;

public record TradeInsight(
    Instant timestamp,
    String text,
    double confidence,
    String strategy,
    String type,
    double reward
) {
    public static final String TRADE_ANALYSIS = "TRADE_ANALYSIS";
}
