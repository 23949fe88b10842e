package com.trading.brain.model;

/**
 * Coarse RSI classification used by the aggregate stats and the signal gate.
 */
public enum RsiZone {
    OVERSOLD("oversold"),
    OVERBOUGHT("overbought"),
    NEUTRAL("neutral"),
    UNKNOWN("unknown");

    private final String key;

    RsiZone(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static RsiZone of(Double rsi) {
        if (rsi == null || rsi.isNaN()) {
            return UNKNOWN;
        }
        if (rsi < 30) {
            return OVERSOLD;
        }
        if (rsi > 70) {
            return OVERBOUGHT;
        }
        return NEUTRAL;
    }
}
