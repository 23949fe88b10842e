package com.trading.brain.model;

/**
 * Indicator readings at trade entry or signal time. Any reading may be absent.
 *
 * @param rsi oscillator reading (0-100)
 * @param adx trend-strength reading
 * @param atr average true range
 */
public record IndicatorSnapshot(Double rsi, Double adx, Double atr) {

    private static final IndicatorSnapshot EMPTY = new IndicatorSnapshot(null, null, null);

    public static IndicatorSnapshot empty() {
        return EMPTY;
    }

    public static IndicatorSnapshot of(Double rsi, Double adx) {
        return new IndicatorSnapshot(rsi, adx, null);
    }

    public RsiZone rsiZone() {
        return RsiZone.of(rsi);
    }
}
