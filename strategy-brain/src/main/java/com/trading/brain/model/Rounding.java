package com.trading.brain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Rounding {

    private Rounding() {}

    /** Half-even rounding to the given number of decimal places. NaN and infinities pass through. */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double safeDiv(double numerator, double denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }
}
