package com.trading.brain.model;

/**
 * Verdict of the signal gate for one pending entry signal.
 */
public record SignalDecision(boolean skip, GateCheck check, String reason) {

    /** Which check of the gate produced the verdict. */
    public enum GateCheck {
        EXPLORATION(false),
        INSUFFICIENT_DATA(false),
        REGIME_WIN_RATE(true),
        REGIME_ZERO_WINS(true),
        LOSS_STREAK(true),
        RSI_ZONE(true),
        BANDIT_PESSIMISM(true),
        APPROVED(false);

        private final boolean skips;

        GateCheck(boolean skips) {
            this.skips = skips;
        }

        public boolean skips() {
            return skips;
        }
    }

    public static SignalDecision of(GateCheck check, String reason) {
        return new SignalDecision(check.skips(), check, reason);
    }
}
