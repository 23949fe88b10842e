package com.trading.brain.model;

/**
 * Result of recording one closed trade.
 *
 * @param insight          explanation of the outcome
 * @param confidenceDelta  confidence nudge suggested by this single trade
 * @param strategy         strategy code
 * @param reward           bandit reward computed for the trade
 * @param chosenPreset     preset credited or debited with the reward
 */
public record TradeAnalysis(
    String insight,
    double confidenceDelta,
    String strategy,
    double reward,
    String chosenPreset
) {}
