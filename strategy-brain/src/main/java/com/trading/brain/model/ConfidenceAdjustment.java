package com.trading.brain.model;

/**
 * Per-strategy confidence bias handed to the signal layer.
 *
 * @param adjustment          bounded bias in [-0.3, +0.3]
 * @param reason              human-readable explanation
 * @param favoredPreset       preset the bandit currently prefers for the current regime
 * @param presetExpectedValue alpha / (alpha + beta) of that preset
 */
public record ConfidenceAdjustment(
    double adjustment,
    String reason,
    String favoredPreset,
    double presetExpectedValue
) {}
