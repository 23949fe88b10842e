package com.trading.brain.model;

import java.util.Map;

/**
 * Read-only status of the learning engine for dashboards and the allocator.
 *
 * @param distributions        "strategy_regime" -> preset -> arm stats
 * @param totalTradesAnalyzed  trades fed to the bandit since first start
 * @param totalReward          cumulative reward
 * @param avgReward            cumulative reward / trades, 0 when no trades
 * @param explorationRate      effective exploration rate
 * @param confidenceAdjustments per-strategy adjustments with reasons
 */
public record LearningStats(
    Map<String, Map<String, PresetStats>> distributions,
    long totalTradesAnalyzed,
    double totalReward,
    double avgReward,
    double explorationRate,
    Map<String, ConfidenceAdjustment> confidenceAdjustments
) {}
