package com.trading.brain.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trading.brain.model.BucketStats;
import com.trading.brain.model.RegimeTransition;
import com.trading.brain.model.TradeInsight;
import com.trading.brain.model.TradeOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted learner state: the trade log, the aggregate tables, the insight log and the last
 * raw confidence adjustments.
 */
public record LearnerSnapshot(
    @JsonProperty("trade_history") List<TradeOutcome> tradeHistory,
    @JsonProperty("regime_stats") Map<String, Map<String, BucketStats>> regimeStats,
    @JsonProperty("session_stats") Map<String, Map<String, BucketStats>> sessionStats,
    @JsonProperty("rsi_zone_stats") Map<String, Map<String, BucketStats>> rsiZoneStats,
    @JsonProperty("hour_stats") Map<String, Map<String, Map<Integer, BucketStats>>> hourStats,
    @JsonProperty("dow_stats") Map<String, Map<String, Map<Integer, BucketStats>>> dowStats,
    @JsonProperty("transition_stats") Map<String, Map<String, BucketStats>> transitionStats,
    @JsonProperty("insights") List<TradeInsight> insights,
    @JsonProperty("confidence_adjustments") Map<String, Double> confidenceAdjustments,
    @JsonProperty("total_trade_count") long totalTradeCount,
    @JsonProperty("current_exploration_rate") double currentExplorationRate,
    @JsonProperty("last_regime_transition") RegimeTransition lastRegimeTransition,
    @JsonProperty("saved_at") Instant savedAt
) {
    public static final String FILE_NAME = "memory.json";

    public LearnerSnapshot {
        tradeHistory = tradeHistory == null ? List.of() : tradeHistory.stream().filter(Objects::nonNull).toList();
        regimeStats = regimeStats == null ? Map.of() : regimeStats;
        sessionStats = sessionStats == null ? Map.of() : sessionStats;
        rsiZoneStats = rsiZoneStats == null ? Map.of() : rsiZoneStats;
        hourStats = hourStats == null ? Map.of() : hourStats;
        dowStats = dowStats == null ? Map.of() : dowStats;
        transitionStats = transitionStats == null ? Map.of() : transitionStats;
        insights = insights == null ? List.of() : insights.stream().filter(Objects::nonNull).toList();
        confidenceAdjustments = confidenceAdjustments == null ? Map.of() : confidenceAdjustments;
    }
}
