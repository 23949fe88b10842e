package com.trading.brain.model;

import java.util.Map;

/**
 * How strategies fared in the hour after each observed regime change.
 *
 * @param stats                  "FROM->TO" -> strategy -> performance
 * @param lastTransition         most recent change, null when none was observed
 * @param withinTransitionWindow true while less than 60 minutes have passed since that change
 */
public record TransitionPerformance(
    Map<String, Map<String, PerformanceCell>> stats,
    RegimeTransition lastTransition,
    boolean withinTransitionWindow
) {}
