package com.trading.brain.model;

/**
 * Dashboard view of one bandit arm.
 */
public record PresetStats(double alpha, double beta, double expected) {}
