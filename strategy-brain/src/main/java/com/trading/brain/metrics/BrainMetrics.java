package com.trading.brain.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Meters for the learning and allocation core.
 *
 * Usage:
 *   var metrics = new BrainMetrics(registry);
 *   metrics.recordTradeAnalyzed("A", 0.35);
 *   metrics.recordSignalEvaluated("B", "REGIME_WIN_RATE");
 */
public final class BrainMetrics {
    private static final Logger logger = LoggerFactory.getLogger(BrainMetrics.class);

    private final MeterRegistry registry;

    public BrainMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        logger.info("BrainMetrics initialized with {}", registry.getClass().getSimpleName());
    }

    /** In-memory registry, used when the host application does not supply one. */
    public static BrainMetrics inMemory() {
        return new BrainMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void recordTradeAnalyzed(String strategy, double reward) {
        registry.counter("brain.trades.analyzed",
            "strategy", strategy).increment();

        registry.summary("brain.trade.reward",
            "strategy", strategy).record(reward);
    }

    public void recordSignalEvaluated(String strategy, String outcome) {
        registry.counter("brain.signals.evaluated",
            "strategy", strategy,
            "outcome", outcome).increment();
    }

    public void recordRebalance() {
        registry.counter("brain.rebalances").increment();
    }

    public void recordSnapshotFailure(String snapshot) {
        registry.counter("brain.snapshot.failures",
            "snapshot", snapshot).increment();
    }
}
