package com.trading.brain.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Bandit context key: one strategy operating in one market regime.
 * Ordered by strategy, then regime, so maps keyed by it iterate deterministically.
 */
public record StrategyContext(String strategy, String regime) implements Comparable<StrategyContext> {

    private static final String SEPARATOR = "|";
    private static final Comparator<StrategyContext> ORDER =
        Comparator.comparing(StrategyContext::strategy).thenComparing(StrategyContext::regime);

    public StrategyContext {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(regime, "regime");
    }

    /** Snapshot key, e.g. {@code A|TRENDING_UP}. */
    public String key() {
        return strategy + SEPARATOR + regime;
    }

    /** Dashboard key, e.g. {@code A_TRENDING_UP}. */
    public String displayKey() {
        return strategy + "_" + regime;
    }

    public static Optional<StrategyContext> parse(String key) {
        if (key == null) {
            return Optional.empty();
        }
        int idx = key.indexOf(SEPARATOR);
        if (idx <= 0 || idx == key.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new StrategyContext(key.substring(0, idx), key.substring(idx + 1)));
    }

    @Override
    public int compareTo(StrategyContext other) {
        return ORDER.compare(this, other);
    }
}
