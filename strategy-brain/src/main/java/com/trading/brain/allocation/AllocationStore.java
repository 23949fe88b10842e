package com.trading.brain.allocation;

import java.util.Map;

/**
 * Owner of the persistent per-strategy allocation (typically a database table keyed by
 * strategy code). This core only computes the numbers.
 */
@FunctionalInterface
public interface AllocationStore {

    /** No-op store for hosts that read allocations from {@link RebalanceResult} themselves. */
    AllocationStore NONE = allocations -> { };

    void applyAllocations(Map<String, Double> allocations);
}
