package com.trading.brain.allocation;

import com.trading.brain.config.BrainConfig;
import com.trading.brain.metrics.BrainMetrics;
import com.trading.brain.model.ConfidenceAdjustment;
import com.trading.brain.model.LearningStats;
import com.trading.brain.model.StreakType;
import com.trading.brain.persistence.AllocationSnapshot;
import com.trading.brain.persistence.AsyncSnapshotWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for AutoAllocator
 * Rebalances every 10 trades with the default 5-50% bounds and 5 point step.
 */
@DisplayName("AutoAllocator Tests")
@ExtendWith(MockitoExtension.class)
class AutoAllocatorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private AllocationStore store;

    @Mock
    private AsyncSnapshotWriter writer;

    private BrainMetrics metrics;
    private AutoAllocator allocator;

    private final Map<String, ExperienceFacts> experience = Map.of(
        "A", new ExperienceFacts(8, 0.7, 40, 520.0, 28, 12, 4, StreakType.WIN),
        "B", new ExperienceFacts(2, 0.35, 20, -80.0, 7, 13, 3, StreakType.LOSS),
        "C", new ExperienceFacts(5, 0.5, 30, 40.0, 15, 15, 1, StreakType.WIN),
        "D", new ExperienceFacts(4, 0.45, 22, -10.0, 10, 12, 1, StreakType.LOSS));

    private final Map<String, Double> equalSplit = Map.of("A", 25.0, "B", 25.0, "C", 25.0, "D", 25.0);

    @BeforeEach
    void setUp() {
        metrics = BrainMetrics.inMemory();
        allocator = new AutoAllocator(BrainConfig.defaults(), store, Clock.fixed(NOW, ZoneOffset.UTC),
            metrics, writer);
    }

    private Optional<RebalanceResult> completeTrades(int count, Map<String, Double> current) {
        Optional<RebalanceResult> last = Optional.empty();
        for (int i = 0; i < count; i++) {
            last = allocator.onTradeCompleted(experience, Map.of(), null, current);
        }
        return last;
    }

    // ========================================================================
    // INTERVAL
    // ========================================================================

    @Nested
    @DisplayName("Rebalance interval")
    class Interval {

        @Test
        @DisplayName("Nothing happens before the tenth trade")
        void beforeInterval() {
            assertThat(completeTrades(9, equalSplit)).isEmpty();

            assertThat(allocator.getStatus().tradesSinceRebalance()).isEqualTo(9);
            assertThat(allocator.getStatus().tradesUntilNext()).isEqualTo(1);
            verify(store, never()).applyAllocations(anyMap());
        }

        @Test
        @DisplayName("The tenth trade rebalances and resets the counter")
        void onInterval() {
            Optional<RebalanceResult> result = completeTrades(10, equalSplit);

            assertThat(result).isPresent();
            assertThat(result.get().rebalanceNumber()).isEqualTo(1);
            assertThat(result.get().timestamp()).isEqualTo(NOW);
            assertThat(allocator.getStatus().tradesSinceRebalance()).isZero();
            assertThat(allocator.getStatus().totalRebalances()).isEqualTo(1);
            verify(store, times(1)).applyAllocations(result.get().allocations());
            verify(writer).submit(eq(AllocationSnapshot.FILE_NAME), any(AllocationSnapshot.class));
            assertThat(metrics.getRegistry().counter("brain.rebalances").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Twenty-five trades give two rebalances")
        void repeated() {
            completeTrades(25, equalSplit);

            assertThat(allocator.getStatus().totalRebalances()).isEqualTo(2);
            assertThat(allocator.getStatus().tradesSinceRebalance()).isEqualTo(5);
            verify(store, times(2)).applyAllocations(anyMap());
        }

        @Test
        @DisplayName("Disabled allocator neither counts nor rebalances")
        void disabled() {
            allocator.setEnabled(false);

            assertThat(completeTrades(30, equalSplit)).isEmpty();

            assertThat(allocator.isEnabled()).isFalse();
            assertThat(allocator.getStatus().tradesSinceRebalance()).isZero();
            verify(store, never()).applyAllocations(anyMap());
            verify(writer).submit(eq(AllocationSnapshot.FILE_NAME), any(AllocationSnapshot.class));
        }
    }

    // ========================================================================
    // RESULT
    // ========================================================================

    @Nested
    @DisplayName("Rebalance result")
    class Result {

        @Test
        @DisplayName("Stronger strategies gain share within the step limit")
        void strongerGains() {
            RebalanceResult result = completeTrades(10, equalSplit).orElseThrow();

            Map<String, Double> allocations = result.allocations();
            assertThat(allocations.values().stream().mapToDouble(Double::doubleValue).sum())
                .isCloseTo(100.0, within(0.1));
            assertThat(allocations.get("A")).isGreaterThan(25.0).isLessThanOrEqualTo(30.0);
            assertThat(allocations.get("B")).isLessThan(25.0).isGreaterThanOrEqualTo(20.0);
            assertThat(result.fitnessScores().get("A").score())
                .isGreaterThan(result.fitnessScores().get("B").score());

            AllocationChange change = result.changes().get("A");
            assertThat(change.from()).isEqualTo(25.0);
            assertThat(change.to()).isEqualTo(allocations.get("A"));
            assertThat(change.delta()).isEqualTo(allocations.get("A") - 25.0, within(0.05));
        }

        @Test
        @DisplayName("Confidence adjustments feed the bandit term, falling back to learning stats")
        void adjustmentsFallback() {
            Map<String, ConfidenceAdjustment> fromStats = new LinkedHashMap<>();
            fromStats.put("A", new ConfidenceAdjustment(0.0, "stats", "moderate", 0.9));
            fromStats.put("B", new ConfidenceAdjustment(0.0, "stats", "moderate", 0.9));
            LearningStats stats = new LearningStats(Map.of(), 0, 0, 0, 0.1, fromStats);
            Map<String, ConfidenceAdjustment> explicit = Map.of(
                "B", new ConfidenceAdjustment(0.0, "explicit", "conservative", 0.1));

            RebalanceResult result = null;
            for (int i = 0; i < 10; i++) {
                result = allocator.onTradeCompleted(experience, explicit, stats, equalSplit).orElse(null);
            }

            assertThat(result).isNotNull();
            assertThat(result.fitnessScores().get("A").breakdown().get("rl_expected").score()).isEqualTo(0.9);
            assertThat(result.fitnessScores().get("B").breakdown().get("rl_expected").score()).isEqualTo(0.1);
            assertThat(result.fitnessScores().get("C").breakdown().get("rl_expected").score()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Null entries in the current split count as an equal share")
        void nullCurrentEntry() {
            Map<String, Double> current = new HashMap<>(equalSplit);
            current.put("B", null);

            assertThat(completeTrades(9, current)).isEmpty();
            RebalanceResult result = completeTrades(1, current).orElseThrow();

            assertThat(result.rebalanceNumber()).isEqualTo(1);
            assertThat(result.changes().get("B").from()).isEqualTo(25.0);
            assertThat(result.allocations().values().stream().mapToDouble(Double::doubleValue).sum())
                .isCloseTo(100.0, within(0.1));
            AllocationStatus status = allocator.getStatus();
            assertThat(status.totalRebalances()).isEqualTo(1);
            assertThat(status.tradesSinceRebalance()).isZero();
            assertThat(status.rebalanceHistory()).hasSize(1);
            verify(store).applyAllocations(result.allocations());
        }

        @Test
        @DisplayName("A failing allocation store does not break the rebalance")
        void storeFailure() {
            doThrow(new IllegalStateException("db down")).when(store).applyAllocations(anyMap());

            assertThat(completeTrades(10, equalSplit)).isPresent();
            assertThat(allocator.getStatus().totalRebalances()).isEqualTo(1);
        }

        @Test
        @DisplayName("Repeated rebalances converge without breaking the step limit")
        void convergence() {
            Map<String, Double> current = new LinkedHashMap<>(equalSplit);
            for (int round = 0; round < 10; round++) {
                RebalanceResult result = completeTrades(10, current).orElseThrow();
                for (String code : current.keySet()) {
                    assertThat(Math.abs(result.allocations().get(code) - current.get(code)))
                        .isLessThanOrEqualTo(5.0 + 1e-6);
                }
                current = new LinkedHashMap<>(result.allocations());
            }

            assertThat(current.get("A")).isGreaterThan(current.get("B"));
        }
    }

    // ========================================================================
    // STATUS AND SNAPSHOTS
    // ========================================================================

    @Nested
    @DisplayName("Status and snapshots")
    class StatusAndSnapshots {

        @Test
        @DisplayName("History keeps the last 20 events, status shows the last 10")
        void historyCap() {
            completeTrades(25 * 10, equalSplit);

            AllocationSnapshot snapshot = allocator.snapshot();
            assertThat(snapshot.rebalanceHistory()).hasSize(AutoAllocator.HISTORY_CAP);
            assertThat(snapshot.rebalanceHistory().get(0).rebalanceNumber()).isEqualTo(6);

            AllocationStatus status = allocator.getStatus();
            assertThat(status.rebalanceHistory()).hasSize(AutoAllocator.STATUS_HISTORY);
            assertThat(status.rebalanceHistory().get(9).rebalanceNumber()).isEqualTo(25);
            assertThat(status.config().weights()).containsEntry("win_rate", 0.30);
            assertThat(status.lastAllocations()).containsOnlyKeys("A", "B", "C", "D");
        }

        @Test
        @DisplayName("Restored allocator continues counting where it left off")
        void restore() {
            completeTrades(14, equalSplit);
            AllocationSnapshot snapshot = allocator.snapshot();

            AutoAllocator restored = new AutoAllocator(BrainConfig.defaults(), store,
                Clock.fixed(NOW, ZoneOffset.UTC), metrics, null);
            restored.restore(snapshot);

            assertThat(restored.getStatus().tradesSinceRebalance()).isEqualTo(4);
            assertThat(restored.getStatus().totalRebalances()).isEqualTo(1);
            assertThat(restored.getStatus().lastAllocations()).isEqualTo(allocator.getStatus().lastAllocations());

            Optional<RebalanceResult> next = Optional.empty();
            for (int i = 0; i < 6; i++) {
                next = restored.onTradeCompleted(experience, Map.of(), null, equalSplit);
            }
            assertThat(next).isPresent();
            assertThat(next.get().rebalanceNumber()).isEqualTo(2);
        }

        @Test
        @DisplayName("Custom interval from configuration is honoured")
        void customInterval() {
            Properties props = new Properties();
            props.setProperty("REBALANCE_INTERVAL", "3");
            AutoAllocator fast = new AutoAllocator(BrainConfig.forTest(props), null,
                Clock.fixed(NOW, ZoneOffset.UTC), metrics, null);

            assertThat(fast.onTradeCompleted(experience, Map.of(), null, equalSplit)).isEmpty();
            assertThat(fast.onTradeCompleted(experience, Map.of(), null, equalSplit)).isEmpty();
            assertThat(fast.onTradeCompleted(experience, Map.of(), null, equalSplit)).isPresent();
        }
    }
}
