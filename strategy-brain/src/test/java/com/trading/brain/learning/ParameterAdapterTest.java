package com.trading.brain.learning;

import com.trading.brain.model.Preset;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Thompson sampling bandit: priors, capped updates, tie-breaking and snapshot restore.
 */
@DisplayName("ParameterAdapter Tests")
class ParameterAdapterTest {

    private static final String STRATEGY = "A";
    private static final String REGIME = "TRENDING_UP";

    private ParameterAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new ParameterAdapter(new Well19937c(42));
    }

    private List<Double> params(Preset preset) {
        return adapter.toSnapshot().get(STRATEGY + "|" + REGIME).get(preset.key());
    }

    // ========================================================================
    // PRIORS AND LAZY CREATION
    // ========================================================================

    @Nested
    @DisplayName("Context creation")
    class ContextCreation {

        @Test
        @DisplayName("First selection seeds the context with the fixed prior")
        void seedsPrior() {
            Preset chosen = adapter.selectPreset(STRATEGY, REGIME);

            assertThat(chosen).isNotNull();
            assertThat(adapter.contextCount()).isEqualTo(1);
            assertThat(params(Preset.CONSERVATIVE)).containsExactly(1.0, 1.0);
            assertThat(params(Preset.MODERATE)).containsExactly(2.0, 1.0);
            assertThat(params(Preset.AGGRESSIVE)).containsExactly(1.0, 1.0);
        }

        @Test
        @DisplayName("Reads on an unseen context answer from the prior without creating it")
        void readsDoNotCreate() {
            assertThat(adapter.expectedValue(STRATEGY, REGIME, "moderate")).isCloseTo(2.0 / 3.0, within(1e-9));
            assertThat(adapter.bestExpected(STRATEGY, REGIME).preset()).isEqualTo(Preset.MODERATE);
            assertThat(adapter.getAllDistributions()).isEmpty();
            assertThat(adapter.hasContext(STRATEGY, REGIME)).isFalse();
        }

        @Test
        @DisplayName("Unknown preset has expected value 0.5")
        void unknownPresetExpectedValue() {
            assertThat(adapter.expectedValue(STRATEGY, REGIME, "turbo")).isEqualTo(0.5);
        }
    }

    // ========================================================================
    // UPDATES
    // ========================================================================

    @Nested
    @DisplayName("Updates")
    class Updates {

        @Test
        @DisplayName("Positive reward increments alpha")
        void positiveReward() {
            adapter.update(STRATEGY, REGIME, Preset.AGGRESSIVE, 0.75);

            assertThat(params(Preset.AGGRESSIVE)).containsExactly(1.75, 1.0);
        }

        @Test
        @DisplayName("Zero and negative rewards increment beta by the magnitude")
        void negativeReward() {
            adapter.update(STRATEGY, REGIME, Preset.CONSERVATIVE, -0.5);
            adapter.update(STRATEGY, REGIME, Preset.CONSERVATIVE, 0.0);

            assertThat(params(Preset.CONSERVATIVE)).containsExactly(1.0, 1.5);
        }

        @Test
        @DisplayName("A single update moves alpha or beta by at most 2.0")
        void cappedUpdate() {
            adapter.update(STRATEGY, REGIME, Preset.MODERATE, 9.5);
            adapter.update(STRATEGY, REGIME, Preset.MODERATE, -40.0);

            assertThat(params(Preset.MODERATE)).containsExactly(4.0, 3.0);
        }

        @Test
        @DisplayName("Unknown preset name is a no-op and never creates a context")
        void unknownPresetIgnored() {
            adapter.update(STRATEGY, REGIME, "turbo", 1.0);
            adapter.update(STRATEGY, REGIME, (String) null, 1.0);

            assertThat(adapter.contextCount()).isZero();
            assertThat(adapter.toSnapshot()).isEmpty();
        }

        @Test
        @DisplayName("Preset names are matched case-insensitively")
        void presetNameCase() {
            adapter.update(STRATEGY, REGIME, "Aggressive", 1.0);

            assertThat(params(Preset.AGGRESSIVE)).containsExactly(2.0, 1.0);
        }

        @Test
        @DisplayName("NaN reward is ignored")
        void nanIgnored() {
            adapter.update(STRATEGY, REGIME, Preset.MODERATE, Double.NaN);

            assertThat(adapter.contextCount()).isZero();
        }

        @Test
        @DisplayName("Alpha and beta never decrease and grow by at most 2.0 per call")
        void monotonicity() {
            Random rewards = new Random(7);
            Preset[] presets = Preset.values();
            for (int i = 0; i < 2_000; i++) {
                Preset preset = presets[rewards.nextInt(presets.length)];
                double reward = (rewards.nextDouble() - 0.5) * 20;
                adapter.selectPreset(STRATEGY, REGIME);
                List<Double> before = new ArrayList<>(params(preset));

                adapter.update(STRATEGY, REGIME, preset, reward);

                List<Double> after = params(preset);
                assertThat(after.get(0)).isGreaterThanOrEqualTo(before.get(0));
                assertThat(after.get(1)).isGreaterThanOrEqualTo(before.get(1));
                assertThat(after.get(0) - before.get(0)).isLessThanOrEqualTo(ParameterAdapter.MAX_UPDATE + 1e-9);
                assertThat(after.get(1) - before.get(1)).isLessThanOrEqualTo(ParameterAdapter.MAX_UPDATE + 1e-9);
            }
        }
    }

    // ========================================================================
    // SELECTION
    // ========================================================================

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Best expected ties go to the earlier preset")
        void tieBreak() {
            // conservative becomes (2,1), equal to the moderate prior
            adapter.update(STRATEGY, REGIME, Preset.CONSERVATIVE, 1.0);

            ParameterAdapter.BestPreset best = adapter.bestExpected(STRATEGY, REGIME);

            assertThat(best.preset()).isEqualTo(Preset.CONSERVATIVE);
            assertThat(best.expectedValue()).isCloseTo(2.0 / 3.0, within(1e-9));
        }

        @Test
        @DisplayName("Same seed gives the same sequence of choices")
        void reproducible() {
            ParameterAdapter other = new ParameterAdapter(new Well19937c(42));
            List<Preset> first = new ArrayList<>();
            List<Preset> second = new ArrayList<>();

            for (int i = 0; i < 50; i++) {
                first.add(adapter.selectPreset(STRATEGY, REGIME));
                second.add(other.selectPreset(STRATEGY, REGIME));
            }

            assertThat(first).isEqualTo(second);
        }

        @Test
        @DisplayName("A clearly dominant preset is chosen almost every time")
        void exploitsWinner() {
            for (int i = 0; i < 40; i++) {
                adapter.update(STRATEGY, REGIME, Preset.AGGRESSIVE, 2.0);
                adapter.update(STRATEGY, REGIME, Preset.CONSERVATIVE, -2.0);
                adapter.update(STRATEGY, REGIME, Preset.MODERATE, -2.0);
            }

            int aggressive = 0;
            for (int i = 0; i < 200; i++) {
                if (adapter.selectPreset(STRATEGY, REGIME) == Preset.AGGRESSIVE) {
                    aggressive++;
                }
            }

            assertThat(aggressive).isGreaterThan(195);
        }

        @Test
        @DisplayName("Contexts are independent per strategy and regime")
        void independentContexts() {
            adapter.update(STRATEGY, REGIME, Preset.AGGRESSIVE, 2.0);

            assertThat(adapter.expectedValue(STRATEGY, "RANGING", "aggressive")).isEqualTo(0.5);
            assertThat(adapter.expectedValue("B", REGIME, "aggressive")).isEqualTo(0.5);
            assertThat(adapter.expectedValue(STRATEGY, REGIME, "aggressive")).isCloseTo(0.75, within(1e-9));
        }
    }

    // ========================================================================
    // SNAPSHOT
    // ========================================================================

    @Nested
    @DisplayName("Snapshot and restore")
    class SnapshotRestore {

        @Test
        @DisplayName("Restored adapter reports the same distributions")
        void roundTrip() {
            adapter.update(STRATEGY, REGIME, Preset.AGGRESSIVE, 1.5);
            adapter.update("B", "RANGING", Preset.CONSERVATIVE, -0.5);

            ParameterAdapter restored = new ParameterAdapter(new Well19937c(1));
            restored.restore(adapter.toSnapshot());

            assertThat(restored.getAllDistributions()).isEqualTo(adapter.getAllDistributions());
        }

        @Test
        @DisplayName("Malformed entries are skipped and missing presets get the prior")
        void malformedEntries() {
            Map<String, List<Double>> presets = new LinkedHashMap<>();
            presets.put("aggressive", List.of(5.0, 2.0));
            presets.put("turbo", List.of(3.0, 3.0));
            presets.put("conservative", List.of(-1.0, 2.0));

            Map<String, Map<String, List<Double>>> snapshot = new LinkedHashMap<>();
            snapshot.put("A|TRENDING_UP", presets);
            snapshot.put("no-separator", Map.of("moderate", List.of(1.0, 1.0)));
            snapshot.put("|RANGING", Map.of("moderate", List.of(1.0, 1.0)));

            adapter.restore(snapshot);

            assertThat(adapter.contextCount()).isEqualTo(1);
            assertThat(params(Preset.AGGRESSIVE)).containsExactly(5.0, 2.0);
            assertThat(params(Preset.CONSERVATIVE)).containsExactly(1.0, 1.0);
            assertThat(params(Preset.MODERATE)).containsExactly(2.0, 1.0);
        }

        @Test
        @DisplayName("Restoring null clears every context")
        void restoreNull() {
            adapter.selectPreset(STRATEGY, REGIME);

            adapter.restore(null);

            assertThat(adapter.contextCount()).isZero();
        }
    }
}
