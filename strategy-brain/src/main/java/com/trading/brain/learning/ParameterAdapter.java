package com.trading.brain.learning;

import com.trading.brain.model.Preset;
import com.trading.brain.model.PresetStats;
import com.trading.brain.model.Rounding;
import com.trading.brain.model.StrategyContext;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Thompson sampling over parameter presets, one independent three-arm bandit per
 * (strategy, regime) context. Each arm is a Beta(alpha, beta) belief about the preset's
 * success rate.
 *
 * Contexts are created with the fixed prior on the first {@link #selectPreset} for the pair;
 * read operations on an unseen context answer from that prior without storing it.
 * Not thread-safe: the owning {@link TradeLearner} serializes access.
 */
public class ParameterAdapter {
    private static final Logger logger = LoggerFactory.getLogger(ParameterAdapter.class);

    /** Upper bound on what a single trade may add to alpha or beta. */
    public static final double MAX_UPDATE = 2.0;
    public static final double UNKNOWN_EXPECTED_VALUE = 0.5;

    private final RandomGenerator random;
    private final Map<StrategyContext, EnumMap<Preset, BetaArm>> contexts = new TreeMap<>();

    public ParameterAdapter(RandomGenerator random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /** Best preset by expected value. */
    public record BestPreset(Preset preset, double expectedValue) {}

    /**
     * Draws one sample per arm and returns the preset with the highest draw.
     * Ties keep the earlier preset in declaration order.
     */
    public Preset selectPreset(String strategy, String regime) {
        EnumMap<Preset, BetaArm> arms = contexts.computeIfAbsent(new StrategyContext(strategy, regime), k -> priorArms());

        Preset best = null;
        double bestSample = Double.NEGATIVE_INFINITY;
        for (Map.Entry<Preset, BetaArm> entry : arms.entrySet()) {
            BetaArm arm = entry.getValue();
            double sample = new BetaDistribution(random, arm.alpha(), arm.beta()).sample();
            if (sample > bestSample) {
                bestSample = sample;
                best = entry.getKey();
            }
        }
        return best;
    }

    /**
     * Credits a positive reward to alpha, anything else to beta, each capped at {@link #MAX_UPDATE}.
     * Unknown preset names are ignored and never create an arm or a context.
     */
    public void update(String strategy, String regime, String presetKey, double reward) {
        Optional<Preset> preset = Preset.fromKey(presetKey);
        if (preset.isEmpty()) {
            logger.debug("Ignoring bandit update for unknown preset '{}' ({}|{})", presetKey, strategy, regime);
            return;
        }
        update(strategy, regime, preset.get(), reward);
    }

    public void update(String strategy, String regime, Preset preset, double reward) {
        if (Double.isNaN(reward)) {
            return;
        }
        BetaArm arm = contexts.computeIfAbsent(new StrategyContext(strategy, regime), k -> priorArms()).get(preset);
        if (reward > 0) {
            arm.addSuccess(Math.min(reward, MAX_UPDATE));
        } else {
            arm.addFailure(Math.min(Math.abs(reward), MAX_UPDATE));
        }
    }

    public double expectedValue(String strategy, String regime, String presetKey) {
        return Preset.fromKey(presetKey)
            .map(preset -> armsOrPrior(strategy, regime).get(preset).expectedValue())
            .orElse(UNKNOWN_EXPECTED_VALUE);
    }

    /** Highest expected value; the first preset reaching the maximum wins. */
    public BestPreset bestExpected(String strategy, String regime) {
        Preset best = null;
        double bestEv = 0.0;
        for (Map.Entry<Preset, BetaArm> entry : armsOrPrior(strategy, regime).entrySet()) {
            double ev = entry.getValue().expectedValue();
            if (ev > bestEv) {
                bestEv = ev;
                best = entry.getKey();
            }
        }
        return best == null ? new BestPreset(Preset.MODERATE, UNKNOWN_EXPECTED_VALUE) : new BestPreset(best, bestEv);
    }

    /** Dashboard view keyed {@code strategy_regime}, values rounded to 3 decimals. */
    public Map<String, Map<String, PresetStats>> getAllDistributions() {
        Map<String, Map<String, PresetStats>> result = new LinkedHashMap<>();
        contexts.forEach((context, arms) -> {
            Map<String, PresetStats> presets = new LinkedHashMap<>();
            arms.forEach((preset, arm) -> presets.put(preset.key(), new PresetStats(
                Rounding.round(arm.alpha(), 3),
                Rounding.round(arm.beta(), 3),
                Rounding.round(arm.expectedValue(), 3))));
            result.put(context.displayKey(), presets);
        });
        return result;
    }

    public int contextCount() {
        return contexts.size();
    }

    public boolean hasContext(String strategy, String regime) {
        return contexts.containsKey(new StrategyContext(strategy, regime));
    }

    /** Serialized form: {@code "strategy|regime" -> preset -> [alpha, beta]}. */
    public Map<String, Map<String, List<Double>>> toSnapshot() {
        Map<String, Map<String, List<Double>>> result = new LinkedHashMap<>();
        contexts.forEach((context, arms) -> {
            Map<String, List<Double>> presets = new LinkedHashMap<>();
            arms.forEach((preset, arm) -> presets.put(preset.key(), List.of(arm.alpha(), arm.beta())));
            result.put(context.key(), presets);
        });
        return result;
    }

    /**
     * Replaces all contexts with the serialized ones. Malformed keys, unknown presets and
     * non-positive parameters are skipped; presets missing from a context get the prior.
     */
    public void restore(Map<String, Map<String, List<Double>>> snapshot) {
        contexts.clear();
        if (snapshot == null) {
            return;
        }
        int skipped = 0;
        for (Map.Entry<String, Map<String, List<Double>>> entry : snapshot.entrySet()) {
            Optional<StrategyContext> context = StrategyContext.parse(entry.getKey());
            if (context.isEmpty() || entry.getValue() == null) {
                skipped++;
                continue;
            }
            EnumMap<Preset, BetaArm> arms = priorArms();
            for (Map.Entry<String, List<Double>> presetEntry : entry.getValue().entrySet()) {
                Optional<Preset> preset = Preset.fromKey(presetEntry.getKey());
                List<Double> params = presetEntry.getValue();
                if (preset.isEmpty() || !validParams(params)) {
                    skipped++;
                    continue;
                }
                arms.put(preset.get(), new BetaArm(params.get(0), params.get(1)));
            }
            contexts.put(context.get(), arms);
        }
        if (skipped > 0) {
            logger.warn("Skipped {} malformed bandit entries while restoring", skipped);
        }
        logger.info("Restored {} bandit contexts", contexts.size());
    }

    private static boolean validParams(List<Double> params) {
        if (params == null || params.size() != 2) {
            return false;
        }
        for (Double v : params) {
            if (v == null || !Double.isFinite(v) || v <= 0) {
                return false;
            }
        }
        return true;
    }

    private EnumMap<Preset, BetaArm> armsOrPrior(String strategy, String regime) {
        EnumMap<Preset, BetaArm> arms = contexts.get(new StrategyContext(strategy, regime));
        return arms != null ? arms : priorArms();
    }

    private static EnumMap<Preset, BetaArm> priorArms() {
        EnumMap<Preset, BetaArm> arms = new EnumMap<>(Preset.class);
        for (Preset preset : Preset.values()) {
            arms.put(preset, new BetaArm(preset.priorAlpha(), preset.priorBeta()));
        }
        return arms;
    }

    /** Mutable Beta(alpha, beta) parameters; both only grow. */
    static final class BetaArm {
        private double alpha;
        private double beta;

        BetaArm(double alpha, double beta) {
            this.alpha = alpha;
            this.beta = beta;
        }

        double alpha() {
            return alpha;
        }

        double beta() {
            return beta;
        }

        void addSuccess(double weight) {
            alpha += weight;
        }

        void addFailure(double weight) {
            beta += weight;
        }

        double expectedValue() {
            return alpha / (alpha + beta);
        }
    }
}
