package com.trading.brain.allocation;

import com.trading.brain.config.BrainConfig;
import com.trading.brain.model.Rounding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Allocation math: fitness scores to target percentages, and smoothing from the current split
 * toward the target.
 *
 * Both results sum to 100 (one decimal place, residual folded into the largest entry that can
 * take it) and stay inside [min, max]. Smoothing additionally moves no strategy by more than
 * the per-rebalance step.
 */
public class AllocationCalculator {
    private static final Logger logger = LoggerFactory.getLogger(AllocationCalculator.class);

    static final double TOTAL = 100.0;
    private static final double EPSILON = 1e-9;

    private final double minPct;
    private final double maxPct;
    private final double maxStep;

    public AllocationCalculator(BrainConfig config) {
        this(config.getMinAllocationPct(), config.getMaxAllocationPct(), config.getMaxChangePerRebalance());
    }

    public AllocationCalculator(double minPct, double maxPct, double maxStep) {
        if (minPct < 0 || maxPct < minPct || maxStep <= 0) {
            throw new IllegalArgumentException(String.format(
                "Invalid allocation bounds: min=%s max=%s step=%s", minPct, maxPct, maxStep));
        }
        this.minPct = minPct;
        this.maxPct = maxPct;
        this.maxStep = maxStep;
    }

    // ===== TARGET =====

    /**
     * Proportional split of 100% by score, clamped to [min, max] with the excess or shortfall
     * redistributed over the unclamped strategies. Non-positive total score gives an equal split.
     */
    public Map<String, Double> targetAllocations(Map<String, Double> scores, List<String> codes) {
        Map<String, Double> raw = new LinkedHashMap<>();
        double totalScore = 0.0;
        for (String code : codes) {
            double score = Math.max(0.0, scores.getOrDefault(code, 0.0));
            raw.put(code, score);
            totalScore += score;
        }

        if (totalScore <= 0) {
            Map<String, Double> equal = new LinkedHashMap<>();
            codes.forEach(code -> equal.put(code, TOTAL / codes.size()));
            return roundToTotal(equal, boundsMap(codes, minPct), boundsMap(codes, maxPct));
        }

        if (codes.size() * minPct > TOTAL + EPSILON || codes.size() * maxPct < TOTAL - EPSILON) {
            logger.warn("Allocation bounds [{}, {}] cannot hold {} strategies, clamping and normalizing",
                minPct, maxPct, codes.size());
            double scoreSum = totalScore;
            Map<String, Double> clamped = new LinkedHashMap<>();
            raw.forEach((code, score) -> clamped.put(code, Rounding.clamp(score / scoreSum * TOTAL, minPct, maxPct)));
            return roundToTotal(normalize(clamped), boundsMap(codes, 0.0), boundsMap(codes, TOTAL));
        }

        Map<String, Double> target = waterFill(raw);
        return roundToTotal(target, boundsMap(codes, minPct), boundsMap(codes, maxPct));
    }

    /**
     * Pins strategies that overflow the cap at the cap (then those under the floor at the
     * floor) and rescales the remaining ones until nothing violates the bounds.
     */
    private Map<String, Double> waterFill(Map<String, Double> raw) {
        Map<String, Double> pinned = new LinkedHashMap<>();
        Set<String> free = new LinkedHashSet<>(raw.keySet());
        Map<String, Double> values = new LinkedHashMap<>();

        for (int iteration = 0; iteration <= raw.size(); iteration++) {
            double budget = TOTAL - pinned.values().stream().mapToDouble(Double::doubleValue).sum();
            double freeScore = free.stream().mapToDouble(raw::get).sum();
            values.clear();
            values.putAll(pinned);
            for (String code : free) {
                double share = freeScore > 0 ? raw.get(code) / freeScore : 1.0 / free.size();
                values.put(code, budget * share);
            }

            Set<String> over = new LinkedHashSet<>();
            Set<String> under = new LinkedHashSet<>();
            for (String code : free) {
                double v = values.get(code);
                if (v > maxPct + EPSILON) {
                    over.add(code);
                } else if (v < minPct - EPSILON) {
                    under.add(code);
                }
            }
            if (over.isEmpty() && under.isEmpty()) {
                break;
            }
            Set<String> toPin = over.isEmpty() ? under : over;
            double pinValue = over.isEmpty() ? minPct : maxPct;
            for (String code : toPin) {
                pinned.put(code, pinValue);
                free.remove(code);
            }
            if (free.isEmpty()) {
                values.clear();
                values.putAll(pinned);
                break;
            }
        }

        Map<String, Double> ordered = new LinkedHashMap<>();
        raw.keySet().forEach(code -> ordered.put(code, values.get(code)));
        return ordered;
    }

    // ===== SMOOTHING =====

    /**
     * Moves each strategy from its current share toward its target by at most the step,
     * keeping the floor and cap, then spreads any leftover over strategies that still have
     * room inside their step band. Missing entries default to an equal split.
     */
    public Map<String, Double> smooth(Map<String, Double> current, Map<String, Double> target, List<String> codes) {
        double equal = TOTAL / codes.size();
        Map<String, Double> lower = new LinkedHashMap<>();
        Map<String, Double> upper = new LinkedHashMap<>();
        Map<String, Double> smoothed = new LinkedHashMap<>();

        for (String code : codes) {
            double cur = valueOr(current.get(code), equal);
            double tgt = valueOr(target.get(code), equal);
            double lo = Math.max(minPct, cur - maxStep);
            double hi = Math.min(maxPct, cur + maxStep);
            if (lo > hi) {
                // Previous split was already out of bounds.
                lo = cur < minPct ? minPct : cur - maxStep;
                hi = lo;
            }
            lower.put(code, lo);
            upper.put(code, hi);
            smoothed.put(code, Rounding.clamp(tgt, lo, hi));
        }

        double residual = TOTAL - sum(smoothed);
        if (Math.abs(residual) > EPSILON) {
            if (!spread(smoothed, lower, upper, residual)) {
                logger.warn("Cannot keep step and bounds while summing to 100 (residual {}), normalizing",
                    Rounding.round(residual, 2));
                Map<String, Double> normalized = normalize(smoothed);
                return roundToTotal(normalized, boundsMap(codes, 0.0), boundsMap(codes, TOTAL));
            }
        }
        return roundToTotal(smoothed, lower, upper);
    }

    /** Distributes the residual proportionally to each entry's room in the needed direction. */
    private static boolean spread(Map<String, Double> values, Map<String, Double> lower,
                                  Map<String, Double> upper, double residual) {
        Map<String, Double> room = new LinkedHashMap<>();
        double totalRoom = 0.0;
        for (Map.Entry<String, Double> e : values.entrySet()) {
            String code = e.getKey();
            double r = residual > 0 ? upper.get(code) - e.getValue() : e.getValue() - lower.get(code);
            room.put(code, Math.max(0.0, r));
            totalRoom += Math.max(0.0, r);
        }
        if (totalRoom + EPSILON < Math.abs(residual)) {
            return false;
        }
        double fraction = Math.abs(residual) / totalRoom;
        double sign = Math.signum(residual);
        room.forEach((code, r) -> values.put(code, values.get(code) + sign * r * fraction));
        return true;
    }

    // ===== ROUNDING =====

    /**
     * Rounds to one decimal and folds the rounding residual into the largest entry that can
     * absorb it without leaving its bounds.
     */
    private static Map<String, Double> roundToTotal(Map<String, Double> values, Map<String, Double> lower,
                                                    Map<String, Double> upper) {
        Map<String, Double> rounded = new LinkedHashMap<>();
        values.forEach((code, v) -> rounded.put(code, Rounding.round(v, 1)));

        double diff = Rounding.round(TOTAL - sum(rounded), 1);
        if (Math.abs(diff) < 0.05) {
            return rounded;
        }

        String best = null;
        for (Map.Entry<String, Double> e : rounded.entrySet()) {
            double candidate = e.getValue() + diff;
            boolean fits = candidate >= lower.get(e.getKey()) - 0.05 && candidate <= upper.get(e.getKey()) + 0.05;
            if (fits && (best == null || e.getValue() > rounded.get(best))) {
                best = e.getKey();
            }
        }
        if (best != null) {
            rounded.put(best, Rounding.round(rounded.get(best) + diff, 1));
        }
        return rounded;
    }

    private static Map<String, Double> normalize(Map<String, Double> values) {
        double total = sum(values);
        Map<String, Double> result = new LinkedHashMap<>();
        values.forEach((code, v) -> result.put(code, total > 0 ? v / total * TOTAL : TOTAL / values.size()));
        return result;
    }

    private static double sum(Map<String, Double> values) {
        return values.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    private static Map<String, Double> boundsMap(List<String> codes, double bound) {
        Map<String, Double> result = new LinkedHashMap<>();
        codes.forEach(code -> result.put(code, bound));
        return result;
    }

    static double valueOr(Double value, double fallback) {
        return value == null || !Double.isFinite(value) ? fallback : value;
    }

    public double getMinPct() {
        return minPct;
    }

    public double getMaxPct() {
        return maxPct;
    }

    public double getMaxStep() {
        return maxStep;
    }
}
