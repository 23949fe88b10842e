package com.trading.brain.model;

import java.util.Optional;

/**
 * Parameter presets the bandit chooses between. Declaration order is the iteration
 * order used for tie-breaks.
 */
public enum Preset {
    CONSERVATIVE("conservative", 1.0, 1.0),
    MODERATE("moderate", 2.0, 1.0),
    AGGRESSIVE("aggressive", 1.0, 1.0);

    private final String key;
    private final double priorAlpha;
    private final double priorBeta;

    Preset(String key, double priorAlpha, double priorBeta) {
        this.key = key;
        this.priorAlpha = priorAlpha;
        this.priorBeta = priorBeta;
    }

    /** Lower-case name used in snapshots and reason strings. */
    public String key() {
        return key;
    }

    public double priorAlpha() {
        return priorAlpha;
    }

    public double priorBeta() {
        return priorBeta;
    }

    public static Optional<Preset> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (Preset preset : values()) {
            if (preset.key.equalsIgnoreCase(key.trim())) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
}
