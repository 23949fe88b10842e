package com.trading.brain.model;

public enum StreakType {
    WIN("win"),
    LOSS("loss"),
    NONE("none");

    private final String key;

    StreakType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static StreakType fromKey(String key) {
        if (key == null) {
            return NONE;
        }
        for (StreakType type : values()) {
            if (type.key.equalsIgnoreCase(key.trim())) {
                return type;
            }
        }
        return NONE;
    }
}
