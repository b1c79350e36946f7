package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Strength of a primary signal, serialized as its integer level (1–5).
 */
public enum SignalStrength {
    VERY_WEAK(1),
    WEAK(2),
    MODERATE(3),
    STRONG(4),
    VERY_STRONG(5);

    private final int level;

    SignalStrength(int level) {
        this.level = level;
    }

    @JsonValue
    public int level() {
        return level;
    }

    public boolean isAtLeast(SignalStrength other) {
        return level >= other.level;
    }

    @JsonCreator
    public static SignalStrength fromLevel(int level) {
        for (SignalStrength s : values()) {
            if (s.level == level) return s;
        }
        throw new IllegalArgumentException("Unknown signal strength level: " + level);
    }
}
