package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk classification derived from signal confidence.
 */
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    RiskLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** confidence &gt; 80 → LOW, &gt; 60 → MEDIUM, otherwise HIGH. */
    public static RiskLevel fromConfidence(double confidence) {
        if (confidence > 80.0) return LOW;
        if (confidence > 60.0) return MEDIUM;
        return HIGH;
    }
}
