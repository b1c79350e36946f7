package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    BULLISH("bullish"),
    BEARISH("bearish"),
    SIDEWAYS("sideways");

    private final String wireName;

    TrendDirection(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
