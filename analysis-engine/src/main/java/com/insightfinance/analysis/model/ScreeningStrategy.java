package com.insightfinance.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pre-defined screening strategies. Only momentum, value, growth and technical change the
 * score; the others rank by the base score and are kept so that clients can name them.
 */
public enum ScreeningStrategy {
    MOMENTUM("momentum", "Momentum Strategy", "Stocks with strong price momentum and volume"),
    VALUE("value", "Value Strategy", "Undervalued stocks with strong fundamentals"),
    GROWTH("growth", "Growth Strategy", "High-growth stocks with strong earnings"),
    QUALITY("quality", "Quality Strategy", "High-quality stocks with strong balance sheets"),
    DIVIDEND("dividend", "Dividend Strategy", "High dividend yield stocks"),
    LOW_VOLATILITY("low_volatility", "Low Volatility Strategy", "Stable, low-risk stocks"),
    HIGH_BETA("high_beta", "High Beta Strategy", "High-beta stocks for aggressive growth"),
    TECHNICAL("technical", "Technical Strategy", "Stocks with strong technical signals"),
    SECTOR_ROTATION("sector_rotation", "Sector Rotation Strategy", "Sectors gaining relative strength");

    private final String wireName;
    private final String displayName;
    private final String description;

    ScreeningStrategy(String wireName, String displayName, String description) {
        this.wireName    = wireName;
        this.displayName = displayName;
        this.description = description;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public String displayName() { return displayName; }

    public String description() { return description; }
}
