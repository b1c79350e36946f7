package com.insightfinance.common.model;

/**
 * Directional reading of a single indicator during signal fusion.
 */
public enum IndicatorVote {
    STRONG_BUY,
    BUY,
    NEUTRAL,
    SELL,
    STRONG_SELL
}
