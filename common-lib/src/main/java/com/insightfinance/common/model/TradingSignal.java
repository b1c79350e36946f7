package com.insightfinance.common.model;

public enum TradingSignal {
    BUY,
    SELL,
    HOLD
}
