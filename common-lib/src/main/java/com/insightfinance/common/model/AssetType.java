package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Asset class of a ticker. Advisory only: it selects the provider order for
 * an acquisition and is never treated as ground truth.
 */
public enum AssetType {
    STOCK("stock"),
    CRYPTO("crypto"),
    FOREX("forex");

    private final String wireName;

    AssetType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
