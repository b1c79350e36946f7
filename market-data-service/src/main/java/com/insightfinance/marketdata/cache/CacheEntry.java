package com.insightfinance.marketdata.cache;

import java.time.Instant;

/**
 * Immutable cache entry: serialized JSON payload plus its absolute expiry instant.
 */
public record CacheEntry(
    String key,
    String payload,
    Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
