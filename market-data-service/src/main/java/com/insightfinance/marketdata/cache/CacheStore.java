package com.insightfinance.marketdata.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Namespaced key/value store with per-entry TTL.
 *
 * <p>The cache is an optimization, never a dependency. Implementations must:
 * <ul>
 *   <li><b>Never error</b>: a failing read completes empty, a failing write emits {@code false}</li>
 *   <li><b>Never serve stale data</b>: an entry read past its expiry is a miss</li>
 *   <li><b>Overwrite on write</b>: last writer wins, no versioning</li>
 * </ul>
 * Callers still guard every call with {@code onErrorResume} so that a misbehaving
 * implementation degrades to "fetch fresh".
 */
public interface CacheStore {

    /** Cached value, or empty on absence, expiry or failure. */
    <T> Mono<T> get(String namespace, String key, Class<T> type);

    /** Stores {@code value} for {@code ttl}; emits {@code false} when the store is unavailable. */
    Mono<Boolean> set(String namespace, String key, Object value, Duration ttl);

    Mono<Boolean> delete(String namespace, String key);

    Mono<Boolean> exists(String namespace, String key);

    /** Time left before expiry; empty when the key is absent or already expired. */
    Mono<Duration> remainingTtl(String namespace, String key);

    /** Removes every entry of the namespace and emits how many were dropped. */
    Mono<Long> clearNamespace(String namespace);
}
