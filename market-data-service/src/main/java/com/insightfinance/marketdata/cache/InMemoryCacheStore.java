package com.insightfinance.marketdata.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process {@link CacheStore} backed by a {@link ConcurrentHashMap}.
 *
 * <p><strong>Fetch Once → Serve Many:</strong> values are serialized to JSON with the shared
 * {@link ObjectMapper} on write and deserialized on read, so a cached object is never shared
 * by reference and two reads of one entry are equal. Expired entries are evicted lazily on read.
 *
 * <p>Thread-safe: every write is a single atomic {@code put}; no cross-key transactions.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Clock clock;
    private final ConcurrentHashMap<String, CacheEntry> store = new ConcurrentHashMap<>();

    public InMemoryCacheStore(ObjectMapper objectMapper, String keyPrefix) {
        this(objectMapper, keyPrefix, Clock.systemUTC());
    }

    public InMemoryCacheStore(ObjectMapper objectMapper, String keyPrefix, Clock clock) {
        this.objectMapper = objectMapper;
        this.keyPrefix    = keyPrefix == null ? "" : keyPrefix;
        this.clock        = clock;
    }

    @Override
    public <T> Mono<T> get(String namespace, String key, Class<T> type) {
        return Mono.fromCallable(() -> {
                CacheEntry entry = liveEntry(fullKey(namespace, key));
                if (entry == null) {
                    return null;
                }
                return objectMapper.readValue(entry.payload(), type);
            })
            .onErrorResume(e -> {
                log.warn("CACHE_GET_FAILED key={} reason={}", fullKey(namespace, key), e.getMessage());
                return Mono.empty();
            });
    }

    @Override
    public Mono<Boolean> set(String namespace, String key, Object value, Duration ttl) {
        return Mono.fromCallable(() -> {
                String fullKey = fullKey(namespace, key);
                String payload = serialize(value);
                Instant expiresAt = clock.instant().plus(ttl);
                store.put(fullKey, new CacheEntry(fullKey, payload, expiresAt));
                log.debug("CACHE_SET key={} ttlSeconds={}", fullKey, ttl.toSeconds());
                return Boolean.TRUE;
            })
            .onErrorResume(e -> {
                log.warn("CACHE_SET_FAILED key={} reason={}", fullKey(namespace, key), e.getMessage());
                return Mono.just(Boolean.FALSE);
            });
    }

    @Override
    public Mono<Boolean> delete(String namespace, String key) {
        return Mono.fromSupplier(() -> store.remove(fullKey(namespace, key)) != null);
    }

    @Override
    public Mono<Boolean> exists(String namespace, String key) {
        return Mono.fromSupplier(() -> liveEntry(fullKey(namespace, key)) != null);
    }

    @Override
    public Mono<Duration> remainingTtl(String namespace, String key) {
        return Mono.fromCallable(() -> {
            CacheEntry entry = liveEntry(fullKey(namespace, key));
            return entry == null ? null : Duration.between(clock.instant(), entry.expiresAt());
        });
    }

    @Override
    public Mono<Long> clearNamespace(String namespace) {
        return Mono.fromSupplier(() -> {
            String prefix = keyPrefix + namespace + ":";
            long removed = 0;
            for (String k : store.keySet()) {
                if (k.startsWith(prefix) && store.remove(k) != null) {
                    removed++;
                }
            }
            log.info("CACHE_CLEAR namespace={} removed={}", namespace, removed);
            return removed;
        });
    }

    String fullKey(String namespace, String key) {
        return (namespace == null || namespace.isEmpty())
            ? keyPrefix + key
            : keyPrefix + namespace + ":" + key;
    }

    private CacheEntry liveEntry(String fullKey) {
        CacheEntry entry = store.get(fullKey);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            store.remove(fullKey, entry);
            return null;
        }
        return entry;
    }

    private String serialize(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsString(value);
    }
}
