package com.insightfinance.marketdata.ratelimit;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-source request spacing for outbound provider calls.
 *
 * <p>One Resilience4j {@link RateLimiter} per source id, each admitting a single call per
 * {@code minInterval} window. Adapters apply it with
 * {@code .transformDeferred(RateLimiterOperator.of(limiterFor(id)))}, which reserves a permit
 * on subscription and delays the HTTP call until that permit's window opens. Concurrent
 * callers for one source therefore queue into successive windows; different sources never
 * wait on each other.
 *
 * <p>A caller whose reservation would wait longer than {@code maxWait} is refused with
 * {@code RequestNotPermitted}, which adapters treat like any other provider failure.
 */
public class SourceRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SourceRateLimiter.class);

    public static final Duration DEFAULT_MAX_WAIT = Duration.ofMinutes(5);

    private final Duration minInterval;
    private final RateLimiterConfig config;
    private final Map<String, RateLimiter> limiters = new ConcurrentHashMap<>();

    public SourceRateLimiter(Duration minInterval) {
        this(minInterval, DEFAULT_MAX_WAIT);
    }

    public SourceRateLimiter(Duration minInterval, Duration maxWait) {
        this.minInterval = minInterval.isNegative() ? Duration.ZERO : minInterval;
        this.config = this.minInterval.isZero()
            ? RateLimiterConfig.custom()
                .limitForPeriod(Integer.MAX_VALUE)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ZERO)
                .build()
            : RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(this.minInterval)
                .timeoutDuration(maxWait)
                .build();
    }

    /** The limiter guarding {@code sourceId}, created on first use. */
    public RateLimiter limiterFor(String sourceId) {
        return limiters.computeIfAbsent(sourceId, id -> {
            log.debug("RATE_LIMIT_REGISTERED source={} minIntervalMs={}", id, minInterval.toMillis());
            RateLimiter limiter = RateLimiter.of("source-" + id, config);
            limiter.getEventPublisher().onFailure(event ->
                log.warn("RATE_LIMIT_REJECTED source={} maxWaitMs={}", id,
                    config.getTimeoutDuration().toMillis()));
            return limiter;
        });
    }

    public Duration minInterval() {
        return minInterval;
    }
}
