package com.insightfinance.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.insightfinance.marketdata.cache.CacheStore;
import com.insightfinance.marketdata.cache.InMemoryCacheStore;
import com.insightfinance.marketdata.ratelimit.SourceRateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class MarketDataConfig {

    @Value("${market-data.rate-limit.min-interval:1s}")
    private Duration minRequestInterval;

    @Value("${market-data.rate-limit.max-wait:5m}")
    private Duration maxRateLimitWait;

    @Value("${market-data.cache.key-prefix:insightfinance:}")
    private String cacheKeyPrefix;

    /** Shared by every adapter so that per-source spacing holds across the whole process. */
    @Bean
    public SourceRateLimiter sourceRateLimiter() {
        return new SourceRateLimiter(minRequestInterval, maxRateLimitWait);
    }

    @Bean
    public CacheStore cacheStore(ObjectMapper objectMapper) {
        return new InMemoryCacheStore(objectMapper, cacheKeyPrefix);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return newObjectMapper();
    }

    /** Optional-aware, ISO-8601 timestamps; used for cache payloads and HTTP bodies alike. */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(new Jdk8Module());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
