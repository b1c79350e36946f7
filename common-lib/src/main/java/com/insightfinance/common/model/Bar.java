package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One OHLCV bar. {@code date} is kept in the provider's ISO-style text form
 * ({@code 2024-05-31} or {@code 2024-05-31 16:00:00}) so that lexical order equals time order.
 */
public record Bar(
    @JsonProperty("date") String date,
    @JsonProperty("open") double open,
    @JsonProperty("high") double high,
    @JsonProperty("low") double low,
    @JsonProperty("close") double close,
    @JsonProperty("volume") long volume
) {}
