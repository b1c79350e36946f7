package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Indicator values of a {@link SignalBundle} without the fused decision.
 */
public record IndicatorSnapshot(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("period") String period,
    @JsonProperty("currentPrice") double currentPrice,
    @JsonProperty("indicators") IndicatorSet indicators
) {
    public static IndicatorSnapshot of(SignalBundle bundle) {
        return new IndicatorSnapshot(bundle.symbol(), bundle.timestamp(), bundle.period(),
            bundle.currentPrice(), bundle.indicators());
    }
}
