package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Complete technical-analysis result for one symbol and period.
 *
 * <p>{@code syntheticHistory} is {@code true} when no market history was available and the
 * indicators were computed from a generated series around the current price.
 */
public record SignalBundle(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("currentPrice") double currentPrice,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("period") String period,
    @JsonProperty("signal") TradingSignal signal,
    @JsonProperty("signalStrength") SignalStrength signalStrength,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("trendDirection") TrendDirection trendDirection,
    @JsonProperty("riskLevel") RiskLevel riskLevel,
    @JsonProperty("reasoning") List<String> reasoning,
    @JsonProperty("individualSignals") Map<String, IndicatorVote> individualSignals,
    @JsonProperty("indicators") IndicatorSet indicators,
    @JsonProperty("syntheticHistory") boolean syntheticHistory
) {}
