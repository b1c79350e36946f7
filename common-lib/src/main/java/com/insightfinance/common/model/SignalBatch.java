package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.insightfinance.common.model.MarketOverview.StrongSignal;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full signal bundles for several symbols. {@code signals} has one entry per requested symbol,
 * {@code null} for the ones listed in {@code errors}.
 */
public record SignalBatch(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("period") String period,
    @JsonProperty("totalSymbols") int totalSymbols,
    @JsonProperty("successfulAnalyses") int successfulAnalyses,
    @JsonProperty("failedAnalyses") int failedAnalyses,
    @JsonProperty("signalsSummary") Map<TradingSignal, Integer> signalsSummary,
    @JsonProperty("strongSignals") List<StrongSignal> strongSignals,
    @JsonProperty("signals") Map<String, SignalBundle> signals,
    @JsonProperty("errors") Map<String, String> errors
) {}
