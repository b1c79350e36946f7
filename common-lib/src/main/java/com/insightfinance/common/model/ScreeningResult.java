package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ScreeningResult(
    @JsonProperty("strategy") String strategy,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("totalAssetsScreened") int totalAssetsScreened,
    @JsonProperty("totalResults") int totalResults,
    @JsonProperty("assets") List<ScreenedAsset> assets,
    @JsonProperty("sectorBreakdown") Map<String, Integer> sectorBreakdown,
    @JsonProperty("performanceSummary") PerformanceSummary performanceSummary
) {

    public record PerformanceSummary(
        @JsonProperty("averageScore") double averageScore,
        @JsonProperty("averageChange") double averageChange,
        @JsonProperty("buySignals") int buySignals,
        @JsonProperty("sellSignals") int sellSignals,
        @JsonProperty("holdSignals") int holdSignals
    ) {}
}
