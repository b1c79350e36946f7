package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Signal overview across several symbols. Symbols whose analysis failed carry an
 * {@link SymbolSummary#error()} instead of a signal.
 */
public record MarketOverview(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("totalSymbols") int totalSymbols,
    @JsonProperty("successfulAnalyses") int successfulAnalyses,
    @JsonProperty("signalsSummary") Map<TradingSignal, Integer> signalsSummary,
    @JsonProperty("strongSignals") List<StrongSignal> strongSignals,
    @JsonProperty("symbols") Map<String, SymbolSummary> symbols
) {

    public record StrongSignal(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("signal") TradingSignal signal,
        @JsonProperty("confidence") double confidence
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SymbolSummary(
        @JsonProperty("signal") TradingSignal signal,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("trend") TrendDirection trend,
        @JsonProperty("risk") RiskLevel risk,
        @JsonProperty("price") Double price,
        @JsonProperty("error") String error
    ) {
        public static SymbolSummary of(SignalBundle bundle) {
            return new SymbolSummary(bundle.signal(), bundle.confidence(), bundle.trendDirection(),
                bundle.riskLevel(), bundle.currentPrice(), null);
        }

        public static SymbolSummary failed(String error) {
            return new SymbolSummary(null, null, null, null, null, error);
        }
    }
}
