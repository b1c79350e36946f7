package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Normalized quote produced by a source adapter, optionally enriched with history
 * by the acquisition layer.
 *
 * <p>Invariants: {@code currentPrice > 0}; {@code history} is ascending by date and never null.
 * Instances are never mutated; enrichment returns a copy.
 */
public record PriceRecord(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("currentPrice") double currentPrice,
    @JsonProperty("change") double change,
    @JsonProperty("changePercent") double changePercent,
    @JsonProperty("volume") long volume,
    @JsonProperty("high") double high,
    @JsonProperty("low") double low,
    @JsonProperty("open") double open,
    @JsonProperty("previousClose") double previousClose,
    @JsonProperty("source") String source,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("history") List<Bar> history,
    @JsonProperty("assetType") AssetType assetType,
    @JsonProperty("period") String period
) {

    public PriceRecord {
        history = history == null ? List.of() : List.copyOf(history);
    }

    /** Quote as returned by an adapter: no history, asset type or period yet. */
    public static PriceRecord quote(String symbol, double currentPrice, double change,
                                    double changePercent, long volume, double high, double low,
                                    double open, double previousClose, String source) {
        return new PriceRecord(symbol, currentPrice, change, changePercent, volume, high, low,
            open, previousClose, source, Instant.now(), List.of(), null, null);
    }

    public PriceRecord withAcquisition(List<Bar> bars, AssetType type, String requestedPeriod) {
        return new PriceRecord(symbol, currentPrice, change, changePercent, volume, high, low,
            open, previousClose, source, timestamp, bars, type, requestedPeriod);
    }
}
