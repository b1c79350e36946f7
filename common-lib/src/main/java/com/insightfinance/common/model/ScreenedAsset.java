package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of a screening result, ranked by {@code score} (1 = best).
 */
public record ScreenedAsset(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("sector") String sector,
    @JsonProperty("industry") String industry,
    @JsonProperty("price") double price,
    @JsonProperty("change") double change,
    @JsonProperty("changePercent") double changePercent,
    @JsonProperty("volume") long volume,
    @JsonProperty("score") double score,
    @JsonProperty("rank") int rank,
    @JsonProperty("signal") TradingSignal signal,
    @JsonProperty("confidence") double confidence
) {
    public ScreenedAsset withRank(int newRank) {
        return new ScreenedAsset(symbol, sector, industry, price, change, changePercent, volume,
            score, newRank, signal, confidence);
    }
}
