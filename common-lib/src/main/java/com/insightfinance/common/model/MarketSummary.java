package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Broad market snapshot: index ETFs plus movers of a fixed large-cap universe.
 */
public record MarketSummary(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("marketStatus") String marketStatus,
    @JsonProperty("indices") Map<String, IndexQuote> indices,
    @JsonProperty("topGainers") List<MarketMover> topGainers,
    @JsonProperty("topLosers") List<MarketMover> topLosers,
    @JsonProperty("mostActive") List<MarketMover> mostActive
) {

    public record IndexQuote(
        @JsonProperty("price") double price,
        @JsonProperty("change") double change,
        @JsonProperty("changePercent") double changePercent
    ) {}

    public record MarketMover(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("price") double price,
        @JsonProperty("change") double change,
        @JsonProperty("changePercent") double changePercent,
        @JsonProperty("volume") long volume
    ) {
        public static MarketMover of(PriceRecord record) {
            return new MarketMover(record.symbol(), record.currentPrice(), record.change(),
                record.changePercent(), record.volume());
        }
    }
}
