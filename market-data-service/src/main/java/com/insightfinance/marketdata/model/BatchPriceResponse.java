package com.insightfinance.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.insightfinance.common.model.PriceRecord;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Batch price result. Unavailable symbols map to {@code null} in {@code prices} and carry an
 * entry in {@code errors}.
 */
public record BatchPriceResponse(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("totalSymbols") int totalSymbols,
    @JsonProperty("successfulRequests") int successfulRequests,
    @JsonProperty("failedRequests") int failedRequests,
    @JsonProperty("prices") Map<String, PriceRecord> prices,
    @JsonProperty("errors") Map<String, String> errors
) {
    public static BatchPriceResponse from(Map<String, Optional<PriceRecord>> results) {
        Map<String, PriceRecord> prices = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        results.forEach((symbol, record) -> {
            prices.put(symbol, record.orElse(null));
            if (record.isEmpty()) {
                errors.put(symbol, "Data unavailable");
            }
        });
        int successful = results.size() - errors.size();
        return new BatchPriceResponse(Instant.now(), results.size(), successful, errors.size(), prices, errors);
    }
}
