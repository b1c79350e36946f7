package com.insightfinance.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Screening criteria. Every field is optional; a missing strategy screens as "custom" with
 * the base score only.
 */
public record ScreeningRequest(
    @JsonProperty("strategy") ScreeningStrategy strategy,
    @JsonProperty("priceMin") Double priceMin,
    @JsonProperty("priceMax") Double priceMax,
    @JsonProperty("volumeMin") Long volumeMin,
    @JsonProperty("limit") Integer limit
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    public int effectiveLimit() {
        return limit == null ? DEFAULT_LIMIT : limit;
    }

    public boolean isValid() {
        return (limit == null || (limit >= 1 && limit <= MAX_LIMIT))
            && (priceMin == null || priceMin >= 0)
            && (priceMax == null || priceMax >= 0)
            && (volumeMin == null || volumeMin >= 0);
    }
}
