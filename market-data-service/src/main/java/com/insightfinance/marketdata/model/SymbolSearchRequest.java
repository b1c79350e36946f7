package com.insightfinance.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Free-text symbol search; {@code limit} defaults to 10.
 */
public record SymbolSearchRequest(
    @JsonProperty("query") String query,
    @JsonProperty("limit") Integer limit
) {
    public static final int MAX_QUERY_LENGTH = 50;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 50;

    public int effectiveLimit() {
        return limit == null ? DEFAULT_LIMIT : limit;
    }

    public boolean isValid() {
        return query != null && !query.isBlank() && query.length() <= MAX_QUERY_LENGTH
            && (limit == null || (limit >= 1 && limit <= MAX_LIMIT));
    }
}
