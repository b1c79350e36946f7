package com.insightfinance.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SymbolSearchResponse(
    @JsonProperty("query") String query,
    @JsonProperty("totalResults") int totalResults,
    @JsonProperty("symbols") List<SymbolMatch> symbols
) {
    public static SymbolSearchResponse of(String query, List<SymbolMatch> matches) {
        return new SymbolSearchResponse(query, matches.size(), matches);
    }
}
