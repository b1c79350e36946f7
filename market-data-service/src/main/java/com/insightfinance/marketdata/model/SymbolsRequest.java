package com.insightfinance.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body listing the symbols of a batch call.
 */
public record SymbolsRequest(
    @JsonProperty("symbols") List<String> symbols
) {
    public static final int MAX_SYMBOLS = 20;
}
