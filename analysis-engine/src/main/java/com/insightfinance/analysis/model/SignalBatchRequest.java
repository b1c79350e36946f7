package com.insightfinance.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body of a multi-symbol signal call; {@code period} defaults to {@code 1mo}.
 */
public record SignalBatchRequest(
    @JsonProperty("symbols") List<String> symbols,
    @JsonProperty("period") String period
) {}
