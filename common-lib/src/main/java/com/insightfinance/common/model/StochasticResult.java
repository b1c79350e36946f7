package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StochasticResult(
    @JsonProperty("k") double k,
    @JsonProperty("d") double d
) {}
