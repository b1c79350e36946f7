package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MacdResult(
    @JsonProperty("macd") double macd,
    @JsonProperty("signal") double signal,
    @JsonProperty("histogram") double histogram
) {}
