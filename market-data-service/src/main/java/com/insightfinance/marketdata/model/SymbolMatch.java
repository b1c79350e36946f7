package com.insightfinance.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.insightfinance.common.model.AssetType;

public record SymbolMatch(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("name") String name,
    @JsonProperty("type") AssetType type
) {}
