package com.insightfinance.marketdata.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.insightfinance.common.model.AssetType;

/**
 * Outcome of a symbol check. A valid symbol carries its asset type and quote currency; an
 * invalid one carries the reason.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SymbolValidation(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("name") String name,
    @JsonProperty("type") AssetType type,
    @JsonProperty("currency") String currency,
    @JsonProperty("source") String source,
    @JsonProperty("error") String error
) {
    public static SymbolValidation valid(String symbol, String name, AssetType type, String source) {
        return new SymbolValidation(true, symbol, name, type, "USD", source, null);
    }

    public static SymbolValidation invalid(String symbol, String error) {
        return new SymbolValidation(false, symbol, null, null, null, null, error);
    }
}
