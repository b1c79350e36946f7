package com.insightfinance.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Alpha Vantage {@code GLOBAL_QUOTE} payload. On errors the provider answers 200 with one of
 * {@code Error Message}, {@code Note} (rate limit) or {@code Information} (quota) instead.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageQuoteResponse(
    @JsonProperty("Global Quote") GlobalQuote globalQuote,
    @JsonProperty("Error Message") String errorMessage,
    @JsonProperty("Note") String note,
    @JsonProperty("Information") String information
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GlobalQuote(
        @JsonProperty("01. symbol") String symbol,
        @JsonProperty("02. open") String open,
        @JsonProperty("03. high") String high,
        @JsonProperty("04. low") String low,
        @JsonProperty("05. price") String price,
        @JsonProperty("06. volume") String volume,
        @JsonProperty("08. previous close") String previousClose,
        @JsonProperty("09. change") String change,
        @JsonProperty("10. change percent") String changePercent
    ) {}
}
