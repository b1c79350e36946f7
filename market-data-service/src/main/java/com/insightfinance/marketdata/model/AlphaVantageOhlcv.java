package com.insightfinance.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.insightfinance.common.model.Bar;

/**
 * One entry of any Alpha Vantage {@code TIME_SERIES_*} map. Values arrive as strings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageOhlcv(
    @JsonProperty("1. open") String open,
    @JsonProperty("2. high") String high,
    @JsonProperty("3. low") String low,
    @JsonProperty("4. close") String close,
    @JsonProperty("5. volume") String volume
) {
    public Bar toBar(String date) {
        return new Bar(date,
            Double.parseDouble(open),
            Double.parseDouble(high),
            Double.parseDouble(low),
            Double.parseDouble(close),
            Long.parseLong(volume));
    }
}
