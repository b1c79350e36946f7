package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Indicator values computed for one symbol. Every component is optional: an empty value
 * means the price series was too short for that indicator, never zero.
 */
public record IndicatorSet(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("rsi") OptionalDouble rsi,
    @JsonProperty("ema20") OptionalDouble ema20,
    @JsonProperty("ema50") OptionalDouble ema50,
    @JsonProperty("sma20") OptionalDouble sma20,
    @JsonProperty("atr") OptionalDouble atr,
    @JsonProperty("williamsR") OptionalDouble williamsR,
    @JsonProperty("macd") Optional<MacdResult> macd,
    @JsonProperty("bollingerBands") Optional<BollingerBands> bollingerBands,
    @JsonProperty("stochastic") Optional<StochasticResult> stochastic
) {

    public IndicatorSet {
        rsi            = rsi == null ? OptionalDouble.empty() : rsi;
        ema20          = ema20 == null ? OptionalDouble.empty() : ema20;
        ema50          = ema50 == null ? OptionalDouble.empty() : ema50;
        sma20          = sma20 == null ? OptionalDouble.empty() : sma20;
        atr            = atr == null ? OptionalDouble.empty() : atr;
        williamsR      = williamsR == null ? OptionalDouble.empty() : williamsR;
        macd           = macd == null ? Optional.empty() : macd;
        bollingerBands = bollingerBands == null ? Optional.empty() : bollingerBands;
        stochastic     = stochastic == null ? Optional.empty() : stochastic;
    }

    public static IndicatorSet empty(String symbol) {
        return new IndicatorSet(symbol, null, null, null, null, null, null, null, null, null);
    }
}
