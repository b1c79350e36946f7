package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bollinger envelope. {@code percentB} is 50 when the band has zero width.
 */
public record BollingerBands(
    @JsonProperty("upper") double upper,
    @JsonProperty("middle") double middle,
    @JsonProperty("lower") double lower,
    @JsonProperty("width") double width,
    @JsonProperty("percentB") double percentB
) {}
