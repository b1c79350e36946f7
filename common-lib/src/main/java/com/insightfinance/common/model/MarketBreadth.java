package com.insightfinance.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Signal breadth across the large-cap universe: BUY counts as advancing, SELL as declining,
 * HOLD as unchanged. {@code advanceDeclineRatio} is absent when nothing declines.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MarketBreadth(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("advancing") int advancing,
    @JsonProperty("declining") int declining,
    @JsonProperty("unchanged") int unchanged,
    @JsonProperty("advanceDeclineRatio") Double advanceDeclineRatio,
    @JsonProperty("breadthIndicator") double breadthIndicator,
    @JsonProperty("marketSentiment") String marketSentiment
) {}
