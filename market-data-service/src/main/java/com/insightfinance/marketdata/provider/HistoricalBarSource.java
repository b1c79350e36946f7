package com.insightfinance.marketdata.provider;

import com.insightfinance.common.model.Bar;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Capability of a {@link QuoteSource} that can also supply OHLCV history.
 * Bars are ascending by date; failures complete empty.
 */
public interface HistoricalBarSource {

    Mono<List<Bar>> fetchHistory(String symbol, String period);
}
