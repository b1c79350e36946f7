package com.insightfinance.marketdata.service;

import com.insightfinance.common.model.MarketSummary;
import com.insightfinance.common.model.MarketSummary.IndexQuote;
import com.insightfinance.common.model.MarketSummary.MarketMover;
import com.insightfinance.common.model.PriceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Market breadth snapshot: index ETFs plus gainers, losers and most active names of a fixed
 * large-cap universe. Symbols without data are left out.
 */
@Service
public class MarketSummaryService {

    private static final Logger log = LoggerFactory.getLogger(MarketSummaryService.class);

    static final List<String> INDEX_SYMBOLS = List.of("SPY", "QQQ", "IWM", "DIA");

    public static final List<String> MARKET_UNIVERSE = List.of(
        "AAPL", "GOOGL", "MSFT", "AMZN", "TSLA", "NVDA", "META", "NFLX",
        "JPM", "BAC", "WFC", "GS", "MS", "C", "AXP", "V", "MA",
        "JNJ", "PFE", "UNH", "ABBV", "MRK", "TMO", "ABT", "DHR",
        "KO", "PEP", "WMT", "PG", "HD", "DIS", "NKE", "BA", "CAT"
    );

    static final int TOP_N = 10;

    private final MarketDataService marketDataService;

    public MarketSummaryService(MarketDataService marketDataService) {
        this.marketDataService = marketDataService;
    }

    public Mono<MarketSummary> getMarketSummary() {
        return getMarketSummary(INDEX_SYMBOLS, MARKET_UNIVERSE);
    }

    Mono<MarketSummary> getMarketSummary(List<String> indexSymbols, List<String> universe) {
        return Mono.zip(marketDataService.getMultiplePrices(indexSymbols),
                        marketDataService.getMultiplePrices(universe))
            .map(tuple -> summarize(tuple.getT1(), tuple.getT2()))
            .doOnNext(s -> log.info("Market summary built. indices={} gainers={} losers={}",
                s.indices().size(), s.topGainers().size(), s.topLosers().size()));
    }

    private MarketSummary summarize(Map<String, Optional<PriceRecord>> indexPrices,
                                    Map<String, Optional<PriceRecord>> universePrices) {
        Map<String, IndexQuote> indices = new LinkedHashMap<>();
        indexPrices.forEach((symbol, record) -> record.ifPresent(r ->
            indices.put(symbol, new IndexQuote(r.currentPrice(), r.change(), r.changePercent()))));

        List<PriceRecord> available = universePrices.values().stream()
            .flatMap(Optional::stream)
            .toList();

        List<MarketMover> gainers = available.stream()
            .filter(r -> r.changePercent() > 0)
            .sorted(Comparator.comparingDouble(PriceRecord::changePercent).reversed())
            .limit(TOP_N)
            .map(MarketMover::of)
            .toList();

        List<MarketMover> losers = available.stream()
            .filter(r -> r.changePercent() < 0)
            .sorted(Comparator.comparingDouble(PriceRecord::changePercent))
            .limit(TOP_N)
            .map(MarketMover::of)
            .toList();

        List<MarketMover> mostActive = available.stream()
            .sorted(Comparator.comparingLong(PriceRecord::volume).reversed())
            .limit(TOP_N)
            .map(MarketMover::of)
            .toList();

        // market-hours calendar is not modelled
        return new MarketSummary(Instant.now(), "open", indices, gainers, losers, mostActive);
    }
}
