package com.insightfinance.analysis.service;

import com.insightfinance.analysis.model.ScreeningRequest;
import com.insightfinance.analysis.model.ScreeningStrategy;
import com.insightfinance.common.model.MarketBreadth;
import com.insightfinance.common.model.MarketOverview;
import com.insightfinance.common.model.PriceRecord;
import com.insightfinance.common.model.ScreenedAsset;
import com.insightfinance.common.model.ScreeningResult;
import com.insightfinance.common.model.ScreeningResult.PerformanceSummary;
import com.insightfinance.common.model.SignalBundle;
import com.insightfinance.common.model.TradingSignal;
import com.insightfinance.marketdata.service.MarketDataService;
import com.insightfinance.marketdata.service.MarketSummaryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ranks a fixed large-cap universe by a strategy score and reports signal breadth.
 *
 * <p>Screening fetches the universe in one batch, drops symbols outside the price and volume
 * bounds, computes a signal bundle for each survivor and scores it. A symbol without a bundle
 * is still listed, as HOLD at 50% confidence with the base score.
 */
@Service
public class ScreenerService {

    private static final Logger log = LoggerFactory.getLogger(ScreenerService.class);

    static final List<String> SCREENING_UNIVERSE = List.of(
        "AAPL", "GOOGL", "MSFT", "AMZN", "TSLA", "NVDA", "META", "NFLX",
        "ADBE", "CRM", "ORCL", "INTC", "AMD", "QCOM", "AVGO", "TXN",
        "JPM", "BAC", "WFC", "GS", "MS", "C", "AXP", "V", "MA",
        "JNJ", "PFE", "UNH", "ABBV", "MRK", "TMO", "ABT", "DHR",
        "KO", "PEP", "WMT", "PG", "HD", "DIS", "NKE"
    );

    static final double BASE_SCORE = 50.0;
    static final String CUSTOM_STRATEGY = "custom";

    private static final Map<String, String> SECTORS = Map.ofEntries(
        Map.entry("AAPL", "Technology"), Map.entry("GOOGL", "Technology"),
        Map.entry("MSFT", "Technology"), Map.entry("NVDA", "Technology"),
        Map.entry("JPM", "Financial"), Map.entry("BAC", "Financial"),
        Map.entry("WFC", "Financial"), Map.entry("GS", "Financial"),
        Map.entry("JNJ", "Healthcare"), Map.entry("PFE", "Healthcare"),
        Map.entry("UNH", "Healthcare"), Map.entry("ABBV", "Healthcare"),
        Map.entry("KO", "Consumer"), Map.entry("PEP", "Consumer"),
        Map.entry("WMT", "Consumer"), Map.entry("PG", "Consumer")
    );

    private static final Map<String, String> INDUSTRIES = Map.of(
        "AAPL", "Consumer Electronics",
        "GOOGL", "Internet Services",
        "MSFT", "Software",
        "JPM", "Banking",
        "BAC", "Banking",
        "WFC", "Banking",
        "JNJ", "Pharmaceuticals",
        "PFE", "Pharmaceuticals",
        "UNH", "Health Insurance"
    );

    private final MarketDataService marketDataService;
    private final SignalService signalService;

    public ScreenerService(MarketDataService marketDataService, SignalService signalService) {
        this.marketDataService = marketDataService;
        this.signalService     = signalService;
    }

    public Mono<ScreeningResult> screen(ScreeningRequest request) {
        return screen(request, SCREENING_UNIVERSE);
    }

    Mono<ScreeningResult> screen(ScreeningRequest request, List<String> universe) {
        ScreeningStrategy strategy = request.strategy();
        String label = strategy == null ? CUSTOM_STRATEGY : strategy.wireName();
        log.info("Screening assets. strategy={} universe={}", label, universe.size());

        return marketDataService.getMultiplePrices(universe)
            .flatMapIterable(prices -> prices.values().stream().flatMap(Optional::stream).toList())
            .filter(record -> withinBounds(record, request))
            .flatMap(record -> signalService.computeSignalBundle(record.symbol(), MarketDataService.DEFAULT_PERIOD)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .map(bundle -> toAsset(record, bundle.orElse(null), strategy)))
            .collectList()
            .map(assets -> {
                List<ScreenedAsset> ranked = rank(assets, universe, request.effectiveLimit());
                log.info("Screening complete. strategy={} results={} universe={}",
                    label, ranked.size(), universe.size());
                return new ScreeningResult(label, Instant.now(), universe.size(), ranked.size(), ranked,
                    sectorBreakdown(ranked), performance(ranked));
            });
    }

    public Mono<MarketBreadth> getMarketBreadth() {
        return getMarketBreadth(MarketSummaryService.MARKET_UNIVERSE);
    }

    Mono<MarketBreadth> getMarketBreadth(List<String> universe) {
        log.info("Computing market breadth. universe={}", universe.size());
        return signalService.getMarketOverview(universe)
            .map(ScreenerService::breadthOf)
            .doOnNext(b -> log.info("Market breadth computed. sentiment={} indicator={}",
                b.marketSentiment(), b.breadthIndicator()));
    }

    /**
     * Strategy score in [0, 100]. Without both a price and a signal, or without a strategy,
     * the base score applies.
     */
    static double screeningScore(PriceRecord price, SignalBundle signal, ScreeningStrategy strategy) {
        double score = BASE_SCORE;
        if (price == null || signal == null || strategy == null) {
            return score;
        }
        switch (strategy) {
            case MOMENTUM -> {
                score += price.changePercent() * 2;
                score += Math.min(signal.confidence(), 100) * 0.3;
                if (signal.signal() == TradingSignal.BUY) score += 20;
            }
            case VALUE -> score += price.changePercent() < 5 ? 30 : 10;
            case GROWTH -> {
                score += price.changePercent() * 1.5;
                score += signal.confidence() * 0.2;
            }
            case TECHNICAL -> {
                score += signal.confidence() * 0.5;
                if (signal.signal() == TradingSignal.BUY) score += 30;
                else if (signal.signal() == TradingSignal.SELL) score -= 20;
            }
            default -> { }
        }
        return Math.max(0, Math.min(100, score));
    }

    static MarketBreadth breadthOf(MarketOverview overview) {
        Map<TradingSignal, Integer> summary = overview.signalsSummary();
        int advancing = summary.getOrDefault(TradingSignal.BUY, 0);
        int declining = summary.getOrDefault(TradingSignal.SELL, 0);
        int unchanged = summary.getOrDefault(TradingSignal.HOLD, 0);
        int total = advancing + declining + unchanged;

        Double ratio = declining > 0 ? (double) advancing / declining : null;
        double indicator = total > 0 ? (double) (advancing - declining) / total : 0.0;
        return new MarketBreadth(Instant.now(), advancing, declining, unchanged, ratio, indicator,
            sentiment(indicator));
    }

    static String sentiment(double breadthIndicator) {
        if (breadthIndicator > 0.3) return "Very Bullish";
        if (breadthIndicator > 0.1) return "Bullish";
        if (breadthIndicator > -0.1) return "Neutral";
        if (breadthIndicator > -0.3) return "Bearish";
        return "Very Bearish";
    }

    static String sectorOf(String symbol) {
        return SECTORS.getOrDefault(symbol, "Other");
    }

    static String industryOf(String symbol) {
        return INDUSTRIES.getOrDefault(symbol, "General");
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private static boolean withinBounds(PriceRecord record, ScreeningRequest request) {
        if (request.priceMin() != null && record.currentPrice() < request.priceMin()) return false;
        if (request.priceMax() != null && record.currentPrice() > request.priceMax()) return false;
        return request.volumeMin() == null || record.volume() >= request.volumeMin();
    }

    private static ScreenedAsset toAsset(PriceRecord record, SignalBundle bundle, ScreeningStrategy strategy) {
        return new ScreenedAsset(
            record.symbol(),
            sectorOf(record.symbol()),
            industryOf(record.symbol()),
            record.currentPrice(),
            record.change(),
            record.changePercent(),
            record.volume(),
            screeningScore(record, bundle, strategy),
            0,
            bundle == null ? TradingSignal.HOLD : bundle.signal(),
            bundle == null ? 50.0 : bundle.confidence());
    }

    private static List<ScreenedAsset> rank(List<ScreenedAsset> assets, List<String> universe, int limit) {
        List<ScreenedAsset> sorted = assets.stream()
            .sorted(Comparator.comparingDouble(ScreenedAsset::score).reversed()
                .thenComparingInt(a -> universe.indexOf(a.symbol())))
            .limit(limit)
            .toList();
        List<ScreenedAsset> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).withRank(i + 1));
        }
        return ranked;
    }

    private static Map<String, Integer> sectorBreakdown(List<ScreenedAsset> assets) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        assets.forEach(a -> breakdown.merge(a.sector(), 1, Integer::sum));
        return breakdown;
    }

    private static PerformanceSummary performance(List<ScreenedAsset> assets) {
        if (assets.isEmpty()) {
            return new PerformanceSummary(0.0, 0.0, 0, 0, 0);
        }
        double avgScore  = assets.stream().mapToDouble(ScreenedAsset::score).average().orElse(0.0);
        double avgChange = assets.stream().mapToDouble(ScreenedAsset::changePercent).average().orElse(0.0);
        return new PerformanceSummary(avgScore, avgChange,
            count(assets, TradingSignal.BUY), count(assets, TradingSignal.SELL), count(assets, TradingSignal.HOLD));
    }

    private static int count(List<ScreenedAsset> assets, TradingSignal signal) {
        return (int) assets.stream().filter(a -> a.signal() == signal).count();
    }
}
