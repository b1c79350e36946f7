package com.insightfinance.analysis.service;

import com.insightfinance.analysis.fusion.FusionResult;
import com.insightfinance.analysis.fusion.SignalFusionEngine;
import com.insightfinance.analysis.indicator.TechnicalIndicators;
import com.insightfinance.common.classifier.Symbols;
import com.insightfinance.common.model.Bar;
import com.insightfinance.common.model.IndicatorSet;
import com.insightfinance.common.model.IndicatorSnapshot;
import com.insightfinance.common.model.MarketOverview;
import com.insightfinance.common.model.MarketOverview.StrongSignal;
import com.insightfinance.common.model.MarketOverview.SymbolSummary;
import com.insightfinance.common.model.PriceRecord;
import com.insightfinance.common.model.SignalBatch;
import com.insightfinance.common.model.SignalBundle;
import com.insightfinance.common.model.SignalStrength;
import com.insightfinance.common.model.TradingSignal;
import com.insightfinance.marketdata.cache.CacheStore;
import com.insightfinance.marketdata.service.MarketDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Computes a {@link SignalBundle} per symbol: price acquisition, indicator suite, fusion.
 *
 * <p>Results are cached under {@code technical / indicator:<SYMBOL>:<SYMBOL>_<period>} for the
 * signal TTL. Every failure along the way is logged and surfaces as an empty result.
 */
@Service
public class SignalService {

    private static final Logger log = LoggerFactory.getLogger(SignalService.class);

    public static final String CACHE_NAMESPACE = "technical";

    static final int HISTORY_POINTS = 50;
    static final int MIN_POINTS = TechnicalIndicators.MACD_SLOW;
    static final String NO_DATA = "No data available";
    static final String ANALYSIS_FAILED = "Analysis failed";
    static final String SYNTHETIC_HISTORY_NOTE =
        "No market history available; indicators computed from a synthetic price series";

    private final MarketDataService marketDataService;
    private final SignalFusionEngine fusionEngine;
    private final CacheStore cache;
    private final Duration signalTtl;

    public SignalService(MarketDataService marketDataService,
                         SignalFusionEngine fusionEngine,
                         CacheStore cache,
                         @Value("${analysis.cache.signal-ttl:10m}") Duration signalTtl) {
        this.marketDataService = marketDataService;
        this.fusionEngine      = fusionEngine;
        this.cache             = cache;
        this.signalTtl         = signalTtl;
    }

    public Mono<SignalBundle> computeSignalBundle(String symbol, String period) {
        return resolveBundle(symbol, period)
            .onErrorResume(e -> {
                log.error("Signal computation failed. symbol={}", symbol, e);
                return Mono.empty();
            });
    }

    /** Raw indicator values behind the bundle, without the fused decision. */
    public Mono<IndicatorSnapshot> getIndicators(String symbol, String period) {
        return computeSignalBundle(symbol, period).map(IndicatorSnapshot::of);
    }

    /**
     * Computes every symbol concurrently. A symbol that fails or yields nothing is reported
     * with an error entry carrying the failure message; the overview itself never fails.
     */
    public Mono<MarketOverview> getMarketOverview(List<String> symbols) {
        List<String> requested = distinctSymbols(symbols);
        log.info("Generating market overview. symbols={}", requested.size());

        return collectOutcomes(requested, MarketDataService.DEFAULT_PERIOD, NO_DATA)
            .map(outcomes -> {
                SignalTally tally = new SignalTally();
                Map<String, SymbolSummary> perSymbol = new LinkedHashMap<>();
                for (String symbol : requested) {
                    SymbolOutcome outcome = outcomes.getOrDefault(symbol, SymbolOutcome.failed(symbol, NO_DATA));
                    if (outcome.bundle() == null) {
                        perSymbol.put(symbol, SymbolSummary.failed(outcome.error()));
                    } else {
                        tally.add(outcome.bundle());
                        perSymbol.put(symbol, SymbolSummary.of(outcome.bundle()));
                    }
                }
                log.info("Market overview complete. requested={} successful={} strong={}",
                    requested.size(), tally.successful, tally.strong.size());
                return new MarketOverview(Instant.now(), requested.size(), tally.successful,
                    tally.summary, tally.strong, perSymbol);
            });
    }

    /**
     * Full bundles for several symbols over one period, with the same summary an overview
     * carries. Failed symbols map to {@code null} and get an entry in {@code errors}.
     */
    public Mono<SignalBatch> getMultipleSignals(List<String> symbols, String period) {
        List<String> requested = distinctSymbols(symbols);
        String effectivePeriod = (period == null || period.isBlank()) ? MarketDataService.DEFAULT_PERIOD : period;
        log.info("Computing signals. symbols={} period={}", requested.size(), effectivePeriod);

        return collectOutcomes(requested, effectivePeriod, ANALYSIS_FAILED)
            .map(outcomes -> {
                SignalTally tally = new SignalTally();
                Map<String, SignalBundle> bundles = new LinkedHashMap<>();
                Map<String, String> errors = new LinkedHashMap<>();
                for (String symbol : requested) {
                    SymbolOutcome outcome = outcomes.getOrDefault(symbol, SymbolOutcome.failed(symbol, ANALYSIS_FAILED));
                    bundles.put(symbol, outcome.bundle());
                    if (outcome.bundle() == null) {
                        errors.put(symbol, outcome.error());
                    } else {
                        tally.add(outcome.bundle());
                    }
                }
                log.info("Signals computed. requested={} successful={}", requested.size(), tally.successful);
                return new SignalBatch(Instant.now(), effectivePeriod, requested.size(), tally.successful,
                    requested.size() - tally.successful, tally.summary, tally.strong, bundles, errors);
            });
    }

    public static String signalCacheKey(String symbol, String period) {
        return "indicator:" + symbol + ":" + symbol + "_" + period;
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Mono<SignalBundle> resolveBundle(String symbol, String period) {
        return Mono.defer(() -> {
            String key = Symbols.normalize(symbol);
            if (key == null || key.isEmpty()) return Mono.<SignalBundle>empty();
            String effectivePeriod = (period == null || period.isBlank())
                ? MarketDataService.DEFAULT_PERIOD : period;
            String cacheKey = signalCacheKey(key, effectivePeriod);

            return cache.get(CACHE_NAMESPACE, cacheKey, SignalBundle.class)
                .onErrorResume(e -> {
                    log.warn("CACHE_UNAVAILABLE op=get key={} reason={}", cacheKey, e.getMessage());
                    return Mono.empty();
                })
                .doOnNext(hit -> log.debug("CACHE_HIT key={} signal={}", cacheKey, hit.signal()))
                .switchIfEmpty(Mono.defer(() -> analyze(key, effectivePeriod, cacheKey)));
        });
    }

    private Mono<Map<String, SymbolOutcome>> collectOutcomes(List<String> requested, String period,
                                                             String emptyMessage) {
        return Flux.fromIterable(requested)
            .flatMap(s -> resolveBundle(s, period)
                .map(bundle -> SymbolOutcome.of(s, bundle))
                .defaultIfEmpty(SymbolOutcome.failed(s, emptyMessage))
                .onErrorResume(e -> {
                    log.warn("Signal task failed. symbol={} reason={}", s, e.toString());
                    return Mono.just(SymbolOutcome.failed(s, String.valueOf(e.getMessage())));
                }))
            .collectMap(SymbolOutcome::symbol);
    }

    private static List<String> distinctSymbols(List<String> symbols) {
        return symbols.stream()
            .map(Symbols::normalize)
            .filter(Objects::nonNull)
            .distinct()
            .toList();
    }

    private Mono<SignalBundle> analyze(String symbol, String period, String cacheKey) {
        return marketDataService.getPriceWithHistory(symbol, period)
            .switchIfEmpty(Mono.defer(() -> {
                log.warn("No price data available. symbol={}", symbol);
                return Mono.empty();
            }))
            .flatMap(record -> Mono.justOrEmpty(buildBundle(record, symbol, period)))
            .flatMap(bundle -> cache.set(CACHE_NAMESPACE, cacheKey, bundle, signalTtl)
                .onErrorResume(e -> {
                    log.warn("CACHE_UNAVAILABLE op=set key={} reason={}", cacheKey, e.getMessage());
                    return Mono.just(Boolean.FALSE);
                })
                .thenReturn(bundle))
            .doOnNext(bundle -> log.info("Generated signal. symbol={} signal={} confidence={}",
                symbol, bundle.signal(), String.format(Locale.ROOT, "%.1f", bundle.confidence())));
    }

    private SignalBundle buildBundle(PriceRecord record, String symbol, String period) {
        double price = record.currentPrice();
        boolean synthetic = record.history().isEmpty();
        List<Double> closes = synthetic ? syntheticSeries(price) : trailingCloses(record.history());
        if (synthetic) {
            log.warn("No history data, generating synthetic series. symbol={}", symbol);
        }
        if (closes.size() < MIN_POINTS) {
            log.warn("Insufficient data. symbol={} points={}", symbol, closes.size());
            return null;
        }

        IndicatorSet indicators = computeIndicators(symbol, closes);
        FusionResult fusion = fusionEngine.generateSignals(price, indicators);

        List<String> reasoning = new ArrayList<>();
        if (synthetic) reasoning.add(SYNTHETIC_HISTORY_NOTE);
        reasoning.addAll(fusion.reasoning());

        return new SignalBundle(symbol, price, Instant.now(), period,
            fusion.signal(), fusion.strength(), fusion.confidence(),
            fusion.trend(), fusion.risk(), List.copyOf(reasoning), fusion.votes(),
            indicators, synthetic);
    }

    static IndicatorSet computeIndicators(String symbol, List<Double> closes) {
        return new IndicatorSet(
            symbol,
            TechnicalIndicators.rsi(closes, TechnicalIndicators.RSI_PERIOD),
            TechnicalIndicators.ema(closes, 20),
            TechnicalIndicators.ema(closes, 50),
            TechnicalIndicators.sma(closes, 20),
            TechnicalIndicators.atr(closes, TechnicalIndicators.ATR_PERIOD),
            TechnicalIndicators.williamsR(closes, TechnicalIndicators.WILLIAMS_PERIOD),
            TechnicalIndicators.macd(closes),
            TechnicalIndicators.bollingerBands(closes),
            TechnicalIndicators.stochastic(closes));
    }

    static List<Double> trailingCloses(List<Bar> history) {
        int from = Math.max(0, history.size() - HISTORY_POINTS);
        return history.subList(from, history.size()).stream().map(Bar::close).toList();
    }

    static List<Double> syntheticSeries(double price) {
        List<Double> series = new ArrayList<>(HISTORY_POINTS);
        for (int i = 0; i < HISTORY_POINTS; i++) {
            series.add(price * (1 + (i - 25) * 0.01));
        }
        return series;
    }

    private static final class SignalTally {
        final Map<TradingSignal, Integer> summary = new EnumMap<>(TradingSignal.class);
        final List<StrongSignal> strong = new ArrayList<>();
        int successful;

        SignalTally() {
            for (TradingSignal s : TradingSignal.values()) summary.put(s, 0);
        }

        void add(SignalBundle bundle) {
            successful++;
            summary.merge(bundle.signal(), 1, Integer::sum);
            if (bundle.signalStrength().isAtLeast(SignalStrength.STRONG)) {
                strong.add(new StrongSignal(bundle.symbol(), bundle.signal(), bundle.confidence()));
            }
        }
    }

    private record SymbolOutcome(String symbol, SignalBundle bundle, String error) {
        static SymbolOutcome of(String symbol, SignalBundle bundle) {
            return new SymbolOutcome(symbol, bundle, null);
        }

        static SymbolOutcome failed(String symbol, String error) {
            return new SymbolOutcome(symbol, null, error);
        }
    }
}
