package com.insightfinance.marketdata.service;

import com.insightfinance.common.classifier.AssetTypeClassifier;
import com.insightfinance.common.classifier.Symbols;
import com.insightfinance.common.model.AssetType;
import com.insightfinance.common.model.Bar;
import com.insightfinance.common.model.PriceRecord;
import com.insightfinance.marketdata.cache.CacheStore;
import com.insightfinance.marketdata.provider.HistoricalBarSource;
import com.insightfinance.marketdata.provider.QuoteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Acquisition orchestrator backed by the shared {@link CacheStore}.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Check the cache for {@code price:<SYMBOL>_<period>}.</li>
 *   <li>On hit → return immediately; no provider is touched.</li>
 *   <li>On miss → classify the asset type and walk the ordered {@link QuoteSource} chain,
 *       one provider at a time, until one returns a quote.</li>
 *   <li>Attach history when the winning provider is a {@link HistoricalBarSource},
 *       cache the result with the price TTL, and return it.</li>
 * </ol>
 *
 * <p>Provider order is fixed by {@code @Order} and filtered per asset type; it is never
 * re-ranked at runtime. When no provider answers the result is empty, never an error.
 * Cache failures degrade to "fetch fresh".
 */
@Service
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    public static final String CACHE_NAMESPACE = "market_data";
    public static final String DEFAULT_PERIOD = "1mo";

    private final List<QuoteSource> sources;
    private final CacheStore cache;
    private final Duration priceTtl;

    public MarketDataService(
            List<QuoteSource> sources,
            CacheStore cache,
            @Value("${market-data.cache.price-ttl:5m}") Duration priceTtl) {
        this.sources  = List.copyOf(sources);
        this.cache    = cache;
        this.priceTtl = priceTtl;
        log.info("Quote source chain: {}",
            this.sources.stream().map(QuoteSource::sourceId).collect(Collectors.joining(" -> ")));
    }

    public Mono<PriceRecord> getPriceWithHistory(String symbol, String period) {
        return Mono.defer(() -> {
            String key = Symbols.normalize(symbol);
            if (key == null || key.isEmpty()) {
                log.warn("Rejected empty symbol");
                return Mono.empty();
            }
            String effectivePeriod = (period == null || period.isBlank()) ? DEFAULT_PERIOD : period;
            String cacheKey = priceCacheKey(key, effectivePeriod);

            return cache.get(CACHE_NAMESPACE, cacheKey, PriceRecord.class)
                .onErrorResume(e -> {
                    log.warn("CACHE_UNAVAILABLE op=get key={} reason={}", cacheKey, e.getMessage());
                    return Mono.empty();
                })
                .doOnNext(hit -> log.info("CACHE_HIT key={} source={} timestamp={}",
                    cacheKey, hit.source(), hit.timestamp()))
                .switchIfEmpty(Mono.defer(() -> fetchFresh(key, effectivePeriod, cacheKey)));
        });
    }

    /**
     * Fetches every distinct symbol concurrently. Each task captures its own outcome, so a
     * failing symbol maps to {@link Optional#empty()} without affecting the rest. Tasks are not
     * timed out here: queueing for a rate-limit permit is expected, and each provider call is
     * bounded by its adapter's own timeout.
     *
     * @return one entry per requested symbol, in request order
     */
    public Mono<Map<String, Optional<PriceRecord>>> getMultiplePrices(List<String> symbols) {
        List<String> requested = symbols.stream()
            .map(Symbols::normalize)
            .filter(Objects::nonNull)
            .distinct()
            .toList();
        log.info("Batch price fetch started. symbols={}", requested.size());

        return Flux.fromIterable(requested)
            .flatMap(s -> getPriceWithHistory(s, DEFAULT_PERIOD)
                .map(Optional::of)
                .onErrorResume(e -> {
                    log.warn("Batch task failed. symbol={} reason={}", s, e.toString());
                    return Mono.just(Optional.empty());
                })
                .defaultIfEmpty(Optional.empty())
                .map(result -> Map.entry(s, result)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .map(found -> {
                Map<String, Optional<PriceRecord>> ordered = new LinkedHashMap<>();
                requested.forEach(s -> ordered.put(s, found.getOrDefault(s, Optional.empty())));
                long ok = ordered.values().stream().filter(Optional::isPresent).count();
                log.info("Batch price fetch complete. requested={} successful={}", ordered.size(), ok);
                return ordered;
            });
    }

    public static String priceCacheKey(String symbol, String period) {
        return "price:" + symbol + "_" + period;
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Mono<PriceRecord> fetchFresh(String symbol, String period, String cacheKey) {
        AssetType assetType = AssetTypeClassifier.classify(symbol);
        List<QuoteSource> chain = sources.stream()
            .filter(s -> s.supports(assetType) && s.isEnabled())
            .toList();
        log.info("CACHE_MISS key={} assetType={} providers={}", cacheKey, assetType.wireName(),
            chain.stream().map(QuoteSource::sourceId).toList());

        return Flux.fromIterable(chain)
            .concatMap(source -> Mono.defer(() -> source.fetchQuote(symbol))
                .onErrorResume(e -> {
                    log.warn("Provider error escaped adapter. provider={} symbol={} reason={}",
                        source.sourceId(), symbol, e.toString());
                    return Mono.empty();
                })
                .flatMap(quote -> attachHistory(source, quote, symbol, assetType, period)))
            .next()
            .flatMap(record -> cache.set(CACHE_NAMESPACE, cacheKey, record, priceTtl)
                .onErrorResume(e -> {
                    log.warn("CACHE_UNAVAILABLE op=set key={} reason={}", cacheKey, e.getMessage());
                    return Mono.just(Boolean.FALSE);
                })
                .thenReturn(record))
            .doOnSuccess(record -> {
                if (record == null) {
                    log.warn("No price data available. symbol={} providersTried={}", symbol, chain.size());
                } else {
                    log.info("CACHE_REFRESH key={} source={} bars={}", cacheKey, record.source(),
                        record.history().size());
                }
            });
    }

    private Mono<PriceRecord> attachHistory(QuoteSource source, PriceRecord quote, String symbol,
                                            AssetType assetType, String period) {
        if (!(source instanceof HistoricalBarSource historySource)) {
            return Mono.just(quote.withAcquisition(List.of(), assetType, period));
        }
        return Mono.defer(() -> historySource.fetchHistory(symbol, period))
            .onErrorResume(e -> {
                log.warn("History fetch failed. provider={} symbol={} reason={}",
                    source.sourceId(), symbol, e.toString());
                return Mono.empty();
            })
            .defaultIfEmpty(List.<Bar>of())
            .map(history -> quote.withAcquisition(history, assetType, period));
    }
}
