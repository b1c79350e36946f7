package com.insightfinance.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightfinance.common.exception.MarketDataException;
import com.insightfinance.common.model.AssetType;
import com.insightfinance.common.model.Bar;
import com.insightfinance.common.model.PriceRecord;
import com.insightfinance.marketdata.model.AlphaVantageOhlcv;
import com.insightfinance.marketdata.model.AlphaVantageQuoteResponse;
import com.insightfinance.marketdata.provider.HistoricalBarSource;
import com.insightfinance.marketdata.provider.QuoteSource;
import com.insightfinance.marketdata.ratelimit.SourceRateLimiter;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Primary quote provider. The only source that also serves history.
 *
 * <p>Disabled while the API key is unset or still the {@code demo} placeholder.
 */
@Component
@Order(2)
public class AlphaVantageClient implements QuoteSource, HistoricalBarSource {

    private static final Logger log = LoggerFactory.getLogger(AlphaVantageClient.class);

    public static final String SOURCE_ID = "alpha_vantage";
    public static final String PLACEHOLDER_KEY = "demo";

    /** Most recent bars kept per history request. */
    static final int HISTORY_WINDOW = 50;

    private static final Map<String, String> FUNCTION_BY_PERIOD = Map.of(
        "1d",  "TIME_SERIES_INTRADAY",
        "1wk", "TIME_SERIES_WEEKLY",
        "1mo", "TIME_SERIES_MONTHLY",
        "3mo", "TIME_SERIES_MONTHLY",
        "6mo", "TIME_SERIES_MONTHLY",
        "1y",  "TIME_SERIES_MONTHLY"
    );
    private static final String DEFAULT_FUNCTION = "TIME_SERIES_MONTHLY";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final SourceRateLimiter rateLimiter;
    private final String apiKey;
    private final Duration timeout;

    public AlphaVantageClient(
            @Qualifier("alphaVantageWebClient") WebClient webClient,
            ObjectMapper objectMapper,
            SourceRateLimiter rateLimiter,
            @Value("${alpha-vantage.api-key:demo}") String apiKey,
            @Value("${alpha-vantage.timeout:15s}") Duration timeout) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.rateLimiter  = rateLimiter;
        this.apiKey       = apiKey;
        this.timeout      = timeout;
    }

    @Override
    public String sourceId() { return SOURCE_ID; }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank() && !PLACEHOLDER_KEY.equals(apiKey);
    }

    @Override
    public boolean supports(AssetType assetType) { return true; }

    @Override
    public Mono<PriceRecord> fetchQuote(String symbol) {
        log.info("Fetching market data. provider=AlphaVantage symbol={}", symbol);
        return Mono.defer(() -> webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/query")
                    .queryParam("function", "GLOBAL_QUOTE")
                    .queryParam("symbol", symbol)
                    .queryParam("apikey", apiKey)
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout))
            .transformDeferred(RateLimiterOperator.of(rateLimiter.limiterFor(SOURCE_ID)))
            .map(json -> parseQuote(symbol, json))
            .doOnNext(q -> log.info("Market data fetched. provider=AlphaVantage symbol={} price={}",
                q.symbol(), q.currentPrice()))
            .onErrorResume(e -> {
                log.warn("Provider returned no data. provider=AlphaVantage symbol={} reason={}",
                    symbol, e.getMessage());
                return Mono.empty();
            });
    }

    @Override
    public Mono<List<Bar>> fetchHistory(String symbol, String period) {
        String function = FUNCTION_BY_PERIOD.getOrDefault(period, DEFAULT_FUNCTION);
        log.info("Fetching history. provider=AlphaVantage symbol={} period={} function={}",
            symbol, period, function);
        return Mono.defer(() -> webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/query")
                        .queryParam("function", function)
                        .queryParam("symbol", symbol)
                        .queryParam("apikey", apiKey);
                    if ("TIME_SERIES_INTRADAY".equals(function)) {
                        uriBuilder.queryParam("interval", "5min");
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout))
            .transformDeferred(RateLimiterOperator.of(rateLimiter.limiterFor(SOURCE_ID)))
            .map(json -> parseHistory(symbol, json))
            .doOnNext(bars -> log.info("History fetched. provider=AlphaVantage symbol={} bars={}",
                symbol, bars.size()))
            .onErrorResume(e -> {
                log.warn("Provider returned no history. provider=AlphaVantage symbol={} reason={}",
                    symbol, e.getMessage());
                return Mono.empty();
            });
    }

    // ── parsing ──────────────────────────────────────────────────────────────

    PriceRecord parseQuote(String symbol, String json) {
        AlphaVantageQuoteResponse response;
        try {
            response = objectMapper.readValue(json, AlphaVantageQuoteResponse.class);
        } catch (Exception e) {
            throw new MarketDataException(SOURCE_ID, "Malformed quote body for symbol: " + symbol, e);
        }
        rejectProviderMessages(response.errorMessage(), response.note(), response.information());

        AlphaVantageQuoteResponse.GlobalQuote quote = response.globalQuote();
        if (quote == null || quote.price() == null || quote.price().isBlank()) {
            throw new MarketDataException(SOURCE_ID, "No price data for symbol: " + symbol);
        }
        try {
            double price = ProviderValues.parseDouble(quote.price(), 0.0);
            if (price <= 0) {
                throw new MarketDataException(SOURCE_ID, "Non-positive price for symbol: " + symbol);
            }
            return PriceRecord.quote(
                symbol,
                price,
                ProviderValues.parseDouble(quote.change(), 0.0),
                ProviderValues.parsePercent(quote.changePercent(), 0.0),
                ProviderValues.parseLong(quote.volume(), 0L),
                ProviderValues.parseDouble(quote.high(), price),
                ProviderValues.parseDouble(quote.low(), price),
                ProviderValues.parseDouble(quote.open(), price),
                ProviderValues.parseDouble(quote.previousClose(), price),
                SOURCE_ID);
        } catch (NumberFormatException e) {
            throw new MarketDataException(SOURCE_ID, "Unexpected quote schema for symbol: " + symbol, e);
        }
    }

    List<Bar> parseHistory(String symbol, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new MarketDataException(SOURCE_ID, "Malformed history body for symbol: " + symbol, e);
        }
        rejectProviderMessages(ProviderValues.text(root, "Error Message"),
            ProviderValues.text(root, "Note"), ProviderValues.text(root, "Information"));

        JsonNode series = null;
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (name.contains("Time Series")) {
                series = root.get(name);
                break;
            }
        }
        if (series == null || !series.isObject()) {
            throw new MarketDataException(SOURCE_ID, "No time series for symbol: " + symbol);
        }

        List<Bar> bars = new ArrayList<>();
        series.fields().forEachRemaining(entry -> {
            try {
                AlphaVantageOhlcv ohlcv = objectMapper.treeToValue(entry.getValue(), AlphaVantageOhlcv.class);
                bars.add(ohlcv.toBar(entry.getKey()));
            } catch (Exception ex) {
                log.debug("Skipping malformed bar. symbol={} date={}", symbol, entry.getKey());
            }
        });
        bars.sort(Comparator.comparing(Bar::date));
        return List.copyOf(bars.subList(Math.max(0, bars.size() - HISTORY_WINDOW), bars.size()));
    }

    private void rejectProviderMessages(String errorMessage, String note, String information) {
        if (errorMessage != null) {
            throw new MarketDataException(SOURCE_ID, "Provider error: " + errorMessage);
        }
        if (note != null) {
            throw new MarketDataException(SOURCE_ID, "Rate limit: " + note);
        }
        if (information != null) {
            throw new MarketDataException(SOURCE_ID, "Quota: " + information);
        }
    }
}
