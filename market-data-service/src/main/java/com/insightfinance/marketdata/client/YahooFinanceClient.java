package com.insightfinance.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightfinance.common.exception.MarketDataException;
import com.insightfinance.common.model.AssetType;
import com.insightfinance.common.model.PriceRecord;
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

/**
 * Secondary quote provider: the public chart endpoint, last resort for every asset type.
 */
@Component
@Order(3)
public class YahooFinanceClient implements QuoteSource {

    private static final Logger log = LoggerFactory.getLogger(YahooFinanceClient.class);

    public static final String SOURCE_ID = "yahoo_finance";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final SourceRateLimiter rateLimiter;
    private final boolean enabled;
    private final Duration timeout;

    public YahooFinanceClient(
            @Qualifier("yahooFinanceWebClient") WebClient webClient,
            ObjectMapper objectMapper,
            SourceRateLimiter rateLimiter,
            @Value("${yahoo-finance.enabled:true}") boolean enabled,
            @Value("${yahoo-finance.timeout:10s}") Duration timeout) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.rateLimiter  = rateLimiter;
        this.enabled      = enabled;
        this.timeout      = timeout;
    }

    @Override
    public String sourceId() { return SOURCE_ID; }

    @Override
    public boolean isEnabled() { return enabled; }

    @Override
    public boolean supports(AssetType assetType) { return true; }

    @Override
    public Mono<PriceRecord> fetchQuote(String symbol) {
        log.info("Fetching market data. provider=YahooFinance symbol={}", symbol);
        return Mono.defer(() -> webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/v8/finance/chart/{symbol}")
                    .queryParam("range", "1d")
                    .queryParam("interval", "1m")
                    .queryParam("includePrePost", "true")
                    .build(symbol))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout))
            .transformDeferred(RateLimiterOperator.of(rateLimiter.limiterFor(SOURCE_ID)))
            .map(json -> parseChart(symbol, json))
            .doOnNext(q -> log.info("Market data fetched. provider=YahooFinance symbol={} price={}",
                q.symbol(), q.currentPrice()))
            .onErrorResume(e -> {
                log.warn("Provider returned no data. provider=YahooFinance symbol={} reason={}",
                    symbol, e.getMessage());
                return Mono.empty();
            });
    }

    PriceRecord parseChart(String symbol, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new MarketDataException(SOURCE_ID, "Malformed chart body for symbol: " + symbol, e);
        }
        JsonNode results = root.path("chart").path("result");
        if (!results.isArray() || results.isEmpty()) {
            String error = root.path("chart").path("error").path("description").asText("empty result");
            throw new MarketDataException(SOURCE_ID, "No chart result for symbol: " + symbol + " (" + error + ")");
        }
        JsonNode meta = results.get(0).path("meta");
        double price = ProviderValues.number(meta, "regularMarketPrice", 0.0);
        if (price <= 0) {
            throw new MarketDataException(SOURCE_ID, "No regular market price for symbol: " + symbol);
        }

        double previousClose = ProviderValues.number(meta, "previousClose", price);
        double change        = price - previousClose;
        double changePercent = previousClose != 0 ? (change / previousClose) * 100 : 0.0;

        return PriceRecord.quote(
            symbol,
            price,
            change,
            changePercent,
            ProviderValues.wholeNumber(meta, "regularMarketVolume", 0L),
            ProviderValues.number(meta, "regularMarketDayHigh", price),
            ProviderValues.number(meta, "regularMarketDayLow", price),
            ProviderValues.number(meta, "regularMarketOpen", price),
            previousClose,
            SOURCE_ID);
    }
}
