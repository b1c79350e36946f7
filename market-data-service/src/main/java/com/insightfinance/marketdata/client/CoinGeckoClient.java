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
import java.util.Map;
import java.util.Optional;

/**
 * Crypto spot provider, first in the chain for crypto symbols.
 *
 * <p>Only the tickers in {@link #COIN_IDS} are served; any other ticker completes empty
 * without reserving a rate-limit permit or issuing a request. Day high/low are not published
 * by the endpoint and are approximated as ±5% around the spot price.
 */
@Component
@Order(1)
public class CoinGeckoClient implements QuoteSource {

    private static final Logger log = LoggerFactory.getLogger(CoinGeckoClient.class);

    public static final String SOURCE_ID = "coingecko";

    static final Map<String, String> COIN_IDS = Map.of(
        "BTC",   "bitcoin",
        "ETH",   "ethereum",
        "ADA",   "cardano",
        "DOT",   "polkadot",
        "LINK",  "chainlink",
        "UNI",   "uniswap",
        "AAVE",  "aave",
        "SOL",   "solana",
        "MATIC", "matic-network",
        "AVAX",  "avalanche-2"
    );

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final SourceRateLimiter rateLimiter;
    private final boolean enabled;
    private final Duration timeout;

    public CoinGeckoClient(
            @Qualifier("coinGeckoWebClient") WebClient webClient,
            ObjectMapper objectMapper,
            SourceRateLimiter rateLimiter,
            @Value("${coingecko.enabled:true}") boolean enabled,
            @Value("${coingecko.timeout:10s}") Duration timeout) {
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
    public boolean supports(AssetType assetType) {
        return assetType == AssetType.CRYPTO;
    }

    public static Optional<String> coinId(String symbol) {
        return Optional.ofNullable(symbol).map(COIN_IDS::get);
    }

    @Override
    public Mono<PriceRecord> fetchQuote(String symbol) {
        Optional<String> coinId = coinId(symbol);
        if (coinId.isEmpty()) {
            log.debug("Unmapped crypto ticker, skipping provider=CoinGecko symbol={}", symbol);
            return Mono.empty();
        }
        String id = coinId.get();
        log.info("Fetching market data. provider=CoinGecko symbol={} coinId={}", symbol, id);
        return Mono.defer(() -> webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/simple/price")
                    .queryParam("ids", id)
                    .queryParam("vs_currencies", "usd")
                    .queryParam("include_24hr_change", "true")
                    .queryParam("include_24hr_vol", "true")
                    .queryParam("include_last_updated_at", "true")
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout))
            .transformDeferred(RateLimiterOperator.of(rateLimiter.limiterFor(SOURCE_ID)))
            .map(json -> parseSimplePrice(symbol, id, json))
            .doOnNext(q -> log.info("Market data fetched. provider=CoinGecko symbol={} price={}",
                q.symbol(), q.currentPrice()))
            .onErrorResume(e -> {
                log.warn("Provider returned no data. provider=CoinGecko symbol={} reason={}",
                    symbol, e.getMessage());
                return Mono.empty();
            });
    }

    PriceRecord parseSimplePrice(String symbol, String coinId, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new MarketDataException(SOURCE_ID, "Malformed price body for symbol: " + symbol, e);
        }
        JsonNode coin = root.path(coinId);
        if (!coin.isObject()) {
            throw new MarketDataException(SOURCE_ID, "Coin missing from response: " + coinId);
        }
        double price = ProviderValues.number(coin, "usd", 0.0);
        if (price <= 0) {
            throw new MarketDataException(SOURCE_ID, "No USD price for coin: " + coinId);
        }

        double changePercent = ProviderValues.number(coin, "usd_24h_change", 0.0);
        double change        = price * (changePercent / 100);
        double previousClose = price - change;

        return PriceRecord.quote(
            symbol,
            price,
            change,
            changePercent,
            ProviderValues.wholeNumber(coin, "usd_24h_vol", 0L),
            price * 1.05,
            price * 0.95,
            previousClose,
            previousClose,
            SOURCE_ID);
    }
}
