package com.insightfinance.marketdata.client;

import com.insightfinance.common.model.AssetType;
import com.insightfinance.marketdata.config.MarketDataConfig;
import com.insightfinance.marketdata.ratelimit.SourceRateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CoinGeckoClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private CoinGeckoClient client(String body) {
        WebClient webClient = WebClient.builder()
            .baseUrl("https://api.coingecko.com/api/v3")
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header("Content-Type", "application/json")
                    .body(body)
                    .build());
            })
            .build();
        return new CoinGeckoClient(webClient, MarketDataConfig.newObjectMapper(),
            new SourceRateLimiter(Duration.ZERO), true, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("only crypto is supported")
    void supportsCryptoOnly() {
        CoinGeckoClient client = client("{}");
        assertTrue(client.supports(AssetType.CRYPTO));
        assertFalse(client.supports(AssetType.STOCK));
        assertFalse(client.supports(AssetType.FOREX));
    }

    @Test
    void coinIdMapping() {
        assertEquals(Optional.of("bitcoin"), CoinGeckoClient.coinId("BTC"));
        assertEquals(Optional.of("matic-network"), CoinGeckoClient.coinId("MATIC"));
        assertEquals(Optional.empty(), CoinGeckoClient.coinId("DOGE"));
        assertEquals(Optional.empty(), CoinGeckoClient.coinId(null));
    }

    @Test
    @DisplayName("simple price → record with ±5% day range and derived previous close")
    void parsesSimplePrice() {
        String body = """
            {"bitcoin": {"usd": 50000.0, "usd_24h_change": 2.0, "usd_24h_vol": 123456789.7, "last_updated_at": 1709280000}}
            """;
        StepVerifier.create(client(body).fetchQuote("BTC"))
            .assertNext(r -> {
                assertEquals("BTC", r.symbol());
                assertEquals(50000.0, r.currentPrice());
                assertEquals(2.0, r.changePercent());
                assertEquals(1000.0, r.change(), 1e-9);
                assertEquals(49000.0, r.previousClose(), 1e-9);
                assertEquals(49000.0, r.open(), 1e-9);
                assertEquals(52500.0, r.high(), 1e-9);
                assertEquals(47500.0, r.low(), 1e-9);
                assertEquals(123456789L, r.volume());
                assertEquals(CoinGeckoClient.SOURCE_ID, r.source());
            })
            .verifyComplete();

        String query = requests.get(0).url().getQuery();
        assertTrue(query.contains("ids=bitcoin"));
        assertTrue(query.contains("vs_currencies=usd"));
    }

    @Test
    @DisplayName("unmapped ticker → empty without any HTTP call")
    void unmappedTickerSkipsHttp() {
        StepVerifier.create(client("{}").fetchQuote("DOGE")).verifyComplete();
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("coin absent from the response → empty")
    void coinMissing() {
        StepVerifier.create(client("{}").fetchQuote("ETH")).verifyComplete();
        assertEquals(1, requests.size());
    }

    private CoinGeckoClient client(ExchangeFunction exchange, SourceRateLimiter limiter, Duration timeout) {
        WebClient webClient = WebClient.builder()
            .baseUrl("https://api.coingecko.com/api/v3")
            .exchangeFunction(exchange)
            .build();
        return new CoinGeckoClient(webClient, MarketDataConfig.newObjectMapper(), limiter, true, timeout);
    }

    @Nested
    @DisplayName("failure modes and throttling")
    class FailureModes {

        private final List<Long> issuedAt = new CopyOnWriteArrayList<>();

        private ExchangeFunction answering(String contentType, String body) {
            return request -> {
                issuedAt.add(System.nanoTime());
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header("Content-Type", contentType)
                    .body(body)
                    .build());
            };
        }

        @Test
        @DisplayName("a provider that never answers times out into empty")
        void hangingProviderTimesOut() {
            CoinGeckoClient client = client(request -> Mono.never(), new SourceRateLimiter(Duration.ZERO),
                Duration.ofMillis(100));

            StepVerifier.create(client.fetchQuote("BTC"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("a non-JSON body → empty")
        void nonJsonBody() {
            CoinGeckoClient client = client(answering("text/html", "<html><body>Service Unavailable</body></html>"),
                new SourceRateLimiter(Duration.ZERO), Duration.ofSeconds(5));

            StepVerifier.create(client.fetchQuote("BTC")).verifyComplete();
            assertEquals(1, issuedAt.size());
        }

        @Test
        @DisplayName("the rate-limit permit is taken before the request goes out")
        void permitPrecedesRequest() {
            CoinGeckoClient client = client(answering("application/json", "{\"bitcoin\": {\"usd\": 50000.0, \"usd_24h_change\": 2.0}}"),
                new SourceRateLimiter(Duration.ofMillis(300)), Duration.ofSeconds(5));

            assertNotNull(client.fetchQuote("BTC").block());
            assertNotNull(client.fetchQuote("BTC").block());

            assertEquals(2, issuedAt.size());
            long gapMs = Duration.ofNanos(issuedAt.get(1) - issuedAt.get(0)).toMillis();
            assertTrue(gapMs >= 200, "second request went out " + gapMs + "ms after the first");
        }
    }
}
