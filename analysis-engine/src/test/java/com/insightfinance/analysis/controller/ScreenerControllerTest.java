package com.insightfinance.analysis.controller;

import com.insightfinance.analysis.fusion.VoteRatioFusionStrategy;
import com.insightfinance.analysis.service.ScreenerService;
import com.insightfinance.analysis.service.SignalService;
import com.insightfinance.common.model.AssetType;
import com.insightfinance.common.model.PriceRecord;
import com.insightfinance.marketdata.cache.InMemoryCacheStore;
import com.insightfinance.marketdata.config.MarketDataConfig;
import com.insightfinance.marketdata.provider.QuoteSource;
import com.insightfinance.marketdata.service.MarketDataService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

class ScreenerControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        // AAPL and MSFT only, no history
        QuoteSource source = new QuoteSource() {
            @Override public String sourceId() { return "stub"; }
            @Override public boolean isEnabled() { return true; }
            @Override public boolean supports(AssetType assetType) { return true; }

            @Override
            public Mono<PriceRecord> fetchQuote(String symbol) {
                if (!symbol.equals("AAPL") && !symbol.equals("MSFT")) return Mono.empty();
                return Mono.just(PriceRecord.quote(symbol, 100.0, 2.0, 2.0, 1_000L,
                    101.0, 99.0, 98.0, 98.0, "stub"));
            }
        };
        InMemoryCacheStore cache = new InMemoryCacheStore(MarketDataConfig.newObjectMapper(), "test:");
        MarketDataService marketData = new MarketDataService(List.of(source), cache, Duration.ofMinutes(5));
        SignalService signals = new SignalService(marketData, new VoteRatioFusionStrategy(), cache,
            Duration.ofMinutes(10));
        client = WebTestClient.bindToController(new ScreenerController(new ScreenerService(marketData, signals)))
            .build();
    }

    @Test
    @DisplayName("POST screen → ranked assets of the universe that have data")
    void screen() {
        client.post().uri("/api/v1/screener")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("strategy", "technical", "limit", 5))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.strategy").isEqualTo("technical")
            .jsonPath("$.totalResults").isEqualTo(2)
            .jsonPath("$.assets[0].rank").isEqualTo(1)
            .jsonPath("$.assets[1].rank").isEqualTo(2)
            .jsonPath("$.sectorBreakdown.Technology").isEqualTo(2)
            .jsonPath("$.performanceSummary.averageChange").isEqualTo(2.0);
    }

    @Test
    @DisplayName("POST screen with a limit outside 1..200 or an unknown strategy → 400")
    void screenRejectsBadInput() {
        client.post().uri("/api/v1/screener")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("limit", 0))
            .exchange()
            .expectStatus().isBadRequest();

        client.post().uri("/api/v1/screener")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("strategy", "astrology"))
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("GET breadth → counts over the symbols that resolve")
    void breadth() {
        client.get().uri("/api/v1/screener/breadth")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.marketSentiment").exists()
            .jsonPath("$.breadthIndicator").exists();
    }

    @Test
    void strategies() {
        client.get().uri("/api/v1/screener/strategies")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.momentum.name").isEqualTo("Momentum Strategy")
            .jsonPath("$.low_volatility.description").exists();
    }
}
