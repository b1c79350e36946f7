package com.insightfinance.marketdata.service;

import com.insightfinance.common.model.AssetType;
import com.insightfinance.marketdata.cache.InMemoryCacheStore;
import com.insightfinance.marketdata.config.MarketDataConfig;
import com.insightfinance.marketdata.model.SymbolMatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SymbolServiceTest {

    private final FakeQuoteSource source = new FakeQuoteSource("fake", Set.of(AssetType.values()), symbol ->
        "ETH".equals(symbol) || "IBM".equals(symbol)
            ? Mono.just(FakeQuoteSource.quote(symbol, 10.0, "fake"))
            : Mono.empty());

    private final MarketDataService marketData = new MarketDataService(List.of(source),
        new InMemoryCacheStore(MarketDataConfig.newObjectMapper(), "test:"), Duration.ofMinutes(5));

    private final SymbolService symbols = new SymbolService(marketData);

    @Nested
    @DisplayName("search()")
    class Search {

        @Test
        @DisplayName("matches ticker or name, case-insensitively, in directory order")
        void matchesTickerOrName() {
            List<String> found = symbols.search("a", 50).stream().map(SymbolMatch::symbol).toList();

            assertTrue(found.containsAll(List.of("AAPL", "AMZN", "ADA", "AAVE", "MSFT")));
            assertFalse(found.contains("ETH"));
            assertEquals("AAPL", found.get(0));
            assertEquals(List.of("BTC"), symbols.search("bitcoin", 10).stream().map(SymbolMatch::symbol).toList());
        }

        @Test
        void limitCapsResults() {
            assertEquals(2, symbols.search("a", 2).size());
        }

        @Test
        void noMatchIsEmpty() {
            assertTrue(symbols.search("zzz", 10).isEmpty());
        }
    }

    @Nested
    @DisplayName("validate()")
    class Validate {

        @Test
        @DisplayName("a quotable symbol is valid and typed by the acquisition")
        void quotableSymbol() {
            StepVerifier.create(symbols.validate(" eth "))
                .assertNext(v -> {
                    assertTrue(v.valid());
                    assertEquals("ETH", v.symbol());
                    assertEquals("Ethereum", v.name());
                    assertEquals(AssetType.CRYPTO, v.type());
                    assertEquals("fake", v.source());
                    assertNull(v.error());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("validation acquires the intraday period")
        void usesIntradayPeriod() {
            StepVerifier.create(symbols.validate("IBM"))
                .assertNext(v -> {
                    assertTrue(v.valid());
                    assertNull(v.name());
                })
                .verifyComplete();
            StepVerifier.create(marketData.getPriceWithHistory("IBM", SymbolService.VALIDATION_PERIOD))
                .assertNext(r -> assertEquals(SymbolService.VALIDATION_PERIOD, r.period()))
                .verifyComplete();
            assertEquals(1, source.calls.get());
        }

        @Test
        void unknownSymbolIsInvalid() {
            StepVerifier.create(symbols.validate("NOPE"))
                .assertNext(v -> {
                    assertFalse(v.valid());
                    assertEquals(SymbolService.NOT_FOUND, v.error());
                })
                .verifyComplete();
        }

        @Test
        void malformedSymbolNeverReachesAProvider() {
            StepVerifier.create(symbols.validate("BAD$"))
                .assertNext(v -> assertEquals(SymbolService.INVALID_FORMAT, v.error()))
                .verifyComplete();
            assertEquals(0, source.calls.get());
        }
    }
}
