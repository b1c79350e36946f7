package com.insightfinance.marketdata.service;

import com.insightfinance.common.classifier.Symbols;
import com.insightfinance.common.model.AssetType;
import com.insightfinance.marketdata.model.SymbolMatch;
import com.insightfinance.marketdata.model.SymbolValidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Symbol lookup: substring search over a built-in directory, and existence checks through a
 * live intraday acquisition.
 */
@Service
public class SymbolService {

    private static final Logger log = LoggerFactory.getLogger(SymbolService.class);

    static final String VALIDATION_PERIOD = "1d";
    static final String INVALID_FORMAT = "Invalid symbol format";
    static final String NOT_FOUND = "Symbol not found or data unavailable";

    static final List<SymbolMatch> DIRECTORY = List.of(
        new SymbolMatch("AAPL", "Apple Inc.", AssetType.STOCK),
        new SymbolMatch("GOOGL", "Alphabet Inc.", AssetType.STOCK),
        new SymbolMatch("MSFT", "Microsoft Corporation", AssetType.STOCK),
        new SymbolMatch("TSLA", "Tesla Inc.", AssetType.STOCK),
        new SymbolMatch("AMZN", "Amazon.com Inc.", AssetType.STOCK),
        new SymbolMatch("BTC", "Bitcoin", AssetType.CRYPTO),
        new SymbolMatch("ETH", "Ethereum", AssetType.CRYPTO),
        new SymbolMatch("ADA", "Cardano", AssetType.CRYPTO),
        new SymbolMatch("DOT", "Polkadot", AssetType.CRYPTO),
        new SymbolMatch("LINK", "Chainlink", AssetType.CRYPTO),
        new SymbolMatch("UNI", "Uniswap", AssetType.CRYPTO),
        new SymbolMatch("AAVE", "Aave", AssetType.CRYPTO),
        new SymbolMatch("SOL", "Solana", AssetType.CRYPTO),
        new SymbolMatch("MATIC", "Polygon", AssetType.CRYPTO),
        new SymbolMatch("AVAX", "Avalanche", AssetType.CRYPTO)
    );

    private final MarketDataService marketDataService;

    public SymbolService(MarketDataService marketDataService) {
        this.marketDataService = marketDataService;
    }

    /** Case-insensitive match on ticker or company name, in directory order. */
    public List<SymbolMatch> search(String query, int limit) {
        String needle = query.trim().toUpperCase(Locale.ROOT);
        List<SymbolMatch> matches = DIRECTORY.stream()
            .filter(m -> m.symbol().contains(needle) || m.name().toUpperCase(Locale.ROOT).contains(needle))
            .limit(limit)
            .toList();
        log.info("Symbol search. query={} results={}", query, matches.size());
        return matches;
    }

    /** Never empty and never an error: an unknown or unreachable symbol comes back invalid. */
    public Mono<SymbolValidation> validate(String symbol) {
        String key = Symbols.normalize(symbol);
        if (!Symbols.isValid(key)) {
            return Mono.just(SymbolValidation.invalid(key, INVALID_FORMAT));
        }
        return marketDataService.getPriceWithHistory(key, VALIDATION_PERIOD)
            .map(record -> SymbolValidation.valid(key, nameOf(key).orElse(null), record.assetType(),
                record.source()))
            .defaultIfEmpty(SymbolValidation.invalid(key, NOT_FOUND))
            .onErrorResume(e -> {
                log.error("Symbol validation failed. symbol={}", key, e);
                return Mono.just(SymbolValidation.invalid(key, "Validation failed"));
            })
            .doOnNext(v -> log.info("Symbol validated. symbol={} valid={}", key, v.valid()));
    }

    static Optional<String> nameOf(String symbol) {
        return DIRECTORY.stream()
            .filter(m -> m.symbol().equals(symbol))
            .map(SymbolMatch::name)
            .findFirst();
    }
}
