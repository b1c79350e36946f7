package com.insightfinance.common.classifier;

import com.insightfinance.common.model.AssetType;

import java.util.List;
import java.util.Locale;

/**
 * Pure stateless classifier that maps a ticker to an {@link AssetType} by pattern.
 *
 * <p>Rules (evaluated in priority order):
 * <ol>
 *   <li>contains a known crypto ticker            → {@link AssetType#CRYPTO}</li>
 *   <li>six characters containing a currency code → {@link AssetType#FOREX}</li>
 *   <li>otherwise                                 → {@link AssetType#STOCK}</li>
 * </ol>
 *
 * <p>No logging and no side effects.
 */
public final class AssetTypeClassifier {

    private static final List<String> CRYPTO_PATTERNS = List.of(
        "BTC", "ETH", "ADA", "DOT", "LINK", "UNI", "AAVE", "SOL", "MATIC", "AVAX");

    private static final List<String> CURRENCY_CODES = List.of(
        "USD", "EUR", "GBP", "JPY", "AUD", "CAD", "CHF", "NZD");

    private AssetTypeClassifier() {}

    public static AssetType classify(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return AssetType.STOCK;
        }
        String upper = symbol.toUpperCase(Locale.ROOT);

        if (CRYPTO_PATTERNS.stream().anyMatch(upper::contains)) {
            return AssetType.CRYPTO;
        }
        if (upper.length() == 6 && CURRENCY_CODES.stream().anyMatch(upper::contains)) {
            return AssetType.FOREX;
        }
        return AssetType.STOCK;
    }
}
