package com.insightfinance.common.classifier;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Ticker normalization and validation helpers.
 */
public final class Symbols {

    public static final int MAX_LENGTH = 10;

    private static final Pattern VALID = Pattern.compile("^[A-Z0-9.\\-]{1," + MAX_LENGTH + "}$");

    private Symbols() {}

    /** Trims and upper-cases; {@code null} stays {@code null}. */
    public static String normalize(String symbol) {
        return symbol == null ? null : symbol.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean isValid(String symbol) {
        String normalized = normalize(symbol);
        return normalized != null && VALID.matcher(normalized).matches();
    }
}
