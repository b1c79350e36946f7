package com.insightfinance.common.exception;

/**
 * Raised inside a source adapter when a provider response cannot be turned into a quote.
 * Never escapes the adapter boundary: adapters translate it into an empty result.
 */
public class MarketDataException extends RuntimeException {
    private final String source;

    public MarketDataException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public MarketDataException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
