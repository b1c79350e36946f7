package com.insightfinance.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient numeric coercion for provider payloads: blank or missing values fall back to a default.
 */
final class ProviderValues {

    private ProviderValues() {}

    static double parseDouble(String raw, double fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        return Double.parseDouble(raw.trim());
    }

    static double parsePercent(String raw, double fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        String trimmed = raw.trim();
        if (trimmed.endsWith("%")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return Double.parseDouble(trimmed);
    }

    static long parseLong(String raw, long fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        return (long) Double.parseDouble(raw.trim());
    }

    static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asDouble() : fallback;
    }

    static long wholeNumber(JsonNode node, String field, long fallback) {
        JsonNode value = node.path(field);
        return value.isNumber() ? (long) value.asDouble() : fallback;
    }
}
