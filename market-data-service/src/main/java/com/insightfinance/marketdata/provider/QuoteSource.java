package com.insightfinance.marketdata.provider;

import com.insightfinance.common.model.AssetType;
import com.insightfinance.common.model.PriceRecord;
import reactor.core.publisher.Mono;

/**
 * One external quote provider in the acquisition fallback chain.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>acquire the shared rate limiter for {@link #sourceId()} before every network call</li>
 *   <li>complete <b>empty</b> on every failure mode (non-2xx, error payload, quota message,
 *       malformed body, timeout); {@link #fetchQuote(String)} never emits an error</li>
 *   <li>return a normalized {@link PriceRecord} with {@code currentPrice > 0}</li>
 * </ul>
 * Order in the chain comes from {@link org.springframework.core.annotation.Order}.
 */
public interface QuoteSource {

    /** Source tag written into {@link PriceRecord#source()} and used as the rate-limit key. */
    String sourceId();

    /** A disabled source is skipped exactly as if it always returned nothing. */
    boolean isEnabled();

    boolean supports(AssetType assetType);

    Mono<PriceRecord> fetchQuote(String symbol);
}
