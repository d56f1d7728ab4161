package com.quotefeed.marketdata.provider;

import com.quotefeed.common.model.OhlcvBar;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * One external price source in an asset-class provider chain.
 *
 * <p>Implementations either emit a {@link ProviderQuote} parsed at their own boundary or
 * fail fast (error or empty). Partial results are not allowed: a payload without a usable
 * price must surface as an error, never as a half-filled quote.
 */
public interface QuoteProvider {

    /** Stable label recorded as the {@code source} of quotes this provider produced. */
    String name();

    Mono<ProviderQuote> fetchQuote(String baseSymbol);

    /**
     * Daily OHLCV history, oldest first. Providers without a history endpoint keep the
     * default, which completes empty so the chain moves on.
     */
    default Mono<List<OhlcvBar>> fetchHistory(String baseSymbol, int days) {
        return Mono.empty();
    }
}
