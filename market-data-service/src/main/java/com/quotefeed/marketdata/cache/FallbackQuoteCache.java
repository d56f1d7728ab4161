package com.quotefeed.marketdata.cache;

import com.quotefeed.common.model.CanonicalQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last-known-good quote per symbol for one fetcher.
 *
 * <p>Written on every live provider success, read only when the whole provider chain has
 * failed. Entries never expire: a stale real price is preferred over a synthetic one.
 * Thread-safe via {@link ConcurrentHashMap}; each symbol is only written by its own fetch.
 */
public class FallbackQuoteCache {

    private static final Logger log = LoggerFactory.getLogger(FallbackQuoteCache.class);

    private final String name;
    private final ConcurrentHashMap<String, CachedQuote> store = new ConcurrentHashMap<>();

    public FallbackQuoteCache(String name) {
        this.name = name;
    }

    public Optional<CachedQuote> get(String symbol) {
        return Optional.ofNullable(store.get(symbol));
    }

    public void put(String symbol, CanonicalQuote quote) {
        store.put(symbol, new CachedQuote(quote, Instant.now()));
        log.debug("CACHE_REFRESH cache={} symbol={} price={} source={}",
                  name, symbol, quote.price(), quote.source());
    }

    public int size() {
        return store.size();
    }
}
