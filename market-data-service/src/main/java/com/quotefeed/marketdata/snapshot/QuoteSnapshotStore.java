package com.quotefeed.marketdata.snapshot;

import com.quotefeed.common.model.CanonicalQuote;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest quote per canonical symbol, overwritten on every poll tick.
 *
 * <p>Only the poll scheduler writes here. Readers always receive copies, never the live map.
 * No TTL and no persistence: the store is empty after a restart until the first tick lands.
 */
public class QuoteSnapshotStore {

    private final ConcurrentHashMap<String, CanonicalQuote> latest = new ConcurrentHashMap<>();

    public void put(CanonicalQuote quote) {
        latest.put(key(quote.symbol()), quote);
    }

    public void putAll(Collection<CanonicalQuote> quotes) {
        quotes.forEach(this::put);
    }

    public Optional<CanonicalQuote> get(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(latest.get(key(symbol)));
    }

    /** Point-in-time copy ordered by symbol. */
    public Map<String, CanonicalQuote> getAll() {
        return Collections.unmodifiableMap(new TreeMap<>(latest));
    }

    public int size() {
        return latest.size();
    }

    private static String key(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
