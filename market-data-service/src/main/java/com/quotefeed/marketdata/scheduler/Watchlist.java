package com.quotefeed.marketdata.scheduler;

import com.quotefeed.common.model.AssetClass;
import com.quotefeed.common.normalize.QuoteNormalizer;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Symbols polled on every tick, grouped by asset class in insertion order.
 *
 * <p>Writers are serialized on the instance; ticks iterate over {@link #snapshot()} so a
 * concurrent add never disturbs a running tick. Symbols are stored in their class's base form
 * ({@code BTC-USD} as {@code BTC}, {@code GC=F} as {@code GOLD}, {@code RELIANCE.NS} as
 * {@code RELIANCE}) so each instrument is watched once. {@code UNKNOWN} entries are filed under
 * {@code EQUITY}.
 */
public class Watchlist {

    private final Map<AssetClass, Set<String>> symbols = new EnumMap<>(AssetClass.class);

    public Watchlist() {
        for (AssetClass assetClass : AssetClass.values()) {
            if (assetClass != AssetClass.UNKNOWN) {
                symbols.put(assetClass, new LinkedHashSet<>());
            }
        }
    }

    /**
     * @return {@code true} if the symbol was not yet watched under that class
     */
    public synchronized boolean add(AssetClass assetClass, String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        AssetClass target = assetClass == null || assetClass == AssetClass.UNKNOWN ? AssetClass.EQUITY : assetClass;
        return symbols.get(target).add(QuoteNormalizer.baseSymbol(target, symbol));
    }

    public synchronized void addAll(AssetClass assetClass, Collection<String> seeds) {
        seeds.stream()
            .filter(s -> s != null && !s.isBlank())
            .forEach(s -> add(assetClass, s));
    }

    public synchronized Map<AssetClass, List<String>> snapshot() {
        Map<AssetClass, List<String>> copy = new EnumMap<>(AssetClass.class);
        symbols.forEach((assetClass, set) -> copy.put(assetClass, List.copyOf(set)));
        return copy;
    }

    public synchronized int size() {
        return symbols.values().stream().mapToInt(Set::size).sum();
    }
}
