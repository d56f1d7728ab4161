package com.quotefeed.marketdata.fetcher;

import com.quotefeed.common.model.AssetClass;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes an {@link AssetClass} to its fetcher. {@code UNKNOWN} resolves to the equity fetcher.
 */
public class FetcherRegistry {

    private final Map<AssetClass, AssetFetcher> fetchers = new EnumMap<>(AssetClass.class);

    public FetcherRegistry(List<AssetFetcher> fetchers) {
        for (AssetFetcher fetcher : fetchers) {
            if (this.fetchers.putIfAbsent(fetcher.assetClass(), fetcher) != null) {
                throw new IllegalArgumentException("Duplicate fetcher for " + fetcher.assetClass());
            }
        }
        if (!this.fetchers.containsKey(AssetClass.EQUITY)) {
            throw new IllegalArgumentException("An EQUITY fetcher is required");
        }
    }

    public AssetFetcher forClass(AssetClass assetClass) {
        AssetFetcher fetcher = assetClass == null ? null : fetchers.get(assetClass);
        return fetcher != null ? fetcher : fetchers.get(AssetClass.EQUITY);
    }
}
