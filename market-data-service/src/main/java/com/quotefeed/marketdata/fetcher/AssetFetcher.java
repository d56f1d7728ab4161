package com.quotefeed.marketdata.fetcher;

import com.quotefeed.common.model.AssetClass;
import com.quotefeed.common.model.CanonicalQuote;
import com.quotefeed.common.model.OhlcvBar;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Quote and history access for one asset class.
 *
 * <p>Neither operation ever signals an error: {@link #getQuote} always emits exactly one
 * quote (live, {@code CACHED} or {@code MOCK}) and {@link #getHistory} emits a possibly
 * empty list.
 */
public interface AssetFetcher {

    AssetClass assetClass();

    Mono<CanonicalQuote> getQuote(String symbol);

    Mono<List<OhlcvBar>> getHistory(String symbol, int days);
}
