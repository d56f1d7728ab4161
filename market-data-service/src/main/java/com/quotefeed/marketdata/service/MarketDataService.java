package com.quotefeed.marketdata.service;

import com.quotefeed.common.model.AssetClass;
import com.quotefeed.common.model.CanonicalQuote;
import com.quotefeed.common.model.OhlcvBar;
import com.quotefeed.common.normalize.QuoteNormalizer;
import com.quotefeed.marketdata.fetcher.FetcherRegistry;
import com.quotefeed.marketdata.scheduler.QuotePollScheduler;
import com.quotefeed.marketdata.snapshot.QuoteSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read surface over the engine, used by request handlers.
 *
 * <p>{@link #getQuote} is the on-demand path: it classifies the ticker and runs the live
 * provider chain directly. It neither reads nor writes the {@link QuoteSnapshotStore} and it
 * does not broadcast; only the poll scheduler does that. {@link #getLatest} and
 * {@link #getAllLatest} are non-blocking reads of the last tick's results.
 */
@Service
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final FetcherRegistry    fetchers;
    private final QuoteSnapshotStore snapshotStore;
    private final QuotePollScheduler scheduler;

    public MarketDataService(FetcherRegistry fetchers,
                             QuoteSnapshotStore snapshotStore,
                             QuotePollScheduler scheduler) {
        this.fetchers      = fetchers;
        this.snapshotStore = snapshotStore;
        this.scheduler     = scheduler;
    }

    public Mono<CanonicalQuote> getQuote(String ticker) {
        AssetClass assetClass = QuoteNormalizer.classify(ticker);
        log.info("QUOTE_REQUEST ticker={} class={}", ticker, assetClass);
        return fetchers.forClass(assetClass).getQuote(ticker);
    }

    public Mono<List<OhlcvBar>> getHistory(String ticker, int days) {
        AssetClass assetClass = QuoteNormalizer.classify(ticker);
        log.info("HISTORY_REQUEST ticker={} class={} days={}", ticker, assetClass, days);
        return fetchers.forClass(assetClass).getHistory(ticker, days);
    }

    public Optional<CanonicalQuote> getLatest(String symbol) {
        return snapshotStore.get(symbol);
    }

    public Map<String, CanonicalQuote> getAllLatest() {
        return snapshotStore.getAll();
    }

    public boolean addToWatchlist(String symbol, String type) {
        return scheduler.addToWatchlist(symbol, type);
    }

    public Map<AssetClass, List<String>> watchlist() {
        return scheduler.watchlist();
    }
}
