package com.quotefeed.marketdata.scheduler;

import com.quotefeed.common.event.QuoteBroadcastMessage;
import com.quotefeed.common.model.AssetClass;
import com.quotefeed.common.model.CanonicalQuote;
import com.quotefeed.common.normalize.QuoteNormalizer;
import com.quotefeed.marketdata.broadcast.QuoteBroadcastSink;
import com.quotefeed.marketdata.fetcher.FetcherRegistry;
import com.quotefeed.marketdata.snapshot.QuoteSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fixed-interval poller over the {@link Watchlist}.
 *
 * <p>One loop per process:
 * <pre>
 *   tick() → delay(interval) → tick() → ...
 * </pre>
 * Each tick fetches every watched symbol concurrently, waits for all of them, writes the
 * results to the {@link QuoteSnapshotStore} and publishes them one by one to the
 * {@link QuoteBroadcastSink}. Ticks are strictly sequential: a slow tick delays the next one,
 * it never overlaps it and missed intervals are not caught up.
 *
 * <p>A failing symbol is logged and dropped from that tick only. A failing publish is logged
 * and skipped. Neither stops the loop.
 */
public class QuotePollScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(QuotePollScheduler.class);

    static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    public enum State { STOPPED, RUNNING }

    private final FetcherRegistry    fetchers;
    private final Watchlist          watchlist;
    private final QuoteSnapshotStore snapshotStore;
    private final QuoteBroadcastSink broadcastSink;
    private final Duration           interval;
    private final boolean            autoStartup;

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private volatile Disposable     loop;
    private volatile CountDownLatch terminated = new CountDownLatch(0);

    public QuotePollScheduler(FetcherRegistry fetchers,
                              Watchlist watchlist,
                              QuoteSnapshotStore snapshotStore,
                              QuoteBroadcastSink broadcastSink,
                              Duration interval,
                              boolean autoStartup) {
        this.fetchers      = fetchers;
        this.watchlist     = watchlist;
        this.snapshotStore = snapshotStore;
        this.broadcastSink = broadcastSink;
        this.interval      = interval;
        this.autoStartup   = autoStartup;
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    @Override
    public void start() {
        if (!state.compareAndSet(State.STOPPED, State.RUNNING)) {
            log.debug("Poll scheduler already running. Ignoring start.");
            return;
        }
        try {
            CountDownLatch latch = new CountDownLatch(1);
            terminated = latch;
            loop = Mono.defer(this::tick)
                .onErrorResume(e -> {
                    log.error("Tick failed unexpectedly. Continuing with next interval.", e);
                    return Mono.empty();
                })
                .then(Mono.delay(interval))
                .repeat()
                .doFinally(signal -> latch.countDown())
                .subscribe(
                    ignored -> { },
                    err -> log.error("Poll loop terminated with error", err));
            log.info("POLL_STARTED intervalSeconds={} watchlistSize={}", interval.toSeconds(), watchlist.size());
        } catch (RuntimeException e) {
            log.error("Poll scheduler failed to start", e);
            state.set(State.STOPPED);
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPED)) {
            return;
        }
        Disposable current = loop;
        if (current != null) {
            current.dispose();
        }
        try {
            if (!terminated.await(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Poll loop did not terminate within {}s", STOP_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("POLL_STOPPED");
    }

    @Override
    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    public State getState() {
        return state.get();
    }

    // ── watchlist ─────────────────────────────────────────────────────────────

    /**
     * Adds a symbol to the polled set. A blank {@code type} means "classify from the symbol".
     *
     * @return {@code true} if the watchlist changed
     */
    public boolean addToWatchlist(String symbol, String type) {
        AssetClass assetClass = type == null || type.isBlank()
            ? QuoteNormalizer.classify(symbol)
            : AssetClass.fromAlias(type);
        boolean added = watchlist.add(assetClass, symbol);
        if (added) {
            log.info("WATCHLIST_ADDED symbol={} class={}", symbol, assetClass);
        }
        return added;
    }

    public Map<AssetClass, List<String>> watchlist() {
        return watchlist.snapshot();
    }

    // ── tick ──────────────────────────────────────────────────────────────────

    /**
     * One poll cycle over a snapshot of the watchlist.
     *
     * @return the quotes that were stored and offered for broadcast, in completion order
     */
    public Mono<List<CanonicalQuote>> tick() {
        Map<AssetClass, List<String>> targets = watchlist.snapshot();
        List<Mono<CanonicalQuote>> fetches = new ArrayList<>();
        targets.forEach((assetClass, symbols) ->
            symbols.forEach(symbol -> fetches.add(fetchIsolated(assetClass, symbol))));

        long startedAt = System.nanoTime();
        return Flux.merge(fetches)
            .collectList()
            .doOnNext(quotes -> {
                deliver(quotes);
                log.info("TICK_COMPLETE requested={} delivered={} elapsedMs={}",
                         fetches.size(), quotes.size(),
                         TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
            });
    }

    private Mono<CanonicalQuote> fetchIsolated(AssetClass assetClass, String symbol) {
        return Mono.defer(() -> fetchers.forClass(assetClass).getQuote(symbol))
            .onErrorResume(e -> {
                log.error("TICK_FETCH_FAILED class={} symbol={}", assetClass, symbol, e);
                return Mono.empty();
            });
    }

    private void deliver(List<CanonicalQuote> quotes) {
        snapshotStore.putAll(quotes);
        for (CanonicalQuote quote : quotes) {
            try {
                broadcastSink.publish(QuoteBroadcastMessage.from(quote));
            } catch (RuntimeException e) {
                log.warn("BROADCAST_FAILED symbol={} reason={}", quote.symbol(), e.getMessage());
            }
        }
    }
}
