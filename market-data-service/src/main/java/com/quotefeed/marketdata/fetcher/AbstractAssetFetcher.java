package com.quotefeed.marketdata.fetcher;

import com.quotefeed.common.model.CanonicalQuote;
import com.quotefeed.common.model.OhlcvBar;
import com.quotefeed.common.normalize.QuoteNormalizer;
import com.quotefeed.marketdata.cache.CachedQuote;
import com.quotefeed.marketdata.cache.FallbackQuoteCache;
import com.quotefeed.marketdata.provider.ProviderChain;
import com.quotefeed.marketdata.provider.ProviderOutcome;
import com.quotefeed.marketdata.provider.ProviderQuote;
import com.quotefeed.marketdata.provider.QuoteProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Shared quote algorithm for every asset class:
 * <ol>
 *   <li>normalize the symbol to the class's base form;</li>
 *   <li>walk the {@link ProviderChain}, first usable price wins;</li>
 *   <li>on success normalize, tag the provider, refresh the fallback cache;</li>
 *   <li>on total failure serve the cached quote tagged {@code CACHED};</li>
 *   <li>with no cache entry serve a synthetic {@code MOCK} quote.</li>
 * </ol>
 * Subclasses supply symbol mapping and may decorate live quotes via {@link #localize}.
 */
public abstract class AbstractAssetFetcher implements AssetFetcher {

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final ProviderChain      chain;
    private final FallbackQuoteCache cache;

    protected AbstractAssetFetcher(ProviderChain chain, FallbackQuoteCache cache) {
        this.chain = chain;
        this.cache = cache;
    }

    /** Upper-cased base form used for provider calls and cache keys, e.g. {@code BTC}. */
    protected abstract String normalizeSymbol(String symbol);

    /** Display form published to callers, e.g. {@code BTC-USD}. */
    protected abstract String canonicalSymbol(String baseSymbol);

    /**
     * Presentation hook applied to live quotes before caching. {@code rawPrice} is the
     * provider's unrounded price. Identity by default; never applied to synthetic quotes.
     */
    protected CanonicalQuote localize(String baseSymbol, CanonicalQuote quote, double rawPrice) {
        return quote;
    }

    @Override
    public Mono<CanonicalQuote> getQuote(String symbol) {
        String base = normalizeSymbol(symbol);
        return chain.firstSuccess(base)
            .map(outcome -> onSuccess(base, outcome))
            .switchIfEmpty(Mono.fromSupplier(() -> fallback(base)))
            .onErrorResume(e -> {
                log.error("Unexpected fetch failure. class={} symbol={}", assetClass(), base, e);
                return Mono.fromSupplier(() -> fallback(base));
            });
    }

    @Override
    public Mono<List<OhlcvBar>> getHistory(String symbol, int days) {
        String base = normalizeSymbol(symbol);
        return chain.firstHistory(base, days)
            .doOnNext(bars -> {
                if (bars.isEmpty()) {
                    log.warn("No history available. class={} symbol={} days={}", assetClass(), base, days);
                }
            })
            .onErrorResume(e -> {
                log.error("Unexpected history failure. class={} symbol={}", assetClass(), base, e);
                return Mono.just(List.of());
            });
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private CanonicalQuote onSuccess(String base, ProviderOutcome outcome) {
        ProviderQuote raw = outcome.quote();
        CanonicalQuote quote = new CanonicalQuote(
            canonicalSymbol(base),
            QuoteNormalizer.roundToScale(raw.price()),
            QuoteNormalizer.roundToScale(raw.changePercent()),
            assetClass(),
            assetClass().defaultCurrency(),
            CanonicalQuote.NEUTRAL_SENTIMENT,
            false,
            outcome.provider(),
            Instant.now(),
            null);
        CanonicalQuote localized = localize(base, quote, raw.price());
        cache.put(base, localized);
        log.info("QUOTE_FETCHED class={} provider={} symbol={} price={}",
                 assetClass(), outcome.provider(), localized.symbol(), localized.price());
        return localized;
    }

    private CanonicalQuote fallback(String base) {
        Optional<CachedQuote> cached = cache.get(base);
        if (cached.isPresent()) {
            log.warn("ALL_PROVIDERS_FAILED class={} symbol={} fallback=CACHED capturedAt={}",
                     assetClass(), base, cached.get().capturedAt());
            return cached.get().quote().withSource(CanonicalQuote.SOURCE_CACHED);
        }
        log.warn("ALL_PROVIDERS_FAILED class={} symbol={} fallback=MOCK", assetClass(), base);
        return QuoteNormalizer.syntheticQuote(canonicalSymbol(base));
    }

    /** Guard against callers passing {@code null} or whitespace-padded input. */
    protected static String clean(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + assetClass() + ", providers="
            + chain.providers().stream().map(QuoteProvider::name).toList() + "]";
    }
}
