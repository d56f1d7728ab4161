package com.quotefeed.marketdata.provider;

import com.quotefeed.common.model.OhlcvBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Ordered, statically configured list of providers for one asset class.
 *
 * <p>Every call is bounded by {@code callTimeout} and folded into a {@link ProviderOutcome};
 * the chain emits the first successful outcome in priority order. Providers are subscribed
 * one at a time, so nothing after the first success is ever called.
 */
public class ProviderChain {

    private static final Logger log = LoggerFactory.getLogger(ProviderChain.class);

    private final String         chainName;
    private final List<QuoteProvider> providers;
    private final Duration       callTimeout;

    public ProviderChain(String chainName, List<QuoteProvider> providers, Duration callTimeout) {
        this.chainName   = chainName;
        this.providers   = List.copyOf(providers);
        this.callTimeout = callTimeout;
    }

    public List<QuoteProvider> providers() {
        return providers;
    }

    /**
     * @return the first successful outcome, or empty when every provider failed
     */
    public Mono<ProviderOutcome> firstSuccess(String symbol) {
        return Flux.fromIterable(providers)
            .concatMap(provider -> attempt(provider, symbol))
            .doOnNext(outcome -> {
                if (!outcome.isSuccess()) {
                    log.warn("PROVIDER_FAILED chain={} provider={} symbol={} reason={}",
                             chainName, outcome.provider(), symbol, outcome.failureReason());
                }
            })
            .filter(ProviderOutcome::isSuccess)
            .next();
    }

    /**
     * @return bars from the first provider that returns a non-empty history; empty list on total failure
     */
    public Mono<List<OhlcvBar>> firstHistory(String symbol, int days) {
        return Flux.fromIterable(providers)
            .concatMap(provider -> Mono.defer(() -> provider.fetchHistory(symbol, days))
                .timeout(callTimeout)
                .doOnNext(bars -> log.info("HISTORY_FETCHED chain={} provider={} symbol={} bars={}",
                                           chainName, provider.name(), symbol, bars.size()))
                .onErrorResume(e -> {
                    log.warn("HISTORY_FAILED chain={} provider={} symbol={} reason={}",
                             chainName, provider.name(), symbol, describe(e));
                    return Mono.empty();
                }))
            .filter(bars -> !bars.isEmpty())
            .next()
            .defaultIfEmpty(List.of());
    }

    private Mono<ProviderOutcome> attempt(QuoteProvider provider, String symbol) {
        return Mono.defer(() -> provider.fetchQuote(symbol))
            .timeout(callTimeout)
            .map(quote -> quote.hasUsablePrice()
                ? ProviderOutcome.success(provider.name(), quote)
                : ProviderOutcome.failure(provider.name(), "non-positive price " + quote.price()))
            .defaultIfEmpty(ProviderOutcome.failure(provider.name(), "empty response"))
            .onErrorResume(e -> Mono.just(ProviderOutcome.failure(provider.name(), describe(e))));
    }

    private String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timeout after " + callTimeout.toMillis() + "ms";
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
