package com.quotefeed.marketdata.provider.equity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseCookie;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Primes and caches the cookie session the NSE quote API requires.
 *
 * <p>The NSE API rejects requests that did not first load the homepage, so the session is
 * bootstrapped lazily before the first direct call and shared by all concurrent callers.
 * A successful bootstrap is reused for {@code sessionTtl}; a failed one is not cached.
 * {@link #refresh()} forces a new bootstrap after a 401/403.
 */
public class NseSessionBootstrap {

    private static final Logger log = LoggerFactory.getLogger(NseSessionBootstrap.class);

    private final WebClient nseClient;
    private final Duration  sessionTtl;

    private final AtomicReference<Mono<String>> session = new AtomicReference<>();
    private final AtomicInteger                 bootstraps = new AtomicInteger();

    public NseSessionBootstrap(WebClient nseClient, Duration sessionTtl) {
        this.nseClient  = nseClient;
        this.sessionTtl = sessionTtl;
        this.session.set(newSession());
    }

    /** Returns the {@code Cookie} header value for the current session, priming it if needed. */
    public Mono<String> cookieHeader() {
        return session.get();
    }

    /** Drops the current session; the returned Mono performs a fresh bootstrap. */
    public Mono<String> refresh() {
        Mono<String> fresh = newSession();
        session.set(fresh);
        log.info("[NSE] Session invalidated, re-bootstrapping");
        return fresh;
    }

    public int bootstrapCount() {
        return bootstraps.get();
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Mono<String> newSession() {
        return prime().cache(
            cookies -> sessionTtl,
            error   -> Duration.ZERO,
            ()      -> Duration.ZERO);
    }

    private Mono<String> prime() {
        return Mono.defer(() -> {
            int attempt = bootstraps.incrementAndGet();
            log.info("[NSE] Bootstrapping cookie session. attempt={}", attempt);
            return nseClient.get()
                .uri("/")
                .exchangeToMono(response -> {
                    String header = response.cookies().values().stream()
                        .flatMap(List::stream)
                        .map(this::toPair)
                        .collect(Collectors.joining("; "));
                    return response.releaseBody().thenReturn(header);
                })
                .doOnSuccess(h -> log.info("[NSE] Session ready. cookies={}", h == null || h.isEmpty() ? 0 : h.split("; ").length))
                .doOnError(e -> log.warn("[NSE] Session bootstrap failed. reason={}", e.getMessage()));
        });
    }

    private String toPair(ResponseCookie cookie) {
        return cookie.getName() + "=" + cookie.getValue();
    }
}
