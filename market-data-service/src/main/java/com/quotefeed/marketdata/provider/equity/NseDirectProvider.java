package com.quotefeed.marketdata.provider.equity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotefeed.common.exception.ProviderException;
import com.quotefeed.marketdata.provider.ProviderQuote;
import com.quotefeed.marketdata.provider.QuoteProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Direct NSE quote API ({@code GET /api/quote-equity?symbol=}).
 *
 * <p>Requests carry the cookies from {@link NseSessionBootstrap}. A 401 or 403 means the
 * session went stale: the session is re-bootstrapped and the request retried once.
 */
public class NseDirectProvider implements QuoteProvider {

    private static final Logger log = LoggerFactory.getLogger(NseDirectProvider.class);

    static final String PROVIDER = "NSE_DIRECT";

    private final WebClient           nseClient;
    private final NseSessionBootstrap session;
    private final ObjectMapper        objectMapper;

    public NseDirectProvider(WebClient nseClient, NseSessionBootstrap session, ObjectMapper objectMapper) {
        this.nseClient    = nseClient;
        this.session      = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return PROVIDER;
    }

    @Override
    public Mono<ProviderQuote> fetchQuote(String baseSymbol) {
        return session.cookieHeader()
            .flatMap(cookies -> request(baseSymbol, cookies))
            .onErrorResume(this::isSessionRejected, e -> {
                log.warn("[NSE] {} received, refreshing session and retrying. symbol={}",
                         ((WebClientResponseException) e).getStatusCode().value(), baseSymbol);
                return session.refresh().flatMap(cookies -> request(baseSymbol, cookies));
            })
            .map(json -> parse(baseSymbol, json));
    }

    private Mono<String> request(String symbol, String cookies) {
        return nseClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/quote-equity")
                .queryParam("symbol", symbol)
                .build())
            .header(HttpHeaders.COOKIE, cookies)
            .retrieve()
            .bodyToMono(String.class);
    }

    private boolean isSessionRejected(Throwable e) {
        if (e instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            return status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value();
        }
        return false;
    }

    private ProviderQuote parse(String symbol, String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode priceInfo = root.path("priceInfo");
            if (priceInfo.isMissingNode()) {
                throw new ProviderException(PROVIDER, "no priceInfo for symbol=" + symbol);
            }
            return new ProviderQuote(
                priceInfo.path("lastPrice").asDouble(0),
                priceInfo.path("pChange").asDouble(0),
                root.path("info").path("companyName").asText(symbol),
                priceInfo.path("totalTradedVolume").asLong(0));
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            throw new ProviderException(PROVIDER, "unparsable payload for symbol=" + symbol, e);
        }
    }
}
