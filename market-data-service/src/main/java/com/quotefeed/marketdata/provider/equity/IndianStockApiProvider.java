package com.quotefeed.marketdata.provider.equity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotefeed.common.exception.ProviderException;
import com.quotefeed.marketdata.provider.ProviderQuote;
import com.quotefeed.marketdata.provider.QuoteProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Aggregator REST API for NSE equities ({@code GET /api/v1/equity/{symbol}}).
 *
 * <p>The payload field names vary between deployments, so price and change are read from
 * the first populated of several aliases.
 */
public class IndianStockApiProvider implements QuoteProvider {

    private static final Logger log = LoggerFactory.getLogger(IndianStockApiProvider.class);

    static final String PROVIDER = "INDIAN_STOCK_API";

    private final WebClient    webClient;
    private final ObjectMapper objectMapper;

    public IndianStockApiProvider(WebClient indianStockApiClient, ObjectMapper objectMapper) {
        this.webClient    = indianStockApiClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return PROVIDER;
    }

    @Override
    public Mono<ProviderQuote> fetchQuote(String baseSymbol) {
        return webClient.get()
            .uri("/api/v1/equity/{symbol}", baseSymbol)
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parse(baseSymbol, json))
            .doOnSuccess(q -> log.debug("Indian stock API quote parsed. symbol={} price={}", baseSymbol,
                                        q == null ? null : q.price()));
    }

    private ProviderQuote parse(String symbol, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new ProviderException(PROVIDER, "unparsable payload for symbol=" + symbol, e);
        }
        double price  = firstPositive(root, "lastPrice", "price", "lastTradedPrice");
        double change = firstNumber(root, "pChange", "changePercent");
        String name   = root.path("companyName").asText(symbol);
        long   volume = root.path("totalTradedVolume").asLong(0);
        return new ProviderQuote(price, change, name, volume);
    }

    private static double firstPositive(JsonNode node, String... fields) {
        for (String field : fields) {
            double value = node.path(field).asDouble(0);
            if (value > 0) {
                return value;
            }
        }
        return 0;
    }

    private static double firstNumber(JsonNode node, String... fields) {
        for (String field : fields) {
            if (node.hasNonNull(field)) {
                return node.path(field).asDouble(0);
            }
        }
        return 0;
    }
}
