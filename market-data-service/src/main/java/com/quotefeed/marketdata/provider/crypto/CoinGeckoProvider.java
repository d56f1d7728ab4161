package com.quotefeed.marketdata.provider.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotefeed.common.exception.ProviderException;
import com.quotefeed.common.model.OhlcvBar;
import com.quotefeed.marketdata.provider.ProviderQuote;
import com.quotefeed.marketdata.provider.QuoteProvider;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CoinGecko public API, no API key.
 *
 * <p>History comes from {@code market_chart}, which only has point prices. Every 4th point
 * is turned into a bar with a fixed ±0.5% band and flagged {@code approximate}.
 */
public class CoinGeckoProvider implements QuoteProvider {

    static final String PROVIDER = "COINGECKO";

    static final double APPROXIMATION_BAND = 0.005;
    static final int    SAMPLE_EVERY       = 4;

    static final Map<String, String> COIN_IDS = Map.ofEntries(
        Map.entry("BTC",   "bitcoin"),
        Map.entry("ETH",   "ethereum"),
        Map.entry("XRP",   "ripple"),
        Map.entry("SOL",   "solana"),
        Map.entry("ADA",   "cardano"),
        Map.entry("DOT",   "polkadot"),
        Map.entry("DOGE",  "dogecoin"),
        Map.entry("MATIC", "matic-network"),
        Map.entry("LINK",  "chainlink"),
        Map.entry("AVAX",  "avalanche-2"),
        Map.entry("BNB",   "binancecoin"),
        Map.entry("SHIB",  "shiba-inu"),
        Map.entry("LTC",   "litecoin"),
        Map.entry("UNI",   "uniswap"),
        Map.entry("ATOM",  "cosmos")
    );

    private final WebClient    webClient;
    private final ObjectMapper objectMapper;

    public CoinGeckoProvider(WebClient coinGeckoClient, ObjectMapper objectMapper) {
        this.webClient    = coinGeckoClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return PROVIDER;
    }

    @Override
    public Mono<ProviderQuote> fetchQuote(String baseSymbol) {
        String coinId = COIN_IDS.get(baseSymbol);
        if (coinId == null) {
            return Mono.error(new ProviderException(PROVIDER, "no coin id mapping for symbol=" + baseSymbol));
        }
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v3/simple/price")
                .queryParam("ids", coinId)
                .queryParam("vs_currencies", "usd")
                .queryParam("include_24hr_change", "true")
                .queryParam("include_24hr_vol", "true")
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parsePrice(coinId, json));
    }

    @Override
    public Mono<List<OhlcvBar>> fetchHistory(String baseSymbol, int days) {
        String coinId = COIN_IDS.get(baseSymbol);
        if (coinId == null) {
            return Mono.empty();
        }
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v3/coins/{id}/market_chart")
                .queryParam("vs_currency", "usd")
                .queryParam("days", days)
                .build(coinId))
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parseMarketChart(coinId, json));
    }

    private ProviderQuote parsePrice(String coinId, String json) {
        try {
            JsonNode coin = objectMapper.readTree(json).path(coinId);
            if (coin.isMissingNode()) {
                throw new ProviderException(PROVIDER, "coin missing from response. id=" + coinId);
            }
            return new ProviderQuote(
                coin.path("usd").asDouble(0),
                coin.path("usd_24h_change").asDouble(0),
                coinId,
                (long) coin.path("usd_24h_vol").asDouble(0));
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            throw new ProviderException(PROVIDER, "unparsable price payload. id=" + coinId, e);
        }
    }

    private List<OhlcvBar> parseMarketChart(String coinId, String json) {
        JsonNode prices;
        try {
            prices = objectMapper.readTree(json).path("prices");
        } catch (Exception e) {
            throw new ProviderException(PROVIDER, "unparsable market_chart payload. id=" + coinId, e);
        }
        List<OhlcvBar> bars = new ArrayList<>();
        for (int i = 0; i < prices.size(); i += SAMPLE_EVERY) {
            JsonNode point = prices.get(i);
            bars.add(OhlcvBar.approximated(
                Instant.ofEpochMilli(point.path(0).asLong()),
                point.path(1).asDouble(),
                APPROXIMATION_BAND));
        }
        return bars;
    }
}
