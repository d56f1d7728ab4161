package com.quotefeed.marketdata.provider.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotefeed.common.exception.ProviderException;
import com.quotefeed.common.model.OhlcvBar;
import com.quotefeed.marketdata.provider.ProviderQuote;
import com.quotefeed.marketdata.provider.QuoteProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Binance public spot endpoints, no API key: 24h ticker for quotes and klines for true
 * OHLCV history. History is hourly by default, so {@code days} maps to {@code days × 24}
 * candles up to {@link KlineInterval#HOURLY}'s cap. Base symbols are quoted against USDT.
 */
public class BinanceTickerProvider implements QuoteProvider {

    private static final Logger log = LoggerFactory.getLogger(BinanceTickerProvider.class);

    static final String PROVIDER = "BINANCE";

    /** Candle width requested from {@code /api/v3/klines}. */
    public enum KlineInterval {
        /** 30 days of hourly candles. */
        HOURLY("1h", 24, 720),
        /** Binance caps a single klines request at 1000 candles. */
        DAILY("1d", 1, 1000);

        private final String code;
        private final int    candlesPerDay;
        private final int    maxCandles;

        KlineInterval(String code, int candlesPerDay, int maxCandles) {
            this.code          = code;
            this.candlesPerDay = candlesPerDay;
            this.maxCandles    = maxCandles;
        }

        public String code() {
            return code;
        }

        int limitFor(int days) {
            long candles = (long) Math.max(1, days) * candlesPerDay;
            return (int) Math.min(candles, maxCandles);
        }

        /** Accepts the Binance code ({@code 1h}, {@code 1d}) or the constant name. */
        public static KlineInterval fromCode(String value) {
            String v = value == null ? "" : value.trim();
            for (KlineInterval interval : values()) {
                if (interval.code.equalsIgnoreCase(v) || interval.name().equals(v.toUpperCase(Locale.ROOT))) {
                    return interval;
                }
            }
            throw new IllegalArgumentException("Unsupported kline interval: " + value);
        }
    }

    private final WebClient     webClient;
    private final ObjectMapper  objectMapper;
    private final KlineInterval historyInterval;

    public BinanceTickerProvider(WebClient binanceClient, ObjectMapper objectMapper) {
        this(binanceClient, objectMapper, KlineInterval.HOURLY);
    }

    public BinanceTickerProvider(WebClient binanceClient, ObjectMapper objectMapper, KlineInterval historyInterval) {
        this.webClient       = binanceClient;
        this.objectMapper    = objectMapper;
        this.historyInterval = historyInterval;
    }

    @Override
    public String name() {
        return PROVIDER;
    }

    @Override
    public Mono<ProviderQuote> fetchQuote(String baseSymbol) {
        String pair = pair(baseSymbol);
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v3/ticker/24hr")
                .queryParam("symbol", pair)
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parseTicker(pair, json));
    }

    @Override
    public Mono<List<OhlcvBar>> fetchHistory(String baseSymbol, int days) {
        String pair = pair(baseSymbol);
        int limit = historyInterval.limitFor(days);
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v3/klines")
                .queryParam("symbol", pair)
                .queryParam("interval", historyInterval.code())
                .queryParam("limit", limit)
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parseKlines(pair, json));
    }

    static String pair(String baseSymbol) {
        return baseSymbol + "USDT";
    }

    private ProviderQuote parseTicker(String pair, String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            // prices arrive as decimal strings
            return new ProviderQuote(
                root.path("lastPrice").asDouble(0),
                root.path("priceChangePercent").asDouble(0),
                pair,
                (long) root.path("volume").asDouble(0));
        } catch (Exception e) {
            throw new ProviderException(PROVIDER, "unparsable ticker for pair=" + pair, e);
        }
    }

    private List<OhlcvBar> parseKlines(String pair, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new ProviderException(PROVIDER, "unparsable klines for pair=" + pair, e);
        }
        if (!root.isArray()) {
            throw new ProviderException(PROVIDER, "unexpected klines payload for pair=" + pair);
        }
        List<OhlcvBar> bars = new ArrayList<>(root.size());
        // Each entry: [openTime, open, high, low, close, volume, closeTime, ...]
        for (JsonNode k : root) {
            if (!k.isArray() || k.size() < 6) {
                log.debug("Skipping malformed kline for pair={}: {}", pair, k);
                continue;
            }
            bars.add(OhlcvBar.of(
                Instant.ofEpochMilli(k.get(0).asLong()),
                k.get(1).asDouble(), k.get(2).asDouble(), k.get(3).asDouble(), k.get(4).asDouble(),
                (long) k.get(5).asDouble()));
        }
        return bars;
    }
}
