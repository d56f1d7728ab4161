package com.quotefeed.marketdata.provider.yahoo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotefeed.common.exception.ProviderException;
import com.quotefeed.common.model.OhlcvBar;
import com.quotefeed.marketdata.provider.ProviderQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Synchronous Yahoo Finance chart client (v8 {@code /finance/chart} endpoint).
 *
 * <p>Every method blocks on network I/O. Callers must only reach it through
 * {@link com.quotefeed.marketdata.provider.BlockingCallPool}.
 */
public class YahooFinanceClient {

    private static final Logger log = LoggerFactory.getLogger(YahooFinanceClient.class);

    static final String PROVIDER = "YAHOO_FINANCE";

    private final RestClient   http;
    private final ObjectMapper objectMapper;

    public YahooFinanceClient(RestClient yahooRestClient, ObjectMapper objectMapper) {
        this.http         = yahooRestClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Latest price for a Yahoo ticker (e.g. {@code RELIANCE.NS}, {@code GC=F}).
     * Change is computed against the previous close reported in the chart meta block.
     */
    public ProviderQuote fetchQuote(String ticker) {
        JsonNode meta = fetchChart(ticker, "1d").path("meta");
        double price = meta.path("regularMarketPrice").asDouble(0);
        if (price <= 0) {
            throw new ProviderException(PROVIDER, "no regularMarketPrice for ticker=" + ticker);
        }
        double previous = meta.hasNonNull("chartPreviousClose")
            ? meta.path("chartPreviousClose").asDouble(0)
            : meta.path("previousClose").asDouble(0);
        double changePct = previous > 0 ? (price - previous) / previous * 100.0 : 0.0;

        String name = meta.path("shortName").asText(ticker);
        long volume = meta.path("regularMarketVolume").asLong(0);
        log.debug("Yahoo quote parsed. ticker={} price={} previousClose={}", ticker, price, previous);
        return new ProviderQuote(price, changePct, name, volume);
    }

    /** Daily candles for the last {@code days} days, oldest first. Rows with gaps are skipped. */
    public List<OhlcvBar> fetchDailyHistory(String ticker, int days) {
        JsonNode result = fetchChart(ticker, days + "d");
        JsonNode timestamps = result.path("timestamp");
        JsonNode quote = result.path("indicators").path("quote").path(0);
        if (!timestamps.isArray() || quote.isMissingNode()) {
            return List.of();
        }

        List<OhlcvBar> bars = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            JsonNode open  = quote.path("open").path(i);
            JsonNode high  = quote.path("high").path(i);
            JsonNode low   = quote.path("low").path(i);
            JsonNode close = quote.path("close").path(i);
            if (!close.isNumber() || !open.isNumber() || !high.isNumber() || !low.isNumber()) {
                continue;
            }
            bars.add(OhlcvBar.of(
                Instant.ofEpochSecond(timestamps.get(i).asLong()),
                open.asDouble(), high.asDouble(), low.asDouble(), close.asDouble(),
                quote.path("volume").path(i).asLong(0)));
        }
        return bars;
    }

    private JsonNode fetchChart(String ticker, String range) {
        String body;
        try {
            body = http.get()
                .uri("/v8/finance/chart/{ticker}?range={range}&interval=1d", ticker, range)
                .retrieve()
                .body(String.class);
        } catch (Exception e) {
            throw new ProviderException(PROVIDER, "request failed for ticker=" + ticker, e);
        }
        try {
            JsonNode chart = objectMapper.readTree(body == null ? "" : body).path("chart");
            JsonNode result = chart.path("result").path(0);
            if (result.isMissingNode()) {
                throw new ProviderException(PROVIDER,
                    "empty chart for ticker=" + ticker + " error=" + chart.path("error").path("description").asText("none"));
            }
            return result;
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            throw new ProviderException(PROVIDER, "unparsable chart payload for ticker=" + ticker, e);
        }
    }
}
