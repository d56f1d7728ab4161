package com.quotefeed.marketdata.provider.yahoo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotefeed.common.exception.ProviderException;
import com.quotefeed.common.model.OhlcvBar;
import com.quotefeed.marketdata.provider.BlockingCallPool;
import com.quotefeed.marketdata.provider.ProviderQuote;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class YahooFinanceClientTest {

    private static final String QUOTE_CHART = """
        {"chart":{"result":[{"meta":{"symbol":"GC=F","regularMarketPrice":2050.0,
          "chartPreviousClose":2000.0,"shortName":"Gold Feb 26","regularMarketVolume":1500}}],"error":null}}
        """;

    private MockWebServer      server;
    private YahooFinanceClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        RestClient restClient = RestClient.builder()
            .baseUrl(String.format("http://localhost:%s", server.getPort()))
            .build();
        client = new YahooFinanceClient(restClient, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("quote change is computed against the previous close")
    void quoteFromChartMeta() throws InterruptedException {
        server.enqueue(json(QUOTE_CHART));

        ProviderQuote quote = client.fetchQuote("GC=F");

        assertEquals(2050.0, quote.price(), 1e-9);
        assertEquals(2.5, quote.changePercent(), 1e-9);
        assertEquals("Gold Feb 26", quote.displayName());
        assertEquals("/v8/finance/chart/GC=F?range=1d&interval=1d", server.takeRequest().getPath());
    }

    @Test
    @DisplayName("empty chart result is a provider failure")
    void emptyChart() {
        server.enqueue(json("{\"chart\":{\"result\":null,\"error\":{\"code\":\"Not Found\",\"description\":\"No data found\"}}}"));

        ProviderException e = assertThrows(ProviderException.class, () -> client.fetchQuote("NOPE.NS"));
        assertEquals("YAHOO_FINANCE", e.getProviderName());
    }

    @Test
    @DisplayName("HTTP errors are wrapped")
    void httpError() {
        server.enqueue(new MockResponse().setResponseCode(429));

        assertThrows(ProviderException.class, () -> client.fetchQuote("RELIANCE.NS"));
    }

    @Test
    @DisplayName("daily history skips rows with null prices")
    void historySkipsGaps() {
        server.enqueue(json("""
            {"chart":{"result":[{"meta":{},
              "timestamp":[1767225600,1767312000,1767398400],
              "indicators":{"quote":[{
                "open":[100.0,null,102.0],"high":[101.5,null,103.0],
                "low":[99.0,null,101.0],"close":[101.0,null,102.5],"volume":[1000,null,1200]}]}}]}}
            """));

        List<OhlcvBar> bars = client.fetchDailyHistory("RELIANCE.NS", 3);

        assertEquals(2, bars.size());
        assertEquals(new BigDecimal("102.50"), bars.get(1).close());
        assertEquals(1200L, bars.get(1).volume());
    }

    @Test
    @DisplayName("provider runs the blocking client on the pool with the mapped ticker")
    void providerUsesPoolAndMapper() throws InterruptedException {
        server.enqueue(json(QUOTE_CHART));
        try (BlockingCallPool pool = new BlockingCallPool(1, 4)) {
            YahooFinanceProvider provider = new YahooFinanceProvider(client, pool, base -> base + "=F");

            StepVerifier.create(provider.fetchQuote("GC"))
                .assertNext(q -> assertEquals(2050.0, q.price(), 1e-9))
                .verifyComplete();
        }
        assertTrue(server.takeRequest().getPath().startsWith("/v8/finance/chart/GC=F"));
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
