package com.quotefeed.marketdata.provider.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotefeed.common.exception.ProviderException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class BinanceTickerProviderTest {

    private MockWebServer server;
    private WebClient client;
    private BinanceTickerProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = WebClient.builder()
            .baseUrl(String.format("http://localhost:%s", server.getPort()))
            .build();
        provider = new BinanceTickerProvider(client, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void parsesTwentyFourHourTicker() throws InterruptedException {
        server.enqueue(json("""
            {"symbol":"BTCUSDT","lastPrice":"97123.45000000","priceChangePercent":"-1.234","volume":"15234.5"}
            """));

        StepVerifier.create(provider.fetchQuote("BTC"))
            .assertNext(q -> {
                assertEquals(97123.45, q.price(), 1e-9);
                assertEquals(-1.234, q.changePercent(), 1e-9);
                assertEquals(15234L, q.volume());
            })
            .verifyComplete();

        RecordedRequest request = server.takeRequest();
        assertEquals("/api/v3/ticker/24hr?symbol=BTCUSDT", request.getPath());
    }

    @Test
    void unknownPairSurfacesAsError() {
        server.enqueue(new MockResponse().setResponseCode(400)
            .setBody("{\"code\":-1121,\"msg\":\"Invalid symbol.\"}"));

        StepVerifier.create(provider.fetchQuote("NOPE"))
            .expectError()
            .verify();
    }

    @Test
    void garbageBodyIsProviderException() {
        server.enqueue(json("not json"));

        StepVerifier.create(provider.fetchQuote("ETH"))
            .expectError(ProviderException.class)
            .verify();
    }

    @Test
    void historyDefaultsToHourlyCandles() throws InterruptedException {
        server.enqueue(json("""
            [
              [1767225600000,"93000.1","93400.0","92900.5","93350.25","120.5",1767229199999,"0",0,"0","0","0"],
              [1767229200000,"93350.25","93600.0","93300.0","93580.0","98.0",1767232799999,"0",0,"0","0","0"]
            ]
            """));

        StepVerifier.create(provider.fetchHistory("BTC", 30))
            .assertNext(bars -> {
                assertEquals(2, bars.size());
                assertEquals(Instant.ofEpochMilli(1767225600000L), bars.get(0).time());
                assertEquals(Instant.ofEpochMilli(1767229200000L), bars.get(1).time());
                assertEquals(new BigDecimal("93400.00"), bars.get(0).high());
                assertEquals(new BigDecimal("93350.25"), bars.get(0).close());
                assertEquals(120L, bars.get(0).volume());
                assertFalse(bars.get(0).approximate());
            })
            .verifyComplete();

        RecordedRequest request = server.takeRequest();
        assertEquals("/api/v3/klines?symbol=BTCUSDT&interval=1h&limit=720", request.getPath());
    }

    @Test
    void hourlyLimitIsDaysTimesTwentyFour() throws InterruptedException {
        server.enqueue(json("[]"));
        server.enqueue(json("[]"));

        provider.fetchHistory("ETH", 7).block();
        provider.fetchHistory("ETH", 365).block();

        assertEquals("/api/v3/klines?symbol=ETHUSDT&interval=1h&limit=168", server.takeRequest().getPath());
        assertEquals("/api/v3/klines?symbol=ETHUSDT&interval=1h&limit=720", server.takeRequest().getPath());
    }

    @Test
    void dailyKlinesWhenConfigured() throws InterruptedException {
        BinanceTickerProvider daily = new BinanceTickerProvider(
            client, new ObjectMapper(), BinanceTickerProvider.KlineInterval.DAILY);
        server.enqueue(json("""
            [
              [1767225600000,"93000.1","95000.0","92000.5","94500.25","1200.5",1767311999999,"0",0,"0","0","0"],
              [1767312000000,"94500.25","96000.0","94000.0","95800.0","980.0",1767398399999,"0",0,"0","0","0"]
            ]
            """));

        StepVerifier.create(daily.fetchHistory("BTC", 2))
            .assertNext(bars -> {
                assertEquals(2, bars.size());
                assertEquals(new BigDecimal("95000.00"), bars.get(0).high());
                assertEquals(1200L, bars.get(0).volume());
            })
            .verifyComplete();

        RecordedRequest request = server.takeRequest();
        assertEquals("/api/v3/klines?symbol=BTCUSDT&interval=1d&limit=2", request.getPath());
    }

    @Test
    void dailyLimitIsCapped() throws InterruptedException {
        BinanceTickerProvider daily = new BinanceTickerProvider(
            client, new ObjectMapper(), BinanceTickerProvider.KlineInterval.DAILY);
        server.enqueue(json("[]"));

        StepVerifier.create(daily.fetchHistory("ETH", 5000))
            .assertNext(bars -> assertTrue(bars.isEmpty()))
            .verifyComplete();

        assertTrue(server.takeRequest().getPath().endsWith("interval=1d&limit=1000"));
    }

    @Test
    void intervalCodesResolve() {
        assertEquals(BinanceTickerProvider.KlineInterval.HOURLY, BinanceTickerProvider.KlineInterval.fromCode("1h"));
        assertEquals(BinanceTickerProvider.KlineInterval.DAILY, BinanceTickerProvider.KlineInterval.fromCode("daily"));
        assertThrows(IllegalArgumentException.class, () -> BinanceTickerProvider.KlineInterval.fromCode("5m"));
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
