package com.quotefeed.marketdata.provider.equity;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class IndianStockApiProviderTest {

    private MockWebServer server;
    private IndianStockApiProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        WebClient client = WebClient.builder()
            .baseUrl(String.format("http://localhost:%s", server.getPort()))
            .build();
        provider = new IndianStockApiProvider(client, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void readsPrimaryFieldNames() throws InterruptedException {
        server.enqueue(json("{\"lastPrice\":4125.0,\"pChange\":0.88,\"companyName\":\"Tata Consultancy Services\",\"totalTradedVolume\":120000}"));

        StepVerifier.create(provider.fetchQuote("TCS"))
            .assertNext(q -> {
                assertEquals(4125.0, q.price(), 1e-9);
                assertEquals(0.88, q.changePercent(), 1e-9);
                assertEquals("Tata Consultancy Services", q.displayName());
            })
            .verifyComplete();
        assertEquals("/api/v1/equity/TCS", server.takeRequest().getPath());
    }

    @Test
    void fallsBackToAlternateFieldNames() {
        server.enqueue(json("{\"lastPrice\":0,\"lastTradedPrice\":\"1890.5\",\"changePercent\":-0.15}"));

        StepVerifier.create(provider.fetchQuote("INFY"))
            .assertNext(q -> {
                assertEquals(1890.5, q.price(), 1e-9);
                assertEquals(-0.15, q.changePercent(), 1e-9);
                assertEquals("INFY", q.displayName());
            })
            .verifyComplete();
    }

    @Test
    void noPriceYieldsUnusableQuote() {
        server.enqueue(json("{\"status\":\"not found\"}"));

        StepVerifier.create(provider.fetchQuote("ZZZ"))
            .assertNext(q -> assertFalse(q.hasUsablePrice()))
            .verifyComplete();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
