package com.quotefeed.marketdata.fetcher;

import com.quotefeed.common.model.AssetClass;
import com.quotefeed.common.model.CanonicalQuote;
import com.quotefeed.common.model.OhlcvBar;
import com.quotefeed.marketdata.cache.FallbackQuoteCache;
import com.quotefeed.marketdata.provider.ProviderChain;
import com.quotefeed.marketdata.provider.ProviderOutcome;
import com.quotefeed.marketdata.provider.ProviderQuote;
import com.quotefeed.marketdata.provider.QuoteProvider;
import com.quotefeed.marketdata.provider.StubProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class AssetFetcherTest {

    private static final Duration TIMEOUT = Duration.ofMillis(200);

    private static ProviderChain chain(QuoteProvider... providers) {
        return new ProviderChain("TEST", List.of(providers), TIMEOUT);
    }

    @Nested
    @DisplayName("quote fallback order")
    class Fallback {

        @Test
        @DisplayName("zero price from the first provider → second provider's rounded price and label")
        void secondProviderAfterZeroPrice() {
            EquityFetcher fetcher = new EquityFetcher(
                chain(StubProvider.pricing("P1", 0.0), StubProvider.pricing("P2", 100.004)),
                new FallbackQuoteCache("equity"));

            StepVerifier.create(fetcher.getQuote("RELIANCE"))
                .assertNext(q -> {
                    assertEquals(new BigDecimal("100.00"), q.price());
                    assertEquals("P2", q.source());
                    assertEquals("RELIANCE.NS", q.symbol());
                    assertEquals("INR", q.currency());
                    assertFalse(q.mock());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("all providers failing with no cache → mock quote with positive price")
        void mockWhenNothingCached() {
            CryptoFetcher fetcher = new CryptoFetcher(
                chain(StubProvider.failing("BINANCE"), StubProvider.failing("COINGECKO")),
                new FallbackQuoteCache("crypto"));

            StepVerifier.create(fetcher.getQuote("BTC"))
                .assertNext(q -> {
                    assertTrue(q.mock());
                    assertEquals(CanonicalQuote.SOURCE_MOCK, q.source());
                    assertEquals("BTC-USD", q.symbol());
                    assertTrue(q.price().signum() > 0);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("all providers failing after an earlier success → cached price tagged CACHED")
        void cachedAfterEarlierSuccess() {
            AtomicBoolean up = new AtomicBoolean(true);
            StubProvider flaky = new StubProvider("BINANCE",
                () -> up.get() ? Mono.just(new ProviderQuote(50000.0, 1.0, "BTC", 0))
                               : Mono.error(new IllegalStateException("down")),
                Mono::empty);
            CryptoFetcher fetcher = new CryptoFetcher(chain(flaky), new FallbackQuoteCache("crypto"));

            fetcher.getQuote("BTC").block();
            up.set(false);

            StepVerifier.create(fetcher.getQuote("btc-usdt"))
                .assertNext(q -> {
                    assertEquals(new BigDecimal("50000.00"), q.price());
                    assertEquals(CanonicalQuote.SOURCE_CACHED, q.source());
                    assertFalse(q.mock());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("an unexpected error inside the chain still yields a quote")
        void unexpectedErrorResumes() {
            ProviderChain broken = new ProviderChain("BROKEN", List.of(StubProvider.pricing("P", 1.0)), TIMEOUT) {
                @Override
                public Mono<ProviderOutcome> firstSuccess(String symbol) {
                    return Mono.error(new IllegalStateException("chain bug"));
                }
            };
            EquityFetcher fetcher = new EquityFetcher(broken, new FallbackQuoteCache("equity"));

            StepVerifier.create(fetcher.getQuote("TCS"))
                .assertNext(q -> assertTrue(q.mock()))
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("symbol mapping")
    class SymbolMapping {

        @Test
        @DisplayName("equity suffixes are stripped and re-applied as .NS")
        void equity() {
            EquityFetcher fetcher = new EquityFetcher(chain(), new FallbackQuoteCache("equity"));
            assertEquals("INFY", fetcher.normalizeSymbol(" infy.bo "));
            assertEquals("INFY.NS", fetcher.canonicalSymbol("INFY"));
            assertEquals(AssetClass.EQUITY, fetcher.assetClass());
        }

        @Test
        @DisplayName("crypto pairs reduce to the base coin")
        void crypto() {
            CryptoFetcher fetcher = new CryptoFetcher(chain(), new FallbackQuoteCache("crypto"));
            assertEquals("ETH", fetcher.normalizeSymbol("eth/usdt"));
            assertEquals("ETH-USD", fetcher.canonicalSymbol("ETH"));
        }

        @Test
        @DisplayName("futures codes map back to their alias")
        void commodity() {
            CommodityFetcher fetcher = new CommodityFetcher(chain(), new FallbackQuoteCache("commodity"));
            assertEquals("GOLD", fetcher.normalizeSymbol("GC=F"));
            assertEquals("SILVER", fetcher.normalizeSymbol("silver"));
            assertEquals("CL=F", CommodityFetcher.yahooTicker("CRUDE"));
            assertEquals("XYZ", CommodityFetcher.yahooTicker("XYZ"));
        }
    }

    @Nested
    @DisplayName("commodity localization")
    class Localization {

        @Test
        @DisplayName("gold keeps its USD price and gains an INR per-10g price")
        void goldLocalized() {
            CommodityFetcher fetcher = new CommodityFetcher(
                chain(StubProvider.pricing("YAHOO_FINANCE", 2000.0)), new FallbackQuoteCache("commodity"));

            StepVerifier.create(fetcher.getQuote("GC=F"))
                .assertNext(q -> {
                    assertEquals(new BigDecimal("2000.00"), q.price());
                    assertEquals("USD", q.currency());
                    assertEquals("GOLD", q.symbol());
                    assertNotNull(q.localized());
                    // 2000 × 83.50 × 0.321507
                    assertEquals(new BigDecimal("53691.67"), q.localized().price());
                    assertEquals("INR", q.localized().currency());
                    assertEquals("per 10g", q.localized().unit());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("INR price is computed from the provider's unrounded USD price")
        void goldLocalizedFromRawPrice() {
            CommodityFetcher fetcher = new CommodityFetcher(
                chain(StubProvider.pricing("YAHOO_FINANCE", 2000.004)), new FallbackQuoteCache("commodity"));

            StepVerifier.create(fetcher.getQuote("GOLD"))
                .assertNext(q -> {
                    assertEquals(new BigDecimal("2000.00"), q.price());
                    assertEquals(new BigDecimal("53691.78"), q.localized().price());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("mock gold quote carries no localized price")
        void mockGoldNotLocalized() {
            CommodityFetcher fetcher = new CommodityFetcher(
                chain(StubProvider.failing("YAHOO_FINANCE")), new FallbackQuoteCache("commodity"));

            StepVerifier.create(fetcher.getQuote("GOLD"))
                .assertNext(q -> {
                    assertTrue(q.mock());
                    assertEquals(CanonicalQuote.SOURCE_MOCK, q.source());
                    assertNull(q.localized());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("crude has no localized price")
        void crudeNotLocalized() {
            CommodityFetcher fetcher = new CommodityFetcher(
                chain(StubProvider.pricing("YAHOO_FINANCE", 75.0)), new FallbackQuoteCache("commodity"));

            StepVerifier.create(fetcher.getQuote("CRUDE"))
                .assertNext(q -> assertNull(q.localized()))
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("history")
    class History {

        @Test
        @DisplayName("total failure → empty list")
        void emptyOnFailure() {
            EquityFetcher fetcher = new EquityFetcher(chain(StubProvider.failing("Y")), new FallbackQuoteCache("equity"));

            StepVerifier.create(fetcher.getHistory("RELIANCE", 30))
                .assertNext(bars -> assertTrue(bars.isEmpty()))
                .verifyComplete();
        }

        @Test
        @DisplayName("bars from the first provider that has them")
        void firstNonEmpty() {
            List<OhlcvBar> bars = List.of(OhlcvBar.of(Instant.parse("2026-01-05T00:00:00Z"), 10, 12, 9, 11, 1000));
            CryptoFetcher fetcher = new CryptoFetcher(
                chain(StubProvider.failing("BINANCE"), StubProvider.withHistory("COINGECKO", bars)),
                new FallbackQuoteCache("crypto"));

            StepVerifier.create(fetcher.getHistory("BTC", 30))
                .assertNext(result -> assertEquals(1, result.size()))
                .verifyComplete();
        }
    }
}
