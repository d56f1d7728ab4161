package com.quotefeed.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotefeed.common.model.AssetClass;
import com.quotefeed.marketdata.broadcast.ReactiveQuoteBroadcastSink;
import com.quotefeed.marketdata.cache.FallbackQuoteCache;
import com.quotefeed.marketdata.fetcher.CommodityFetcher;
import com.quotefeed.marketdata.fetcher.CryptoFetcher;
import com.quotefeed.marketdata.fetcher.EquityFetcher;
import com.quotefeed.marketdata.fetcher.FetcherRegistry;
import com.quotefeed.marketdata.provider.BlockingCallPool;
import com.quotefeed.marketdata.provider.ProviderChain;
import com.quotefeed.marketdata.provider.crypto.BinanceTickerProvider;
import com.quotefeed.marketdata.provider.crypto.CoinGeckoProvider;
import com.quotefeed.marketdata.provider.equity.IndianStockApiProvider;
import com.quotefeed.marketdata.provider.equity.NseDirectProvider;
import com.quotefeed.marketdata.provider.equity.NseSessionBootstrap;
import com.quotefeed.marketdata.provider.yahoo.YahooFinanceClient;
import com.quotefeed.marketdata.provider.yahoo.YahooFinanceProvider;
import com.quotefeed.marketdata.scheduler.QuotePollScheduler;
import com.quotefeed.marketdata.scheduler.Watchlist;
import com.quotefeed.marketdata.snapshot.QuoteSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Engine wiring: provider chains per asset class, the shared blocking pool, the snapshot store,
 * the broadcast sink and the poll scheduler.
 */
@Configuration
public class MarketDataConfig {

    private static final Logger log = LoggerFactory.getLogger(MarketDataConfig.class);

    @Value("${market-data.provider.timeout-seconds:8}")
    private long providerTimeoutSeconds;

    @Value("${market-data.blocking-pool.threads:4}")
    private int blockingThreads;

    @Value("${market-data.blocking-pool.queue:64}")
    private int blockingQueue;

    @Value("${market-data.nse.session-ttl-minutes:5}")
    private long nseSessionTtlMinutes;

    @Value("${market-data.binance.history-interval:1h}")
    private String binanceHistoryInterval;

    @Value("${market-data.poll.interval-seconds:15}")
    private long pollIntervalSeconds;

    @Value("${market-data.poll.enabled:true}")
    private boolean pollEnabled;

    @Value("${market-data.watchlist.equity:RELIANCE,TCS,HDFCBANK,INFY,ICICIBANK}")
    private List<String> equitySeeds;

    @Value("${market-data.watchlist.crypto:BTC,ETH,SOL}")
    private List<String> cryptoSeeds;

    @Value("${market-data.watchlist.commodity:GOLD,SILVER}")
    private List<String> commoditySeeds;

    // ── shared resources ─────────────────────────────────────────────────────

    @Bean(destroyMethod = "close")
    public BlockingCallPool blockingCallPool() {
        return new BlockingCallPool(blockingThreads, blockingQueue);
    }

    @Bean
    public YahooFinanceClient yahooFinanceClient(RestClient yahooRestClient, ObjectMapper objectMapper) {
        return new YahooFinanceClient(yahooRestClient, objectMapper);
    }

    @Bean
    public NseSessionBootstrap nseSessionBootstrap(@Qualifier("nseClient") WebClient nseClient) {
        return new NseSessionBootstrap(nseClient, Duration.ofMinutes(nseSessionTtlMinutes));
    }

    // ── fetchers ─────────────────────────────────────────────────────────────

    @Bean
    public EquityFetcher equityFetcher(@Qualifier("indianStockApiClient") WebClient indianStockApiClient,
                                       @Qualifier("nseClient") WebClient nseClient,
                                       NseSessionBootstrap nseSession,
                                       YahooFinanceClient yahoo,
                                       BlockingCallPool pool,
                                       ObjectMapper objectMapper) {
        ProviderChain chain = new ProviderChain("EQUITY", List.of(
            new IndianStockApiProvider(indianStockApiClient, objectMapper),
            new NseDirectProvider(nseClient, nseSession, objectMapper),
            new YahooFinanceProvider(yahoo, pool, EquityFetcher::yahooTicker)
        ), providerTimeout());
        return new EquityFetcher(chain, new FallbackQuoteCache("equity"));
    }

    @Bean
    public CryptoFetcher cryptoFetcher(@Qualifier("binanceClient") WebClient binanceClient,
                                       @Qualifier("coinGeckoClient") WebClient coinGeckoClient,
                                       ObjectMapper objectMapper) {
        ProviderChain chain = new ProviderChain("CRYPTO", List.of(
            new BinanceTickerProvider(binanceClient, objectMapper,
                                      BinanceTickerProvider.KlineInterval.fromCode(binanceHistoryInterval)),
            new CoinGeckoProvider(coinGeckoClient, objectMapper)
        ), providerTimeout());
        return new CryptoFetcher(chain, new FallbackQuoteCache("crypto"));
    }

    @Bean
    public CommodityFetcher commodityFetcher(YahooFinanceClient yahoo, BlockingCallPool pool) {
        ProviderChain chain = new ProviderChain("COMMODITY", List.of(
            new YahooFinanceProvider(yahoo, pool, CommodityFetcher::yahooTicker)
        ), providerTimeout());
        return new CommodityFetcher(chain, new FallbackQuoteCache("commodity"));
    }

    @Bean
    public FetcherRegistry fetcherRegistry(EquityFetcher equity, CryptoFetcher crypto, CommodityFetcher commodity) {
        FetcherRegistry registry = new FetcherRegistry(List.of(equity, crypto, commodity));
        log.info("Fetchers configured. {} {} {}", equity, crypto, commodity);
        return registry;
    }

    // ── polling & fan-out ────────────────────────────────────────────────────

    @Bean
    public QuoteSnapshotStore quoteSnapshotStore() {
        return new QuoteSnapshotStore();
    }

    @Bean
    public ReactiveQuoteBroadcastSink quoteBroadcastSink() {
        return new ReactiveQuoteBroadcastSink();
    }

    @Bean
    public Watchlist watchlist() {
        Watchlist watchlist = new Watchlist();
        watchlist.addAll(AssetClass.EQUITY, equitySeeds);
        watchlist.addAll(AssetClass.CRYPTO, cryptoSeeds);
        watchlist.addAll(AssetClass.COMMODITY, commoditySeeds);
        return watchlist;
    }

    @Bean
    public QuotePollScheduler quotePollScheduler(FetcherRegistry fetchers,
                                                 Watchlist watchlist,
                                                 QuoteSnapshotStore snapshotStore,
                                                 ReactiveQuoteBroadcastSink broadcastSink) {
        return new QuotePollScheduler(fetchers, watchlist, snapshotStore, broadcastSink,
                                      Duration.ofSeconds(pollIntervalSeconds), pollEnabled);
    }

    private Duration providerTimeout() {
        return Duration.ofSeconds(providerTimeoutSeconds);
    }
}
