package com.quotefeed.marketdata.provider.yahoo;

import com.quotefeed.common.model.OhlcvBar;
import com.quotefeed.marketdata.provider.BlockingCallPool;
import com.quotefeed.marketdata.provider.ProviderQuote;
import com.quotefeed.marketdata.provider.QuoteProvider;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Chain step backed by the blocking {@link YahooFinanceClient}. Each fetcher supplies its
 * own ticker mapping: equities append {@code .NS}, commodities map aliases to futures codes.
 */
public class YahooFinanceProvider implements QuoteProvider {

    private final YahooFinanceClient     client;
    private final BlockingCallPool       pool;
    private final UnaryOperator<String>  tickerMapper;

    public YahooFinanceProvider(YahooFinanceClient client, BlockingCallPool pool, UnaryOperator<String> tickerMapper) {
        this.client       = client;
        this.pool         = pool;
        this.tickerMapper = tickerMapper;
    }

    @Override
    public String name() {
        return YahooFinanceClient.PROVIDER;
    }

    @Override
    public Mono<ProviderQuote> fetchQuote(String baseSymbol) {
        String ticker = tickerMapper.apply(baseSymbol);
        return pool.submit(() -> client.fetchQuote(ticker));
    }

    @Override
    public Mono<List<OhlcvBar>> fetchHistory(String baseSymbol, int days) {
        String ticker = tickerMapper.apply(baseSymbol);
        return pool.submit(() -> client.fetchDailyHistory(ticker, days));
    }
}
