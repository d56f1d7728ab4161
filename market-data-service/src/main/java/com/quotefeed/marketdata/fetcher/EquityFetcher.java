package com.quotefeed.marketdata.fetcher;

import com.quotefeed.common.model.AssetClass;
import com.quotefeed.common.normalize.QuoteNormalizer;
import com.quotefeed.marketdata.cache.FallbackQuoteCache;
import com.quotefeed.marketdata.provider.ProviderChain;

/**
 * NSE equities. Base symbols are bare tickers ({@code RELIANCE}); published symbols carry
 * the {@code .NS} suffix. Chain order: aggregator API → NSE direct → Yahoo Finance.
 */
public class EquityFetcher extends AbstractAssetFetcher {

    static final String NSE_SUFFIX = ".NS";

    public EquityFetcher(ProviderChain chain, FallbackQuoteCache cache) {
        super(chain, cache);
    }

    @Override
    public AssetClass assetClass() {
        return AssetClass.EQUITY;
    }

    @Override
    protected String normalizeSymbol(String symbol) {
        return QuoteNormalizer.equityBase(clean(symbol));
    }

    @Override
    protected String canonicalSymbol(String baseSymbol) {
        return baseSymbol + NSE_SUFFIX;
    }

    /** Yahoo ticker for an NSE base symbol. */
    public static String yahooTicker(String baseSymbol) {
        return baseSymbol + NSE_SUFFIX;
    }
}
