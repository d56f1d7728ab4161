package com.quotefeed.marketdata.fetcher;

import com.quotefeed.common.model.AssetClass;
import com.quotefeed.common.normalize.QuoteNormalizer;
import com.quotefeed.marketdata.cache.FallbackQuoteCache;
import com.quotefeed.marketdata.provider.ProviderChain;

/**
 * Cryptocurrencies priced in USD. {@code BTC}, {@code BTC-USD}, {@code btc/usdt} all map to
 * base {@code BTC} and publish as {@code BTC-USD}. Chain order: Binance → CoinGecko.
 */
public class CryptoFetcher extends AbstractAssetFetcher {

    public CryptoFetcher(ProviderChain chain, FallbackQuoteCache cache) {
        super(chain, cache);
    }

    @Override
    public AssetClass assetClass() {
        return AssetClass.CRYPTO;
    }

    @Override
    protected String normalizeSymbol(String symbol) {
        return QuoteNormalizer.cryptoBase(clean(symbol));
    }

    @Override
    protected String canonicalSymbol(String baseSymbol) {
        return baseSymbol + "-USD";
    }
}
