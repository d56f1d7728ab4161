package com.quotefeed.marketdata.fetcher;

import com.quotefeed.common.model.AssetClass;
import com.quotefeed.common.model.CanonicalQuote;
import com.quotefeed.common.normalize.QuoteNormalizer;
import com.quotefeed.marketdata.cache.FallbackQuoteCache;
import com.quotefeed.marketdata.provider.ProviderChain;

/**
 * Commodities via front-month futures proxies. Aliases ({@code GOLD}) are the base form;
 * futures codes passed directly ({@code GC=F}) are mapped back to their alias. Live gold and
 * silver quotes additionally carry an MCX-localized INR price.
 */
public class CommodityFetcher extends AbstractAssetFetcher {

    public CommodityFetcher(ProviderChain chain, FallbackQuoteCache cache) {
        super(chain, cache);
    }

    @Override
    public AssetClass assetClass() {
        return AssetClass.COMMODITY;
    }

    @Override
    protected String normalizeSymbol(String symbol) {
        return QuoteNormalizer.commodityBase(clean(symbol));
    }

    @Override
    protected String canonicalSymbol(String baseSymbol) {
        return baseSymbol;
    }

    @Override
    protected CanonicalQuote localize(String baseSymbol, CanonicalQuote quote, double rawPrice) {
        return McxLocalizer.apply(baseSymbol, quote, rawPrice);
    }

    /** Yahoo futures ticker for a commodity alias; unknown aliases pass through unchanged. */
    public static String yahooTicker(String baseSymbol) {
        return QuoteNormalizer.futuresCode(baseSymbol);
    }
}
