package com.quotefeed.marketdata.provider;

/**
 * Fixed parsed-result shape every provider adapter hands to its chain.
 * Raw vendor payloads never travel past the adapter.
 */
public record ProviderQuote(
    double price,
    double changePercent,
    String displayName,
    long   volume
) {

    /** A quote counts as a success only with a finite, strictly positive price. */
    public boolean hasUsablePrice() {
        return Double.isFinite(price) && price > 0;
    }
}
