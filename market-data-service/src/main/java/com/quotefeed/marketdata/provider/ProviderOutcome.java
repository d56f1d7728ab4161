package com.quotefeed.marketdata.provider;

/**
 * Tagged result of one provider call: either a quote or a failure reason, never both.
 */
public record ProviderOutcome(String provider, ProviderQuote quote, String failureReason) {

    public static ProviderOutcome success(String provider, ProviderQuote quote) {
        return new ProviderOutcome(provider, quote, null);
    }

    public static ProviderOutcome failure(String provider, String reason) {
        return new ProviderOutcome(provider, null, reason);
    }

    public boolean isSuccess() {
        return quote != null;
    }
}
