package com.quotefeed.common.model;

import java.util.Locale;

/**
 * Asset class of a tracked instrument. Each class knows the currency its live quotes are
 * denominated in, which is also the currency of its synthetic fallback quotes.
 */
public enum AssetClass {
    EQUITY("INR"),
    CRYPTO("USD"),
    COMMODITY("USD"),
    UNKNOWN("USD");

    private final String defaultCurrency;

    AssetClass(String defaultCurrency) {
        this.defaultCurrency = defaultCurrency;
    }

    public String defaultCurrency() {
        return defaultCurrency;
    }

    /**
     * Resolves a free-form type label (as accepted by the watchlist API) to an asset class.
     * Unrecognised or blank labels resolve to {@link #EQUITY}.
     */
    public static AssetClass fromAlias(String alias) {
        if (alias == null || alias.isBlank()) {
            return EQUITY;
        }
        return switch (alias.trim().toUpperCase(Locale.ROOT)) {
            case "CRYPTO", "CRYPTOCURRENCY"   -> CRYPTO;
            case "COMMODITY", "METAL"         -> COMMODITY;
            default                           -> EQUITY;
        };
    }
}
