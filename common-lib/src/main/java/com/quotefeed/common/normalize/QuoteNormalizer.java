package com.quotefeed.common.normalize;

import com.quotefeed.common.model.AssetClass;
import com.quotefeed.common.model.CanonicalQuote;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pure, stateless normalization helpers shared by every fetcher.
 *
 * <p>All methods are deterministic, allocation-light and safe to call from any thread.
 * None of them throws for malformed input.
 */
public final class QuoteNormalizer {

    public static final int DEFAULT_SCALE = 2;

    static final Set<String> CRYPTO_BASES = Set.of(
        "BTC", "ETH", "XRP", "SOL", "ADA", "DOT", "DOGE", "MATIC",
        "LINK", "AVAX", "BNB", "SHIB", "LTC", "UNI", "ATOM"
    );

    static final Set<String> COMMODITY_ALIASES = Set.of(
        "GOLD", "SILVER", "CRUDE", "NATGAS", "COPPER", "PLATINUM"
    );

    static final Set<String> EQUITY_ALLOWLIST = Set.of(
        "RELIANCE", "TCS", "INFY", "HDFCBANK", "ICICIBANK", "SBIN", "HDFC",
        "BAJFINANCE", "BHARTIARTL", "ITC", "KOTAKBANK", "LT", "AXISBANK",
        "ASIAN", "MARUTI", "TITAN", "NESTLEIND", "ULTRACEMCO", "WIPRO",
        "TATASTEEL", "NTPC", "POWERGRID", "SUNPHARMA", "TATAMOTORS", "ADANIENT"
    );

    // longest first so "-USDT" wins over "USDT"
    private static final List<String> CRYPTO_PAIR_SUFFIXES = List.of(
        "-USDT", "/USDT", "-USD", "/USD", "-INR", "USDT"
    );

    private static final List<String> EQUITY_EXCHANGE_SUFFIXES = List.of(".NS", ".BO");

    private static final String FUTURES_SUFFIX = "=F";

    /** Commodity alias → front-month futures code. */
    static final Map<String, String> COMMODITY_FUTURES = Map.of(
        "GOLD",     "GC=F",
        "SILVER",   "SI=F",
        "CRUDE",    "CL=F",
        "NATGAS",   "NG=F",
        "COPPER",   "HG=F",
        "PLATINUM", "PL=F"
    );

    private record MockPoint(String price, String changePercent) {}

    private static final Map<String, MockPoint> MOCK_TABLE = Map.of(
        "BTC-USD",     new MockPoint("98500.00", "2.15"),
        "ETH-USD",     new MockPoint("3420.50",  "1.82"),
        "RELIANCE.NS", new MockPoint("2985.75",  "0.45"),
        "HDFCBANK.NS", new MockPoint("1580.20",  "-0.32"),
        "TCS.NS",      new MockPoint("4125.00",  "0.88"),
        "INFY.NS",     new MockPoint("1890.50",  "0.15"),
        "GOLD",        new MockPoint("2045.30",  "0.28"),
        "GC=F",        new MockPoint("2045.30",  "0.28"),
        "SILVER",      new MockPoint("24.55",    "0.62"),
        "SI=F",        new MockPoint("24.55",    "0.62")
    );

    private static final MockPoint DEFAULT_MOCK = new MockPoint("100.00", "0.00");

    private QuoteNormalizer() {}

    // ── rounding ─────────────────────────────────────────────────────────────

    public static BigDecimal roundToScale(Object value) {
        return roundToScale(value, DEFAULT_SCALE);
    }

    /**
     * Half-up rounding through {@link BigDecimal}. Doubles are converted through their
     * shortest decimal string so {@code 2.675} rounds to {@code 2.68}, not {@code 2.67}.
     * {@code null}, blank, non-numeric, NaN and infinite inputs map to zero at the requested scale.
     */
    public static BigDecimal roundToScale(Object value, int decimals) {
        int scale = Math.max(0, decimals);
        BigDecimal decimal = toBigDecimal(value);
        if (decimal == null) {
            return BigDecimal.ZERO.setScale(scale);
        }
        return decimal.setScale(scale, RoundingMode.HALF_UP);
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal bd) {
            return bd;
        }
        try {
            if (value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                return Double.isFinite(d) ? new BigDecimal(Double.toString(d)) : null;
            }
            if (value instanceof Number n) {
                return new BigDecimal(n.toString());
            }
            String text = value.toString().trim();
            return text.isEmpty() ? null : new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // ── classification ───────────────────────────────────────────────────────

    /**
     * Lexical asset-class detection. Blank input is {@link AssetClass#UNKNOWN};
     * anything unrecognised is treated as {@link AssetClass#EQUITY}.
     */
    public static AssetClass classify(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return AssetClass.UNKNOWN;
        }
        String s = symbol.trim().toUpperCase(Locale.ROOT);

        for (String suffix : EQUITY_EXCHANGE_SUFFIXES) {
            if (s.endsWith(suffix)) {
                return AssetClass.EQUITY;
            }
        }
        for (String suffix : CRYPTO_PAIR_SUFFIXES) {
            if (s.endsWith(suffix) && s.length() > suffix.length()) {
                return AssetClass.CRYPTO;
            }
        }
        if (CRYPTO_BASES.contains(s)) {
            return AssetClass.CRYPTO;
        }
        if (s.endsWith(FUTURES_SUFFIX) || COMMODITY_ALIASES.contains(s)) {
            return AssetClass.COMMODITY;
        }
        return AssetClass.EQUITY;
    }

    /** Strips any known crypto pair suffix, e.g. {@code BTC-USD} → {@code BTC}. */
    public static String cryptoBase(String symbol) {
        String s = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        for (String suffix : CRYPTO_PAIR_SUFFIXES) {
            if (s.endsWith(suffix) && s.length() > suffix.length()) {
                return s.substring(0, s.length() - suffix.length());
            }
        }
        return s;
    }

    /** Strips an NSE/BSE exchange suffix, e.g. {@code RELIANCE.NS} → {@code RELIANCE}. */
    public static String equityBase(String symbol) {
        String s = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        for (String suffix : EQUITY_EXCHANGE_SUFFIXES) {
            if (s.endsWith(suffix)) {
                return s.substring(0, s.length() - suffix.length());
            }
        }
        return s;
    }

    /** Maps a futures code back to its alias, e.g. {@code GC=F} → {@code GOLD}. */
    public static String commodityBase(String symbol) {
        String s = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        return COMMODITY_FUTURES.entrySet().stream()
            .filter(e -> e.getValue().equals(s))
            .map(Map.Entry::getKey)
            .findFirst()
            .orElse(s);
    }

    /** Futures code for a commodity alias; unknown aliases pass through unchanged. */
    public static String futuresCode(String alias) {
        return COMMODITY_FUTURES.getOrDefault(alias, alias);
    }

    /**
     * Base form a fetcher of {@code assetClass} works with, so one instrument has exactly one
     * key: {@code BTC-USD} → {@code BTC}, {@code RELIANCE.NS} → {@code RELIANCE},
     * {@code GC=F} → {@code GOLD}. {@code UNKNOWN} is treated as equity.
     */
    public static String baseSymbol(AssetClass assetClass, String symbol) {
        if (assetClass == AssetClass.CRYPTO) {
            return cryptoBase(symbol);
        }
        if (assetClass == AssetClass.COMMODITY) {
            return commodityBase(symbol);
        }
        return equityBase(symbol);
    }

    // ── synthetic fallback ───────────────────────────────────────────────────

    /**
     * Deterministic stand-in quote for a symbol no provider or cache could serve.
     * Known symbols get fixed reference values; everything else is priced at 100.00.
     */
    public static CanonicalQuote syntheticQuote(String symbol) {
        String key = symbol == null ? "UNKNOWN" : symbol.trim().toUpperCase(Locale.ROOT);
        MockPoint point = MOCK_TABLE.getOrDefault(key, DEFAULT_MOCK);
        AssetClass assetClass = classify(key);
        return new CanonicalQuote(
            key,
            new BigDecimal(point.price()),
            new BigDecimal(point.changePercent()),
            assetClass,
            assetClass.defaultCurrency(),
            CanonicalQuote.NEUTRAL_SENTIMENT,
            true,
            CanonicalQuote.SOURCE_MOCK,
            Instant.now(),
            null
        );
    }
}
