package com.quotefeed.marketdata.fetcher;

import com.quotefeed.common.model.CanonicalQuote;
import com.quotefeed.common.model.LocalizedPrice;
import com.quotefeed.common.normalize.InrFormat;
import com.quotefeed.common.normalize.QuoteNormalizer;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Restates a USD-per-ounce futures quote as an Indian MCX-style spot price.
 *
 * <p>Uses a fixed unit factor and a fixed USD→INR rate. The result is attached as
 * {@link CanonicalQuote#localized()}; the canonical USD price is left as is.
 */
public final class McxLocalizer {

    public static final BigDecimal USD_TO_INR = new BigDecimal("83.50");

    record Conversion(BigDecimal factor, String unit, String displayName) {}

    static final Map<String, Conversion> CONVERSIONS = Map.of(
        "GOLD",   new Conversion(new BigDecimal("0.321507"), "per 10g", "Chennai Gold Census"),
        "SILVER", new Conversion(new BigDecimal("35.274"),   "per kg",  "Mumbai Spot Silver")
    );

    private McxLocalizer() {}

    /** {@code usdPrice} is the unrounded provider price; only the INR result is rounded. */
    public static Optional<LocalizedPrice> localize(String commodity, double usdPrice) {
        Conversion conversion = CONVERSIONS.get(commodity);
        if (conversion == null || !Double.isFinite(usdPrice) || usdPrice <= 0) {
            return Optional.empty();
        }
        BigDecimal usd = new BigDecimal(Double.toString(usdPrice));
        BigDecimal inr = QuoteNormalizer.roundToScale(usd.multiply(USD_TO_INR).multiply(conversion.factor()));
        return Optional.of(new LocalizedPrice(inr, "INR", conversion.unit(), conversion.displayName(), InrFormat.format(inr)));
    }

    public static CanonicalQuote apply(String commodity, CanonicalQuote quote, double usdPrice) {
        return localize(commodity, usdPrice)
            .map(quote::withLocalized)
            .orElse(quote);
    }
}
