package com.quotefeed.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.quotefeed.common.normalize.QuoteNormalizer;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * The engine's normalized price observation for one symbol.
 *
 * <p>Price and change are always held at scale 2 with half-up rounding; the compact
 * constructor re-applies that rule so no caller can build an off-scale or negative-price
 * quote. {@code mock} is {@code true} only for synthetic quotes (source {@value #SOURCE_MOCK}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CanonicalQuote(
    @JsonProperty("symbol")        String         symbol,
    @JsonProperty("price")         BigDecimal     price,
    @JsonProperty("changePercent") BigDecimal     changePercent,
    @JsonProperty("assetClass")    AssetClass     assetClass,
    @JsonProperty("currency")      String         currency,
    @JsonProperty("sentiment")     double         sentiment,
    @JsonProperty("mock")          boolean        mock,
    @JsonProperty("source")        String         source,
    @JsonProperty("timestamp")     Instant        timestamp,
    @JsonProperty("localized")     LocalizedPrice localized
) {

    public static final String SOURCE_CACHED = "CACHED";
    public static final String SOURCE_MOCK   = "MOCK";

    /** Neutral placeholder until a sentiment collaborator fills it in. */
    public static final double NEUTRAL_SENTIMENT = 0.50;

    public CanonicalQuote {
        Objects.requireNonNull(symbol, "symbol");
        price         = QuoteNormalizer.roundToScale(price).max(BigDecimal.ZERO.setScale(2));
        changePercent = QuoteNormalizer.roundToScale(changePercent);
        assetClass    = assetClass == null ? AssetClass.UNKNOWN : assetClass;
        currency      = currency == null ? assetClass.defaultCurrency() : currency;
        sentiment     = Double.isFinite(sentiment) ? Math.max(0.0, Math.min(1.0, sentiment)) : NEUTRAL_SENTIMENT;
        source        = source == null ? "UNKNOWN" : source;
        timestamp     = timestamp == null ? Instant.now() : timestamp;
    }

    public CanonicalQuote withSource(String newSource) {
        return new CanonicalQuote(symbol, price, changePercent, assetClass, currency,
            sentiment, mock, newSource, timestamp, localized);
    }

    public CanonicalQuote withLocalized(LocalizedPrice newLocalized) {
        return new CanonicalQuote(symbol, price, changePercent, assetClass, currency,
            sentiment, mock, source, timestamp, newLocalized);
    }
}
