package com.quotefeed.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quotefeed.common.normalize.QuoteNormalizer;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One historical candle.
 *
 * <p>{@code approximate} is set when open/high/low were derived from a single sampled
 * price point rather than read from a real candle endpoint.
 */
public record OhlcvBar(
    @JsonProperty("time")        Instant    time,
    @JsonProperty("open")        BigDecimal open,
    @JsonProperty("high")        BigDecimal high,
    @JsonProperty("low")         BigDecimal low,
    @JsonProperty("close")       BigDecimal close,
    @JsonProperty("volume")      long       volume,
    @JsonProperty("approximate") boolean    approximate
) {

    public OhlcvBar {
        open  = QuoteNormalizer.roundToScale(open);
        high  = QuoteNormalizer.roundToScale(high);
        low   = QuoteNormalizer.roundToScale(low);
        close = QuoteNormalizer.roundToScale(close);
    }

    public static OhlcvBar of(Instant time, double open, double high, double low, double close, long volume) {
        return new OhlcvBar(time, BigDecimal.valueOf(open), BigDecimal.valueOf(high),
            BigDecimal.valueOf(low), BigDecimal.valueOf(close), volume, false);
    }

    /** Builds an approximate bar from a single price point with a symmetric band. */
    public static OhlcvBar approximated(Instant time, double price, double bandFraction) {
        return new OhlcvBar(time,
            BigDecimal.valueOf(price),
            BigDecimal.valueOf(price * (1 + bandFraction)),
            BigDecimal.valueOf(price * (1 - bandFraction)),
            BigDecimal.valueOf(price),
            0L,
            true);
    }
}
