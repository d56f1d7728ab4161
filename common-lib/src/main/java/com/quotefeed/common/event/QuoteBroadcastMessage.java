package com.quotefeed.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quotefeed.common.model.CanonicalQuote;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Wire shape of one broadcast quote update, e.g.
 * <pre>
 * {"asset":"RELIANCE.NS","price":2984.50,"change_pc":1.24,"type":"EQUITY","currency":"INR",
 *  "sentiment":0.5,"is_mock":false,"source":"NSE_DIRECT","timestamp":"2026-02-05T02:30:00Z"}
 * </pre>
 */
public record QuoteBroadcastMessage(
    @JsonProperty("asset")     String     asset,
    @JsonProperty("price")     BigDecimal price,
    @JsonProperty("change_pc") BigDecimal changePercent,
    @JsonProperty("type")      String     type,
    @JsonProperty("currency")  String     currency,
    @JsonProperty("sentiment") double     sentiment,
    @JsonProperty("is_mock")   boolean    mock,
    @JsonProperty("source")    String     source,
    @JsonProperty("timestamp") String     timestamp
) {

    public static QuoteBroadcastMessage from(CanonicalQuote quote) {
        return from(quote, Instant.now());
    }

    public static QuoteBroadcastMessage from(CanonicalQuote quote, Instant publishedAt) {
        return new QuoteBroadcastMessage(
            quote.symbol(),
            quote.price(),
            quote.changePercent(),
            quote.assetClass().name(),
            quote.currency(),
            quote.sentiment(),
            quote.mock(),
            quote.source(),
            DateTimeFormatter.ISO_INSTANT.format(publishedAt)
        );
    }
}
