package com.quotefeed.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** {@code type} is optional; when absent the symbol is classified. */
public record WatchlistRequest(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("type")   String type
) {}
