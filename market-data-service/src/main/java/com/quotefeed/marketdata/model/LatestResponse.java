package com.quotefeed.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quotefeed.common.model.CanonicalQuote;

import java.util.Map;

public record LatestResponse(
    @JsonProperty("count") int                         count,
    @JsonProperty("data")  Map<String, CanonicalQuote> data
) {

    public static LatestResponse of(Map<String, CanonicalQuote> data) {
        return new LatestResponse(data.size(), data);
    }
}
