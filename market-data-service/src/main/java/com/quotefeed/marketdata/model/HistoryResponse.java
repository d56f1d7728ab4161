package com.quotefeed.marketdata.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.quotefeed.common.model.AssetClass;
import com.quotefeed.common.model.OhlcvBar;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryResponse(
    @JsonProperty("ticker")         String         ticker,
    @JsonProperty("type")           AssetClass     type,
    @JsonProperty("days_requested") int            daysRequested,
    @JsonProperty("count")          int            count,
    @JsonProperty("data")           List<OhlcvBar> data,
    @JsonProperty("message")        String         message
) {

    static final String NO_DATA_MESSAGE = "No historical data available for this ticker";

    public static HistoryResponse of(String ticker, AssetClass type, int daysRequested, List<OhlcvBar> bars) {
        return new HistoryResponse(ticker, type, daysRequested, bars.size(), bars,
                                   bars.isEmpty() ? NO_DATA_MESSAGE : null);
    }
}
