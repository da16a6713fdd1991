package com.stockinsights.marketdata.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body shared by the historical-data and analytical-insights endpoints. Fields stay raw
 * strings so that validation, not JSON binding, decides what is acceptable.
 */
public record HistoricalDataRequest(
    @JsonProperty("symbol")       String  symbol,
    @JsonProperty("start_date")   String  startDate,
    @JsonProperty("end_date")     String  endDate,
    @JsonProperty("interval")     String  interval,
    @JsonProperty("include_bars") Boolean includeBars
) {
    public static HistoricalDataRequest of(String symbol, String startDate, String endDate, String interval) {
        return new HistoricalDataRequest(symbol, startDate, endDate, interval, null);
    }

    /** Bars are returned unless explicitly switched off. */
    public boolean includeBarsOrDefault() {
        return includeBars == null || includeBars;
    }
}
