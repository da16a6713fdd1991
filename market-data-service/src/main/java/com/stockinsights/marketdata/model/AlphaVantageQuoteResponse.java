package com.stockinsights.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Alpha Vantage {@code GLOBAL_QUOTE} payload. Unknown symbols come back as an empty
 * {@code "Global Quote": {}} object.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageQuoteResponse(
    @JsonProperty("Global Quote") GlobalQuote globalQuote,
    @JsonProperty("Error Message") String errorMessage,
    @JsonProperty("Note") String note,
    @JsonProperty("Information") String information
) {
    public String notice() {
        return note != null ? note : information;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GlobalQuote(
        @JsonProperty("01. symbol") String symbol,
        @JsonProperty("02. open") String open,
        @JsonProperty("03. high") String high,
        @JsonProperty("04. low") String low,
        @JsonProperty("05. price") String price,
        @JsonProperty("06. volume") String volume,
        @JsonProperty("07. latest trading day") String latestTradingDay,
        @JsonProperty("08. previous close") String previousClose,
        @JsonProperty("09. change") String change,
        @JsonProperty("10. change percent") String changePercent
    ) {}
}
