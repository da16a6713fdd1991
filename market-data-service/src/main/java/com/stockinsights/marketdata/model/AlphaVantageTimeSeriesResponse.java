package com.stockinsights.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stockinsights.common.model.Bar;
import com.stockinsights.common.model.Interval;

import java.time.LocalDate;
import java.util.Map;

/**
 * Alpha Vantage {@code TIME_SERIES_DAILY|WEEKLY|MONTHLY} payload.
 * Exactly one series key is populated on success; on failure one of the message keys is.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageTimeSeriesResponse(
    @JsonProperty("Meta Data") MetaData metaData,
    @JsonProperty("Time Series (Daily)") Map<String, OhlcvData> timeSeriesDaily,
    @JsonProperty("Weekly Time Series") Map<String, OhlcvData> timeSeriesWeekly,
    @JsonProperty("Monthly Time Series") Map<String, OhlcvData> timeSeriesMonthly,
    @JsonProperty("Error Message") String errorMessage,
    @JsonProperty("Note") String note,
    @JsonProperty("Information") String information
) {
    /** The series block matching {@code interval}, or {@code null} when absent. */
    public Map<String, OhlcvData> seriesFor(Interval interval) {
        return switch (interval) {
            case DAILY   -> timeSeriesDaily;
            case WEEKLY  -> timeSeriesWeekly;
            case MONTHLY -> timeSeriesMonthly;
        };
    }

    /** Throttling or API-key notice, if the provider sent one instead of data. */
    public String notice() {
        return note != null ? note : information;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MetaData(
        @JsonProperty("1. Information") String information,
        @JsonProperty("2. Symbol") String symbol,
        @JsonProperty("3. Last Refreshed") String lastRefreshed
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OhlcvData(
        @JsonProperty("1. open") String open,
        @JsonProperty("2. high") String high,
        @JsonProperty("3. low") String low,
        @JsonProperty("4. close") String close,
        @JsonProperty("5. volume") String volume
    ) {
        /**
         * @throws NumberFormatException    when a field is missing or not numeric
         * @throws IllegalArgumentException when the values break the {@link Bar} invariants
         */
        public Bar toBar(LocalDate date) {
            return new Bar(
                date,
                Double.parseDouble(open),
                Double.parseDouble(high),
                Double.parseDouble(low),
                Double.parseDouble(close),
                Long.parseLong(volume)
            );
        }
    }
}
