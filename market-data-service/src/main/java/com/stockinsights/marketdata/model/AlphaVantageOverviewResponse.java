package com.stockinsights.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Alpha Vantage {@code OVERVIEW} payload; {@code {}} for unknown symbols. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageOverviewResponse(
    @JsonProperty("Symbol") String symbol,
    @JsonProperty("Name") String name,
    @JsonProperty("Description") String description,
    @JsonProperty("Exchange") String exchange,
    @JsonProperty("Currency") String currency,
    @JsonProperty("Sector") String sector,
    @JsonProperty("Industry") String industry,
    @JsonProperty("OfficialSite") String officialSite,
    @JsonProperty("MarketCapitalization") String marketCapitalization,
    @JsonProperty("52WeekHigh") String fiftyTwoWeekHigh,
    @JsonProperty("52WeekLow") String fiftyTwoWeekLow,
    @JsonProperty("Error Message") String errorMessage,
    @JsonProperty("Note") String note,
    @JsonProperty("Information") String information
) {
    public String notice() {
        return note != null ? note : information;
    }
}
