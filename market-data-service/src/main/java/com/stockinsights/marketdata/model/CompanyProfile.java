package com.stockinsights.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Company profile fields; anything the provider does not report is {@code null}. */
public record CompanyProfile(
    @JsonProperty("symbol")                String symbol,
    @JsonProperty("name")                  String name,
    @JsonProperty("summary")               String summary,
    @JsonProperty("exchange")              String exchange,
    @JsonProperty("currency")              String currency,
    @JsonProperty("sector")                String sector,
    @JsonProperty("industry")              String industry,
    @JsonProperty("website")               String website,
    @JsonProperty("market_cap")            Long   marketCap,
    @JsonProperty("fifty_two_week_high")   Double fiftyTwoWeekHigh,
    @JsonProperty("fifty_two_week_low")    Double fiftyTwoWeekLow
) {}
