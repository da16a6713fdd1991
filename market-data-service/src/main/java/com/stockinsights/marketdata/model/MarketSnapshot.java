package com.stockinsights.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/** Latest end-of-session quote for a symbol. Not a streaming tick. */
public record MarketSnapshot(
    @JsonProperty("symbol")             String    symbol,
    @JsonProperty("last_price")         Double    lastPrice,
    @JsonProperty("previous_close")     Double    previousClose,
    @JsonProperty("open")               Double    open,
    @JsonProperty("day_high")           Double    dayHigh,
    @JsonProperty("day_low")            Double    dayLow,
    @JsonProperty("volume")             Long      volume,
    @JsonProperty("change")             Double    change,
    @JsonProperty("change_percent")     String    changePercent,
    @JsonProperty("latest_trading_day") LocalDate latestTradingDay
) {}
