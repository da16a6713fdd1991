package com.stockinsights.marketdata.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stockinsights.common.model.Bar;
import com.stockinsights.common.model.Interval;

import java.time.LocalDate;
import java.util.List;

public record HistoricalDataResponse(
    @JsonProperty("symbol")     String    symbol,
    @JsonProperty("interval")   Interval  interval,
    @JsonProperty("start_date") LocalDate startDate,
    @JsonProperty("end_date")   LocalDate endDate,
    @JsonProperty("bars")       List<Bar> bars
) {}
