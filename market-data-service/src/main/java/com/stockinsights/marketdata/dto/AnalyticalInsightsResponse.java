package com.stockinsights.marketdata.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stockinsights.common.model.Bar;
import com.stockinsights.common.model.Interval;

import java.time.LocalDate;
import java.util.List;

/**
 * Historical fields plus the aggregate statistics. {@code total_return} is a ratio
 * ({@code 0.5} = +50%); {@code volatility} is the population standard deviation of closes.
 */
public record AnalyticalInsightsResponse(
    @JsonProperty("symbol")         String    symbol,
    @JsonProperty("interval")       Interval  interval,
    @JsonProperty("start_date")     LocalDate startDate,
    @JsonProperty("end_date")       LocalDate endDate,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("bars")           List<Bar> bars,
    @JsonProperty("average_close")  double    averageClose,
    @JsonProperty("max_close")      double    maxClose,
    @JsonProperty("max_close_date") LocalDate maxCloseDate,
    @JsonProperty("min_close")      double    minClose,
    @JsonProperty("min_close_date") LocalDate minCloseDate,
    @JsonProperty("volatility")     double    volatility,
    @JsonProperty("total_return")   double    totalReturn,
    @JsonProperty("bar_count")      int       barCount
) {}
