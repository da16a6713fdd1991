package com.stockinsights.common.model;

import java.time.LocalDate;

/**
 * Aggregate statistics over the closing prices of a non-empty {@link PriceSeries}.
 *
 * @param averageClose arithmetic mean of closes
 * @param maxClose     highest close
 * @param maxCloseDate date of the first bar that closed at {@code maxClose}
 * @param minClose     lowest close
 * @param minCloseDate date of the first bar that closed at {@code minClose}
 * @param volatility   population standard deviation of closes
 * @param totalReturn  (last - first) / first as a ratio, 0.0 for a single bar
 * @param barCount     number of bars aggregated
 */
public record Analytics(
    double    averageClose,
    double    maxClose,
    LocalDate maxCloseDate,
    double    minClose,
    LocalDate minCloseDate,
    double    volatility,
    double    totalReturn,
    int       barCount
) {}
