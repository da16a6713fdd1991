package com.stockinsights.common.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Validated, inclusive calendar window plus the sampling interval to fetch it at.
 * Build instances through {@code RangeValidator} when the input is user-supplied.
 */
public record DateRange(
    LocalDate start,
    LocalDate end,
    Interval interval
) {
    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(interval, "interval");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
    }

    public static DateRange of(LocalDate start, LocalDate end, Interval interval) {
        return new DateRange(start, end, interval);
    }

    /** Inclusive at both ends. */
    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }
}
