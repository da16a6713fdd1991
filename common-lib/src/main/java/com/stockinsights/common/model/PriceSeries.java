package com.stockinsights.common.model;

import java.util.List;
import java.util.Objects;

/**
 * Bars for exactly one symbol and one {@link DateRange}, oldest first.
 * Timestamps are strictly increasing. The series may be empty.
 */
public record PriceSeries(
    String       symbol,
    DateRange    range,
    List<Bar>    bars
) {
    public PriceSeries {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(range, "range");
        bars = List.copyOf(Objects.requireNonNull(bars, "bars"));
        for (int i = 1; i < bars.size(); i++) {
            if (!bars.get(i).timestamp().isAfter(bars.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("Bars not strictly increasing at index " + i
                    + ": " + bars.get(i - 1).timestamp() + " -> " + bars.get(i).timestamp());
            }
        }
    }

    public static PriceSeries empty(String symbol, DateRange range) {
        return new PriceSeries(symbol, range, List.of());
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public int size() {
        return bars.size();
    }

    public Bar first() {
        return bars.get(0);
    }

    public Bar last() {
        return bars.get(bars.size() - 1);
    }
}
