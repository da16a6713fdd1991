package com.stockinsights.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One OHLCV record for a single interval bucket.
 *
 * <p>Construction enforces {@code low <= open, close <= high}, strictly positive finite
 * prices and a non-negative volume, so downstream analytics never divide by a zero close.
 */
public record Bar(
    @JsonProperty("timestamp") LocalDate timestamp,
    @JsonProperty("open")      double    open,
    @JsonProperty("high")      double    high,
    @JsonProperty("low")       double    low,
    @JsonProperty("close")     double    close,
    @JsonProperty("volume")    long      volume
) {
    public Bar {
        Objects.requireNonNull(timestamp, "timestamp");
        requirePositive("open", open);
        requirePositive("high", high);
        requirePositive("low", low);
        requirePositive("close", close);
        if (low > high) {
            throw new IllegalArgumentException("low " + low + " above high " + high + " at " + timestamp);
        }
        if (open < low || open > high) {
            throw new IllegalArgumentException("open " + open + " outside [low, high] at " + timestamp);
        }
        if (close < low || close > high) {
            throw new IllegalArgumentException("close " + close + " outside [low, high] at " + timestamp);
        }
        if (volume < 0) {
            throw new IllegalArgumentException("negative volume " + volume + " at " + timestamp);
        }
    }

    private static void requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new IllegalArgumentException(field + " must be a positive finite price, got " + value);
        }
    }
}
