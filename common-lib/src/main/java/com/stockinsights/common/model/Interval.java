package com.stockinsights.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Sampling granularity of a price series.
 *
 * <p>Each constant is addressable by its name ({@code daily}) or by its short code
 * ({@code 1d}), case-insensitively. The code is the serialized form.
 */
public enum Interval {

    DAILY("1d"),
    WEEKLY("1wk"),
    MONTHLY("1mo");

    private final String code;

    Interval(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Resolves a raw interval string.
     *
     * @param raw user-supplied value, may be null
     * @return the matching interval, or empty when {@code raw} is null or unknown
     */
    public static Optional<Interval> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (Interval interval : values()) {
            if (interval.code.equals(value) || interval.name().toLowerCase(Locale.ROOT).equals(value)) {
                return Optional.of(interval);
            }
        }
        return Optional.empty();
    }

    /** Human-readable list of accepted spellings, e.g. {@code daily (1d), weekly (1wk)}. */
    public static String acceptedValues() {
        return Arrays.stream(values())
            .map(i -> i.name().toLowerCase(Locale.ROOT) + " (" + i.code + ")")
            .collect(Collectors.joining(", "));
    }
}
