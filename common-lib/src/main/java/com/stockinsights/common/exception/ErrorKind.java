package com.stockinsights.common.exception;

/**
 * Machine-distinguishable failure categories surfaced to callers.
 *
 * <p>The {@code INVALID_*} kinds are caller input errors detected before any upstream call.
 * {@link #SYMBOL_NOT_FOUND} and {@link #UPSTREAM_UNAVAILABLE} come from the data provider.
 * {@link #EMPTY_SERIES} is raised by analytics when there is nothing to aggregate.
 */
public enum ErrorKind {

    INVALID_DATE_FORMAT,
    INVALID_DATE_RANGE,
    INVALID_INTERVAL,
    INVALID_SYMBOL,

    SYMBOL_NOT_FOUND,
    UPSTREAM_UNAVAILABLE,

    EMPTY_SERIES;

    /** True for kinds caused by bad caller input. */
    public boolean isValidationError() {
        return this == INVALID_DATE_FORMAT
            || this == INVALID_DATE_RANGE
            || this == INVALID_INTERVAL
            || this == INVALID_SYMBOL;
    }
}
