package com.stockinsights.common.exception;

public class EmptySeriesException extends InsightsException {

    public EmptySeriesException(String symbol) {
        super(ErrorKind.EMPTY_SERIES,
            "No bars available for symbol '" + symbol + "' in the requested range; analytics cannot be computed");
    }
}
