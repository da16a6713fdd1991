package com.stockinsights.common.exception;

/**
 * The market-data provider could not be reached, timed out, or answered with something
 * unusable. Transient from the caller's point of view; the core does not retry.
 */
public class UpstreamUnavailableException extends InsightsException {

    public UpstreamUnavailableException(String message) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message, cause);
    }
}
