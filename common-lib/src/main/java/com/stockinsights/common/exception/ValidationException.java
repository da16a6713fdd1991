package com.stockinsights.common.exception;

/**
 * Caller input rejected before any upstream call. Never retried.
 */
public class ValidationException extends InsightsException {

    public ValidationException(ErrorKind kind, String message) {
        super(kind, message);
        if (!kind.isValidationError()) {
            throw new IllegalArgumentException("Not a validation kind: " + kind);
        }
    }
}
