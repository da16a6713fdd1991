package com.stockinsights.common.exception;

public class InsightsException extends RuntimeException {
    private final ErrorKind kind;

    public InsightsException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public InsightsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
