package com.stockinsights.marketdata.exception;

import com.stockinsights.common.exception.ErrorKind;
import com.stockinsights.common.exception.InsightsException;
import com.stockinsights.marketdata.dto.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

/**
 * Maps the error taxonomy onto HTTP. Caller errors are 4xx, provider failures 502.
 * Each failure is logged once here; 4xx at WARN without a stack trace, 5xx at ERROR.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InsightsException.class)
    public ResponseEntity<ApiError> handleInsights(InsightsException ex, ServerWebExchange exchange) {
        return buildError(statusFor(ex.getKind()), ex.getKind().name(), ex.getMessage(), exchange, ex);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiError> handleUnreadable(ServerWebInputException ex, ServerWebExchange exchange) {
        return buildError(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST",
            "Request body must be a JSON object", exchange, ex);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        return buildError(status != null ? status : HttpStatus.BAD_REQUEST, "REQUEST_REJECTED",
            ex.getReason() != null ? ex.getReason() : ex.getMessage(), exchange, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL",
            "An unexpected error occurred", exchange, ex);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case INVALID_DATE_FORMAT, INVALID_DATE_RANGE, INVALID_INTERVAL, INVALID_SYMBOL -> HttpStatus.BAD_REQUEST;
            case SYMBOL_NOT_FOUND     -> HttpStatus.NOT_FOUND;
            case EMPTY_SERIES         -> HttpStatus.UNPROCESSABLE_ENTITY;
            case UPSTREAM_UNAVAILABLE -> HttpStatus.BAD_GATEWAY;
        };
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, String kind, String message,
                                                ServerWebExchange exchange, Exception ex) {
        String path = exchange.getRequest().getPath().value();
        ApiError error = new ApiError(message, kind, status.value(), path, Instant.now());
        if (status.is5xxServerError()) {
            log.error("{} {} -> {} {} {}", exchange.getRequest().getMethod(), path, status.value(), kind, message, ex);
        } else {
            log.warn("{} {} -> {} {} {}", exchange.getRequest().getMethod(), path, status.value(), kind, message);
        }
        return ResponseEntity.status(status).body(error);
    }
}
