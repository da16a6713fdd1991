package com.stockinsights.marketdata.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Error body. {@code kind} is an {@code ErrorKind} name, or {@code MALFORMED_REQUEST},
 * {@code REQUEST_REJECTED} or {@code INTERNAL} for failures outside the domain taxonomy.
 */
public record ApiError(
    @JsonProperty("error")     String  error,
    @JsonProperty("kind")      String  kind,
    @JsonProperty("status")    int     status,
    @JsonProperty("path")      String  path,
    @JsonProperty("timestamp") Instant timestamp
) {}
