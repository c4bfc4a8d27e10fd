package com.liquidswap.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Rejected request: error code, readable message, offending field (absent for unreadable bodies), timestamp.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorBody(String error, String message, String field, Instant timestamp) {

    public static ErrorBody invalidField(String error, String message, String field) {
        return new ErrorBody(error, message, field, Instant.now());
    }

    public static ErrorBody unreadable(String message) {
        return new ErrorBody("INVALID_REQUEST", message, null, Instant.now());
    }
}
