package com.kreasipositif.transactionservice.dto;

import java.time.Instant;

/**
 * Error payload returned by the REST layer.
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path
) {
    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path);
    }
}
