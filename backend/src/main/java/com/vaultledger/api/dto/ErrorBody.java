package com.vaultledger.api.dto;

import org.springframework.http.HttpStatus;

/**
 * Error envelope returned on every failure: HTTP status code, human message, reason phrase, and a stable
 * machine-readable code (INVALID_AMOUNT, DUPLICATE_LOAN, ...).
 */
public record ErrorBody(int statusCode, String message, String error, String errorCode) {

    public static ErrorBody of(HttpStatus status, String errorCode, String message) {
        return new ErrorBody(status.value(), message, status.getReasonPhrase(), errorCode);
    }
}
