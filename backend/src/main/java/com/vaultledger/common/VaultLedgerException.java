package com.vaultledger.common;

import lombok.Getter;

/**
 * Base of the service error taxonomy. The API layer maps each subtype to an HTTP status and the
 * {@code {statusCode, message, error}} envelope; {@link #getErrorCode()} is a stable machine-readable code.
 */
@Getter
public abstract class VaultLedgerException extends RuntimeException {

    private final String errorCode;

    protected VaultLedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected VaultLedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /** Whether retrying the same call later can succeed without changing the request. */
    public boolean isRetryable() {
        return false;
    }
}
