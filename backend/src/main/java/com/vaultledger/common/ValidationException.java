package com.vaultledger.common;

/**
 * Malformed input: bad amount, unknown enum value, out-of-range parameter. Never retried.
 */
public class ValidationException extends VaultLedgerException {

    public static final String INVALID_AMOUNT = "INVALID_AMOUNT";
    public static final String INVALID_ADDRESS = "INVALID_ADDRESS";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    public ValidationException(String message) {
        this(INVALID_REQUEST, message);
    }

    public ValidationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
