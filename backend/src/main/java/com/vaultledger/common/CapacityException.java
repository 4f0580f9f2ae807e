package com.vaultledger.common;

/**
 * LTV capacity or a partner borrowing limit would be exceeded.
 */
public class CapacityException extends VaultLedgerException {

    public static final String LTV_EXCEEDED = "LTV_EXCEEDED";
    public static final String DAILY_LIMIT_EXCEEDED = "DAILY_LIMIT_EXCEEDED";
    public static final String TOTAL_LIMIT_EXCEEDED = "TOTAL_LIMIT_EXCEEDED";
    public static final String NO_ELIGIBLE_POSITION = "NO_ELIGIBLE_POSITION";

    public CapacityException(String errorCode, String message) {
        super(errorCode, message);
    }
}
