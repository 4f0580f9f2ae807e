package com.vaultledger.common;

import lombok.Getter;

/**
 * Operation is not valid for the current status of the target. {@code conflict} marks clashes with an
 * existing record (duplicate idempotency key), reported as 409 instead of 400.
 */
@Getter
public class StateException extends VaultLedgerException {

    public static final String INVALID_STATUS = "INVALID_STATUS";
    public static final String ALREADY_BORROWED = "ALREADY_BORROWED";
    public static final String OUTSTANDING_DEBT = "OUTSTANDING_DEBT";
    public static final String POSITION_EXISTS = "POSITION_EXISTS";
    public static final String DUPLICATE_LOAN = "DUPLICATE_LOAN";
    public static final String TRANSFER_ALREADY_USED = "TRANSFER_ALREADY_USED";
    public static final String MAPPING_CONFLICT = "MAPPING_CONFLICT";

    private final boolean conflict;

    public StateException(String errorCode, String message) {
        this(errorCode, message, false);
    }

    public StateException(String errorCode, String message, boolean conflict) {
        super(errorCode, message);
        this.conflict = conflict;
    }

    public static StateException conflict(String errorCode, String message) {
        return new StateException(errorCode, message, true);
    }
}
