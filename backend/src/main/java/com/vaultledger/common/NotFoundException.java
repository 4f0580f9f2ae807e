package com.vaultledger.common;

public class NotFoundException extends VaultLedgerException {

    public static final String POSITION_NOT_FOUND = "POSITION_NOT_FOUND";
    public static final String LOAN_NOT_FOUND = "LOAN_NOT_FOUND";
    public static final String PARTNER_NOT_FOUND = "PARTNER_NOT_FOUND";
    public static final String EVENT_NOT_FOUND = "EVENT_NOT_FOUND";
    public static final String ASSET_NOT_FOUND = "ASSET_NOT_FOUND";

    public NotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }
}
