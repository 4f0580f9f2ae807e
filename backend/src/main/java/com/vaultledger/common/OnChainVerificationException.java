package com.vaultledger.common;

/**
 * A referenced transfer could not be verified on-chain: missing, unconfirmed, reverted or mismatched.
 * The caller may retry once the real transaction confirms.
 */
public class OnChainVerificationException extends VaultLedgerException {

    public static final String TX_NOT_FOUND = "TX_NOT_FOUND";
    public static final String TX_NOT_CONFIRMED = "TX_NOT_CONFIRMED";
    public static final String TX_REVERTED = "TX_REVERTED";
    public static final String TRANSFER_NOT_FOUND = "TRANSFER_NOT_FOUND";
    public static final String AMOUNT_MISMATCH = "AMOUNT_MISMATCH";

    public OnChainVerificationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
