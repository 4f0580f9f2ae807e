package com.vaultledger.common;

/**
 * RPC, network, nonce or confirmation-timeout failure while submitting a transaction. Transient.
 */
public class ChainSubmissionException extends VaultLedgerException {

    public static final String SUBMISSION_FAILED = "CHAIN_SUBMISSION_FAILED";
    public static final String CONFIRMATION_TIMEOUT = "CONFIRMATION_TIMEOUT";
    public static final String TX_REVERTED = "CHAIN_TX_REVERTED";

    public ChainSubmissionException(String errorCode, String message) {
        super(errorCode, message);
    }

    public ChainSubmissionException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return !TX_REVERTED.equals(getErrorCode());
    }
}
