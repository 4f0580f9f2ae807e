package com.vaultledger.partner;

/**
 * Outcome of one partner API call, as recorded in the audit log. {@code errorCode} and {@code errorMessage} are
 * null on success.
 */
public record PartnerApiCall(String method,
                             String endpoint,
                             int statusCode,
                             long responseTimeMs,
                             String errorCode,
                             String errorMessage,
                             String partnerLoanId,
                             String userWallet) {

    public boolean success() {
        return statusCode < 400;
    }
}
