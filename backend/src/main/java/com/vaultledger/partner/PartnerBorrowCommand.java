package com.vaultledger.partner;

import java.math.BigInteger;

/**
 * {@code partnerLoanId} is the partner's idempotency key: unique per partner, forever.
 */
public record PartnerBorrowCommand(String partnerLoanId,
                                   String userWallet,
                                   BigInteger amount,
                                   long loanDurationSeconds,
                                   int numberOfInstallments) {
}
