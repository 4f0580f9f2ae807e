package com.vaultledger.partner;

import java.math.BigInteger;

/**
 * Repayment the user already sent as a stablecoin transfer to the partner's settlement address.
 */
public record TransferRepaymentCommand(String partnerLoanId,
                                       String userWallet,
                                       BigInteger amount,
                                       String transferTxHash) {
}
