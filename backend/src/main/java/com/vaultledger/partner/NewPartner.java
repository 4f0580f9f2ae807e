package com.vaultledger.partner;

import java.math.BigInteger;

/**
 * Onboarding request. {@code platformFeeBps} may be null to take the configured default.
 */
public record NewPartner(String name,
                         String prefix,
                         String tier,
                         BigInteger dailyBorrowLimit,
                         BigInteger totalBorrowLimit,
                         Integer platformFeeBps,
                         String settlementAddress) {
}
