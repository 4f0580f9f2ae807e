package com.vaultledger.partner;

import com.vaultledger.domain.PartnerStatus;

import java.math.BigInteger;

public record PartnerStats(String partnerId,
                           String name,
                           String tier,
                           PartnerStatus status,
                           BigInteger dailyBorrowLimit,
                           BigInteger totalBorrowLimit,
                           BigInteger currentOutstanding,
                           BigInteger totalBorrowed,
                           BigInteger totalRepaid,
                           long activeLoans) {
}
