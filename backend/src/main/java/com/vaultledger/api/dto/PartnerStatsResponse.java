package com.vaultledger.api.dto;

import com.vaultledger.common.Amounts;
import com.vaultledger.domain.PartnerStatus;
import com.vaultledger.partner.PartnerStats;

public record PartnerStatsResponse(String partnerId,
                                   String name,
                                   String tier,
                                   PartnerStatus status,
                                   Limits limits,
                                   Lifetime lifetime,
                                   long activeLoans) {

    public record Limits(String dailyBorrowLimit, String totalBorrowLimit, String currentOutstanding) {
    }

    public record Lifetime(String totalBorrowed, String totalRepaid) {
    }

    public static PartnerStatsResponse from(PartnerStats s) {
        return new PartnerStatsResponse(s.partnerId(), s.name(), s.tier(), s.status(),
                new Limits(Amounts.format(s.dailyBorrowLimit()), Amounts.format(s.totalBorrowLimit()),
                        Amounts.format(s.currentOutstanding())),
                new Lifetime(Amounts.format(s.totalBorrowed()), Amounts.format(s.totalRepaid())),
                s.activeLoans());
    }
}
