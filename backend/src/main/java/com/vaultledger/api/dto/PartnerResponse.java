package com.vaultledger.api.dto;

import com.vaultledger.common.Amounts;
import com.vaultledger.domain.Partner;
import com.vaultledger.domain.PartnerStatus;

import java.time.Instant;

/**
 * Partner as shown to admins. {@code apiKey} is set only in the response that issued it.
 */
public record PartnerResponse(String partnerId,
                              String name,
                              String tier,
                              PartnerStatus status,
                              String apiKeyPrefix,
                              String apiKey,
                              String dailyBorrowLimit,
                              String totalBorrowLimit,
                              String currentOutstanding,
                              int platformFeeBps,
                              String settlementAddress,
                              String totalBorrowed,
                              String totalRepaid,
                              Instant lastActivityAt,
                              Instant createdAt) {

    public static PartnerResponse from(Partner p) {
        return from(p, null);
    }

    public static PartnerResponse from(Partner p, String apiKey) {
        return new PartnerResponse(p.getPartnerId(), p.getName(), p.getTier(), p.getStatus(), p.getApiKeyPrefix(),
                apiKey, Amounts.format(p.getDailyBorrowLimit()), Amounts.format(p.getTotalBorrowLimit()),
                Amounts.format(p.getCurrentOutstanding()), p.getPlatformFeeBps(), p.getSettlementAddress(),
                Amounts.format(p.getTotalBorrowed()), Amounts.format(p.getTotalRepaid()),
                p.getLastActivityAt(), p.getCreatedAt());
    }
}
