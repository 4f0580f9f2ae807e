package com.vaultledger.api.dto;

import com.vaultledger.common.Amounts;
import com.vaultledger.domain.HealthStatus;
import com.vaultledger.health.HealthSnapshot;

/**
 * healthFactor is in bps (10000 = 1.0); null when there is no debt.
 */
public record HealthResponse(String healthFactor,
                             HealthStatus status,
                             String outstandingDebt,
                             String maxBorrowable,
                             String availableToBorrow) {

    public static HealthResponse from(HealthSnapshot s) {
        return new HealthResponse(Amounts.format(s.healthFactor()), s.status(), Amounts.format(s.outstandingDebt()),
                Amounts.format(s.maxBorrowable()), Amounts.format(s.availableToBorrow()));
    }
}
