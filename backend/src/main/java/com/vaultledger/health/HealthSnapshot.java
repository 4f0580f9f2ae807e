package com.vaultledger.health;

import com.vaultledger.domain.HealthStatus;

import java.math.BigInteger;

/**
 * Health of one position at one instant. {@code healthFactor} is null when there is no debt (unbounded).
 */
public record HealthSnapshot(BigInteger healthFactor,
                             HealthStatus status,
                             BigInteger outstandingDebt,
                             BigInteger maxBorrowable,
                             BigInteger availableToBorrow) {

    public boolean liquidatable() {
        return status == HealthStatus.LIQUIDATABLE;
    }
}
