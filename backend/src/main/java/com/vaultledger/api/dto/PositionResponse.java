package com.vaultledger.api.dto;

import com.vaultledger.common.Amounts;
import com.vaultledger.domain.CollateralClass;
import com.vaultledger.domain.ConfirmationState;
import com.vaultledger.domain.Position;
import com.vaultledger.domain.PositionStatus;
import com.vaultledger.health.HealthSnapshot;

import java.time.Instant;

/**
 * Position with health recomputed at read time.
 */
public record PositionResponse(long positionId,
                               String owner,
                               String collateralToken,
                               CollateralClass collateralClass,
                               String collateralAmount,
                               String valuationUsd,
                               String principalBorrowed,
                               String principalRepaid,
                               String interestRepaid,
                               String totalRepaid,
                               PositionStatus status,
                               ConfirmationState syncState,
                               HealthResponse health,
                               Long loanDurationSeconds,
                               Integer numberOfInstallments,
                               Long installmentIntervalSeconds,
                               int missedPayments,
                               boolean defaulted,
                               String marketplaceListingId,
                               String debtRecovered,
                               Instant createdAt,
                               Instant updatedAt) {

    public static PositionResponse from(Position p, HealthSnapshot health) {
        return new PositionResponse(
                p.getPositionId(),
                p.getOwner(),
                p.getCollateralToken(),
                p.getCollateralClass(),
                Amounts.format(p.getCollateralAmount()),
                Amounts.format(p.getValuationUsd()),
                Amounts.format(p.getPrincipalBorrowed()),
                Amounts.format(p.getPrincipalRepaid()),
                Amounts.format(p.getInterestRepaid()),
                Amounts.format(p.getTotalRepaid()),
                p.getStatus(),
                p.getSyncState(),
                HealthResponse.from(health),
                p.getLoanDurationSeconds(),
                p.getNumberOfInstallments(),
                p.getInstallmentIntervalSeconds(),
                p.getMissedPayments(),
                p.isDefaulted(),
                p.getMarketplaceListingId(),
                Amounts.format(p.getDebtRecovered()),
                p.getCreatedAt(),
                p.getUpdatedAt());
    }
}
