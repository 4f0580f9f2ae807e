package com.vaultledger.ledger;

import com.vaultledger.domain.CollateralClass;

import java.math.BigInteger;

/**
 * Collateral lock as reported by the vault for a freshly created position.
 */
public record NewPosition(long positionId,
                          String owner,
                          String collateralToken,
                          CollateralClass collateralClass,
                          BigInteger collateralAmount,
                          BigInteger valuationUsd) {
}
