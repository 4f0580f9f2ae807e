package com.vaultledger.ledger;

import com.vaultledger.domain.CollateralClass;

import java.math.BigInteger;

public record DepositCommand(String owner,
                             String collateralToken,
                             BigInteger collateralAmount,
                             BigInteger valuationUsd,
                             CollateralClass collateralClass) {
}
