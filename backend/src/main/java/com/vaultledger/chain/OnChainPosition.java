package com.vaultledger.chain;

import java.math.BigInteger;

/**
 * Vault's view of a position as returned by getPosition plus getOutstandingDebt.
 */
public record OnChainPosition(long positionId,
                              String user,
                              String collateralToken,
                              BigInteger collateralAmount,
                              BigInteger usdcBorrowed,
                              BigInteger tokenValueUsd,
                              long createdAt,
                              boolean active,
                              int tokenType,
                              BigInteger outstandingDebt) {
}
