package com.vaultledger.chain;

/**
 * Mined collateral deposit together with the position id the vault assigned in its PositionCreated log.
 */
public record SubmittedDeposit(long positionId, String txHash, long blockNumber) {
}
