package com.vaultledger.ledger;

import com.vaultledger.domain.Position;
import reactor.core.publisher.Mono;

import java.math.BigInteger;

/**
 * Position commands with the full rule set: validation against the ledger, submission on-chain, then a TENTATIVE
 * ledger record. Direct users and partners go through the same operations, so both face identical checks.
 * {@code caller} must own the position.
 */
public interface LoanOperations {

    Mono<Position> deposit(DepositCommand command);

    Mono<Position> borrow(String caller, long positionId, BigInteger amount, long loanDurationSeconds, int numberOfInstallments);

    Mono<Position> repay(String caller, long positionId, BigInteger amount);

    Mono<Position> withdraw(String caller, long positionId, BigInteger amount);

    /**
     * Admin-only. Requires a live health factor below the liquidation threshold.
     */
    Mono<Position> liquidate(long positionId, String marketplaceListingId);

    /**
     * Records a repayment already settled by a verified stablecoin transfer. Nothing is submitted; the entry is
     * CONFIRMED since the transfer itself is on-chain.
     */
    Mono<Position> repayFromTransfer(long positionId, BigInteger amount, String transferTxHash, long blockNumber);
}
