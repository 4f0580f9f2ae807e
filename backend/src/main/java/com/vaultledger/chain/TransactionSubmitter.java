package com.vaultledger.chain;

import reactor.core.publisher.Mono;

import java.math.BigInteger;

/**
 * State-changing vault calls issued from the platform signing identity. Each Mono completes once the
 * transaction is mined successfully and fails with ChainSubmissionException on RPC, nonce, revert or
 * confirmation-timeout failures.
 */
public interface TransactionSubmitter {

    /**
     * Approves the vault for {@code amount} of {@code collateralToken}, then deposits it.
     */
    Mono<SubmittedDeposit> deposit(String collateralToken, BigInteger amount, BigInteger valuationUsd, int collateralClassCode);

    Mono<SubmittedTx> borrow(long positionId, BigInteger amount, long durationSeconds, int installments);

    /**
     * Approves the vault for {@code amount} of stablecoin, then repays.
     */
    Mono<SubmittedTx> repay(long positionId, BigInteger amount);

    Mono<SubmittedTx> withdraw(long positionId, BigInteger amount);

    Mono<SubmittedTx> liquidate(long positionId, String marketplaceListingIdBytes32);

    /**
     * ERC-20 transfer from the platform wallet.
     */
    Mono<SubmittedTx> transfer(String token, String recipient, BigInteger amount);
}
