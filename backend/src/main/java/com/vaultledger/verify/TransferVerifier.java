package com.vaultledger.verify;

import reactor.core.publisher.Mono;

import java.math.BigInteger;

/**
 * Confirms that a transaction moved exactly {@code expectedAmount} of {@code tokenAddress} from
 * {@code expectedSender} to {@code expectedRecipient}. Read-only: recording the transfer once is the caller's job.
 */
public interface TransferVerifier {

    /**
     * @return the matching transfer; errors with OnChainVerificationException when the receipt is missing,
     * unconfirmed or reverted, or when no log matches exactly
     */
    Mono<VerifiedTransfer> verifyTransfer(String txHash,
                                          String expectedSender,
                                          String expectedRecipient,
                                          BigInteger expectedAmount,
                                          String tokenAddress);
}
