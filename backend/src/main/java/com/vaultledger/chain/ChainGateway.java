package com.vaultledger.chain;

import com.vaultledger.chain.config.ChainAdapterConfig;
import com.vaultledger.chain.config.ChainProperties;
import com.vaultledger.common.ChainSubmissionException;
import com.vaultledger.common.RetryPolicy;
import com.vaultledger.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Single owner of the platform signer's nonce. Broadcasts are queued on a one-thread executor and issued
 * strictly in FIFO order; only that thread reads or advances {@code nextNonce}. The nonce is loaded lazily from
 * the chain's pending count and reloaded only after the node clearly rejected a send. Transactions are signed
 * before broadcast so their hash is known; when a broadcast fails without a clear answer the same signed bytes are
 * resent, and an "already known" or "nonce too low" reply is resolved by looking the hash up.
 * <p>
 * A request cancelled while still queued is dropped without broadcasting. Once broadcast, cancellation no longer
 * has any effect on the transaction. Waiting for the receipt happens off the submitter thread, as a bounded
 * poll.
 */
@Slf4j
@Component
public class ChainGateway implements TransactionSubmitter {

    private final ChainClient chainClient;
    private final ChainProperties properties;
    private final RetryPolicy retryPolicy;
    private final Executor submitter;

    /** Confined to the submitter thread. */
    private BigInteger nextNonce;

    public ChainGateway(ChainClient chainClient,
                        ChainProperties properties,
                        @Qualifier(ChainAdapterConfig.CHAIN_RETRY_POLICY) RetryPolicy retryPolicy,
                        @Qualifier(AsyncConfig.CHAIN_SUBMITTER_EXECUTOR) Executor submitter) {
        this.chainClient = chainClient;
        this.properties = properties;
        this.retryPolicy = retryPolicy;
        this.submitter = submitter;
    }

    @Override
    public Mono<SubmittedDeposit> deposit(String collateralToken, BigInteger amount, BigInteger valuationUsd,
                                          int collateralClassCode) {
        String vault = properties.getVaultAddress();
        return submit(collateralToken, AbiCodec.encodeCall(VaultContract.APPROVE, vault, amount), "approve collateral")
                .then(submit(vault, AbiCodec.encodeCall(VaultContract.DEPOSIT_COLLATERAL,
                        collateralToken, amount, valuationUsd, collateralClassCode, false), "depositCollateral"))
                .map(receipt -> {
                    List<LogEntry> created = receipt.logsFrom(vault, VaultContract.POSITION_CREATED);
                    if (created.isEmpty()) {
                        throw new ChainSubmissionException(ChainSubmissionException.SUBMISSION_FAILED,
                                "Deposit " + receipt.transactionHash() + " mined without a PositionCreated log");
                    }
                    long positionId = AbiCodec.uint(created.get(0).topic(1)).longValueExact();
                    return new SubmittedDeposit(positionId, receipt.transactionHash(), receipt.blockNumber());
                });
    }

    @Override
    public Mono<SubmittedTx> borrow(long positionId, BigInteger amount, long durationSeconds, int installments) {
        String data = AbiCodec.encodeCall(VaultContract.BORROW_USDC, positionId, amount, durationSeconds, installments);
        return submit(properties.getVaultAddress(), data, "borrowUSDC #" + positionId).map(SubmittedTx::of);
    }

    @Override
    public Mono<SubmittedTx> repay(long positionId, BigInteger amount) {
        String vault = properties.getVaultAddress();
        return submit(properties.getStablecoinAddress(), AbiCodec.encodeCall(VaultContract.APPROVE, vault, amount),
                "approve repayment #" + positionId)
                .then(submit(vault, AbiCodec.encodeCall(VaultContract.REPAY_LOAN, positionId, amount), "repayLoan #" + positionId))
                .map(SubmittedTx::of);
    }

    @Override
    public Mono<SubmittedTx> withdraw(long positionId, BigInteger amount) {
        String data = AbiCodec.encodeCall(VaultContract.WITHDRAW_COLLATERAL, positionId, amount);
        return submit(properties.getVaultAddress(), data, "withdrawCollateral #" + positionId).map(SubmittedTx::of);
    }

    @Override
    public Mono<SubmittedTx> liquidate(long positionId, String marketplaceListingIdBytes32) {
        String data = AbiCodec.encodeCall(VaultContract.LIQUIDATE_POSITION, positionId, marketplaceListingIdBytes32);
        return submit(properties.getVaultAddress(), data, "liquidatePosition #" + positionId).map(SubmittedTx::of);
    }

    @Override
    public Mono<SubmittedTx> transfer(String token, String recipient, BigInteger amount) {
        String data = AbiCodec.encodeCall(VaultContract.TRANSFER, recipient, amount);
        return submit(token, data, "transfer to " + recipient).map(SubmittedTx::of);
    }

    /**
     * Broadcast through the actor, then wait for a successful receipt.
     */
    Mono<TransactionReceipt> submit(String to, String data, String label) {
        return broadcast(to, data, label).flatMap(txHash -> awaitReceipt(txHash, label));
    }

    Mono<String> broadcast(String to, String data, String label) {
        return Mono.defer(() -> {
            CompletableFuture<String> future = new CompletableFuture<>();
            submitter.execute(() -> runBroadcast(to, data, label, future));
            return Mono.fromFuture(future);
        });
    }

    /**
     * Polls for the receipt until it appears or the confirmation timeout elapses.
     */
    Mono<TransactionReceipt> awaitReceipt(String txHash, String label) {
        Duration pollInterval = Duration.ofMillis(properties.getReceiptPollIntervalMs());
        return Mono.defer(() -> chainClient.getTransactionReceipt(txHash))
                .repeatWhenEmpty(repeats -> repeats.delayElements(pollInterval))
                .timeout(Duration.ofMillis(properties.getConfirmationTimeoutMs()))
                .onErrorMap(TimeoutException.class, e -> new ChainSubmissionException(
                        ChainSubmissionException.CONFIRMATION_TIMEOUT,
                        label + " " + txHash + " not mined within " + properties.getConfirmationTimeoutMs() + " ms", e))
                .onErrorMap(RpcException.class, e -> new ChainSubmissionException(
                        ChainSubmissionException.SUBMISSION_FAILED, "Receipt lookup failed for " + txHash + ": " + e.getMessage(), e))
                .flatMap(receipt -> {
                    if (!receipt.successful()) {
                        return Mono.error(new ChainSubmissionException(ChainSubmissionException.TX_REVERTED,
                                label + " " + txHash + " reverted in block " + receipt.blockNumber()));
                    }
                    log.info("{} mined: {} in block {}", label, txHash, receipt.blockNumber());
                    return Mono.just(receipt);
                });
    }

    private void runBroadcast(String to, String data, String label, CompletableFuture<String> future) {
        int attempt = 0;
        // Signed bytes whose last broadcast had an unknown outcome; resent as-is so a retry can never fork the nonce.
        SignedTransaction inFlight = null;
        while (true) {
            if (future.isCancelled()) {
                if (inFlight != null) {
                    nextNonce = null;
                }
                log.info("{} cancelled before broadcast; dropped", label);
                return;
            }
            SignedTransaction tx = inFlight;
            boolean broadcasting = false;
            try {
                if (tx == null) {
                    if (nextNonce == null) {
                        nextNonce = chainClient.getPendingNonce(properties.getSignerAddress()).block(rpcTimeout());
                        log.info("Signer nonce loaded from chain: {}", nextNonce);
                    }
                    tx = chainClient.signTransaction(properties.getSignerAddress(), to, data, nextNonce).block(rpcTimeout());
                }
                broadcasting = true;
                chainClient.sendRawTransaction(tx.raw()).block(rpcTimeout());
                accepted(tx, label, future);
                return;
            } catch (RuntimeException e) {
                attempt++;
                BigInteger nonce = tx != null ? tx.nonce() : nextNonce;
                boolean alreadyKnown = RpcException.isAlreadyKnown(e);
                boolean nonceConflict = RpcException.isNonceConflict(e);
                if (inFlight != null && alreadyKnown) {
                    log.info("{} resend of {} already known to the node", label, inFlight.txHash());
                    accepted(inFlight, label, future);
                    return;
                }
                if (inFlight != null && nonceConflict) {
                    try {
                        if (chainClient.getTransactionReceipt(inFlight.txHash()).blockOptional(rpcTimeout()).isPresent()) {
                            log.info("{} resend of {} found already mined", label, inFlight.txHash());
                            accepted(inFlight, label, future);
                            return;
                        }
                        log.warn("{} nonce {} was taken by another transaction; re-signing", label, nonce);
                        inFlight = null;
                    } catch (RuntimeException lookupFailure) {
                        log.warn("{} receipt lookup for {} failed, resending: {}", label, inFlight.txHash(),
                                lookupFailure.getMessage());
                    }
                } else if (broadcasting && RpcException.isAmbiguousSend(e)) {
                    inFlight = tx;
                } else {
                    inFlight = null;
                }
                if (inFlight == null) {
                    nextNonce = null;
                }
                boolean retry = (inFlight != null || nonceConflict || RpcException.isTransient(e))
                        && retryPolicy.hasAttemptsLeft(attempt);
                if (!retry) {
                    // Outcome may be unknown; the next submission starts from the chain's pending count.
                    nextNonce = null;
                    log.warn("{} failed after {} attempt(s) (nonce {}): {}", label, attempt, nonce, e.getMessage());
                    future.completeExceptionally(new ChainSubmissionException(ChainSubmissionException.SUBMISSION_FAILED,
                            label + " failed: " + e.getMessage(), e));
                    return;
                }
                long delay = nonceConflict ? 0L : retryPolicy.delayMs(attempt - 1);
                log.warn("{} rejected (attempt {}, nonce {}), retrying in {} ms: {}", label, attempt, nonce, delay, e.getMessage());
                if (!sleep(delay, future)) {
                    nextNonce = null;
                    return;
                }
            }
        }
    }

    private void accepted(SignedTransaction tx, String label, CompletableFuture<String> future) {
        nextNonce = tx.nonce().add(BigInteger.ONE);
        log.info("{} broadcast with nonce {}: {}", label, tx.nonce(), tx.txHash());
        future.complete(tx.txHash());
    }

    private boolean sleep(long delayMs, CompletableFuture<String> future) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.completeExceptionally(new ChainSubmissionException(ChainSubmissionException.SUBMISSION_FAILED,
                    "Interrupted while waiting to retry", e));
            return false;
        }
    }

    private Duration rpcTimeout() {
        return Duration.ofMillis(properties.getRpcTimeoutMs());
    }
}
