package com.vaultledger.chain;

import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.List;

/**
 * Chain access used by the gateway, the verifier and the event poller. Reads are retried internally on
 * transient failures; {@link #sendRawTransaction} is sent exactly once per call.
 */
public interface ChainClient {

    Mono<Long> blockNumber();

    /**
     * Receipt of a mined transaction; empty when the transaction is unknown or still pending.
     */
    Mono<TransactionReceipt> getTransactionReceipt(String txHash);

    Mono<List<LogEntry>> getLogs(LogFilter filter);

    /**
     * eth_call against the latest block; returns the raw hex result.
     */
    Mono<String> call(String to, String data);

    /**
     * Next nonce of {@code address} including pending transactions.
     */
    Mono<BigInteger> getPendingNonce(String address);

    /**
     * Sign a transaction with the node-managed account {@code from} and an explicit nonce, without broadcasting.
     * The hash is known before the transaction leaves the process.
     */
    Mono<SignedTransaction> signTransaction(String from, String to, String data, BigInteger nonce);

    /**
     * Broadcast a signed transaction.
     *
     * @return transaction hash
     */
    Mono<String> sendRawTransaction(String rawTransaction);
}
