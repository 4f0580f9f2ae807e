package com.vaultledger.chain;

/**
 * A broadcast transaction that has been mined successfully.
 */
public record SubmittedTx(String txHash, long blockNumber) {

    static SubmittedTx of(TransactionReceipt receipt) {
        return new SubmittedTx(receipt.transactionHash(), receipt.blockNumber());
    }
}
