package com.vaultledger.ledger;

import com.vaultledger.domain.ConfirmationState;

/**
 * Transaction behind a ledger mutation. TENTATIVE when recorded from the submitter's receipt, CONFIRMED when
 * recorded (or re-recorded) from an ingested vault event. A null txHash marks an off-chain bookkeeping change.
 */
public record TxRef(String txHash, Long blockNumber, ConfirmationState confirmation) {

    public static TxRef tentative(String txHash, Long blockNumber) {
        return new TxRef(txHash != null ? txHash.toLowerCase() : null, blockNumber, ConfirmationState.TENTATIVE);
    }

    public static TxRef confirmed(String txHash, Long blockNumber) {
        return new TxRef(txHash != null ? txHash.toLowerCase() : null, blockNumber, ConfirmationState.CONFIRMED);
    }

    public static TxRef offChain() {
        return new TxRef(null, null, ConfirmationState.CONFIRMED);
    }

    public boolean isConfirmed() {
        return confirmation == ConfirmationState.CONFIRMED;
    }
}
