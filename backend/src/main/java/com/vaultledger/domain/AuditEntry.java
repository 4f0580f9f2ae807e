package com.vaultledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Append-only history line of a {@link Position}. A non-null txHash appears at most once per position;
 * that is what makes ledger mutations replay-safe.
 */
@NoArgsConstructor
@Getter
@Setter
public class AuditEntry {

    private AuditAction action;
    private BigInteger amount;
    private String txHash;
    private Long blockNumber;
    private ConfirmationState confirmation;
    private Instant recordedAt;
    private Instant confirmedAt;

    public AuditEntry(AuditAction action, BigInteger amount, String txHash, Long blockNumber,
                      ConfirmationState confirmation, Instant recordedAt) {
        this.action = action;
        this.amount = amount;
        this.txHash = txHash;
        this.blockNumber = blockNumber;
        this.confirmation = confirmation;
        this.recordedAt = recordedAt;
        if (confirmation == ConfirmationState.CONFIRMED) {
            this.confirmedAt = recordedAt;
        }
    }
}
