package com.vaultledger.ledger;

import java.util.List;

/**
 * Result of one missed-installment pass over a position.
 */
public record MissedInstallments(long positionId, List<Integer> newlyMissed, int missedPayments, boolean defaultedNow) {

    public boolean changed() {
        return !newlyMissed.isEmpty() || defaultedNow;
    }
}
