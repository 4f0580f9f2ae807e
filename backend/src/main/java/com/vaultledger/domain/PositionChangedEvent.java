package com.vaultledger.domain;

import java.math.BigInteger;

/**
 * Application event published by PositionLedger after a mutation is saved. Consumed by the partner loan mirror
 * and the notification listener.
 */
public record PositionChangedEvent(long positionId,
                                   String owner,
                                   AuditAction action,
                                   PositionStatus status,
                                   BigInteger outstandingDebt,
                                   BigInteger amount,
                                   String txHash) {
}
