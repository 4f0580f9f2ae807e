package com.vaultledger.domain;

public enum ChainEventStatus {
    PENDING,
    APPLIED,
    RETRY,
    DEAD
}
