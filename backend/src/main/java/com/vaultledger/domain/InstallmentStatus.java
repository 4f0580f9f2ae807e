package com.vaultledger.domain;

public enum InstallmentStatus {
    PENDING,
    PAID,
    MISSED
}
