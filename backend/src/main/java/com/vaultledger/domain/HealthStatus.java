package com.vaultledger.domain;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    LIQUIDATABLE
}
