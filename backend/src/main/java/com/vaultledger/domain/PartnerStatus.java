package com.vaultledger.domain;

public enum PartnerStatus {
    ACTIVE,
    SUSPENDED,
    INACTIVE
}
