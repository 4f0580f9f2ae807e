package com.vaultledger.domain;

public enum AssetStatus {
    PENDING,
    REGISTERED,
    TOKENIZED
}
