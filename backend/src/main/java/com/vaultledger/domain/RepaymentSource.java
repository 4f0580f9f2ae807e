package com.vaultledger.domain;

public enum RepaymentSource {
    USER,
    PARTNER,
    LIQUIDATION
}
