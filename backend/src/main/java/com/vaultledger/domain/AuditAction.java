package com.vaultledger.domain;

public enum AuditAction {
    DEPOSIT,
    BORROW,
    REPAY,
    WITHDRAW,
    REVALUE,
    MISSED_PAYMENT,
    DEFAULT,
    LIQUIDATE,
    LIQUIDATION_SETTLED
}
