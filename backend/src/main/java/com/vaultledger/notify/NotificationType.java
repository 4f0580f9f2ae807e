package com.vaultledger.notify;

public enum NotificationType {
    HEALTH_WARNING,
    LIQUIDATION_RISK,
    PAYMENT_MISSED,
    POSITION_DEFAULTED,
    LOAN_REPAID,
    POSITION_LIQUIDATED
}
