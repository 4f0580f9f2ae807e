package com.vaultledger.domain;

/**
 * Closed set of on-chain events the reconciliation processor understands. Adding a constant forces every
 * exhaustive switch over this type to handle it.
 */
public enum VaultEventType {
    POSITION_CREATED,
    USDC_BORROWED,
    REPAYMENT_PLAN_CREATED,
    LOAN_REPAID,
    COLLATERAL_WITHDRAWN,
    MISSED_PAYMENT_MARKED,
    POSITION_DEFAULTED,
    POSITION_LIQUIDATED,
    LIQUIDATION_SETTLED,
    ASSET_REGISTERED,
    TOKEN_SUITE_DEPLOYED,
    TRANSFER,
    /** A matching log that failed to decode; the raw topics and data are kept in the payload. */
    UNDECODED
}
