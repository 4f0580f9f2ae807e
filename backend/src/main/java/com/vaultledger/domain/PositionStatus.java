package com.vaultledger.domain;

/**
 * ACTIVE -> REPAID -> CLOSED, ACTIVE -> CLOSED (never borrowed, fully withdrawn), ACTIVE -> LIQUIDATED (terminal).
 */
public enum PositionStatus {
    ACTIVE,
    REPAID,
    LIQUIDATED,
    CLOSED
}
