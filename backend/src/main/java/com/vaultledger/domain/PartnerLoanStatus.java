package com.vaultledger.domain;

/**
 * PENDING is the reservation written before any chain call; FAILED keeps the key burned after a broadcast failure.
 */
public enum PartnerLoanStatus {
    PENDING,
    ACTIVE,
    REPAID,
    DEFAULTED,
    LIQUIDATED,
    FAILED
}
