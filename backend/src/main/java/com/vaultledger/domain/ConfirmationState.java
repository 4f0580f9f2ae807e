package com.vaultledger.domain;

/**
 * TENTATIVE: written from a receipt before the matching vault event was ingested.
 * CONFIRMED: matched to (or created from) an ingested vault event.
 */
public enum ConfirmationState {
    TENTATIVE,
    CONFIRMED
}
