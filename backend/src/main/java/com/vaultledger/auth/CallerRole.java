package com.vaultledger.auth;

public enum CallerRole {
    USER,
    ADMIN
}
