package com.vaultledger.auth;

/**
 * Authenticated caller as asserted by the upstream gateway. {@code address} is lower-case.
 */
public record CallerIdentity(String address, CallerRole role) {

    public boolean isAdmin() {
        return role == CallerRole.ADMIN;
    }
}
