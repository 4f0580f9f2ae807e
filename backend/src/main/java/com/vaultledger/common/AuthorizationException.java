package com.vaultledger.common;

import lombok.Getter;

/**
 * Caller is unknown (unauthenticated) or not allowed to touch the resource (forbidden).
 */
@Getter
public class AuthorizationException extends VaultLedgerException {

    public static final String UNAUTHENTICATED = "UNAUTHENTICATED";
    public static final String FORBIDDEN = "FORBIDDEN";

    private final boolean unauthenticated;

    private AuthorizationException(String errorCode, String message, boolean unauthenticated) {
        super(errorCode, message);
        this.unauthenticated = unauthenticated;
    }

    public static AuthorizationException unauthenticated(String message) {
        return new AuthorizationException(UNAUTHENTICATED, message, true);
    }

    public static AuthorizationException forbidden(String message) {
        return new AuthorizationException(FORBIDDEN, message, false);
    }
}
