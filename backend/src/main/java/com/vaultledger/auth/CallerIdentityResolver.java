package com.vaultledger.auth;

import com.vaultledger.common.AuthorizationException;
import org.springframework.http.HttpHeaders;

/**
 * Turns request headers into a caller. Session handling lives upstream; implementations only read what the
 * gateway forwarded.
 */
public interface CallerIdentityResolver {

    /**
     * @throws AuthorizationException unauthenticated when no usable identity is present
     */
    CallerIdentity resolve(HttpHeaders headers);

    /**
     * @throws AuthorizationException forbidden when the caller is not an admin
     */
    default CallerIdentity requireAdmin(HttpHeaders headers) {
        CallerIdentity caller = resolve(headers);
        if (!caller.isAdmin()) {
            throw AuthorizationException.forbidden("Admin role required");
        }
        return caller;
    }
}
