package com.vaultledger.auth;

import com.vaultledger.common.Addresses;
import com.vaultledger.common.AuthorizationException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Reads {@code X-Caller-Address} and {@code X-Caller-Role}. A missing role means USER.
 */
@Component
public class HeaderCallerIdentityResolver implements CallerIdentityResolver {

    public static final String ADDRESS_HEADER = "X-Caller-Address";
    public static final String ROLE_HEADER = "X-Caller-Role";

    @Override
    public CallerIdentity resolve(HttpHeaders headers) {
        String address = headers.getFirst(ADDRESS_HEADER);
        if (address == null || !Addresses.isValid(address.trim())) {
            throw AuthorizationException.unauthenticated("Missing or invalid " + ADDRESS_HEADER + " header");
        }
        return new CallerIdentity(address.trim().toLowerCase(), role(headers.getFirst(ROLE_HEADER)));
    }

    private static CallerRole role(String value) {
        if (value == null || value.isBlank()) {
            return CallerRole.USER;
        }
        try {
            return CallerRole.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw AuthorizationException.unauthenticated("Unknown caller role: " + value);
        }
    }
}
