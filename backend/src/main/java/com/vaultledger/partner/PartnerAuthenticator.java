package com.vaultledger.partner;

import com.vaultledger.common.AuthorizationException;
import com.vaultledger.domain.Partner;
import com.vaultledger.domain.PartnerStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves {@code Authorization: Bearer pk_...} to an active partner. Missing or unknown key: unauthenticated;
 * known key of a partner that is not ACTIVE: forbidden.
 */
@Component
@RequiredArgsConstructor
public class PartnerAuthenticator {

    private static final String BEARER = "Bearer ";

    private final PartnerService partnerService;

    public Partner authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER)) {
            throw AuthorizationException.unauthenticated("Missing or invalid API key format");
        }
        String apiKey = authorizationHeader.substring(BEARER.length()).trim();
        if (!apiKey.startsWith("pk_")) {
            throw AuthorizationException.unauthenticated("Missing or invalid API key format");
        }
        Partner partner = partnerService.findByKeyHash(PartnerService.hashApiKey(apiKey));
        if (partner == null) {
            throw AuthorizationException.unauthenticated("Invalid API key");
        }
        if (partner.getStatus() != PartnerStatus.ACTIVE) {
            throw AuthorizationException.forbidden("Partner account is " + partner.getStatus().name().toLowerCase());
        }
        return partner;
    }
}
