package com.vaultledger.partner;

import com.vaultledger.common.AuthorizationException;
import com.vaultledger.domain.Partner;
import com.vaultledger.domain.PartnerStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PartnerAuthenticatorTest {

    private static final String KEY = "pk_acme_test_0123456789abcdef0123456789abcdef";

    @Mock
    PartnerService partnerService;
    @InjectMocks
    PartnerAuthenticator authenticator;

    private static Partner partner(PartnerStatus status) {
        Partner partner = new Partner();
        partner.setPartnerId("partner_acme_01020304");
        partner.setStatus(status);
        return partner;
    }

    @Test
    @DisplayName("a known key of an active partner authenticates")
    void activePartner() {
        when(partnerService.findByKeyHash(PartnerService.hashApiKey(KEY))).thenReturn(partner(PartnerStatus.ACTIVE));

        assertThat(authenticator.authenticate("Bearer " + KEY).getPartnerId()).isEqualTo("partner_acme_01020304");
    }

    @Test
    @DisplayName("missing or malformed headers are 401 without a lookup")
    void malformed() {
        for (String header : new String[]{null, "", "Basic abc", "Bearer sk_live_123"}) {
            assertThatThrownBy(() -> authenticator.authenticate(header))
                    .isInstanceOf(AuthorizationException.class)
                    .hasMessage("Missing or invalid API key format")
                    .satisfies(e -> assertThat(((AuthorizationException) e).isUnauthenticated()).isTrue());
        }
        verifyNoInteractions(partnerService);
    }

    @Test
    @DisplayName("an unknown key is 401")
    void unknownKey() {
        when(partnerService.findByKeyHash(anyString())).thenReturn(null);

        assertThatThrownBy(() -> authenticator.authenticate("Bearer " + KEY))
                .isInstanceOf(AuthorizationException.class)
                .hasMessage("Invalid API key");
    }

    @Test
    @DisplayName("a suspended partner is 403")
    void suspended() {
        when(partnerService.findByKeyHash(anyString())).thenReturn(partner(PartnerStatus.SUSPENDED));

        assertThatThrownBy(() -> authenticator.authenticate("Bearer " + KEY))
                .isInstanceOf(AuthorizationException.class)
                .hasMessage("Partner account is suspended")
                .satisfies(e -> assertThat(((AuthorizationException) e).isUnauthenticated()).isFalse());
    }
}
