package com.vaultledger.partner;

import com.vaultledger.domain.Partner;
import com.vaultledger.domain.PartnerApiLog;
import com.vaultledger.domain.PartnerApiLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PartnerApiLogServiceTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @Mock
    PartnerApiLogRepository partnerApiLogRepository;

    private PartnerApiLogService service;
    private Partner partner;

    @BeforeEach
    void setUp() {
        service = new PartnerApiLogService(partnerApiLogRepository);
        partner = new Partner();
        partner.setPartnerId("partner_acme_0a1b2c3d");
        partner.setName("Acme Pay");
    }

    @Test
    @DisplayName("a failed call is stored with its status, error code and loan context")
    void recordsFailure() {
        when(partnerApiLogRepository.save(any(PartnerApiLog.class))).thenAnswer(inv -> inv.getArgument(0));

        service.record(partner, new PartnerApiCall("POST", "/partners/borrow", 409, 12L, "DUPLICATE_LOAN",
                "Loan loan-1 already exists", "loan-1", "0xAbCd000000000000000000000000000000000001")).block(WAIT);

        ArgumentCaptor<PartnerApiLog> saved = ArgumentCaptor.forClass(PartnerApiLog.class);
        verify(partnerApiLogRepository).save(saved.capture());
        PartnerApiLog entry = saved.getValue();
        assertThat(entry.getPartnerId()).isEqualTo("partner_acme_0a1b2c3d");
        assertThat(entry.getPartnerName()).isEqualTo("Acme Pay");
        assertThat(entry.getStatusCode()).isEqualTo(409);
        assertThat(entry.isSuccess()).isFalse();
        assertThat(entry.getErrorCode()).isEqualTo("DUPLICATE_LOAN");
        assertThat(entry.getPartnerLoanId()).isEqualTo("loan-1");
        assertThat(entry.getUserWallet()).isEqualTo("0xabcd000000000000000000000000000000000001");
        assertThat(entry.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("a log write failure does not fail the audited call")
    void writeFailureIsContained() {
        when(partnerApiLogRepository.save(any(PartnerApiLog.class)))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        service.record(partner, new PartnerApiCall("GET", "/partners/stats", 200, 3L, null, null, null, null))
                .block(WAIT);

        verify(partnerApiLogRepository).save(any(PartnerApiLog.class));
    }
}
