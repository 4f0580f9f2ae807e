package com.vaultledger.partner;

import com.vaultledger.common.NotFoundException;
import com.vaultledger.common.ValidationException;
import com.vaultledger.domain.Partner;
import com.vaultledger.domain.PartnerLoan;
import com.vaultledger.domain.PartnerLoanRepository;
import com.vaultledger.domain.PartnerLoanStatus;
import com.vaultledger.domain.PartnerRepository;
import com.vaultledger.domain.PartnerStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PartnerServiceTest {

    private static final String SETTLEMENT = "0xAbCd000000000000000000000000000000000001";

    @Mock
    PartnerRepository partnerRepository;
    @Mock
    PartnerLoanRepository partnerLoanRepository;

    private PartnerService partnerService;

    @BeforeEach
    void setUp() {
        PartnerProperties properties = new PartnerProperties();
        properties.setKeyEnvironment("test");
        partnerService = new PartnerService(partnerRepository, partnerLoanRepository, properties);
    }

    private static NewPartner request(Integer feeBps) {
        return new NewPartner("Acme Pay", "acme", null, BigInteger.valueOf(1_000_000_000L),
                BigInteger.valueOf(10_000_000_000L), feeBps, SETTLEMENT);
    }

    private Partner stored(String partnerId) {
        Partner partner = new Partner();
        partner.setPartnerId(partnerId);
        partner.setStatus(PartnerStatus.ACTIVE);
        partner.setDailyBorrowLimit(BigInteger.valueOf(1_000_000_000L));
        partner.setTotalBorrowLimit(BigInteger.valueOf(10_000_000_000L));
        when(partnerRepository.findById(partnerId)).thenReturn(Optional.of(partner));
        lenient().when(partnerRepository.save(any(Partner.class))).thenAnswer(inv -> inv.getArgument(0));
        return partner;
    }

    @Test
    @DisplayName("onboarding issues a prefixed key and stores only its hash")
    void createPartner() {
        when(partnerRepository.insert(any(Partner.class))).thenAnswer(inv -> inv.getArgument(0));

        IssuedKey issued = partnerService.createPartner(request(null));

        assertThat(issued.apiKey()).matches("pk_acme_test_[0-9a-f]{32}");
        Partner partner = issued.partner();
        assertThat(partner.getPartnerId()).matches("partner_acme_[0-9a-f]{8}");
        assertThat(partner.getApiKeyHash()).isEqualTo(PartnerService.hashApiKey(issued.apiKey()));
        assertThat(partner.getApiKeyHash()).doesNotContain(issued.apiKey());
        assertThat(partner.getApiKeyPrefix()).isEqualTo(issued.apiKey().substring(0, 16));
        assertThat(partner.getPlatformFeeBps()).isEqualTo(50);
        assertThat(partner.getTier()).isEqualTo("standard");
        assertThat(partner.getStatus()).isEqualTo(PartnerStatus.ACTIVE);
        assertThat(partner.getSettlementAddress()).isEqualTo(SETTLEMENT.toLowerCase());
    }

    @Test
    @DisplayName("invalid prefix, limits or fee are rejected before anything is stored")
    void createPartner_validation() {
        assertThatThrownBy(() -> partnerService.createPartner(new NewPartner("Acme", "Acme!", null,
                BigInteger.ONE, BigInteger.ONE, null, SETTLEMENT))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> partnerService.createPartner(new NewPartner("Acme", "acme", null,
                BigInteger.ZERO, BigInteger.ONE, null, SETTLEMENT))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> partnerService.createPartner(request(10_001))).isInstanceOf(ValidationException.class);
        verify(partnerRepository, never()).insert(any(Partner.class));
    }

    @Test
    @DisplayName("key rotation replaces the hash; the old key no longer matches")
    void regenerateKey() {
        Partner partner = stored("partner_acme_0a1b2c3d");
        partner.setApiKeyHash(PartnerService.hashApiKey("pk_acme_test_old"));

        IssuedKey issued = partnerService.regenerateKey("partner_acme_0a1b2c3d");

        assertThat(issued.apiKey()).startsWith("pk_acme_test_");
        assertThat(partner.getApiKeyHash())
                .isEqualTo(PartnerService.hashApiKey(issued.apiKey()))
                .isNotEqualTo(PartnerService.hashApiKey("pk_acme_test_old"));
    }

    @Test
    @DisplayName("outstanding grows with borrows and never drops below zero on repayment")
    void stats() {
        Partner partner = stored("partner_acme_0a1b2c3d");

        partnerService.recordBorrow("partner_acme_0a1b2c3d", BigInteger.valueOf(100));
        partnerService.recordRepayment("partner_acme_0a1b2c3d", BigInteger.valueOf(104));

        assertThat(partner.getCurrentOutstanding()).isZero();
        assertThat(partner.getTotalBorrowed()).isEqualTo(BigInteger.valueOf(100));
        assertThat(partner.getTotalRepaid()).isEqualTo(BigInteger.valueOf(104));
        assertThat(partner.getLastActivityAt()).isNotNull();
    }

    @Test
    @DisplayName("stats count only ACTIVE loans")
    void statsActiveLoans() {
        stored("partner_acme_0a1b2c3d");
        PartnerLoan active = new PartnerLoan();
        active.setStatus(PartnerLoanStatus.ACTIVE);
        PartnerLoan repaid = new PartnerLoan();
        repaid.setStatus(PartnerLoanStatus.REPAID);
        when(partnerLoanRepository.findByPartnerIdOrderByCreatedAtDesc("partner_acme_0a1b2c3d"))
                .thenReturn(List.of(active, repaid));

        PartnerStats stats = partnerService.stats("partner_acme_0a1b2c3d");

        assertThat(stats.activeLoans()).isEqualTo(1L);
        assertThat(stats.totalBorrowLimit()).isEqualTo(BigInteger.valueOf(10_000_000_000L));
    }

    @Test
    @DisplayName("limits update only the supplied values")
    void updateLimits() {
        Partner partner = stored("partner_acme_0a1b2c3d");

        partnerService.updateLimits("partner_acme_0a1b2c3d", null, BigInteger.valueOf(5));

        assertThat(partner.getDailyBorrowLimit()).isEqualTo(BigInteger.valueOf(1_000_000_000L));
        assertThat(partner.getTotalBorrowLimit()).isEqualTo(BigInteger.valueOf(5));
    }

    @Test
    @DisplayName("unknown partner id is a 404")
    void unknownPartner() {
        when(partnerRepository.findById("partner_x_1")).thenReturn(Optional.empty());
        assertThatThrownBy(() -> partnerService.getPartner("partner_x_1")).isInstanceOf(NotFoundException.class);
    }
}
