package com.vaultledger.partner;

import com.vaultledger.chain.SubmittedTx;
import com.vaultledger.chain.TransactionSubmitter;
import com.vaultledger.chain.config.ChainProperties;
import com.vaultledger.common.AuthorizationException;
import com.vaultledger.common.CapacityException;
import com.vaultledger.common.ChainSubmissionException;
import com.vaultledger.common.OnChainVerificationException;
import com.vaultledger.common.StateException;
import com.vaultledger.common.VaultLedgerException;
import com.vaultledger.domain.AuditAction;
import com.vaultledger.domain.AuditEntry;
import com.vaultledger.domain.ConfirmationState;
import com.vaultledger.domain.HealthStatus;
import com.vaultledger.domain.Partner;
import com.vaultledger.domain.PartnerLoan;
import com.vaultledger.domain.PartnerLoanRepository;
import com.vaultledger.domain.PartnerLoanStatus;
import com.vaultledger.domain.PartnerStatus;
import com.vaultledger.domain.Position;
import com.vaultledger.domain.PositionChangedEvent;
import com.vaultledger.domain.PositionStatus;
import com.vaultledger.domain.RepaymentSource;
import com.vaultledger.domain.TransferClaim;
import com.vaultledger.domain.TransferClaimRepository;
import com.vaultledger.health.HealthSnapshot;
import com.vaultledger.ledger.LoanOperations;
import com.vaultledger.ledger.PositionLedger;
import com.vaultledger.verify.TransferVerifier;
import com.vaultledger.verify.VerifiedTransfer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PartnerLoanGatewayTest {

    private static final String PARTNER_ID = "partner_acme_01020304";
    private static final String USER = "0x1111111111111111111111111111111111111111";
    private static final String SETTLEMENT = "0x2222222222222222222222222222222222222222";
    private static final String STABLECOIN = "0x00000000000000000000000000000000000000cc";
    private static final String BORROW_TX = "0x" + "b".repeat(64);
    private static final String DISBURSE_TX = "0x" + "d".repeat(64);
    private static final String TRANSFER_TX = "0x" + "e".repeat(64);
    private static final BigInteger ONE_THOUSAND_USD = BigInteger.valueOf(1_000_000_000L);
    private static final long MONTH = 30L * 86_400L;
    private static final Duration WAIT = Duration.ofSeconds(5);

    @Mock
    PartnerLoanRepository partnerLoanRepository;
    @Mock
    TransferClaimRepository transferClaimRepository;
    @Mock
    PartnerService partnerService;
    @Mock
    PositionLedger positionLedger;
    @Mock
    LoanOperations loanOperations;
    @Mock
    TransactionSubmitter transactionSubmitter;
    @Mock
    TransferVerifier transferVerifier;

    private final Map<String, PartnerLoan> loans = new ConcurrentHashMap<>();
    private Partner partner;
    private PartnerLoanGateway gateway;

    @BeforeEach
    void setUp() {
        ChainProperties chainProperties = new ChainProperties();
        chainProperties.setStablecoinAddress(STABLECOIN);
        gateway = new PartnerLoanGateway(partnerLoanRepository, transferClaimRepository, partnerService, positionLedger,
                loanOperations, transactionSubmitter, transferVerifier, chainProperties, new PartnerProperties());

        partner = new Partner();
        partner.setPartnerId(PARTNER_ID);
        partner.setStatus(PartnerStatus.ACTIVE);
        partner.setPlatformFeeBps(50);
        partner.setSettlementAddress(SETTLEMENT);
        partner.setDailyBorrowLimit(BigInteger.valueOf(2_000_000_000L));
        partner.setTotalBorrowLimit(BigInteger.valueOf(5_000_000_000L));
        lenient().when(partnerService.getPartner(PARTNER_ID)).thenReturn(partner);

        lenient().when(partnerLoanRepository.insert(any(PartnerLoan.class))).thenAnswer(inv -> {
            PartnerLoan loan = inv.getArgument(0);
            boolean taken = loans.values().stream().anyMatch(l -> l.getPartnerId().equals(loan.getPartnerId())
                    && l.getPartnerLoanId().equals(loan.getPartnerLoanId()));
            if (taken) {
                throw new DuplicateKeyException("E11000 duplicate key partner_loan_key");
            }
            loan.setId(UUID.randomUUID().toString());
            loans.put(loan.getId(), loan);
            return loan;
        });
        lenient().when(partnerLoanRepository.save(any(PartnerLoan.class))).thenAnswer(inv -> {
            PartnerLoan loan = inv.getArgument(0);
            loans.put(loan.getId(), loan);
            return loan;
        });
        lenient().when(partnerLoanRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(loans.get(inv.<String>getArgument(0))));
        lenient().doAnswer(inv -> loans.remove(inv.<String>getArgument(0)))
                .when(partnerLoanRepository).deleteById(anyString());
        lenient().when(partnerLoanRepository.findByPartnerIdAndPartnerLoanId(anyString(), anyString()))
                .thenAnswer(inv -> loans.values().stream()
                        .filter(l -> l.getPartnerId().equals(inv.getArgument(0)) && l.getPartnerLoanId().equals(inv.getArgument(1)))
                        .findFirst());
        lenient().when(partnerLoanRepository.findByPartnerIdAndStatusInAndCreatedAtAfter(anyString(), any(), any()))
                .thenAnswer(inv -> {
                    List<PartnerLoanStatus> statuses = inv.getArgument(1);
                    Instant after = inv.getArgument(2);
                    return loans.values().stream()
                            .filter(l -> l.getPartnerId().equals(inv.getArgument(0)))
                            .filter(l -> statuses.contains(l.getStatus()) && l.getCreatedAt().isAfter(after))
                            .toList();
                });
        lenient().when(partnerLoanRepository.findByPositionId(anyLong()))
                .thenAnswer(inv -> loans.values().stream()
                        .filter(l -> inv.getArgument(0).equals(l.getPositionId()))
                        .toList());
    }

    private static Position position(long id, boolean borrowed) {
        Position position = new Position();
        position.setPositionId(id);
        position.setOwner(USER);
        position.setStatus(PositionStatus.ACTIVE);
        if (borrowed) {
            position.setPrincipalBorrowed(ONE_THOUSAND_USD);
        }
        return position;
    }

    private void eligible(Position... positions) {
        when(positionLedger.getActivePositions(USER)).thenReturn(List.of(positions));
        lenient().when(positionLedger.healthOf(any(Position.class))).thenReturn(new HealthSnapshot(null,
                HealthStatus.HEALTHY, BigInteger.ZERO, BigInteger.valueOf(7_000_000_000L), BigInteger.valueOf(7_000_000_000L)));
    }

    private static Position borrowedPosition(long id, PositionStatus status) {
        Position position = position(id, true);
        position.setStatus(status);
        position.getHistory().add(new AuditEntry(AuditAction.BORROW, ONE_THOUSAND_USD, BORROW_TX, 11L,
                ConfirmationState.TENTATIVE, Instant.now()));
        return position;
    }

    private static PartnerBorrowCommand command(String partnerLoanId, BigInteger amount) {
        return new PartnerBorrowCommand(partnerLoanId, USER, amount, MONTH * 3, 3);
    }

    private PartnerLoan activeLoan(String partnerLoanId, long positionId) {
        PartnerLoan loan = new PartnerLoan();
        loan.setId(UUID.randomUUID().toString());
        loan.setPartnerId(PARTNER_ID);
        loan.setPartnerLoanId(partnerLoanId);
        loan.setUserWallet(USER);
        loan.setPositionId(positionId);
        loan.setPrincipalAmount(ONE_THOUSAND_USD);
        loan.setRemainingDebt(ONE_THOUSAND_USD);
        loan.setStatus(PartnerLoanStatus.ACTIVE);
        loan.setCreatedAt(Instant.now());
        loans.put(loan.getId(), loan);
        return loan;
    }

    private static String code(Throwable e) {
        return ((VaultLedgerException) e).getErrorCode();
    }

    @Test
    @DisplayName("borrow selects the lowest eligible position, disburses net of fee and activates the loan")
    void borrow_activates() {
        eligible(position(3, true), position(9, false), position(5, false));
        Position borrowed = borrowedPosition(5, PositionStatus.ACTIVE);
        when(loanOperations.borrow(USER, 5L, ONE_THOUSAND_USD, MONTH * 3, 3)).thenReturn(Mono.just(borrowed));
        when(positionLedger.outstandingDebt(borrowed)).thenReturn(ONE_THOUSAND_USD);
        when(transactionSubmitter.transfer(STABLECOIN, SETTLEMENT, BigInteger.valueOf(995_000_000L)))
                .thenReturn(Mono.just(new SubmittedTx(DISBURSE_TX, 12L)));

        PartnerLoan loan = gateway.borrow(partner, command("loan-1", ONE_THOUSAND_USD)).block(WAIT);

        assertThat(loan).isNotNull();
        assertThat(loan.getStatus()).isEqualTo(PartnerLoanStatus.ACTIVE);
        assertThat(loan.getPositionId()).isEqualTo(5L);
        assertThat(loan.getPlatformFee()).isEqualTo(BigInteger.valueOf(5_000_000L));
        assertThat(loan.getNetDisbursed()).isEqualTo(BigInteger.valueOf(995_000_000L));
        assertThat(loan.getBorrowTxHash()).isEqualTo(BORROW_TX);
        assertThat(loan.getDisbursementTxHash()).isEqualTo(DISBURSE_TX);
        assertThat(loan.getRemainingDebt()).isEqualTo(ONE_THOUSAND_USD);
        verify(partnerService).recordBorrow(PARTNER_ID, ONE_THOUSAND_USD);
    }

    @Test
    @DisplayName("a reused partnerLoanId is a 409 and never reaches the vault")
    void borrow_duplicateKey() {
        activeLoan("loan-1", 5);

        assertThatThrownBy(() -> gateway.borrow(partner, command("loan-1", ONE_THOUSAND_USD)).block(WAIT))
                .isInstanceOf(StateException.class)
                .satisfies(e -> assertThat(code(e)).isEqualTo(StateException.DUPLICATE_LOAN))
                .satisfies(e -> assertThat(((StateException) e).isConflict()).isTrue());
        verify(loanOperations, never()).borrow(anyString(), anyLong(), any(), anyLong(), anyInt());
    }

    @Test
    @DisplayName("the daily limit counts loans of the window and releases the rejected reservation")
    void borrow_dailyLimit() {
        activeLoan("loan-1", 4).setPrincipalAmount(BigInteger.valueOf(1_500_000_000L));

        assertThatThrownBy(() -> gateway.borrow(partner, command("loan-2", ONE_THOUSAND_USD)).block(WAIT))
                .isInstanceOf(CapacityException.class)
                .satisfies(e -> assertThat(code(e)).isEqualTo(CapacityException.DAILY_LIMIT_EXCEEDED));
        assertThat(loans.values()).extracting(PartnerLoan::getPartnerLoanId).containsExactly("loan-1");
    }

    @Test
    @DisplayName("the total limit is checked against current outstanding")
    void borrow_totalLimit() {
        partner.setCurrentOutstanding(BigInteger.valueOf(4_500_000_000L));

        assertThatThrownBy(() -> gateway.borrow(partner, command("loan-2", ONE_THOUSAND_USD)).block(WAIT))
                .satisfies(e -> assertThat(code(e)).isEqualTo(CapacityException.TOTAL_LIMIT_EXCEEDED));
        assertThat(loans).isEmpty();
    }

    @Test
    @DisplayName("no unborrowed position with enough headroom is rejected and the key stays free")
    void borrow_noEligiblePosition() {
        eligible(position(3, true));

        assertThatThrownBy(() -> gateway.borrow(partner, command("loan-1", ONE_THOUSAND_USD)).block(WAIT))
                .satisfies(e -> assertThat(code(e)).isEqualTo(CapacityException.NO_ELIGIBLE_POSITION));
        assertThat(loans).isEmpty();
    }

    @Test
    @DisplayName("a ledger rejection from the borrow releases the reservation")
    void borrow_ledgerRejection() {
        eligible(position(5, false));
        when(loanOperations.borrow(USER, 5L, ONE_THOUSAND_USD, MONTH * 3, 3))
                .thenReturn(Mono.error(new CapacityException(CapacityException.LTV_EXCEEDED, "over cap")));

        assertThatThrownBy(() -> gateway.borrow(partner, command("loan-1", ONE_THOUSAND_USD)).block(WAIT))
                .satisfies(e -> assertThat(code(e)).isEqualTo(CapacityException.LTV_EXCEEDED));
        assertThat(loans).isEmpty();
    }

    @Test
    @DisplayName("a submission failure leaves a FAILED record and burns the key")
    void borrow_submissionFailure() {
        eligible(position(5, false));
        when(loanOperations.borrow(USER, 5L, ONE_THOUSAND_USD, MONTH * 3, 3))
                .thenReturn(Mono.error(new ChainSubmissionException(ChainSubmissionException.CONFIRMATION_TIMEOUT, "not mined")));

        assertThatThrownBy(() -> gateway.borrow(partner, command("loan-1", ONE_THOUSAND_USD)).block(WAIT))
                .isInstanceOf(ChainSubmissionException.class);
        assertThat(loans.values()).singleElement()
                .satisfies(l -> assertThat(l.getStatus()).isEqualTo(PartnerLoanStatus.FAILED))
                .satisfies(l -> assertThat(l.getFailureReason()).isEqualTo("not mined"));

        assertThatThrownBy(() -> gateway.borrow(partner, command("loan-1", ONE_THOUSAND_USD)).block(WAIT))
                .satisfies(e -> assertThat(code(e)).isEqualTo(StateException.DUPLICATE_LOAN));
    }

    @Test
    @DisplayName("a failed disbursement marks the loan FAILED with the borrow tx and no partner stats")
    void borrow_disbursementFailure() {
        eligible(position(5, false));
        when(loanOperations.borrow(USER, 5L, ONE_THOUSAND_USD, MONTH * 3, 3))
                .thenReturn(Mono.just(borrowedPosition(5, PositionStatus.ACTIVE)));
        when(transactionSubmitter.transfer(anyString(), anyString(), any()))
                .thenReturn(Mono.error(new ChainSubmissionException(ChainSubmissionException.SUBMISSION_FAILED, "transfer failed")));

        assertThatThrownBy(() -> gateway.borrow(partner, command("loan-1", ONE_THOUSAND_USD)).block(WAIT))
                .isInstanceOf(ChainSubmissionException.class);
        PartnerLoan loan = loans.values().iterator().next();
        assertThat(loan.getStatus()).isEqualTo(PartnerLoanStatus.FAILED);
        assertThat(loan.getBorrowTxHash()).isEqualTo(BORROW_TX);
        assertThat(loan.getFailureReason()).startsWith("Disbursement failed");
        verify(partnerService, never()).recordBorrow(anyString(), any());
    }

    @Test
    @DisplayName("a short transfer fails verification and changes nothing")
    void repayWithTransfer_amountMismatch() {
        PartnerLoan loan = activeLoan("loan-1", 5);
        BigInteger expected = BigInteger.valueOf(100_000_000L);
        when(positionLedger.checkRepayment(5L, expected)).thenReturn(position(5, true));
        when(transferVerifier.verifyTransfer(TRANSFER_TX, USER, SETTLEMENT, expected, STABLECOIN))
                .thenReturn(Mono.error(new OnChainVerificationException(OnChainVerificationException.AMOUNT_MISMATCH,
                        "Transfer amount mismatch. Expected: 100000000, Got: 50000000")));

        assertThatThrownBy(() -> gateway.repayWithTransfer(partner,
                new TransferRepaymentCommand("loan-1", USER, expected, TRANSFER_TX)).block(WAIT))
                .isInstanceOf(OnChainVerificationException.class)
                .hasMessageContaining("Expected: 100000000, Got: 50000000");

        verify(transferClaimRepository, never()).insert(any(TransferClaim.class));
        verify(loanOperations, never()).repayFromTransfer(anyLong(), any(), anyString(), anyLong());
        verify(partnerService, never()).recordRepayment(anyString(), any());
        assertThat(loan.getTotalRepaid()).isZero();
        assertThat(loan.getRepaymentHistory()).isEmpty();
    }

    @Test
    @DisplayName("a verified transfer is claimed once, credited to the position and can complete the loan")
    void repayWithTransfer_credits() {
        activeLoan("loan-1", 5);
        Position repaid = borrowedPosition(5, PositionStatus.REPAID);
        when(positionLedger.checkRepayment(5L, ONE_THOUSAND_USD)).thenReturn(position(5, true));
        when(transferVerifier.verifyTransfer(TRANSFER_TX, USER, SETTLEMENT, ONE_THOUSAND_USD, STABLECOIN))
                .thenReturn(Mono.just(new VerifiedTransfer(TRANSFER_TX, STABLECOIN, USER, SETTLEMENT, ONE_THOUSAND_USD, 90L, 0)));
        when(transferClaimRepository.insert(any(TransferClaim.class))).thenAnswer(inv -> inv.getArgument(0));
        when(loanOperations.repayFromTransfer(5L, ONE_THOUSAND_USD, TRANSFER_TX, 90L)).thenReturn(Mono.just(repaid));
        when(positionLedger.outstandingDebt(repaid)).thenReturn(BigInteger.ZERO);

        PartnerLoan loan = gateway.repayWithTransfer(partner,
                new TransferRepaymentCommand("loan-1", USER, ONE_THOUSAND_USD,
                        TRANSFER_TX.toUpperCase().replace("0X", "0x"))).block(WAIT);

        assertThat(loan).isNotNull();
        assertThat(loan.getStatus()).isEqualTo(PartnerLoanStatus.REPAID);
        assertThat(loan.getRemainingDebt()).isZero();
        assertThat(loan.getTotalRepaid()).isEqualTo(ONE_THOUSAND_USD);
        assertThat(loan.getRepaymentHistory()).singleElement()
                .satisfies(r -> assertThat(r.getRepaidBy()).isEqualTo(RepaymentSource.PARTNER))
                .satisfies(r -> assertThat(r.getTxHash()).isEqualTo(TRANSFER_TX));
        verify(partnerService).recordRepayment(PARTNER_ID, ONE_THOUSAND_USD);
    }

    @Test
    @DisplayName("a transfer already credited is a 409 before any chain lookup")
    void repayWithTransfer_alreadyClaimed() {
        activeLoan("loan-1", 5);
        when(transferClaimRepository.existsById(TRANSFER_TX)).thenReturn(true);

        assertThatThrownBy(() -> gateway.repayWithTransfer(partner,
                new TransferRepaymentCommand("loan-1", USER, ONE_THOUSAND_USD, TRANSFER_TX)).block(WAIT))
                .satisfies(e -> assertThat(code(e)).isEqualTo(StateException.TRANSFER_ALREADY_USED));
        verify(transferVerifier, never()).verifyTransfer(anyString(), anyString(), anyString(), any(), anyString());
    }

    @Test
    @DisplayName("losing the claim race is a 409 and the ledger is not touched")
    void repayWithTransfer_claimRace() {
        activeLoan("loan-1", 5);
        when(positionLedger.checkRepayment(5L, ONE_THOUSAND_USD)).thenReturn(position(5, true));
        when(transferVerifier.verifyTransfer(anyString(), anyString(), anyString(), any(), anyString()))
                .thenReturn(Mono.just(new VerifiedTransfer(TRANSFER_TX, STABLECOIN, USER, SETTLEMENT, ONE_THOUSAND_USD, 90L, 0)));
        when(transferClaimRepository.insert(any(TransferClaim.class))).thenThrow(new DuplicateKeyException("E11000"));

        assertThatThrownBy(() -> gateway.repayWithTransfer(partner,
                new TransferRepaymentCommand("loan-1", USER, ONE_THOUSAND_USD, TRANSFER_TX)).block(WAIT))
                .satisfies(e -> assertThat(code(e)).isEqualTo(StateException.TRANSFER_ALREADY_USED));
        verify(loanOperations, never()).repayFromTransfer(anyLong(), any(), anyString(), anyLong());
    }

    @Test
    @DisplayName("a ledger failure after the claim releases the claim")
    void repayWithTransfer_unclaimOnFailure() {
        activeLoan("loan-1", 5);
        when(positionLedger.checkRepayment(5L, ONE_THOUSAND_USD)).thenReturn(position(5, true));
        when(transferVerifier.verifyTransfer(anyString(), anyString(), anyString(), any(), anyString()))
                .thenReturn(Mono.just(new VerifiedTransfer(TRANSFER_TX, STABLECOIN, USER, SETTLEMENT, ONE_THOUSAND_USD, 90L, 0)));
        when(transferClaimRepository.insert(any(TransferClaim.class))).thenAnswer(inv -> inv.getArgument(0));
        when(loanOperations.repayFromTransfer(5L, ONE_THOUSAND_USD, TRANSFER_TX, 90L))
                .thenReturn(Mono.error(new StateException(StateException.INVALID_STATUS, "liquidated meanwhile")));

        assertThatThrownBy(() -> gateway.repayWithTransfer(partner,
                new TransferRepaymentCommand("loan-1", USER, ONE_THOUSAND_USD, TRANSFER_TX)).block(WAIT))
                .isInstanceOf(StateException.class);
        verify(transferClaimRepository).deleteById(TRANSFER_TX);
    }

    @Test
    @DisplayName("another wallet cannot repay the loan")
    void repayWithTransfer_walletMismatch() {
        activeLoan("loan-1", 5);

        assertThatThrownBy(() -> gateway.repayWithTransfer(partner, new TransferRepaymentCommand("loan-1",
                "0x3333333333333333333333333333333333333333", ONE_THOUSAND_USD, TRANSFER_TX)).block(WAIT))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    @DisplayName("position changes are mirrored onto ACTIVE partner loans only")
    void mirrorsPositionChanges() {
        PartnerLoan active = activeLoan("loan-1", 5);
        PartnerLoan failed = activeLoan("loan-2", 5);
        failed.setStatus(PartnerLoanStatus.FAILED);

        gateway.onPositionChanged(new PositionChangedEvent(5L, USER, AuditAction.LIQUIDATE, PositionStatus.LIQUIDATED,
                BigInteger.valueOf(700_000_000L), BigInteger.valueOf(700_000_000L), null));

        assertThat(active.getStatus()).isEqualTo(PartnerLoanStatus.LIQUIDATED);
        assertThat(active.getRemainingDebt()).isEqualTo(BigInteger.valueOf(700_000_000L));
        assertThat(failed.getStatus()).isEqualTo(PartnerLoanStatus.FAILED);
    }

    @Test
    @DisplayName("a default on the position defaults the partner loan")
    void mirrorsDefault() {
        PartnerLoan active = activeLoan("loan-1", 5);

        gateway.onPositionChanged(new PositionChangedEvent(5L, USER, AuditAction.DEFAULT, PositionStatus.ACTIVE,
                ONE_THOUSAND_USD, null, null));

        assertThat(active.getStatus()).isEqualTo(PartnerLoanStatus.DEFAULTED);
    }

    @Test
    @DisplayName("loans of another partner are forbidden, not hidden")
    void crossTenant() {
        PartnerLoan loan = activeLoan("loan-1", 5);
        Partner other = new Partner();
        other.setPartnerId("partner_other_0a0b0c0d");

        assertThat(gateway.getLoanById(partner, loan.getId()).getPartnerLoanId()).isEqualTo("loan-1");
        assertThatThrownBy(() -> gateway.getLoanById(other, loan.getId()))
                .isInstanceOf(AuthorizationException.class);
        assertThat(gateway.listLoans(other, null, null)).isEmpty();
    }
}
