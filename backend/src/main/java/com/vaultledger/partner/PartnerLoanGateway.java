package com.vaultledger.partner;

import com.vaultledger.chain.SubmittedTx;
import com.vaultledger.chain.TransactionSubmitter;
import com.vaultledger.chain.config.ChainProperties;
import com.vaultledger.common.Addresses;
import com.vaultledger.common.AuthorizationException;
import com.vaultledger.common.CapacityException;
import com.vaultledger.common.ChainSubmissionException;
import com.vaultledger.common.NotFoundException;
import com.vaultledger.common.StateException;
import com.vaultledger.common.ValidationException;
import com.vaultledger.common.VaultLedgerException;
import com.vaultledger.domain.AuditAction;
import com.vaultledger.domain.AuditEntry;
import com.vaultledger.domain.Partner;
import com.vaultledger.domain.PartnerLoan;
import com.vaultledger.domain.PartnerLoanRepository;
import com.vaultledger.domain.PartnerLoanStatus;
import com.vaultledger.domain.Position;
import com.vaultledger.domain.PositionChangedEvent;
import com.vaultledger.domain.PositionStatus;
import com.vaultledger.domain.RepaymentSource;
import com.vaultledger.domain.TransferClaim;
import com.vaultledger.domain.TransferClaimRepository;
import com.vaultledger.ledger.LoanOperations;
import com.vaultledger.ledger.PositionLedger;
import com.vaultledger.verify.TransferVerifier;
import com.vaultledger.verify.VerifiedTransfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * Partner-originated loans on top of the user ledger. A partner never writes positions directly: every
 * change goes through {@link LoanOperations}, so partner and user paths share the same checks.
 * <p>
 * Borrow lifecycle: PENDING reservation, then borrow and disbursement, then ACTIVE. A rejection before the
 * vault borrow is broadcast removes the reservation; anything later leaves a FAILED record so the
 * partnerLoanId stays burned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PartnerLoanGateway {

    public static final String PARTNER_LOAN_NOT_FOUND = "PARTNER_LOAN_NOT_FOUND";

    private static final BigInteger BPS = BigInteger.valueOf(10_000);
    private static final List<PartnerLoanStatus> COUNTED_FOR_DAILY_LIMIT = List.of(
            PartnerLoanStatus.PENDING, PartnerLoanStatus.ACTIVE, PartnerLoanStatus.REPAID,
            PartnerLoanStatus.DEFAULTED, PartnerLoanStatus.LIQUIDATED);

    private final PartnerLoanRepository partnerLoanRepository;
    private final TransferClaimRepository transferClaimRepository;
    private final PartnerService partnerService;
    private final PositionLedger positionLedger;
    private final LoanOperations loanOperations;
    private final TransactionSubmitter transactionSubmitter;
    private final TransferVerifier transferVerifier;
    private final ChainProperties chainProperties;
    private final PartnerProperties partnerProperties;

    public Mono<PartnerLoan> borrow(Partner partner, PartnerBorrowCommand command) {
        return blocking(() -> reserve(partner, command))
                .flatMap(reserved -> blocking(() -> prepare(reserved))
                        .onErrorResume(e -> blocking(() -> release(reserved)).then(Mono.<PartnerLoan>error(e)))
                        .flatMap(loan -> loanOperations.borrow(loan.getUserWallet(), loan.getPositionId(),
                                        loan.getPrincipalAmount(), loan.getLoanDurationSeconds(), loan.getNumberOfInstallments())
                                .onErrorResume(e -> blocking(() -> abandon(loan, e)).then(Mono.<Position>error(e)))
                                .flatMap(position -> disburse(loan, position))));
    }

    public Mono<PartnerLoan> repayWithTransfer(Partner partner, TransferRepaymentCommand command) {
        if (command.transferTxHash() == null || command.transferTxHash().isBlank()) {
            return Mono.error(new ValidationException("transferTxHash is required"));
        }
        String txHash = command.transferTxHash().toLowerCase();
        return blocking(() -> {
            BigInteger amount = requirePositive("repaymentAmount", command.amount());
            String wallet = Addresses.normalize("userWallet", command.userWallet());
            PartnerLoan loan = requireActive(getLoan(partner, command.partnerLoanId()));
            if (!Addresses.same(wallet, loan.getUserWallet())) {
                throw AuthorizationException.forbidden("Loan " + loan.getPartnerLoanId() + " does not belong to " + wallet);
            }
            if (transferClaimRepository.existsById(txHash)) {
                throw StateException.conflict(StateException.TRANSFER_ALREADY_USED, "Transfer " + txHash + " was already credited");
            }
            positionLedger.checkRepayment(loan.getPositionId(), amount);
            return loan;
        }).flatMap(loan -> transferVerifier.verifyTransfer(txHash, loan.getUserWallet(), partner.getSettlementAddress(),
                        command.amount(), chainProperties.getStablecoinAddress())
                .flatMap(verified -> blocking(() -> claim(partner, loan, verified))
                        .then(loanOperations.repayFromTransfer(loan.getPositionId(), verified.amount(),
                                        verified.txHash(), verified.blockNumber())
                                .onErrorResume(e -> blocking(() -> unclaim(verified.txHash())).then(Mono.<Position>error(e))))
                        .flatMap(position -> blocking(() -> recordRepayment(loan, verified.amount(),
                                verified.txHash(), position)))));
    }

    /**
     * Repayment paid from the platform custody wallet on the user's behalf.
     */
    public Mono<PartnerLoan> repay(Partner partner, String partnerLoanId, BigInteger amount) {
        return blocking(() -> {
            requirePositive("repaymentAmount", amount);
            return requireActive(getLoan(partner, partnerLoanId));
        }).flatMap(loan -> loanOperations.repay(loan.getUserWallet(), loan.getPositionId(), amount)
                .flatMap(position -> blocking(() -> recordRepayment(loan, amount,
                        lastTxHash(position, AuditAction.REPAY), position))));
    }

    public PartnerLoan getLoan(Partner partner, String partnerLoanId) {
        return partnerLoanRepository.findByPartnerIdAndPartnerLoanId(partner.getPartnerId(), partnerLoanId)
                .orElseThrow(() -> new NotFoundException(PARTNER_LOAN_NOT_FOUND, "Partner loan not found: " + partnerLoanId));
    }

    /**
     * Loan by internal id. A loan of another partner is forbidden, not hidden.
     */
    public PartnerLoan getLoanById(Partner partner, String loanId) {
        PartnerLoan loan = partnerLoanRepository.findById(loanId)
                .orElseThrow(() -> new NotFoundException(PARTNER_LOAN_NOT_FOUND, "Partner loan not found: " + loanId));
        if (!loan.getPartnerId().equals(partner.getPartnerId())) {
            throw AuthorizationException.forbidden("Loan " + loanId + " belongs to another partner");
        }
        return loan;
    }

    public List<PartnerLoan> listLoans(Partner partner, String userWallet, PartnerLoanStatus status) {
        return partnerLoanRepository.findByPartnerIdOrderByCreatedAtDesc(partner.getPartnerId()).stream()
                .filter(l -> userWallet == null || Addresses.same(userWallet, l.getUserWallet()))
                .filter(l -> status == null || l.getStatus() == status)
                .toList();
    }

    public PartnerStats stats(Partner partner) {
        return partnerService.stats(partner.getPartnerId());
    }

    /**
     * Keeps ACTIVE partner loans in step with their position, whichever path changed it.
     */
    @EventListener
    public void onPositionChanged(PositionChangedEvent event) {
        List<PartnerLoan> loans = partnerLoanRepository.findByPositionId(event.positionId());
        for (PartnerLoan loan : loans) {
            if (loan.getStatus() != PartnerLoanStatus.ACTIVE) {
                continue;
            }
            try {
                mirror(loan, event);
            } catch (RuntimeException e) {
                log.warn("Partner loan {} not mirrored for position {} ({}): {}",
                        loan.getId(), event.positionId(), event.action(), e.getMessage());
            }
        }
    }

    private void mirror(PartnerLoan loan, PositionChangedEvent event) {
        PartnerLoanStatus next = switch (event.status()) {
            case REPAID -> PartnerLoanStatus.REPAID;
            case LIQUIDATED -> PartnerLoanStatus.LIQUIDATED;
            default -> event.action() == AuditAction.DEFAULT ? PartnerLoanStatus.DEFAULTED : PartnerLoanStatus.ACTIVE;
        };
        if (next == loan.getStatus() && event.outstandingDebt().equals(loan.getRemainingDebt())) {
            return;
        }
        loan.setRemainingDebt(event.outstandingDebt());
        loan.setStatus(next);
        loan.setUpdatedAt(Instant.now());
        partnerLoanRepository.save(loan);
        log.debug("Partner loan {} mirrored: status {}, remaining {}", loan.getId(), next, event.outstandingDebt());
    }

    private PartnerLoan reserve(Partner partner, PartnerBorrowCommand command) {
        if (command.partnerLoanId() == null || command.partnerLoanId().isBlank()) {
            throw new ValidationException("partnerLoanId is required");
        }
        requirePositive("amount", command.amount());
        Instant now = Instant.now();
        PartnerLoan loan = new PartnerLoan();
        loan.setPartnerId(partner.getPartnerId());
        loan.setPartnerLoanId(command.partnerLoanId());
        loan.setUserWallet(Addresses.normalize("userWallet", command.userWallet()));
        loan.setPrincipalAmount(command.amount());
        loan.setLoanDurationSeconds(command.loanDurationSeconds());
        loan.setNumberOfInstallments(command.numberOfInstallments());
        loan.setStatus(PartnerLoanStatus.PENDING);
        loan.setCreatedAt(now);
        loan.setUpdatedAt(now);
        try {
            return partnerLoanRepository.insert(loan);
        } catch (DuplicateKeyException e) {
            throw StateException.conflict(StateException.DUPLICATE_LOAN,
                    "Partner loan " + command.partnerLoanId() + " already exists");
        }
    }

    /**
     * Limits and position selection. Read-only apart from pinning the selected position on the reservation.
     */
    private PartnerLoan prepare(PartnerLoan loan) {
        Partner partner = partnerService.getPartner(loan.getPartnerId());
        BigInteger amount = loan.getPrincipalAmount();

        Instant windowStart = Instant.now().minusSeconds(partnerProperties.getDailyWindowSeconds());
        BigInteger borrowedToday = partnerLoanRepository
                .findByPartnerIdAndStatusInAndCreatedAtAfter(partner.getPartnerId(), COUNTED_FOR_DAILY_LIMIT, windowStart)
                .stream()
                .filter(l -> !l.getId().equals(loan.getId()))
                .map(PartnerLoan::getPrincipalAmount)
                .reduce(BigInteger.ZERO, BigInteger::add);
        if (borrowedToday.add(amount).compareTo(partner.getDailyBorrowLimit()) > 0) {
            throw new CapacityException(CapacityException.DAILY_LIMIT_EXCEEDED, "Daily borrow limit of "
                    + partner.getDailyBorrowLimit() + " exceeded (already " + borrowedToday + ")");
        }
        if (partner.getCurrentOutstanding().add(amount).compareTo(partner.getTotalBorrowLimit()) > 0) {
            throw new CapacityException(CapacityException.TOTAL_LIMIT_EXCEEDED, "Total borrow limit of "
                    + partner.getTotalBorrowLimit() + " exceeded (outstanding " + partner.getCurrentOutstanding() + ")");
        }

        Position position = positionLedger.getActivePositions(loan.getUserWallet()).stream()
                .filter(p -> !p.hasBorrowed())
                .filter(p -> positionLedger.healthOf(p).availableToBorrow().compareTo(amount) >= 0)
                .min(Comparator.comparing(Position::getPositionId))
                .orElseThrow(() -> new CapacityException(CapacityException.NO_ELIGIBLE_POSITION,
                        "No active unborrowed position of " + loan.getUserWallet() + " can cover " + amount));
        loan.setPositionId(position.getPositionId());
        loan.setUpdatedAt(Instant.now());
        return partnerLoanRepository.save(loan);
    }

    private Mono<PartnerLoan> disburse(PartnerLoan loan, Position position) {
        Partner partner = partnerService.getPartner(loan.getPartnerId());
        BigInteger fee = loan.getPrincipalAmount().multiply(BigInteger.valueOf(partner.getPlatformFeeBps())).divide(BPS);
        BigInteger net = loan.getPrincipalAmount().subtract(fee);
        String borrowTxHash = lastTxHash(position, AuditAction.BORROW);
        return transactionSubmitter.transfer(chainProperties.getStablecoinAddress(), partner.getSettlementAddress(), net)
                .onErrorResume(e -> {
                    log.error("Partner loan {} borrowed in tx {} but disbursement of {} to {} failed: {}",
                            loan.getPartnerLoanId(), borrowTxHash, net, partner.getSettlementAddress(), e.getMessage());
                    return blocking(() -> update(loan.getId(), l -> {
                        l.setBorrowTxHash(borrowTxHash);
                        l.setStatus(PartnerLoanStatus.FAILED);
                        l.setFailureReason("Disbursement failed: " + e.getMessage());
                    })).then(Mono.<SubmittedTx>error(e));
                })
                .flatMap(tx -> blocking(() -> {
                    PartnerLoan active = update(loan.getId(), l -> {
                        l.setBorrowTxHash(borrowTxHash);
                        l.setDisbursementTxHash(tx.txHash());
                        l.setPlatformFee(fee);
                        l.setNetDisbursed(net);
                        l.setRemainingDebt(positionLedger.outstandingDebt(position));
                        l.setStatus(PartnerLoanStatus.ACTIVE);
                    });
                    partnerService.recordBorrow(partner.getPartnerId(), loan.getPrincipalAmount());
                    log.info("Partner {} loan {} active: position {}, principal {}, fee {}, net {} in tx {}",
                            partner.getPartnerId(), loan.getPartnerLoanId(), loan.getPositionId(),
                            loan.getPrincipalAmount(), fee, net, tx.txHash());
                    return active;
                }));
    }

    private PartnerLoan release(PartnerLoan reservation) {
        partnerLoanRepository.deleteById(reservation.getId());
        log.debug("Reservation {} for partner loan {} released", reservation.getId(), reservation.getPartnerLoanId());
        return reservation;
    }

    /**
     * Ledger rejections happen before the vault call and free the key. A submission failure may have reached
     * the network, so the key stays burned.
     */
    private PartnerLoan abandon(PartnerLoan loan, Throwable cause) {
        if (cause instanceof VaultLedgerException && !(cause instanceof ChainSubmissionException)) {
            return release(loan);
        }
        log.warn("Partner loan {} failed after submission: {}", loan.getPartnerLoanId(), cause.getMessage());
        return update(loan.getId(), l -> {
            l.setStatus(PartnerLoanStatus.FAILED);
            l.setFailureReason(cause.getMessage());
        });
    }

    private TransferClaim claim(Partner partner, PartnerLoan loan, VerifiedTransfer verified) {
        try {
            return transferClaimRepository.insert(new TransferClaim(verified.txHash(), partner.getPartnerId(),
                    loan.getPartnerLoanId(), verified.amount(), Instant.now()));
        } catch (DuplicateKeyException e) {
            throw StateException.conflict(StateException.TRANSFER_ALREADY_USED,
                    "Transfer " + verified.txHash() + " was already credited");
        }
    }

    private String unclaim(String txHash) {
        transferClaimRepository.deleteById(txHash);
        return txHash;
    }

    private PartnerLoan recordRepayment(PartnerLoan loan, BigInteger amount, String txHash, Position position) {
        PartnerLoan updated = update(loan.getId(), l -> {
            l.getRepaymentHistory().add(new PartnerLoan.Repayment(amount, txHash, Instant.now(), RepaymentSource.PARTNER));
            l.setTotalRepaid(l.getTotalRepaid().add(amount));
            l.setRemainingDebt(positionLedger.outstandingDebt(position));
            if (position.getStatus() == PositionStatus.REPAID) {
                l.setStatus(PartnerLoanStatus.REPAID);
            }
        });
        partnerService.recordRepayment(loan.getPartnerId(), amount);
        log.info("Partner {} loan {} repaid {} (tx {}), remaining {}",
                loan.getPartnerId(), loan.getPartnerLoanId(), amount, txHash, updated.getRemainingDebt());
        return updated;
    }

    /** Reloads before writing: the position listener may have saved the loan in between. */
    private PartnerLoan update(String loanId, Consumer<PartnerLoan> change) {
        PartnerLoan loan = partnerLoanRepository.findById(loanId)
                .orElseThrow(() -> new NotFoundException(PARTNER_LOAN_NOT_FOUND, "Partner loan not found: " + loanId));
        change.accept(loan);
        loan.setUpdatedAt(Instant.now());
        return partnerLoanRepository.save(loan);
    }

    private static PartnerLoan requireActive(PartnerLoan loan) {
        if (loan.getStatus() != PartnerLoanStatus.ACTIVE) {
            throw new StateException(StateException.INVALID_STATUS,
                    "Partner loan " + loan.getPartnerLoanId() + " is " + loan.getStatus());
        }
        return loan;
    }

    private static BigInteger requirePositive(String field, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT, field + " must be greater than zero");
        }
        return amount;
    }

    private static String lastTxHash(Position position, AuditAction action) {
        List<AuditEntry> history = position.getHistory();
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).getAction() == action) {
                return history.get(i).getTxHash();
            }
        }
        return null;
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
