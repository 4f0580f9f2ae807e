package com.vaultledger.ledger;

import com.vaultledger.common.Addresses;
import com.vaultledger.common.CapacityException;
import com.vaultledger.common.KeyedLocks;
import com.vaultledger.common.NotFoundException;
import com.vaultledger.common.StateException;
import com.vaultledger.common.ValidationException;
import com.vaultledger.domain.AuditAction;
import com.vaultledger.domain.AuditEntry;
import com.vaultledger.domain.ConfirmationState;
import com.vaultledger.domain.HealthStatus;
import com.vaultledger.domain.Installment;
import com.vaultledger.domain.Position;
import com.vaultledger.domain.PositionChangedEvent;
import com.vaultledger.domain.PositionRepository;
import com.vaultledger.domain.PositionStatus;
import com.vaultledger.health.HealthEvaluator;
import com.vaultledger.health.HealthSnapshot;
import com.vaultledger.schedule.PaymentAllocation;
import com.vaultledger.schedule.RepaymentScheduler;
import com.vaultledger.schedule.ScheduleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Sole writer of the {@code positions} collection.
 * <p>
 * Every mutation runs under the position's lock, re-reads the document and saves it with its {@code @Version},
 * so concurrent writers on one instance serialize and writers on other instances fail instead of overwriting.
 * Mutations carrying a tx hash already present in the history for the same action are no-ops, except that a
 * CONFIRMED reference upgrades a TENTATIVE entry. A {@link PositionChangedEvent} is published after each save.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PositionLedger {

    private static final Set<PositionStatus> WITHDRAWABLE = EnumSet.of(PositionStatus.ACTIVE, PositionStatus.REPAID);

    private final PositionRepository positionRepository;
    private final HealthEvaluator healthEvaluator;
    private final RepaymentScheduler repaymentScheduler;
    private final ScheduleProperties scheduleProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final KeyedLocks<Long> locks = new KeyedLocks<>();

    /**
     * Mirrors a collateral lock. Replaying the same creation transaction returns the stored position.
     *
     * @throws ValidationException when the lock reference (tx hash and block) is missing or amounts are invalid
     * @throws StateException      POSITION_EXISTS (409) when the id is already taken by another transaction
     */
    public Position createPosition(NewPosition request, TxRef ref) {
        if (ref == null || ref.txHash() == null || ref.blockNumber() == null) {
            throw new ValidationException("Position creation requires a mined collateral lock (tx hash and block)");
        }
        requirePositive("collateralAmount", request.collateralAmount());
        requirePositive("valuationUsd", request.valuationUsd());
        Objects.requireNonNull(request.collateralClass(), "collateralClass");
        String owner = Addresses.normalize("owner", request.owner());
        String token = Addresses.normalize("collateralToken", request.collateralToken());

        return locks.withLock(request.positionId(), () -> {
            Optional<Position> existing = positionRepository.findById(request.positionId());
            if (existing.isPresent()) {
                Position position = existing.get();
                if (ref.txHash().equalsIgnoreCase(position.getCreationTxHash())) {
                    return confirmIfNeeded(position, AuditAction.DEPOSIT, ref);
                }
                throw StateException.conflict(StateException.POSITION_EXISTS,
                        "Position " + request.positionId() + " already exists from tx " + position.getCreationTxHash());
            }
            Instant now = Instant.now();
            Position position = new Position();
            position.setPositionId(request.positionId());
            position.setOwner(owner);
            position.setCollateralToken(token);
            position.setCollateralClass(request.collateralClass());
            position.setCollateralAmount(request.collateralAmount());
            position.setValuationUsd(request.valuationUsd());
            position.setStatus(PositionStatus.ACTIVE);
            position.setCreationTxHash(ref.txHash());
            position.setCreationBlock(ref.blockNumber());
            position.setCreatedAt(now);
            position.setUpdatedAt(now);
            position.appendHistory(new AuditEntry(AuditAction.DEPOSIT, request.collateralAmount(), ref.txHash(),
                    ref.blockNumber(), ref.confirmation(), now));
            refreshHealth(position, now);
            Position saved = positionRepository.save(position);
            log.info("Position {} created for {}: {} of {} valued {} ({})", saved.getPositionId(), owner,
                    request.collateralAmount(), token, request.valuationUsd(), ref.confirmation());
            publish(saved, AuditAction.DEPOSIT, request.collateralAmount(), ref);
            return saved;
        });
    }

    /**
     * Opens the single loan of an ACTIVE position and generates its installment plan.
     *
     * @throws StateException    INVALID_STATUS unless ACTIVE; ALREADY_BORROWED when a loan was opened before
     * @throws CapacityException LTV_EXCEEDED when amount plus existing debt exceeds the LTV cap
     */
    public Position recordBorrow(long positionId, BigInteger amount, long loanDurationSeconds, int numberOfInstallments,
                                 TxRef ref) {
        return openLoan(positionId, amount, loanDurationSeconds, numberOfInstallments, ref, true);
    }

    /**
     * Mirrors a borrow the chain has already executed. Status and single-loan rules still hold; an LTV breach
     * against the ledger's valuation is logged instead of rejected, since the debt exists either way.
     *
     * @throws StateException INVALID_STATUS unless ACTIVE; ALREADY_BORROWED when a loan was opened before
     */
    public Position recordChainBorrow(long positionId, BigInteger amount, long loanDurationSeconds,
                                      int numberOfInstallments, TxRef ref) {
        return openLoan(positionId, amount, loanDurationSeconds, numberOfInstallments, ref, false);
    }

    private Position openLoan(long positionId, BigInteger amount, long loanDurationSeconds, int numberOfInstallments,
                              TxRef ref, boolean enforceCapacity) {
        requirePositive("amount", amount);
        return mutate(positionId, AuditAction.BORROW, amount, ref, position -> {
            checkLoanOpenable(position);
            if (enforceCapacity) {
                checkCapacity(position, amount);
            } else if (!withinCapacity(position, amount)) {
                log.warn("Position {} chain borrow of {} exceeds LTV capacity at valuation {}; recorded as executed",
                        positionId, amount, position.getValuationUsd());
            }
            Instant start = Instant.now();
            List<Installment> installments = repaymentScheduler.generate(amount, loanDurationSeconds, numberOfInstallments, start);
            position.setPrincipalBorrowed(position.getPrincipalBorrowed().add(amount));
            position.setLoanDurationSeconds(loanDurationSeconds);
            position.setNumberOfInstallments(numberOfInstallments);
            position.setInstallmentIntervalSeconds(repaymentScheduler.intervalSeconds(loanDurationSeconds, numberOfInstallments));
            position.setLoanStartedAt(start);
            position.setInstallments(new ArrayList<>(installments));
            log.info("Position {} borrowed {} over {} installment(s)", positionId, amount, numberOfInstallments);
        });
    }

    /**
     * Applies a repayment interest-first across unpaid installments in due order; REPAID once nothing is left.
     *
     * @throws StateException      INVALID_STATUS unless ACTIVE with an open loan
     * @throws ValidationException when amount exceeds the remaining scheduled obligation
     */
    public Position recordRepayment(long positionId, BigInteger amount, TxRef ref) {
        requirePositive("amount", amount);
        return mutate(positionId, AuditAction.REPAY, amount, ref, position -> {
            checkRepayable(position, amount);
            PaymentAllocation allocation = repaymentScheduler.applyPayment(position.getInstallments(), amount, Instant.now());
            position.setPrincipalRepaid(position.getPrincipalRepaid().add(allocation.principal()));
            position.setInterestRepaid(position.getInterestRepaid().add(allocation.interest()));
            position.setTotalRepaid(position.getTotalRepaid().add(amount));
            if (repaymentScheduler.remainingObligation(position.getInstallments()).signum() == 0) {
                position.setStatus(PositionStatus.REPAID);
            }
            log.info("Position {} repaid {} (principal {}, interest {}), installments paid {}", positionId, amount,
                    allocation.principal(), allocation.interest(), allocation.installmentsPaid());
        });
    }

    /**
     * Releases collateral of a debt-free position; CLOSED once no collateral remains. Valuation scales with the
     * remaining amount.
     *
     * @throws StateException      INVALID_STATUS unless ACTIVE or REPAID; OUTSTANDING_DEBT while any debt remains
     * @throws ValidationException when amount exceeds the locked collateral
     */
    public Position recordWithdrawal(long positionId, BigInteger amount, TxRef ref) {
        requirePositive("amount", amount);
        return mutate(positionId, AuditAction.WITHDRAW, amount, ref, position -> {
            checkWithdrawable(position, amount);
            BigInteger before = position.getCollateralAmount();
            BigInteger remaining = before.subtract(amount);
            position.setCollateralAmount(remaining);
            position.setValuationUsd(position.getValuationUsd().multiply(remaining).divide(before));
            if (remaining.signum() == 0) {
                position.setStatus(PositionStatus.CLOSED);
            }
            log.info("Position {} withdrew {}, remaining collateral {}", positionId, amount, remaining);
        });
    }

    /**
     * Records a liquidation. Terminal: a LIQUIDATED position accepts no further loan operation.
     *
     * @throws StateException INVALID_STATUS unless ACTIVE
     */
    public Position markLiquidated(long positionId, String marketplaceListingId, BigInteger debtAmount, TxRef ref) {
        return mutate(positionId, AuditAction.LIQUIDATE, debtAmount, ref, position -> {
            if (position.getStatus() != PositionStatus.ACTIVE) {
                throw new StateException(StateException.INVALID_STATUS,
                        "Position " + positionId + " cannot be liquidated from " + position.getStatus());
            }
            position.setStatus(PositionStatus.LIQUIDATED);
            position.setLiquidationTxHash(ref.txHash());
            position.setMarketplaceListingId(marketplaceListingId);
            position.setLiquidatedAt(Instant.now());
            if (debtAmount != null) {
                position.setChainReportedDebt(debtAmount);
            }
            log.warn("Position {} liquidated, listing {}, debt {}", positionId, marketplaceListingId, debtAmount);
        });
    }

    /**
     * @throws StateException INVALID_STATUS unless LIQUIDATED
     */
    public Position recordLiquidationSettlement(long positionId, BigInteger debtRecovered, TxRef ref) {
        return mutate(positionId, AuditAction.LIQUIDATION_SETTLED, debtRecovered, ref, position -> {
            if (position.getStatus() != PositionStatus.LIQUIDATED) {
                throw new StateException(StateException.INVALID_STATUS,
                        "Position " + positionId + " is not liquidated: " + position.getStatus());
            }
            position.setDebtRecovered(debtRecovered);
            position.setSettledAt(Instant.now());
            position.setChainReportedDebt(BigInteger.ZERO);
            log.info("Position {} liquidation settled, recovered {}", positionId, debtRecovered);
        });
    }

    /**
     * Marks installments of an ACTIVE position overdue when their due date is before {@code cutoff}, and flags the
     * position defaulted once the missed count reaches the configured maximum. Never liquidates.
     */
    public MissedInstallments markMissedInstallments(long positionId, Instant cutoff) {
        return locks.withLock(positionId, () -> {
            Position position = load(positionId);
            if (position.getStatus() != PositionStatus.ACTIVE || position.getInstallments().isEmpty()) {
                return new MissedInstallments(positionId, List.of(), position.getMissedPayments(), false);
            }
            List<Installment> missed = repaymentScheduler.markOverdue(position.getInstallments(), cutoff);
            if (missed.isEmpty()) {
                return new MissedInstallments(positionId, List.of(), position.getMissedPayments(), false);
            }
            Instant now = Instant.now();
            position.setMissedPayments(position.getMissedPayments() + missed.size());
            for (Installment installment : missed) {
                position.appendHistory(new AuditEntry(AuditAction.MISSED_PAYMENT, installment.remaining(), null, null,
                        ConfirmationState.CONFIRMED, now));
            }
            boolean defaultedNow = !position.isDefaulted()
                    && position.getMissedPayments() >= scheduleProperties.getMaxMissedPayments();
            if (defaultedNow) {
                position.setDefaulted(true);
                position.appendHistory(new AuditEntry(AuditAction.DEFAULT, null, null, null, ConfirmationState.CONFIRMED, now));
            }
            refreshHealth(position, now);
            position.setUpdatedAt(now);
            Position saved = positionRepository.save(position);
            List<Integer> numbers = missed.stream().map(Installment::getNumber).toList();
            log.warn("Position {} missed installment(s) {}; {} missed in total", positionId, numbers, saved.getMissedPayments());
            publish(saved, defaultedNow ? AuditAction.DEFAULT : AuditAction.MISSED_PAYMENT, null, TxRef.offChain());
            return new MissedInstallments(positionId, numbers, saved.getMissedPayments(), defaultedNow);
        });
    }

    /**
     * Sets the missed-payment count reported by the vault (absolute, not a delta).
     */
    public Position applyChainMissedPayments(long positionId, int missedPayments, TxRef ref) {
        return mutate(positionId, AuditAction.MISSED_PAYMENT, BigInteger.valueOf(missedPayments), ref,
                position -> position.setMissedPayments(missedPayments));
    }

    public Position markDefaulted(long positionId, TxRef ref) {
        return mutate(positionId, AuditAction.DEFAULT, null, ref, position -> {
            position.setDefaulted(true);
            log.warn("Position {} defaulted", positionId);
        });
    }

    /**
     * Replaces the collateral valuation and recomputes health. Flags but never liquidates.
     *
     * @throws StateException INVALID_STATUS for LIQUIDATED or CLOSED positions
     */
    public Position revalue(long positionId, BigInteger valuationUsd) {
        requirePositive("valuationUsd", valuationUsd);
        return mutate(positionId, AuditAction.REVALUE, valuationUsd, TxRef.offChain(), position -> {
            if (!WITHDRAWABLE.contains(position.getStatus())) {
                throw new StateException(StateException.INVALID_STATUS,
                        "Position " + positionId + " cannot be revalued in status " + position.getStatus());
            }
            position.setValuationUsd(valuationUsd);
        });
    }

    /**
     * Marks every TENTATIVE history entry written by {@code txHash} as CONFIRMED.
     *
     * @return false when no position references the transaction
     */
    public boolean confirm(String txHash, long blockNumber) {
        Optional<Position> match = positionRepository.findFirstByHistoryTxHash(txHash.toLowerCase());
        if (match.isEmpty()) {
            return false;
        }
        long positionId = match.get().getPositionId();
        locks.withLock(positionId, () -> {
            Position position = load(positionId);
            Instant now = Instant.now();
            boolean changed = false;
            for (AuditEntry entry : position.getHistory()) {
                if (txHash.equalsIgnoreCase(entry.getTxHash()) && entry.getConfirmation() == ConfirmationState.TENTATIVE) {
                    entry.setConfirmation(ConfirmationState.CONFIRMED);
                    entry.setBlockNumber(blockNumber);
                    entry.setConfirmedAt(now);
                    changed = true;
                }
            }
            if (changed) {
                position.refreshSyncState();
                position.setUpdatedAt(now);
                positionRepository.save(position);
                log.info("Position {} confirmed tx {} at block {}", positionId, txHash, blockNumber);
            }
        });
        return true;
    }

    /**
     * Applies absolute totals reported by a vault event. Null values are left untouched. Differences against the
     * derived state are logged; the derived debt stays the bookkeeping source, the reported one is kept alongside.
     */
    public Position applyChainTotals(long positionId, BigInteger remainingDebt, BigInteger remainingCollateral) {
        return locks.withLock(positionId, () -> {
            Position position = load(positionId);
            boolean changed = false;
            if (remainingDebt != null && !remainingDebt.equals(position.getChainReportedDebt())) {
                BigInteger derived = outstandingDebt(position);
                if (derived.compareTo(remainingDebt) != 0) {
                    log.warn("Position {} debt drift: chain reports {}, ledger derives {}", positionId, remainingDebt, derived);
                }
                position.setChainReportedDebt(remainingDebt);
                changed = true;
            }
            if (remainingCollateral != null && remainingCollateral.compareTo(position.getCollateralAmount()) != 0) {
                log.warn("Position {} collateral drift: chain reports {}, ledger has {}", positionId, remainingCollateral,
                        position.getCollateralAmount());
                position.setCollateralAmount(remainingCollateral);
                if (remainingCollateral.signum() == 0 && WITHDRAWABLE.contains(position.getStatus())
                        && outstandingDebt(position).signum() == 0) {
                    position.setStatus(PositionStatus.CLOSED);
                }
                changed = true;
            }
            if (!changed) {
                return position;
            }
            Instant now = Instant.now();
            refreshHealth(position, now);
            position.setUpdatedAt(now);
            return positionRepository.save(position);
        });
    }

    /**
     * Recomputes the stored health snapshot from live state. Only the indexed scan fields change.
     */
    public HealthSnapshot refreshHealth(long positionId) {
        return locks.withLock(positionId, () -> {
            Position position = load(positionId);
            HealthStatus before = position.getHealthStatus();
            BigInteger hfBefore = position.getHealthFactor();
            HealthSnapshot snapshot = refreshHealth(position, Instant.now());
            if (before != snapshot.status() || !Objects.equals(hfBefore, snapshot.healthFactor())) {
                positionRepository.save(position);
            }
            return snapshot;
        });
    }

    public Position getPosition(long positionId) {
        return load(positionId);
    }

    public List<Position> getUserPositions(String owner) {
        return positionRepository.findByOwnerOrderByCreatedAtDesc(Addresses.normalize("owner", owner));
    }

    public List<Position> getActivePositions(String owner) {
        return positionRepository.findByOwnerAndStatusOrderByCreatedAtDesc(Addresses.normalize("owner", owner),
                PositionStatus.ACTIVE);
    }

    public List<Position> getAllPositions() {
        return positionRepository.findAll();
    }

    public List<Position> getPositionsByStatus(PositionStatus status) {
        return positionRepository.findByStatus(status);
    }

    /**
     * ACTIVE positions whose live health factor is below the liquidation threshold.
     */
    public List<Position> getLiquidatablePositions() {
        return activeWithLiveStatus(HealthStatus.LIQUIDATABLE);
    }

    public List<Position> getWarningPositions() {
        return activeWithLiveStatus(HealthStatus.WARNING);
    }

    public List<Position> getOpenPositionsByCollateral(String collateralToken) {
        return positionRepository.findByCollateralTokenAndStatusIn(collateralToken.toLowerCase(), WITHDRAWABLE);
    }

    public HealthSnapshot healthOf(Position position) {
        return healthEvaluator.evaluate(position.getCollateralClass(), position.getValuationUsd(), outstandingDebt(position));
    }

    /**
     * (principalBorrowed - principalRepaid) + (accrued interest - interestRepaid), accrued interest being the
     * interest of installments that are due or already partly paid.
     */
    public BigInteger outstandingDebt(Position position) {
        if (!position.hasBorrowed()) {
            return BigInteger.ZERO;
        }
        BigInteger principal = position.getPrincipalBorrowed().subtract(position.getPrincipalRepaid());
        BigInteger interest = repaymentScheduler.accruedInterest(position.getInstallments(), Instant.now())
                .subtract(position.getInterestRepaid());
        return principal.add(interest.max(BigInteger.ZERO));
    }

    /**
     * Read-only pre-check of {@link #recordBorrow}, used before anything is submitted on-chain.
     */
    public Position checkBorrow(long positionId, BigInteger amount, long loanDurationSeconds, int numberOfInstallments) {
        requirePositive("amount", amount);
        repaymentScheduler.intervalSeconds(loanDurationSeconds, numberOfInstallments);
        Position position = load(positionId);
        checkBorrowable(position, amount);
        return position;
    }

    public Position checkRepayment(long positionId, BigInteger amount) {
        requirePositive("amount", amount);
        Position position = load(positionId);
        checkRepayable(position, amount);
        return position;
    }

    public Position checkWithdrawal(long positionId, BigInteger amount) {
        requirePositive("amount", amount);
        Position position = load(positionId);
        checkWithdrawable(position, amount);
        return position;
    }

    private void checkBorrowable(Position position, BigInteger amount) {
        checkLoanOpenable(position);
        checkCapacity(position, amount);
    }

    private void checkLoanOpenable(Position position) {
        if (position.getStatus() != PositionStatus.ACTIVE) {
            throw new StateException(StateException.INVALID_STATUS,
                    "Position " + position.getPositionId() + " is not active: " + position.getStatus());
        }
        if (position.hasBorrowed()) {
            throw new StateException(StateException.ALREADY_BORROWED,
                    "Position " + position.getPositionId() + " already has a loan");
        }
    }

    private boolean withinCapacity(Position position, BigInteger amount) {
        return healthEvaluator.canBorrow(position.getCollateralClass(), position.getValuationUsd(),
                outstandingDebt(position), amount);
    }

    private void checkCapacity(Position position, BigInteger amount) {
        if (!withinCapacity(position, amount)) {
            BigInteger existingDebt = outstandingDebt(position);
            BigInteger max = healthEvaluator.maxBorrowable(position.getCollateralClass(), position.getValuationUsd());
            throw new CapacityException(CapacityException.LTV_EXCEEDED,
                    "Borrow of " + amount + " exceeds LTV capacity " + max.subtract(existingDebt).max(BigInteger.ZERO)
                            + " for position " + position.getPositionId());
        }
    }

    private void checkRepayable(Position position, BigInteger amount) {
        if (position.getStatus() != PositionStatus.ACTIVE || !position.hasBorrowed()) {
            throw new StateException(StateException.INVALID_STATUS,
                    "Position " + position.getPositionId() + " has no open loan (" + position.getStatus() + ")");
        }
        BigInteger obligation = repaymentScheduler.remainingObligation(position.getInstallments());
        if (amount.compareTo(obligation) > 0) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT,
                    "Repayment " + amount + " exceeds remaining obligation " + obligation);
        }
    }

    private void checkWithdrawable(Position position, BigInteger amount) {
        if (!WITHDRAWABLE.contains(position.getStatus())) {
            throw new StateException(StateException.INVALID_STATUS,
                    "Position " + position.getPositionId() + " cannot release collateral in status " + position.getStatus());
        }
        BigInteger debt = outstandingDebt(position);
        if (debt.signum() > 0) {
            throw new StateException(StateException.OUTSTANDING_DEBT,
                    "Position " + position.getPositionId() + " still owes " + debt);
        }
        if (amount.compareTo(position.getCollateralAmount()) > 0) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT,
                    "Withdrawal " + amount + " exceeds collateral " + position.getCollateralAmount());
        }
    }

    private Position mutate(long positionId, AuditAction action, BigInteger amount, TxRef ref, Consumer<Position> change) {
        return locks.withLock(positionId, () -> {
            Position position = load(positionId);
            if (ref.txHash() != null && position.findHistory(ref.txHash(), action).isPresent()) {
                return confirmIfNeeded(position, action, ref);
            }
            change.accept(position);
            Instant now = Instant.now();
            position.appendHistory(new AuditEntry(action, amount, ref.txHash(), ref.blockNumber(), ref.confirmation(), now));
            refreshHealth(position, now);
            position.setUpdatedAt(now);
            Position saved = positionRepository.save(position);
            publish(saved, action, amount, ref);
            return saved;
        });
    }

    private Position confirmIfNeeded(Position position, AuditAction action, TxRef ref) {
        AuditEntry entry = position.findHistory(ref.txHash(), action).orElseThrow();
        if (!ref.isConfirmed() || entry.getConfirmation() == ConfirmationState.CONFIRMED) {
            log.debug("Position {}: {} from tx {} already recorded", position.getPositionId(), action, ref.txHash());
            return position;
        }
        Instant now = Instant.now();
        entry.setConfirmation(ConfirmationState.CONFIRMED);
        entry.setBlockNumber(ref.blockNumber());
        entry.setConfirmedAt(now);
        position.refreshSyncState();
        position.setUpdatedAt(now);
        Position saved = positionRepository.save(position);
        log.info("Position {}: {} from tx {} confirmed", position.getPositionId(), action, ref.txHash());
        return saved;
    }

    private HealthSnapshot refreshHealth(Position position, Instant now) {
        HealthSnapshot snapshot = healthOf(position);
        position.setHealthFactor(snapshot.healthFactor());
        position.setHealthStatus(snapshot.status());
        position.setHealthEvaluatedAt(now);
        return snapshot;
    }

    private List<Position> activeWithLiveStatus(HealthStatus status) {
        return positionRepository.findByStatus(PositionStatus.ACTIVE).stream()
                .filter(p -> healthOf(p).status() == status)
                .toList();
    }

    private void publish(Position position, AuditAction action, BigInteger amount, TxRef ref) {
        applicationEventPublisher.publishEvent(new PositionChangedEvent(position.getPositionId(), position.getOwner(),
                action, position.getStatus(), outstandingDebt(position), amount, ref.txHash()));
    }

    private Position load(long positionId) {
        return positionRepository.findById(positionId)
                .orElseThrow(() -> new NotFoundException(NotFoundException.POSITION_NOT_FOUND, "Position not found: " + positionId));
    }

    private static void requirePositive(String field, BigInteger value) {
        if (value == null || value.signum() <= 0) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT, field + " must be greater than zero");
        }
    }
}
