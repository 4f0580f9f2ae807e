package com.vaultledger.reconcile;

import com.vaultledger.asset.CollateralAssetService;
import com.vaultledger.common.Bytes32Codec;
import com.vaultledger.common.RetryPolicy;
import com.vaultledger.common.ValidationException;
import com.vaultledger.config.AsyncConfig;
import com.vaultledger.domain.AppliedEvent;
import com.vaultledger.domain.AppliedEventRepository;
import com.vaultledger.domain.AuditAction;
import com.vaultledger.domain.ChainEvent;
import com.vaultledger.domain.ChainEventRepository;
import com.vaultledger.domain.ChainEventStatus;
import com.vaultledger.domain.CollateralClass;
import com.vaultledger.domain.Position;
import com.vaultledger.domain.PositionStatus;
import com.vaultledger.domain.VaultEventType;
import com.vaultledger.ledger.NewPosition;
import com.vaultledger.ledger.PositionLedger;
import com.vaultledger.ledger.TxRef;
import com.vaultledger.schedule.RepaymentScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Applies queued chain events to the mirror.
 * <p>
 * Due events are grouped by ordering key. Groups run in parallel on the reconcile executor; inside a group events
 * run one by one in (blockNumber, logIndex) order and the group stops at its first failure, so no event overtakes
 * an earlier one of the same position, asset or token. A group whose earlier event is waiting for a retry or is
 * dead-lettered does not run at all.
 * <p>
 * Every handler is replay-safe: position mutations are deduped by tx hash in the audit trail, totals are set
 * absolutely, and each side of a Transfer delta claims its own {@link AppliedEvent} row before touching a balance.
 */
@Service
@Slf4j
public class EventReconciliationProcessor {

    private static final Comparator<ChainEvent> CHAIN_ORDER =
            Comparator.comparingLong(ChainEvent::getBlockNumber).thenComparingInt(ChainEvent::getLogIndex);

    enum Outcome { APPLIED, DUPLICATE, IGNORED }

    private final ChainEventRepository chainEventRepository;
    private final AppliedEventRepository appliedEventRepository;
    private final PositionLedger positionLedger;
    private final RepaymentScheduler repaymentScheduler;
    private final CollateralAssetService collateralAssetService;
    private final VaultLogDecoder decoder;
    private final ReconcileProperties properties;
    private final RetryPolicy retryPolicy;
    private final Executor reconcileExecutor;

    public EventReconciliationProcessor(ChainEventRepository chainEventRepository,
                                        AppliedEventRepository appliedEventRepository,
                                        PositionLedger positionLedger,
                                        RepaymentScheduler repaymentScheduler,
                                        CollateralAssetService collateralAssetService,
                                        VaultLogDecoder decoder,
                                        ReconcileProperties properties,
                                        @Qualifier(ReconcileConfig.RECONCILE_RETRY_POLICY) RetryPolicy retryPolicy,
                                        @Qualifier(AsyncConfig.RECONCILE_EXECUTOR) Executor reconcileExecutor) {
        this.chainEventRepository = chainEventRepository;
        this.appliedEventRepository = appliedEventRepository;
        this.positionLedger = positionLedger;
        this.repaymentScheduler = repaymentScheduler;
        this.collateralAssetService = collateralAssetService;
        this.decoder = decoder;
        this.properties = properties;
        this.retryPolicy = retryPolicy;
        this.reconcileExecutor = reconcileExecutor;
    }

    /**
     * One processing pass over due events.
     *
     * @return events applied in this pass
     */
    public int processDue() {
        List<ChainEvent> due = chainEventRepository.findDue(Instant.now(), properties.getBatchSize());
        if (due.isEmpty()) {
            return 0;
        }
        Map<String, List<ChainEvent>> groups = due.stream()
                .collect(Collectors.groupingBy(ChainEvent::getOrderingKey, LinkedHashMap::new, Collectors.toList()));
        List<CompletableFuture<Integer>> runs = groups.values().stream()
                .map(group -> CompletableFuture.supplyAsync(() -> processGroup(group), reconcileExecutor))
                .toList();
        int applied = runs.stream().mapToInt(CompletableFuture::join).sum();
        log.info("Reconciliation pass: {} of {} due event(s) applied across {} group(s)", applied, due.size(), groups.size());
        return applied;
    }

    int processGroup(List<ChainEvent> group) {
        List<ChainEvent> ordered = group.stream().sorted(CHAIN_ORDER).toList();
        ChainEvent first = ordered.get(0);
        List<ChainEvent> blockers = chainEventRepository.findBlockedBefore(first.getOrderingKey(),
                first.getBlockNumber(), first.getLogIndex());
        if (!blockers.isEmpty()) {
            log.debug("Group {} waits for earlier event {} ({})", first.getOrderingKey(),
                    blockers.get(0).getEventKey(), blockers.get(0).getStatus());
            return 0;
        }
        int applied = 0;
        for (ChainEvent event : ordered) {
            try {
                Outcome outcome = apply(event);
                markApplied(event);
                if (outcome == Outcome.APPLIED) {
                    applied++;
                    log.info("Applied {} {} (block {})", event.getType(), event.getEventKey(), event.getBlockNumber());
                } else if (outcome == Outcome.IGNORED) {
                    log.info("Event {} decodes to nothing the ledger tracks; acknowledged", event.getEventKey());
                } else {
                    log.debug("Event {} was already applied", event.getEventKey());
                }
            } catch (RuntimeException e) {
                markFailed(event, e);
                break;
            }
        }
        return applied;
    }

    Outcome apply(ChainEvent event) {
        return switch (event.getType()) {
            case POSITION_CREATED -> positionCreated(event);
            case USDC_BORROWED -> borrowed(event);
            case REPAYMENT_PLAN_CREATED -> planCreated(event);
            case LOAN_REPAID -> repaid(event);
            case COLLATERAL_WITHDRAWN -> withdrawn(event);
            case MISSED_PAYMENT_MARKED -> missedPaymentMarked(event);
            case POSITION_DEFAULTED -> defaulted(event);
            case POSITION_LIQUIDATED -> liquidated(event);
            case LIQUIDATION_SETTLED -> liquidationSettled(event);
            case ASSET_REGISTERED -> assetRegistered(event);
            case TOKEN_SUITE_DEPLOYED -> tokenSuiteDeployed(event);
            case TRANSFER -> transfer(event);
            case UNDECODED -> undecoded(event);
        };
    }

    /**
     * A requeued raw log is decoded again; on success the entry takes the decoded shape and is applied as such.
     */
    private Outcome undecoded(ChainEvent event) {
        Optional<ChainEvent> decoded = decoder.redecode(event);
        if (decoded.isEmpty()) {
            return Outcome.IGNORED;
        }
        ChainEvent fresh = decoded.get();
        if (!fresh.getOrderingKey().equals(event.getOrderingKey())) {
            log.warn("Event {} re-decoded under {} instead of {}", event.getEventKey(), fresh.getOrderingKey(),
                    event.getOrderingKey());
        }
        event.setType(fresh.getType());
        event.setOrderingKey(fresh.getOrderingKey());
        event.setPositionId(fresh.getPositionId());
        event.setPayload(fresh.getPayload());
        return apply(event);
    }

    private Outcome positionCreated(ChainEvent event) {
        positionLedger.createPosition(new NewPosition(
                event.getPositionId(),
                event.arg("user"),
                event.arg("collateralToken"),
                CollateralClass.fromOnChainCode(Integer.parseInt(event.arg("tokenType"))),
                uint(event, "collateralAmount"),
                uint(event, "tokenValueUSD")), ref(event));
        return Outcome.APPLIED;
    }

    /**
     * The plan parameters come from the RepaymentPlanCreated log of the same transaction; until that log is queued
     * the event is retried. The chain already executed the borrow, so the ledger's LTV gate does not apply.
     */
    private Outcome borrowed(ChainEvent event) {
        ChainEvent plan = chainEventRepository.findFirstByTxHashAndType(event.getTxHash(), VaultEventType.REPAYMENT_PLAN_CREATED)
                .orElseThrow(() -> new IllegalStateException("Repayment plan of " + event.getTxHash() + " not ingested yet"));
        positionLedger.recordChainBorrow(event.getPositionId(), uint(event, "amount"),
                Long.parseLong(plan.arg("loanDuration")), Integer.parseInt(plan.arg("numberOfInstallments")), ref(event));
        positionLedger.applyChainTotals(event.getPositionId(), uint(event, "totalDebt"), null);
        return Outcome.APPLIED;
    }

    private Outcome planCreated(ChainEvent event) {
        Position position = positionLedger.getPosition(event.getPositionId());
        long interval = Long.parseLong(event.arg("installmentInterval"));
        if (position.getInstallmentIntervalSeconds() != null && position.getInstallmentIntervalSeconds() != interval) {
            log.warn("Position {} installment interval drift: chain {}s, ledger {}s", event.getPositionId(), interval,
                    position.getInstallmentIntervalSeconds());
        }
        return Outcome.APPLIED;
    }

    /**
     * A repayment the ledger has not seen yet is capped at the remaining scheduled obligation; the chain's absolute
     * remaining debt is recorded next to it either way.
     */
    private Outcome repaid(ChainEvent event) {
        Position position = positionLedger.getPosition(event.getPositionId());
        BigInteger amountPaid = uint(event, "amountPaid");
        boolean known = position.findHistory(event.getTxHash(), AuditAction.REPAY).isPresent();
        BigInteger amount = known
                ? amountPaid
                : amountPaid.min(repaymentScheduler.remainingObligation(position.getInstallments()));
        if (known || (amount.signum() > 0 && position.getStatus() == PositionStatus.ACTIVE)) {
            if (amount.compareTo(amountPaid) < 0) {
                log.warn("Position {} repayment {} capped to remaining obligation {}", event.getPositionId(), amountPaid, amount);
            }
            positionLedger.recordRepayment(event.getPositionId(), amount, ref(event));
        }
        positionLedger.applyChainTotals(event.getPositionId(), uint(event, "remainingDebt"), null);
        return Outcome.APPLIED;
    }

    private Outcome withdrawn(ChainEvent event) {
        positionLedger.recordWithdrawal(event.getPositionId(), uint(event, "amount"), ref(event));
        positionLedger.applyChainTotals(event.getPositionId(), null, uint(event, "remainingCollateral"));
        return Outcome.APPLIED;
    }

    private Outcome missedPaymentMarked(ChainEvent event) {
        positionLedger.applyChainMissedPayments(event.getPositionId(), Integer.parseInt(event.arg("missedPayments")), ref(event));
        return Outcome.APPLIED;
    }

    private Outcome defaulted(ChainEvent event) {
        positionLedger.markDefaulted(event.getPositionId(), ref(event));
        return Outcome.APPLIED;
    }

    private Outcome liquidated(ChainEvent event) {
        positionLedger.markLiquidated(event.getPositionId(), listingId(event.arg("marketplaceListingId")),
                uint(event, "debtAmount"), ref(event));
        return Outcome.APPLIED;
    }

    private Outcome liquidationSettled(ChainEvent event) {
        positionLedger.recordLiquidationSettlement(event.getPositionId(), uint(event, "debtRepaid"), ref(event));
        return Outcome.APPLIED;
    }

    private Outcome assetRegistered(ChainEvent event) {
        collateralAssetService.recordRegistration(event.arg("assetId"), event.arg("attestationHash"),
                event.arg("attestor"), event.getTxHash(), event.getBlockNumber());
        return Outcome.APPLIED;
    }

    private Outcome tokenSuiteDeployed(ChainEvent event) {
        collateralAssetService.recordTokenSuite(event.arg("assetId"), event.arg("tokenAddress"),
                event.arg("complianceAddress"), uint(event, "totalSupply"), event.getTxHash(), event.getBlockNumber());
        return Outcome.APPLIED;
    }

    /**
     * Balance legs dedupe themselves; the event-level row only short-circuits a fully applied replay.
     */
    private Outcome transfer(ChainEvent event) {
        if (appliedEventRepository.existsById(event.getEventKey())) {
            return Outcome.DUPLICATE;
        }
        collateralAssetService.applyTransfer(event.getEventKey(), event.getContractAddress(), event.arg("from"),
                event.arg("to"), uint(event, "value"), event.getBlockNumber());
        try {
            appliedEventRepository.insert(new AppliedEvent(event.getEventKey(), event.getType(), Instant.now()));
        } catch (DuplicateKeyException e) {
            return Outcome.DUPLICATE;
        }
        return Outcome.APPLIED;
    }

    private void markApplied(ChainEvent event) {
        event.setStatus(ChainEventStatus.APPLIED);
        event.setAppliedAt(Instant.now());
        event.setLastError(null);
        event.setNextAttemptAt(null);
        chainEventRepository.save(event);
    }

    private void markFailed(ChainEvent event, RuntimeException e) {
        int attempts = event.getAttempts() + 1;
        event.setAttempts(attempts);
        event.setLastError(e.getClass().getSimpleName() + ": " + e.getMessage());
        if (!retryPolicy.hasAttemptsLeft(attempts)) {
            event.setStatus(ChainEventStatus.DEAD);
            event.setNextAttemptAt(null);
            log.error("Event {} ({}) dead-lettered after {} attempt(s): {}", event.getEventKey(), event.getType(),
                    attempts, event.getLastError());
        } else {
            long delay = retryPolicy.delayMs(attempts - 1);
            event.setStatus(ChainEventStatus.RETRY);
            event.setNextAttemptAt(Instant.now().plusMillis(delay));
            log.warn("Event {} ({}) failed, attempt {}; retry in {} ms: {}", event.getEventKey(), event.getType(),
                    attempts, delay, event.getLastError());
        }
        chainEventRepository.save(event);
    }

    private static TxRef ref(ChainEvent event) {
        return TxRef.confirmed(event.getTxHash(), event.getBlockNumber());
    }

    private static BigInteger uint(ChainEvent event, String name) {
        return new BigInteger(event.arg(name));
    }

    /**
     * Listing ids that encode a UUID are stored as the UUID; anything else keeps its bytes32 form.
     */
    private static String listingId(String bytes32) {
        try {
            return Bytes32Codec.toUuid(bytes32).toString();
        } catch (ValidationException e) {
            return bytes32;
        }
    }
}
