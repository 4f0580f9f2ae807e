package com.vaultledger.ledger;

import com.vaultledger.chain.TransactionSubmitter;
import com.vaultledger.chain.VaultStateReader;
import com.vaultledger.common.Addresses;
import com.vaultledger.common.AuthorizationException;
import com.vaultledger.common.Bytes32Codec;
import com.vaultledger.common.StateException;
import com.vaultledger.common.ValidationException;
import com.vaultledger.domain.Position;
import com.vaultledger.domain.PositionStatus;
import com.vaultledger.health.HealthSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigInteger;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

/**
 * Validate, submit, record. Ledger calls block on MongoDB and run on the bounded elastic scheduler. A failure after
 * a transaction was mined is logged as an inconsistency and propagated; the vault event for that transaction will
 * still be reconciled into the ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PositionCommandService implements LoanOperations {

    private static final Pattern BYTES32 = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    private final PositionLedger positionLedger;
    private final TransactionSubmitter transactionSubmitter;
    private final VaultStateReader vaultStateReader;

    @Override
    public Mono<Position> deposit(DepositCommand command) {
        return blocking(() -> validate(command))
                .flatMap(valid -> transactionSubmitter.deposit(valid.collateralToken(), valid.collateralAmount(),
                                valid.valuationUsd(), valid.collateralClass().onChainCode())
                        .flatMap(deposit -> record("deposit", deposit.txHash(), () -> positionLedger.createPosition(
                                new NewPosition(deposit.positionId(), valid.owner(), valid.collateralToken(),
                                        valid.collateralClass(), valid.collateralAmount(), valid.valuationUsd()),
                                TxRef.tentative(deposit.txHash(), deposit.blockNumber())))));
    }

    @Override
    public Mono<Position> borrow(String caller, long positionId, BigInteger amount, long loanDurationSeconds,
                                 int numberOfInstallments) {
        return blocking(() -> owned(caller, positionLedger.checkBorrow(positionId, amount, loanDurationSeconds, numberOfInstallments)))
                .flatMap(p -> transactionSubmitter.borrow(positionId, amount, loanDurationSeconds, numberOfInstallments))
                .flatMap(tx -> record("borrow", tx.txHash(), () -> positionLedger.recordBorrow(positionId, amount,
                        loanDurationSeconds, numberOfInstallments, TxRef.tentative(tx.txHash(), tx.blockNumber()))));
    }

    @Override
    public Mono<Position> repay(String caller, long positionId, BigInteger amount) {
        return blocking(() -> owned(caller, positionLedger.checkRepayment(positionId, amount)))
                .flatMap(p -> transactionSubmitter.repay(positionId, amount))
                .flatMap(tx -> record("repay", tx.txHash(), () -> positionLedger.recordRepayment(positionId, amount,
                        TxRef.tentative(tx.txHash(), tx.blockNumber()))));
    }

    @Override
    public Mono<Position> withdraw(String caller, long positionId, BigInteger amount) {
        return blocking(() -> owned(caller, positionLedger.checkWithdrawal(positionId, amount)))
                .flatMap(p -> transactionSubmitter.withdraw(positionId, amount))
                .flatMap(tx -> record("withdraw", tx.txHash(), () -> positionLedger.recordWithdrawal(positionId, amount,
                        TxRef.tentative(tx.txHash(), tx.blockNumber()))));
    }

    @Override
    public Mono<Position> liquidate(long positionId, String marketplaceListingId) {
        String listing = toBytes32(marketplaceListingId);
        return blocking(() -> {
            Position position = positionLedger.getPosition(positionId);
            HealthSnapshot health = positionLedger.healthOf(position);
            if (position.getStatus() != PositionStatus.ACTIVE || !health.liquidatable()) {
                throw new StateException(StateException.INVALID_STATUS, "Position " + positionId
                        + " is not liquidatable (status " + position.getStatus() + ", health factor " + health.healthFactor() + ")");
            }
            return health.outstandingDebt();
        }).flatMap(debt -> transactionSubmitter.liquidate(positionId, listing)
                .flatMap(tx -> record("liquidate", tx.txHash(), () -> positionLedger.markLiquidated(positionId,
                        marketplaceListingId, debt, TxRef.tentative(tx.txHash(), tx.blockNumber())))));
    }

    @Override
    public Mono<Position> repayFromTransfer(long positionId, BigInteger amount, String transferTxHash, long blockNumber) {
        return blocking(() -> positionLedger.recordRepayment(positionId, amount, TxRef.confirmed(transferTxHash, blockNumber)));
    }

    /**
     * Re-reads the vault's view of a position and applies its debt and collateral as absolute totals.
     */
    public Mono<Position> syncFromChain(long positionId) {
        return blocking(() -> positionLedger.getPosition(positionId))
                .flatMap(p -> vaultStateReader.readPosition(positionId))
                .flatMap(onChain -> blocking(() -> positionLedger.applyChainTotals(positionId,
                        onChain.outstandingDebt(), onChain.collateralAmount())));
    }

    private DepositCommand validate(DepositCommand command) {
        if (command.collateralAmount() == null || command.collateralAmount().signum() <= 0) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT, "collateralAmount must be greater than zero");
        }
        if (command.valuationUsd() == null || command.valuationUsd().signum() <= 0) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT, "valuationUsd must be greater than zero");
        }
        if (command.collateralClass() == null) {
            throw new ValidationException("collateralClass is required");
        }
        return new DepositCommand(
                Addresses.normalize("owner", command.owner()),
                Addresses.normalize("collateralToken", command.collateralToken()),
                command.collateralAmount(),
                command.valuationUsd(),
                command.collateralClass());
    }

    private static Position owned(String caller, Position position) {
        if (!Addresses.same(caller, position.getOwner())) {
            throw AuthorizationException.forbidden("Position " + position.getPositionId() + " does not belong to " + caller);
        }
        return position;
    }

    /**
     * Accepts a UUID (encoded left-aligned) or a raw bytes32 hex string.
     */
    static String toBytes32(String marketplaceListingId) {
        Objects.requireNonNull(marketplaceListingId, "marketplaceListingId");
        if (BYTES32.matcher(marketplaceListingId).matches()) {
            return marketplaceListingId.toLowerCase();
        }
        try {
            return Bytes32Codec.fromUuid(UUID.fromString(marketplaceListingId));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("marketplaceListingId must be a UUID or bytes32 hex: " + marketplaceListingId);
        }
    }

    private Mono<Position> record(String operation, String txHash, Callable<Position> write) {
        return blocking(write)
                .doOnError(e -> log.error("{} tx {} mined but not recorded; left to reconciliation: {}",
                        operation, txHash, e.getMessage()));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
