package com.vaultledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Off-chain mirror of one vault position: a collateral lock plus at most one loan.
 * Keyed by the chain-assigned position id. Owned and mutated exclusively by PositionLedger; never deleted.
 * Monetary fields are base-unit integers (stablecoin: 6 decimals) persisted as strings.
 * {@code healthFactor}/{@code healthStatus} are a scan index only; readers recompute from live state.
 */
@Document(collection = "positions")
@CompoundIndexes({
        @CompoundIndex(name = "owner_status", def = "{'owner': 1, 'status': 1}"),
        @CompoundIndex(name = "token_status", def = "{'collateralToken': 1, 'status': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Position {

    @Id
    @EqualsAndHashCode.Include
    private Long positionId;
    @Version
    private Long version;

    private String owner;
    private String collateralToken;
    private CollateralClass collateralClass;
    private BigInteger collateralAmount;
    private BigInteger valuationUsd;

    private BigInteger principalBorrowed = BigInteger.ZERO;
    private BigInteger principalRepaid = BigInteger.ZERO;
    private BigInteger interestRepaid = BigInteger.ZERO;
    private BigInteger totalRepaid = BigInteger.ZERO;
    /** Last absolute debt reported by a vault event; informational, drift against the derived debt is logged. */
    private BigInteger chainReportedDebt;

    private PositionStatus status;
    private ConfirmationState syncState;

    private BigInteger healthFactor;
    private HealthStatus healthStatus;
    private Instant healthEvaluatedAt;

    private Long loanDurationSeconds;
    private Long installmentIntervalSeconds;
    private Integer numberOfInstallments;
    private Instant loanStartedAt;
    private List<Installment> installments = new ArrayList<>();
    private int missedPayments;
    private boolean defaulted;

    private String liquidationTxHash;
    private String marketplaceListingId;
    private Instant liquidatedAt;
    private BigInteger debtRecovered;
    private Instant settledAt;

    @Indexed(sparse = true)
    private String creationTxHash;
    private Long creationBlock;
    private List<AuditEntry> history = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    public boolean hasBorrowed() {
        return principalBorrowed != null && principalBorrowed.signum() > 0;
    }

    /**
     * History entry recorded for {@code action} by transaction {@code txHash}. One transaction may emit several
     * vault events (a missed-payment mark that also defaults), so the action is part of the key.
     */
    public Optional<AuditEntry> findHistory(String txHash, AuditAction action) {
        if (txHash == null) {
            return Optional.empty();
        }
        return history.stream()
                .filter(e -> e.getAction() == action && txHash.equalsIgnoreCase(e.getTxHash()))
                .findFirst();
    }

    public void appendHistory(AuditEntry entry) {
        history.add(entry);
        refreshSyncState();
    }

    public void refreshSyncState() {
        boolean pending = history.stream().anyMatch(e -> e.getConfirmation() == ConfirmationState.TENTATIVE);
        syncState = pending ? ConfirmationState.TENTATIVE : ConfirmationState.CONFIRMED;
    }
}
