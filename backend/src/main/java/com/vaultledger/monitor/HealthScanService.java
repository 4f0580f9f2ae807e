package com.vaultledger.monitor;

import com.vaultledger.asset.CollateralAssetService;
import com.vaultledger.config.AsyncConfig;
import com.vaultledger.domain.CollateralAsset;
import com.vaultledger.domain.HealthStatus;
import com.vaultledger.domain.Position;
import com.vaultledger.domain.PositionStatus;
import com.vaultledger.health.HealthProperties;
import com.vaultledger.health.HealthSnapshot;
import com.vaultledger.ledger.PositionLedger;
import com.vaultledger.notify.Notification;
import com.vaultledger.notify.NotificationSink;
import com.vaultledger.notify.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Batch health recomputation: full rescans of ACTIVE positions and revaluations (single position or every open
 * position on one collateral token). Owners are notified when a position enters the WARNING or LIQUIDATABLE band.
 * Positions are flagged only; liquidation stays an explicit admin action.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthScanService {

    private final PositionLedger positionLedger;
    private final CollateralAssetService collateralAssetService;
    private final NotificationSink notificationSink;
    private final HealthProperties healthProperties;

    public ScanSummary rescanActive() {
        List<Position> active = positionLedger.getPositionsByStatus(PositionStatus.ACTIVE);
        ScanSummary summary = scan(active, null);
        log.info("Health scan: {} scanned, {} warning, {} liquidatable, {} failed",
                summary.scanned(), summary.warning(), summary.liquidatable(), summary.failed());
        return summary;
    }

    @Async(AsyncConfig.SCAN_EXECUTOR)
    public CompletableFuture<ScanSummary> rescanActiveAsync() {
        return CompletableFuture.completedFuture(rescanActive());
    }

    /**
     * Replaces one position's valuation and returns its live health.
     */
    public HealthSnapshot revaluePosition(long positionId, BigInteger valuationUsd) {
        HealthStatus before = positionLedger.getPosition(positionId).getHealthStatus();
        Position position = positionLedger.revalue(positionId, valuationUsd);
        HealthSnapshot snapshot = positionLedger.healthOf(position);
        notifyOnBandChange(position, before, snapshot);
        log.info("Position {} revalued to {}: health factor {} ({})", positionId, valuationUsd,
                snapshot.healthFactor(), snapshot.status());
        return snapshot;
    }

    /**
     * Records a new unit price for {@code tokenAddress} and revalues every open position locked in it as
     * {@code collateralAmount * unitPrice / 10^decimals}.
     */
    public ScanSummary revalueByToken(String tokenAddress, BigInteger unitPriceUsd) {
        CollateralAsset asset = collateralAssetService.updatePrice(tokenAddress, unitPriceUsd);
        List<Position> open = positionLedger.getOpenPositionsByCollateral(asset.getTokenAddress());
        ScanSummary summary = scan(open, unitPriceUsd);
        log.info("Token {} repriced to {}: {} position(s) revalued, {} warning, {} liquidatable, {} failed",
                asset.getTokenAddress(), unitPriceUsd, summary.scanned(), summary.warning(), summary.liquidatable(),
                summary.failed());
        return summary;
    }

    BigInteger valuationAt(BigInteger collateralAmount, BigInteger unitPriceUsd) {
        return collateralAmount.multiply(unitPriceUsd).divide(BigInteger.TEN.pow(healthProperties.getCollateralTokenDecimals()));
    }

    private ScanSummary scan(List<Position> positions, BigInteger unitPriceUsd) {
        Map<HealthStatus, Integer> counts = new EnumMap<>(HealthStatus.class);
        int failed = 0;
        for (Position position : positions) {
            try {
                HealthSnapshot snapshot;
                if (unitPriceUsd != null) {
                    Position revalued = positionLedger.revalue(position.getPositionId(),
                            valuationAt(position.getCollateralAmount(), unitPriceUsd));
                    snapshot = positionLedger.healthOf(revalued);
                } else {
                    snapshot = positionLedger.refreshHealth(position.getPositionId());
                }
                counts.merge(snapshot.status(), 1, Integer::sum);
                notifyOnBandChange(position, position.getHealthStatus(), snapshot);
            } catch (RuntimeException e) {
                failed++;
                log.warn("Health scan of position {} failed: {}", position.getPositionId(), e.getMessage());
            }
        }
        return new ScanSummary(positions.size(),
                counts.getOrDefault(HealthStatus.HEALTHY, 0),
                counts.getOrDefault(HealthStatus.WARNING, 0),
                counts.getOrDefault(HealthStatus.LIQUIDATABLE, 0),
                failed);
    }

    private void notifyOnBandChange(Position position, HealthStatus before, HealthSnapshot after) {
        if (after.status() == before || after.status() == HealthStatus.HEALTHY) {
            return;
        }
        NotificationType type = after.status() == HealthStatus.LIQUIDATABLE
                ? NotificationType.LIQUIDATION_RISK
                : NotificationType.HEALTH_WARNING;
        notificationSink.send(new Notification(position.getOwner(), type, position.getPositionId(),
                "Health factor " + after.healthFactor() + " bps is in the " + after.status() + " band"));
    }
}
