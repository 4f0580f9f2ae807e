package com.vaultledger.monitor;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic health rescan of all ACTIVE positions, so accrued interest moves positions between bands
 * even without revaluations.
 */
@Component
@RequiredArgsConstructor
public class LiquidationCandidateJob {

    private final HealthScanService healthScanService;

    @Scheduled(
            fixedRateString = "${vaultledger.health.scan-interval-ms:300000}",
            initialDelayString = "${vaultledger.health.scan-interval-ms:300000}")
    public void runScheduled() {
        healthScanService.rescanActive();
    }
}
