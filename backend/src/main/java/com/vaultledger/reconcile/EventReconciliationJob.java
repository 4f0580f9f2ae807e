package com.vaultledger.reconcile;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class EventReconciliationJob {

    private final EventReconciliationProcessor processor;
    private final ReconcileProperties properties;

    @Scheduled(
            fixedDelayString = "${vaultledger.reconcile.process-interval-ms:5000}",
            initialDelayString = "${vaultledger.reconcile.process-interval-ms:5000}")
    public void runScheduled() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            processor.processDue();
        } catch (RuntimeException e) {
            log.warn("Reconciliation pass aborted: {}", e.getMessage());
        }
    }
}
