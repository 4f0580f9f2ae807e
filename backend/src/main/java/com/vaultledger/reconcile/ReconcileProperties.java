package com.vaultledger.reconcile;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Event ingestion and reconciliation queue settings.
 */
@ConfigurationProperties(prefix = "vaultledger.reconcile")
@NoArgsConstructor
@Getter
@Setter
public class ReconcileProperties {

    /** Turns both the poller and the processor on or off. */
    private boolean enabled = true;
    private long pollIntervalMs = 15_000L;
    private long processIntervalMs = 5_000L;
    /** Blocks re-read behind the cursor on every poll so a shallow reorg is picked up again. */
    private int reorgOverlapBlocks = 12;
    /** Widest eth_getLogs range per request. */
    private long maxBlockRange = 2_000L;
    /** First block scanned when no cursor exists (vault deployment block). */
    private long startBlock = 0L;
    /** Due events loaded per processing pass. */
    private int batchSize = 500;
    /** Attempts before an event is dead-lettered. */
    private int maxAttempts = 8;
    private long retryBaseDelayMs = 2_000L;
    private long retryMaxDelayMs = 600_000L;
    /** Collateral tokens whose Transfer logs are ingested in addition to the tokenized registry assets. */
    private List<String> trackedTokens = new ArrayList<>();
}
