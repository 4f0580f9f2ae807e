package com.vaultledger.reconcile;

import com.vaultledger.asset.CollateralAssetService;
import com.vaultledger.chain.ChainClient;
import com.vaultledger.chain.LogEntry;
import com.vaultledger.chain.LogFilter;
import com.vaultledger.chain.VaultContract;
import com.vaultledger.chain.config.ChainProperties;
import com.vaultledger.domain.ChainCursor;
import com.vaultledger.domain.ChainCursorRepository;
import com.vaultledger.domain.ChainEvent;
import com.vaultledger.domain.ChainEventRepository;
import com.vaultledger.domain.CollateralAsset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads confirmed logs into the reconciliation queue. One cursor covers the vault and the asset registry; each
 * tracked token has its own cursor, starting at its deployment block, so a token tokenized later is still read
 * from its first Transfer. Every poll re-reads {@code reorgOverlapBlocks} behind the cursor; the unique event key
 * turns the overlap into no-ops. A log that fails to decode is queued dead-lettered with its raw content instead of
 * being skipped, so the cursor never moves past an event that was not captured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VaultEventPoller {

    static final String CONTRACTS_STREAM = "contracts";
    private static final Duration RPC_TIMEOUT = Duration.ofSeconds(60);
    private static final List<String> CONTRACT_TOPICS = List.of(
            VaultContract.POSITION_CREATED,
            VaultContract.USDC_BORROWED,
            VaultContract.REPAYMENT_PLAN_CREATED,
            VaultContract.LOAN_REPAID,
            VaultContract.COLLATERAL_WITHDRAWN,
            VaultContract.MISSED_PAYMENT_MARKED,
            VaultContract.POSITION_DEFAULTED,
            VaultContract.POSITION_LIQUIDATED,
            VaultContract.LIQUIDATION_SETTLED,
            VaultContract.ASSET_REGISTERED,
            VaultContract.TOKEN_SUITE_DEPLOYED);

    private final ChainClient chainClient;
    private final ChainProperties chainProperties;
    private final ReconcileProperties properties;
    private final VaultLogDecoder decoder;
    private final ChainEventRepository chainEventRepository;
    private final ChainCursorRepository chainCursorRepository;
    private final CollateralAssetService collateralAssetService;

    @Scheduled(
            fixedDelayString = "${vaultledger.reconcile.poll-interval-ms:15000}",
            initialDelayString = "${vaultledger.reconcile.poll-interval-ms:15000}")
    public void runScheduled() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            poll();
        } catch (RuntimeException e) {
            log.warn("Event poll failed, cursor unchanged: {}", e.getMessage());
        }
    }

    /**
     * @return number of newly enqueued events
     */
    public int poll() {
        Long head = chainClient.blockNumber().block(RPC_TIMEOUT);
        if (head == null) {
            return 0;
        }
        long safeHead = head - Math.max(1, chainProperties.getConfirmations()) + 1;
        List<String> contracts = new ArrayList<>();
        if (chainProperties.getVaultAddress() != null) {
            contracts.add(chainProperties.getVaultAddress().toLowerCase());
        }
        if (chainProperties.getRegistryAddress() != null) {
            contracts.add(chainProperties.getRegistryAddress().toLowerCase());
        }
        int enqueued = 0;
        if (!contracts.isEmpty()) {
            enqueued += scanStream(CONTRACTS_STREAM, contracts, CONTRACT_TOPICS, properties.getStartBlock(), safeHead);
        }
        for (TrackedToken token : trackedTokens()) {
            enqueued += scanStream(VaultLogDecoder.TOKEN_KEY + token.address(), List.of(token.address()),
                    List.of(VaultContract.TRANSFER_TOPIC), token.startBlock(), safeHead);
        }
        if (enqueued > 0) {
            log.info("Event poll up to block {}: {} new event(s)", safeHead, enqueued);
        }
        return enqueued;
    }

    private int scanStream(String stream, List<String> addresses, List<String> topics, long startBlock, long safeHead) {
        ChainCursor cursor = chainCursorRepository.findById(stream)
                .orElseGet(() -> new ChainCursor(stream, startBlock - 1));
        long from = Math.max(startBlock, cursor.getLastScannedBlock() + 1 - properties.getReorgOverlapBlocks());
        int enqueued = 0;
        while (from <= safeHead) {
            long to = Math.min(from + properties.getMaxBlockRange() - 1, safeHead);
            List<LogEntry> logs = chainClient.getLogs(new LogFilter(addresses, topics, from, to)).block(RPC_TIMEOUT);
            for (LogEntry entry : logs != null ? logs : List.<LogEntry>of()) {
                enqueued += enqueue(entry);
            }
            if (to > cursor.getLastScannedBlock()) {
                cursor.setLastScannedBlock(to);
                cursor.setUpdatedAt(Instant.now());
                chainCursorRepository.save(cursor);
            }
            from = to + 1;
        }
        return enqueued;
    }

    private int enqueue(LogEntry entry) {
        Optional<ChainEvent> decoded;
        try {
            decoded = decoder.decode(entry);
        } catch (RuntimeException e) {
            ChainEvent dead = decoder.undecodable(entry, e);
            if (!chainEventRepository.enqueueIfAbsent(dead)) {
                return 0;
            }
            log.error("Undecodable log {}:{} from {} dead-lettered as {}: {}", entry.transactionHash(),
                    entry.logIndex(), entry.address(), dead.getOrderingKey(), e.getMessage());
            return 1;
        }
        if (decoded.isEmpty()) {
            return 0;
        }
        if (chainEventRepository.enqueueIfAbsent(decoded.get())) {
            return 1;
        }
        log.debug("Event {} already queued", decoded.get().getEventKey());
        return 0;
    }

    private Set<TrackedToken> trackedTokens() {
        Set<TrackedToken> tokens = new LinkedHashSet<>();
        for (String configured : properties.getTrackedTokens()) {
            tokens.add(new TrackedToken(configured.toLowerCase(), properties.getStartBlock()));
        }
        for (CollateralAsset asset : collateralAssetService.listAssets()) {
            if (asset.getTokenAddress() != null && asset.getDeploymentBlock() != null) {
                TrackedToken token = new TrackedToken(asset.getTokenAddress(), asset.getDeploymentBlock());
                if (tokens.stream().noneMatch(t -> t.address().equals(token.address()))) {
                    tokens.add(token);
                }
            }
        }
        return tokens;
    }

    private record TrackedToken(String address, long startBlock) {
    }
}
