package com.vaultledger.api.dto;

import com.vaultledger.domain.ChainEvent;
import com.vaultledger.domain.ChainEventStatus;
import com.vaultledger.domain.VaultEventType;

import java.time.Instant;
import java.util.Map;

public record ChainEventResponse(String eventKey,
                                 VaultEventType type,
                                 Long positionId,
                                 String txHash,
                                 long blockNumber,
                                 int logIndex,
                                 Map<String, String> payload,
                                 ChainEventStatus status,
                                 int attempts,
                                 String lastError,
                                 Instant createdAt) {

    public static ChainEventResponse from(ChainEvent e) {
        return new ChainEventResponse(e.getEventKey(), e.getType(), e.getPositionId(), e.getTxHash(),
                e.getBlockNumber(), e.getLogIndex(), e.getPayload(), e.getStatus(), e.getAttempts(),
                e.getLastError(), e.getCreatedAt());
    }
}
