package com.vaultledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Durable at-least-once queue entry for one decoded log. {@code eventKey} (txHash:logIndex) is unique, so
 * re-polling the same block range never enqueues twice. {@code orderingKey} groups events that must be applied
 * in chain order (one position, one asset, one token); ordering inside a group is (blockNumber, logIndex).
 */
@Document(collection = "chain_events")
@CompoundIndexes({
        @CompoundIndex(name = "status_next_attempt", def = "{'status': 1, 'nextAttemptAt': 1}"),
        @CompoundIndex(name = "tx_type", def = "{'txHash': 1, 'type': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ChainEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String eventKey;
    private VaultEventType type;
    private String orderingKey;
    private Long positionId;
    private String contractAddress;
    private String txHash;
    private long blockNumber;
    private int logIndex;
    /** Decoded arguments as decimal or hex strings, keyed by ABI parameter name. */
    private Map<String, String> payload = new HashMap<>();

    private ChainEventStatus status;
    private int attempts;
    private Instant nextAttemptAt;
    private String lastError;
    private Instant createdAt;
    private Instant appliedAt;

    public static String keyOf(String txHash, int logIndex) {
        return txHash.toLowerCase() + ":" + logIndex;
    }

    public String arg(String name) {
        String value = payload.get(name);
        if (value == null) {
            throw new IllegalStateException("Event " + eventKey + " (" + type + ") has no argument " + name);
        }
        return value;
    }
}
