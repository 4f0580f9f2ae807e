package com.vaultledger.domain;

import java.time.Instant;
import java.util.List;

/**
 * Queue operations that need MongoTemplate: insert-if-absent and due-batch selection.
 */
public interface ChainEventRepositoryCustom {

    /**
     * Insert when no event with the same eventKey exists. Returns true when inserted.
     */
    boolean enqueueIfAbsent(ChainEvent event);

    /**
     * PENDING or RETRY events whose nextAttemptAt is due, in chain order, at most {@code limit}.
     */
    List<ChainEvent> findDue(Instant now, int limit);

    /**
     * Earliest unapplied (not APPLIED) event per ordering key, used to hold back later events of a group.
     */
    List<ChainEvent> findBlockedBefore(String orderingKey, long blockNumber, int logIndex);
}
