package com.vaultledger.reconcile;

import com.vaultledger.common.NotFoundException;
import com.vaultledger.common.StateException;
import com.vaultledger.domain.ChainEvent;
import com.vaultledger.domain.ChainEventRepository;
import com.vaultledger.domain.ChainEventStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Inspection and manual redelivery of dead-lettered reconciliation events.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeadLetterService {

    private final ChainEventRepository chainEventRepository;

    public List<ChainEvent> listDead() {
        return chainEventRepository.findByStatusOrderByBlockNumberAscLogIndexAsc(ChainEventStatus.DEAD);
    }

    /**
     * Puts a DEAD event back in the queue with a fresh attempt budget.
     *
     * @throws NotFoundException EVENT_NOT_FOUND for an unknown key
     * @throws StateException    INVALID_STATUS when the event is not DEAD
     */
    public ChainEvent retry(String eventKey) {
        ChainEvent event = chainEventRepository.findByEventKey(eventKey)
                .orElseThrow(() -> new NotFoundException(NotFoundException.EVENT_NOT_FOUND, "Event not found: " + eventKey));
        if (event.getStatus() != ChainEventStatus.DEAD) {
            throw new StateException(StateException.INVALID_STATUS, "Event " + eventKey + " is " + event.getStatus() + ", not DEAD");
        }
        event.setStatus(ChainEventStatus.RETRY);
        event.setAttempts(0);
        event.setNextAttemptAt(Instant.now());
        ChainEvent saved = chainEventRepository.save(event);
        log.info("Event {} ({}) requeued by admin; last error was: {}", eventKey, event.getType(), event.getLastError());
        return saved;
    }
}
