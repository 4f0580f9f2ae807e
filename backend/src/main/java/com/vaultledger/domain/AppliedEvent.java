package com.vaultledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Dedupe row for delta-carrying events. Inserted before the delta is applied; the id is the event key,
 * suffixed with {@code /debit} or {@code /credit} for one side of a Transfer.
 */
@Document(collection = "applied_events")
@NoArgsConstructor
@Getter
@Setter
public class AppliedEvent {

    @Id
    private String eventKey;
    private VaultEventType type;
    private Instant appliedAt;

    public AppliedEvent(String eventKey, VaultEventType type, Instant appliedAt) {
        this.eventKey = eventKey;
        this.type = type;
        this.appliedAt = appliedAt;
    }
}
