package com.vaultledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Last fully scanned block of one log stream.
 */
@Document(collection = "chain_cursors")
@NoArgsConstructor
@Getter
@Setter
public class ChainCursor {

    @Id
    private String stream;
    private long lastScannedBlock;
    private Instant updatedAt;

    public ChainCursor(String stream, long lastScannedBlock) {
        this.stream = stream;
        this.lastScannedBlock = lastScannedBlock;
    }
}
