package com.vaultledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Marks a verified transfer as credited. The transaction hash is the document id, so a second claim of the
 * same transfer fails on insert.
 */
@Document(collection = "transfer_claims")
@NoArgsConstructor
@Getter
@Setter
public class TransferClaim {

    @Id
    private String txHash;
    private String claimedBy;
    private String reference;
    private BigInteger amount;
    private Instant claimedAt;

    public TransferClaim(String txHash, String claimedBy, String reference, BigInteger amount, Instant claimedAt) {
        this.txHash = txHash;
        this.claimedBy = claimedBy;
        this.reference = reference;
        this.amount = amount;
        this.claimedAt = claimedAt;
    }
}
