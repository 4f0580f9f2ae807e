package com.vaultledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Balance of one holder for one tracked collateral token, maintained from Transfer deltas.
 */
@Document(collection = "token_holdings")
@CompoundIndex(name = "token_holder", def = "{'tokenAddress': 1, 'holder': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
public class TokenHolding {

    @Id
    private String id;
    private String tokenAddress;
    private String holder;
    private BigInteger balance = BigInteger.ZERO;
    private long lastBlock;
    private Instant updatedAt;
}
