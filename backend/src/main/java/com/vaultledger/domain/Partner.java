package com.vaultledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Registered partner platform. Only the sha256 of the API key is stored; the plaintext is shown once.
 * Limits and stats are stablecoin base units.
 */
@Document(collection = "partners")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Partner {

    @Id
    @EqualsAndHashCode.Include
    private String partnerId;
    @Version
    private Long version;

    private String name;
    @Indexed(unique = true)
    private String apiKeyHash;
    private String apiKeyPrefix;
    private PartnerStatus status;
    private String tier;

    private BigInteger dailyBorrowLimit;
    private BigInteger totalBorrowLimit;
    private BigInteger currentOutstanding = BigInteger.ZERO;
    private int platformFeeBps;
    private String settlementAddress;

    private BigInteger totalBorrowed = BigInteger.ZERO;
    private BigInteger totalRepaid = BigInteger.ZERO;
    private Instant lastActivityAt;
    private Instant createdAt;
}
