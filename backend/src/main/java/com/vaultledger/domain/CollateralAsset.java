package com.vaultledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Registry mirror for a tokenized collateral asset. {@code assetId} is the canonical UUID derived from the
 * registry's bytes32 id; {@code assetIdBytes32} is kept to detect divergent mappings.
 * {@code unitPriceUsd} is the admin-asserted price of one whole token (18 decimals) in stablecoin base units.
 */
@Document(collection = "collateral_assets")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CollateralAsset {

    @Id
    @EqualsAndHashCode.Include
    private String assetId;
    @Indexed(unique = true)
    private String assetIdBytes32;
    private AssetStatus status;
    private String attestationHash;
    private String attestor;
    private String registryTxHash;
    private Long registryBlock;

    @Indexed(unique = true, sparse = true)
    private String tokenAddress;
    private String complianceAddress;
    private BigInteger totalSupply;
    private String deploymentTxHash;
    private Long deploymentBlock;

    private CollateralClass collateralClass;
    private BigInteger unitPriceUsd;
    private Instant priceUpdatedAt;
    private Instant updatedAt;
}
