package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface CollateralAssetRepository extends MongoRepository<CollateralAsset, String> {

    Optional<CollateralAsset> findByTokenAddress(String tokenAddress);

    Optional<CollateralAsset> findByAssetIdBytes32(String assetIdBytes32);
}
