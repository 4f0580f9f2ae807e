package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface TokenHoldingRepository extends MongoRepository<TokenHolding, String> {

    Optional<TokenHolding> findByTokenAddressAndHolder(String tokenAddress, String holder);

    List<TokenHolding> findByTokenAddress(String tokenAddress);
}
