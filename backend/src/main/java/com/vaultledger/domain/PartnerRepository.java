package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface PartnerRepository extends MongoRepository<Partner, String> {

    Optional<Partner> findByApiKeyHash(String apiKeyHash);
}
