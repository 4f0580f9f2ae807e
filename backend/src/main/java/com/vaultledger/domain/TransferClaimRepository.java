package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface TransferClaimRepository extends MongoRepository<TransferClaim, String> {
}
