package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface ChainCursorRepository extends MongoRepository<ChainCursor, String> {
}
