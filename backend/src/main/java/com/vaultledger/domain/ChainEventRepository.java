package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ChainEventRepository extends MongoRepository<ChainEvent, String>, ChainEventRepositoryCustom {

    Optional<ChainEvent> findByEventKey(String eventKey);

    Optional<ChainEvent> findFirstByTxHashAndType(String txHash, VaultEventType type);

    List<ChainEvent> findByStatusOrderByBlockNumberAscLogIndexAsc(ChainEventStatus status);
}
