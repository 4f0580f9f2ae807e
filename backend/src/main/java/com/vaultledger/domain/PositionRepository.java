package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for positions. Writes go through PositionLedger only; other modules read.
 */
public interface PositionRepository extends MongoRepository<Position, Long> {

    List<Position> findByOwnerOrderByCreatedAtDesc(String owner);

    List<Position> findByOwnerAndStatusOrderByCreatedAtDesc(String owner, PositionStatus status);

    List<Position> findByStatus(PositionStatus status);

    List<Position> findByCollateralTokenAndStatusIn(String collateralToken, Collection<PositionStatus> statuses);

    Optional<Position> findFirstByHistoryTxHash(String txHash);
}
