package com.vaultledger.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of ChainEventRepositoryCustom using MongoTemplate.
 */
@Repository
@RequiredArgsConstructor
public class ChainEventRepositoryImpl implements ChainEventRepositoryCustom {

    private static final Sort CHAIN_ORDER = Sort.by(Sort.Order.asc("blockNumber"), Sort.Order.asc("logIndex"));

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean enqueueIfAbsent(ChainEvent event) {
        if (mongoTemplate.exists(new Query(where("eventKey").is(event.getEventKey())), ChainEvent.class)) {
            return false;
        }
        try {
            mongoTemplate.insert(event);
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    @Override
    public List<ChainEvent> findDue(Instant now, int limit) {
        Query query = new Query(new Criteria().orOperator(
                where("status").is(ChainEventStatus.PENDING),
                where("status").is(ChainEventStatus.RETRY).and("nextAttemptAt").lte(now)))
                .with(CHAIN_ORDER)
                .limit(limit);
        return mongoTemplate.find(query, ChainEvent.class);
    }

    @Override
    public List<ChainEvent> findBlockedBefore(String orderingKey, long blockNumber, int logIndex) {
        Criteria earlier = new Criteria().orOperator(
                where("blockNumber").lt(blockNumber),
                where("blockNumber").is(blockNumber).and("logIndex").lt(logIndex));
        Query query = new Query(new Criteria().andOperator(
                where("orderingKey").is(orderingKey),
                where("status").in(ChainEventStatus.PENDING, ChainEventStatus.RETRY, ChainEventStatus.DEAD),
                earlier))
                .with(CHAIN_ORDER)
                .limit(1);
        return mongoTemplate.find(query, ChainEvent.class);
    }
}
