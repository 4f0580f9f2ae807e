package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PartnerApiLogRepository extends MongoRepository<PartnerApiLog, String> {

    List<PartnerApiLog> findTop100ByPartnerIdOrderByCreatedAtDesc(String partnerId);
}
