package com.vaultledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PartnerLoanRepository extends MongoRepository<PartnerLoan, String> {

    Optional<PartnerLoan> findByPartnerIdAndPartnerLoanId(String partnerId, String partnerLoanId);

    List<PartnerLoan> findByPartnerIdOrderByCreatedAtDesc(String partnerId);

    List<PartnerLoan> findByPositionId(Long positionId);

    List<PartnerLoan> findByPartnerIdAndStatusInAndCreatedAtAfter(String partnerId,
                                                                    List<PartnerLoanStatus> statuses,
                                                                    Instant createdAfter);
}
