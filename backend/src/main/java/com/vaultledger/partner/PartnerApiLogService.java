package com.vaultledger.partner;

import com.vaultledger.domain.Partner;
import com.vaultledger.domain.PartnerApiLog;
import com.vaultledger.domain.PartnerApiLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;

/**
 * Audit trail of partner API calls. A failed write is logged and never fails the call being audited.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PartnerApiLogService {

    private final PartnerApiLogRepository partnerApiLogRepository;

    public Mono<Void> record(Partner partner, PartnerApiCall call) {
        return Mono.fromRunnable(() -> partnerApiLogRepository.save(toLog(partner, call)))
                .subscribeOn(Schedulers.boundedElastic())
                .then()
                .onErrorResume(e -> {
                    log.warn("Partner API log write failed for {} {} {}: {}", partner.getPartnerId(), call.method(),
                            call.endpoint(), e.getMessage());
                    return Mono.empty();
                });
    }

    public List<PartnerApiLog> recent(String partnerId) {
        return partnerApiLogRepository.findTop100ByPartnerIdOrderByCreatedAtDesc(partnerId);
    }

    private static PartnerApiLog toLog(Partner partner, PartnerApiCall call) {
        PartnerApiLog entry = new PartnerApiLog();
        entry.setPartnerId(partner.getPartnerId());
        entry.setPartnerName(partner.getName());
        entry.setMethod(call.method());
        entry.setEndpoint(call.endpoint());
        entry.setStatusCode(call.statusCode());
        entry.setSuccess(call.success());
        entry.setResponseTimeMs(call.responseTimeMs());
        entry.setErrorCode(call.errorCode());
        entry.setErrorMessage(call.errorMessage());
        entry.setPartnerLoanId(call.partnerLoanId());
        entry.setUserWallet(call.userWallet() != null ? call.userWallet().toLowerCase() : null);
        entry.setCreatedAt(Instant.now());
        return entry;
    }
}
