package com.vaultledger.api.dto;

import com.vaultledger.domain.PartnerApiLog;

import java.time.Instant;

public record PartnerApiLogResponse(String method,
                                    String endpoint,
                                    int statusCode,
                                    boolean success,
                                    long responseTimeMs,
                                    String errorCode,
                                    String errorMessage,
                                    String partnerLoanId,
                                    String userWallet,
                                    Instant createdAt) {

    public static PartnerApiLogResponse from(PartnerApiLog log) {
        return new PartnerApiLogResponse(log.getMethod(), log.getEndpoint(), log.getStatusCode(), log.isSuccess(),
                log.getResponseTimeMs(), log.getErrorCode(), log.getErrorMessage(), log.getPartnerLoanId(),
                log.getUserWallet(), log.getCreatedAt());
    }
}
