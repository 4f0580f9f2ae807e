package com.vaultledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One authenticated partner API call: who called what, the outcome and how long it took.
 */
@Document(collection = "partner_api_logs")
@CompoundIndexes({
        @CompoundIndex(name = "partner_created", def = "{'partnerId': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "success_created", def = "{'success': 1, 'createdAt': -1}")
})
@NoArgsConstructor
@Getter
@Setter
public class PartnerApiLog {

    @Id
    private String id;
    private String partnerId;
    private String partnerName;
    private String method;
    private String endpoint;
    private int statusCode;
    private boolean success;
    private long responseTimeMs;
    private String errorCode;
    private String errorMessage;
    private String partnerLoanId;
    private String userWallet;
    private Instant createdAt;
}
