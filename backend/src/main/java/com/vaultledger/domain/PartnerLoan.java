package com.vaultledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A position viewed through a partner relationship. (partnerId, partnerLoanId) is unique for the lifetime
 * of the collection, including FAILED records.
 */
@Document(collection = "partner_loans")
@CompoundIndex(name = "partner_loan_key", def = "{'partnerId': 1, 'partnerLoanId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PartnerLoan {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Version
    private Long version;

    private String partnerId;
    private String partnerLoanId;
    private String userWallet;
    @Indexed(sparse = true)
    private Long positionId;

    private BigInteger principalAmount;
    private BigInteger platformFee;
    private BigInteger netDisbursed;
    private BigInteger remainingDebt;
    private BigInteger totalRepaid = BigInteger.ZERO;
    private Long loanDurationSeconds;
    private Integer numberOfInstallments;

    private String borrowTxHash;
    private String disbursementTxHash;
    private List<Repayment> repaymentHistory = new ArrayList<>();

    private PartnerLoanStatus status;
    private String failureReason;
    private Instant createdAt;
    private Instant updatedAt;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Repayment {
        private BigInteger amount;
        private String txHash;
        private Instant repaidAt;
        private RepaymentSource repaidBy;

        public Repayment(BigInteger amount, String txHash, Instant repaidAt, RepaymentSource repaidBy) {
            this.amount = amount;
            this.txHash = txHash;
            this.repaidAt = repaidAt;
            this.repaidBy = repaidBy;
        }
    }
}
