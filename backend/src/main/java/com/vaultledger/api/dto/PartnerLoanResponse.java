package com.vaultledger.api.dto;

import com.vaultledger.common.Amounts;
import com.vaultledger.domain.PartnerLoan;
import com.vaultledger.domain.PartnerLoanStatus;
import com.vaultledger.domain.RepaymentSource;

import java.time.Instant;
import java.util.List;

public record PartnerLoanResponse(String partnerLoanId,
                                  String userWallet,
                                  Long positionId,
                                  String principalAmount,
                                  String platformFee,
                                  String netDisbursed,
                                  String remainingDebt,
                                  String totalRepaid,
                                  Long loanDurationSeconds,
                                  Integer numberOfInstallments,
                                  String borrowTxHash,
                                  String disbursementTxHash,
                                  PartnerLoanStatus status,
                                  String failureReason,
                                  List<RepaymentItem> repaymentHistory,
                                  Instant createdAt,
                                  Instant updatedAt) {

    public record RepaymentItem(String amount, String txHash, Instant repaidAt, RepaymentSource repaidBy) {
    }

    public static PartnerLoanResponse from(PartnerLoan l) {
        return new PartnerLoanResponse(l.getPartnerLoanId(), l.getUserWallet(), l.getPositionId(),
                Amounts.format(l.getPrincipalAmount()), Amounts.format(l.getPlatformFee()),
                Amounts.format(l.getNetDisbursed()), Amounts.format(l.getRemainingDebt()),
                Amounts.format(l.getTotalRepaid()), l.getLoanDurationSeconds(), l.getNumberOfInstallments(),
                l.getBorrowTxHash(), l.getDisbursementTxHash(), l.getStatus(), l.getFailureReason(),
                l.getRepaymentHistory().stream()
                        .map(r -> new RepaymentItem(Amounts.format(r.getAmount()), r.getTxHash(), r.getRepaidAt(), r.getRepaidBy()))
                        .toList(),
                l.getCreatedAt(), l.getUpdatedAt());
    }
}
