package com.vaultledger.api.dto;

import com.vaultledger.common.Amounts;
import com.vaultledger.domain.Installment;
import com.vaultledger.domain.InstallmentStatus;
import com.vaultledger.schedule.ScheduleView;

import java.time.Instant;
import java.util.List;

public record ScheduleResponse(long positionId,
                               Long loanDurationSeconds,
                               Integer numberOfInstallments,
                               Long installmentIntervalSeconds,
                               Instant nextPaymentDueAt,
                               int paidInstallments,
                               int missedInstallments,
                               String remainingObligation,
                               List<InstallmentItem> installments) {

    public record InstallmentItem(int number,
                                  Instant dueAt,
                                  String principalDue,
                                  String interestDue,
                                  String principalPaid,
                                  String interestPaid,
                                  InstallmentStatus status,
                                  Instant paidAt) {

        static InstallmentItem from(Installment i) {
            return new InstallmentItem(i.getNumber(), i.getDueAt(), Amounts.format(i.getPrincipalDue()),
                    Amounts.format(i.getInterestDue()), Amounts.format(i.getPrincipalPaid()),
                    Amounts.format(i.getInterestPaid()), i.getStatus(), i.getPaidAt());
        }
    }

    public static ScheduleResponse from(ScheduleView v) {
        return new ScheduleResponse(v.positionId(), v.loanDurationSeconds(), v.numberOfInstallments(),
                v.installmentIntervalSeconds(), v.nextPaymentDueAt(), v.paidInstallments(), v.missedInstallments(),
                Amounts.format(v.remainingObligation()),
                v.installments().stream().map(InstallmentItem::from).toList());
    }
}
