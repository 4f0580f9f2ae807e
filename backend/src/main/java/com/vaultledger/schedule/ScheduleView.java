package com.vaultledger.schedule;

import com.vaultledger.domain.Installment;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

public record ScheduleView(long positionId,
                           Long loanDurationSeconds,
                           Integer numberOfInstallments,
                           Long installmentIntervalSeconds,
                           Instant nextPaymentDueAt,
                           int paidInstallments,
                           int missedInstallments,
                           BigInteger remainingObligation,
                           List<Installment> installments) {
}
