package com.vaultledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One scheduled repayment, embedded in {@link Position}. Structure (number, dueAt, principalDue, interestDue)
 * is fixed at schedule creation; paid amounts and status move with repayments.
 */
@NoArgsConstructor
@Getter
@Setter
public class Installment {

    private int number;
    private Instant dueAt;
    private BigInteger principalDue;
    private BigInteger interestDue;
    private BigInteger principalPaid = BigInteger.ZERO;
    private BigInteger interestPaid = BigInteger.ZERO;
    private InstallmentStatus status = InstallmentStatus.PENDING;
    private Instant paidAt;

    public Installment(int number, Instant dueAt, BigInteger principalDue, BigInteger interestDue) {
        this.number = number;
        this.dueAt = dueAt;
        this.principalDue = principalDue;
        this.interestDue = interestDue;
    }

    public BigInteger totalDue() {
        return principalDue.add(interestDue);
    }

    public BigInteger remaining() {
        return totalDue().subtract(principalPaid).subtract(interestPaid);
    }

    public boolean hasProgress() {
        return principalPaid.signum() > 0 || interestPaid.signum() > 0;
    }
}
