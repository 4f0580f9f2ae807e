package com.vaultledger.schedule;

import java.math.BigInteger;
import java.util.List;

/**
 * How one repayment was split. {@code installmentsPaid} lists installment numbers that became PAID.
 */
public record PaymentAllocation(BigInteger principal, BigInteger interest, List<Integer> installmentsPaid) {
}
