package com.vaultledger.schedule;

import com.vaultledger.common.NotFoundException;
import com.vaultledger.common.ValidationException;
import com.vaultledger.domain.Installment;
import com.vaultledger.domain.InstallmentStatus;
import com.vaultledger.domain.Position;
import com.vaultledger.domain.PositionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Installment plans: generation, interest-first payment application and the schedule view.
 * <p>
 * Principal is split evenly with the last installment absorbing the rounding remainder, so the principal
 * portions always sum to the borrowed principal. Interest per installment is the principal still outstanding at
 * the start of that period times the periodic rate {@code annualInterestBps * interval / (10000 * 365d)}.
 * Interest counts towards the outstanding debt once its installment is due or has received any payment.
 */
@Component
@RequiredArgsConstructor
public class RepaymentScheduler {

    static final BigInteger SECONDS_PER_YEAR = BigInteger.valueOf(31_536_000L);
    private static final BigInteger BPS = BigInteger.valueOf(10_000);
    private static final Comparator<Installment> DUE_ORDER =
            Comparator.comparing(Installment::getDueAt).thenComparingInt(Installment::getNumber);

    private final ScheduleProperties properties;
    private final PositionRepository positionRepository;

    public long intervalSeconds(long durationSeconds, int installmentCount) {
        if (installmentCount < 1) {
            throw new ValidationException("numberOfInstallments must be at least 1");
        }
        if (durationSeconds <= 0) {
            throw new ValidationException("loanDuration must be positive");
        }
        long interval = durationSeconds / installmentCount;
        if (interval < properties.getMinIntervalSeconds()) {
            throw new ValidationException("Installment interval " + interval + "s is below the minimum of "
                    + properties.getMinIntervalSeconds() + "s");
        }
        return interval;
    }

    public List<Installment> generate(BigInteger principal, long durationSeconds, int installmentCount, Instant start) {
        if (principal == null || principal.signum() <= 0) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT, "Principal must be positive");
        }
        long interval = intervalSeconds(durationSeconds, installmentCount);
        BigInteger count = BigInteger.valueOf(installmentCount);
        BigInteger base = principal.divide(count);
        BigInteger remainder = principal.subtract(base.multiply(count));
        BigInteger rateNumerator = BigInteger.valueOf(properties.getAnnualInterestBps()).multiply(BigInteger.valueOf(interval));
        BigInteger rateDenominator = BPS.multiply(SECONDS_PER_YEAR);

        List<Installment> installments = new ArrayList<>(installmentCount);
        BigInteger outstanding = principal;
        for (int k = 1; k <= installmentCount; k++) {
            BigInteger principalPortion = k == installmentCount ? base.add(remainder) : base;
            BigInteger interest = outstanding.multiply(rateNumerator).divide(rateDenominator);
            Installment installment = new Installment(k, start.plusSeconds(interval * k), principalPortion, interest);
            // principal smaller than the installment count leaves nothing due on the early rows
            if (installment.totalDue().signum() == 0) {
                installment.setStatus(InstallmentStatus.PAID);
                installment.setPaidAt(start);
            }
            installments.add(installment);
            outstanding = outstanding.subtract(principalPortion);
        }
        return installments;
    }

    public BigInteger remainingObligation(List<Installment> installments) {
        return installments.stream()
                .filter(i -> i.getStatus() != InstallmentStatus.PAID)
                .map(Installment::remaining)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    public BigInteger accruedInterest(List<Installment> installments, Instant now) {
        return installments.stream()
                .filter(i -> !i.getDueAt().isAfter(now) || i.hasProgress() || i.getStatus() != InstallmentStatus.PENDING)
                .map(Installment::getInterestDue)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    /**
     * Applies {@code amount} to unpaid installments in due order: each installment's interest, then its principal,
     * before moving on. Partial coverage is recorded as progress; status flips to PAID only at zero remaining.
     *
     * @throws ValidationException when amount is not positive or exceeds the remaining obligation
     */
    public PaymentAllocation applyPayment(List<Installment> installments, BigInteger amount, Instant now) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT, "Repayment amount must be positive");
        }
        BigInteger obligation = remainingObligation(installments);
        if (amount.compareTo(obligation) > 0) {
            throw new ValidationException(ValidationException.INVALID_AMOUNT,
                    "Repayment " + amount + " exceeds remaining obligation " + obligation);
        }
        BigInteger left = amount;
        BigInteger toPrincipal = BigInteger.ZERO;
        BigInteger toInterest = BigInteger.ZERO;
        List<Integer> paid = new ArrayList<>();
        List<Installment> ordered = installments.stream()
                .filter(i -> i.getStatus() != InstallmentStatus.PAID)
                .sorted(DUE_ORDER)
                .toList();
        for (Installment installment : ordered) {
            if (left.signum() == 0) {
                break;
            }
            BigInteger interestPart = left.min(installment.getInterestDue().subtract(installment.getInterestPaid()));
            installment.setInterestPaid(installment.getInterestPaid().add(interestPart));
            left = left.subtract(interestPart);
            toInterest = toInterest.add(interestPart);

            BigInteger principalPart = left.min(installment.getPrincipalDue().subtract(installment.getPrincipalPaid()));
            installment.setPrincipalPaid(installment.getPrincipalPaid().add(principalPart));
            left = left.subtract(principalPart);
            toPrincipal = toPrincipal.add(principalPart);

            if (installment.remaining().signum() == 0) {
                installment.setStatus(InstallmentStatus.PAID);
                installment.setPaidAt(now);
                paid.add(installment.getNumber());
            }
        }
        return new PaymentAllocation(toPrincipal, toInterest, paid);
    }

    /**
     * Marks PENDING installments due before {@code cutoff} as MISSED.
     *
     * @return installments newly marked
     */
    public List<Installment> markOverdue(List<Installment> installments, Instant cutoff) {
        List<Installment> missed = new ArrayList<>();
        for (Installment installment : installments) {
            if (installment.getStatus() == InstallmentStatus.PENDING && installment.getDueAt().isBefore(cutoff)) {
                installment.setStatus(InstallmentStatus.MISSED);
                missed.add(installment);
            }
        }
        return missed;
    }

    public Instant nextDueAt(List<Installment> installments) {
        return installments.stream()
                .filter(i -> i.getStatus() != InstallmentStatus.PAID)
                .map(Installment::getDueAt)
                .min(Comparator.naturalOrder())
                .orElse(null);
    }

    public Instant missedCutoff(Instant now) {
        return now.minusSeconds(properties.getGracePeriodSeconds());
    }

    public ScheduleView getSchedule(long positionId) {
        Position position = positionRepository.findById(positionId)
                .orElseThrow(() -> new NotFoundException(NotFoundException.POSITION_NOT_FOUND, "Position not found: " + positionId));
        return view(position);
    }

    public ScheduleView view(Position position) {
        List<Installment> installments = position.getInstallments();
        int paid = (int) installments.stream().filter(i -> i.getStatus() == InstallmentStatus.PAID).count();
        int missed = (int) installments.stream().filter(i -> i.getStatus() == InstallmentStatus.MISSED).count();
        return new ScheduleView(
                position.getPositionId(),
                position.getLoanDurationSeconds(),
                position.getNumberOfInstallments(),
                position.getInstallmentIntervalSeconds(),
                nextDueAt(installments),
                paid,
                missed,
                remainingObligation(installments),
                installments.stream().sorted(DUE_ORDER).toList());
    }
}
