package com.vaultledger.monitor;

import com.vaultledger.domain.Position;
import com.vaultledger.domain.PositionStatus;
import com.vaultledger.ledger.MissedInstallments;
import com.vaultledger.ledger.PositionLedger;
import com.vaultledger.notify.Notification;
import com.vaultledger.notify.NotificationSink;
import com.vaultledger.notify.NotificationType;
import com.vaultledger.schedule.RepaymentScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Marks installments MISSED once due date plus grace period has passed and notifies the owner.
 * The ledger flags a position defaulted after the configured number of misses.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MissedInstallmentJob {

    private final PositionLedger positionLedger;
    private final RepaymentScheduler repaymentScheduler;
    private final NotificationSink notificationSink;

    @Scheduled(cron = "${vaultledger.schedule.missed-check-cron:0 0 * * * *}")
    public void runScheduled() {
        checkAll(Instant.now());
    }

    /**
     * @return positions with newly missed installments
     */
    public int checkAll(Instant now) {
        Instant cutoff = repaymentScheduler.missedCutoff(now);
        List<Position> candidates = positionLedger.getPositionsByStatus(PositionStatus.ACTIVE).stream()
                .filter(Position::hasBorrowed)
                .toList();
        int changed = 0;
        for (Position position : candidates) {
            try {
                MissedInstallments result = positionLedger.markMissedInstallments(position.getPositionId(), cutoff);
                if (result.changed()) {
                    changed++;
                    notifyOwner(position, result);
                }
            } catch (RuntimeException e) {
                log.warn("Missed-installment check of position {} failed: {}", position.getPositionId(), e.getMessage());
            }
        }
        if (changed > 0) {
            log.info("Missed-installment check: {} of {} position(s) changed", changed, candidates.size());
        }
        return changed;
    }

    private void notifyOwner(Position position, MissedInstallments result) {
        if (!result.newlyMissed().isEmpty()) {
            notificationSink.send(new Notification(position.getOwner(), NotificationType.PAYMENT_MISSED,
                    position.getPositionId(), "Installment(s) " + result.newlyMissed() + " missed; "
                    + result.missedPayments() + " missed in total"));
        }
    }
}
