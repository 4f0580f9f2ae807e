package com.vaultledger.notify;

import com.vaultledger.domain.PositionChangedEvent;
import com.vaultledger.domain.PositionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Tells owners about loan completion, liquidation and default. Missed installments and health bands are
 * notified by the monitors that detect them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PositionNotificationListener {

    private final NotificationSink notificationSink;

    @EventListener
    public void onPositionChanged(PositionChangedEvent event) {
        Notification notification = switch (event.action()) {
            case REPAY -> event.status() == PositionStatus.REPAID
                    ? new Notification(event.owner(), NotificationType.LOAN_REPAID, event.positionId(),
                    "Loan fully repaid; collateral can be withdrawn")
                    : null;
            case LIQUIDATE -> new Notification(event.owner(), NotificationType.POSITION_LIQUIDATED, event.positionId(),
                    "Position liquidated with outstanding debt " + event.amount());
            case DEFAULT -> new Notification(event.owner(), NotificationType.POSITION_DEFAULTED, event.positionId(),
                    "Position defaulted after repeated missed payments");
            case DEPOSIT, BORROW, WITHDRAW, REVALUE, MISSED_PAYMENT, LIQUIDATION_SETTLED -> null;
        };
        if (notification == null) {
            return;
        }
        try {
            notificationSink.send(notification);
        } catch (RuntimeException e) {
            log.warn("Notification {} for position {} not sent: {}", notification.type(), event.positionId(), e.getMessage());
        }
    }
}
