package com.vaultledger.notify;

import com.vaultledger.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Default sink: writes notifications to the application log on the notify executor. Replace with a transport
 * bean (mail, push, webhook) to deliver them.
 */
@Component
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    @Async(AsyncConfig.NOTIFY_EXECUTOR)
    public void send(Notification notification) {
        log.info("Notify {} [{}] position {}: {}", notification.recipient(), notification.type(),
                notification.positionId(), notification.message());
    }
}
