package com.vaultledger.notify;

/**
 * Outbound notification port. Fire-and-forget: callers never wait for delivery and a failed delivery never
 * undoes the state change that triggered it.
 */
public interface NotificationSink {

    void send(Notification notification);
}
