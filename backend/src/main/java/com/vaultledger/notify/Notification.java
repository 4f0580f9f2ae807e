package com.vaultledger.notify;

/**
 * Message for a position owner. {@code recipient} is the owner's address; delivery channel is up to the sink.
 */
public record Notification(String recipient, NotificationType type, long positionId, String message) {
}
