package com.questrail.transferd.observability;

import java.time.Instant;

/**
 * Record representing an event dropped for one subscriber.
 */
public record DeliveryDroppedEvent(
    Instant timestamp,
    int sessionId,
    String eventName,
    Reason reason
) {
    public enum Reason {
        QUEUE_FULL,
        SESSION_CLOSED
    }
}
