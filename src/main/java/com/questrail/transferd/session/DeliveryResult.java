package com.questrail.transferd.session;

/**
 * Outcome of offering a message to a session's outbound queue.
 */
public enum DeliveryResult
{
    QUEUED,
    /** Event dropped: the session already has its maximum of queued events. */
    QUEUE_FULL,
    /** The session is closing or closed. */
    SESSION_CLOSED
}
