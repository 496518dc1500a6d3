package com.questrail.transferd.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the daemon.
 */
public record DaemonErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
