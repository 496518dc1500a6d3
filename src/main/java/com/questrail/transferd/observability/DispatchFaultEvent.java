package com.questrail.transferd.observability;

import com.questrail.transferd.protocol.model.Fault;

import java.time.Instant;

/**
 * Record representing a request answered with a fault.
 */
public record DispatchFaultEvent(
    Instant timestamp,
    int sessionId,
    long requestId,
    String operation,
    Fault fault,
    Throwable cause
) {
}
