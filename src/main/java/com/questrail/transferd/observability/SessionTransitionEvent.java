package com.questrail.transferd.observability;

import com.questrail.transferd.session.SessionState;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a session lifecycle transition.
 */
public record SessionTransitionEvent(
    Instant timestamp,
    int sessionId,
    SocketAddress remoteAddress,
    SessionState oldState,
    SessionState newState,
    String reason
) {
}
