package com.questrail.transferd.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a client session.
 *
 * <pre>
 *   CONNECTING ──handshake──▶ AUTHENTICATING ──login──▶ AUTHENTICATED
 *       │                          │                        │
 *       └──────────────┬───────────┴────────────────────────┘
 *                      ▼
 *                   CLOSING ──▶ CLOSED
 * </pre>
 *
 * A session in AUTHENTICATED may log in again; it stays AUTHENTICATED.
 */
public enum SessionState
{
    CONNECTING,
    AUTHENTICATING,
    AUTHENTICATED,
    CLOSING,
    CLOSED;

    public boolean canTransitionTo(SessionState next) {
        return successors().contains(next);
    }

    /** Whether the session still accepts requests and events. */
    public boolean isLive() {
        return this == AUTHENTICATING || this == AUTHENTICATED;
    }

    private Set<SessionState> successors() {
        switch (this) {
            case CONNECTING:
                return EnumSet.of(AUTHENTICATING, CLOSING);
            case AUTHENTICATING:
                return EnumSet.of(AUTHENTICATED, CLOSING);
            case AUTHENTICATED:
                return EnumSet.of(AUTHENTICATED, CLOSING);
            case CLOSING:
                return EnumSet.of(CLOSED);
            default:
                return EnumSet.noneOf(SessionState.class);
        }
    }
}
