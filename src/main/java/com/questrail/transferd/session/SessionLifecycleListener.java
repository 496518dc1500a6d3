package com.questrail.transferd.session;

/**
 * Notified when a session reaches CLOSED, after its outbound queue has been
 * discarded. Used to purge per-session state held elsewhere (event
 * subscriptions).
 */
@FunctionalInterface
public interface SessionLifecycleListener
{
    void onSessionClosed(Session session);
}
