package com.questrail.transferd.session;

import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.internal.time.Cancellable;
import com.questrail.transferd.protocol.model.DaemonMessage;
import com.questrail.transferd.protocol.model.Event;
import com.questrail.transferd.protocol.model.Response;
import com.questrail.transferd.transport.Connection;

import java.net.SocketAddress;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Session
 * =============================================================================
 * The daemon-side state of one client connection.
 *
 * <h2>Ownership</h2>
 * <ul>
 *   <li>Lifecycle state, identity and login bookkeeping are mutated only by
 *       {@link SessionManager}.</li>
 *   <li>Event interest is mutated through the public interest methods by the
 *       event layer.</li>
 *   <li>The outbound queue is fed through {@link #offerResponse(Response)} and
 *       {@link #offerEvent(Event)}; a single writer drains it.</li>
 * </ul>
 *
 * <h2>Thread safety</h2>
 * State transitions are guarded by the session monitor. Level and username are
 * published through volatile fields so that readers always see a consistent,
 * most recently committed value.
 */
public final class Session
{
    private final int id;
    private final Connection connection;
    private final OutboundQueue outbound;
    private final Consumer<Session> writerTrigger;

    private final Set<String> eventInterest = new LinkedHashSet<>();
    private final Set<Long> outstandingRequests = ConcurrentHashMap.newKeySet();

    // guarded by this
    private SessionState state = SessionState.CONNECTING;
    private int failedLogins;
    private Cancellable idleTimer;

    private volatile AuthLevel level = AuthLevel.NONE;
    private volatile String username;
    private volatile boolean compression;
    private volatile boolean closeAfterReply;
    private volatile long lastActivityNanos;

    Session(int id, Connection connection, int eventCapacity, long nowNanos, Consumer<Session> writerTrigger) {
        this.id = id;
        this.connection = Objects.requireNonNull(connection, "connection");
        this.outbound = new OutboundQueue(eventCapacity);
        this.writerTrigger = Objects.requireNonNull(writerTrigger, "writerTrigger");
        this.lastActivityNanos = nowNanos;
    }

    public int id() {
        return id;
    }

    public Connection connection() {
        return connection;
    }

    public SocketAddress remoteAddress() {
        return connection.remoteAddress();
    }

    public synchronized SessionState state() {
        return state;
    }

    public boolean isLive() {
        return state().isLive();
    }

    public AuthLevel level() {
        return level;
    }

    public String username() {
        return username;
    }

    // ---------------------------------------------------------------------
    // Event interest
    // ---------------------------------------------------------------------

    public Set<String> eventInterest() {
        synchronized (eventInterest) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(eventInterest));
        }
    }

    public void addEventInterest(Collection<String> names) {
        synchronized (eventInterest) {
            eventInterest.addAll(names);
        }
    }

    public void removeEventInterest(Collection<String> names) {
        synchronized (eventInterest) {
            eventInterest.removeAll(names);
        }
    }

    public void clearEventInterest() {
        synchronized (eventInterest) {
            eventInterest.clear();
        }
    }

    /**
     * Whether an event with this name matches the session's filter, either
     * exactly or through the {@code *} wildcard.
     */
    public boolean isInterestedIn(String eventName) {
        synchronized (eventInterest) {
            return eventInterest.contains(eventName) || eventInterest.contains("*");
        }
    }

    // ---------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------

    public DeliveryResult offerResponse(Response response) {
        return offer(response);
    }

    /**
     * Queue an event. Drops it (and reports why) when the session is not
     * live or its event backlog is full; never blocks.
     */
    public DeliveryResult offerEvent(Event event) {
        if (!isLive()) {
            return DeliveryResult.SESSION_CLOSED;
        }
        return offer(event);
    }

    private DeliveryResult offer(DaemonMessage message) {
        DeliveryResult result = outbound.offer(message);
        if (result == DeliveryResult.QUEUED) {
            writerTrigger.accept(this);
        }
        return result;
    }

    OutboundQueue outbound() {
        return outbound;
    }

    public boolean compressionEnabled() {
        return compression;
    }

    /**
     * Switch outbound frames to compressed form for the rest of the session.
     */
    public void enableCompression() {
        compression = true;
    }

    // ---------------------------------------------------------------------
    // In-flight requests
    // ---------------------------------------------------------------------

    /**
     * @return {@code false} if a request with this id is already outstanding
     */
    public boolean beginRequest(long requestId) {
        return outstandingRequests.add(requestId);
    }

    public void endRequest(long requestId) {
        outstandingRequests.remove(requestId);
    }

    public int outstandingRequests() {
        return outstandingRequests.size();
    }

    // ---------------------------------------------------------------------
    // Manager-owned state
    // ---------------------------------------------------------------------

    /**
     * @return the previous state, or {@code null} if the transition is not allowed
     */
    synchronized SessionState transition(SessionState next) {
        SessionState previous = state;
        if (!previous.canTransitionTo(next)) {
            return null;
        }
        state = next;
        return previous;
    }

    void grant(AuthLevel level, String username) {
        this.username = username;
        this.level = level;
    }

    synchronized int recordFailedLogin() {
        return ++failedLogins;
    }

    synchronized void resetFailedLogins() {
        failedLogins = 0;
    }

    boolean closeAfterReply() {
        return closeAfterReply;
    }

    void requestCloseAfterReply() {
        closeAfterReply = true;
    }

    long lastActivityNanos() {
        return lastActivityNanos;
    }

    void touch(long nowNanos) {
        lastActivityNanos = nowNanos;
    }

    synchronized void replaceIdleTimer(Cancellable timer) {
        if (idleTimer != null) {
            idleTimer.cancel();
        }
        idleTimer = timer;
    }

    @Override
    public String toString() {
        return "Session[id=" + id + ", remote=" + remoteAddress() + ", state=" + state()
                + ", level=" + level + ", user=" + username + "]";
    }
}
