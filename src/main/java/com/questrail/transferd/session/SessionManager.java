package com.questrail.transferd.session;

import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.auth.AuthException;
import com.questrail.transferd.auth.Authenticator;
import com.questrail.transferd.auth.Credentials;
import com.questrail.transferd.component.Component;
import com.questrail.transferd.internal.time.MonotonicClock;
import com.questrail.transferd.internal.time.MonotonicScheduler;
import com.questrail.transferd.observability.DaemonErrorEvent;
import com.questrail.transferd.observability.DaemonObservabilitySink;
import com.questrail.transferd.observability.SessionTransitionEvent;
import com.questrail.transferd.protocol.codec.EnvelopeEncoder;
import com.questrail.transferd.protocol.codec.PayloadCodec;
import com.questrail.transferd.protocol.model.DaemonMessage;
import com.questrail.transferd.protocol.model.Response;
import com.questrail.transferd.transport.Connection;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * SessionManager
 * =============================================================================
 * Owns every live {@link Session}: creation, authentication, idle expiry,
 * the per-session outbound writer and teardown.
 *
 * <h2>Outbound writer</h2>
 * Each session has at most one writer at a time. The writer takes the next
 * message from the session's queue, encodes it (compressed if the session
 * negotiated compression) and writes it; it continues only once the
 * connection has accepted the frame. A slow client therefore backs up its own
 * queue and never anyone else's.
 *
 * <h2>Closing</h2>
 * <ul>
 *   <li>{@link #close(Session, String)} is immediate and idempotent: pending
 *       output is discarded.</li>
 *   <li>{@link #closeGracefully(Session, String)} stops accepting output and
 *       closes once the queue has drained.</li>
 * </ul>
 * Either way, CLOSED is reached exactly once, listeners are notified, and
 * the id is released for reuse after the grace period.
 */
public final class SessionManager implements Component
{
    public static final String COMPONENT_NAME = "SessionManager";

    /**
     * Tunables for session handling.
     *
     * @param idleTimeout        close sessions silent for this long; {@code null} or zero disables
     * @param idReuseGrace       delay before a released session id may be reused
     * @param eventQueueCapacity maximum queued events per session
     * @param maxLoginAttempts   failed logins tolerated before the session is closed
     */
    public record Settings(Duration idleTimeout, Duration idReuseGrace, int eventQueueCapacity, int maxLoginAttempts) {
        public Settings {
            Objects.requireNonNull(idReuseGrace, "idReuseGrace");
            if (eventQueueCapacity <= 0) {
                throw new IllegalArgumentException("eventQueueCapacity must be positive");
            }
            if (maxLoginAttempts <= 0) {
                throw new IllegalArgumentException("maxLoginAttempts must be positive");
            }
        }

        boolean idleTimeoutEnabled() {
            return idleTimeout != null && !idleTimeout.isZero() && !idleTimeout.isNegative();
        }
    }

    private final Authenticator authenticator;
    private final PayloadCodec payloadCodec;
    private final EnvelopeEncoder envelopeEncoder;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Executor writerExecutor;
    private final DaemonObservabilitySink observability;
    private final Settings settings;

    private final SessionIdAllocator ids;
    private final ConcurrentMap<Integer, Session> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Session> byConnection = new ConcurrentHashMap<>();
    private final List<SessionLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    public SessionManager(Authenticator authenticator,
                          PayloadCodec payloadCodec,
                          EnvelopeEncoder envelopeEncoder,
                          MonotonicScheduler scheduler,
                          MonotonicClock clock,
                          Executor writerExecutor,
                          DaemonObservabilitySink observability,
                          Settings settings)
    {
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.payloadCodec = Objects.requireNonNull(payloadCodec, "payloadCodec");
        this.envelopeEncoder = Objects.requireNonNull(envelopeEncoder, "envelopeEncoder");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.writerExecutor = Objects.requireNonNull(writerExecutor, "writerExecutor");
        this.observability = Objects.requireNonNull(observability, "observability");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.ids = new SessionIdAllocator(scheduler, clock, settings.idReuseGrace());
    }

    @Override
    public String name() {
        return COMPONENT_NAME;
    }

    @Override
    public void stop() {
        closeAll("daemon stopping");
    }

    public void addListener(SessionLifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Create a session for a freshly accepted connection, in CONNECTING.
     */
    public Session open(Connection connection) {
        int id = ids.allocate();
        Session session = new Session(id, connection, settings.eventQueueCapacity(), clock.nowNanos(),
                this::triggerWriter);
        sessions.put(id, session);
        byConnection.put(connection.id(), session);
        emitTransition(session, null, SessionState.CONNECTING, "accepted");

        if (settings.idleTimeoutEnabled()) {
            armIdleTimer(session, settings.idleTimeout());
        }
        return session;
    }

    /**
     * The encrypted channel is up: CONNECTING → AUTHENTICATING.
     */
    public void handshakeCompleted(Session session) {
        SessionState previous = session.transition(SessionState.AUTHENTICATING);
        if (previous != null) {
            emitTransition(session, previous, SessionState.AUTHENTICATING, "handshake complete");
        }
    }

    /**
     * Verify credentials and raise the session to the granted level.
     *
     * <p>On failure the session's level is unchanged. Once the number of
     * failed attempts reaches the configured maximum, the session is marked
     * to close after the failure reply has been written.</p>
     *
     * @throws AuthException if the credentials are rejected or the session cannot log in
     */
    public AuthLevel authenticate(Session session, Credentials credentials) {
        if (!session.isLive()) {
            throw new AuthException("Session is not accepting logins");
        }

        AuthLevel granted;
        try {
            granted = authenticator.authenticate(credentials);
        } catch (AuthException e) {
            int failures = session.recordFailedLogin();
            if (failures >= settings.maxLoginAttempts()) {
                session.requestCloseAfterReply();
            }
            throw e;
        }

        SessionState previous = session.transition(SessionState.AUTHENTICATED);
        if (previous == null) {
            throw new AuthException("Session closed during login");
        }
        session.resetFailedLogins();
        session.grant(granted, credentials.username());
        emitTransition(session, previous, SessionState.AUTHENTICATED,
                "login as " + credentials.username() + " (" + granted + ")");
        return granted;
    }

    /**
     * Note inbound traffic for idle accounting.
     */
    public void recordActivity(Session session) {
        session.touch(clock.nowNanos());
    }

    /**
     * Queue a response for the session. If the session is marked to close
     * after its reply, graceful close begins once the response is queued.
     */
    public DeliveryResult reply(Session session, Response response) {
        DeliveryResult result = session.offerResponse(response);
        if (session.closeAfterReply()) {
            closeGracefully(session, "too many failed login attempts");
        }
        return result;
    }

    public void closeGracefully(Session session, String reason) {
        SessionState previous = session.transition(SessionState.CLOSING);
        if (previous == null) {
            return;
        }
        emitTransition(session, previous, SessionState.CLOSING, reason);
        if (session.outbound().seal()) {
            finishClose(session, reason);
        }
    }

    /**
     * Close immediately, discarding pending output. Safe to call any number
     * of times from any thread.
     */
    public void close(Session session, String reason) {
        SessionState previous = session.transition(SessionState.CLOSING);
        if (previous != null) {
            emitTransition(session, previous, SessionState.CLOSING, reason);
        }
        finishClose(session, reason);
    }

    /**
     * The transport reports that the connection is gone.
     */
    public void connectionLost(Session session, Throwable cause) {
        close(session, cause == null ? "connection closed" : "connection lost: " + cause.getMessage());
    }

    public void closeAll(String reason) {
        for (Session session : new ArrayList<>(sessions.values())) {
            close(session, reason);
        }
    }

    private void finishClose(Session session, String reason) {
        session.outbound().discard();
        if (session.transition(SessionState.CLOSED) == null) {
            return;
        }
        session.replaceIdleTimer(null);
        sessions.remove(session.id(), session);
        byConnection.remove(session.connection().id(), session);
        session.connection().close();

        for (SessionLifecycleListener listener : listeners) {
            try {
                listener.onSessionClosed(session);
            } catch (RuntimeException e) {
                observability.onError(new DaemonErrorEvent(Instant.now(),
                        "Session close listener failed for session " + session.id(), e));
            }
        }

        ids.release(session.id());
        emitTransition(session, SessionState.CLOSING, SessionState.CLOSED, reason);
    }

    // ---------------------------------------------------------------------
    // Lookup
    // ---------------------------------------------------------------------

    public Optional<Session> get(int sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<Session> forConnection(Connection connection) {
        return Optional.ofNullable(byConnection.get(connection.id()));
    }

    public List<Session> sessions() {
        return List.copyOf(sessions.values());
    }

    public int count() {
        return sessions.size();
    }

    // ---------------------------------------------------------------------
    // Outbound writer
    // ---------------------------------------------------------------------

    private void triggerWriter(Session session) {
        if (session.outbound().tryAcquireWriter()) {
            writerExecutor.execute(() -> writeNext(session));
        }
    }

    private void writeNext(Session session) {
        while (true) {
            DaemonMessage next = session.outbound().pollOrRelease();
            if (next == null) {
                if (session.outbound().isSealed()) {
                    finishClose(session, "closed after final reply");
                }
                return;
            }

            byte[] frame;
            try {
                frame = envelopeEncoder.encode(payloadCodec.encode(next, session.compressionEnabled()));
            } catch (RuntimeException e) {
                observability.onError(new DaemonErrorEvent(Instant.now(),
                        "Could not encode " + next.type() + " for session " + session.id(), e));
                continue;
            }

            session.connection().write(frame).whenComplete((ignored, failure) -> {
                if (failure != null) {
                    close(session, "write failed: " + failure.getMessage());
                } else {
                    writerExecutor.execute(() -> writeNext(session));
                }
            });
            return;
        }
    }

    // ---------------------------------------------------------------------
    // Idle expiry
    // ---------------------------------------------------------------------

    private void armIdleTimer(Session session, Duration delay) {
        session.replaceIdleTimer(scheduler.scheduleAfter(delay, clock, () -> checkIdle(session)));
    }

    private void checkIdle(Session session) {
        SessionState state = session.state();
        if (state == SessionState.CLOSING || state == SessionState.CLOSED) {
            return;
        }
        long limit = settings.idleTimeout().toNanos();
        long idle = clock.nowNanos() - session.lastActivityNanos();
        if (idle >= limit) {
            close(session, "idle timeout");
        } else {
            armIdleTimer(session, Duration.ofNanos(limit - idle));
        }
    }

    private void emitTransition(Session session, SessionState from, SessionState to, String reason) {
        observability.onSessionTransition(new SessionTransitionEvent(
                Instant.now(), session.id(), session.remoteAddress(), from, to, reason));
    }
}
