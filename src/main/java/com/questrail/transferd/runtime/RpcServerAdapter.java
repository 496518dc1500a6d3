package com.questrail.transferd.runtime;

import com.questrail.transferd.component.Component;
import com.questrail.transferd.event.EventManager;
import com.questrail.transferd.internal.exec.SerialExecutor;
import com.questrail.transferd.observability.DaemonErrorEvent;
import com.questrail.transferd.observability.DaemonObservabilitySink;
import com.questrail.transferd.plugin.PluginManager;
import com.questrail.transferd.protocol.codec.Envelope;
import com.questrail.transferd.protocol.codec.EnvelopeDecoder;
import com.questrail.transferd.protocol.codec.PayloadCodec;
import com.questrail.transferd.protocol.codec.ProtocolException;
import com.questrail.transferd.protocol.model.DaemonMessage;
import com.questrail.transferd.protocol.model.Request;
import com.questrail.transferd.protocol.model.Response;
import com.questrail.transferd.rpc.RpcDispatcher;
import com.questrail.transferd.session.DeliveryResult;
import com.questrail.transferd.session.Session;
import com.questrail.transferd.session.SessionManager;
import com.questrail.transferd.transport.Connection;
import com.questrail.transferd.transport.ConnectionEndpoint;
import com.questrail.transferd.transport.ConnectionListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * RpcServerAdapter
 * =============================================================================
 * Glue between the transport port and the daemon core.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Create a session per connection and advance it when TLS is up.</li>
 *   <li>Decode inbound frames; a frame that is not a well-formed request,
 *       or reuses an outstanding request id, is a protocol error and closes
 *       the session.</li>
 *   <li>Hand each request to the dispatcher on the session's own serial lane,
 *       so requests of one session run in order while sessions proceed
 *       independently.</li>
 *   <li>Switch a session to compressed output once it sends a compressed
 *       frame, if compression is allowed.</li>
 * </ul>
 *
 * <p>Transport callbacks run on I/O threads; nothing here blocks them
 * beyond decoding.</p>
 */
public final class RpcServerAdapter implements ConnectionListener, Component
{
    public static final String COMPONENT_NAME = "RpcServer";

    private static final Logger log = LoggerFactory.getLogger(RpcServerAdapter.class);

    private final ConnectionEndpoint endpoint;
    private final SessionManager sessions;
    private final RpcDispatcher dispatcher;
    private final EnvelopeDecoder envelopeDecoder;
    private final PayloadCodec payloadCodec;
    private final Executor workerExecutor;
    private final boolean compressionAllowed;
    private final DaemonObservabilitySink observability;

    private final ConcurrentMap<String, SerialExecutor> lanes = new ConcurrentHashMap<>();

    public RpcServerAdapter(ConnectionEndpoint endpoint,
                            SessionManager sessions,
                            RpcDispatcher dispatcher,
                            EnvelopeDecoder envelopeDecoder,
                            PayloadCodec payloadCodec,
                            Executor workerExecutor,
                            boolean compressionAllowed,
                            DaemonObservabilitySink observability)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.envelopeDecoder = Objects.requireNonNull(envelopeDecoder, "envelopeDecoder");
        this.payloadCodec = Objects.requireNonNull(payloadCodec, "payloadCodec");
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor");
        this.compressionAllowed = compressionAllowed;
        this.observability = Objects.requireNonNull(observability, "observability");
    }

    @Override
    public String name() {
        return COMPONENT_NAME;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(SessionManager.COMPONENT_NAME, EventManager.COMPONENT_NAME, PluginManager.COMPONENT_NAME);
    }

    @Override
    public void start() {
        endpoint.setListener(this);
        endpoint.start();
    }

    @Override
    public void stop() {
        endpoint.stop();
    }

    // ---------------------------------------------------------------------
    // ConnectionListener
    // ---------------------------------------------------------------------

    @Override
    public void onConnectionOpened(Connection connection) {
        lanes.put(connection.id(), new SerialExecutor(workerExecutor));
        sessions.open(connection);
    }

    @Override
    public void onConnectionSecured(Connection connection) {
        sessions.forConnection(connection).ifPresent(sessions::handshakeCompleted);
    }

    @Override
    public void onFrame(Connection connection, byte[] frame) {
        Session session = sessions.forConnection(connection).orElse(null);
        SerialExecutor lane = lanes.get(connection.id());
        if (session == null || lane == null) {
            log.debug("Ignoring frame from {}: no live session", connection.remoteAddress());
            return;
        }
        sessions.recordActivity(session);

        Request request;
        try {
            request = decodeRequest(session, frame);
        } catch (ProtocolException e) {
            protocolError(session, e);
            return;
        }

        if (!session.beginRequest(request.requestId())) {
            protocolError(session, new ProtocolException(
                    "Request id " + request.requestId() + " is already outstanding"));
            return;
        }
        lane.execute(() -> serve(session, request));
    }

    @Override
    public void onConnectionClosed(Connection connection, Throwable cause) {
        lanes.remove(connection.id());
        sessions.forConnection(connection).ifPresent(session -> sessions.connectionLost(session, cause));
    }

    // ---------------------------------------------------------------------

    private Request decodeRequest(Session session, byte[] frame) {
        Envelope envelope = envelopeDecoder.decode(frame);
        if (envelope.compressed() && compressionAllowed && !session.compressionEnabled()) {
            session.enableCompression();
            log.debug("Session {} switched to compressed frames", session.id());
        }
        DaemonMessage message = payloadCodec.decode(envelope);
        if (message instanceof Request request) {
            return request;
        }
        throw new ProtocolException("Clients may only send requests, got " + message.type());
    }

    private void serve(Session session, Request request) {
        try {
            Response response = dispatcher.dispatch(session, request);
            if (sessions.reply(session, response) == DeliveryResult.SESSION_CLOSED) {
                log.debug("Discarding response to request {} of closed session {}", request.requestId(), session.id());
            }
        } finally {
            session.endRequest(request.requestId());
        }
    }

    private void protocolError(Session session, ProtocolException e) {
        observability.onError(new DaemonErrorEvent(Instant.now(),
                "Protocol error on session " + session.id() + ": " + e.getMessage(), e));
        sessions.close(session, "protocol error: " + e.getMessage());
    }
}
