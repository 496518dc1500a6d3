package com.questrail.transferd.session;

import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.auth.Authenticator;
import com.questrail.transferd.auth.Credentials;
import com.questrail.transferd.auth.InMemoryCredentialStore;
import com.questrail.transferd.observability.RecordingObservabilitySink;
import com.questrail.transferd.protocol.codec.impl.DefaultEnvelopeDecoder;
import com.questrail.transferd.protocol.codec.impl.DefaultEnvelopeEncoder;
import com.questrail.transferd.protocol.codec.impl.JacksonPayloadCodec;
import com.questrail.transferd.protocol.model.DaemonMessage;
import com.questrail.transferd.protocol.model.Event;
import com.questrail.transferd.protocol.model.Response;
import com.questrail.transferd.time.DeterministicScheduler;
import com.questrail.transferd.time.ManualMonotonicClock;
import com.questrail.transferd.transport.FakeConnection;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test fixture: a {@link SessionManager} over fake connections, a manual
 * clock and a deterministic scheduler. Outbound writes run on the calling
 * thread, so frames are visible on the connection as soon as a call returns.
 *
 * <p>Accounts: {@code reader/reader} (READ_ONLY), {@code user/user} (NORMAL),
 * {@code admin/admin} (ADMIN).</p>
 */
public final class TestSessions {

    public static final SessionManager.Settings DEFAULT_SETTINGS =
            new SessionManager.Settings(Duration.ofMinutes(10), Duration.ofSeconds(30), 16, 3);

    public final ManualMonotonicClock clock = new ManualMonotonicClock();
    public final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    public final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    public final JacksonPayloadCodec codec = new JacksonPayloadCodec();
    public final SessionManager manager;

    private final DefaultEnvelopeDecoder decoder = new DefaultEnvelopeDecoder();

    public TestSessions() {
        this(DEFAULT_SETTINGS);
    }

    public TestSessions(SessionManager.Settings settings) {
        InMemoryCredentialStore store = InMemoryCredentialStore.builder()
                .addAccount("reader", "reader", AuthLevel.READ_ONLY)
                .addAccount("user", "user", AuthLevel.NORMAL)
                .addAccount("admin", "admin", AuthLevel.ADMIN)
                .build();
        this.manager = new SessionManager(new Authenticator(store), codec, new DefaultEnvelopeEncoder(),
                scheduler, clock, Runnable::run, sink, settings);
    }

    /** A session past the handshake, not logged in. */
    public Session open(String connectionId) {
        Session session = manager.open(new FakeConnection(connectionId));
        manager.handshakeCompleted(session);
        return session;
    }

    public Session loggedIn(String connectionId, AuthLevel level) {
        Session session = open(connectionId);
        String account = switch (level) {
            case READ_ONLY -> "reader";
            case NORMAL -> "user";
            case ADMIN -> "admin";
            case NONE -> null;
        };
        if (account != null) {
            manager.authenticate(session, new Credentials(account, account));
        }
        return session;
    }

    public static FakeConnection connectionOf(Session session) {
        return (FakeConnection) session.connection();
    }

    /** Every message written to the session's connection so far, decoded. */
    public List<DaemonMessage> sent(Session session) {
        List<DaemonMessage> out = new ArrayList<>();
        for (byte[] frame : connectionOf(session).written()) {
            out.add(codec.decode(decoder.decode(frame)));
        }
        return out;
    }

    public List<Event> sentEvents(Session session) {
        return sent(session).stream()
                .filter(m -> m instanceof Event)
                .map(m -> (Event) m)
                .collect(Collectors.toList());
    }

    public List<Response> sentResponses(Session session) {
        return sent(session).stream()
                .filter(m -> m instanceof Response)
                .map(m -> (Response) m)
                .collect(Collectors.toList());
    }
}
