package com.questrail.transferd.daemon;

import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.event.EventManager;
import com.questrail.transferd.protocol.model.Event;
import com.questrail.transferd.protocol.model.FaultKind;
import com.questrail.transferd.protocol.model.Request;
import com.questrail.transferd.protocol.model.Response;
import com.questrail.transferd.rpc.OperationRegistry;
import com.questrail.transferd.rpc.RpcDispatcher;
import com.questrail.transferd.session.Session;
import com.questrail.transferd.session.SessionState;
import com.questrail.transferd.session.TestSessions;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class DaemonOperationsTest
{
    private final TestSessions fixture = new TestSessions();
    private final EventManager events = new EventManager(Runnable::run, fixture.sink);
    private final OperationRegistry registry = new OperationRegistry();
    private final AtomicInteger shutdowns = new AtomicInteger();
    private final RpcDispatcher dispatcher = new RpcDispatcher(registry, fixture.codec, fixture.sink);

    DaemonOperationsTest()
    {
        registry.registerAll(new DaemonOperations("0.1.0", fixture.manager, events, registry,
                shutdowns::incrementAndGet).operations());
    }

    private Response call(Session session, long id, String operation, Object... args)
    {
        return dispatcher.dispatch(session, Request.of(id, operation, args));
    }

    @Test
    void infoNeedsNoLogin()
    {
        Session session = fixture.open("c1");

        assertEquals("0.1.0", call(session, 1, "daemon.info").result());
    }

    @Test
    void loginReturnsNumericLevel()
    {
        Session session = fixture.open("c1");

        Response response = call(session, 1, "daemon.login", "user", "user");

        assertEquals(5, response.result());
        assertEquals(AuthLevel.NORMAL, session.level());
    }

    @Test
    void loginAcceptsNamedArguments()
    {
        Session session = fixture.open("c1");

        Response response = dispatcher.dispatch(session, new Request(1, "daemon.login", List.of(),
                Map.of("username", "admin", "password", "admin")));

        assertEquals(10, response.result());
    }

    @Test
    void badLoginIsAuthErrorAndRepeatedFailuresClose()
    {
        Session session = fixture.open("c1");

        for (int attempt = 1; attempt <= 3; attempt++) {
            Response response = call(session, attempt, "daemon.login", "admin", "wrong");
            assertEquals(FaultKind.AUTH_ERROR, response.fault().kind());
            assertEquals(AuthLevel.NONE, session.level());
            fixture.manager.reply(session, response);
        }

        assertEquals(SessionState.CLOSED, session.state());
        assertEquals(3, fixture.sentResponses(session).size());
    }

    @Test
    void methodListIsSortedAndIncludesBuiltIns()
    {
        Session session = fixture.loggedIn("c1", AuthLevel.READ_ONLY);

        @SuppressWarnings("unchecked")
        List<String> names = (List<String>) call(session, 1, "daemon.get_method_list").result();

        assertTrue(names.containsAll(List.of("daemon.info", "daemon.login", "daemon.shutdown")));
        assertEquals(names.stream().sorted().toList(), names);
    }

    @Test
    void eventInterestCanBeSetAndRemoved()
    {
        Session session = fixture.loggedIn("c1", AuthLevel.READ_ONLY);

        assertEquals(Boolean.TRUE, call(session, 1, "daemon.set_event_interest", List.of("job.status", "plugin.enabled")).result());
        assertEquals(Set.of("job.status", "plugin.enabled"), session.eventInterest());

        events.publish(Event.of("job.status", 1));
        assertEquals(1, fixture.sentEvents(session).size());

        call(session, 2, "daemon.remove_event_interest", List.of("job.status"));
        events.publish(Event.of("job.status", 2));
        assertEquals(1, fixture.sentEvents(session).size());
    }

    @Test
    void eventInterestNeedsLogin()
    {
        Session session = fixture.open("c1");

        assertEquals(FaultKind.AUTH_ERROR,
                call(session, 1, "daemon.set_event_interest", List.of("job.status")).fault().kind());
        assertTrue(session.eventInterest().isEmpty());
    }

    @Test
    void shutdownIsAdminOnly()
    {
        Session normal = fixture.loggedIn("c1", AuthLevel.NORMAL);
        Session admin = fixture.loggedIn("c2", AuthLevel.ADMIN);

        assertEquals(FaultKind.AUTH_ERROR, call(normal, 1, "daemon.shutdown").fault().kind());
        assertEquals(0, shutdowns.get());

        Response response = call(admin, 2, "daemon.shutdown");
        assertFalse(response.isFault());
        assertEquals(1, shutdowns.get());
    }
}
