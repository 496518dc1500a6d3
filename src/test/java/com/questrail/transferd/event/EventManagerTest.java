package com.questrail.transferd.event;

import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.observability.DaemonErrorEvent;
import com.questrail.transferd.observability.DeliveryDroppedEvent;
import com.questrail.transferd.protocol.model.Event;
import com.questrail.transferd.session.Session;
import com.questrail.transferd.session.SessionManager;
import com.questrail.transferd.session.TestSessions;
import com.questrail.transferd.transport.FakeConnection;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EventManagerTest
 * -----------------------------------------------------------------------------
 * Fan-out to sessions and in-process handlers. Session writes and handler
 * lanes run inline unless a test needs real concurrency.
 */
final class EventManagerTest
{
    private final TestSessions fixture = new TestSessions();
    private final EventManager events = new EventManager(Runnable::run, fixture.sink);

    EventManagerTest()
    {
        fixture.manager.addListener(events);
    }

    @Test
    void eachInterestedSessionReceivesTheEventExactlyOnce()
    {
        Session a = fixture.loggedIn("a", AuthLevel.READ_ONLY);
        Session b = fixture.loggedIn("b", AuthLevel.READ_ONLY);
        events.subscribe(a, List.of("job.status"));
        events.subscribe(b, List.of("job.status"));

        int delivered = events.publish(Event.of("job.status", "job-1"));

        assertEquals(2, delivered);
        assertEquals(1, fixture.sentEvents(a).size());
        assertEquals(1, fixture.sentEvents(b).size());
        assertEquals("job-1", fixture.sentEvents(a).get(0).value());
    }

    @Test
    void sessionsOnlyReceiveEventsTheyAskedFor()
    {
        Session named = fixture.loggedIn("a", AuthLevel.READ_ONLY);
        Session wildcard = fixture.loggedIn("b", AuthLevel.READ_ONLY);
        Session silent = fixture.loggedIn("c", AuthLevel.READ_ONLY);
        events.subscribe(named, List.of("plugin.enabled"));
        events.subscribe(wildcard, List.of("*"));

        events.publish(Event.of("job.status", 1));
        events.publish(Event.of("plugin.enabled", "label"));

        assertEquals(List.of("plugin.enabled"), names(fixture.sentEvents(named)));
        assertEquals(List.of("job.status", "plugin.enabled"), names(fixture.sentEvents(wildcard)));
        assertTrue(fixture.sent(silent).isEmpty());
    }

    @Test
    void eventsArriveInPublishOrder()
    {
        Session session = fixture.loggedIn("a", AuthLevel.READ_ONLY);
        FakeConnection connection = TestSessions.connectionOf(session);
        connection.holdWrites(true);
        events.subscribe(session, List.of("tick"));

        for (int i = 0; i < 10; i++) {
            events.publish(Event.of("tick", i));
        }
        connection.releaseAll();

        List<Object> values = fixture.sentEvents(session).stream().map(Event::value).collect(Collectors.toList());
        assertEquals(IntStream.range(0, 10).boxed().collect(Collectors.toList()), values);
    }

    @Test
    void fullSessionDropsNewestWithoutAffectingOthers()
    {
        TestSessions small = new TestSessions(new SessionManager.Settings(Duration.ofMinutes(10), Duration.ofSeconds(30), 2, 3));
        EventManager manager = new EventManager(Runnable::run, small.sink);
        Session slow = small.loggedIn("slow", AuthLevel.READ_ONLY);
        Session fast = small.loggedIn("fast", AuthLevel.READ_ONLY);
        TestSessions.connectionOf(slow).holdWrites(true);
        manager.subscribe(slow, List.of("tick"));
        manager.subscribe(fast, List.of("tick"));

        for (int i = 1; i <= 5; i++) {
            manager.publish(Event.of("tick", i));
        }
        TestSessions.connectionOf(slow).releaseAll();

        // 1 is already on the wire, 2 and 3 fill the backlog, 4 and 5 are dropped
        assertEquals(List.of(1, 2, 3), values(small.sentEvents(slow)));
        assertEquals(List.of(1, 2, 3, 4, 5), values(small.sentEvents(fast)));
        List<DeliveryDroppedEvent> drops = small.sink.eventsOfType(DeliveryDroppedEvent.class);
        assertEquals(2, drops.size());
        assertTrue(drops.stream().allMatch(d -> d.sessionId() == slow.id()
                && d.reason() == DeliveryDroppedEvent.Reason.QUEUE_FULL));
    }

    @Test
    void closedSessionIsPurged()
    {
        Session session = fixture.loggedIn("a", AuthLevel.READ_ONLY);
        events.subscribe(session, List.of("*"));
        assertEquals(1, events.subscriberCount());

        fixture.manager.close(session, "bye");

        assertEquals(0, events.subscriberCount());
        assertEquals(0, events.publish(Event.of("job.status", 1)));
    }

    @Test
    void subscribingAClosedSessionHasNoEffect()
    {
        Session session = fixture.loggedIn("a", AuthLevel.READ_ONLY);
        fixture.manager.close(session, "bye");

        events.subscribe(session, List.of("job.status"));

        assertEquals(0, events.subscriberCount());
        assertTrue(session.eventInterest().isEmpty());
    }

    @Test
    void unsubscribeRemovesOnlyNamedInterest()
    {
        Session session = fixture.loggedIn("a", AuthLevel.READ_ONLY);
        events.subscribe(session, List.of("a", "b"));

        events.unsubscribe(session, List.of("a"));
        assertEquals(Set.of("b"), session.eventInterest());
        assertEquals(1, events.subscriberCount());

        events.unsubscribe(session, List.of("b"));
        assertEquals(0, events.subscriberCount());
    }

    @Test
    void handlersReceiveMatchingEventsInOrder()
    {
        List<Object> seen = new ArrayList<>();
        events.subscribeHandler("label", "job.status", e -> seen.add(e.value()));
        events.subscribeHandler("label", "*", e -> seen.add("any:" + e.name()));

        events.publish(Event.of("job.status", 1));
        events.publish(Event.of("other", 2));

        assertEquals(List.of(1, "any:job.status", "any:other"), seen);
    }

    @Test
    void failingHandlerIsReportedAndKeepsReceiving()
    {
        List<Object> seen = new ArrayList<>();
        events.subscribeHandler("label", "tick", e -> {
            seen.add(e.value());
            if (Integer.valueOf(1).equals(e.value())) {
                throw new IllegalStateException("boom");
            }
        });

        events.publish(Event.of("tick", 1));
        events.publish(Event.of("tick", 2));

        assertEquals(List.of(1, 2), seen);
        assertEquals(1, fixture.sink.eventsOfType(DaemonErrorEvent.class).size());
    }

    @Test
    void handlerThrowingAnErrorIsReportedAndKeepsReceiving()
    {
        List<Object> seen = new ArrayList<>();
        events.subscribeHandler("label", "tick", e -> {
            seen.add(e.value());
            if (Integer.valueOf(1).equals(e.value())) {
                throw new AssertionError("label bug");
            }
        });

        events.publish(Event.of("tick", 1));
        events.publish(Event.of("tick", 2));

        assertEquals(List.of(1, 2), seen);
        DaemonErrorEvent error = fixture.sink.eventsOfType(DaemonErrorEvent.class).get(0);
        assertInstanceOf(AssertionError.class, error.cause());
    }

    @Test
    void removeHandlersDropsEveryHandlerOfOwner()
    {
        List<Object> seen = new ArrayList<>();
        events.subscribeHandler("label", "tick", e -> seen.add("label"));
        events.subscribeHandler("label", "*", e -> seen.add("label*"));
        HandlerRegistration stats = events.subscribeHandler("stats", "tick", e -> seen.add("stats"));

        assertEquals(2, events.removeHandlers("label"));
        events.publish(Event.of("tick", 0));

        assertEquals(List.of("stats"), seen);
        assertTrue(events.removeHandler(stats));
        assertTrue(events.handlers().isEmpty());
    }

    @Test
    void slowHandlerDoesNotHoldUpOthers() throws Exception
    {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            EventManager concurrent = new EventManager(pool, fixture.sink);
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch fastSaw = new CountDownLatch(2);
            List<Object> slowSeen = Collections.synchronizedList(new ArrayList<>());
            concurrent.subscribeHandler("slow", "tick", e -> {
                release.await(5, TimeUnit.SECONDS);
                slowSeen.add(e.value());
            });
            concurrent.subscribeHandler("fast", "tick", e -> fastSaw.countDown());

            concurrent.publish(Event.of("tick", 1));
            concurrent.publish(Event.of("tick", 2));

            assertTrue(fastSaw.await(5, TimeUnit.SECONDS), "fast handler should not wait for the slow one");
            release.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
            assertEquals(List.of(1, 2), slowSeen);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shutdownForgetsSubscriptionsAndHandlers()
    {
        Session session = fixture.loggedIn("a", AuthLevel.READ_ONLY);
        events.subscribe(session, List.of("*"));
        events.subscribeHandler("label", "*", e -> {});

        events.shutdown();

        assertEquals(0, events.subscriberCount());
        assertTrue(events.handlers().isEmpty());
    }

    private static List<String> names(List<Event> received) {
        return received.stream().map(Event::name).collect(Collectors.toList());
    }

    private static List<Object> values(List<Event> received) {
        return received.stream().map(Event::value).collect(Collectors.toList());
    }
}
