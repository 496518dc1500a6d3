package com.questrail.transferd.event;

import com.questrail.transferd.component.Component;
import com.questrail.transferd.internal.exec.SerialExecutor;
import com.questrail.transferd.observability.DaemonErrorEvent;
import com.questrail.transferd.observability.DaemonObservabilitySink;
import com.questrail.transferd.observability.DeliveryDroppedEvent;
import com.questrail.transferd.protocol.model.Event;
import com.questrail.transferd.session.DeliveryResult;
import com.questrail.transferd.session.Session;
import com.questrail.transferd.session.SessionLifecycleListener;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * EventManager
 * =============================================================================
 * Fans published events out to subscribed sessions and to in-process
 * handlers.
 *
 * <h2>Session delivery</h2>
 * <ul>
 *   <li>An event goes to every subscribed session whose interest set
 *       contains the event name or {@code *}.</li>
 *   <li>Publishes are serialized, so each session sees events in the order
 *       they were published.</li>
 *   <li>Delivery never blocks: if a session's event backlog is full the
 *       event is dropped for that session only (drop-newest), and the drop
 *       is reported.</li>
 * </ul>
 *
 * <h2>Handlers</h2>
 * Handlers registered with {@link #subscribeHandler(String, String, EventHandler)}
 * are called asynchronously, each on its own serial lane over the handler
 * executor. A slow handler delays only its own later callbacks. Handler
 * failures are reported to the observability sink.
 */
public final class EventManager implements Component, SessionLifecycleListener
{
    public static final String COMPONENT_NAME = "EventManager";

    private final Executor handlerExecutor;
    private final DaemonObservabilitySink observability;

    private final Object publishLock = new Object();
    private final Set<Session> subscribers = ConcurrentHashMap.newKeySet();
    private final List<HandlerRegistration> handlers = new CopyOnWriteArrayList<>();

    public EventManager(Executor handlerExecutor, DaemonObservabilitySink observability) {
        this.handlerExecutor = Objects.requireNonNull(handlerExecutor, "handlerExecutor");
        this.observability = Objects.requireNonNull(observability, "observability");
    }

    @Override
    public String name() {
        return COMPONENT_NAME;
    }

    // ---------------------------------------------------------------------
    // Sessions
    // ---------------------------------------------------------------------

    public void subscribe(Session session, Collection<String> eventNames) {
        session.addEventInterest(eventNames);
        subscribers.add(session);
        // A session that closed meanwhile has already been purged; undo.
        if (!session.isLive()) {
            unsubscribeAll(session);
        }
    }

    public void unsubscribe(Session session, Collection<String> eventNames) {
        session.removeEventInterest(eventNames);
        if (session.eventInterest().isEmpty()) {
            subscribers.remove(session);
        }
    }

    public void unsubscribeAll(Session session) {
        session.clearEventInterest();
        subscribers.remove(session);
    }

    @Override
    public void onSessionClosed(Session session) {
        unsubscribeAll(session);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    // ---------------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------------

    public HandlerRegistration subscribeHandler(String owner, String eventName, EventHandler handler) {
        HandlerRegistration registration =
                new HandlerRegistration(owner, eventName, handler, new SerialExecutor(handlerExecutor));
        handlers.add(registration);
        return registration;
    }

    public boolean removeHandler(HandlerRegistration registration) {
        return handlers.remove(registration);
    }

    /**
     * Remove every handler registered under {@code owner}.
     *
     * @return number removed
     */
    public int removeHandlers(String owner) {
        List<HandlerRegistration> owned = new ArrayList<>();
        for (HandlerRegistration registration : handlers) {
            if (registration.owner().equals(owner)) {
                owned.add(registration);
            }
        }
        handlers.removeAll(owned);
        return owned.size();
    }

    public List<HandlerRegistration> handlers() {
        return List.copyOf(handlers);
    }

    // ---------------------------------------------------------------------
    // Publish
    // ---------------------------------------------------------------------

    /**
     * Publish an event to every interested session and handler.
     *
     * @return number of sessions the event was queued for
     */
    public int publish(Event event) {
        Objects.requireNonNull(event, "event");
        int delivered = 0;
        synchronized (publishLock) {
            for (Session session : subscribers) {
                if (!session.isInterestedIn(event.name())) {
                    continue;
                }
                DeliveryResult result = session.offerEvent(event);
                if (result == DeliveryResult.QUEUED) {
                    delivered++;
                } else {
                    observability.onDeliveryDropped(new DeliveryDroppedEvent(Instant.now(), session.id(),
                            event.name(), result == DeliveryResult.QUEUE_FULL
                                    ? DeliveryDroppedEvent.Reason.QUEUE_FULL
                                    : DeliveryDroppedEvent.Reason.SESSION_CLOSED));
                }
            }
            for (HandlerRegistration registration : handlers) {
                if (registration.matches(event.name())) {
                    registration.lane().execute(() -> invoke(registration, event));
                }
            }
        }
        return delivered;
    }

    private void invoke(HandlerRegistration registration, Event event) {
        try {
            registration.handler().onEvent(event);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            observability.onError(new DaemonErrorEvent(Instant.now(),
                    "Event handler of " + registration.owner() + " failed on '" + event.name() + "'", e));
        }
    }

    @Override
    public void shutdown() {
        handlers.clear();
        subscribers.clear();
    }
}
