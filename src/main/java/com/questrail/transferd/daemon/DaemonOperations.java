package com.questrail.transferd.daemon;

import com.questrail.transferd.api.Arguments;
import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.api.CallContext;
import com.questrail.transferd.api.FaultException;
import com.questrail.transferd.auth.Credentials;
import com.questrail.transferd.event.EventManager;
import com.questrail.transferd.protocol.model.FaultKind;
import com.questrail.transferd.rpc.OperationRecord;
import com.questrail.transferd.rpc.OperationRegistry;
import com.questrail.transferd.session.Session;
import com.questrail.transferd.session.SessionManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Built-in {@code daemon.*} operations: identity, login, introspection,
 * event interest and shutdown.
 */
public final class DaemonOperations
{
    private static final Logger log = LoggerFactory.getLogger(DaemonOperations.class);

    private final String version;
    private final SessionManager sessions;
    private final EventManager events;
    private final OperationRegistry registry;
    private final Runnable shutdownAction;

    /**
     * @param shutdownAction must return promptly; the daemon stops in the background
     */
    public DaemonOperations(String version,
                            SessionManager sessions,
                            EventManager events,
                            OperationRegistry registry,
                            Runnable shutdownAction)
    {
        this.version = Objects.requireNonNull(version, "version");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.events = Objects.requireNonNull(events, "events");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.shutdownAction = Objects.requireNonNull(shutdownAction, "shutdownAction");
    }

    public List<OperationRecord> operations() {
        return List.of(
                OperationRecord.builtIn("daemon.info", AuthLevel.NONE, this::info),
                OperationRecord.builtIn("daemon.login", AuthLevel.NONE, this::login),
                OperationRecord.builtIn("daemon.get_method_list", AuthLevel.READ_ONLY, this::methodList),
                OperationRecord.builtIn("daemon.set_event_interest", AuthLevel.READ_ONLY, this::setEventInterest),
                OperationRecord.builtIn("daemon.remove_event_interest", AuthLevel.READ_ONLY, this::removeEventInterest),
                OperationRecord.builtIn("daemon.shutdown", AuthLevel.ADMIN, this::shutdown));
    }

    Object info(CallContext context, Arguments args) {
        return version;
    }

    Object login(CallContext context, Arguments args) {
        Credentials credentials = new Credentials(
                args.requireString(0, "username"),
                args.requireString(1, "password"));
        AuthLevel level = sessions.authenticate(session(context), credentials);
        return level.value();
    }

    Object methodList(CallContext context, Arguments args) {
        return registry.operationNames();
    }

    Object setEventInterest(CallContext context, Arguments args) {
        events.subscribe(session(context), args.requireStringList(0, "events"));
        return Boolean.TRUE;
    }

    Object removeEventInterest(CallContext context, Arguments args) {
        events.unsubscribe(session(context), args.requireStringList(0, "events"));
        return Boolean.TRUE;
    }

    Object shutdown(CallContext context, Arguments args) {
        log.info("Shutdown requested by {} (session {})", context.username(), context.sessionId());
        shutdownAction.run();
        return null;
    }

    private Session session(CallContext context) {
        return sessions.get(context.sessionId())
                .orElseThrow(() -> new FaultException(FaultKind.HANDLER_ERROR,
                        "Session " + context.sessionId() + " is closed"));
    }
}
