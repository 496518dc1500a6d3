package com.questrail.transferd.observability;

import com.questrail.transferd.protocol.model.FaultKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DaemonObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDaemonObservabilitySink implements DaemonObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDaemonObservabilitySink.class);

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        log.info("Session {} ({}): {} -> {}{}",
            event.sessionId(),
            event.remoteAddress(),
            event.oldState(),
            event.newState(),
            event.reason() == null ? "" : " [" + event.reason() + "]");
    }

    @Override
    public void onDispatchFault(DispatchFaultEvent event) {
        if (event.fault().kind() == FaultKind.HANDLER_ERROR) {
            log.warn("Session {} request {} '{}' failed: {}",
                event.sessionId(), event.requestId(), event.operation(), event.fault().message(), event.cause());
        }
        else {
            log.debug("Session {} request {} '{}': {} {}",
                event.sessionId(), event.requestId(), event.operation(),
                event.fault().kind().wireName(), event.fault().message());
        }
    }

    @Override
    public void onDeliveryDropped(DeliveryDroppedEvent event) {
        log.debug("Dropped event '{}' for session {}: {}", event.eventName(), event.sessionId(), event.reason());
    }

    @Override
    public void onPluginLifecycle(PluginLifecycleEvent event) {
        switch (event.action()) {
            case LOADED -> log.info("Plugin {} {} enabled", event.plugin(), event.version());
            case UNLOADED -> log.info("Plugin {} {} disabled", event.plugin(), event.version());
            case LOAD_FAILED -> log.error("Plugin {} failed to load", event.plugin(), event.cause());
            case DISABLE_FAILED -> log.warn("Plugin {} raised during disable()", event.plugin(), event.cause());
        }
    }

    @Override
    public void onError(DaemonErrorEvent event) {
        log.error("Daemon error: {}", event.message(), event.cause());
    }
}
