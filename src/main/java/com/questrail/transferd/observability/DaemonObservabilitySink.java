package com.questrail.transferd.observability;

/**
 * Main interface for receiving daemon observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from many threads (transport event loops, dispatch
 * workers, event lanes); implementations must be thread-safe and must not
 * block.</p>
 */
public interface DaemonObservabilitySink {
    /**
     * Called when a session changes lifecycle state.
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called when a dispatch ends in a fault.
     */
    void onDispatchFault(DispatchFaultEvent event);

    /**
     * Called when an event could not be delivered to a session.
     */
    void onDeliveryDropped(DeliveryDroppedEvent event);

    /**
     * Called on plugin load, unload and failed load.
     */
    void onPluginLifecycle(PluginLifecycleEvent event);

    /**
     * Called when an error or anomaly occurs off the request path.
     */
    void onError(DaemonErrorEvent event);
}
