package com.questrail.transferd.observability;

/**
 * No-op implementation of DaemonObservabilitySink.
 */
public final class NullObservabilitySink implements DaemonObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {}

    @Override
    public void onDispatchFault(DispatchFaultEvent event) {}

    @Override
    public void onDeliveryDropped(DeliveryDroppedEvent event) {}

    @Override
    public void onPluginLifecycle(PluginLifecycleEvent event) {}

    @Override
    public void onError(DaemonErrorEvent event) {}
}
