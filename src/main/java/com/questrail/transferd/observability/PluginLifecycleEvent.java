package com.questrail.transferd.observability;

import java.time.Instant;

/**
 * Record representing a plugin lifecycle step.
 */
public record PluginLifecycleEvent(
    Instant timestamp,
    String plugin,
    String version,
    Action action,
    Throwable cause
) {
    public enum Action {
        LOADED,
        LOAD_FAILED,
        UNLOADED,
        DISABLE_FAILED
    }
}
