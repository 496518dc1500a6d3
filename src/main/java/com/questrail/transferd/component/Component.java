package com.questrail.transferd.component;

import java.util.Set;

/**
 * Component
 * -----------------------------------------------------------------------------
 * A named, independently startable part of the daemon.
 *
 * <p>Components declare the names of the components they depend on; the
 * {@link ComponentRegistry} starts dependencies first and stops dependents
 * first. All lifecycle hooks default to no-ops.</p>
 */
public interface Component
{
    String name();

    default Set<String> dependencies() {
        return Set.of();
    }

    /** Called when the component moves from STOPPED to STARTED. */
    default void start() {}

    /** Called when the component moves from STARTED to STOPPED. */
    default void stop() {}

    /** Final cleanup after the component has been stopped for good. */
    default void shutdown() {}
}
