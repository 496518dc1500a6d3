package com.questrail.transferd.plugin;

import java.util.function.Supplier;

/**
 * Where a plugin's code comes from. Each call produces a fresh instance.
 */
@FunctionalInterface
public interface PluginSource
{
    ResolvedPlugin resolve() throws PluginLoadException;

    /**
     * Source for a plugin already on the daemon's class path.
     */
    static PluginSource of(Supplier<? extends DaemonPlugin> factory) {
        return () -> ResolvedPlugin.of(factory.get());
    }
}
