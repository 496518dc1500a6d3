package com.questrail.transferd.plugin;

import java.util.List;
import java.util.Optional;

/**
 * Plugins available for enabling by name.
 */
public interface PluginCatalog
{
    /** Sorted names of available plugins. */
    List<String> available();

    Optional<PluginSource> find(String name);

    static PluginCatalog empty() {
        return new PluginCatalog() {
            @Override
            public List<String> available() {
                return List.of();
            }

            @Override
            public Optional<PluginSource> find(String name) {
                return Optional.empty();
            }
        };
    }
}
