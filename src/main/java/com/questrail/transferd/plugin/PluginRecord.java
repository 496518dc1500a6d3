package com.questrail.transferd.plugin;

import java.util.List;

/**
 * What {@link PluginManager#list()} reports for one plugin.
 *
 * @param version    {@code null} unless enabled
 * @param operations operations currently owned by the plugin
 */
public record PluginRecord(String name, String version, boolean enabled, List<String> operations)
{
    public PluginRecord {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }
}
