package com.questrail.transferd.plugin;

/**
 * A plugin could not be resolved, instantiated or enabled. The daemon state
 * is as it was before the attempt.
 */
public class PluginLoadException extends Exception
{
    private final String plugin;

    public PluginLoadException(String plugin, String message) {
        super(message);
        this.plugin = plugin;
    }

    public PluginLoadException(String plugin, String message, Throwable cause) {
        super(message, cause);
        this.plugin = plugin;
    }

    public String plugin() {
        return plugin;
    }
}
