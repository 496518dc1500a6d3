package com.questrail.transferd.plugin;

/**
 * DaemonPlugin
 * =============================================================================
 * Capability interface every plugin implements.
 *
 * <p>Plugins packaged as jars declare their implementation in
 * {@code META-INF/services/com.questrail.transferd.plugin.DaemonPlugin}; the
 * class needs a public no-argument constructor.</p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #enable(PluginContext)} registers the plugin's operations and
 *       event handlers through the context. If it throws, everything it
 *       registered is removed again and the plugin stays disabled;
 *       {@link #disable()} is not called.</li>
 *   <li>{@link #disable()} releases the plugin's own resources. Its
 *       registrations are removed by the daemon afterwards regardless of the
 *       outcome.</li>
 * </ul>
 */
public interface DaemonPlugin
{
    /** Plugin name; also the owner tag of every registration it makes. */
    String name();

    String version();

    void enable(PluginContext context) throws Exception;

    void disable() throws Exception;
}
