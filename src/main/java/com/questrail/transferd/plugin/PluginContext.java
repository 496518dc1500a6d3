package com.questrail.transferd.plugin;

import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.api.OperationHandler;
import com.questrail.transferd.event.EventHandler;
import com.questrail.transferd.event.EventManager;
import com.questrail.transferd.event.HandlerRegistration;
import com.questrail.transferd.protocol.model.Event;
import com.questrail.transferd.rpc.DuplicateOperationException;
import com.questrail.transferd.rpc.OperationRecord;
import com.questrail.transferd.rpc.OperationRegistry;

import java.util.Locale;
import java.util.Objects;

/**
 * PluginContext
 * -----------------------------------------------------------------------------
 * The daemon as one plugin sees it.
 *
 * <p>Every registration made through a context carries the plugin's name as
 * owner tag. Operation names are placed in the plugin's namespace: a plugin
 * named {@code Label} registering {@code set} exposes {@code label.set}; a
 * name that already starts with {@code label.} is kept as is.</p>
 *
 * <p>Once the plugin is unloaded, or its load failed, the context is revoked
 * and every further registration attempt fails with
 * {@link IllegalStateException}.</p>
 */
public final class PluginContext
{
    private final String pluginName;
    private final String namespace;
    private final OperationRegistry registry;
    private final EventManager eventManager;

    // guarded by this
    private boolean revoked;

    PluginContext(String pluginName, OperationRegistry registry, EventManager eventManager) {
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.namespace = pluginName.toLowerCase(Locale.ROOT);
        this.registry = Objects.requireNonNull(registry, "registry");
        this.eventManager = Objects.requireNonNull(eventManager, "eventManager");
    }

    public String pluginName() {
        return pluginName;
    }

    /**
     * Register an operation owned by this plugin.
     *
     * @param requiredLevel minimum level; {@code null} makes the operation unreachable
     * @return the fully qualified operation name
     * @throws DuplicateOperationException if the qualified name is taken
     */
    public synchronized String registerOperation(String name, AuthLevel requiredLevel, OperationHandler handler) {
        ensureActive();
        String qualified = qualify(name);
        registry.register(new OperationRecord(qualified, handler, requiredLevel, pluginName));
        return qualified;
    }

    public synchronized HandlerRegistration subscribe(String eventName, EventHandler handler) {
        ensureActive();
        return eventManager.subscribeHandler(pluginName, eventName, handler);
    }

    /**
     * Publish an event to sessions and handlers.
     */
    public void publish(String eventName, Object value) {
        ensureActive();
        eventManager.publish(Event.of(eventName, value));
    }

    String qualify(String name) {
        Objects.requireNonNull(name, "name");
        return name.startsWith(namespace + ".") ? name : namespace + "." + name;
    }

    synchronized void revoke() {
        revoked = true;
    }

    synchronized boolean isRevoked() {
        return revoked;
    }

    private synchronized void ensureActive() {
        if (revoked) {
            throw new IllegalStateException("Plugin context for " + pluginName + " is no longer active");
        }
    }
}
