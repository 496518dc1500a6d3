package com.questrail.transferd.plugin;

import com.questrail.transferd.component.Component;
import com.questrail.transferd.event.EventManager;
import com.questrail.transferd.observability.DaemonErrorEvent;
import com.questrail.transferd.observability.DaemonObservabilitySink;
import com.questrail.transferd.observability.PluginLifecycleEvent;
import com.questrail.transferd.protocol.model.Event;
import com.questrail.transferd.rpc.OperationRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * PluginManager
 * =============================================================================
 * Loads and unloads plugins at runtime while requests and events keep
 * flowing.
 *
 * <h2>Load</h2>
 * <ol>
 *   <li>Resolve the plugin from its {@link PluginSource}.</li>
 *   <li>Call {@link DaemonPlugin#enable(PluginContext)} with a context scoped
 *       to the plugin's name.</li>
 *   <li>If anything fails, revoke the context, remove every operation and
 *       event handler tagged with the plugin's name, release the plugin's
 *       resources and report a {@link PluginLoadException}. The registries
 *       are left exactly as they were.</li>
 * </ol>
 *
 * <h2>Unload</h2>
 * {@link DaemonPlugin#disable()} is called best-effort; its failure is
 * reported but removal continues. The plugin's operations and handlers are
 * then removed and its resources released. Unloading a plugin that is not
 * loaded is a reported no-op.
 *
 * <h2>Thread safety</h2>
 * Loads and unloads are serialized by a lifecycle lock. Lookups used by
 * dispatch and publish are never blocked by it.
 */
public final class PluginManager implements Component
{
    public static final String COMPONENT_NAME = "PluginManager";

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final OperationRegistry registry;
    private final EventManager eventManager;
    private final PluginCatalog catalog;
    private final DaemonObservabilitySink observability;

    private final Object lifecycleLock = new Object();
    private final ConcurrentMap<String, LoadedPlugin> loaded = new ConcurrentHashMap<>();

    private record LoadedPlugin(ResolvedPlugin resolved, PluginContext context) {
        DaemonPlugin plugin() {
            return resolved.plugin();
        }
    }

    public PluginManager(OperationRegistry registry,
                         EventManager eventManager,
                         PluginCatalog catalog,
                         DaemonObservabilitySink observability)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.eventManager = Objects.requireNonNull(eventManager, "eventManager");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.observability = Objects.requireNonNull(observability, "observability");
    }

    @Override
    public String name() {
        return COMPONENT_NAME;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(EventManager.COMPONENT_NAME);
    }

    @Override
    public void shutdown() {
        unloadAll();
    }

    /**
     * Enable a plugin from the catalog.
     */
    public PluginRecord enable(String name) throws PluginLoadException {
        PluginSource source = catalog.find(name)
                .orElseThrow(() -> new PluginLoadException(name, "No plugin named '" + name + "' is available"));
        return load(name, source);
    }

    public PluginRecord load(String name, PluginSource source) throws PluginLoadException {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");

        synchronized (lifecycleLock) {
            if (loaded.containsKey(name)) {
                throw new PluginLoadException(name, "Plugin '" + name + "' is already enabled");
            }

            ResolvedPlugin resolved;
            try {
                resolved = source.resolve();
            } catch (PluginLoadException e) {
                reportLoadFailure(name, e);
                throw e;
            } catch (RuntimeException | LinkageError e) {
                throw failed(name, "Plugin '" + name + "' could not be resolved: " + e.getMessage(), e);
            }

            DaemonPlugin plugin = resolved.plugin();
            String declared;
            try {
                declared = plugin.name();
            } catch (VirtualMachineError e) {
                release(name, resolved);
                throw e;
            } catch (Throwable e) {
                release(name, resolved);
                throw failed(name, "Plugin '" + name + "' failed to report its name: " + e.getMessage(), e);
            }
            if (!name.equals(declared)) {
                release(name, resolved);
                throw failed(name, "Plugin requested as '" + name + "' declares name '" + declared + "'", null);
            }

            PluginContext context = new PluginContext(name, registry, eventManager);
            try {
                plugin.enable(context);
            } catch (VirtualMachineError e) {
                rollback(name, context);
                release(name, resolved);
                throw e;
            } catch (Throwable e) {
                rollback(name, context);
                release(name, resolved);
                throw failed(name, "Plugin '" + name + "' failed to enable: " + e.getMessage(), e);
            }

            loaded.put(name, new LoadedPlugin(resolved, context));
            observability.onPluginLifecycle(new PluginLifecycleEvent(Instant.now(), name, plugin.version(),
                    PluginLifecycleEvent.Action.LOADED, null));
            eventManager.publish(Event.of("plugin.enabled", name));
            return record(name);
        }
    }

    /**
     * @return {@code false} if the plugin was not loaded
     */
    public boolean unload(String name) {
        synchronized (lifecycleLock) {
            LoadedPlugin entry = loaded.remove(name);
            if (entry == null) {
                log.info("Plugin {} is not enabled; nothing to disable", name);
                return false;
            }

            DaemonPlugin plugin = entry.plugin();
            try {
                plugin.disable();
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                observability.onPluginLifecycle(new PluginLifecycleEvent(Instant.now(), name, plugin.version(),
                        PluginLifecycleEvent.Action.DISABLE_FAILED, e));
            } finally {
                rollback(name, entry.context());
                release(name, entry.resolved());
            }
            observability.onPluginLifecycle(new PluginLifecycleEvent(Instant.now(), name, plugin.version(),
                    PluginLifecycleEvent.Action.UNLOADED, null));
            eventManager.publish(Event.of("plugin.disabled", name));
            return true;
        }
    }

    public void unloadAll() {
        synchronized (lifecycleLock) {
            for (String name : new ArrayList<>(loaded.keySet())) {
                unload(name);
            }
        }
    }

    public boolean isLoaded(String name) {
        return loaded.containsKey(name);
    }

    public Optional<PluginRecord> get(String name) {
        if (!loaded.containsKey(name) && !catalog.available().contains(name)) {
            return Optional.empty();
        }
        return Optional.of(record(name));
    }

    /**
     * Every known plugin, from the catalog and currently loaded, sorted by name.
     */
    public List<PluginRecord> list() {
        Set<String> names = new TreeSet<>(catalog.available());
        names.addAll(loaded.keySet());
        List<PluginRecord> records = new ArrayList<>(names.size());
        for (String name : names) {
            records.add(record(name));
        }
        return records;
    }

    public Map<String, String> loadedVersions() {
        Map<String, String> versions = new TreeMap<>();
        loaded.forEach((name, entry) -> versions.put(name, entry.plugin().version()));
        return versions;
    }

    private PluginRecord record(String name) {
        LoadedPlugin entry = loaded.get(name);
        return new PluginRecord(name,
                entry == null ? null : entry.plugin().version(),
                entry != null,
                registry.operationNamesOwnedBy(name));
    }

    private void rollback(String name, PluginContext context) {
        context.revoke();
        List<String> operations = registry.unregisterAll(name);
        int handlers = eventManager.removeHandlers(name);
        log.debug("Removed {} operation(s) and {} event handler(s) of plugin {}", operations.size(), handlers, name);
    }

    private void release(String name, ResolvedPlugin resolved) {
        try {
            resolved.release();
        } catch (IOException e) {
            observability.onError(new DaemonErrorEvent(Instant.now(),
                    "Could not release resources of plugin " + name, e));
        }
    }

    private PluginLoadException failed(String name, String message, Throwable cause) {
        PluginLoadException e = new PluginLoadException(name, message, cause);
        reportLoadFailure(name, e);
        return e;
    }

    private void reportLoadFailure(String name, PluginLoadException e) {
        observability.onPluginLifecycle(new PluginLifecycleEvent(Instant.now(), name, null,
                PluginLifecycleEvent.Action.LOAD_FAILED, e));
    }
}
