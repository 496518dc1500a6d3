package com.questrail.transferd.component;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ComponentRegistry
 * =============================================================================
 * Owns the lifecycle of the daemon's components.
 *
 * <h2>Ordering</h2>
 * <ul>
 *   <li>{@link #start(String)} starts a component's dependencies first; only
 *       STOPPED components are started.</li>
 *   <li>{@link #stop()} stops components in reverse start order;
 *       {@link #stop(String)} stops started dependents first.</li>
 *   <li>{@link #shutdown()} stops everything and then calls
 *       {@link Component#shutdown()} on each component. A failing component
 *       is logged and never aborts the sequence.</li>
 * </ul>
 *
 * <h2>Thread safety</h2>
 * All lifecycle operations are serialized on the registry monitor.
 */
public final class ComponentRegistry
{
    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    private final Map<String, Component> components = new LinkedHashMap<>();
    private final Map<String, ComponentState> states = new LinkedHashMap<>();
    private final Deque<String> startOrder = new ArrayDeque<>();

    public synchronized void register(Component component) {
        Objects.requireNonNull(component, "component");
        String name = Objects.requireNonNull(component.name(), "component.name()");
        if (components.containsKey(name)) {
            throw new IllegalStateException("Component already registered: " + name);
        }
        components.put(name, component);
        states.put(name, ComponentState.STOPPED);
        log.debug("Registered component {}", name);
    }

    /**
     * Stops (if started) and removes a component. Unknown names are ignored.
     */
    public synchronized void deregister(String name) {
        if (!components.containsKey(name)) {
            return;
        }
        log.debug("Deregistering component {}", name);
        stop(name);
        components.remove(name);
        states.remove(name);
    }

    public synchronized Optional<Component> get(String name) {
        return Optional.ofNullable(components.get(name));
    }

    public synchronized <T extends Component> T get(String name, Class<T> type) {
        Component component = components.get(name);
        if (component == null) {
            throw new IllegalArgumentException("No component named " + name);
        }
        return type.cast(component);
    }

    public synchronized ComponentState state(String name) {
        ComponentState state = states.get(name);
        if (state == null) {
            throw new IllegalArgumentException("No component named " + name);
        }
        return state;
    }

    public synchronized void start() {
        for (String name : new ArrayList<>(components.keySet())) {
            start(name);
        }
    }

    public synchronized void start(String name) {
        startRecursive(name, new HashSet<>());
    }

    private void startRecursive(String name, Set<String> visiting) {
        Component component = components.get(name);
        if (component == null) {
            throw new IllegalArgumentException("No component named " + name);
        }
        if (!visiting.add(name)) {
            throw new IllegalStateException("Dependency cycle through component " + name);
        }
        for (String dependency : component.dependencies()) {
            startRecursive(dependency, visiting);
        }
        visiting.remove(name);

        if (states.get(name) == ComponentState.STOPPED) {
            log.debug("Starting component {}", name);
            component.start();
            states.put(name, ComponentState.STARTED);
            startOrder.push(name);
        }
    }

    public synchronized void stop() {
        // startOrder is a stack: most recently started first.
        for (String name : new ArrayList<>(startOrder)) {
            if (components.containsKey(name)) {
                stop(name);
            }
        }
    }

    public synchronized void stop(String name) {
        if (states.get(name) != ComponentState.STARTED) {
            return;
        }
        for (Map.Entry<String, Component> entry : components.entrySet()) {
            if (entry.getValue().dependencies().contains(name)) {
                stop(entry.getKey());
            }
        }
        log.debug("Stopping component {}", name);
        try {
            components.get(name).stop();
        } catch (RuntimeException e) {
            log.error("Component {} failed to stop cleanly", name, e);
        }
        states.put(name, ComponentState.STOPPED);
        startOrder.remove(name);
    }

    public synchronized void shutdown() {
        stop();
        List<String> names = new ArrayList<>(components.keySet());
        for (String name : names) {
            log.debug("Shutting down component {}", name);
            try {
                components.get(name).shutdown();
            } catch (RuntimeException e) {
                log.error("Component {} failed during shutdown", name, e);
            }
        }
    }
}
