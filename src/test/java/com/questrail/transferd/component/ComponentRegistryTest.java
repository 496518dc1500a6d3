package com.questrail.transferd.component;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ComponentRegistryTest
{
    private final List<String> log = new ArrayList<>();
    private final ComponentRegistry registry = new ComponentRegistry();

    private final class Recording implements Component
    {
        private final String name;
        private final Set<String> dependencies;
        private boolean failOnStop;

        Recording(String name, String... dependencies) {
            this.name = name;
            this.dependencies = Set.of(dependencies);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Set<String> dependencies() {
            return dependencies;
        }

        @Override
        public void start() {
            log.add("start " + name);
        }

        @Override
        public void stop() {
            log.add("stop " + name);
            if (failOnStop) {
                throw new IllegalStateException("stop failed");
            }
        }

        @Override
        public void shutdown() {
            log.add("shutdown " + name);
        }
    }

    @Test
    void dependenciesStartFirstAndStopLast()
    {
        registry.register(new Recording("RpcServer", "Sessions", "Events"));
        registry.register(new Recording("Events"));
        registry.register(new Recording("Sessions"));

        registry.start();
        assertEquals(3, log.size());
        assertTrue(log.subList(0, 2).containsAll(List.of("start Events", "start Sessions")));
        assertEquals("start RpcServer", log.get(2));
        assertEquals(ComponentState.STARTED, registry.state("Events"));

        log.clear();
        registry.stop();

        assertEquals("stop RpcServer", log.get(0));
        assertEquals(3, log.size());
        assertEquals(ComponentState.STOPPED, registry.state("RpcServer"));
    }

    @Test
    void startingOneComponentStartsItsDependencies()
    {
        registry.register(new Recording("Plugins", "Events"));
        registry.register(new Recording("Events"));
        registry.register(new Recording("Unrelated"));

        registry.start("Plugins");

        assertEquals(List.of("start Events", "start Plugins"), log);
        assertEquals(ComponentState.STOPPED, registry.state("Unrelated"));
    }

    @Test
    void startIsIdempotent()
    {
        registry.register(new Recording("Events"));

        registry.start();
        registry.start();

        assertEquals(List.of("start Events"), log);
    }

    @Test
    void stoppingAComponentStopsItsDependentsFirst()
    {
        registry.register(new Recording("Events"));
        registry.register(new Recording("Plugins", "Events"));
        registry.start();
        log.clear();

        registry.stop("Events");

        assertEquals(List.of("stop Plugins", "stop Events"), log);
    }

    @Test
    void duplicateNamesAndCyclesAreRejected()
    {
        registry.register(new Recording("A", "B"));
        registry.register(new Recording("B", "A"));

        assertThrows(IllegalStateException.class, () -> registry.register(new Recording("A")));
        assertThrows(IllegalStateException.class, () -> registry.start("A"));
    }

    @Test
    void unknownDependencyFailsStart()
    {
        registry.register(new Recording("A", "Missing"));

        assertThrows(IllegalArgumentException.class, () -> registry.start());
    }

    @Test
    void shutdownStopsThenShutsDownEvenWhenAStopFails()
    {
        Recording failing = new Recording("Events");
        failing.failOnStop = true;
        registry.register(failing);
        registry.register(new Recording("Sessions"));
        registry.start();
        log.clear();

        registry.shutdown();

        assertTrue(log.contains("stop Events"));
        assertTrue(log.contains("stop Sessions"));
        assertTrue(log.containsAll(List.of("shutdown Events", "shutdown Sessions")));
        assertEquals(ComponentState.STOPPED, registry.state("Events"));
    }

    @Test
    void deregisterStopsAndForgets()
    {
        registry.register(new Recording("Events"));
        registry.start();

        registry.deregister("Events");

        assertTrue(log.contains("stop Events"));
        assertTrue(registry.get("Events").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> registry.state("Events"));
    }

    @Test
    void typedLookup()
    {
        Recording events = new Recording("Events");
        registry.register(events);

        assertSame(events, registry.get("Events", Component.class));
        assertThrows(IllegalArgumentException.class, () -> registry.get("Nope", Component.class));
    }
}
