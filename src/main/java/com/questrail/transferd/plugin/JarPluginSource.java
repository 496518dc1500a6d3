package com.questrail.transferd.plugin;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JarPluginSource
 * -----------------------------------------------------------------------------
 * Loads a plugin from a directory laid out as {@code dir/*.jar} plus
 * {@code dir/lib/*.jar}.
 *
 * <p>Each {@link #resolve()} creates a new {@link ChildFirstClassLoader} over
 * those jars and discovers exactly one {@link DaemonPlugin} through
 * {@link ServiceLoader}. The class loader is closed on failure, and by the
 * plugin manager when the plugin is unloaded.</p>
 */
public final class JarPluginSource implements PluginSource
{
    private final String name;
    private final Path directory;
    private final ClassLoader parent;

    public JarPluginSource(String name, Path directory, ClassLoader parent) {
        this.name = Objects.requireNonNull(name, "name");
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    public Path directory() {
        return directory;
    }

    @Override
    public ResolvedPlugin resolve() throws PluginLoadException {
        URL[] urls = toUrls(resolveJars());
        URLClassLoader classLoader = new ChildFirstClassLoader(urls, parent);

        try {
            return new ResolvedPlugin(discoverSinglePlugin(classLoader), classLoader);
        } catch (PluginLoadException e) {
            closeQuietlyAfterFailure(classLoader, e);
            throw e;
        }
    }

    List<Path> resolveJars() throws PluginLoadException {
        if (!Files.isDirectory(directory)) {
            throw new PluginLoadException(name, "Plugin directory is missing or not a directory: " + directory);
        }
        List<Path> jars = new ArrayList<>();
        collectJars(directory, jars);
        Path lib = directory.resolve("lib");
        if (Files.isDirectory(lib)) {
            collectJars(lib, jars);
        }
        if (jars.isEmpty()) {
            throw new PluginLoadException(name, "No jar found under plugin directory: " + directory);
        }
        return jars;
    }

    private void collectJars(Path dir, List<Path> jars) throws PluginLoadException {
        try (Stream<Path> stream = Files.list(dir)) {
            jars.addAll(stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".jar"))
                    .sorted()
                    .collect(Collectors.toList()));
        } catch (IOException e) {
            throw new PluginLoadException(name, "Failed to list jars in " + dir, e);
        }
    }

    private URL[] toUrls(List<Path> jars) throws PluginLoadException {
        URL[] urls = new URL[jars.size()];
        for (int i = 0; i < jars.size(); i++) {
            try {
                urls[i] = jars.get(i).toUri().toURL();
            } catch (MalformedURLException e) {
                throw new PluginLoadException(name, "Invalid jar path " + jars.get(i), e);
            }
        }
        return urls;
    }

    private DaemonPlugin discoverSinglePlugin(ClassLoader classLoader) throws PluginLoadException {
        List<DaemonPlugin> found = new ArrayList<>();
        try {
            Iterator<DaemonPlugin> it = ServiceLoader.load(DaemonPlugin.class, classLoader).iterator();
            while (it.hasNext()) {
                DaemonPlugin candidate = it.next();
                // Providers visible through the parent belong to the daemon, not this plugin.
                if (candidate.getClass().getClassLoader() == classLoader) {
                    found.add(candidate);
                }
            }
        } catch (ServiceConfigurationError | LinkageError e) {
            throw new PluginLoadException(name, "Failed to instantiate plugin from " + directory, e);
        }

        if (found.isEmpty()) {
            throw new PluginLoadException(name, "No " + DaemonPlugin.class.getName() + " provider in " + directory);
        }
        if (found.size() > 1) {
            throw new PluginLoadException(name, "Expected exactly one plugin in " + directory + " but found "
                    + found.stream().map(p -> p.getClass().getName()).collect(Collectors.joining(", ")));
        }
        return found.get(0);
    }

    private static void closeQuietlyAfterFailure(URLClassLoader classLoader, PluginLoadException failure) {
        try {
            classLoader.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public String toString() {
        return "JarPluginSource[" + name + " @ " + directory + "]";
    }
}
