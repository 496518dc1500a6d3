package com.questrail.transferd.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Catalog over a plugin root directory: every direct sub-directory is one
 * plugin, named after the directory. The directory is scanned on each call,
 * so plugins dropped in at runtime become available without a restart.
 */
public final class DirectoryPluginCatalog implements PluginCatalog
{
    private static final Logger log = LoggerFactory.getLogger(DirectoryPluginCatalog.class);

    private final Path root;
    private final ClassLoader parent;

    public DirectoryPluginCatalog(Path root, ClassLoader parent) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    @Override
    public List<String> available() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(root)) {
            return stream.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to list plugin root {}", root, e);
            return List.of();
        }
    }

    @Override
    public Optional<PluginSource> find(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.startsWith(".")) {
            return Optional.empty();
        }
        Path dir = root.resolve(name);
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        return Optional.of(new JarPluginSource(name, dir, parent));
    }
}
