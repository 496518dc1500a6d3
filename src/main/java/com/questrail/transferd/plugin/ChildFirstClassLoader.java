package com.questrail.transferd.plugin;

import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Child-first class loader with a parent-first allow-list.
 *
 * <p>Plugin jars win over the daemon's class path, except for the JDK, SLF4J
 * and the daemon's own packages, which must resolve to a single copy so that
 * plugin and daemon agree on the SPI types.</p>
 */
public class ChildFirstClassLoader extends URLClassLoader
{
    public static final List<String> DEFAULT_PARENT_FIRST_PACKAGES = List.of(
            "java.",
            "javax.",
            "jdk.",
            "sun.",
            "com.sun.",
            "org.slf4j.",
            "com.questrail.transferd.");

    static {
        ClassLoader.registerAsParallelCapable();
    }

    private final List<String> parentFirstPackages;

    public ChildFirstClassLoader(URL[] urls, ClassLoader parent) {
        this(urls, parent, DEFAULT_PARENT_FIRST_PACKAGES);
    }

    public ChildFirstClassLoader(URL[] urls, ClassLoader parent, List<String> parentFirstPackages) {
        super(urls, parent);
        this.parentFirstPackages = parentFirstPackages != null
                ? Collections.unmodifiableList(new ArrayList<>(parentFirstPackages))
                : DEFAULT_PARENT_FIRST_PACKAGES;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> loaded = findLoadedClass(name);
            if (loaded != null) {
                return loaded;
            }
            if (isParentFirst(name)) {
                return super.loadClass(name, resolve);
            }
            try {
                Class<?> clazz = findClass(name);
                if (resolve) {
                    resolveClass(clazz);
                }
                return clazz;
            } catch (ClassNotFoundException notInPlugin) {
                return super.loadClass(name, resolve);
            }
        }
    }

    boolean isParentFirst(String className) {
        for (String prefix : parentFirstPackages) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
