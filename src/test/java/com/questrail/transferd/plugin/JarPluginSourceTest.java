package com.questrail.transferd.plugin;

import com.questrail.sample.EchoPlugin;
import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.event.EventManager;
import com.questrail.transferd.protocol.model.Request;
import com.questrail.transferd.rpc.OperationRegistry;
import com.questrail.transferd.rpc.RpcDispatcher;
import com.questrail.transferd.session.Session;
import com.questrail.transferd.session.TestSessions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JarPluginSourceTest
 * -----------------------------------------------------------------------------
 * Loads plugins from jars assembled at test time out of compiled test
 * classes, so that the isolated class loader path runs for real.
 */
final class JarPluginSourceTest
{
    private static final String SERVICE_FILE = "META-INF/services/" + DaemonPlugin.class.getName();

    @TempDir
    Path root;

    private final ClassLoader parent = getClass().getClassLoader();

    private static void writePluginJar(Path jar, Class<?> pluginClass) throws IOException
    {
        Files.createDirectories(jar.getParent());
        String classEntry = pluginClass.getName().replace('.', '/') + ".class";
        try (OutputStream out = Files.newOutputStream(jar);
             JarOutputStream jarOut = new JarOutputStream(out);
             InputStream classBytes = pluginClass.getClassLoader().getResourceAsStream(classEntry))
        {
            assertNotNull(classBytes, "compiled class not found: " + classEntry);
            jarOut.putNextEntry(new JarEntry(classEntry));
            classBytes.transferTo(jarOut);
            jarOut.closeEntry();

            jarOut.putNextEntry(new JarEntry(SERVICE_FILE));
            jarOut.write((pluginClass.getName() + "\n").getBytes(StandardCharsets.UTF_8));
            jarOut.closeEntry();
        }
    }

    @Test
    void pluginClassIsLoadedInItsOwnClassLoader() throws Exception
    {
        writePluginJar(root.resolve("echo/echo-plugin.jar"), EchoPlugin.class);

        ResolvedPlugin resolved = new JarPluginSource("echo", root.resolve("echo"), parent).resolve();
        try {
            DaemonPlugin plugin = resolved.plugin();
            assertEquals("echo", plugin.name());
            assertEquals(EchoPlugin.class.getName(), plugin.getClass().getName());
            assertNotSame(EchoPlugin.class, plugin.getClass());
            assertInstanceOf(ChildFirstClassLoader.class, plugin.getClass().getClassLoader());
        } finally {
            resolved.release();
        }
    }

    @Test
    void jarsUnderLibAreOnThePluginClassPath() throws Exception
    {
        writePluginJar(root.resolve("echo/lib/echo-plugin.jar"), EchoPlugin.class);
        Files.writeString(root.resolve("echo/README.txt"), "not a jar");

        List<Path> jars = new JarPluginSource("echo", root.resolve("echo"), parent).resolveJars();

        assertEquals(1, jars.size());
        assertTrue(jars.get(0).endsWith(Path.of("lib", "echo-plugin.jar")));
    }

    @Test
    void providerVisibleThroughDaemonClassPathIsNotAPlugin() throws Exception
    {
        writePluginJar(root.resolve("label/label.jar"), LabelPlugin.class);

        PluginLoadException e = assertThrows(PluginLoadException.class,
                () -> new JarPluginSource("label", root.resolve("label"), parent).resolve());
        assertTrue(e.getMessage().contains("provider"), e.getMessage());
    }

    @Test
    void missingDirectoryOrJarIsALoadError() throws Exception
    {
        assertThrows(PluginLoadException.class,
                () -> new JarPluginSource("ghost", root.resolve("ghost"), parent).resolve());

        Files.createDirectories(root.resolve("empty"));
        PluginLoadException e = assertThrows(PluginLoadException.class,
                () -> new JarPluginSource("empty", root.resolve("empty"), parent).resolve());
        assertEquals("empty", e.plugin());
    }

    @Test
    void catalogListsPluginDirectoriesAndRefusesPathTricks() throws Exception
    {
        writePluginJar(root.resolve("echo/echo-plugin.jar"), EchoPlugin.class);
        Files.createDirectories(root.resolve("other"));
        Files.writeString(root.resolve("stray.jar"), "x");

        DirectoryPluginCatalog catalog = new DirectoryPluginCatalog(root, parent);

        assertEquals(List.of("echo", "other"), catalog.available());
        assertTrue(catalog.find("echo").isPresent());
        assertTrue(catalog.find("../echo").isEmpty());
        assertTrue(catalog.find("missing").isEmpty());
        assertTrue(new DirectoryPluginCatalog(root.resolve("nowhere"), parent).available().isEmpty());
    }

    @Test
    void jarPluginOperationsServeCallsUntilDisabled() throws Exception
    {
        writePluginJar(root.resolve("echo/echo-plugin.jar"), EchoPlugin.class);
        TestSessions fixture = new TestSessions();
        OperationRegistry registry = new OperationRegistry();
        EventManager events = new EventManager(Runnable::run, fixture.sink);
        PluginManager plugins = new PluginManager(registry, events, new DirectoryPluginCatalog(root, parent), fixture.sink);
        RpcDispatcher dispatcher = new RpcDispatcher(registry, fixture.codec, fixture.sink);
        Session reader = fixture.loggedIn("c1", AuthLevel.READ_ONLY);

        PluginRecord record = plugins.enable("echo");

        assertEquals(List.of("echo.echo"), record.operations());
        assertEquals("hello", dispatcher.dispatch(reader, Request.of(1, "echo.echo", "hello")).result());

        assertTrue(plugins.unload("echo"));
        assertFalse(registry.contains("echo.echo"));
    }
}
