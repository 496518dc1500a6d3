package com.questrail.transferd.plugin;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;

/**
 * A plugin instance together with whatever must be released once it is
 * unloaded (typically its class loader).
 */
public record ResolvedPlugin(DaemonPlugin plugin, Closeable resources)
{
    public ResolvedPlugin {
        Objects.requireNonNull(plugin, "plugin");
    }

    public static ResolvedPlugin of(DaemonPlugin plugin) {
        return new ResolvedPlugin(plugin, null);
    }

    void release() throws IOException {
        if (resources != null) {
            resources.close();
        }
    }
}
