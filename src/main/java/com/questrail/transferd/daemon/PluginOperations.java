package com.questrail.transferd.daemon;

import com.questrail.transferd.api.Arguments;
import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.api.CallContext;
import com.questrail.transferd.api.FaultException;
import com.questrail.transferd.plugin.PluginLoadException;
import com.questrail.transferd.plugin.PluginManager;
import com.questrail.transferd.protocol.model.FaultKind;
import com.questrail.transferd.rpc.OperationRecord;

import java.util.List;
import java.util.Objects;

/**
 * Built-in {@code plugin.*} operations.
 */
public final class PluginOperations
{
    private final PluginManager plugins;

    public PluginOperations(PluginManager plugins) {
        this.plugins = Objects.requireNonNull(plugins, "plugins");
    }

    public List<OperationRecord> operations() {
        return List.of(
                OperationRecord.builtIn("plugin.list", AuthLevel.READ_ONLY, this::list),
                OperationRecord.builtIn("plugin.enable", AuthLevel.ADMIN, this::enable),
                OperationRecord.builtIn("plugin.disable", AuthLevel.ADMIN, this::disable));
    }

    Object list(CallContext context, Arguments args) {
        return plugins.list();
    }

    Object enable(CallContext context, Arguments args) {
        String name = args.requireString(0, "name");
        try {
            return plugins.enable(name);
        } catch (PluginLoadException e) {
            throw new FaultException(FaultKind.PLUGIN_LOAD_ERROR, e.getMessage(), e);
        }
    }

    /**
     * @return {@code false} if the plugin was not enabled
     */
    Object disable(CallContext context, Arguments args) {
        return plugins.unload(args.requireString(0, "name"));
    }
}
