package com.questrail.sample;

import com.questrail.transferd.api.Arguments;
import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.api.CallContext;
import com.questrail.transferd.api.OperationHandler;
import com.questrail.transferd.plugin.DaemonPlugin;
import com.questrail.transferd.plugin.PluginContext;

/**
 * Plugin packaged into a jar at test time. Kept free of lambdas and nested
 * classes so that its single class file is the whole plugin.
 */
public final class EchoPlugin implements DaemonPlugin, OperationHandler
{
    @Override
    public String name() {
        return "echo";
    }

    @Override
    public String version() {
        return "1.0";
    }

    @Override
    public void enable(PluginContext context) {
        context.registerOperation("echo", AuthLevel.READ_ONLY, this);
    }

    @Override
    public void disable() {
    }

    @Override
    public Object handle(CallContext context, Arguments arguments) {
        return arguments.requireString(0, "text");
    }
}
