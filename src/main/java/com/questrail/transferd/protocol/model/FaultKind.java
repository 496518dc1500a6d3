package com.questrail.transferd.protocol.model;

import java.util.Optional;

/**
 * Fault taxonomy as it appears on the wire.
 *
 * <p>A protocol error is deliberately absent: malformed traffic closes the
 * connection and is never answered with a fault.</p>
 */
public enum FaultKind
{
    /** Bad credentials, or a session below the operation's required level. */
    AUTH_ERROR("AuthError"),

    /** No operation registered under the requested name. */
    METHOD_NOT_FOUND("MethodNotFound"),

    /** The operation's implementation failed. */
    HANDLER_ERROR("HandlerError"),

    /** The caller passed arguments the operation cannot accept. */
    INVALID_ARGUMENTS("InvalidArguments"),

    /** A plugin could not be loaded; registries are unchanged. */
    PLUGIN_LOAD_ERROR("PluginLoadError"),

    /** The handler overran the configured invocation deadline. */
    TIMEOUT("Timeout");

    private final String wireName;

    FaultKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<FaultKind> fromWireName(String name) {
        for (FaultKind kind : values()) {
            if (kind.wireName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
