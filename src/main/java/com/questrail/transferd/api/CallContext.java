package com.questrail.transferd.api;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * CallContext
 * -----------------------------------------------------------------------------
 * Identity of the session invoking an operation, passed explicitly to the
 * handler for exactly one call.
 *
 * <p>The context is an immutable snapshot taken when the call is authorized.
 * It is never stored in a shared or thread-local slot, so concurrently
 * executing calls cannot observe each other's identity.</p>
 *
 * @param sessionId     id of the invoking session
 * @param username      authenticated account name, {@code null} before login
 * @param level         session level at authorization time
 * @param remoteAddress peer address of the session's connection
 * @param requestId     id of the request being served
 * @param operation     fully qualified operation name
 */
public record CallContext(
        int sessionId,
        String username,
        AuthLevel level,
        SocketAddress remoteAddress,
        long requestId,
        String operation
) {
    public CallContext {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(operation, "operation");
    }

    public Optional<String> user() {
        return Optional.ofNullable(username);
    }
}
