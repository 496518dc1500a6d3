package com.questrail.transferd.protocol.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Answer to exactly one {@link Request}, carrying the same request id and
 * either a result value or a {@link Fault}.
 */
public record Response(long requestId, Object result, Fault fault) implements DaemonMessage {

    public Response {
        if (fault != null && result != null) {
            throw new IllegalArgumentException("a response carries either a result or a fault, not both");
        }
    }

    public static Response success(long requestId, Object result) {
        return new Response(requestId, result, null);
    }

    public static Response failure(long requestId, Fault fault) {
        return new Response(requestId, null, Objects.requireNonNull(fault, "fault"));
    }

    public static Response failure(long requestId, FaultKind kind, String message) {
        return failure(requestId, new Fault(kind, message));
    }

    public boolean isFault() {
        return fault != null;
    }

    public Optional<Fault> faultIfAny() {
        return Optional.ofNullable(fault);
    }

    @Override
    public MessageType type() {
        return MessageType.RESPONSE;
    }
}
