package com.questrail.transferd.protocol.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A state-change notification fanned out to subscribed sessions.
 *
 * <p>Events are ephemeral: they are never persisted or replayed.</p>
 */
public record Event(String name, Object value, Instant timestamp) implements DaemonMessage {

    public Event {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Event of(String name, Object value) {
        return new Event(name, value, Instant.now());
    }

    @Override
    public MessageType type() {
        return MessageType.EVENT;
    }
}
