package com.questrail.transferd.protocol.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single call issued by a client.
 *
 * <p>{@code requestId} is chosen by the client and must be unique among that
 * session's outstanding requests. Arguments are plain wire values: strings,
 * numbers, booleans, {@code null}, lists and string-keyed maps.</p>
 */
public record Request(
        long requestId,
        String operation,
        List<Object> args,
        Map<String, Object> kwargs
) implements DaemonMessage {

    public Request {
        Objects.requireNonNull(operation, "operation");
        // Wire values may be null, so List.copyOf/Map.copyOf are not usable here.
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public static Request of(long requestId, String operation, Object... args) {
        return new Request(requestId, operation, Arrays.asList(args), Map.of());
    }

    @Override
    public MessageType type() {
        return MessageType.REQUEST;
    }
}
