package com.questrail.transferd.protocol.model;

import java.util.Optional;

/**
 * Envelope type tag.
 */
public enum MessageType
{
    REQUEST(1),
    RESPONSE(2),
    EVENT(3);

    private final int code;

    MessageType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<MessageType> fromCode(int code) {
        for (MessageType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
