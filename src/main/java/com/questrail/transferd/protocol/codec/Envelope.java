package com.questrail.transferd.protocol.codec;

import com.questrail.transferd.protocol.model.MessageType;

import java.util.Arrays;
import java.util.Objects;

/**
 * Envelope
 * -----------------------------------------------------------------------------
 * One framed unit of wire traffic, <em>after</em> framing and decompression.
 *
 * <p>{@code payload} is always the plain (uncompressed) payload bytes.
 * {@code compressed} records whether the payload travels deflate-compressed on
 * the wire; the envelope encoder applies the compression, the decoder removes
 * it.</p>
 */
public record Envelope(int version, MessageType type, boolean compressed, byte[] payload) {

    public Envelope {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Envelope other)) {
            return false;
        }
        return version == other.version
                && compressed == other.compressed
                && type == other.type
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, type, compressed, Arrays.hashCode(payload));
    }

    @Override
    public String toString() {
        return "Envelope[version=" + version + ", type=" + type + ", compressed=" + compressed
                + ", payloadLength=" + payload.length + "]";
    }
}
