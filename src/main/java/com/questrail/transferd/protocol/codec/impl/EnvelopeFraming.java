package com.questrail.transferd.protocol.codec.impl;

/**
 * EnvelopeFraming
 * -----------------------------------------------------------------------------
 * Constants of the envelope header. See the package documentation of
 * {@code com.questrail.transferd.protocol.codec} for the full layout.
 */
public final class EnvelopeFraming
{
    /** First byte of every frame ('T'). */
    public static final int MAGIC = 0x54;

    /** The only protocol version this daemon speaks. */
    public static final int PROTOCOL_VERSION = 1;

    /** Fixed header size in bytes. */
    public static final int HEADER_LENGTH = 8;

    /** Offset of the big-endian payload length field. */
    public static final int LENGTH_FIELD_OFFSET = 4;

    /** Size of the payload length field. */
    public static final int LENGTH_FIELD_LENGTH = 4;

    /** Flag bit: payload is deflate-compressed. */
    public static final int FLAG_COMPRESSED = 0x01;

    /** Flags this version understands; any other bit set is a protocol error. */
    static final int KNOWN_FLAGS = FLAG_COMPRESSED;

    /** Default upper bound for a single payload (16 MiB). */
    public static final int DEFAULT_MAX_PAYLOAD_LENGTH = 16 * 1024 * 1024;

    private EnvelopeFraming() {}
}
