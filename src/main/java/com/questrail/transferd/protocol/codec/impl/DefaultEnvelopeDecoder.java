package com.questrail.transferd.protocol.codec.impl;

import com.questrail.transferd.protocol.codec.Envelope;
import com.questrail.transferd.protocol.codec.EnvelopeDecoder;
import com.questrail.transferd.protocol.codec.ProtocolException;
import com.questrail.transferd.protocol.model.MessageType;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * DefaultEnvelopeDecoder
 * -----------------------------------------------------------------------------
 * Concrete {@link EnvelopeDecoder}. Steps, in order:
 * <ol>
 *   <li>Header: magic, version, type tag, flags</li>
 *   <li>Length: declared payload length must match the bytes received and the
 *       configured maximum</li>
 *   <li>Decompression, when the compressed flag is set</li>
 * </ol>
 */
public final class DefaultEnvelopeDecoder implements EnvelopeDecoder
{
    private final int maxPayloadLength;

    public DefaultEnvelopeDecoder()
    {
        this(EnvelopeFraming.DEFAULT_MAX_PAYLOAD_LENGTH);
    }

    public DefaultEnvelopeDecoder(int maxPayloadLength)
    {
        if (maxPayloadLength <= 0) {
            throw new IllegalArgumentException("maxPayloadLength must be > 0");
        }
        this.maxPayloadLength = maxPayloadLength;
    }

    @Override
    public Envelope decode(byte[] frame)
    {
        if (frame == null || frame.length < EnvelopeFraming.HEADER_LENGTH) {
            throw new ProtocolException("Frame shorter than envelope header");
        }

        ByteBuffer buf = ByteBuffer.wrap(frame);

        int magic = buf.get() & 0xFF;
        if (magic != EnvelopeFraming.MAGIC) {
            throw new ProtocolException(String.format("Bad magic byte 0x%02X", magic));
        }

        int version = buf.get() & 0xFF;
        if (version != EnvelopeFraming.PROTOCOL_VERSION) {
            throw new ProtocolException("Unsupported protocol version " + version);
        }

        int typeCode = buf.get() & 0xFF;
        MessageType type = MessageType.fromCode(typeCode)
                .orElseThrow(() -> new ProtocolException("Unknown message type " + typeCode));

        int flags = buf.get() & 0xFF;
        if ((flags & ~EnvelopeFraming.KNOWN_FLAGS) != 0) {
            throw new ProtocolException(String.format("Unknown flags 0x%02X", flags));
        }

        int length = buf.getInt();
        if (length < 0 || length > maxPayloadLength) {
            throw new ProtocolException("Declared payload length " + length + " out of range");
        }
        if (frame.length - EnvelopeFraming.HEADER_LENGTH != length) {
            throw new ProtocolException("Declared payload length " + length + " does not match frame ("
                    + (frame.length - EnvelopeFraming.HEADER_LENGTH) + " bytes)");
        }

        byte[] wirePayload = Arrays.copyOfRange(frame, EnvelopeFraming.HEADER_LENGTH, frame.length);

        boolean compressed = (flags & EnvelopeFraming.FLAG_COMPRESSED) != 0;
        byte[] payload = compressed
                ? PayloadCompression.inflate(wirePayload, maxPayloadLength)
                : wirePayload;

        return new Envelope(version, type, compressed, payload);
    }
}
