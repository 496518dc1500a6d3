package com.questrail.transferd.protocol.codec.impl;

import com.questrail.transferd.protocol.codec.Envelope;
import com.questrail.transferd.protocol.codec.EnvelopeEncoder;

import java.nio.ByteBuffer;

/**
 * DefaultEnvelopeEncoder
 * -----------------------------------------------------------------------------
 * Concrete {@link EnvelopeEncoder}: compresses the payload when the envelope
 * asks for it, then writes header and length prefix.
 */
public final class DefaultEnvelopeEncoder implements EnvelopeEncoder
{
    @Override
    public byte[] encode(Envelope envelope)
    {
        byte[] plain = envelope.payload();
        byte[] wirePayload = envelope.compressed() ? PayloadCompression.deflate(plain) : plain;

        int flags = envelope.compressed() ? EnvelopeFraming.FLAG_COMPRESSED : 0;

        ByteBuffer buf = ByteBuffer.allocate(EnvelopeFraming.HEADER_LENGTH + wirePayload.length);
        buf.put((byte) EnvelopeFraming.MAGIC);
        buf.put((byte) envelope.version());
        buf.put((byte) envelope.type().code());
        buf.put((byte) flags);
        buf.putInt(wirePayload.length);
        buf.put(wirePayload);
        return buf.array();
    }
}
