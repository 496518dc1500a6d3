package com.questrail.transferd.protocol.codec;

/**
 * EnvelopeEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for envelope framing.
 *
 * <p>This encoder does NOT decide what to send. It applies the mechanical
 * rules only: optional payload compression, header, length prefix. The
 * returned bytes are ready for immediate transmission.</p>
 */
public interface EnvelopeEncoder
{
    byte[] encode(Envelope envelope);
}
