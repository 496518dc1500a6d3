package com.questrail.transferd.protocol.codec;

/**
 * EnvelopeDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for envelope framing.
 *
 * <p>The decoder is invoked with exactly one complete frame: the transport has
 * already used the length prefix to delimit the byte stream. The decoder is
 * responsible only for:</p>
 * <ul>
 *   <li>Validating the header (magic, protocol version, type tag, flags)</li>
 *   <li>Checking the declared length against the bytes received</li>
 *   <li>Removing payload compression</li>
 * </ul>
 *
 * <p>It does not interpret the payload. Every failure at this layer is a
 * protocol error and is connection-fatal.</p>
 */
public interface EnvelopeDecoder
{
    /**
     * @param frame one complete frame, header included
     * @return the decoded envelope
     * @throws ProtocolException if the frame is malformed
     */
    Envelope decode(byte[] frame);
}
