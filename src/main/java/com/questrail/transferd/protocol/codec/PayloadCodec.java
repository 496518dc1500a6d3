package com.questrail.transferd.protocol.codec;

import com.questrail.transferd.protocol.model.DaemonMessage;

/**
 * PayloadCodec
 * -----------------------------------------------------------------------------
 * Semantic step of the codec pipeline:
 *
 * <pre>
 *   inbound   Envelope → PayloadCodec.decode → DaemonMessage
 *   outbound  DaemonMessage → PayloadCodec.encode → Envelope
 * </pre>
 *
 * <p>The codec also owns the definition of a <em>wire-safe value</em>, so
 * that the dispatcher can normalize handler results before they are queued
 * and a result the codec cannot represent becomes a fault instead of a broken
 * connection.</p>
 */
public interface PayloadCodec
{
    /**
     * @throws ProtocolException if the payload does not describe a valid message
     */
    DaemonMessage decode(Envelope envelope);

    /**
     * @param compress whether the resulting envelope should travel compressed
     */
    Envelope encode(DaemonMessage message, boolean compress);

    /**
     * Converts an arbitrary handler result into plain wire values (maps,
     * lists, strings, numbers, booleans, {@code null}).
     *
     * @throws IllegalArgumentException if the value cannot be represented on the wire
     */
    Object normalize(Object value);
}
