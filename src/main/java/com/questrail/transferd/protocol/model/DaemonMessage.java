package com.questrail.transferd.protocol.model;

/**
 * DaemonMessage
 * -----------------------------------------------------------------------------
 * Semantic message carried by one envelope.
 *
 * <p>Messages are immutable values. They are produced by the payload codec
 * from a decoded envelope (inbound) or by the daemon core (outbound) and never
 * carry transport or framing details.</p>
 *
 * <pre>
 *   Request   client → daemon   (one call)
 *   Response  daemon → client   (exactly one per Request, same id)
 *   Event     daemon → client   (fan-out notification)
 * </pre>
 */
public sealed interface DaemonMessage
        permits Request, Response, Event
{
    /**
     * The envelope type tag this message travels under.
     */
    MessageType type();
}
