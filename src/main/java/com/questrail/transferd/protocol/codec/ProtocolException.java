package com.questrail.transferd.protocol.codec;

/**
 * Indicates malformed wire traffic: a broken frame, an unsupported protocol
 * version, an undecodable payload, or a message a client is not allowed to
 * send.
 *
 * <p>Protocol errors are unrecoverable at the session level: the connection
 * that produced one is closed.</p>
 */
public final class ProtocolException extends RuntimeException
{
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
