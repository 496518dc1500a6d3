package com.questrail.transferd.transport;

import java.net.SocketAddress;
import java.util.concurrent.CompletionStage;

/**
 * Connection
 * -----------------------------------------------------------------------------
 * One live, encrypted client connection as seen above the transport adapter.
 *
 * <p>Frames are complete envelopes as {@code byte[]}; no framework buffer
 * types cross this boundary.</p>
 */
public interface Connection
{
    /** Transport-assigned identifier, unique among live connections. */
    String id();

    SocketAddress remoteAddress();

    /**
     * Write one complete frame.
     *
     * <p>The returned stage completes once the transport has accepted the
     * frame (flushed to the socket), or exceptionally if the write failed.
     * Callers wait on it before writing the next frame of the same session,
     * which is how outbound backpressure reaches the session writer.</p>
     */
    CompletionStage<Void> write(byte[] frame);

    boolean isOpen();

    /** Close the connection. Idempotent. */
    void close();
}
