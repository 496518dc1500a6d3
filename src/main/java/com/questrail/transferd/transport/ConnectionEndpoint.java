package com.questrail.transferd.transport;

import java.net.SocketAddress;
import java.util.Optional;

/**
 * ConnectionEndpoint
 * -----------------------------------------------------------------------------
 * Port for the listening side of the transport.
 *
 * <p>Implementations perform transport I/O only: accept, encrypt, cut the
 * byte stream into length-prefixed frames and write frames back. They do not
 * decode envelopes or interpret messages.</p>
 */
public interface ConnectionEndpoint
{
    /**
     * Register the listener. Must be called before {@link #start()}.
     */
    void setListener(ConnectionListener listener);

    /**
     * Bind and begin accepting connections. Returns once bound.
     */
    void start();

    /**
     * Stop accepting, close every open connection and release resources.
     */
    void stop();

    /**
     * The bound local address, once started.
     */
    Optional<SocketAddress> localAddress();
}
