package com.questrail.transferd.transport;

/**
 * ConnectionListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link ConnectionEndpoint}.
 *
 * <p>For one connection, callbacks are delivered serially and in this order:
 * {@code onConnectionOpened}, {@code onConnectionSecured} (after the TLS
 * handshake), any number of {@code onFrame}, then {@code onConnectionClosed}
 * exactly once. Callbacks for different connections may run concurrently.</p>
 */
public interface ConnectionListener
{
    void onConnectionOpened(Connection connection);

    /**
     * The encrypted channel is established; application traffic may flow.
     */
    void onConnectionSecured(Connection connection);

    /**
     * One complete frame arrived. The listener owns the array.
     */
    void onFrame(Connection connection, byte[] frame);

    /**
     * @param cause diagnostic cause, {@code null} for an orderly close
     */
    void onConnectionClosed(Connection connection, Throwable cause);
}
