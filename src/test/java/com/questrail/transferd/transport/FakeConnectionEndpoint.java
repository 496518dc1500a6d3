package com.questrail.transferd.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * FakeConnectionEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link ConnectionEndpoint}. Contains no daemon semantics; tests
 * drive connection lifecycle and inbound frames directly.
 */
public final class FakeConnectionEndpoint implements ConnectionEndpoint {

    private ConnectionListener listener;
    private boolean started;

    @Override
    public void setListener(ConnectionListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        started = true;
    }

    @Override
    public void stop() {
        started = false;
    }

    @Override
    public Optional<SocketAddress> localAddress() {
        return started ? Optional.of(new InetSocketAddress("127.0.0.1", 58846)) : Optional.empty();
    }

    public boolean isStarted() {
        return started;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /** Open a connection and complete its handshake. */
    public FakeConnection connect(String id) {
        FakeConnection connection = new FakeConnection(id);
        requireListener().onConnectionOpened(connection);
        listener.onConnectionSecured(connection);
        return connection;
    }

    public void inject(Connection connection, byte[] frame) {
        requireListener().onFrame(connection, frame);
    }

    public void disconnect(Connection connection, Throwable cause) {
        requireListener().onConnectionClosed(connection, cause);
    }

    private ConnectionListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
