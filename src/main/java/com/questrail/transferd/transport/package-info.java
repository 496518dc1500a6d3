/**
 * Transport Ports
 * =============================================================================
 *
 * <p>These interfaces define the framework-agnostic boundary between a
 * concrete networking implementation (Netty with TLS in production, an
 * in-memory fake in tests) and the daemon's session and dispatch layers.</p>
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>complete frames as {@code byte[]}</li>
 *   <li>remote endpoints as {@link java.net.SocketAddress}</li>
 *   <li>connection lifecycle notifications</li>
 * </ul>
 *
 * <p>Implementations must not decode envelopes, emit daemon messages or
 * apply timeouts of their own.</p>
 */
package com.questrail.transferd.transport;
