package com.questrail.hostlink.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>This endpoint is intentionally small. Higher layers are responsible for:</p>
 * <ul>
 *   <li>decoding inbound datagrams into commands</li>
 *   <li>classifying them and submitting them to the execution serializer</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind the endpoint and begin receiving datagrams.
     *
     * <p>Returns once the endpoint is bound. On success the endpoint MUST notify
     * its listener via {@link DatagramEndpointListener#onTransportUp()} exactly
     * once per transition.</p>
     *
     * @throws IllegalStateException if the endpoint cannot be bound
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>On shutdown (graceful or error-induced), the endpoint MUST notify its
     * listener via {@link DatagramEndpointListener#onTransportDown(Throwable)} at
     * most once per transition.</p>
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint. Best effort; failures
     * are not reported to the caller.
     *
     * @param remote remote destination
     * @param payload datagram payload
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);

    /**
     * The address actually bound, or {@code null} before {@link #start()}.
     */
    SocketAddress localAddress();
}
