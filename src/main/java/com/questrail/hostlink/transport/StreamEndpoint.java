package com.questrail.hostlink.transport;

import java.net.SocketAddress;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Port for a connection-oriented request/response transport (TCP-style).
 *
 * <p>The endpoint owns accepting connections, framing complete JSON documents
 * out of the byte stream (across partial reads of any size), enforcing read and
 * write timeouts, and flushing replies completely. It performs no command
 * interpretation.</p>
 *
 * <h2>Request/response discipline</h2>
 * On each connection at most one frame is outstanding: the endpoint delivers the
 * next frame via {@link StreamEndpointListener#onFrame} only after the previous
 * frame has been answered through {@link StreamConnection#reply(byte[])} and the
 * reply has been written. Frames that arrive early are held in order.
 */
public interface StreamEndpoint
{
    /**
     * Bind and begin accepting connections. Returns once the endpoint is bound.
     *
     * @throws IllegalStateException if the endpoint cannot be bound
     */
    void start();

    /**
     * Close the listening socket and every open connection.
     */
    void stop();

    /**
     * Register the listener. This must be called before {@link #start()}.
     */
    void setListener(StreamEndpointListener listener);

    /**
     * The address actually bound, or {@code null} before {@link #start()}.
     */
    SocketAddress localAddress();
}
