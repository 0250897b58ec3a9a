package com.questrail.hostlink.transport;

import java.net.SocketAddress;

/**
 * One accepted connection of a {@link StreamEndpoint}.
 *
 * <p>Owned by the endpoint; listeners only use it to answer the frame they were
 * handed. All methods are safe to call from any thread.</p>
 */
public interface StreamConnection
{
    /** Endpoint-unique connection id, for logs. */
    long id();

    SocketAddress remoteAddress();

    boolean isOpen();

    /**
     * Answer the outstanding frame. The reply is written completely before the
     * next frame is delivered. If the connection has already closed the reply is
     * discarded.
     */
    void reply(byte[] payload);

    /**
     * Answer the outstanding frame, then close the connection once the reply has
     * been flushed.
     */
    void replyAndClose(byte[] payload);

    void close();
}
