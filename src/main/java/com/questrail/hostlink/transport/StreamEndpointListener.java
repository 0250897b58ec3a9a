package com.questrail.hostlink.transport;

/**
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>Callbacks for one connection are serialized; callbacks for different
 * connections may run concurrently. Implementations must not block.</p>
 */
public interface StreamEndpointListener
{
    void onTransportUp();

    void onTransportDown(Throwable cause);

    void onConnectionOpened(StreamConnection connection);

    /**
     * Called with one complete JSON document. The listener must eventually answer
     * it through {@link StreamConnection#reply(byte[])} or
     * {@link StreamConnection#replyAndClose(byte[])}.
     */
    void onFrame(StreamConnection connection, byte[] frame);

    /**
     * Called when the byte stream cannot be framed (not JSON, or too long). The
     * stream cannot be resynchronized, so the listener should answer with
     * {@link StreamConnection#replyAndClose(byte[])}.
     */
    void onFrameError(StreamConnection connection, Throwable cause);

    /**
     * Called once when the connection is gone.
     *
     * @param cause failure that closed it; {@code null} for an orderly close
     */
    void onConnectionClosed(StreamConnection connection, Throwable cause);
}
