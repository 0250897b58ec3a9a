package com.questrail.hostlink.transport.tcp.netty;

import java.io.IOException;
import java.time.Duration;

/**
 * Close cause reported for a connection that stayed idle past the idle timeout.
 */
public final class IdleConnectionException extends IOException
{
    public IdleConnectionException(Duration idleTimeout) {
        super("Connection idle for longer than " + idleTimeout);
    }
}
