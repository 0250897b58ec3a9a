package com.questrail.hostlink.observability;

import com.questrail.hostlink.api.Transport;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a transport lifecycle change.
 *
 * @param remote peer address for connection events; local address for up/down
 * @param cause  diagnostic cause, may be {@code null}
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    Transport transport,
    Kind kind,
    SocketAddress remote,
    Throwable cause
) {
    public enum Kind {
        TRANSPORT_UP,
        TRANSPORT_DOWN,
        CONNECTION_OPENED,
        CONNECTION_CLOSED
    }
}
