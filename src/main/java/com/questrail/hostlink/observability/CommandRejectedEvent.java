package com.questrail.hostlink.observability;

import com.questrail.hostlink.api.Transport;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a submission that was refused before execution.
 *
 * @param commandName the command name if it could be decoded, otherwise {@code null}
 * @param remote      the sender, if known
 */
public record CommandRejectedEvent(
    Instant timestamp,
    Transport transport,
    String commandName,
    RejectionReason reason,
    String detail,
    SocketAddress remote
) {
}
