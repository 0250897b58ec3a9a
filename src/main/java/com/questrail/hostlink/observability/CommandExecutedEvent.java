package com.questrail.hostlink.observability;

import com.questrail.hostlink.api.Command;
import com.questrail.hostlink.api.CommandResponse;

import java.time.Duration;
import java.time.Instant;

/**
 * Record emitted by the serializer after every executed command.
 *
 * @param queued  time the command spent waiting in the serializer queue
 * @param elapsed time spent inside the handler
 * @param failure the exception the handler raised, or {@code null} on success
 */
public record CommandExecutedEvent(
    Instant timestamp,
    Command command,
    CommandResponse response,
    Duration queued,
    Duration elapsed,
    Throwable failure
) {
    public boolean failed() {
        return failure != null;
    }
}
