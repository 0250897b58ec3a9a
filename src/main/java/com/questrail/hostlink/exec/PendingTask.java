package com.questrail.hostlink.exec;

import com.questrail.hostlink.api.Command;
import com.questrail.hostlink.registry.CommandDescriptor;

import java.util.Objects;

/**
 * A classified command waiting in the serializer queue together with the
 * responder that receives its outcome.
 */
record PendingTask(Command command, CommandDescriptor descriptor, Responder responder, long enqueuedNanos) {
    PendingTask {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(responder, "responder");
    }
}
