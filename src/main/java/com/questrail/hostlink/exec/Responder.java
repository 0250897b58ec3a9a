package com.questrail.hostlink.exec;

import com.questrail.hostlink.api.CommandResponse;

/**
 * Completion callback for a submitted command.
 *
 * <p>Invoked exactly once: from the serializer's consumer context after the
 * command has executed, or from the submitting thread if the submission was
 * rejected. Implementations must not block.</p>
 */
@FunctionalInterface
public interface Responder
{
    void complete(CommandResponse response);

    /**
     * Responder for lossy-origin commands, whose result has nowhere to go.
     */
    static Responder none() {
        return response -> {};
    }
}
