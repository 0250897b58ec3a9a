package com.questrail.hostlink.registry;

import com.questrail.hostlink.api.Command;
import com.questrail.hostlink.api.SessionApi;

/**
 * Executes one command against the host session.
 *
 * <p>Handlers run only inside the execution serializer's consumer context.
 * They may be executed even when nobody will observe the result (a reliable
 * caller that timed out or disconnected), so they must not rely on it being read.</p>
 */
@FunctionalInterface
public interface CommandHandler
{
    Object handle(SessionApi session, Command command) throws Exception;

    /**
     * Handler that forwards the command 1:1 to {@link SessionApi#invoke}.
     */
    static CommandHandler delegating() {
        return (session, command) -> session.invoke(command.name(), command.params());
    }
}
