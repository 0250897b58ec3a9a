package com.questrail.hostlink.api;

import java.util.Map;

/**
 * SessionApi
 * =============================================================================
 * The host application's own state-mutation surface.
 *
 * <h2>Threading contract (binding)</h2>
 * Implementations are <strong>not</strong> required to be thread-safe. The
 * dispatch core guarantees that {@link #invoke(String, Map)} is only ever called
 * from the execution serializer's single consumer context, one command at a time.
 * Callers outside the core MUST NOT invoke it directly.
 *
 * <p>The session is injected into the core; the core never owns or recreates it.</p>
 */
@FunctionalInterface
public interface SessionApi
{
    /**
     * Execute a named host operation.
     *
     * @param commandName host command name
     * @param params      immutable command parameters
     * @return operation result; any Jackson-serializable value, or {@code null}
     * @throws SessionException if the host rejects or fails the operation
     */
    Object invoke(String commandName, Map<String, Object> params) throws SessionException;
}
