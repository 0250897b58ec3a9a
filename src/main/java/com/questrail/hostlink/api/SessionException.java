package com.questrail.hostlink.api;

/**
 * Raised by a {@link SessionApi} when the host rejects or fails an operation.
 *
 * <p>The serializer translates it into an error {@link CommandResponse} whose
 * message is {@link #getMessage()}.</p>
 */
public class SessionException extends Exception
{
    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
