package com.questrail.hostlink.client;

/**
 * Base class for failures surfaced by {@link ClientConnectionManager}.
 */
public class HostLinkException extends RuntimeException
{
    public HostLinkException(String message) {
        super(message);
    }

    public HostLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
