package com.questrail.hostlink.client;

/**
 * The connection to the host failed: it could not be established, an I/O error
 * or read timeout occurred, or the response was truncated or unparseable.
 *
 * <p>Whether the command ran on the host is unknown.</p>
 */
public class HostConnectionException extends HostLinkException
{
    public HostConnectionException(String message) {
        super(message);
    }

    public HostConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
