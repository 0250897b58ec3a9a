package com.questrail.hostlink.client;

/**
 * The host answered a command with an error response.
 */
public class HostCommandException extends HostLinkException
{
    private final String commandName;
    private final String hostMessage;

    public HostCommandException(String commandName, String hostMessage) {
        super(commandName + " failed: " + hostMessage);
        this.commandName = commandName;
        this.hostMessage = hostMessage;
    }

    public String commandName() {
        return commandName;
    }

    /** The error message exactly as sent by the host. */
    public String hostMessage() {
        return hostMessage;
    }
}
