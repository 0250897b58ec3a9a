package com.questrail.hostlink.codec;

/**
 * Indicates that a wire message could not be translated into a valid
 * {@link com.questrail.hostlink.api.Command} or
 * {@link com.questrail.hostlink.api.CommandResponse}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Bytes that are not well-formed UTF-8 JSON</li>
 *   <li>A document that is not a JSON object</li>
 *   <li>A missing or non-string {@code type} member</li>
 *   <li>A {@code params} member that is not a JSON object</li>
 * </ul>
 */
public final class CommandDecodeException extends RuntimeException
{
    public CommandDecodeException(String message) {
        super(message);
    }

    public CommandDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
