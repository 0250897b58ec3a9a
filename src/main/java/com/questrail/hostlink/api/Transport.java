package com.questrail.hostlink.api;

/**
 * Transport
 * -----------------------------------------------------------------------------
 * The two ingress channels a {@link Command} can arrive on.
 *
 * <p>The transports are deliberately asymmetric. Nothing is guaranteed about the
 * relative ordering of commands that arrive on different transports.</p>
 */
public enum Transport
{
    /** Connection-oriented channel; exactly one response per request. */
    RELIABLE,

    /** Connectionless, best-effort channel; no acknowledgment and no response. */
    LOSSY
}
