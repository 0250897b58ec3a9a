package com.questrail.hostlink.observability;

/**
 * Error taxonomy of the dispatch core.
 */
public enum DispatchErrorKind {
    /** Malformed payload or unknown command, detected before any handler runs. */
    PROTOCOL,
    /** A never-lossy command arrived on the lossy transport. */
    CLASSIFICATION,
    /** The session API raised while executing a correctly classified command. */
    HANDLER,
    /** Socket-level failure, scoped to one connection or endpoint. */
    TRANSPORT
}
