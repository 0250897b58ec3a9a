package com.questrail.hostlink.exec;

/**
 * What {@link ExecutionSerializer#submit} does when the queue is at capacity.
 */
public enum QueueFullPolicy {
    /** Reject the submission immediately. */
    REJECT,

    /** Wait up to the configured offer timeout for space, then reject. */
    BLOCK
}
