package com.questrail.hostlink.observability;

/**
 * Why a submission never reached a handler.
 */
public enum RejectionReason {
    MALFORMED(DispatchErrorKind.PROTOCOL),
    UNKNOWN_COMMAND(DispatchErrorKind.PROTOCOL),
    NEVER_LOSSY(DispatchErrorKind.CLASSIFICATION),
    QUEUE_FULL(DispatchErrorKind.TRANSPORT),
    SERIALIZER_STOPPED(DispatchErrorKind.TRANSPORT);

    private final DispatchErrorKind kind;

    RejectionReason(DispatchErrorKind kind) {
        this.kind = kind;
    }

    public DispatchErrorKind kind() {
        return kind;
    }
}
