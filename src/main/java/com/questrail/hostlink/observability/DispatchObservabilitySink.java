package com.questrail.hostlink.observability;

/**
 * Main interface for receiving dispatch observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from several threads (the serializer consumer, the lossy
 * receive loop and reliable connection event loops); implementations must be
 * thread-safe and must not block.</p>
 */
public interface DispatchObservabilitySink {
    /**
     * Called after the serializer has executed a command, successfully or not.
     * @param event the execution details
     */
    void onCommandExecuted(CommandExecutedEvent event);

    /**
     * Called when a submission is refused before reaching a handler.
     * @param event the rejection details
     */
    void onCommandRejected(CommandRejectedEvent event);

    /**
     * Called when a transport-level event occurs (e.g., connection opened/closed).
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs in the dispatch core.
     * @param event the error event
     */
    void onError(DispatchErrorEvent event);
}
