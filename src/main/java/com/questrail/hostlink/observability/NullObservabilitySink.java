package com.questrail.hostlink.observability;

/**
 * No-op implementation of DispatchObservabilitySink.
 */
public final class NullObservabilitySink implements DispatchObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCommandExecuted(CommandExecutedEvent event) {}

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(DispatchErrorEvent event) {}
}
