package com.questrail.hostlink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DispatchObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDispatchObservabilitySink implements DispatchObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDispatchObservabilitySink.class);

    @Override
    public void onCommandExecuted(CommandExecutedEvent event) {
        if (event.failed()) {
            log.warn("Command {} ({}) failed after {} ms: {}",
                event.command().name(),
                event.command().transport(),
                event.elapsed().toMillis(),
                event.response().message(),
                event.failure());
            return;
        }
        log.debug("Command {} ({}) executed in {} ms after {} ms queued",
            event.command().name(),
            event.command().transport(),
            event.elapsed().toMillis(),
            event.queued().toMillis());
    }

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {
        if (event.reason() == RejectionReason.NEVER_LOSSY) {
            log.warn("Rejected unsafe lossy submission of {} from {}",
                event.commandName(), event.remote());
            return;
        }
        log.warn("{} error: rejected {} submission {} from {}: {} ({})",
            event.reason().kind(),
            event.transport(),
            event.commandName() != null ? event.commandName() : "<undecoded>",
            event.remote(),
            event.reason(),
            event.detail());
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event.cause() != null) {
            log.info("{} {} {}: {}", event.transport(), event.kind(), event.remote(),
                event.cause().toString());
            return;
        }
        log.info("{} {} {}", event.transport(), event.kind(), event.remote());
    }

    @Override
    public void onError(DispatchErrorEvent event) {
        log.error("Dispatch {} error: {}", event.kind(), event.message(), event.cause());
    }
}
