package com.questrail.hostlink.transport.udp;

import com.questrail.hostlink.api.Command;
import com.questrail.hostlink.api.Transport;
import com.questrail.hostlink.codec.CommandCodec;
import com.questrail.hostlink.codec.CommandDecodeException;
import com.questrail.hostlink.exec.ExecutionSerializer;
import com.questrail.hostlink.exec.Responder;
import com.questrail.hostlink.observability.CommandRejectedEvent;
import com.questrail.hostlink.observability.DispatchErrorEvent;
import com.questrail.hostlink.observability.DispatchErrorKind;
import com.questrail.hostlink.observability.DispatchObservabilitySink;
import com.questrail.hostlink.observability.NullObservabilitySink;
import com.questrail.hostlink.observability.RejectionReason;
import com.questrail.hostlink.observability.TransportObservabilityEvent;
import com.questrail.hostlink.registry.CommandDescriptor;
import com.questrail.hostlink.registry.CommandRegistry;
import com.questrail.hostlink.transport.DatagramEndpoint;
import com.questrail.hostlink.transport.DatagramEndpointListener;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * LossyChannelListener
 * =============================================================================
 * Fire-and-forget command ingress over a datagram transport.
 *
 * <h2>Inbound path (decode, classify, submit)</h2>
 *
 * <pre>
 *   DatagramEndpoint
 *        → CommandCodec.decodeCommand
 *            → CommandRegistry.classify (tier check)
 *                → ExecutionSerializer.submit (no-op responder)
 * </pre>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Nothing is ever sent back. A sender must not assume delivery.</li>
 *   <li>A {@code NEVER_LOSSY} command is never executed; it is dropped and
 *       reported as a rejected unsafe submission.</li>
 *   <li>Malformed and unknown commands are dropped and reported. There is no
 *       channel to tell the sender.</li>
 *   <li>No failure for a single datagram stops the receive loop.</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * Accepted commands execute in serializer dequeue order, which follows arrival
 * order on this transport only. Nothing is guaranteed relative to commands on
 * the reliable transport.
 */
public final class LossyChannelListener implements DatagramEndpointListener {

    private final CommandRegistry registry;
    private final ExecutionSerializer serializer;
    private final CommandCodec codec;
    private final DatagramEndpoint endpoint;
    private final DispatchObservabilitySink observabilitySink;

    public LossyChannelListener(CommandRegistry registry,
                                ExecutionSerializer serializer,
                                CommandCodec codec,
                                DatagramEndpoint endpoint,
                                DispatchObservabilitySink observabilitySink) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public SocketAddress localAddress() {
        return endpoint.localAddress();
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        transportEvent(TransportObservabilityEvent.Kind.TRANSPORT_UP, null);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        transportEvent(TransportObservabilityEvent.Kind.TRANSPORT_DOWN, cause);
    }

    @Override
    public void onTransportError(Throwable cause) {
        observabilitySink.onError(new DispatchErrorEvent(
                Instant.now(),
                DispatchErrorKind.TRANSPORT,
                "Lossy transport I/O error",
                cause
        ));
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        try {
            dispatch(remote, payload);
        } catch (RuntimeException e) {
            observabilitySink.onError(new DispatchErrorEvent(
                    Instant.now(),
                    DispatchErrorKind.TRANSPORT,
                    "Failed to dispatch datagram from " + remote,
                    e
            ));
        }
    }

    private void dispatch(SocketAddress remote, byte[] payload) {
        // 1) Datagram bytes -> command (drop malformed payloads)
        final Command command;
        try {
            command = codec.decodeCommand(payload, Transport.LOSSY);
        } catch (CommandDecodeException e) {
            reject(remote, null, RejectionReason.MALFORMED, e.getMessage());
            return;
        }

        // 2) Classify; only the registry decides eligibility
        Optional<CommandDescriptor> descriptor = registry.classify(command.name());
        if (descriptor.isEmpty()) {
            reject(remote, command.name(), RejectionReason.UNKNOWN_COMMAND, "Unknown command: " + command.name());
            return;
        }
        if (!descriptor.get().safetyTier().permits(Transport.LOSSY)) {
            reject(remote, command.name(), RejectionReason.NEVER_LOSSY,
                    "Command " + command.name() + " is not lossy-eligible");
            return;
        }

        // 3) Submit; the outcome has nowhere to go. Queue-full rejections are
        //    reported by the serializer itself.
        serializer.submit(descriptor.get(), command, Responder.none());
    }

    private void reject(SocketAddress remote, String name, RejectionReason reason, String detail) {
        observabilitySink.onCommandRejected(new CommandRejectedEvent(
                Instant.now(),
                Transport.LOSSY,
                name,
                reason,
                detail,
                remote
        ));
    }

    private void transportEvent(TransportObservabilityEvent.Kind kind, Throwable cause) {
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                Instant.now(),
                Transport.LOSSY,
                kind,
                endpoint.localAddress(),
                cause
        ));
    }
}
