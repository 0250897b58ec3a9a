package com.questrail.hostlink.transport.tcp;

import com.questrail.hostlink.api.Command;
import com.questrail.hostlink.api.CommandResponse;
import com.questrail.hostlink.api.Transport;
import com.questrail.hostlink.codec.CommandCodec;
import com.questrail.hostlink.codec.CommandDecodeException;
import com.questrail.hostlink.exec.ExecutionSerializer;
import com.questrail.hostlink.observability.CommandRejectedEvent;
import com.questrail.hostlink.observability.DispatchErrorEvent;
import com.questrail.hostlink.observability.DispatchErrorKind;
import com.questrail.hostlink.observability.DispatchObservabilitySink;
import com.questrail.hostlink.observability.NullObservabilitySink;
import com.questrail.hostlink.observability.RejectionReason;
import com.questrail.hostlink.observability.TransportObservabilityEvent;
import com.questrail.hostlink.registry.CommandDescriptor;
import com.questrail.hostlink.registry.CommandRegistry;
import com.questrail.hostlink.transport.StreamConnection;
import com.questrail.hostlink.transport.StreamEndpoint;
import com.questrail.hostlink.transport.StreamEndpointListener;

import java.net.SocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ReliableChannelListener
 * =============================================================================
 * Request/response command ingress over a stream transport.
 *
 * <h2>Per-frame path</h2>
 *
 * <pre>
 *   StreamEndpoint (one complete JSON frame)
 *        → CommandCodec.decodeCommand
 *            → CommandRegistry.classify
 *                → ExecutionSerializer.submit (responder bound to this connection)
 *                    → CommandCodec.encodeResponse
 *                        → StreamConnection.reply
 * </pre>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>Every frame gets exactly one response, on the connection it came from.</li>
 *   <li>Malformed and unknown commands are answered with an error without ever
 *       reaching the serializer.</li>
 *   <li>A handler failure is answered with an error; the connection stays usable.</li>
 *   <li>Only the connection that submitted a command waits for it. Other
 *       connections keep being served.</li>
 * </ul>
 *
 * <h2>Blocking submissions</h2>
 * When the serializer may wait for queue space, submissions are handed to a
 * dedicated thread in arrival order, so a full queue never stalls the endpoint
 * I/O threads that other connections share.
 *
 * <h2>Response timeout</h2>
 * If a command has not completed within the response timeout, the caller gets
 * an error response. The command still runs when its turn comes and its result
 * is discarded.
 */
public final class ReliableChannelListener implements StreamEndpointListener {

    static final String TIMEOUT_MESSAGE = "Timeout waiting for operation to complete";
    static final String STOPPED_MESSAGE = "Listener stopped";

    private final CommandRegistry registry;
    private final ExecutionSerializer serializer;
    private final CommandCodec codec;
    private final StreamEndpoint endpoint;
    private final Duration responseTimeout;
    private final DispatchObservabilitySink observabilitySink;

    private volatile ExecutorService submitExecutor;

    public ReliableChannelListener(CommandRegistry registry,
                                   ExecutionSerializer serializer,
                                   CommandCodec codec,
                                   StreamEndpoint endpoint,
                                   Duration responseTimeout,
                                   DispatchObservabilitySink observabilitySink) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.responseTimeout = Objects.requireNonNull(responseTimeout, "responseTimeout");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        if (responseTimeout.isNegative() || responseTimeout.isZero()) {
            throw new IllegalArgumentException("responseTimeout must be positive");
        }

        this.endpoint.setListener(this);
    }

    public void start() {
        if (serializer.submitMayBlock() && submitExecutor == null) {
            submitExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "hostlink-reliable-submit");
                t.setDaemon(true);
                return t;
            });
        }
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
        ExecutorService executor = submitExecutor;
        if (executor != null) {
            submitExecutor = null;
            executor.shutdown();
        }
    }

    public SocketAddress localAddress() {
        return endpoint.localAddress();
    }

    // -------------------------------------------------------------------------
    // StreamEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        transportEvent(TransportObservabilityEvent.Kind.TRANSPORT_UP, endpoint.localAddress(), null);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        transportEvent(TransportObservabilityEvent.Kind.TRANSPORT_DOWN, endpoint.localAddress(), cause);
    }

    @Override
    public void onConnectionOpened(StreamConnection connection) {
        transportEvent(TransportObservabilityEvent.Kind.CONNECTION_OPENED, connection.remoteAddress(), null);
    }

    @Override
    public void onConnectionClosed(StreamConnection connection, Throwable cause) {
        transportEvent(TransportObservabilityEvent.Kind.CONNECTION_CLOSED, connection.remoteAddress(), cause);
    }

    @Override
    public void onFrameError(StreamConnection connection, Throwable cause) {
        String detail = "Malformed request: " + cause.getMessage();
        reject(connection, null, RejectionReason.MALFORMED, detail);
        connection.replyAndClose(codec.encodeResponse(CommandResponse.error(detail)));
    }

    @Override
    public void onFrame(StreamConnection connection, byte[] frame) {
        // 1) Frame -> command; malformed requests never reach the serializer
        final Command command;
        try {
            command = codec.decodeCommand(frame, Transport.RELIABLE);
        } catch (CommandDecodeException e) {
            reject(connection, null, RejectionReason.MALFORMED, e.getMessage());
            connection.reply(codec.encodeResponse(CommandResponse.error(e.getMessage())));
            return;
        }

        // 2) Classify; every registered tier is allowed on this transport
        Optional<CommandDescriptor> descriptor = registry.classify(command.name());
        if (descriptor.isEmpty()) {
            String detail = "Unknown command: " + command.name();
            reject(connection, command.name(), RejectionReason.UNKNOWN_COMMAND, detail);
            respond(connection, command, CommandResponse.error(detail));
            return;
        }

        // 3) Submit with a responder bound to this connection. Only this
        //    connection waits; the endpoint holds its next frame until we reply.
        CompletableFuture<CommandResponse> pending = new CompletableFuture<>();
        pending.orTimeout(responseTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((response, failure) -> {
                    if (failure == null) {
                        respond(connection, command, response);
                        return;
                    }
                    if (failure instanceof TimeoutException) {
                        observabilitySink.onError(new DispatchErrorEvent(
                                Instant.now(),
                                DispatchErrorKind.HANDLER,
                                "Command " + command.name() + " did not complete within " + responseTimeout,
                                null
                        ));
                        respond(connection, command, CommandResponse.error(TIMEOUT_MESSAGE));
                        return;
                    }
                    respond(connection, command, CommandResponse.error(String.valueOf(failure.getMessage())));
                });

        submit(connection, descriptor.get(), command, pending);
    }

    private void submit(StreamConnection connection,
                        CommandDescriptor descriptor,
                        Command command,
                        CompletableFuture<CommandResponse> pending) {
        ExecutorService executor = submitExecutor;
        if (executor == null) {
            serializer.submit(descriptor, command, pending::complete);
            return;
        }
        try {
            executor.execute(() -> serializer.submit(descriptor, command, pending::complete));
        } catch (RejectedExecutionException e) {
            reject(connection, command.name(), RejectionReason.SERIALIZER_STOPPED, STOPPED_MESSAGE);
            pending.complete(CommandResponse.error(STOPPED_MESSAGE));
        }
    }

    private void respond(StreamConnection connection, Command command, CommandResponse response) {
        byte[] payload;
        try {
            payload = codec.encodeResponse(response, command.correlation());
        } catch (IllegalStateException e) {
            observabilitySink.onError(new DispatchErrorEvent(
                    Instant.now(),
                    DispatchErrorKind.HANDLER,
                    "Result of " + command.name() + " is not serializable",
                    e
            ));
            payload = codec.encodeResponse(
                    CommandResponse.error("Failed to encode result of " + command.name()),
                    command.correlation());
        }
        // Discarded by the endpoint if the connection has gone away meanwhile.
        connection.reply(payload);
    }

    private void reject(StreamConnection connection, String name, RejectionReason reason, String detail) {
        observabilitySink.onCommandRejected(new CommandRejectedEvent(
                Instant.now(),
                Transport.RELIABLE,
                name,
                reason,
                detail,
                connection.remoteAddress()
        ));
    }

    private void transportEvent(TransportObservabilityEvent.Kind kind, SocketAddress address, Throwable cause) {
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                Instant.now(),
                Transport.RELIABLE,
                kind,
                address,
                cause
        ));
    }
}
