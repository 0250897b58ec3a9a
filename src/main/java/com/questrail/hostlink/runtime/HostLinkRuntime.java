package com.questrail.hostlink.runtime;

import com.questrail.hostlink.api.SessionApi;
import com.questrail.hostlink.codec.CommandCodec;
import com.questrail.hostlink.config.HostLinkConfig;
import com.questrail.hostlink.exec.ExecutionSerializer;
import com.questrail.hostlink.observability.DispatchObservabilitySink;
import com.questrail.hostlink.observability.NullObservabilitySink;
import com.questrail.hostlink.registry.CommandRegistry;
import com.questrail.hostlink.registry.StandardCommands;
import com.questrail.hostlink.transport.DatagramEndpoint;
import com.questrail.hostlink.transport.StreamEndpoint;
import com.questrail.hostlink.transport.tcp.ReliableChannelListener;
import com.questrail.hostlink.transport.tcp.netty.NettyTcpStreamEndpoint;
import com.questrail.hostlink.transport.udp.LossyChannelListener;
import com.questrail.hostlink.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HostLinkRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the command dispatch stack: one
 * execution serializer fed by a reliable and a lossy listener.
 *
 * <pre>
 *   HostLinkRuntime runtime = HostLinkRuntime.builder()
 *       .withSessionApi(session)
 *       .withConfig(HostLinkConfig.defaults())
 *       .withObservabilitySink(new Slf4jDispatchObservabilitySink())
 *       .build();
 *   runtime.start();
 * </pre>
 *
 * <p>{@link #start()} starts the serializer before any transport accepts
 * traffic; {@link #stop()} closes the transports before stopping the
 * serializer. A runtime is started at most once.</p>
 */
public final class HostLinkRuntime {
    private final ExecutionSerializer serializer;
    private final ReliableChannelListener reliableListener;
    private final LossyChannelListener lossyListener;
    private final CommandRegistry registry;
    private final HostLinkConfig config;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private HostLinkRuntime(
            ExecutionSerializer serializer,
            ReliableChannelListener reliableListener,
            LossyChannelListener lossyListener,
            CommandRegistry registry,
            HostLinkConfig config) {
        this.serializer = serializer;
        this.reliableListener = reliableListener;
        this.lossyListener = lossyListener;
        this.registry = registry;
        this.config = config;
    }

    /**
     * @throws IllegalStateException if this runtime was started before; the
     *         running stack is left untouched
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("HostLinkRuntime already started");
        }
        serializer.start();
        try {
            reliableListener.start();
        } catch (RuntimeException e) {
            serializer.stop();
            throw e;
        }
        try {
            lossyListener.start();
        } catch (RuntimeException e) {
            reliableListener.stop();
            serializer.stop();
            throw e;
        }
    }

    public void stop() {
        lossyListener.stop();
        reliableListener.stop();
        serializer.stop();
    }

    /** Address the reliable listener is bound to, or {@code null} before start. */
    public SocketAddress reliableAddress() {
        return reliableListener.localAddress();
    }

    /** Address the lossy listener is bound to, or {@code null} before start. */
    public SocketAddress lossyAddress() {
        return lossyListener.localAddress();
    }

    public CommandRegistry registry() {
        return registry;
    }

    public HostLinkConfig config() {
        return config;
    }

    public boolean isRunning() {
        return serializer.isRunning();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SessionApi sessionApi;
        private CommandRegistry registry;
        private HostLinkConfig config = HostLinkConfig.defaults();
        private DispatchObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private StreamEndpoint streamEndpoint;
        private DatagramEndpoint datagramEndpoint;

        public Builder withSessionApi(SessionApi sessionApi) {
            this.sessionApi = sessionApi;
            return this;
        }

        public Builder withRegistry(CommandRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withConfig(HostLinkConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(DispatchObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /** Replace the Netty TCP endpoint, e.g. with an in-memory fake. */
        public Builder withStreamEndpoint(StreamEndpoint endpoint) {
            this.streamEndpoint = endpoint;
            return this;
        }

        /** Replace the Netty UDP endpoint, e.g. with an in-memory fake. */
        public Builder withDatagramEndpoint(DatagramEndpoint endpoint) {
            this.datagramEndpoint = endpoint;
            return this;
        }

        public HostLinkRuntime build() {
            Objects.requireNonNull(sessionApi, "sessionApi");
            Objects.requireNonNull(config, "config");
            DispatchObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
            CommandRegistry commands = registry != null ? registry : StandardCommands.registry();

            // 1. Single consumer of host state
            ExecutionSerializer serializer = new ExecutionSerializer(sessionApi, config.serializer(), sink);
            CommandCodec codec = new CommandCodec();

            // 2. Reliable ingress
            StreamEndpoint stream = streamEndpoint != null
                ? streamEndpoint
                : new NettyTcpStreamEndpoint(
                    config.reliableBindAddress(),
                    config.maxFrameLength(),
                    config.idleTimeout(),
                    config.writeTimeout());
            ReliableChannelListener reliable = new ReliableChannelListener(
                commands, serializer, codec, stream, config.responseTimeout(), sink);

            // 3. Lossy ingress
            DatagramEndpoint datagrams = datagramEndpoint != null
                ? datagramEndpoint
                : new NettyUdpDatagramEndpoint(config.lossyBindAddress());
            LossyChannelListener lossy = new LossyChannelListener(
                commands, serializer, codec, datagrams, sink);

            return new HostLinkRuntime(serializer, reliable, lossy, commands, config);
        }
    }
}
