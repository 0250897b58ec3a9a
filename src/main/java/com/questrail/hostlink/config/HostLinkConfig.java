package com.questrail.hostlink.config;

import com.questrail.hostlink.exec.SerializerConfig;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the command dispatch runtime.
 *
 * <p>Ports may be {@code 0} to bind ephemeral ports; the runtime reports the
 * addresses actually bound.</p>
 */
public record HostLinkConfig(
    String bindHost,
    int reliablePort,
    int lossyPort,
    SerializerConfig serializer,
    Duration responseTimeout,
    Duration idleTimeout,
    Duration writeTimeout,
    int maxFrameLength
) {
    public static final String DEFAULT_BIND_HOST = "127.0.0.1";
    public static final int DEFAULT_RELIABLE_PORT = 9877;
    public static final int DEFAULT_LOSSY_PORT = 9878;
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(15);
    public static final int DEFAULT_MAX_FRAME_LENGTH = 8 * 1024 * 1024;
    /** Largest UDP payload over IPv4. */
    public static final int MAX_DATAGRAM_SIZE = 65_507;

    public HostLinkConfig {
        Objects.requireNonNull(bindHost, "bindHost");
        Objects.requireNonNull(serializer, "serializer");
        Objects.requireNonNull(responseTimeout, "responseTimeout");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        Objects.requireNonNull(writeTimeout, "writeTimeout");
        requirePort(reliablePort, "reliablePort");
        requirePort(lossyPort, "lossyPort");
        requirePositive(responseTimeout, "responseTimeout");
        requirePositive(idleTimeout, "idleTimeout");
        requirePositive(writeTimeout, "writeTimeout");
        if (maxFrameLength < 2) {
            throw new IllegalArgumentException("maxFrameLength must be >= 2");
        }
    }

    public static HostLinkConfig defaults() {
        return builder().build();
    }

    public InetSocketAddress reliableBindAddress() {
        return new InetSocketAddress(bindHost, reliablePort);
    }

    public InetSocketAddress lossyBindAddress() {
        return new InetSocketAddress(bindHost, lossyPort);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePort(int port, String name) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(name + " must be in 0..65535");
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static final class Builder {
        private String bindHost = DEFAULT_BIND_HOST;
        private int reliablePort = DEFAULT_RELIABLE_PORT;
        private int lossyPort = DEFAULT_LOSSY_PORT;
        private SerializerConfig serializer = SerializerConfig.defaults();
        private Duration responseTimeout = DEFAULT_RESPONSE_TIMEOUT;
        private Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;
        private Duration writeTimeout = DEFAULT_WRITE_TIMEOUT;
        private int maxFrameLength = DEFAULT_MAX_FRAME_LENGTH;

        public Builder withBindHost(String bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        public Builder withReliablePort(int port) {
            this.reliablePort = port;
            return this;
        }

        public Builder withLossyPort(int port) {
            this.lossyPort = port;
            return this;
        }

        /** Bind both listeners to ephemeral ports. */
        public Builder withEphemeralPorts() {
            this.reliablePort = 0;
            this.lossyPort = 0;
            return this;
        }

        public Builder withSerializer(SerializerConfig serializer) {
            this.serializer = serializer;
            return this;
        }

        public Builder withResponseTimeout(Duration timeout) {
            this.responseTimeout = timeout;
            return this;
        }

        public Builder withIdleTimeout(Duration timeout) {
            this.idleTimeout = timeout;
            return this;
        }

        public Builder withWriteTimeout(Duration timeout) {
            this.writeTimeout = timeout;
            return this;
        }

        public Builder withMaxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public HostLinkConfig build() {
            return new HostLinkConfig(
                bindHost,
                reliablePort,
                lossyPort,
                serializer,
                responseTimeout,
                idleTimeout,
                writeTimeout,
                maxFrameLength
            );
        }
    }
}
