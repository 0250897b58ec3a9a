package com.questrail.hostlink.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@code ClientConnectionManager}.
 */
public record ClientConfig(
    String host,
    int reliablePort,
    int lossyPort,
    Duration connectTimeout,
    Duration readTimeout,
    int connectAttempts,
    Duration reconnectDelay,
    int readChunkSize,
    int maxDatagramSize
) {
    public ClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        if (reliablePort < 1 || reliablePort > 65_535 || lossyPort < 1 || lossyPort > 65_535) {
            throw new IllegalArgumentException("ports must be in 1..65535");
        }
        if (connectAttempts < 1) {
            throw new IllegalArgumentException("connectAttempts must be >= 1");
        }
        if (readChunkSize < 1) {
            throw new IllegalArgumentException("readChunkSize must be >= 1");
        }
        if (reconnectDelay.isNegative()) {
            throw new IllegalArgumentException("reconnectDelay must not be negative");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()
                || readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
        if (maxDatagramSize < 1 || maxDatagramSize > HostLinkConfig.MAX_DATAGRAM_SIZE) {
            throw new IllegalArgumentException("maxDatagramSize must be in 1.." + HostLinkConfig.MAX_DATAGRAM_SIZE);
        }
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    public InetSocketAddress reliableAddress() {
        return new InetSocketAddress(host, reliablePort);
    }

    public InetSocketAddress lossyAddress() {
        return new InetSocketAddress(host, lossyPort);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = HostLinkConfig.DEFAULT_BIND_HOST;
        private int reliablePort = HostLinkConfig.DEFAULT_RELIABLE_PORT;
        private int lossyPort = HostLinkConfig.DEFAULT_LOSSY_PORT;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
        private int connectAttempts = 3;
        private Duration reconnectDelay = Duration.ofSeconds(1);
        private int readChunkSize = 8192;
        private int maxDatagramSize = HostLinkConfig.MAX_DATAGRAM_SIZE;

        public Builder withHost(String host) {
            this.host = host;
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

        public Builder withConnectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public Builder withReadTimeout(Duration timeout) {
            this.readTimeout = timeout;
            return this;
        }

        public Builder withConnectAttempts(int attempts) {
            this.connectAttempts = attempts;
            return this;
        }

        public Builder withReconnectDelay(Duration delay) {
            this.reconnectDelay = delay;
            return this;
        }

        public Builder withReadChunkSize(int size) {
            this.readChunkSize = size;
            return this;
        }

        public Builder withMaxDatagramSize(int size) {
            this.maxDatagramSize = size;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(
                host,
                reliablePort,
                lossyPort,
                connectTimeout,
                readTimeout,
                connectAttempts,
                reconnectDelay,
                readChunkSize,
                maxDatagramSize
            );
        }
    }
}
