package com.questrail.hostlink.client;

import com.questrail.hostlink.api.CommandResponse;
import com.questrail.hostlink.codec.CommandCodec;
import com.questrail.hostlink.codec.CommandDecodeException;
import com.questrail.hostlink.config.ClientConfig;
import com.questrail.hostlink.transport.DatagramEndpoint;
import com.questrail.hostlink.transport.DatagramEndpointListener;
import com.questrail.hostlink.transport.udp.netty.NettyUdpDatagramEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.Objects;

/**
 * ClientConnectionManager
 * =============================================================================
 * Client-side access to a running host.
 *
 * <ul>
 *   <li>{@link #call(String, Map)} sends a command on the reliable channel and
 *       blocks for its response. Calls are serialized; one persistent
 *       connection is reused and re-established after a failure.</li>
 *   <li>{@link #cast(String, Map)} fires a command on the lossy channel and
 *       returns at once. Nothing is reported back.</li>
 * </ul>
 *
 * <p>A call is never retried: a command whose outcome is unknown must not run
 * twice. Only establishing the connection is attempted more than once.</p>
 */
public final class ClientConnectionManager implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(ClientConnectionManager.class);

    private final ClientConfig config;
    private final CommandCodec codec;
    private final InetSocketAddress reliableAddress;
    private final InetSocketAddress lossyAddress;
    private final Object castLock = new Object();

    // Guarded by this
    private Socket socket;
    private OutputStream out;
    private JsonDocumentReader reader;

    // Guarded by castLock
    private DatagramEndpoint castEndpoint;
    private boolean closed;

    public ClientConnectionManager(ClientConfig config) {
        this(config, new CommandCodec());
    }

    public ClientConnectionManager(ClientConfig config, CommandCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.reliableAddress = config.reliableAddress();
        this.lossyAddress = config.lossyAddress();
    }

    /**
     * Send a command on the reliable channel and wait for its response.
     *
     * @return the host's {@code result}, possibly {@code null}
     * @throws HostCommandException    if the host answered with an error
     * @throws HostConnectionException if the connection failed; the next call reconnects
     */
    public synchronized Object call(String name, Map<String, Object> params) {
        Objects.requireNonNull(name, "name");
        byte[] request = codec.encodeCommand(name, params);

        ensureConnected();

        byte[] payload;
        try {
            out.write(request);
            out.flush();
            payload = reader.readDocument();
        } catch (SocketTimeoutException e) {
            // A late reply would be read as the answer to the next call.
            disconnect();
            throw new HostConnectionException(
                "Timed out after " + config.readTimeout() + " waiting for response to " + name, e);
        } catch (IOException e) {
            disconnect();
            throw new HostConnectionException("Connection to host lost during " + name + ": " + e.getMessage(), e);
        }

        CommandResponse response;
        try {
            response = codec.decodeResponse(payload);
        } catch (CommandDecodeException e) {
            disconnect();
            throw new HostConnectionException("Invalid response to " + name + ": " + e.getMessage(), e);
        }

        if (!response.isSuccess()) {
            throw new HostCommandException(name, response.message());
        }
        return response.result();
    }

    public Object call(String name) {
        return call(name, Map.of());
    }

    /**
     * Send a command on the lossy channel. Best effort; failures and oversized
     * payloads are logged and never thrown.
     */
    public void cast(String name, Map<String, Object> params) {
        Objects.requireNonNull(name, "name");

        byte[] payload;
        try {
            payload = codec.encodeCommand(name, params);
        } catch (IllegalStateException e) {
            log.warn("Dropping cast {}: {}", name, e.getMessage());
            return;
        }
        if (payload.length > config.maxDatagramSize()) {
            log.warn("Dropping cast {}: {} bytes exceeds the datagram limit of {}",
                name, payload.length, config.maxDatagramSize());
            return;
        }

        try {
            DatagramEndpoint endpoint = castEndpoint();
            if (endpoint != null) {
                endpoint.send(lossyAddress, payload);
            }
        } catch (RuntimeException e) {
            log.warn("Cast {} to {} failed", name, lossyAddress, e);
        }
    }

    public synchronized boolean isConnected() {
        return socket != null && !socket.isClosed();
    }

    @Override
    public void close() {
        synchronized (this) {
            disconnect();
        }
        synchronized (castLock) {
            closed = true;
            if (castEndpoint != null) {
                castEndpoint.stop();
                castEndpoint = null;
            }
        }
    }

    private void ensureConnected() {
        if (isConnected()) {
            return;
        }

        IOException last = null;
        for (int attempt = 1; attempt <= config.connectAttempts(); attempt++) {
            Socket s = new Socket();
            try {
                s.setTcpNoDelay(true);
                s.connect(reliableAddress, (int) config.connectTimeout().toMillis());
                s.setSoTimeout((int) config.readTimeout().toMillis());
                socket = s;
                out = s.getOutputStream();
                reader = new JsonDocumentReader(s.getInputStream(), config.readChunkSize());
                log.info("Connected to host at {}", reliableAddress);
                return;
            } catch (IOException e) {
                closeAfterFailure(s, e);
                last = e;
                log.debug("Connect attempt {}/{} to {} failed: {}",
                    attempt, config.connectAttempts(), reliableAddress, e.getMessage());
            }

            if (attempt < config.connectAttempts()) {
                pauseBeforeReconnect();
            }
        }
        throw new HostConnectionException(
            "Could not connect to host at " + reliableAddress
                + " after " + config.connectAttempts() + " attempt(s)", last);
    }

    private void pauseBeforeReconnect() {
        try {
            Thread.sleep(config.reconnectDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HostConnectionException("Interrupted while connecting to " + reliableAddress, e);
        }
    }

    private void disconnect() {
        Socket s = socket;
        socket = null;
        out = null;
        reader = null;
        if (s == null) {
            return;
        }
        try {
            s.close();
            log.info("Disconnected from host at {}", reliableAddress);
        } catch (IOException e) {
            log.debug("Error closing connection to {}", reliableAddress, e);
        }
    }

    private static void closeAfterFailure(Socket s, IOException failure) {
        try {
            s.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private DatagramEndpoint castEndpoint() {
        synchronized (castLock) {
            if (closed) {
                log.warn("Dropping cast: client is closed");
                return null;
            }
            if (castEndpoint == null) {
                DatagramEndpoint endpoint = new NettyUdpDatagramEndpoint(new InetSocketAddress(0));
                endpoint.setListener(new CastListener());
                endpoint.start();
                castEndpoint = endpoint;
            }
            return castEndpoint;
        }
    }

    /** The cast socket only sends; the host never answers on the lossy channel. */
    private final class CastListener implements DatagramEndpointListener
    {
        @Override
        public void onTransportUp() {
            log.debug("Lossy sender bound for {}", lossyAddress);
        }

        @Override
        public void onTransportDown(Throwable cause) {
            if (cause != null) {
                log.warn("Lossy sender stopped", cause);
            }
        }

        @Override
        public void onTransportError(Throwable cause) {
            log.warn("Lossy send to {} failed", lossyAddress, cause);
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            log.debug("Ignoring {} byte datagram from {}", payload.length, remote);
        }
    }
}
