package com.questrail.hostlink.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.hostlink.api.RecordingSessionApi;
import com.questrail.hostlink.api.SafetyTier;
import com.questrail.hostlink.api.SessionException;
import com.questrail.hostlink.client.ClientConnectionManager;
import com.questrail.hostlink.config.ClientConfig;
import com.questrail.hostlink.config.HostLinkConfig;
import com.questrail.hostlink.exec.QueueFullPolicy;
import com.questrail.hostlink.exec.SerializerConfig;
import com.questrail.hostlink.observability.CommandRejectedEvent;
import com.questrail.hostlink.observability.RecordingObservabilitySink;
import com.questrail.hostlink.observability.RejectionReason;
import com.questrail.hostlink.registry.CommandRegistry;
import com.questrail.hostlink.registry.StandardCommands;
import com.questrail.hostlink.transport.tcp.RawJsonClient;
import com.questrail.hostlink.transport.tcp.netty.NettyTcpStreamEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HostLinkRuntimeIntegrationTest
 * -----------------------------------------------------------------------------
 * End-to-end scenarios over real loopback sockets on ephemeral ports.
 */
class HostLinkRuntimeIntegrationTest {

    private final RecordingSessionApi session = new RecordingSessionApi()
        .on("get_info", params -> Map.of("name", "Live Set", "tempo", 120.0))
        .on("echo", params -> params);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private HostLinkRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.stop();
        }
    }

    private static CommandRegistry registry() {
        return StandardCommands.register(CommandRegistry.builder())
            .register("get_info", SafetyTier.NEVER_LOSSY)
            .register("echo", SafetyTier.NEVER_LOSSY)
            .build();
    }

    private HostLinkRuntime start(Duration responseTimeout) {
        runtime = HostLinkRuntime.builder()
            .withSessionApi(session)
            .withRegistry(registry())
            .withConfig(HostLinkConfig.builder()
                .withEphemeralPorts()
                .withResponseTimeout(responseTimeout)
                .build())
            .withObservabilitySink(sink)
            .build();
        runtime.start();
        return runtime;
    }

    private HostLinkRuntime start() {
        return start(Duration.ofSeconds(10));
    }

    private int reliablePort() {
        return ((InetSocketAddress) runtime.reliableAddress()).getPort();
    }

    private int lossyPort() {
        return ((InetSocketAddress) runtime.lossyAddress()).getPort();
    }

    @Test
    void getInfoRoundTrip() throws Exception {
        start();
        try (RawJsonClient client = RawJsonClient.connect(runtime.reliableAddress())) {
            client.send("{\"type\":\"get_info\",\"params\":{}}");

            JsonNode response = client.readResponse();
            assertEquals("success", response.get("status").asText());
            assertEquals("Live Set", response.get("result").get("name").asText());
        }
    }

    @Test
    void malformedJsonGetsErrorAndConnectionStaysUsable() throws Exception {
        start();
        try (RawJsonClient client = RawJsonClient.connect(runtime.reliableAddress())) {
            client.send("{\"type\": get_info, \"params\": {}}");
            JsonNode error = client.readResponse();
            assertEquals("error", error.get("status").asText());

            client.send("{\"type\":\"get_info\",\"params\":{}}");
            assertEquals("success", client.readResponse().get("status").asText());
        }
        assertEquals(List.of("get_info"), session.commandNames());
    }

    @Test
    void handlerExceptionGetsErrorAndConnectionStaysUsable() throws Exception {
        session.on("delete_scene", params -> {
            throw new SessionException("Scene index out of range");
        });
        start();
        try (RawJsonClient client = RawJsonClient.connect(runtime.reliableAddress())) {
            client.send("{\"type\":\"delete_scene\",\"params\":{\"scene_index\":99}}");
            assertEquals("Scene index out of range", client.readResponse().get("message").asText());

            client.send("{\"type\":\"get_info\"}");
            assertEquals("success", client.readResponse().get("status").asText());
        }
    }

    @Test
    void slowCommandTimesOutAndConnectionStaysUsable() throws Exception {
        session.on("get_browser_tree", params -> {
            Thread.sleep(600);
            return "tree";
        });
        start(Duration.ofMillis(200));
        try (RawJsonClient client = RawJsonClient.connect(runtime.reliableAddress())) {
            client.send("{\"type\":\"get_browser_tree\",\"id\":1}");
            JsonNode timeout = client.readResponse();
            assertEquals("Timeout waiting for operation to complete", timeout.get("message").asText());
            assertEquals(1, timeout.get("id").asInt());

            // The slow command still runs to completion; the connection serves the next request
            assertTrue(session.awaitCalls(1, 5000));
            client.send("{\"type\":\"echo\",\"params\":{\"n\":2},\"id\":2}");
            JsonNode next = client.readResponse();
            assertEquals("success", next.get("status").asText());
            assertEquals(2, next.get("id").asInt());
        }
    }

    @Test
    void twoConnectionsWithFiftyInterleavedRequestsEachGetTheirOwnResponses() throws Exception {
        start();
        runConcurrentConnections(2, 50);
    }

    @Test
    void manyConnectionsNeverSeeEachOthersResponses() throws Exception {
        start();
        runConcurrentConnections(8, 25);
    }

    private void runConcurrentConnections(int connections, int requestsEach) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(connections);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int c = 0; c < connections; c++) {
                int connection = c;
                results.add(pool.submit(() -> {
                    int matched = 0;
                    try (RawJsonClient client = RawJsonClient.connect(runtime.reliableAddress())) {
                        for (int r = 0; r < requestsEach; r++) {
                            String tag = connection + ":" + r;
                            client.send("{\"type\":\"echo\",\"params\":{\"tag\":\"" + tag + "\"},\"id\":\"" + tag + "\"}");
                            JsonNode response = client.readResponse();
                            assertEquals(tag, response.get("id").asText());
                            assertEquals(tag, response.get("result").get("tag").asText());
                            matched++;
                        }
                    }
                    return matched;
                }));
            }
            for (Future<Integer> f : results) {
                assertEquals(requestsEach, f.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(connections * requestsEach, session.calls().size());
    }

    @Test
    void clientCallsFromManyThreadsShareOneConnection() throws Exception {
        start();
        ClientConfig config = ClientConfig.builder()
            .withReliablePort(reliablePort())
            .withLossyPort(lossyPort())
            .build();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try (ClientConnectionManager client = new ClientConnectionManager(config)) {
            List<Future<Object>> results = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                int n = i;
                results.add(pool.submit(() -> client.call("echo", Map.of("n", n))));
            }
            for (int i = 0; i < 40; i++) {
                assertEquals(Map.of("n", i), results.get(i).get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void fullBlockingQueueDoesNotStallConnectionsSharingTheIoThread() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        session.on("get_browser_tree", params -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return "tree";
        });
        HostLinkConfig config = HostLinkConfig.builder()
            .withEphemeralPorts()
            .withSerializer(SerializerConfig.defaults()
                .withQueueCapacity(1)
                .withQueueFullPolicy(QueueFullPolicy.BLOCK)
                .withOfferTimeout(Duration.ofSeconds(3)))
            .build();
        // One worker thread: every connection shares the same event loop
        runtime = HostLinkRuntime.builder()
            .withSessionApi(session)
            .withRegistry(registry())
            .withConfig(config)
            .withObservabilitySink(sink)
            .withStreamEndpoint(new NettyTcpStreamEndpoint(
                config.reliableBindAddress(), config.maxFrameLength(), config.idleTimeout(), config.writeTimeout(), 1))
            .build();
        runtime.start();

        try (RawJsonClient a = RawJsonClient.connect(runtime.reliableAddress());
             RawJsonClient b = RawJsonClient.connect(runtime.reliableAddress());
             RawJsonClient c = RawJsonClient.connect(runtime.reliableAddress());
             RawJsonClient d = RawJsonClient.connect(runtime.reliableAddress())) {
            // GIVEN: one command executing and the one-slot queue taken
            a.send("{\"type\":\"get_browser_tree\"}");
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            b.send("{\"type\":\"get_info\"}");
            c.send("{\"type\":\"get_info\"}");

            // WHEN: an unrelated connection sends an unknown command
            d.setReadTimeout(1500);
            d.send("{\"type\":\"launch_rockets\"}");

            // THEN: it is answered while the other submission still waits for space
            assertEquals("Unknown command: launch_rockets", d.readResponse().get("message").asText());

            release.countDown();
            assertEquals("tree", a.readResponse().get("result").asText());
            assertEquals("success", b.readResponse().get("status").asText());
            assertEquals("success", c.readResponse().get("status").asText());
        }
        assertTrue(sink.getRejections(RejectionReason.QUEUE_FULL).isEmpty());
    }

    @Test
    void neverLossyDatagramIsRejectedWithoutInvokingSession() throws Exception {
        start();
        byte[] delete = "{\"type\":\"delete_track\",\"params\":{\"track_index\":0}}".getBytes(StandardCharsets.UTF_8);
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.send(new DatagramPacket(delete, delete.length, InetAddress.getLoopbackAddress(), lossyPort()));
        }

        assertTrue(sink.awaitCount(CommandRejectedEvent.class, 1, 5000));
        assertEquals(1, sink.getRejections(RejectionReason.NEVER_LOSSY).size());
        assertTrue(session.calls().isEmpty());

        // The receive loop is still alive
        byte[] mute = "{\"type\":\"set_track_mute\",\"params\":{\"track_index\":0,\"mute\":true}}"
            .getBytes(StandardCharsets.UTF_8);
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.send(new DatagramPacket(mute, mute.length, InetAddress.getLoopbackAddress(), lossyPort()));
        }
        assertTrue(session.awaitCalls(1, 5000));
        assertEquals(List.of("set_track_mute"), session.commandNames());
    }
}
