package com.questrail.hostlink.client;

import com.questrail.hostlink.api.RecordingSessionApi;
import com.questrail.hostlink.api.SessionException;
import com.questrail.hostlink.config.ClientConfig;
import com.questrail.hostlink.config.HostLinkConfig;
import com.questrail.hostlink.observability.CommandRejectedEvent;
import com.questrail.hostlink.observability.RecordingObservabilitySink;
import com.questrail.hostlink.observability.RejectionReason;
import com.questrail.hostlink.runtime.HostLinkRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ClientConnectionManagerTest
 * -----------------------------------------------------------------------------
 * Drives the client against a real runtime on ephemeral ports, and against a
 * scripted server for failure shapes the runtime never produces.
 */
class ClientConnectionManagerTest {

    private final RecordingSessionApi session = new RecordingSessionApi();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private HostLinkRuntime runtime;
    private ClientConnectionManager client;
    private ScriptedHostServer scripted;

    @AfterEach
    void tearDown() throws IOException {
        if (client != null) {
            client.close();
        }
        if (runtime != null) {
            runtime.stop();
        }
        if (scripted != null) {
            scripted.close();
        }
    }

    private ClientConnectionManager clientForRuntime() {
        runtime = HostLinkRuntime.builder()
            .withSessionApi(session)
            .withConfig(HostLinkConfig.builder().withEphemeralPorts().build())
            .withObservabilitySink(sink)
            .build();
        runtime.start();

        ClientConfig config = ClientConfig.builder()
            .withReliablePort(((InetSocketAddress) runtime.reliableAddress()).getPort())
            .withLossyPort(((InetSocketAddress) runtime.lossyAddress()).getPort())
            .withReadTimeout(Duration.ofSeconds(5))
            .build();
        client = new ClientConnectionManager(config);
        return client;
    }

    private ClientConnectionManager clientFor(int port, Duration readTimeout, int chunkSize) {
        client = new ClientConnectionManager(ClientConfig.builder()
            .withReliablePort(port)
            .withReadTimeout(readTimeout)
            .withReadChunkSize(chunkSize)
            .withConnectAttempts(1)
            .build());
        return client;
    }

    private static int unusedPort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    @Test
    void callReturnsResult() {
        session.on("get_session_info", params -> Map.of("tempo", 120.0, "track_count", 8));
        ClientConnectionManager c = clientForRuntime();

        Object result = c.call("get_session_info");

        assertEquals(Map.of("tempo", 120.0, "track_count", 8), result);
        assertTrue(c.isConnected());
    }

    @Test
    void largeResultRoundTripsUnchanged() {
        List<Map<String, Object>> notes = new ArrayList<>();
        for (int i = 0; i < 5000; i++) {
            Map<String, Object> note = new LinkedHashMap<>();
            note.put("pitch", i % 128);
            note.put("start_time", i * 0.25);
            note.put("duration", 0.5);
            note.put("velocity", 100);
            note.put("mute", i % 7 == 0);
            note.put("label", "note-" + i);
            notes.add(note);
        }
        session.on("get_clip_notes", params -> notes);
        ClientConnectionManager c = clientForRuntime();

        Object result = c.call("get_clip_notes", Map.of("track_index", 0, "clip_index", 0));

        assertEquals(notes, result);
    }

    @Test
    void errorResponseRaisesCommandExceptionAndConnectionSurvives() {
        session.on("delete_track", params -> {
            throw new SessionException("Track index out of range");
        });
        ClientConnectionManager c = clientForRuntime();

        HostCommandException e = assertThrows(HostCommandException.class,
            () -> c.call("delete_track", Map.of("track_index", 42)));

        assertEquals("Track index out of range", e.hostMessage());
        assertEquals("delete_track", e.commandName());
        assertTrue(c.isConnected());
        assertNotNull(c.call("undo"));
    }

    @Test
    void unknownCommandRaisesCommandException() {
        ClientConnectionManager c = clientForRuntime();

        HostCommandException e = assertThrows(HostCommandException.class, () -> c.call("launch_rockets"));

        assertEquals("Unknown command: launch_rockets", e.hostMessage());
    }

    @Test
    void refusedConnectionRaisesConnectionExceptionAfterAllAttempts() throws IOException {
        int port = unusedPort();
        client = new ClientConnectionManager(ClientConfig.builder()
            .withReliablePort(port)
            .withConnectAttempts(3)
            .withReconnectDelay(Duration.ofMillis(10))
            .build());

        HostConnectionException e = assertThrows(HostConnectionException.class,
            () -> client.call("get_session_info"));

        assertTrue(e.getMessage().contains("3 attempt"));
        assertFalse(client.isConnected());
    }

    @Test
    void responseSplitAcrossManyWritesIsReassembled() throws IOException {
        scripted = new ScriptedHostServer((request, out) -> {
            byte[] response = ("{\"status\":\"success\",\"result\":{\"echo\":\""
                + request.get("type").asText() + "\",\"padding\":\"" + "p".repeat(300) + "\"}}")
                .getBytes(StandardCharsets.UTF_8);
            for (int i = 0; i < response.length; i += 7) {
                out.write(response, i, Math.min(7, response.length - i));
                out.flush();
                Thread.sleep(1);
            }
            return true;
        });
        ClientConnectionManager c = clientFor(scripted.port(), Duration.ofSeconds(5), 16);

        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) c.call("get_track_info");

        assertEquals("get_track_info", result.get("echo"));
        assertEquals(300, ((String) result.get("padding")).length());
    }

    @Test
    void droppedConnectionFailsOneCallThenReconnects() throws IOException {
        scripted = new ScriptedHostServer((request, out) -> {
            out.write("{\"status\":\"success\",\"result\":1}".getBytes(StandardCharsets.UTF_8));
            out.flush();
            return false;
        });
        ClientConnectionManager c = clientFor(scripted.port(), Duration.ofSeconds(5), 8192);

        assertEquals(1, c.call("undo"));
        assertThrows(HostConnectionException.class, () -> c.call("redo"));
        assertFalse(c.isConnected());

        assertEquals(1, c.call("undo"));
        assertEquals(2, scripted.connections());
    }

    @Test
    void readTimeoutRaisesConnectionExceptionAndDiscardsSocket() throws IOException {
        scripted = new ScriptedHostServer((request, out) -> {
            Thread.sleep(2000);
            return false;
        });
        ClientConnectionManager c = clientFor(scripted.port(), Duration.ofMillis(200), 8192);

        HostConnectionException e = assertThrows(HostConnectionException.class, () -> c.call("get_browser_tree"));

        assertTrue(e.getMessage().startsWith("Timed out"));
        assertFalse(c.isConnected());
    }

    @Test
    void unparseableResponseRaisesConnectionException() throws IOException {
        scripted = new ScriptedHostServer((request, out) -> {
            out.write("{\"status\": maybe}".getBytes(StandardCharsets.UTF_8));
            out.flush();
            return true;
        });
        ClientConnectionManager c = clientFor(scripted.port(), Duration.ofSeconds(5), 8192);

        assertThrows(HostConnectionException.class, () -> c.call("undo"));
        assertFalse(c.isConnected());
    }

    @Test
    void callIsNeverRetried() throws IOException {
        scripted = new ScriptedHostServer((request, out) -> false);
        client = new ClientConnectionManager(ClientConfig.builder()
            .withReliablePort(scripted.port())
            .withConnectAttempts(3)
            .withReconnectDelay(Duration.ZERO)
            .build());

        assertThrows(HostConnectionException.class, () -> client.call("delete_all_tracks"));

        assertEquals(1, scripted.requests());
    }

    @Test
    void castIsExecutedWithoutReply() throws Exception {
        ClientConnectionManager c = clientForRuntime();

        c.cast("set_track_volume", Map.of("track_index", 0, "volume", 0.5));

        assertTrue(session.awaitCalls(1, 5000));
        assertEquals(Map.of("track_index", 0, "volume", 0.5), session.calls().get(0).params());
        assertFalse(c.isConnected(), "cast never opens the reliable connection");
    }

    @Test
    void castOfNeverLossyCommandIsRejectedByHost() throws Exception {
        ClientConnectionManager c = clientForRuntime();

        c.cast("delete_track", Map.of("track_index", 0));
        c.cast("fire_clip", Map.of("track_index", 0, "clip_index", 1));

        assertTrue(session.awaitCalls(1, 5000));
        assertEquals(List.of("fire_clip"), session.commandNames());
        assertTrue(sink.awaitCount(CommandRejectedEvent.class, 1, 5000));
        assertEquals(1, sink.getRejections(RejectionReason.NEVER_LOSSY).size());
    }

    @Test
    void oversizedCastIsDroppedWithoutThrowing() throws Exception {
        ClientConnectionManager c = clientForRuntime();

        c.cast("set_device_parameter", Map.of("value", "x".repeat(70_000)));
        c.cast("set_track_pan", Map.of("track_index", 0, "pan", 0.0));

        assertTrue(session.awaitCalls(1, 5000));
        assertEquals(List.of("set_track_pan"), session.commandNames());
    }

    @Test
    void castAfterCloseIsDropped() {
        ClientConnectionManager c = clientForRuntime();
        c.close();

        assertDoesNotThrow(() -> c.cast("fire_scene", Map.of("scene_index", 0)));
    }
}
