package com.questrail.hostlink.runtime;

import com.questrail.hostlink.api.RecordingSessionApi;
import com.questrail.hostlink.config.HostLinkConfig;
import com.questrail.hostlink.observability.Slf4jDispatchObservabilitySink;
import com.questrail.hostlink.transport.tcp.RawJsonClient;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

import static org.junit.jupiter.api.Assertions.*;

class HostLinkRuntimeSmokeTest {

    @Test
    void fullStackLifecycle() {
        HostLinkRuntime runtime = HostLinkRuntime.builder()
            .withSessionApi(new RecordingSessionApi())
            .withConfig(HostLinkConfig.builder().withEphemeralPorts().build())
            .withObservabilitySink(new Slf4jDispatchObservabilitySink())
            .build();

        assertNotNull(runtime);
        assertNull(runtime.reliableAddress());

        runtime.start();
        assertTrue(runtime.isRunning());
        assertNotEquals(0, ((InetSocketAddress) runtime.reliableAddress()).getPort());
        assertNotEquals(0, ((InetSocketAddress) runtime.lossyAddress()).getPort());
        assertTrue(runtime.registry().classify("get_session_info").isPresent());

        runtime.stop();
        assertFalse(runtime.isRunning());
    }

    @Test
    void secondStartIsRefusedAndLeavesTheRunningStackServing() throws Exception {
        HostLinkRuntime runtime = HostLinkRuntime.builder()
            .withSessionApi(new RecordingSessionApi())
            .withConfig(HostLinkConfig.builder().withEphemeralPorts().build())
            .build();
        runtime.start();
        try {
            SocketAddress bound = runtime.reliableAddress();

            assertThrows(IllegalStateException.class, runtime::start);

            assertTrue(runtime.isRunning());
            assertEquals(bound, runtime.reliableAddress());
            try (RawJsonClient client = RawJsonClient.connect(bound)) {
                client.send("{\"type\":\"get_session_info\"}");
                assertEquals("success", client.readResponse().get("status").asText());
            }
        } finally {
            runtime.stop();
        }
    }

    @Test
    void sessionApiIsRequired() {
        assertThrows(NullPointerException.class, () -> HostLinkRuntime.builder().build());
    }

    @Test
    void failedBindLeavesNothingRunning() {
        HostLinkRuntime first = HostLinkRuntime.builder()
            .withSessionApi(new RecordingSessionApi())
            .withConfig(HostLinkConfig.builder().withEphemeralPorts().build())
            .build();
        first.start();
        try {
            int takenPort = ((InetSocketAddress) first.lossyAddress()).getPort();
            HostLinkRuntime second = HostLinkRuntime.builder()
                .withSessionApi(new RecordingSessionApi())
                .withConfig(HostLinkConfig.builder().withReliablePort(0).withLossyPort(takenPort).build())
                .build();

            assertThrows(IllegalStateException.class, second::start);
            assertFalse(second.isRunning());
        } finally {
            first.stop();
        }
    }
}
