package com.questrail.hostlink.config;

import com.questrail.hostlink.exec.QueueFullPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HostLinkConfigTest {

    @Test
    void defaultsMatchStockPortsAndTimeouts() {
        HostLinkConfig config = HostLinkConfig.defaults();

        assertEquals("127.0.0.1", config.bindHost());
        assertEquals(9877, config.reliablePort());
        assertEquals(9878, config.lossyPort());
        assertEquals(Duration.ofSeconds(10), config.responseTimeout());
        assertEquals(4096, config.serializer().queueCapacity());
        assertEquals(QueueFullPolicy.REJECT, config.serializer().queueFullPolicy());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> HostLinkConfig.builder().withReliablePort(70000).build());
        assertThrows(IllegalArgumentException.class,
            () -> HostLinkConfig.builder().withResponseTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> HostLinkConfig.builder().withMaxFrameLength(1).build());
    }

    @Test
    void clientDefaultsMatchServerPorts() {
        ClientConfig client = ClientConfig.defaults();

        assertEquals(9877, client.reliablePort());
        assertEquals(9878, client.lossyPort());
        assertEquals(Duration.ofSeconds(15), client.readTimeout());
        assertEquals(3, client.connectAttempts());
        assertEquals(8192, client.readChunkSize());
    }

    @Test
    void clientRequiresAtLeastOneConnectAttempt() {
        assertThrows(IllegalArgumentException.class,
            () -> ClientConfig.builder().withConnectAttempts(0).build());
    }
}
