package io.penguin.metrics.agent.mqtt;

import io.penguin.metrics.config.model.MqttSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class MqttTransportTest {

    private static final MqttSettings MQTT = MqttSettings.defaults();
    private static final String STATUS = "penguin_metrics/status";
    private static final TransportSettings SETTINGS = new TransportSettings(Duration.ofSeconds(1),
            Duration.ofSeconds(1), Duration.ofMillis(10), Duration.ofMillis(50), 100, Duration.ofMinutes(10),
            Duration.ofSeconds(2));

    private FakeBrokerConnection broker;
    private MqttTransport transport;

    @BeforeEach
    void setUp() {
        broker = new FakeBrokerConnection();
        transport = new MqttTransport(broker, MQTT, SETTINGS);
    }

    @AfterEach
    void tearDown() {
        transport.shutdown();
    }

    @Test
    @DisplayName("Should announce online before delivering queued messages in order")
    void onlineThenFifo() {
        transport.publish("t/a", "1", false);
        transport.publish("t/b", "2", false);
        transport.start();
        transport.publish("t/c", "3", false);

        await().atMost(Duration.ofSeconds(5)).until(() -> broker.published().size() == 4);

        List<FakeBrokerConnection.Published> published = broker.published();
        assertEquals(new FakeBrokerConnection.Published(STATUS, "online", true), published.get(0));
        assertEquals(List.of("t/a", "t/b", "t/c"),
                published.subList(1, 4).stream().map(FakeBrokerConnection.Published::topic).toList());
        assertEquals(TransportState.CONNECTED, transport.getState());
    }

    @Test
    @DisplayName("Should retry the failed head after reconnecting without reordering")
    void reconnectKeepsOrder() {
        broker.failOnce("2");
        transport.start();
        transport.publish("t/x", "1", false);
        transport.publish("t/x", "2", false);
        transport.publish("t/x", "3", false);

        await().atMost(Duration.ofSeconds(5)).until(() -> broker.payloadsOn("t/x").size() == 3);

        assertEquals(List.of("1", "2", "3"), broker.payloadsOn("t/x"));
        assertEquals(2, broker.connectCount());
        assertEquals(List.of("online", "online"), broker.payloadsOn(STATUS));
    }

    @Test
    @DisplayName("Should retry the online status before draining when its publish fails on a live session")
    void retriesOnlineStatusOnLiveSession() {
        broker.rejectPublishes(1);
        transport.publish("t/a", "1", false);
        transport.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> broker.payloadsOn("t/a").size() == 1);

        List<FakeBrokerConnection.Published> published = broker.published();
        assertEquals(new FakeBrokerConnection.Published(STATUS, "online", true), published.get(0));
        assertEquals("t/a", published.get(1).topic());
        assertEquals(1, broker.connectCount());
        assertEquals(TransportState.CONNECTED, transport.getState());
    }

    @Test
    @DisplayName("Should keep messages while the broker is unreachable")
    void queuesWhileUnreachable() {
        broker.failConnects(3);
        transport.publish("t/a", "1", true);
        transport.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> broker.payloadsOn("t/a").size() == 1);
        assertEquals(0, transport.getQueueSize());
        assertEquals(1, broker.connectCount());
    }

    @Test
    @DisplayName("Should mark sources and agent offline on shutdown")
    void shutdownSequence() {
        transport.start();
        transport.publishSource("penguin_metrics/process/nginx", "{\"state\":\"running\"}");
        transport.publishSource("penguin_metrics/service/ssh", "{\"state\":\"active\"}");
        transport.forgetSource("penguin_metrics/service/ssh");
        await().atMost(Duration.ofSeconds(5)).until(() -> broker.published().size() == 3);

        transport.shutdown();

        List<FakeBrokerConnection.Published> published = broker.published();
        assertEquals(5, published.size());
        assertEquals(new FakeBrokerConnection.Published("penguin_metrics/process/nginx",
                MqttTransport.SOURCE_OFFLINE, true), published.get(3));
        assertEquals(new FakeBrokerConnection.Published(STATUS, "offline", true), published.get(4));
        assertFalse(broker.isConnected());
        assertEquals(TransportState.DISCONNECTED, transport.getState());
    }

    @Test
    @DisplayName("Should double the backoff delay up to the cap")
    void backoffDelay() {
        Duration initial = Duration.ofSeconds(1);
        Duration max = Duration.ofSeconds(60);

        assertEquals(Duration.ofSeconds(1), MqttTransport.backoffDelay(1, initial, max));
        assertEquals(Duration.ofSeconds(2), MqttTransport.backoffDelay(2, initial, max));
        assertEquals(Duration.ofSeconds(32), MqttTransport.backoffDelay(6, initial, max));
        assertEquals(max, MqttTransport.backoffDelay(7, initial, max));
        assertEquals(max, MqttTransport.backoffDelay(100, initial, max));
    }

    @Test
    @DisplayName("Should use the configured client id or generate one")
    void clientId() {
        assertTrue(MqttTransport.clientId(MQTT).matches("penguin_metrics_[0-9a-f]{8}"));
        MqttSettings named = new MqttSettings("h", 1883, null, null, "agent-1", "p", 1, true, 60);
        assertEquals("agent-1", MqttTransport.clientId(named));
    }
}
