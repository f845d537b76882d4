package io.penguin.metrics.agent.mqtt;

import io.penguin.metrics.config.model.MqttSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Persistent broker session with a FIFO outbound queue.
 * <p>
 * All publishing goes through the queue and a single drain thread, so messages reach the
 * broker in enqueue order. A message is removed only after the broker accepted it; a failed
 * publish leaves it at the head and the thread reconnects with capped exponential backoff.
 * Nothing is drained in a session until the retained {@code online} status was accepted.
 */
public class MqttTransport implements MessagePublisher {

    private static final Logger log = LoggerFactory.getLogger(MqttTransport.class);

    public static final String ONLINE = "online";
    public static final String OFFLINE = "offline";
    static final String SOURCE_OFFLINE = "{\"state\":\"offline\"}";
    private static final Duration IDLE_WAIT = Duration.ofMillis(200);

    private final BrokerConnection connection;
    private final MqttSettings mqtt;
    private final TransportSettings settings;
    private final OutboundQueue queue;
    private final Clock clock;
    private final Set<String> sourceTopics = ConcurrentHashMap.newKeySet();
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private volatile TransportState state = TransportState.DISCONNECTED;
    private volatile boolean running;
    private volatile boolean onlineAnnounced;
    private volatile int failedAttempts;
    private Thread drainThread;

    public MqttTransport(BrokerConnection connection, MqttSettings mqtt, TransportSettings settings) {
        this(connection, mqtt, settings, Clock.systemUTC());
    }

    MqttTransport(BrokerConnection connection, MqttSettings mqtt, TransportSettings settings, Clock clock) {
        this.connection = connection;
        this.mqtt = mqtt;
        this.settings = settings;
        this.clock = clock;
        this.queue = new OutboundQueue(settings.maxQueueSize(), settings.maxMessageAge(), clock);
    }

    /**
     * @return the configured client id, or a random {@code penguin_metrics_xxxxxxxx}
     */
    public static String clientId(MqttSettings mqtt) {
        if (mqtt.clientId() != null && !mqtt.clientId().isEmpty()) {
            return mqtt.clientId();
        }
        return "penguin_metrics_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        state = TransportState.CONNECTING;
        drainThread = new Thread(this::drainLoop, "mqtt-transport");
        drainThread.setDaemon(true);
        drainThread.start();
        log.info("MQTT transport started for {}", mqtt.brokerUri());
    }

    @Override
    public void publish(String topic, String payload, boolean retain) {
        queue.offer(new OutboundMessage(topic, payload, mqtt.qos(), retain, Instant.now(clock)));
    }

    /**
     * Publishes a source payload and remembers the topic for the offline sequence on shutdown.
     */
    public void publishSource(String topic, String payload) {
        sourceTopics.add(topic);
        publish(topic, payload, mqtt.retain());
    }

    public void forgetSource(String topic) {
        sourceTopics.remove(topic);
    }

    public TransportState getState() {
        return state;
    }

    public int getQueueSize() {
        return queue.size();
    }

    /**
     * Flushes the queue, marks every known source and then the agent offline, and disconnects.
     * The whole sequence is bounded by the offline publish timeout.
     */
    public void shutdown() {
        long deadline = clock.millis() + settings.offlinePublishTimeout().toMillis();
        while (running && !queue.isEmpty() && state == TransportState.CONNECTED && clock.millis() < deadline) {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        synchronized (this) {
            running = false;
        }
        stopSignal.countDown();
        if (drainThread != null) {
            try {
                drainThread.join(settings.publishTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (!queue.isEmpty()) {
            log.warn("Shutting down with {} undelivered messages", queue.size());
        }
        if (connection.isConnected()) {
            for (String topic : List.copyOf(sourceTopics)) {
                if (clock.millis() >= deadline) {
                    log.warn("Offline publish timeout reached, skipping remaining source topics");
                    break;
                }
                sendQuietly(topic, SOURCE_OFFLINE, mqtt.retain());
            }
            sendQuietly(mqtt.statusTopic(), OFFLINE, true);
            try {
                connection.disconnect();
            } catch (TransportException e) {
                log.warn("Error disconnecting from broker: {}", e.getMessage());
            }
        }
        state = TransportState.DISCONNECTED;
        log.info("MQTT transport stopped");
    }

    private void drainLoop() {
        while (running) {
            try {
                if (!connection.isConnected()) {
                    connectOnce();
                    continue;
                }
                if (!onlineAnnounced) {
                    announceOnline();
                    continue;
                }
                OutboundMessage head = queue.peek();
                if (head == null) {
                    queue.awaitNonEmpty(IDLE_WAIT);
                    continue;
                }
                try {
                    connection.publish(head.topic(), head.payloadBytes(), head.qos(), head.retain());
                    queue.remove(head);
                    if (state != TransportState.CONNECTED) {
                        state = TransportState.CONNECTED;
                        failedAttempts = 0;
                    }
                } catch (TransportException e) {
                    log.warn("Publish failed, will retry after reconnect: {}", e.getMessage());
                    state = TransportState.RECONNECTING;
                    backoff();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Unexpected error in transport loop", e);
            }
        }
    }

    private void connectOnce() throws InterruptedException {
        if (state == TransportState.CONNECTED) {
            state = TransportState.RECONNECTING;
        }
        onlineAnnounced = false;
        try {
            connection.connect(this::onConnectionLost);
            log.info("Connected to MQTT broker {}", mqtt.brokerUri());
        } catch (TransportException e) {
            log.warn("Connection to {} failed: {}", mqtt.brokerUri(), e.getMessage());
            backoff();
            return;
        }
        announceOnline();
    }

    private void announceOnline() throws InterruptedException {
        try {
            connection.publish(mqtt.statusTopic(), ONLINE.getBytes(StandardCharsets.UTF_8), mqtt.qos(), true);
            onlineAnnounced = true;
            state = TransportState.CONNECTED;
            failedAttempts = 0;
        } catch (TransportException e) {
            log.warn("Could not publish online status, retrying: {}", e.getMessage());
            backoff();
        }
    }

    private void backoff() throws InterruptedException {
        failedAttempts++;
        Duration delay = backoffDelay(failedAttempts, settings.initialBackoff(), settings.maxBackoff());
        log.debug("Reconnecting in {}ms (attempt {})", delay.toMillis(), failedAttempts);
        stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * {@code min(max, initial * 2^(attempt-1))}
     */
    static Duration backoffDelay(int attempt, Duration initial, Duration max) {
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        long millis = initial.toMillis() * (1L << exponent);
        return millis <= 0 || millis > max.toMillis() ? max : Duration.ofMillis(millis);
    }

    private void onConnectionLost(Throwable cause) {
        log.warn("Lost connection to MQTT broker: {}", cause == null ? "unknown" : cause.getMessage());
        onlineAnnounced = false;
        state = TransportState.RECONNECTING;
    }

    private void sendQuietly(String topic, String payload, boolean retain) {
        try {
            connection.publish(topic, payload.getBytes(StandardCharsets.UTF_8), mqtt.qos(), retain);
        } catch (TransportException e) {
            log.warn("Could not publish to {} during shutdown: {}", topic, e.getMessage());
        }
    }
}
