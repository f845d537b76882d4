package io.penguin.metrics.agent.mqtt;

import io.penguin.metrics.config.model.MqttSettings;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * {@link BrokerConnection} backed by the Eclipse Paho synchronous client. Paho's own automatic
 * reconnect is off; {@link MqttTransport} owns reconnection and backoff.
 */
public class PahoBrokerConnection implements BrokerConnection {

    public static final String OFFLINE = "offline";

    private final MqttSettings mqtt;
    private final TransportSettings settings;
    private final String clientId;
    private MqttClient client;

    public PahoBrokerConnection(MqttSettings mqtt, TransportSettings settings, String clientId) {
        this.mqtt = mqtt;
        this.settings = settings;
        this.clientId = clientId;
    }

    @Override
    public synchronized void connect(Consumer<Throwable> onConnectionLost) throws TransportException {
        try {
            if (client == null) {
                client = new MqttClient(mqtt.brokerUri(), clientId, new MemoryPersistence());
                client.setTimeToWait(settings.publishTimeout().toMillis());
            }
            client.setCallback(new MqttCallback() {
                @Override
                public void connectionLost(Throwable cause) {
                    onConnectionLost.accept(cause);
                }

                @Override
                public void messageArrived(String topic, MqttMessage message) {
                }

                @Override
                public void deliveryComplete(IMqttDeliveryToken token) {
                }
            });
            client.connect(options());
        } catch (MqttException e) {
            throw new TransportException("Cannot connect to " + mqtt.brokerUri() + ": " + e.getMessage(), e);
        }
    }

    MqttConnectOptions options() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        options.setKeepAliveInterval(mqtt.keepaliveSeconds());
        options.setConnectionTimeout((int) Math.max(1, settings.connectTimeout().toSeconds()));
        if (mqtt.username() != null) {
            options.setUserName(mqtt.username());
        }
        if (mqtt.password() != null) {
            options.setPassword(mqtt.password().toCharArray());
        }
        options.setWill(mqtt.statusTopic(), OFFLINE.getBytes(StandardCharsets.UTF_8), mqtt.qos(), true);
        return options;
    }

    @Override
    public synchronized boolean isConnected() {
        return client != null && client.isConnected();
    }

    @Override
    public void publish(String topic, byte[] payload, int qos, boolean retain) throws TransportException {
        MqttClient current;
        synchronized (this) {
            current = client;
        }
        if (current == null || !current.isConnected()) {
            throw new TransportException("Not connected");
        }
        try {
            current.publish(topic, payload, qos, retain);
        } catch (MqttException e) {
            throw new TransportException("Publish to " + topic + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void disconnect() throws TransportException {
        if (client == null) {
            return;
        }
        try {
            if (client.isConnected()) {
                client.disconnect();
            }
            client.close();
        } catch (MqttException e) {
            throw new TransportException("Disconnect failed: " + e.getMessage(), e);
        } finally {
            client = null;
        }
    }
}
