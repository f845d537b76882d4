package io.penguin.metrics.agent;

import io.penguin.metrics.agent.collector.CollectorFactory;
import io.penguin.metrics.agent.config.AgentSettings;
import io.penguin.metrics.agent.discovery.NamespaceEnumerator;
import io.penguin.metrics.agent.homeassistant.DeviceResolver;
import io.penguin.metrics.agent.homeassistant.HomeAssistantDiscovery;
import io.penguin.metrics.agent.homeassistant.SensorFactory;
import io.penguin.metrics.agent.mqtt.MqttTransport;
import io.penguin.metrics.config.model.Config;

import java.util.List;

/**
 * Everything a running agent is wired from. Built once at startup and passed explicitly.
 */
public record AgentContext(
        Config config,
        AgentSettings settings,
        MqttTransport transport,
        HomeAssistantDiscovery discovery,
        DeviceResolver devices,
        SensorFactory sensors,
        CollectorFactory collectors,
        List<NamespaceEnumerator> enumerators) {

    public AgentContext {
        enumerators = List.copyOf(enumerators);
    }
}
