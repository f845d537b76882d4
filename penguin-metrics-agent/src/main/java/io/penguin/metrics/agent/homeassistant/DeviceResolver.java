package io.penguin.metrics.agent.homeassistant;

import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.DeviceRef;
import io.penguin.metrics.config.model.DeviceTemplate;
import io.penguin.metrics.config.model.SourceConfig;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which Home Assistant device a source's sensors belong to.
 */
public class DeviceResolver {

    public static final String MANUFACTURER = "Penguin Metrics";

    private final String topicPrefix;
    private final String hostname;
    private final Map<String, DeviceTemplate> templates;
    private final Device hostDevice;

    public DeviceResolver(String topicPrefix, String hostname, Map<String, DeviceTemplate> templates) {
        this.topicPrefix = topicPrefix;
        this.hostname = hostname;
        this.templates = Map.copyOf(templates);
        this.hostDevice = new Device(List.of("penguin_metrics_" + topicPrefix + "_system"), hostname,
                MANUFACTURER, "Linux Host", null, Map.of());
    }

    public Device hostDevice() {
        return hostDevice;
    }

    /**
     * @return the device for {@code source}, empty for {@code device none;}
     */
    public Optional<Device> resolve(SourceConfig source) {
        DeviceRef ref = source.device();
        return switch (ref.kind()) {
            case NONE -> Optional.empty();
            case SYSTEM -> Optional.of(hostDevice);
            case TEMPLATE -> Optional.of(template(ref.template()));
            case AUTO -> Optional.of(source.type().ownDeviceByDefault() ? ownDevice(source) : hostDevice);
        };
    }

    private Device template(String name) {
        DeviceTemplate template = templates.get(name);
        if (template == null) {
            throw new IllegalStateException("Unknown device template: " + name);
        }
        return new Device(List.of(template.identifier()), template.displayName(), MANUFACTURER, null,
                hostDevice.primaryIdentifier(), template.fields());
    }

    private Device ownDevice(SourceConfig source) {
        SourceType type = source.type();
        String identifier = "penguin_metrics_" + topicPrefix + "_" + type.topicSegment() + "_" + source.id();
        return new Device(List.of(identifier), label(type) + ": " + source.name(), MANUFACTURER, model(type),
                hostDevice.primaryIdentifier(), Map.of());
    }

    private static String label(SourceType type) {
        return switch (type) {
            case PROCESS -> "Process";
            case SERVICE -> "Service";
            case CONTAINER -> "Container";
            case CUSTOM, BINARY_SENSOR -> "Sensor";
            default -> Character.toUpperCase(type.blockName().charAt(0)) + type.blockName().substring(1);
        };
    }

    private static String model(SourceType type) {
        return switch (type) {
            case PROCESS -> "Process Monitor";
            case SERVICE -> "Systemd Service";
            case CONTAINER -> "Docker Container";
            default -> "Custom Sensor";
        };
    }

    public String hostname() {
        return hostname;
    }
}
