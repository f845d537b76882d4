package io.penguin.metrics.config;

import java.util.Optional;

/**
 * The kinds of telemetry source the agent knows about, with the names they use in the
 * configuration language and on the wire.
 */
public enum SourceType {
    SYSTEM("system", null, "system", false, false),
    PROCESS("process", "processes", "process", true, true),
    SERVICE("service", "services", "service", true, true),
    CONTAINER("container", "containers", "docker", false, true),
    TEMPERATURE("temperature", "temperatures", "temperature", false, false),
    BATTERY("battery", "batteries", "battery", false, false),
    AC_POWER("ac_power", "ac_powers", "ac_power", false, false),
    DISK("disk", "disks", "disk", false, false),
    CUSTOM("custom", null, "custom", false, true),
    BINARY_SENSOR("custom_binary", null, "binary_sensor", false, true);

    private final String blockName;
    private final String autoBlockName;
    private final String topicSegment;
    private final boolean filterRequired;
    private final boolean ownDeviceByDefault;

    SourceType(String blockName, String autoBlockName, String topicSegment,
               boolean filterRequired, boolean ownDeviceByDefault) {
        this.blockName = blockName;
        this.autoBlockName = autoBlockName;
        this.topicSegment = topicSegment;
        this.filterRequired = filterRequired;
        this.ownDeviceByDefault = ownDeviceByDefault;
    }

    /** Block keyword of a manual declaration, e.g. {@code battery}. */
    public String blockName() {
        return blockName;
    }

    /** Block keyword of the auto-discovery section, e.g. {@code batteries}; {@code null} if not discoverable. */
    public String autoBlockName() {
        return autoBlockName;
    }

    /** Topic path segment, e.g. {@code docker} for containers. */
    public String topicSegment() {
        return topicSegment;
    }

    /** Whether auto-discovery refuses to run without at least one {@code filter}. */
    public boolean filterRequired() {
        return filterRequired;
    }

    /** Whether sources of this type get their own device when none is configured. */
    public boolean ownDeviceByDefault() {
        return ownDeviceByDefault;
    }

    public boolean discoverable() {
        return autoBlockName != null;
    }

    public static Optional<SourceType> fromBlockName(String name) {
        for (SourceType type : values()) {
            if (type.blockName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static Optional<SourceType> fromAutoBlockName(String name) {
        for (SourceType type : values()) {
            if (name.equals(type.autoBlockName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
