package io.penguin.metrics.config.model;

/**
 * Where a source's sensors are grouped in Home Assistant.
 *
 * @param template template name for {@link Kind#TEMPLATE}, otherwise {@code null}
 */
public record DeviceRef(Kind kind, String template) {

    public enum Kind {
        /** Type-dependent: own device or the host device. */
        AUTO,
        /** The host device. */
        SYSTEM,
        /** No device at all. */
        NONE,
        /** A {@code device "name" { }} template. */
        TEMPLATE
    }

    public static final DeviceRef AUTO = new DeviceRef(Kind.AUTO, null);
    public static final DeviceRef SYSTEM = new DeviceRef(Kind.SYSTEM, null);
    public static final DeviceRef NONE = new DeviceRef(Kind.NONE, null);

    public static DeviceRef parse(String value) {
        if (value == null) {
            return AUTO;
        }
        return switch (value) {
            case "auto" -> AUTO;
            case "system" -> SYSTEM;
            case "none" -> NONE;
            default -> new DeviceRef(Kind.TEMPLATE, value);
        };
    }

    @Override
    public String toString() {
        return kind == Kind.TEMPLATE ? template : kind.name().toLowerCase();
    }
}
