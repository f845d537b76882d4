package io.penguin.metrics.agent.collector;

import io.penguin.metrics.agent.probe.Sysfs;
import io.penguin.metrics.config.model.BatterySource;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Battery state from {@code /sys/class/power_supply}. The kernel reports micro-units
 * (µV, µA, µW, µWh), which are published as V, A, W and Wh.
 */
public class BatteryCollector extends AbstractCollector<BatterySource> {

    private static final double MICRO = 1e-6;

    private final Path supplies;

    public BatteryCollector(BatterySource config, Path supplies) {
        super(config);
        this.supplies = supplies;
    }

    @Override
    protected void declareMetrics(List<MetricDescriptor> metrics) {
        metrics.add(MetricDescriptor.text("status", "Status", "mdi:battery-charging"));
        if (enabled("capacity")) {
            metrics.add(MetricDescriptor.measurement("capacity", "Capacity", "%", "battery", "mdi:battery"));
        }
        if (enabled("voltage")) {
            metrics.add(MetricDescriptor.measurement("voltage", "Voltage", "V", "voltage", "mdi:flash"));
        }
        if (enabled("current")) {
            metrics.add(MetricDescriptor.measurement("current", "Current", "A", "current", "mdi:current-dc"));
        }
        if (enabled("power")) {
            metrics.add(MetricDescriptor.measurement("power", "Power", "W", "power", "mdi:lightning-bolt"));
        }
        if (enabled("health")) {
            metrics.add(MetricDescriptor.text("health", "Health", "mdi:battery-heart-variant"));
        }
        if (enabled("energy_now")) {
            metrics.add(MetricDescriptor.measurement("energy_now", "Energy", "Wh", "energy_storage", "mdi:battery"));
        }
        if (enabled("energy_full")) {
            metrics.add(MetricDescriptor.measurement("energy_full", "Energy Full", "Wh", "energy_storage", "mdi:battery"));
        }
        if (enabled("energy_full_design")) {
            metrics.add(MetricDescriptor.measurement("energy_full_design", "Energy Full Design", "Wh", "energy_storage", "mdi:battery"));
        }
        if (enabled("cycles")) {
            metrics.add(MetricDescriptor.total("cycles", "Cycle Count", null, null, "mdi:battery-sync"));
        }
        if (enabled("temperature")) {
            metrics.add(MetricDescriptor.measurement("temperature", "Temperature", "°C", "temperature", "mdi:thermometer"));
        }
        if (enabled("time_to_empty")) {
            metrics.add(MetricDescriptor.measurement("time_to_empty", "Time to Empty", "s", "duration", "mdi:timer-sand"));
        }
        if (enabled("time_to_full")) {
            metrics.add(MetricDescriptor.measurement("time_to_full", "Time to Full", "s", "duration", "mdi:timer-sand"));
        }
        if (enabled("present")) {
            metrics.add(MetricDescriptor.binary("present", "Present", null, "mdi:battery-check"));
        }
        if (enabled("technology")) {
            metrics.add(MetricDescriptor.text("technology", "Technology", "mdi:battery-unknown"));
        }
        for (String key : List.of("voltage_max", "voltage_min", "voltage_max_design", "voltage_min_design")) {
            if (enabled(key)) {
                metrics.add(MetricDescriptor.measurement(key, title(key), "V", "voltage", "mdi:flash"));
            }
        }
        for (String key : List.of("constant_charge_current", "constant_charge_current_max")) {
            if (enabled(key)) {
                metrics.add(MetricDescriptor.measurement(key, title(key), "A", "current", "mdi:current-dc"));
            }
        }
        if (enabled("charge_full_design")) {
            metrics.add(MetricDescriptor.measurement("charge_full_design", "Charge Full Design", "Ah", null, "mdi:battery"));
        }
    }

    @Override
    public CollectorResult collect() {
        Optional<Path> located = locate();
        if (located.isEmpty()) {
            return CollectorResult.notFound();
        }
        Path dir = located.get();
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("status", Sysfs.read(dir.resolve("status")).orElse(null));
        if (enabled("capacity")) {
            values.put("capacity", value(dir, "capacity"));
        }
        Double voltage = micro(dir, "voltage_now");
        Double current = micro(dir, "current_now");
        if (enabled("voltage")) {
            values.put("voltage", voltage == null ? null : round(voltage, 2));
        }
        if (enabled("current")) {
            values.put("current", current == null ? null : round(current, 3));
        }
        if (enabled("power")) {
            Double power = micro(dir, "power_now");
            if (power == null && voltage != null && current != null) {
                power = Math.abs(voltage * current);
            }
            values.put("power", power == null ? null : round(power, 2));
        }
        if (enabled("health")) {
            values.put("health", Sysfs.read(dir.resolve("health")).orElse(null));
        }
        for (String key : List.of("energy_now", "energy_full", "energy_full_design")) {
            if (enabled(key)) {
                Double energy = micro(dir, key);
                values.put(key, energy == null ? null : round(energy, 2));
            }
        }
        if (enabled("cycles")) {
            values.put("cycles", value(dir, "cycle_count"));
        }
        if (enabled("temperature")) {
            OptionalLong tenths = Sysfs.readLong(dir.resolve("temp"));
            values.put("temperature", tenths.isPresent() ? round(tenths.getAsLong() / 10.0, 1) : null);
        }
        if (enabled("time_to_empty")) {
            values.put("time_to_empty", value(dir, "time_to_empty_now"));
        }
        if (enabled("time_to_full")) {
            values.put("time_to_full", value(dir, "time_to_full_now"));
        }
        if (enabled("present")) {
            values.put("present", Sysfs.readLong(dir.resolve("present")).orElse(0) == 1 ? "ON" : "OFF");
        }
        if (enabled("technology")) {
            values.put("technology", Sysfs.read(dir.resolve("technology")).orElse(null));
        }
        for (String key : List.of("voltage_max", "voltage_min", "voltage_max_design", "voltage_min_design",
                "constant_charge_current", "constant_charge_current_max", "charge_full_design")) {
            if (enabled(key)) {
                Double scaled = micro(dir, key);
                values.put(key, scaled == null ? null : round(scaled, 3));
            }
        }
        return CollectorResult.online(values);
    }

    Optional<Path> locate() {
        if (config.path() != null) {
            Path dir = Path.of(config.path());
            return Files.isDirectory(dir) ? Optional.of(dir) : Optional.empty();
        }
        if (config.supply() != null) {
            Path dir = supplies.resolve(config.supply());
            return Files.isDirectory(dir) ? Optional.of(dir) : Optional.empty();
        }
        List<Path> batteries = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(supplies)) {
            for (Path entry : entries) {
                if (Sysfs.read(entry.resolve("type")).filter("Battery"::equals).isPresent()) {
                    batteries.add(entry);
                }
            }
        } catch (IOException e) {
            return Optional.empty();
        }
        return batteries.stream().sorted().findFirst();
    }

    private static Long value(Path dir, String file) {
        OptionalLong value = Sysfs.readLong(dir.resolve(file));
        return value.isPresent() ? value.getAsLong() : null;
    }

    private static Double micro(Path dir, String file) {
        OptionalLong value = Sysfs.readLong(dir.resolve(file));
        return value.isPresent() ? value.getAsLong() * MICRO : null;
    }

    private static String title(String key) {
        StringBuilder title = new StringBuilder();
        for (String word : key.split("_")) {
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.toString();
    }
}
