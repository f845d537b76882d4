package io.penguin.metrics.agent.collector;

import io.penguin.metrics.agent.probe.Sysfs;
import io.penguin.metrics.config.model.TemperatureSource;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reads one temperature in degrees Celsius from a thermal zone, a hwmon sensor or an explicit
 * sysfs file. The file is located once and re-located whenever it disappears.
 */
public class TemperatureCollector extends AbstractCollector<TemperatureSource> {

    private final Path thermalRoot;
    private final Path hwmonRoot;
    private Path input;

    public TemperatureCollector(TemperatureSource config, Path thermalRoot, Path hwmonRoot) {
        super(config);
        this.thermalRoot = thermalRoot;
        this.hwmonRoot = hwmonRoot;
    }

    @Override
    protected void declareMetrics(List<MetricDescriptor> metrics) {
        metrics.add(MetricDescriptor.measurement("temperature", "Temperature", "°C", "temperature", "mdi:thermometer"));
    }

    @Override
    public void initialize() {
        input = locate().orElse(null);
    }

    @Override
    public CollectorResult collect() throws CollectionException {
        if (input == null || !Files.exists(input)) {
            input = locate().orElse(null);
            if (input == null) {
                return CollectorResult.notFound();
            }
        }
        OptionalLong milli = Sysfs.readLong(input);
        if (milli.isEmpty()) {
            throw new CollectionException("Cannot read temperature from " + input);
        }
        return CollectorResult.online(Map.of("temperature", round(milli.getAsLong() / 1000.0, 1)));
    }

    Optional<Path> locate() {
        if (config.path() != null) {
            return Optional.of(Path.of(config.path()));
        }
        if (config.hwmon() != null) {
            return hwmon(config.hwmon());
        }
        return zone(config.zone() != null ? config.zone() : config.name());
    }

    /**
     * Matches a zone by directory name ({@code thermal_zone0}) or by its {@code type}.
     */
    private Optional<Path> zone(String zone) {
        Path direct = thermalRoot.resolve(zone).resolve("temp");
        if (Files.exists(direct)) {
            return Optional.of(direct);
        }
        try (DirectoryStream<Path> zones = Files.newDirectoryStream(thermalRoot, "thermal_zone*")) {
            for (Path dir : zones) {
                if (Sysfs.read(dir.resolve("type")).filter(zone::equals).isPresent()) {
                    return Optional.of(dir.resolve("temp"));
                }
            }
        } catch (IOException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    /**
     * Matches a hwmon chip by its {@code name}; a {@code chip/label} form also matches the sensor label.
     */
    private Optional<Path> hwmon(String selector) {
        int slash = selector.indexOf('/');
        String chip = slash < 0 ? selector : selector.substring(0, slash);
        String label = slash < 0 ? null : selector.substring(slash + 1);
        try (DirectoryStream<Path> chips = Files.newDirectoryStream(hwmonRoot, "hwmon*")) {
            for (Path dir : chips) {
                if (Sysfs.read(dir.resolve("name")).filter(chip::equals).isEmpty()) {
                    continue;
                }
                if (label == null) {
                    Path first = dir.resolve("temp1_input");
                    if (Files.exists(first)) {
                        return Optional.of(first);
                    }
                    continue;
                }
                try (DirectoryStream<Path> labels = Files.newDirectoryStream(dir, "temp*_label")) {
                    for (Path labelFile : labels) {
                        if (Sysfs.read(labelFile).filter(label::equals).isPresent()) {
                            String file = labelFile.getFileName().toString();
                            return Optional.of(dir.resolve(file.replace("_label", "_input")));
                        }
                    }
                }
            }
        } catch (IOException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }
}
