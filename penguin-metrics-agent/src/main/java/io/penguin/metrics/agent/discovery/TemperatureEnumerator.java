package io.penguin.metrics.agent.discovery;

import io.penguin.metrics.agent.probe.Sysfs;
import io.penguin.metrics.config.Identifiers;
import io.penguin.metrics.config.SourceConfigFactory;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.AutoDiscoverySettings;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Temperature sensors, either thermal zones (named by zone type) or hwmon inputs
 * (named {@code <chip>_<label>}), depending on the auto block's {@code source}.
 */
public class TemperatureEnumerator implements NamespaceEnumerator {

    private final Path thermalRoot;
    private final Path hwmonRoot;

    public TemperatureEnumerator(Path thermalRoot, Path hwmonRoot) {
        this.thermalRoot = thermalRoot;
        this.hwmonRoot = hwmonRoot;
    }

    @Override
    public SourceType type() {
        return SourceType.TEMPERATURE;
    }

    @Override
    public List<NamespaceEntry> enumerate(AutoDiscoverySettings settings) throws IOException {
        if (SourceConfigFactory.HWMON.equals(settings.source())) {
            return hwmon();
        }
        return thermalZones();
    }

    private List<NamespaceEntry> thermalZones() throws IOException {
        List<Path> zones = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(thermalRoot, "thermal_zone*")) {
            dirs.forEach(zones::add);
        } catch (NoSuchFileException e) {
            return List.of();
        }
        zones.sort(null);
        List<NamespaceEntry> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Path zone : zones) {
            String dir = zone.getFileName().toString();
            String type = Sysfs.read(zone.resolve("type")).orElse(dir);
            String name = seen.add(type) ? type : type + "_" + dir.substring("thermal_zone".length());
            entries.add(new NamespaceEntry(name, dir, List.of(type, dir)));
        }
        return entries;
    }

    private List<NamespaceEntry> hwmon() throws IOException {
        List<Path> chips = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(hwmonRoot, "hwmon*")) {
            dirs.forEach(chips::add);
        } catch (NoSuchFileException e) {
            return List.of();
        }
        chips.sort(null);
        List<NamespaceEntry> entries = new ArrayList<>();
        for (Path chip : chips) {
            String chipName = Sysfs.read(chip.resolve("name")).orElse(chip.getFileName().toString());
            List<Path> inputs = new ArrayList<>();
            try (DirectoryStream<Path> files = Files.newDirectoryStream(chip, "temp*_input")) {
                files.forEach(inputs::add);
            }
            inputs.sort(null);
            for (Path input : inputs) {
                String sensor = input.getFileName().toString().replace("_input", "");
                String label = Sysfs.read(chip.resolve(sensor + "_label")).orElse(sensor);
                String name = Identifiers.sanitize(chipName + "_" + label);
                entries.add(new NamespaceEntry(name, input.toString(), List.of(name, chipName, label)));
            }
        }
        return entries;
    }
}
