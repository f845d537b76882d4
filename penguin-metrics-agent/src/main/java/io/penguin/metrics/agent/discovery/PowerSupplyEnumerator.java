package io.penguin.metrics.agent.discovery;

import io.penguin.metrics.agent.probe.Sysfs;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.AutoDiscoverySettings;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entries of {@code /sys/class/power_supply} with a given {@code type}: {@code Battery} for
 * batteries, {@code Mains} for AC adapters.
 */
public class PowerSupplyEnumerator implements NamespaceEnumerator {

    private final SourceType type;
    private final Path supplies;
    private final String supplyType;

    public PowerSupplyEnumerator(SourceType type, Path supplies, String supplyType) {
        this.type = type;
        this.supplies = supplies;
        this.supplyType = supplyType;
    }

    public static PowerSupplyEnumerator batteries(Path supplies) {
        return new PowerSupplyEnumerator(SourceType.BATTERY, supplies, "Battery");
    }

    public static PowerSupplyEnumerator acPowers(Path supplies) {
        return new PowerSupplyEnumerator(SourceType.AC_POWER, supplies, "Mains");
    }

    @Override
    public SourceType type() {
        return type;
    }

    @Override
    public List<NamespaceEntry> enumerate(AutoDiscoverySettings settings) throws IOException {
        List<NamespaceEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(supplies)) {
            for (Path dir : dirs) {
                if (Sysfs.read(dir.resolve("type")).filter(supplyType::equals).isPresent()) {
                    String name = dir.getFileName().toString();
                    entries.add(new NamespaceEntry(name, name, List.of(name)));
                }
            }
        } catch (NoSuchFileException e) {
            return List.of();
        }
        entries.sort((a, b) -> a.name().compareTo(b.name()));
        return entries;
    }
}
