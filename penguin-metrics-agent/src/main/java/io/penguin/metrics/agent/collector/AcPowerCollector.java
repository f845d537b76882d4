package io.penguin.metrics.agent.collector;

import io.penguin.metrics.agent.probe.Sysfs;
import io.penguin.metrics.config.model.AcPowerSource;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Whether an external power supply ({@code Mains} type) is plugged in.
 */
public class AcPowerCollector extends AbstractCollector<AcPowerSource> {

    private final Path supplies;

    public AcPowerCollector(AcPowerSource config, Path supplies) {
        super(config);
        this.supplies = supplies;
    }

    @Override
    protected void declareMetrics(List<MetricDescriptor> metrics) {
        metrics.add(MetricDescriptor.binary("online", "Plugged In", "plug", "mdi:power-plug"));
    }

    @Override
    public CollectorResult collect() throws CollectionException {
        Optional<Path> dir = locate();
        if (dir.isEmpty()) {
            return CollectorResult.notFound();
        }
        OptionalLong online = Sysfs.readLong(dir.get().resolve("online"));
        if (online.isEmpty()) {
            throw new CollectionException("Cannot read " + dir.get().resolve("online"));
        }
        return CollectorResult.online(Map.of("online", online.getAsLong() == 1 ? "ON" : "OFF"));
    }

    private Optional<Path> locate() {
        if (config.path() != null) {
            Path dir = Path.of(config.path());
            return Files.isDirectory(dir) ? Optional.of(dir) : Optional.empty();
        }
        if (config.supply() != null) {
            Path dir = supplies.resolve(config.supply());
            return Files.isDirectory(dir) ? Optional.of(dir) : Optional.empty();
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(supplies)) {
            for (Path entry : entries) {
                if (Sysfs.read(entry.resolve("type")).filter("Mains"::equals).isPresent()) {
                    return Optional.of(entry);
                }
            }
        } catch (IOException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }
}
