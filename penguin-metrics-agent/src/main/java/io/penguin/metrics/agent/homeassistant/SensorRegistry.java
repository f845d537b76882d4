package io.penguin.metrics.agent.homeassistant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persisted set of announced discovery topics, keyed by unique id, so entities left behind by
 * a previous run can be retracted. The file is replaced atomically on every save.
 */
public class SensorRegistry {

    private static final Logger log = LoggerFactory.getLogger(SensorRegistry.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;
    private final Map<String, String> components = new TreeMap<>();

    public SensorRegistry(Path file) {
        this.file = file;
    }

    /**
     * Loads the registry. A missing file is an empty registry; an unreadable one is logged and ignored.
     */
    public synchronized void load() {
        components.clear();
        try {
            JsonNode root = MAPPER.readTree(Files.readString(file));
            for (JsonNode entry : root.path("sensors")) {
                String uniqueId = entry.path("unique_id").asText(null);
                if (uniqueId != null) {
                    components.put(uniqueId, entry.path("component").asText("sensor"));
                }
            }
            log.debug("Loaded {} registered sensors from {}", components.size(), file);
        } catch (NoSuchFileException e) {
            log.debug("No sensor registry at {}", file);
        } catch (IOException e) {
            log.warn("Ignoring unreadable sensor registry {}: {}", file, e.getMessage());
        }
    }

    public synchronized void save() {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode sensors = root.putArray("sensors");
        components.forEach((uniqueId, component) ->
                sensors.addObject().put("unique_id", uniqueId).put("component", component));
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.warn("Cannot write sensor registry {}: {}", file, e.getMessage());
        }
    }

    public synchronized void add(String uniqueId, String component) {
        components.put(uniqueId, component);
    }

    public synchronized void remove(String uniqueId) {
        components.remove(uniqueId);
    }

    /**
     * @return unique id to component ({@code sensor} or {@code binary_sensor})
     */
    public synchronized Map<String, String> entries() {
        return Collections.unmodifiableMap(new TreeMap<>(components));
    }
}
