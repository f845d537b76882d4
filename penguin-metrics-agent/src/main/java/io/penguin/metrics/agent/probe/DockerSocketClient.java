package io.penguin.metrics.agent.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.URLEncoder;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ContainerRuntime} speaking the Docker Engine API over its Unix socket.
 * Each call opens a fresh connection and sends a plain HTTP/1.0 request so the response
 * body is delimited by connection close.
 */
public class DockerSocketClient implements ContainerRuntime {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path socket;

    public DockerSocketClient(Path socket) {
        this.socket = socket;
    }

    @Override
    public List<ContainerInfo> list(boolean all) throws IOException {
        JsonNode array = get("/containers/json" + (all ? "?all=1" : "")).orElseThrow(
                () -> new IOException("Container list not available"));
        List<ContainerInfo> containers = new ArrayList<>();
        for (JsonNode node : array) {
            String name = node.path("Names").path(0).asText("");
            containers.add(new ContainerInfo(
                    node.path("Id").asText(),
                    stripSlash(name),
                    node.path("Image").asText(null),
                    node.path("State").asText(null),
                    null,
                    null,
                    labels(node.path("Labels"))));
        }
        return containers;
    }

    @Override
    public Optional<ContainerInfo> inspect(String idOrName) throws IOException {
        Optional<JsonNode> response = get("/containers/" + encode(idOrName) + "/json");
        if (response.isEmpty()) {
            return Optional.empty();
        }
        JsonNode node = response.get();
        JsonNode state = node.path("State");
        JsonNode health = state.path("Health").path("Status");
        return Optional.of(new ContainerInfo(
                node.path("Id").asText(),
                stripSlash(node.path("Name").asText("")),
                node.path("Config").path("Image").asText(null),
                state.path("Status").asText(null),
                health.isMissingNode() || health.isNull() ? null : health.asText(),
                state.path("StartedAt").asText(null),
                labels(node.path("Config").path("Labels"))));
    }

    @Override
    public ContainerStats stats(String id) throws IOException {
        JsonNode node = get("/containers/" + encode(id) + "/stats?stream=false")
                .orElseThrow(() -> new IOException("No stats for container " + id));
        JsonNode cpu = node.path("cpu_stats");
        JsonNode preCpu = node.path("precpu_stats");
        JsonNode memory = node.path("memory_stats");
        long cache = memory.path("stats").path("inactive_file").asLong(memory.path("stats").path("cache").asLong(0));

        long rx = 0;
        long tx = 0;
        Iterator<JsonNode> networks = node.path("networks").elements();
        while (networks.hasNext()) {
            JsonNode network = networks.next();
            rx += network.path("rx_bytes").asLong(0);
            tx += network.path("tx_bytes").asLong(0);
        }

        long read = 0;
        long write = 0;
        for (JsonNode entry : node.path("blkio_stats").path("io_service_bytes_recursive")) {
            String op = entry.path("op").asText("");
            if (op.equalsIgnoreCase("read")) {
                read += entry.path("value").asLong(0);
            } else if (op.equalsIgnoreCase("write")) {
                write += entry.path("value").asLong(0);
            }
        }

        int onlineCpus = cpu.path("online_cpus").asInt(0);
        if (onlineCpus == 0) {
            onlineCpus = Math.max(1, cpu.path("cpu_usage").path("percpu_usage").size());
        }
        return new ContainerStats(
                cpu.path("cpu_usage").path("total_usage").asLong(0),
                preCpu.path("cpu_usage").path("total_usage").asLong(0),
                cpu.path("system_cpu_usage").asLong(0),
                preCpu.path("system_cpu_usage").asLong(0),
                onlineCpus,
                Math.max(0, memory.path("usage").asLong(0) - cache),
                memory.path("limit").asLong(0),
                rx, tx, read, write);
    }

    /**
     * @return the parsed body, or empty on 404
     */
    private Optional<JsonNode> get(String path) throws IOException {
        try (SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX)) {
            channel.connect(UnixDomainSocketAddress.of(socket));
            String request = "GET " + path + " HTTP/1.0\r\nHost: docker\r\nAccept: application/json\r\n\r\n";
            channel.write(ByteBuffer.wrap(request.getBytes(StandardCharsets.US_ASCII)));

            ByteArrayOutputStream response = new ByteArrayOutputStream();
            ByteBuffer buffer = ByteBuffer.allocate(16 * 1024);
            while (channel.read(buffer) >= 0) {
                buffer.flip();
                response.write(buffer.array(), 0, buffer.limit());
                buffer.clear();
            }
            return parseResponse(response.toByteArray(), path);
        }
    }

    static Optional<JsonNode> parseResponse(byte[] raw, String path) throws IOException {
        String text = new String(raw, StandardCharsets.UTF_8);
        int headerEnd = text.indexOf("\r\n\r\n");
        if (headerEnd < 0) {
            throw new IOException("Malformed response from container engine for " + path);
        }
        String statusLine = text.substring(0, text.indexOf("\r\n"));
        String[] status = statusLine.split(" ", 3);
        int code = status.length > 1 ? Integer.parseInt(status[1]) : 0;
        String body = text.substring(headerEnd + 4);
        if (code == 404) {
            return Optional.empty();
        }
        if (code < 200 || code >= 300) {
            throw new IOException("Container engine returned " + statusLine + " for " + path + ": " + body.trim());
        }
        return Optional.of(MAPPER.readTree(body));
    }

    private static Map<String, String> labels(JsonNode node) {
        Map<String, String> labels = new HashMap<>();
        node.fields().forEachRemaining(e -> labels.put(e.getKey(), e.getValue().asText()));
        return labels;
    }

    private static String stripSlash(String name) {
        return name.startsWith("/") ? name.substring(1) : name;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
