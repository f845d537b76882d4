package io.penguin.metrics.agent.probe;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SystemdClient} that shells out to {@code systemctl}.
 */
public class SystemctlClient implements SystemdClient {

    private final CommandRunner runner;
    private final String systemctl;
    private final Duration timeout;

    public SystemctlClient(CommandRunner runner, String systemctl, Duration timeout) {
        this.runner = runner;
        this.systemctl = systemctl;
        this.timeout = timeout;
    }

    @Override
    public List<String> listServices() throws IOException {
        CommandResult result = runner.run(List.of(systemctl, "list-units", "--type=service", "--all",
                "--no-legend", "--plain", "--no-pager"), timeout);
        if (!result.succeeded()) {
            throw new IOException("systemctl list-units failed: " + result.stderr().trim());
        }
        List<String> units = new ArrayList<>();
        for (String line : result.stdout().split("\n")) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length > 0 && parts[0].endsWith(".service")) {
                units.add(parts[0]);
            }
        }
        return units;
    }

    @Override
    public Map<String, String> show(String unit, List<String> properties) throws IOException {
        List<String> command = new ArrayList<>(List.of(systemctl, "show", unit, "--no-pager"));
        command.add("--property=" + String.join(",", properties));
        CommandResult result = runner.run(command, timeout);
        if (!result.succeeded()) {
            throw new IOException("systemctl show " + unit + " failed: " + result.stderr().trim());
        }
        return parseProperties(result.stdout());
    }

    static Map<String, String> parseProperties(String output) {
        Map<String, String> values = new HashMap<>();
        for (String line : output.split("\n")) {
            int eq = line.indexOf('=');
            if (eq > 0) {
                values.put(line.substring(0, eq), line.substring(eq + 1).trim());
            }
        }
        return values;
    }
}
