package io.penguin.metrics.agent.collector;

import io.penguin.metrics.agent.probe.CommandResult;
import io.penguin.metrics.agent.probe.CommandRunner;
import io.penguin.metrics.config.model.BinarySensorSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * An on/off value derived from a shell command. A command that fails to run counts as
 * {@code OFF}, so the sensor always carries a value.
 */
public class BinarySensorCollector extends AbstractCollector<BinarySensorSource> {

    private static final Logger log = LoggerFactory.getLogger(BinarySensorCollector.class);

    private static final Set<String> ON = Set.of("on", "true", "1", "yes", "ok", "online", "up");
    private static final Set<String> OFF = Set.of("off", "false", "0", "no", "error", "offline", "down");

    private final CommandRunner runner;

    public BinarySensorCollector(BinarySensorSource config, CommandRunner runner) {
        super(config);
        this.runner = runner;
    }

    @Override
    protected void declareMetrics(List<MetricDescriptor> metrics) {
        metrics.add(MetricDescriptor.binary(CustomCollector.VALUE, config.name(), null, "mdi:toggle-switch"));
    }

    @Override
    public CollectorResult collect() {
        CommandResult result;
        try {
            result = runner.shell(config.commandLine(), config.timeout());
        } catch (IOException e) {
            log.debug("Binary sensor {} command failed: {}", id(), e.getMessage());
            result = new CommandResult(-1, "", e.getMessage());
        }
        boolean on = interpret(result);
        return CollectorResult.online(Map.of(CustomCollector.VALUE, on ? "ON" : "OFF"));
    }

    boolean interpret(CommandResult result) {
        boolean on;
        if (config.valueSource() == BinarySensorSource.ValueSource.RETURNCODE) {
            on = result.exitCode() == 0;
        } else {
            String output = result.stdout().trim().toLowerCase(Locale.ROOT);
            if (ON.contains(output)) {
                on = true;
            } else if (OFF.contains(output)) {
                on = false;
            } else {
                on = !output.isEmpty();
            }
        }
        return config.invert() != on;
    }
}
