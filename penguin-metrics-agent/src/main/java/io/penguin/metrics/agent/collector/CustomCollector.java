package io.penguin.metrics.agent.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.penguin.metrics.agent.probe.CommandResult;
import io.penguin.metrics.agent.probe.CommandRunner;
import io.penguin.metrics.config.model.CustomSource;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single value produced by a shell command. The output is parsed according to the configured
 * {@link CustomSource.OutputType}; a non-zero exit status or unparsable output fails the cycle.
 */
public class CustomCollector extends AbstractCollector<CustomSource> {

    static final String VALUE = "value";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern FIRST_NUMBER = Pattern.compile("[-+]?\\d*\\.?\\d+");

    private final CommandRunner runner;

    public CustomCollector(CustomSource config, CommandRunner runner) {
        super(config);
        this.runner = runner;
    }

    @Override
    protected void declareMetrics(List<MetricDescriptor> metrics) {
        metrics.add(new MetricDescriptor(VALUE, config.name(), config.unit(), config.deviceClass(),
                config.stateClass(), "mdi:cog-outline", false));
    }

    @Override
    public CollectorResult collect() throws CollectionException {
        CommandResult result;
        try {
            result = runner.shell(config.commandLine(), config.timeout());
        } catch (IOException e) {
            throw new CollectionException(e.getMessage(), e);
        }
        if (!result.succeeded()) {
            String stderr = result.stderr().trim();
            throw new CollectionException(stderr.isEmpty() ? "Command failed with code " + result.exitCode() : stderr);
        }
        String output = result.stdout().trim();
        if (output.isEmpty()) {
            throw new CollectionException("Command produced no output");
        }
        return CollectorResult.online(Map.of(VALUE, parse(output)));
    }

    Object parse(String output) throws CollectionException {
        return switch (config.outputType()) {
            case NUMBER -> round(number(output) * config.scale(), 4);
            case STRING -> output;
            case JSON -> json(output);
        };
    }

    private static double number(String output) throws CollectionException {
        try {
            return Double.parseDouble(output);
        } catch (NumberFormatException e) {
            Matcher matcher = FIRST_NUMBER.matcher(output);
            if (matcher.find()) {
                return Double.parseDouble(matcher.group());
            }
            throw new CollectionException("Parse error: cannot parse number from: " + output);
        }
    }

    private static Object json(String output) throws CollectionException {
        try {
            JsonNode node = MAPPER.readTree(output);
            if (node.isNumber()) {
                return node.numberValue();
            }
            if (node.isTextual()) {
                return node.textValue();
            }
            if (node.isBoolean()) {
                return node.booleanValue();
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new CollectionException("Parse error: " + e.getOriginalMessage(), e);
        }
    }
}
