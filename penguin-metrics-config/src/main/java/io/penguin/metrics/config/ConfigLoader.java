package io.penguin.metrics.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Loads a configuration file end to end: lexing, parsing with includes, and binding.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    public static BindResult load(Path file) throws ConfigException {
        ConfigDocument document = new ConfigParser().parseFile(file);
        BindResult result = new ConfigBinder().bind(document);
        log.debug("Loaded {}: {} manual sources, {} warnings",
                file, result.config().allSources().size(), result.warnings().size());
        return result;
    }

    public static BindResult loadString(String text) throws ConfigException {
        ConfigDocument document = new ConfigParser().parse(text, null);
        return new ConfigBinder().bind(document);
    }
}
