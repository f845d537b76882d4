package io.penguin.metrics.config;

import io.penguin.metrics.config.model.Config;

import java.util.List;

/**
 * @param warnings non-fatal findings in source order, each prefixed with its location
 */
public record BindResult(Config config, List<String> warnings) {
}
