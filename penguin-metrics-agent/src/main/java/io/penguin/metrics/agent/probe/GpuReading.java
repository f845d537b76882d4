package io.penguin.metrics.agent.probe;

/**
 * One reading of the primary GPU. A value the driver does not expose is {@code null}.
 *
 * @param name           sysfs entry the reading came from, e.g. {@code card0} or {@code fb000000.gpu}
 * @param utilization    busy percentage
 * @param frequencyMhz   current core clock
 * @param temperature    degrees Celsius
 */
public record GpuReading(String name, Double utilization, Long frequencyMhz, Double temperature) {
}
