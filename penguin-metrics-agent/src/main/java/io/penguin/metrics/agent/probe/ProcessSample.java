package io.penguin.metrics.agent.probe;

import java.time.Instant;

/**
 * Point-in-time resource usage of one process. Optional figures are {@code null} when the
 * kernel does not expose them to this user.
 *
 * @param cpuSeconds accumulated user plus system CPU time
 */
public record ProcessSample(
        long pid,
        double cpuSeconds,
        long rssBytes,
        int threads,
        Integer openFds,
        Long readBytes,
        Long writeBytes,
        Long pssBytes,
        Long ussBytes,
        Instant sampledAt) {
}
