package io.penguin.metrics.agent.collector;

import io.penguin.metrics.agent.probe.ContainerInfo;
import io.penguin.metrics.agent.probe.ContainerRuntime;
import io.penguin.metrics.agent.probe.ContainerStats;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.ContainerSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContainerCollectorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static ContainerInfo container(String id, String name, String state) {
        return new ContainerInfo(id, name, "redis:7", state, "healthy", "2025-12-31T23:00:00Z",
                Map.of("com.docker.compose.service", "cache"));
    }

    private static ContainerStats stats(long rx) {
        return new ContainerStats(400, 200, 2000, 1000, 2, 256L * 1024 * 1024, 1024L * 1024 * 1024,
                rx, 0, 0, 0);
    }

    @Test
    @DisplayName("Should report usage of a running container")
    void running() throws Exception {
        ContainerSource source = Sources.first("""
                container "redis" { network_rate on; health on; uptime on; }
                """, SourceType.CONTAINER);
        ContainerRuntime runtime = mock(ContainerRuntime.class);
        when(runtime.inspect("redis")).thenReturn(Optional.of(container("abc", "redis", "running")));
        when(runtime.inspect("abc")).thenReturn(Optional.of(container("abc", "redis", "running")));
        when(runtime.stats("abc")).thenReturn(stats(0), stats(20480));
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T0, T0, T0.plusSeconds(2), T0.plusSeconds(2));
        ContainerCollector collector = new ContainerCollector(source, runtime, clock);

        CollectorResult first = collector.collect();
        assertEquals("running", first.state());
        assertEquals(40.0, first.metrics().get("cpu_percent"));
        assertEquals(256.0, first.metrics().get("memory"));
        assertEquals(25.0, first.metrics().get("memory_percent"));
        assertEquals("healthy", first.metrics().get("health"));
        assertEquals(3600L, first.metrics().get("uptime"));
        assertEquals(0.0, first.metrics().get("network_rx_rate"));

        CollectorResult second = collector.collect();
        assertEquals(10.0, second.metrics().get("network_rx_rate"));
    }

    @Test
    @DisplayName("Should skip stats for a stopped container")
    void stopped() throws Exception {
        ContainerSource source = Sources.first("container \"redis\" { }", SourceType.CONTAINER);
        ContainerRuntime runtime = mock(ContainerRuntime.class);
        when(runtime.inspect("redis")).thenReturn(Optional.of(container("abc", "redis", "exited")));

        CollectorResult result = new ContainerCollector(source, runtime).collect();

        assertEquals("exited", result.state());
        assertFalse(result.metrics().containsKey("cpu_percent"));
        verify(runtime, never()).stats(anyString());
    }

    @Test
    @DisplayName("Should match containers by label")
    void matchByLabel() throws Exception {
        ContainerSource source = Sources.first("""
                container "cache" { match label "com.docker.compose.service=cache"; }
                """, SourceType.CONTAINER);
        ContainerRuntime runtime = mock(ContainerRuntime.class);
        ContainerInfo other = new ContainerInfo("def", "web", "nginx:1", "running", null, null, Map.of());
        when(runtime.list(true)).thenReturn(List.of(other, container("abc", "redis", "running")));
        when(runtime.inspect("abc")).thenReturn(Optional.of(container("abc", "redis", "running")));
        when(runtime.stats("abc")).thenReturn(stats(0));

        CollectorResult result = new ContainerCollector(source, runtime).collect();

        assertEquals("running", result.state());
        verify(runtime, never()).inspect("def");
    }

    @Test
    @DisplayName("Should report not_found when no container matches")
    void notFound() throws Exception {
        ContainerSource source = Sources.first("container \"db\" { match image \"postgres\"; }", SourceType.CONTAINER);
        ContainerRuntime runtime = mock(ContainerRuntime.class);
        when(runtime.list(true)).thenReturn(List.of(container("abc", "redis", "running")));

        CollectorResult result = new ContainerCollector(source, runtime).collect();

        assertEquals(CollectorResult.NOT_FOUND, result.state());
    }
}
