package io.penguin.metrics.agent.homeassistant;

import io.penguin.metrics.config.ConfigLoader;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeviceResolverTest {

    private Config config;
    private DeviceResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        config = ConfigLoader.loadString("""
                device "rack" { manufacturer "Acme"; }
                process "nginx" { match name "nginx"; }
                battery "main" { }
                battery "ups" { device "rack"; }
                custom "quiet" { command "true"; device none; }
                """).config();
        resolver = new DeviceResolver("penguin_metrics", "host1", config.deviceTemplates());
    }

    @Test
    @DisplayName("Should give processes their own device under the host")
    void ownDevice() {
        Device device = resolver.resolve(config.sources(SourceType.PROCESS).get(0)).orElseThrow();

        assertEquals(List.of("penguin_metrics_penguin_metrics_process_nginx"), device.identifiers());
        assertEquals("Process: nginx", device.name());
        assertEquals("penguin_metrics_penguin_metrics_system", device.viaDevice());
    }

    @Test
    @DisplayName("Should put hardware sources on the host device")
    void hostDevice() {
        Device device = resolver.resolve(config.sources(SourceType.BATTERY).get(0)).orElseThrow();

        assertSame(resolver.hostDevice(), device);
        assertEquals("host1", device.name());
        assertEquals("Linux Host", device.model());
    }

    @Test
    @DisplayName("Should resolve templates and none")
    void templateAndNone() {
        Device rack = resolver.resolve(config.sources(SourceType.BATTERY).get(1)).orElseThrow();
        assertEquals("Acme", rack.extra().get("manufacturer"));
        assertEquals(resolver.hostDevice().primaryIdentifier(), rack.viaDevice());

        assertTrue(resolver.resolve(config.sources(SourceType.CUSTOM).get(0)).isEmpty());
    }
}
