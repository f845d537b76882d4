package io.penguin.metrics.agent.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.penguin.metrics.agent.mqtt.TransportSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AgentSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should fall back to built-in defaults for missing keys")
    void defaults() {
        AgentSettings settings = new AgentSettings(ConfigFactory.empty());

        assertEquals(Path.of("/etc/penguin-metrics/config.conf"), settings.getConfigFile());
        assertEquals(4, settings.getSchedulerThreads());
        assertEquals(Path.of("/proc"), settings.getProcRoot());
        assertEquals(Path.of("/var/run/docker.sock"), settings.getDockerSocket());
        assertEquals(Duration.ofSeconds(60), settings.getMaxBackoff());
    }

    @Test
    @DisplayName("Should map transport keys onto transport settings")
    void transportSettings() {
        AgentSettings settings = new AgentSettings(ConfigFactory.parseString("""
                penguin.transport {
                    initial-backoff-ms = 250
                    max-backoff-ms = 4000
                    max-queue-size = 50
                }
                """));

        TransportSettings transport = settings.toTransportSettings();
        assertEquals(Duration.ofMillis(250), transport.initialBackoff());
        assertEquals(Duration.ofSeconds(4), transport.maxBackoff());
        assertEquals(50, transport.maxQueueSize());
        assertEquals(Duration.ofSeconds(5), transport.offlinePublishTimeout());
    }

    @Test
    @DisplayName("Should reject an outbound queue bound below one message")
    void rejectsEmptyQueueBound() {
        AgentSettings settings = new AgentSettings(ConfigFactory.parseString("penguin.transport.max-queue-size = 0"));

        ConfigException.BadValue e = assertThrows(ConfigException.BadValue.class, settings::toTransportSettings);
        assertTrue(e.getMessage().contains("max-queue-size"));
    }

    @Test
    @DisplayName("Should let an external settings file override the classpath defaults")
    void externalFile() throws Exception {
        Path file = tempDir.resolve("agent.conf");
        Files.writeString(file, "penguin.probes.sys-root = \"/host/sys\"\n");

        AgentSettings settings = new AgentSettings(file.toString());

        assertEquals(Path.of("/host/sys"), settings.getSysRoot());
        assertEquals(2, settings.getSchedulerThreads(), "Test application.conf still applies");
    }

    @Test
    @DisplayName("Should ignore a missing external settings file")
    void missingExternalFile() {
        AgentSettings settings = new AgentSettings(tempDir.resolve("absent.conf").toString());

        assertEquals(Path.of("/sys"), settings.getSysRoot());
    }
}
