package io.penguin.metrics.agent;

import com.typesafe.config.ConfigFactory;
import io.penguin.metrics.agent.config.AgentSettings;
import io.penguin.metrics.agent.discovery.NamespaceEnumerator;
import io.penguin.metrics.agent.probe.CommandRunner;
import io.penguin.metrics.agent.probe.ContainerRuntime;
import io.penguin.metrics.agent.probe.Probes;
import io.penguin.metrics.agent.probe.ProcessTable;
import io.penguin.metrics.agent.probe.Procfs;
import io.penguin.metrics.agent.probe.SystemdClient;
import io.penguin.metrics.config.ConfigLoader;
import io.penguin.metrics.config.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AgentServerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should validate a configuration file and report errors with exit code 1")
    void validate() throws Exception {
        Path good = tempDir.resolve("good.conf");
        Files.writeString(good, "mqtt { host \"broker\"; }\nsystem { }\n");
        Path bad = tempDir.resolve("bad.conf");
        Files.writeString(bad, "mqtt { port \"abc\"; }\n");

        assertEquals(0, AgentServer.validate(good));
        assertEquals(1, AgentServer.validate(bad));
        assertEquals(1, AgentServer.validate(tempDir.resolve("missing.conf")));
    }

    @Test
    @DisplayName("Should handle help, version and bad arguments without starting")
    void cliArguments() {
        assertEquals(0, AgentServer.run(new String[]{"--version"}));
        assertEquals(0, AgentServer.run(new String[]{"--help"}));
        assertEquals(1, AgentServer.run(new String[]{"--no-such-flag"}));
    }

    @Test
    @DisplayName("Should wire one enumerator per discoverable source type")
    void enumerators() {
        Probes probes = new Probes(new Procfs(tempDir), tempDir, mock(ProcessTable.class),
                mock(SystemdClient.class), mock(ContainerRuntime.class), new CommandRunner());

        List<NamespaceEnumerator> enumerators = AgentServer.enumerators(probes);

        List<SourceType> discoverable = List.of(SourceType.values()).stream().filter(SourceType::discoverable).toList();
        assertEquals(discoverable.size(), enumerators.size());
        assertTrue(enumerators.stream().map(NamespaceEnumerator::type).toList().containsAll(discoverable));
    }

    @Test
    @DisplayName("Should build a context from configuration and settings")
    void createContext() throws Exception {
        var config = ConfigLoader.loadString("mqtt { topic_prefix \"lab\"; client_id \"agent-7\"; }").config();
        AgentSettings settings = new AgentSettings(ConfigFactory.parseString(
                "penguin.probes { proc-root = \"" + tempDir + "\", sys-root = \"" + tempDir + "\" }"));

        AgentContext context = AgentServer.createContext(config, settings, "host1");

        assertEquals("host1", context.devices().hostname());
        assertEquals("lab/status", context.config().mqtt().statusTopic());
        assertEquals(7, context.enumerators().size());
    }
}
