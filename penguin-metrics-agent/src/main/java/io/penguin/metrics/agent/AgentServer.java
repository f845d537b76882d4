package io.penguin.metrics.agent;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import io.penguin.metrics.agent.collector.CollectorFactory;
import io.penguin.metrics.agent.config.AgentSettings;
import io.penguin.metrics.agent.config.LogbackConfigurator;
import io.penguin.metrics.agent.discovery.ContainerEnumerator;
import io.penguin.metrics.agent.discovery.DiskEnumerator;
import io.penguin.metrics.agent.discovery.NamespaceEnumerator;
import io.penguin.metrics.agent.discovery.PowerSupplyEnumerator;
import io.penguin.metrics.agent.discovery.ProcessEnumerator;
import io.penguin.metrics.agent.discovery.ServiceEnumerator;
import io.penguin.metrics.agent.discovery.TemperatureEnumerator;
import io.penguin.metrics.agent.homeassistant.DeviceResolver;
import io.penguin.metrics.agent.homeassistant.HomeAssistantDiscovery;
import io.penguin.metrics.agent.homeassistant.SensorFactory;
import io.penguin.metrics.agent.homeassistant.SensorRegistry;
import io.penguin.metrics.agent.mqtt.MqttTransport;
import io.penguin.metrics.agent.mqtt.PahoBrokerConnection;
import io.penguin.metrics.agent.mqtt.TransportSettings;
import io.penguin.metrics.agent.probe.CommandRunner;
import io.penguin.metrics.agent.probe.DockerSocketClient;
import io.penguin.metrics.agent.probe.Probes;
import io.penguin.metrics.agent.probe.Procfs;
import io.penguin.metrics.agent.probe.ProcfsProcessTable;
import io.penguin.metrics.agent.probe.SystemctlClient;
import io.penguin.metrics.config.BindResult;
import io.penguin.metrics.config.ConfigException;
import io.penguin.metrics.config.ConfigLoader;
import io.penguin.metrics.config.model.Config;
import io.penguin.metrics.config.model.MqttSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The agent process.
 *
 * Usage:
 * <pre>
 * java -jar penguin-metrics-agent.jar -c /etc/penguin-metrics/config.conf
 * java -jar penguin-metrics-agent.jar -c config.conf --validate
 * java -jar penguin-metrics-agent.jar -c config.conf --settings /etc/penguin-metrics/agent.conf
 * </pre>
 *
 * The agent configuration file describes what to monitor; the optional HOCON settings file
 * tunes the runtime (scheduler, transport, probe locations).
 */
public class AgentServer {

    private static final Logger log = LoggerFactory.getLogger(AgentServer.class);

    public static final String VERSION = "0.1.0";

    private final AgentSettings settings;
    private final Path configFile;
    private final AtomicReference<Orchestrator> orchestratorRef = new AtomicReference<>();
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /**
     * CLI arguments.
     */
    public static class Args {
        @Parameter(names = {"-c", "--config"}, description = "Path to the agent configuration file")
        public String configPath;

        @Parameter(names = {"--settings"}, description = "Path to a HOCON runtime settings file")
        public String settingsPath;

        @Parameter(names = {"--validate"}, description = "Load the configuration, print warnings and exit")
        public boolean validate;

        @Parameter(names = {"-h", "--help"}, help = true, description = "Show this help message")
        public boolean help;

        @Parameter(names = {"-v", "--version"}, description = "Show version information")
        public boolean version;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * @return the process exit code
     */
    static int run(String[] args) {
        Args cliArgs = new Args();
        JCommander jcommander = JCommander.newBuilder()
                .addObject(cliArgs)
                .programName("penguin-metrics")
                .build();

        try {
            jcommander.parse(args);
        } catch (Exception e) {
            System.err.println("Error parsing arguments: " + e.getMessage());
            jcommander.usage();
            return 1;
        }

        if (cliArgs.help) {
            jcommander.usage();
            return 0;
        }

        if (cliArgs.version) {
            System.out.println("Penguin Metrics v" + VERSION);
            return 0;
        }

        AgentSettings settings = new AgentSettings(cliArgs.settingsPath);
        Path configFile = cliArgs.configPath != null ? Path.of(cliArgs.configPath) : settings.getConfigFile();

        if (cliArgs.validate) {
            return validate(configFile);
        }

        try {
            new AgentServer(settings, configFile).start();
            return 0;
        } catch (ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Failed to start agent", e);
            return 1;
        }
    }

    static int validate(Path configFile) {
        try {
            BindResult result = ConfigLoader.load(configFile);
            for (String warning : result.warnings()) {
                System.out.println("warning: " + warning);
            }
            System.out.println("Configuration OK: " + result.config().allSources().size() + " sources");
            return 0;
        } catch (ConfigException e) {
            System.err.println("error: " + e.getMessage());
            return 1;
        }
    }

    public AgentServer(AgentSettings settings, Path configFile) {
        this.settings = settings;
        this.configFile = configFile;
    }

    /**
     * Loads the configuration and runs until shutdown is triggered.
     */
    public void start() throws ConfigException {
        log.info("Starting Penguin Metrics v{}", VERSION);
        log.info("Settings: {}", settings);
        BindResult result = ConfigLoader.load(configFile);
        Config config = result.config();
        LogbackConfigurator.apply(config.logging());
        for (String warning : result.warnings()) {
            log.warn("{}", warning);
        }
        log.info("Loaded {} with {} manual sources", configFile, config.allSources().size());

        Orchestrator orchestrator = new Orchestrator(createContext(config, settings, hostname()));
        orchestratorRef.set(orchestrator);
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "agent-shutdown-hook"));
        orchestrator.start();

        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Agent interrupted");
        }
    }

    /**
     * Trigger graceful shutdown.
     */
    public void shutdown() {
        log.info("Shutting down Penguin Metrics...");
        Orchestrator orchestrator = orchestratorRef.get();
        if (orchestrator != null && orchestrator.isRunning()) {
            orchestrator.stop();
        }
        shutdownLatch.countDown();
        log.info("Penguin Metrics stopped");
    }

    static AgentContext createContext(Config config, AgentSettings settings, String hostname) {
        Procfs procfs = new Procfs(settings.getProcRoot());
        CommandRunner commands = new CommandRunner();
        Probes probes = new Probes(
                procfs,
                settings.getSysRoot(),
                new ProcfsProcessTable(settings.getProcRoot()),
                new SystemctlClient(commands, settings.getSystemctl(), settings.getCommandTimeout()),
                new DockerSocketClient(settings.getDockerSocket()),
                commands);

        MqttSettings mqtt = config.mqtt();
        TransportSettings transportSettings = settings.toTransportSettings();
        String clientId = MqttTransport.clientId(mqtt);
        MqttTransport transport = new MqttTransport(
                new PahoBrokerConnection(mqtt, transportSettings, clientId), mqtt, transportSettings);
        HomeAssistantDiscovery discovery = new HomeAssistantDiscovery(transport, config.homeAssistant(), mqtt,
                new SensorRegistry(config.homeAssistant().stateFile()));

        return new AgentContext(
                config,
                settings,
                transport,
                discovery,
                new DeviceResolver(mqtt.topicPrefix(), hostname, config.deviceTemplates()),
                new SensorFactory(mqtt.topicPrefix()),
                new CollectorFactory(probes),
                enumerators(probes));
    }

    static List<NamespaceEnumerator> enumerators(Probes probes) {
        return List.of(
                new ProcessEnumerator(probes.processes()),
                new ServiceEnumerator(probes.systemd()),
                new ContainerEnumerator(probes.containers()),
                new TemperatureEnumerator(probes.thermalZones(), probes.hwmon()),
                PowerSupplyEnumerator.batteries(probes.powerSupplies()),
                PowerSupplyEnumerator.acPowers(probes.powerSupplies()),
                new DiskEnumerator(probes.procfs()));
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Cannot resolve host name: {}", e.getMessage());
            return "localhost";
        }
    }
}
