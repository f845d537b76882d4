package io.penguin.metrics.agent.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.penguin.metrics.agent.mqtt.TransportSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Runtime settings of the agent process, loaded from HOCON.
 *
 * Configuration is loaded in the following order (later sources override earlier):
 * 1. application.conf from classpath (defaults)
 * 2. File given with --settings (optional override)
 * 3. System properties (highest priority)
 *
 * Example:
 * <pre>
 * penguin {
 *     config-file = "/etc/penguin-metrics/config.conf"
 *     scheduler {
 *         threads = 4
 *         shutdown-grace-ms = 5000
 *     }
 *     transport {
 *         initial-backoff-ms = 1000
 *         max-backoff-ms = 60000
 *         max-queue-size = 10000
 *     }
 *     probes {
 *         proc-root = "/proc"
 *         sys-root = "/sys"
 *         docker-socket = "/var/run/docker.sock"
 *     }
 * }
 * </pre>
 */
public class AgentSettings {

    private static final Logger log = LoggerFactory.getLogger(AgentSettings.class);
    private static final String CONFIG_PREFIX = "penguin";

    private final Config config;

    /**
     * Load settings from default locations.
     */
    public AgentSettings() {
        this.config = ConfigFactory.load().resolve();
    }

    /**
     * @param externalConfigPath optional HOCON file overriding the classpath defaults, may be null
     */
    public AgentSettings(String externalConfigPath) {
        Config classpathConfig = ConfigFactory.load();
        Config resultConfig = classpathConfig;
        if (externalConfigPath != null && !externalConfigPath.isEmpty()) {
            File externalFile = new File(externalConfigPath);
            if (externalFile.exists()) {
                log.info("Loading external settings from: {}", externalConfigPath);
                Config withExternal = ConfigFactory.parseFile(externalFile).withFallback(classpathConfig);
                resultConfig = ConfigFactory.systemProperties().withFallback(withExternal);
            } else {
                log.warn("External settings file not found: {}", externalConfigPath);
            }
        }
        this.config = resultConfig.resolve();
    }

    public AgentSettings(Config config) {
        this.config = config;
    }

    public Config getConfig() {
        return config;
    }

    /**
     * Path of the agent configuration file, used when no {@code --config} is given.
     */
    public Path getConfigFile() {
        return Path.of(getString("config-file", "/etc/penguin-metrics/config.conf"));
    }

    public int getSchedulerThreads() {
        return getInt("scheduler.threads", 4);
    }

    public Duration getShutdownGrace() {
        return Duration.ofMillis(getLong("scheduler.shutdown-grace-ms", 5000));
    }

    public Duration getConnectTimeout() {
        return Duration.ofMillis(getLong("transport.connect-timeout-ms", 10000));
    }

    public Duration getPublishTimeout() {
        return Duration.ofMillis(getLong("transport.publish-timeout-ms", 10000));
    }

    public Duration getInitialBackoff() {
        return Duration.ofMillis(getLong("transport.initial-backoff-ms", 1000));
    }

    public Duration getMaxBackoff() {
        return Duration.ofMillis(getLong("transport.max-backoff-ms", 60000));
    }

    /**
     * @throws ConfigException.BadValue when the bound is below one message
     */
    public int getMaxQueueSize() {
        int size = getInt("transport.max-queue-size", 10000);
        if (size < 1) {
            throw new ConfigException.BadValue(CONFIG_PREFIX + ".transport.max-queue-size",
                    "must be at least 1, got " + size);
        }
        return size;
    }

    public Duration getMaxMessageAge() {
        return Duration.ofMillis(getLong("transport.max-message-age-ms", 600000));
    }

    public Duration getOfflinePublishTimeout() {
        return Duration.ofMillis(getLong("transport.offline-publish-timeout-ms", 5000));
    }

    public Path getProcRoot() {
        return Path.of(getString("probes.proc-root", "/proc"));
    }

    public Path getSysRoot() {
        return Path.of(getString("probes.sys-root", "/sys"));
    }

    public Path getDockerSocket() {
        return Path.of(getString("probes.docker-socket", "/var/run/docker.sock"));
    }

    public String getSystemctl() {
        return getString("probes.systemctl", "systemctl");
    }

    public Duration getCommandTimeout() {
        return Duration.ofMillis(getLong("probes.command-timeout-ms", 5000));
    }

    public TransportSettings toTransportSettings() {
        return new TransportSettings(getConnectTimeout(), getPublishTimeout(), getInitialBackoff(),
                getMaxBackoff(), getMaxQueueSize(), getMaxMessageAge(), getOfflinePublishTimeout());
    }

    private String getString(String path, String defaultValue) {
        String fullPath = CONFIG_PREFIX + "." + path;
        if (config.hasPath(fullPath)) {
            return config.getString(fullPath);
        }
        return defaultValue;
    }

    private int getInt(String path, int defaultValue) {
        String fullPath = CONFIG_PREFIX + "." + path;
        if (config.hasPath(fullPath)) {
            return config.getInt(fullPath);
        }
        return defaultValue;
    }

    private long getLong(String path, long defaultValue) {
        String fullPath = CONFIG_PREFIX + "." + path;
        if (config.hasPath(fullPath)) {
            return config.getLong(fullPath);
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "AgentSettings{" +
                "configFile=" + getConfigFile() +
                ", schedulerThreads=" + getSchedulerThreads() +
                ", procRoot=" + getProcRoot() +
                ", sysRoot=" + getSysRoot() +
                ", dockerSocket=" + getDockerSocket() +
                '}';
    }
}
