package io.penguin.metrics.agent.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.penguin.metrics.config.model.LoggingSettings;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Programmatic Logback configuration.
 * <p>
 * {@link #configure(Config)} sets up console logging from the {@code logging} section of
 * application.conf:
 * <pre>
 * logging {
 *     level = "INFO"
 *     pattern = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n"
 *     loggers {
 *         "org.eclipse.paho" = "WARN"
 *     }
 * }
 * </pre>
 * {@link #apply(LoggingSettings)} then overlays the agent configuration file's {@code logging}
 * block: root level, colors, pattern and an optional size-rotated log file.
 */
public class LogbackConfigurator {

    static final String DEFAULT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
    static final String COLOR_PATTERN =
            "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %highlight(%-5level) %cyan(%logger{36}) - %msg%n";
    private static final String DEFAULT_LEVEL = "INFO";

    private static volatile boolean configured = false;

    /**
     * Configure Logback from application.conf.
     * Safe to call multiple times - only configures once.
     */
    public static synchronized void configure() {
        if (configured) {
            return;
        }
        configure(ConfigFactory.load());
        configured = true;
    }

    public static void configure(Config config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();

        String pattern = getStringOrDefault(config, "logging.pattern", DEFAULT_PATTERN);
        String rootLevel = getStringOrDefault(config, "logging.level", DEFAULT_LEVEL);

        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(Level.toLevel(rootLevel));
        rootLogger.addAppender(console(context, pattern, null));

        if (config.hasPath("logging.loggers")) {
            Config loggersConfig = config.getConfig("logging.loggers");
            for (String loggerName : loggersConfig.root().keySet()) {
                context.getLogger(loggerName).setLevel(Level.toLevel(loggersConfig.getString(loggerName)));
            }
        }

        setLoggerLevel(context, "org.eclipse.paho", "WARN");
    }

    /**
     * Replaces the root appenders according to the configuration file's {@code logging} block.
     * The root logger runs at the lower of the console and file thresholds, each appender
     * filters to its own.
     */
    public static void apply(LoggingSettings settings) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.detachAndStopAllAppenders();

        Level consoleLevel = toLevel(settings.level());
        String pattern = settings.format() != null ? settings.format()
                : settings.colors() ? COLOR_PATTERN : DEFAULT_PATTERN;
        rootLogger.addAppender(console(context, pattern, consoleLevel));

        Level rootLevel = consoleLevel;
        if (settings.file() != null) {
            Level fileLevel = toLevel(settings.fileLevel());
            rootLogger.addAppender(file(context, settings, fileLevel));
            if (fileLevel.toInt() < rootLevel.toInt()) {
                rootLevel = fileLevel;
            }
        }
        rootLogger.setLevel(rootLevel);
    }

    /**
     * Maps configuration level names, including {@code warning} and {@code critical}, to Logback levels.
     */
    static Level toLevel(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "trace" -> Level.TRACE;
            case "debug" -> Level.DEBUG;
            case "warning", "warn" -> Level.WARN;
            case "error", "critical" -> Level.ERROR;
            default -> Level.INFO;
        };
    }

    private static ConsoleAppender<ILoggingEvent> console(LoggerContext context, String pattern, Level threshold) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("CONSOLE");
        appender.setEncoder(encoder(context, pattern));
        if (threshold != null) {
            appender.addFilter(threshold(context, threshold));
        }
        appender.start();
        return appender;
    }

    private static RollingFileAppender<ILoggingEvent> file(LoggerContext context, LoggingSettings settings,
                                                           Level threshold) {
        RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName("FILE");
        appender.setFile(settings.file());

        FixedWindowRollingPolicy rolling = new FixedWindowRollingPolicy();
        rolling.setContext(context);
        rolling.setParent(appender);
        rolling.setFileNamePattern(settings.file() + ".%i");
        rolling.setMinIndex(1);
        rolling.setMaxIndex(Math.max(1, settings.fileKeep()));
        rolling.start();

        SizeBasedTriggeringPolicy<ILoggingEvent> triggering = new SizeBasedTriggeringPolicy<>();
        triggering.setContext(context);
        triggering.setMaxFileSize(FileSize.valueOf(settings.fileMaxSizeMb() + "MB"));
        triggering.start();

        appender.setRollingPolicy(rolling);
        appender.setTriggeringPolicy(triggering);
        appender.setEncoder(encoder(context, settings.format() != null ? settings.format() : DEFAULT_PATTERN));
        appender.addFilter(threshold(context, threshold));
        appender.start();
        return appender;
    }

    private static PatternLayoutEncoder encoder(LoggerContext context, String pattern) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern);
        encoder.start();
        return encoder;
    }

    private static ThresholdFilter threshold(LoggerContext context, Level level) {
        ThresholdFilter filter = new ThresholdFilter();
        filter.setContext(context);
        filter.setLevel(level.toString());
        filter.start();
        return filter;
    }

    private static void setLoggerLevel(LoggerContext context, String name, String level) {
        Logger logger = context.getLogger(name);
        if (logger.getLevel() == null) {
            logger.setLevel(Level.toLevel(level));
        }
    }

    private static String getStringOrDefault(Config config, String path, String defaultValue) {
        if (config.hasPath(path)) {
            return config.getString(path);
        }
        return defaultValue;
    }

    /**
     * Reset configuration state. For testing only.
     */
    static void reset() {
        configured = false;
    }
}
