package io.penguin.metrics.config;

import io.penguin.metrics.config.model.AutoDiscoverySettings;
import io.penguin.metrics.config.model.Config;
import io.penguin.metrics.config.model.CustomSource;
import io.penguin.metrics.config.model.DefaultsSettings;
import io.penguin.metrics.config.model.DeviceRef;
import io.penguin.metrics.config.model.DeviceTemplate;
import io.penguin.metrics.config.model.HomeAssistantSettings;
import io.penguin.metrics.config.model.LoggingSettings;
import io.penguin.metrics.config.model.Match;
import io.penguin.metrics.config.model.MqttSettings;
import io.penguin.metrics.config.model.SensorOverrides;
import io.penguin.metrics.config.model.SourceConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static io.penguin.metrics.config.Setting.Kind.BOOLEAN;
import static io.penguin.metrics.config.Setting.Kind.DURATION;
import static io.penguin.metrics.config.Setting.Kind.INTEGER;
import static io.penguin.metrics.config.Setting.Kind.STRING;

/**
 * Turns a generic {@link ConfigDocument} into a typed {@link Config}.
 *
 * <p>Structural problems that would make the agent misbehave are {@link ConfigError}s.
 * Directives and blocks that are simply not recognised are reported as warnings and ignored.
 */
public class ConfigBinder {

    static final String AUTO_DISCOVERY = "auto_discovery";
    static final String AUTO_REFRESH_INTERVAL = "auto_refresh_interval";
    static final String HOMEASSISTANT = "homeassistant";

    private static final Map<String, Setting.Kind> MQTT_DIRECTIVES = Map.of(
            "host", STRING,
            "port", INTEGER,
            "username", STRING,
            "password", STRING,
            "client_id", STRING,
            "topic_prefix", STRING,
            "qos", INTEGER,
            "retain", BOOLEAN,
            "keepalive", INTEGER);

    private static final Map<String, Setting.Kind> HOMEASSISTANT_DIRECTIVES = Map.of(
            "discovery", BOOLEAN,
            "discovery_prefix", STRING,
            "state_file", STRING);

    private static final Map<String, Setting.Kind> LOGGING_DIRECTIVES = Map.of(
            "level", STRING,
            "file", STRING,
            "file_level", STRING,
            "file_max_size", INTEGER,
            "file_keep", INTEGER,
            "colors", BOOLEAN,
            "format", STRING);

    private static final Map<SourceType, Set<Match.Kind>> MATCH_KINDS = Map.of(
            SourceType.PROCESS, EnumSet.of(Match.Kind.NAME, Match.Kind.PATTERN, Match.Kind.PID,
                    Match.Kind.PIDFILE, Match.Kind.CMDLINE),
            SourceType.SERVICE, EnumSet.of(Match.Kind.UNIT, Match.Kind.PATTERN),
            SourceType.CONTAINER, EnumSet.of(Match.Kind.NAME, Match.Kind.PATTERN, Match.Kind.IMAGE, Match.Kind.LABEL));

    private static final Set<String> LOG_LEVELS = Set.of("trace", "debug", "info", "warning", "warn", "error", "critical");

    private final List<String> warnings = new ArrayList<>();
    private Map<String, DeviceTemplate> templates = Map.of();

    public BindResult bind(ConfigDocument document) throws ConfigError {
        warnings.clear();

        Duration autoRefresh = Duration.ZERO;
        for (Directive directive : document.directives()) {
            if (directive.name().equals(AUTO_REFRESH_INTERVAL)) {
                autoRefresh = SourceConfigFactory.duration((Double) typed(directive, DURATION));
            } else {
                warn(directive.position(), "Unknown top-level directive '" + directive.name() + "'");
            }
        }

        MqttSettings mqtt = bindMqtt(document.blocks("mqtt"));
        HomeAssistantSettings homeAssistant = bindHomeAssistant(document.blocks(HOMEASSISTANT));
        LoggingSettings logging = bindLogging(document.blocks("logging"));
        templates = bindDeviceTemplates(document.blocks("device"), mqtt.topicPrefix());
        DefaultsSettings defaults = bindDefaults(document.blocks("defaults"));

        Map<SourceType, AutoDiscoverySettings> autoDiscovery = new EnumMap<>(SourceType.class);
        Map<SourceType, List<SourceConfig>> sources = new EnumMap<>(SourceType.class);
        for (Block block : document.blocks()) {
            Optional<SourceType> manual = SourceType.fromBlockName(block.type());
            Optional<SourceType> auto = SourceType.fromAutoBlockName(block.type());
            if (manual.isPresent()) {
                sources.computeIfAbsent(manual.get(), t -> new ArrayList<>())
                        .add(bindSource(manual.get(), block, defaults));
            } else if (auto.isPresent()) {
                autoDiscovery.put(auto.get(), bindAutoDiscovery(auto.get(), block));
            } else if (block.type().equals(AUTO_DISCOVERY)) {
                bindAutoDiscoveryGroup(block, autoDiscovery);
            } else if (!Set.of("mqtt", HOMEASSISTANT, "logging", "device", "defaults").contains(block.type())) {
                warn(block.position(), "Unknown block '" + block.type() + "'");
            }
        }

        validateUnique(sources);

        Config config = new Config(mqtt, homeAssistant, logging, defaults, autoRefresh, templates, autoDiscovery, sources);
        return new BindResult(config, List.copyOf(warnings));
    }

    private MqttSettings bindMqtt(List<Block> blocks) throws ConfigError {
        Map<String, Object> v = flatten(blocks, MQTT_DIRECTIVES);
        MqttSettings d = MqttSettings.defaults();
        int qos = intOr(v, "qos", d.qos());
        if (qos < 0 || qos > 2) {
            throw new ConfigError("mqtt qos must be 0, 1 or 2 but was " + qos, position(blocks));
        }
        int port = intOr(v, "port", d.port());
        if (port <= 0 || port > 65535) {
            throw new ConfigError("mqtt port out of range: " + port, position(blocks));
        }
        return new MqttSettings(
                (String) v.getOrDefault("host", d.host()),
                port,
                (String) v.get("username"),
                (String) v.get("password"),
                (String) v.get("client_id"),
                (String) v.getOrDefault("topic_prefix", d.topicPrefix()),
                qos,
                (Boolean) v.getOrDefault("retain", d.retain()),
                intOr(v, "keepalive", d.keepaliveSeconds()));
    }

    private HomeAssistantSettings bindHomeAssistant(List<Block> blocks) throws ConfigError {
        Map<String, Object> v = flatten(blocks, HOMEASSISTANT_DIRECTIVES);
        HomeAssistantSettings d = HomeAssistantSettings.defaults();
        return new HomeAssistantSettings(
                (Boolean) v.getOrDefault("discovery", d.discovery()),
                (String) v.getOrDefault("discovery_prefix", d.discoveryPrefix()),
                v.containsKey("state_file") ? Path.of((String) v.get("state_file")) : d.stateFile());
    }

    private LoggingSettings bindLogging(List<Block> blocks) throws ConfigError {
        Map<String, Object> v = flatten(blocks, LOGGING_DIRECTIVES);
        LoggingSettings d = LoggingSettings.defaults();
        String level = ((String) v.getOrDefault("level", d.level())).toLowerCase(Locale.ROOT);
        String fileLevel = ((String) v.getOrDefault("file_level", d.fileLevel())).toLowerCase(Locale.ROOT);
        for (String candidate : List.of(level, fileLevel)) {
            if (!LOG_LEVELS.contains(candidate)) {
                throw new ConfigError("Unknown log level '" + candidate + "'", position(blocks));
            }
        }
        return new LoggingSettings(level, (String) v.get("file"), fileLevel,
                intOr(v, "file_max_size", (int) d.fileMaxSizeMb()),
                intOr(v, "file_keep", d.fileKeep()),
                (Boolean) v.getOrDefault("colors", d.colors()),
                (String) v.get("format"));
    }

    private Map<String, DeviceTemplate> bindDeviceTemplates(List<Block> blocks, String topicPrefix) throws ConfigError {
        Map<String, DeviceTemplate> bound = new LinkedHashMap<>();
        for (Block block : blocks) {
            if (block.name() == null) {
                throw new ConfigError("Device template requires a name: device \"name\" { ... }", block.position());
            }
            if (bound.containsKey(block.name())) {
                throw new ConfigError("Duplicate device template '" + block.name() + "'", block.position());
            }
            Map<String, Object> fields = new LinkedHashMap<>();
            String displayName = block.name();
            for (Directive directive : block.directives()) {
                if (directive.name().equals("name")) {
                    displayName = (String) typed(directive, STRING);
                } else {
                    fields.put(directive.name(), passThrough(directive));
                }
            }
            String identifier = "penguin_metrics_" + topicPrefix + "_device_" + Identifiers.sanitize(block.name());
            bound.put(block.name(), new DeviceTemplate(block.name(), identifier, displayName, fields));
        }
        return bound;
    }

    private DefaultsSettings bindDefaults(List<Block> blocks) throws ConfigError {
        Set<String> globalNames = SourceSchema.globalDefaultNames();
        Map<String, Object> global = new HashMap<>();
        Map<SourceType, Map<String, Object>> perType = new EnumMap<>(SourceType.class);
        for (Block block : blocks) {
            for (Directive directive : block.directives()) {
                if (!globalNames.contains(directive.name())) {
                    warn(directive.position(), "Unknown directive '" + directive.name() + "' in defaults");
                    continue;
                }
                Object value = typed(directive, globalKind(directive.name()));
                if (directive.name().equals(SourceSchema.DEVICE)) {
                    checkDeviceRef(DeviceRef.parse((String) value), directive.position());
                }
                global.put(directive.name(), value);
            }
            for (Block nested : block.blocks()) {
                Optional<SourceType> type = SourceType.fromBlockName(nested.type());
                if (type.isEmpty()) {
                    warn(nested.position(), "Unknown block '" + nested.type() + "' in defaults");
                    continue;
                }
                Map<String, Object> values = perType.computeIfAbsent(type.get(), t -> new HashMap<>());
                for (Directive directive : nested.directives()) {
                    Optional<Setting> setting = SourceSchema.setting(type.get(), directive.name());
                    if (setting.isEmpty() || !setting.get().cascade()) {
                        warn(directive.position(), "Unknown directive '" + directive.name()
                                + "' in defaults " + nested.type());
                        continue;
                    }
                    Object value = typed(directive, setting.get().kind());
                    if (directive.name().equals(SourceSchema.DEVICE)) {
                        checkDeviceRef(DeviceRef.parse((String) value), directive.position());
                    }
                    values.put(directive.name(), value);
                }
            }
        }
        return new DefaultsSettings(global, perType);
    }

    private void bindAutoDiscoveryGroup(Block group, Map<SourceType, AutoDiscoverySettings> target) throws ConfigError {
        for (Directive directive : group.directives()) {
            warn(directive.position(), "Unknown directive '" + directive.name() + "' in auto_discovery");
        }
        for (Block block : group.blocks()) {
            Optional<SourceType> type = SourceType.fromAutoBlockName(block.type());
            if (type.isEmpty()) {
                warn(block.position(), "Unknown block '" + block.type() + "' in auto_discovery");
                continue;
            }
            target.put(type.get(), bindAutoDiscovery(type.get(), block));
        }
    }

    private AutoDiscoverySettings bindAutoDiscovery(SourceType type, Block block) throws ConfigError {
        boolean enabled = false;
        List<Glob> filters = new ArrayList<>();
        List<Glob> excludes = new ArrayList<>();
        String source = SourceConfigFactory.THERMAL;
        DeviceRef device = DeviceRef.AUTO;
        Duration interval = null;
        Map<String, Object> options = new HashMap<>();
        for (Directive directive : block.directives()) {
            switch (directive.name()) {
                case "auto" -> enabled = (Boolean) typed(directive, BOOLEAN);
                case "filter" -> filters.addAll(globs(directive));
                case "exclude" -> excludes.addAll(globs(directive));
                case "device" -> {
                    device = DeviceRef.parse((String) typed(directive, STRING));
                    checkDeviceRef(device, directive.position());
                }
                case SourceSchema.UPDATE_INTERVAL ->
                        interval = SourceConfigFactory.duration((Double) typed(directive, DURATION));
                case "source" -> {
                    if (type != SourceType.TEMPERATURE) {
                        warn(directive.position(), "Directive 'source' only applies to temperatures");
                        continue;
                    }
                    source = (String) typed(directive, STRING);
                    if (!source.equals(SourceConfigFactory.THERMAL) && !source.equals(SourceConfigFactory.HWMON)) {
                        throw new ConfigError("temperatures source must be 'thermal' or 'hwmon' but was '"
                                + source + "'", directive.position());
                    }
                }
                default -> {
                    Optional<Setting> setting = SourceSchema.setting(type, directive.name());
                    if (setting.isEmpty() || !setting.get().cascade()) {
                        warn(directive.position(), "Unknown directive '" + directive.name() + "' in " + block.type());
                        continue;
                    }
                    options.put(directive.name(), typed(directive, setting.get().kind()));
                }
            }
        }
        for (Block nested : block.blocks()) {
            warn(nested.position(), "Unknown block '" + nested.type() + "' in " + block.type());
        }
        if (enabled && type.filterRequired() && filters.isEmpty()) {
            throw new ConfigError("Auto-discovery for '" + block.type()
                    + "' requires at least one 'filter' pattern", block.position());
        }
        return new AutoDiscoverySettings(type, enabled, filters, excludes, source, device, interval, options);
    }

    private SourceConfig bindSource(SourceType type, Block block, DefaultsSettings defaults) throws ConfigError {
        String name = block.name();
        if (name == null) {
            if (type != SourceType.SYSTEM) {
                throw new ConfigError("Block '" + block.type() + "' requires a name: "
                        + block.type() + " \"name\" { ... }", block.position());
            }
            name = "system";
        }
        if (Identifiers.sanitize(name).isEmpty()) {
            throw new ConfigError("Name '" + name + "' does not contain any usable characters", block.position());
        }

        Map<String, Object> instance = new HashMap<>();
        for (Directive directive : block.directives()) {
            Optional<Setting> setting = SourceSchema.setting(type, directive.name());
            if (setting.isEmpty()) {
                warn(directive.position(), "Unknown directive '" + directive.name() + "' in " + block.label());
                continue;
            }
            Object value = setting.get().kind() == Setting.Kind.MATCH
                    ? match(type, directive)
                    : typed(directive, setting.get().kind());
            instance.put(directive.name(), value);
        }

        SensorOverrides overrides = SensorOverrides.NONE;
        for (Block nested : block.blocks()) {
            if (nested.type().equals(HOMEASSISTANT)) {
                Map<String, Object> fields = new LinkedHashMap<>(overrides.fields());
                for (Directive directive : nested.directives()) {
                    fields.put(directive.name(), passThrough(directive));
                }
                overrides = new SensorOverrides(fields);
            } else {
                warn(nested.position(), "Unknown block '" + nested.type() + "' in " + block.label());
            }
        }

        Map<String, Object> resolved = defaults.resolve(type, instance);
        validateSource(type, block, resolved);
        if (instance.containsKey(SourceSchema.DEVICE)) {
            checkDeviceRef(DeviceRef.parse((String) instance.get(SourceSchema.DEVICE)), block.position());
        }
        return SourceConfigFactory.create(type, name, resolved, overrides);
    }

    private void validateSource(SourceType type, Block block, Map<String, Object> resolved) throws ConfigError {
        double interval = ((Number) resolved.get(SourceSchema.UPDATE_INTERVAL)).doubleValue();
        if (interval <= 0) {
            throw new ConfigError("update_interval must be positive in " + block.label(), block.position());
        }
        if (type == SourceType.CUSTOM || type == SourceType.BINARY_SENSOR) {
            if (resolved.get("command") == null && resolved.get("script") == null) {
                throw new ConfigError(block.label() + " requires 'command' or 'script'", block.position());
            }
        }
        if (type == SourceType.CUSTOM) {
            String outputType = ((String) resolved.get("type")).toUpperCase(Locale.ROOT);
            try {
                CustomSource.OutputType.valueOf(outputType);
            } catch (IllegalArgumentException e) {
                throw new ConfigError("Unknown custom sensor type '" + resolved.get("type")
                        + "', expected number, string or json", block.position());
            }
        }
        if (type == SourceType.BINARY_SENSOR) {
            String valueSource = (String) resolved.get("value_source");
            if (!valueSource.equals("returncode") && !valueSource.equals("output")) {
                throw new ConfigError("Unknown value_source '" + valueSource
                        + "', expected returncode or output", block.position());
            }
        }
    }

    private Match match(SourceType type, Directive directive) throws ConfigError {
        if (directive.values().size() != 2) {
            throw new ConfigError("'match' expects a kind and a value, e.g. match name \"nginx\"", directive.position());
        }
        String kindName = String.valueOf(directive.values().get(0));
        Match.Kind kind;
        try {
            kind = Match.Kind.valueOf(kindName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            kind = null;
        }
        if (kind == null || !MATCH_KINDS.get(type).contains(kind)) {
            throw new ConfigError("Unsupported match kind '" + kindName + "' for " + type.blockName(), directive.position());
        }
        String value = String.valueOf(directive.values().get(1));
        if (kind == Match.Kind.PATTERN) {
            try {
                Pattern.compile(value);
            } catch (PatternSyntaxException e) {
                throw new ConfigError("Invalid match pattern '" + value + "': " + e.getDescription(), directive.position());
            }
        }
        return new Match(kind, value);
    }

    private void validateUnique(Map<SourceType, List<SourceConfig>> sources) throws ConfigError {
        List<SourceConfig> systems = sources.getOrDefault(SourceType.SYSTEM, List.of());
        if (systems.size() > 1) {
            throw new ConfigError("Only one system block may be declared");
        }
        for (Map.Entry<SourceType, List<SourceConfig>> entry : sources.entrySet()) {
            Set<String> seen = new HashSet<>();
            for (SourceConfig source : entry.getValue()) {
                if (!seen.add(source.id())) {
                    throw new ConfigError("Duplicate " + entry.getKey().blockName() + " '" + source.name()
                            + "' (id '" + source.id() + "')");
                }
            }
        }
    }

    private void checkDeviceRef(DeviceRef ref, SourcePosition position) throws ConfigError {
        if (ref.kind() == DeviceRef.Kind.TEMPLATE && !templates.containsKey(ref.template())) {
            throw new ConfigError("Unknown device template '" + ref.template() + "'; declare it with device \""
                    + ref.template() + "\" { ... } or use system, auto or none", position);
        }
    }

    private Map<String, Object> flatten(List<Block> blocks, Map<String, Setting.Kind> schema) throws ConfigError {
        Map<String, Object> values = new HashMap<>();
        for (Block block : blocks) {
            for (Directive directive : block.directives()) {
                Setting.Kind kind = schema.get(directive.name());
                if (kind == null) {
                    warn(directive.position(), "Unknown directive '" + directive.name() + "' in " + block.type());
                    continue;
                }
                values.put(directive.name(), typed(directive, kind));
            }
            for (Block nested : block.blocks()) {
                warn(nested.position(), "Unknown block '" + nested.type() + "' in " + block.type());
            }
        }
        return values;
    }

    /**
     * Checks a single-valued directive against its expected kind and normalizes the value:
     * numbers and durations become {@link Double} seconds, integers {@link Integer}.
     */
    static Object typed(Directive directive, Setting.Kind kind) throws ConfigError {
        if (directive.values().size() != 1) {
            throw new ConfigError("'" + directive.name() + "' expects exactly one value but got "
                    + directive.values().size(), directive.position());
        }
        Object value = directive.firstValue();
        switch (kind) {
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                break;
            case DURATION:
            case NUMBER:
                if (value instanceof Number number) {
                    return number.doubleValue();
                }
                break;
            case INTEGER:
                if (value instanceof Long number && number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                    return number.intValue();
                }
                break;
            case STRING:
                if (value instanceof String || value instanceof Long) {
                    return value.toString();
                }
                break;
            default:
                break;
        }
        throw new ConfigError("'" + directive.name() + "' expects " + describe(kind) + " but got '" + value + "'",
                directive.position());
    }

    private static Setting.Kind globalKind(String name) {
        for (SourceType type : SourceType.values()) {
            Setting setting = SourceSchema.settings(type).get(name);
            if (setting != null) {
                return setting.kind();
            }
        }
        throw new IllegalStateException("No setting named " + name);
    }

    private static List<Glob> globs(Directive directive) throws ConfigError {
        if (!directive.hasValue()) {
            throw new ConfigError("'" + directive.name() + "' expects at least one pattern", directive.position());
        }
        List<Glob> globs = new ArrayList<>();
        for (Object value : directive.values()) {
            globs.add(Glob.of(String.valueOf(value)));
        }
        return globs;
    }

    private static Object passThrough(Directive directive) {
        return directive.values().size() == 1 ? directive.firstValue() : directive.values();
    }

    private static int intOr(Map<String, Object> values, String key, int fallback) {
        Object value = values.get(key);
        return value == null ? fallback : (Integer) value;
    }

    private static String describe(Setting.Kind kind) {
        return switch (kind) {
            case BOOLEAN -> "on/off";
            case DURATION -> "a duration such as 10s";
            case INTEGER -> "an integer";
            case NUMBER -> "a number";
            case STRING -> "a string";
            case MATCH -> "a match";
        };
    }

    private static SourcePosition position(List<Block> blocks) {
        return blocks.isEmpty() ? null : blocks.get(blocks.size() - 1).position();
    }

    private void warn(SourcePosition position, String message) {
        warnings.add(position == null ? message : position + ": " + message);
    }
}
