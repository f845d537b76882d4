package io.penguin.metrics.agent.homeassistant;

import io.penguin.metrics.config.SourceType;

import java.util.Optional;

/**
 * The {@code state} value that marks a source as available. A source is shown available only
 * while the agent is online and its last payload carried this state.
 */
public final class AvailabilityRule {

    public static final String ONLINE = "online";
    public static final String OFFLINE = "offline";

    private AvailabilityRule() {
    }

    /**
     * @return the expected state, empty for the system source which only follows the agent status
     */
    public static Optional<String> expectedState(SourceType type) {
        return switch (type) {
            case SYSTEM -> Optional.empty();
            case SERVICE -> Optional.of("active");
            case CONTAINER, PROCESS -> Optional.of("running");
            default -> Optional.of(ONLINE);
        };
    }

    /**
     * @return the Jinja template mapping a payload to {@code online}/{@code offline}
     */
    public static Optional<String> template(SourceType type) {
        return expectedState(type).map(state ->
                "{{ '" + ONLINE + "' if value_json.state == '" + state + "' else '" + OFFLINE + "' }}");
    }
}
