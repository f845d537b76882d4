package io.penguin.metrics.config;

import java.util.List;

/**
 * A {@code name value*;} statement. Values are typed the same way as {@link Token#value()}.
 */
public record Directive(String name, List<Object> values, SourcePosition position) {

    public Directive {
        values = List.copyOf(values);
    }

    public boolean hasValue() {
        return !values.isEmpty();
    }

    public Object firstValue() {
        return values.isEmpty() ? null : values.get(0);
    }
}
