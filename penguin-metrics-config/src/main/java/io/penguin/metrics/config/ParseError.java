package io.penguin.metrics.config;

/**
 * Raised by the {@link ConfigParser} on a token sequence that does not follow the grammar,
 * or on an include that cannot be resolved.
 */
public class ParseError extends ConfigException {

    public ParseError(String message, SourcePosition position) {
        super(message, position);
    }

    public ParseError(String message, SourcePosition position, Throwable cause) {
        super(message, position, cause);
    }

    static ParseError expected(String expected, Token found) {
        return new ParseError("expected " + expected + " but found " + found.describe(), found.position());
    }
}
