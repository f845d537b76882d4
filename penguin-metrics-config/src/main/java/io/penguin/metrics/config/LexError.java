package io.penguin.metrics.config;

/**
 * Raised by the {@link Lexer} on characters or literals it cannot turn into tokens.
 */
public class LexError extends ConfigException {

    public LexError(String message, SourcePosition position) {
        super(message, position);
    }
}
