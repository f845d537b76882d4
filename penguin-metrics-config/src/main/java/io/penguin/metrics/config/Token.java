package io.penguin.metrics.config;

/**
 * A single lexical token.
 *
 * <p>{@code value} is typed by {@code type}: {@link String} for identifiers and strings,
 * {@link Long} or {@link Double} for numbers, {@link Double} seconds for durations,
 * {@link Boolean} for booleans and {@code null} for punctuation.
 *
 * @param raw the exact source text of the token
 */
public record Token(TokenType type, Object value, SourcePosition position, String raw) {

    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    String describe() {
        return switch (type) {
            case EOF -> "end of file";
            case LBRACE -> "'{'";
            case RBRACE -> "'}'";
            case SEMICOLON -> "';'";
            default -> type.name().toLowerCase() + " '" + raw + "'";
        };
    }
}
