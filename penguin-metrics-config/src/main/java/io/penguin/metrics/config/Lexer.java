package io.penguin.metrics.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns configuration text into a list of {@link Token}s terminated by {@link TokenType#EOF}.
 *
 * <p>Lexing is pure: {@link #tokenize()} can be called any number of times and always
 * yields the same list. Durations are normalized to seconds, e.g. {@code 30ms} becomes {@code 0.03}.
 */
public class Lexer {

    private static final Map<String, Double> DURATION_UNITS = Map.of(
            "s", 1.0,
            "m", 60.0,
            "h", 3600.0,
            "d", 86400.0);

    private final String text;
    private final Path file;

    private int pos;
    private int line;
    private int column;

    public Lexer(String text) {
        this(text, null);
    }

    public Lexer(String text, Path file) {
        this.text = text;
        this.file = file;
    }

    public List<Token> tokenize() throws LexError {
        pos = 0;
        line = 1;
        column = 1;
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (atEnd()) {
                tokens.add(new Token(TokenType.EOF, null, here(), ""));
                return Collections.unmodifiableList(tokens);
            }
            tokens.add(nextToken());
        }
    }

    private Token nextToken() throws LexError {
        SourcePosition start = here();
        char c = peek();
        switch (c) {
            case '{':
                advance();
                return new Token(TokenType.LBRACE, null, start, "{");
            case '}':
                advance();
                return new Token(TokenType.RBRACE, null, start, "}");
            case ';':
                advance();
                return new Token(TokenType.SEMICOLON, null, start, ";");
            case '"':
            case '\'':
                return readString(start);
            default:
                break;
        }
        if (isDigit(c) || (c == '-' && isDigit(peekAt(1)))) {
            return readNumber(start);
        }
        if (Character.isLetter(c) || c == '_') {
            return readWord(start);
        }
        throw new LexError("Unexpected character '" + c + "'", start);
    }

    private Token readString(SourcePosition start) throws LexError {
        int from = pos;
        char quote = advance();
        StringBuilder value = new StringBuilder();
        while (true) {
            if (atEnd() || peek() == '\n') {
                throw new LexError("Unterminated string literal", start);
            }
            char c = advance();
            if (c == quote) {
                break;
            }
            if (c == '\\') {
                if (atEnd()) {
                    throw new LexError("Unterminated string literal", start);
                }
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        return new Token(TokenType.STRING, value.toString(), start, text.substring(from, pos));
    }

    private Token readNumber(SourcePosition start) throws LexError {
        int from = pos;
        if (peek() == '-') {
            advance();
        }
        boolean decimal = false;
        while (!atEnd() && (isDigit(peek()) || peek() == '.')) {
            if (peek() == '.') {
                if (decimal || !isDigit(peekAt(1))) {
                    throw new LexError("Malformed number '" + text.substring(from, pos + 1) + "'", start);
                }
                decimal = true;
            }
            advance();
        }
        String digits = text.substring(from, pos);

        int unitStart = pos;
        while (!atEnd() && Character.isLetter(peek())) {
            advance();
        }
        String raw = text.substring(from, pos);
        if (unitStart == pos) {
            Object value = decimal ? (Object) Double.parseDouble(digits) : (Object) parseLong(digits, start);
            return new Token(TokenType.NUMBER, value, start, raw);
        }

        String unit = text.substring(unitStart, pos);
        double amount = Double.parseDouble(digits);
        if (unit.equals("ms")) {
            return new Token(TokenType.DURATION, amount / 1000, start, raw);
        }
        Double multiplier = DURATION_UNITS.get(unit);
        if (multiplier == null) {
            throw new LexError("Unknown duration unit '" + unit + "' in '" + raw + "'", start);
        }
        return new Token(TokenType.DURATION, amount * multiplier, start, raw);
    }

    private Token readWord(SourcePosition start) {
        int from = pos;
        while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_' || peek() == '-')) {
            advance();
        }
        String word = text.substring(from, pos);
        String lower = word.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "on":
            case "true":
                return new Token(TokenType.BOOLEAN, Boolean.TRUE, start, word);
            case "off":
            case "false":
                return new Token(TokenType.BOOLEAN, Boolean.FALSE, start, word);
            default:
                break;
        }
        if (word.equals("include")) {
            return new Token(TokenType.INCLUDE, word, start, word);
        }
        return new Token(TokenType.IDENTIFIER, word, start, word);
    }

    private void skipWhitespaceAndComments() throws LexError {
        while (!atEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#') {
                while (!atEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && peekAt(1) == '*') {
                SourcePosition start = here();
                advance();
                advance();
                while (!(peek() == '*' && peekAt(1) == '/')) {
                    if (atEnd()) {
                        throw new LexError("Unterminated block comment", start);
                    }
                    advance();
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private long parseLong(String digits, SourcePosition start) throws LexError {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new LexError("Number out of range '" + digits + "'", start);
        }
    }

    private SourcePosition here() {
        return SourcePosition.of(file, line, column);
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return atEnd() ? '\0' : text.charAt(pos);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private char advance() {
        char c = text.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
