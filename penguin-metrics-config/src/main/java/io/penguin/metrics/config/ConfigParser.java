package io.penguin.metrics.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Recursive-descent parser producing a {@link ConfigDocument}.
 *
 * <pre>
 * document  := (block | directive | include)*
 * block     := IDENT [STRING|IDENT] '{' (block | directive | include)* '}'
 * directive := IDENT value* ';'
 * include   := 'include' STRING ';'
 * </pre>
 *
 * Includes are resolved relative to the directory of the including file. A glob pattern
 * includes every matching file in lexicographic order; a file already visited during the
 * same load is skipped. One parser instance tracks one load, so create a new parser per load.
 */
public class ConfigParser {

    private static final Logger log = LoggerFactory.getLogger(ConfigParser.class);

    private final Set<Path> visited = new HashSet<>();

    /**
     * Parses a configuration file and everything it includes.
     */
    public ConfigDocument parseFile(Path file) throws ConfigException {
        Path absolute = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(absolute)) {
            throw new ParseError("Configuration file not found: " + absolute, null);
        }
        visited.add(absolute);
        return parse(read(absolute, null), absolute);
    }

    /**
     * Parses in-memory text. Includes resolve against the parent of {@code file},
     * or the working directory when {@code file} is {@code null}.
     */
    public ConfigDocument parse(String text, Path file) throws ConfigException {
        List<Token> tokens = new Lexer(text, file).tokenize();
        Cursor cursor = new Cursor(tokens);
        Path baseDir = file == null ? Path.of("").toAbsolutePath() : file.toAbsolutePath().getParent();
        List<Block> blocks = new ArrayList<>();
        List<Directive> directives = new ArrayList<>();
        parseBody(cursor, baseDir, false, blocks, directives);
        return new ConfigDocument(blocks, directives, file);
    }

    private void parseBody(Cursor cursor, Path baseDir, boolean nested,
                           List<Block> blocks, List<Directive> directives) throws ConfigException {
        while (true) {
            Token token = cursor.peek();
            switch (token.type()) {
                case EOF -> {
                    if (nested) {
                        throw ParseError.expected("'}'", token);
                    }
                    return;
                }
                case RBRACE -> {
                    if (!nested) {
                        throw ParseError.expected("block, directive or include", token);
                    }
                    return;
                }
                case INCLUDE -> {
                    cursor.next();
                    Token path = cursor.expect(TokenType.STRING, "include path string");
                    cursor.expect(TokenType.SEMICOLON, "';'");
                    for (ConfigDocument included : include((String) path.value(), baseDir, path.position())) {
                        blocks.addAll(included.blocks());
                        directives.addAll(included.directives());
                    }
                }
                case IDENTIFIER -> parseStatement(cursor, baseDir, blocks, directives);
                default -> throw ParseError.expected("block, directive or include", token);
            }
        }
    }

    private void parseStatement(Cursor cursor, Path baseDir,
                                List<Block> blocks, List<Directive> directives) throws ConfigException {
        Token name = cursor.next();
        List<Token> values = new ArrayList<>();
        while (true) {
            Token token = cursor.peek();
            switch (token.type()) {
                case SEMICOLON -> {
                    cursor.next();
                    List<Object> typed = values.stream().map(Token::value).collect(Collectors.toList());
                    directives.add(new Directive((String) name.value(), typed, name.position()));
                    return;
                }
                case LBRACE -> {
                    cursor.next();
                    blocks.add(parseBlock(cursor, baseDir, name, values));
                    return;
                }
                case STRING, NUMBER, DURATION, BOOLEAN, IDENTIFIER -> values.add(cursor.next());
                default -> throw ParseError.expected("value, ';' or '{'", token);
            }
        }
    }

    private Block parseBlock(Cursor cursor, Path baseDir, Token type, List<Token> header) throws ConfigException {
        if (header.size() > 1) {
            throw new ParseError("Block '" + type.value() + "' takes at most one name but got "
                    + header.size() + " values", header.get(1).position());
        }
        String blockName = null;
        if (header.size() == 1) {
            Token nameToken = header.get(0);
            if (!nameToken.is(TokenType.STRING) && !nameToken.is(TokenType.IDENTIFIER)) {
                throw ParseError.expected("block name string", nameToken);
            }
            blockName = (String) nameToken.value();
        }
        List<Block> blocks = new ArrayList<>();
        List<Directive> directives = new ArrayList<>();
        parseBody(cursor, baseDir, true, blocks, directives);
        cursor.expect(TokenType.RBRACE, "'}'");
        return new Block((String) type.value(), blockName, directives, blocks, type.position());
    }

    private List<ConfigDocument> include(String pattern, Path baseDir, SourcePosition position) throws ConfigException {
        List<Path> files = isGlob(pattern) ? expandGlob(pattern, baseDir, position) : List.of(resolvePlain(pattern, baseDir, position));
        List<ConfigDocument> documents = new ArrayList<>();
        for (Path file : files) {
            if (!visited.add(file)) {
                log.debug("Skipping already included file {}", file);
                continue;
            }
            documents.add(parse(read(file, position), file));
        }
        return documents;
    }

    private Path resolvePlain(String pattern, Path baseDir, SourcePosition position) throws ParseError {
        Path file = baseDir.resolve(pattern).toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new ParseError("Included file not found: " + file, position);
        }
        return file;
    }

    private List<Path> expandGlob(String pattern, Path baseDir, SourcePosition position) throws ParseError {
        Path absolutePattern = baseDir.resolve(pattern).normalize();
        Path root = absolutePattern.getRoot();
        Path walkFrom = root;
        int remaining = 0;
        boolean recursive = false;
        for (Path segment : absolutePattern) {
            String part = segment.toString();
            if (remaining == 0 && !isGlob(part)) {
                walkFrom = walkFrom.resolve(part);
            } else {
                remaining++;
                recursive |= part.contains("**");
            }
        }
        if (!Files.isDirectory(walkFrom)) {
            return List.of();
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + absolutePattern);
        int depth = recursive ? Integer.MAX_VALUE : remaining;
        try (Stream<Path> paths = Files.walk(walkFrom, depth)) {
            return paths.filter(Files::isRegularFile)
                    .map(p -> p.toAbsolutePath().normalize())
                    .filter(matcher::matches)
                    .sorted((a, b) -> a.toString().compareTo(b.toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ParseError("Cannot expand include pattern '" + pattern + "': " + e.getMessage(), position, e);
        }
    }

    private static String read(Path file, SourcePosition position) throws ParseError {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ParseError("Cannot read " + file + ": " + e.getMessage(), position, e);
        }
    }

    private static boolean isGlob(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0
                || pattern.indexOf('[') >= 0 || pattern.indexOf('{') >= 0;
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private int index;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            Token token = tokens.get(index);
            if (!token.is(TokenType.EOF)) {
                index++;
            }
            return token;
        }

        Token expect(TokenType type, String description) throws ParseError {
            Token token = peek();
            if (!token.is(type)) {
                throw ParseError.expected(description, token);
            }
            return next();
        }
    }
}
