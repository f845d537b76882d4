package io.penguin.metrics.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ConfigParserTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private static List<String> blockNames(ConfigDocument document) {
        return document.blocks().stream().map(Block::name).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should parse nested blocks, named blocks and multi-value directives")
    void parseStructure() throws Exception {
        ConfigDocument document = new ConfigParser().parse("""
                auto_refresh_interval 60s;
                process "nginx" {
                    match name "nginx";
                    homeassistant { icon "mdi:web"; }
                }
                mqtt { host broker; }
                """, null);

        assertEquals(1, document.directives().size());
        assertEquals(60.0, document.directives().get(0).firstValue());

        Block process = document.blocks("process").get(0);
        assertEquals("nginx", process.name());
        assertEquals(List.of("name", "nginx"), process.directive("match").orElseThrow().values());
        assertEquals("mdi:web", process.block("homeassistant").orElseThrow()
                .directive("icon").orElseThrow().firstValue());

        Block mqtt = document.blocks("mqtt").get(0);
        assertNull(mqtt.name());
        assertEquals("broker", mqtt.directive("host").orElseThrow().firstValue());
    }

    @Test
    @DisplayName("Should report expected versus found on a missing semicolon")
    void missingSemicolon() {
        ParseError error = assertThrows(ParseError.class,
                () -> new ConfigParser().parse("mqtt {\n  host \"x\"\n}", null));
        assertTrue(error.getMessage().contains("expected"), error.getMessage());
        assertTrue(error.getMessage().contains("'}'"), error.getMessage());
        assertEquals(3, error.getPosition().line());
    }

    @Test
    @DisplayName("Should reject unclosed blocks and blocks with two names")
    void structuralErrors() {
        assertThrows(ParseError.class, () -> new ConfigParser().parse("system {", null));
        assertThrows(ParseError.class, () -> new ConfigParser().parse("}", null));
        assertThrows(ParseError.class, () -> new ConfigParser().parse("process \"a\" \"b\" { }", null));
    }

    @Test
    @DisplayName("Should merge a plain include relative to the including file")
    void plainInclude() throws Exception {
        write("conf.d/mqtt.conf", "mqtt { host \"included\"; }");
        Path main = write("main.conf", "include \"conf.d/mqtt.conf\";\nsystem { }");

        ConfigDocument document = new ConfigParser().parseFile(main);

        assertEquals(List.of("mqtt", "system"),
                document.blocks().stream().map(Block::type).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Should include glob matches in lexicographic order")
    void globIncludeOrder() throws Exception {
        write("sensors/b.conf", "custom \"b\" { command \"true\"; }");
        write("sensors/a.conf", "custom \"a\" { command \"true\"; }");
        write("sensors/c.conf", "custom \"c\" { command \"true\"; }");
        write("sensors/ignored.txt", "custom \"x\" { }");
        Path main = write("main.conf", "include \"sensors/*.conf\";");

        ConfigDocument document = new ConfigParser().parseFile(main);

        assertEquals(List.of("a", "b", "c"), blockNames(document));
    }

    @Test
    @DisplayName("Should accept a glob without matches")
    void emptyGlob() throws Exception {
        Path main = write("main.conf", "include \"missing/*.conf\";\nsystem { }");
        assertEquals(1, new ConfigParser().parseFile(main).blocks().size());
    }

    @Test
    @DisplayName("Should fail on a plain include that does not exist")
    void missingInclude() throws Exception {
        Path main = write("main.conf", "include \"nope.conf\";");
        ParseError error = assertThrows(ParseError.class, () -> new ConfigParser().parseFile(main));
        assertTrue(error.getMessage().contains("nope.conf"));
    }

    @Test
    @DisplayName("Should treat a repeated or cyclic include as a no-op")
    void cyclicInclude() throws Exception {
        write("a.conf", "include \"b.conf\";\ncustom \"a\" { command \"true\"; }");
        write("b.conf", "include \"a.conf\";\ninclude \"main.conf\";\ncustom \"b\" { command \"true\"; }");
        Path main = write("main.conf", "include \"a.conf\";\ninclude \"a.conf\";\nsystem { }");

        ConfigDocument document = new ConfigParser().parseFile(main);

        assertEquals(List.of("b", "a"), blockNames(document).subList(0, 2));
        assertEquals(3, document.blocks().size());
    }

    @Test
    @DisplayName("Should merge an include inside a block into that block")
    void includeInsideBlock() throws Exception {
        write("mqtt-auth.conf", "username \"user\";\npassword \"secret\";");
        Path main = write("main.conf", "mqtt {\n  host \"h\";\n  include \"mqtt-auth.conf\";\n}");

        Block mqtt = new ConfigParser().parseFile(main).blocks("mqtt").get(0);

        assertEquals(3, mqtt.directives().size());
        assertEquals("secret", mqtt.directive("password").orElseThrow().firstValue());
    }
}
