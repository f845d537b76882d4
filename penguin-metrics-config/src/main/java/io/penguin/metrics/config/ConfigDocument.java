package io.penguin.metrics.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Generic parse tree of a configuration file with all includes already merged in.
 */
public record ConfigDocument(List<Block> blocks, List<Directive> directives, Path file) {

    public ConfigDocument {
        blocks = List.copyOf(blocks);
        directives = List.copyOf(directives);
    }

    public static ConfigDocument empty(Path file) {
        return new ConfigDocument(List.of(), List.of(), file);
    }

    /**
     * Appends the top-level content of {@code other} after this document's content.
     */
    public ConfigDocument merge(ConfigDocument other) {
        List<Block> mergedBlocks = new ArrayList<>(blocks);
        mergedBlocks.addAll(other.blocks());
        List<Directive> mergedDirectives = new ArrayList<>(directives);
        mergedDirectives.addAll(other.directives());
        return new ConfigDocument(mergedBlocks, mergedDirectives, file);
    }

    public List<Block> blocks(String type) {
        List<Block> result = new ArrayList<>();
        for (Block block : blocks) {
            if (block.type().equals(type)) {
                result.add(block);
            }
        }
        return result;
    }

    public List<Directive> directives(String name) {
        List<Directive> result = new ArrayList<>();
        for (Directive directive : directives) {
            if (directive.name().equals(name)) {
                result.add(directive);
            }
        }
        return result;
    }
}
