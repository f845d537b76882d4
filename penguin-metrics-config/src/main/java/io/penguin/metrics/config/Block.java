package io.penguin.metrics.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A {@code type ["name"] { ... }} section holding directives and nested blocks in source order.
 */
public record Block(String type, String name, List<Directive> directives, List<Block> blocks, SourcePosition position) {

    public Block {
        directives = List.copyOf(directives);
        blocks = List.copyOf(blocks);
    }

    /**
     * @return the last directive with the given name; later directives override earlier ones
     */
    public Optional<Directive> directive(String directiveName) {
        Directive found = null;
        for (Directive directive : directives) {
            if (directive.name().equals(directiveName)) {
                found = directive;
            }
        }
        return Optional.ofNullable(found);
    }

    public List<Directive> directives(String directiveName) {
        List<Directive> result = new ArrayList<>();
        for (Directive directive : directives) {
            if (directive.name().equals(directiveName)) {
                result.add(directive);
            }
        }
        return result;
    }

    public List<Block> blocks(String blockType) {
        List<Block> result = new ArrayList<>();
        for (Block block : blocks) {
            if (block.type().equals(blockType)) {
                result.add(block);
            }
        }
        return result;
    }

    public Optional<Block> block(String blockType) {
        List<Block> matching = blocks(blockType);
        return matching.isEmpty() ? Optional.empty() : Optional.of(matching.get(matching.size() - 1));
    }

    public String label() {
        return name == null ? type : type + " \"" + name + "\"";
    }
}
