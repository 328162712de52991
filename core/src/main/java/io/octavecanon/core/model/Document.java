package io.octavecanon.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Root of the AST.
 *
 * @param name        envelope name from {@code ===NAME===}
 * @param frontmatter raw frontmatter text, kept byte-for-byte, or {@code null}
 * @param meta        children of the {@code META:} block, empty when there is none
 * @param separator   whether a {@code ---} line follows the META block
 * @param body        top-level nodes after META
 */
public record Document(String name, String frontmatter, List<Node> meta, boolean separator, List<Node> body) {

    public Document {
        Objects.requireNonNull(name, "name must not be null");
        meta = List.copyOf(meta);
        body = List.copyOf(body);
    }

    public static Document of(String name, List<Node> meta, List<Node> body) {
        return new Document(name, null, meta, false, body);
    }

    /** Value of the last META assignment named {@code key}, or {@link Value.Absent}. */
    public Value metaValue(String key) {
        return lastValue(meta, key);
    }

    /** Value of the last top-level assignment named {@code key}, or {@link Value.Absent}. */
    public Value bodyValue(String key) {
        return lastValue(body, key);
    }

    /** Whether frontmatter would be emitted: present and not blank. */
    public boolean hasFrontmatter() {
        return frontmatter != null && !frontmatter.isBlank();
    }

    private static Value lastValue(List<Node> nodes, String key) {
        Value found = Value.Absent.INSTANCE;
        for (Node node : nodes) {
            if (node instanceof Node.Assignment a && a.key().equals(key)) {
                found = a.value();
            }
        }
        return found;
    }
}
