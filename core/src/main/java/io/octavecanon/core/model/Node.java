package io.octavecanon.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Closed set of document nodes. Nodes are immutable and carry no source positions, so
 * two documents that differ only in layout compare equal.
 */
public sealed interface Node permits Node.Assignment, Node.Block, Node.Section, Node.Comment {

    <R> R accept(NodeVisitor<R> visitor);

    /**
     * {@code KEY::value}. The empty key marks a literal zone written directly in a block
     * body without a {@code KEY::} line; only literal zones may have it.
     */
    record Assignment(String key, Value value) implements Node {
        public Assignment {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
            if (key.isEmpty()) {
                if (!(value instanceof Value.LiteralZoneValue)) {
                    throw new IllegalArgumentException("only a literal zone may have an empty key");
                }
            } else {
                requireKey(key);
            }
        }

        /** True for a literal zone written without a key. */
        public boolean isBareZone() {
            return key.isEmpty();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }

    /** {@code KEY:} followed by indented children. */
    record Block(String key, List<Node> children) implements Node {
        public Block {
            requireKey(key);
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    /**
     * {@code §ID::NAME[annotation]} followed by indented children.
     *
     * @param id         section number or identifier, e.g. {@code 1} or {@code 2b}
     * @param name       section name
     * @param annotation bracketed annotation, or {@code null}
     * @param children   ordered children
     */
    record Section(String id, String name, String annotation, List<Node> children) implements Node {
        public Section {
            requireKey(id);
            requireKey(name);
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSection(this);
        }
    }

    /** {@code // text}. */
    record Comment(String text) implements Node {
        public Comment {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitComment(this);
        }
    }

    private static void requireKey(String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }
}
