package io.octavecanon.core.model;

/**
 * Exhaustive match over {@link Node}.
 *
 * @param <R> result type
 */
public interface NodeVisitor<R> {

    R visitAssignment(Node.Assignment assignment);

    R visitBlock(Node.Block block);

    R visitSection(Node.Section section);

    R visitComment(Node.Comment comment);
}
