package io.octavecanon.core.repair;

import io.octavecanon.core.emit.Emitter;
import io.octavecanon.core.model.Document;
import io.octavecanon.core.model.Node;
import io.octavecanon.core.model.Value;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structural diff of two documents with the same shape.
 *
 * <p>
 * Repair rewrites keys, names, comments and values but never adds, removes or
 * reorders nodes, so the diff walks both trees in parallel. Differences are reported
 * in document order and located by the dotted path in the new tree.
 */
public final class TreeDiff {

    /** Which part of a node differs. */
    public enum Aspect {
        KEY,
        VALUE,
        SECTION,
        COMMENT
    }

    /**
     * One difference.
     *
     * @param location dotted path of the node in the new tree
     * @param aspect   which part differs
     * @param before   old representation
     * @param after    new representation
     */
    public record Difference(String location, Aspect aspect, String before, String after) {

        public Difference {
            Objects.requireNonNull(location, "location must not be null");
            Objects.requireNonNull(aspect, "aspect must not be null");
        }
    }

    private TreeDiff() {
        // utility class
    }

    /**
     * Differences from {@code before} to {@code after}.
     *
     * @throws IllegalArgumentException if the documents differ in shape
     */
    public static List<Difference> diff(Document before, Document after) {
        List<Difference> out = new ArrayList<>();
        nodes(before.meta(), after.meta(), "META", out);
        nodes(before.body(), after.body(), "", out);
        return out;
    }

    static String join(String parent, String key) {
        return parent.isEmpty() ? key : parent + "." + key;
    }

    static String commentPath(String parent) {
        return join(parent, "//");
    }

    static String section(Node.Section section) {
        return Emitter.header(section);
    }

    static String render(Value value) {
        if (value instanceof Value.LiteralZoneValue zone) {
            return zone.toString();
        }
        if (value instanceof Value.Absent) {
            return "ABSENT";
        }
        return Emitter.render(value);
    }

    private static void nodes(List<Node> before, List<Node> after, String parent, List<Difference> out) {
        if (before.size() != after.size()) {
            throw new IllegalArgumentException("container '" + parent + "' differs in size");
        }
        for (int i = 0; i < before.size(); i++) {
            node(before.get(i), after.get(i), parent, out);
        }
    }

    private static void node(Node before, Node after, String parent, List<Difference> out) {
        if (before instanceof Node.Assignment a && after instanceof Node.Assignment b) {
            String path = join(parent, b.key());
            if (!a.key().equals(b.key())) {
                out.add(new Difference(path, Aspect.KEY, a.key(), b.key()));
            }
            if (!a.value().equals(b.value())) {
                out.add(new Difference(path, Aspect.VALUE, render(a.value()), render(b.value())));
            }
        } else if (before instanceof Node.Block a && after instanceof Node.Block b) {
            String path = join(parent, b.key());
            if (!a.key().equals(b.key())) {
                out.add(new Difference(path, Aspect.KEY, a.key(), b.key()));
            }
            nodes(a.children(), b.children(), path, out);
        } else if (before instanceof Node.Section a && after instanceof Node.Section b) {
            String path = join(parent, b.name());
            String old = section(a);
            String now = section(b);
            if (!old.equals(now)) {
                out.add(new Difference(path, Aspect.SECTION, old, now));
            }
            nodes(a.children(), b.children(), path, out);
        } else if (before instanceof Node.Comment a && after instanceof Node.Comment b) {
            if (!a.text().equals(b.text())) {
                out.add(new Difference(commentPath(parent), Aspect.COMMENT, a.text(), b.text()));
            }
        } else {
            throw new IllegalArgumentException("node kinds differ under '" + parent + "': "
                    + before.getClass().getSimpleName() + " vs " + after.getClass().getSimpleName());
        }
    }
}
