package io.octavecanon.core.emit;

import io.octavecanon.core.model.Document;
import io.octavecanon.core.model.Node;
import io.octavecanon.core.model.NodeVisitor;
import io.octavecanon.core.model.Value;
import io.octavecanon.core.model.ValueVisitor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a {@link Document} as canonical text.
 *
 * <p>
 * Canonical form: two-space indentation, {@code KEY::value} without spaces, lists on one
 * line ({@code [a,b,[k::v]]}), strings bare only when they read back as the same
 * identifier or flow expression, LF line endings and a trailing newline. Literal zone
 * content is written verbatim; only its fence lines are indented. Blank frontmatter
 * and {@link Value.Absent} assignments produce no output. {@link EmitOptions} selects
 * the non-canonical layouts.
 *
 * <p>
 * For every document {@code d} produced by the parser, parsing the emitted text yields
 * a document equal to {@code d}, and emitting that again yields the same text.
 */
public final class Emitter {

    private static final String INDENT = "  ";

    /** One identifier, optionally qualified as {@code NAME<A,B>}. */
    private static final String SEGMENT =
            "[A-Za-z_][A-Za-z0-9_.\\-]*(?:(?<!-)<(?:[A-Za-z_](?:[A-Za-z0-9_,]*[A-Za-z0-9_])?)?>)?";

    /** Identifier segments joined by flow operators; read back as one joined value. */
    private static final Pattern BARE = Pattern.compile(SEGMENT + "(?:[→⇌⊕⧺∧∨@]" + SEGMENT + ")*");

    private static final Pattern VARIABLE = Pattern.compile("\\$[A-Za-z_][A-Za-z0-9_]*");

    private static final Pattern SEGMENT_SPLIT = Pattern.compile("[→⇌⊕⧺∧∨@]");

    private static final Set<String> RESERVED = Set.of("true", "false", "null", "vs");

    /** Keys whose string values are regular expressions and stay quoted even when bare-safe. */
    private static final Set<String> ALWAYS_QUOTED_KEYS = Set.of("PATTERN", "REGEX");

    private Emitter() {
        // utility class
    }

    /**
     * Emits {@code doc} in canonical form.
     *
     * @throws IllegalStateException if the document holds a value that has no textual
     *                               form, such as a bare {@link Value.Absent} list item
     */
    public static String emit(Document doc) {
        return emit(doc, EmitOptions.canonical());
    }

    /**
     * Emits {@code doc} with the given layout options.
     *
     * @throws IllegalStateException as for {@link #emit(Document)}
     */
    public static String emit(Document doc, EmitOptions options) {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(options, "options must not be null");
        StringBuilder out = new StringBuilder();
        if (doc.hasFrontmatter()) {
            out.append("---\n").append(doc.frontmatter()).append("\n---\n");
        }
        out.append("===").append(doc.name()).append("===\n");
        if (!doc.meta().isEmpty()) {
            out.append("META:\n");
            nodes(doc.meta(), 1, options, out);
        }
        if (doc.separator()) {
            out.append("---\n");
        }
        nodes(doc.body(), 0, options, out);
        out.append("===END===\n");
        return out.toString();
    }

    /** Renders a single non-zone value as it would appear after {@code ::}. */
    public static String render(Value value) {
        return value.accept(VALUE_RENDERER);
    }

    /**
     * Renders a section header line without indentation. Annotations that would not
     * read back as one word are quoted.
     */
    public static String header(Node.Section section) {
        StringBuilder sb = new StringBuilder("§").append(section.id()).append("::").append(section.name());
        String annotation = section.annotation();
        if (annotation != null) {
            sb.append('[').append(isBare(annotation) ? annotation : quote(annotation)).append(']');
        }
        return sb.toString();
    }

    private static void nodes(List<Node> nodes, int depth, EmitOptions options, StringBuilder out) {
        NodeWriter writer = new NodeWriter(depth, options, out);
        boolean sectionSeen = false;
        for (Node node : options.sortKeys() ? sortedByKey(nodes) : nodes) {
            if (node instanceof Node.Section) {
                if (sectionSeen && depth == 0 && options.separateSections()) {
                    out.append('\n');
                }
                sectionSeen = true;
            }
            node.accept(writer);
        }
    }

    /** Keyed assignments first, ordered by key; everything else after them in source order. */
    static List<Node> sortedByKey(List<Node> nodes) {
        List<Node> sorted = new ArrayList<>(nodes.size());
        nodes.stream()
                .filter(Emitter::isKeyedAssignment)
                .sorted(Comparator.comparing(node -> ((Node.Assignment) node).key()))
                .forEach(sorted::add);
        nodes.stream().filter(node -> !isKeyedAssignment(node)).forEach(sorted::add);
        return sorted;
    }

    private static boolean isKeyedAssignment(Node node) {
        return node instanceof Node.Assignment a && !a.isBareZone();
    }

    private static final class NodeWriter implements NodeVisitor<Void> {

        private final int depth;
        private final String indent;
        private final EmitOptions options;
        private final StringBuilder out;

        NodeWriter(int depth, EmitOptions options, StringBuilder out) {
            this.depth = depth;
            this.indent = INDENT.repeat(depth);
            this.options = options;
            this.out = out;
        }

        @Override
        public Void visitAssignment(Node.Assignment assignment) {
            Value value = assignment.value();
            if (value instanceof Value.Absent) {
                return null;
            }
            if (assignment.isBareZone()) {
                literalZone((Value.LiteralZoneValue) value);
                return null;
            }
            out.append(indent).append(assignment.key()).append("::");
            if (value instanceof Value.LiteralZoneValue zone) {
                out.append('\n');
                literalZone(zone);
            } else if (value instanceof Value.StringValue text && ALWAYS_QUOTED_KEYS.contains(assignment.key())) {
                out.append(quote(text.text())).append('\n');
            } else {
                out.append(render(value)).append('\n');
            }
            return null;
        }

        private void literalZone(Value.LiteralZoneValue zone) {
            out.append(indent).append(zone.fenceMarker());
            if (zone.infoTag() != null) {
                out.append(zone.infoTag());
            }
            out.append('\n');
            if (!zone.content().isEmpty()) {
                out.append(zone.content()).append('\n');
            }
            out.append(indent).append(zone.fenceMarker()).append('\n');
        }

        @Override
        public Void visitBlock(Node.Block block) {
            out.append(indent).append(block.key()).append(":\n");
            nodes(block.children(), depth + 1, options, out);
            return null;
        }

        @Override
        public Void visitSection(Node.Section section) {
            out.append(indent).append(header(section)).append('\n');
            nodes(section.children(), depth + 1, options, out);
            return null;
        }

        @Override
        public Void visitComment(Node.Comment comment) {
            if (options.stripComments()) {
                return null;
            }
            String text = options.stripTrailingWhitespace() ? comment.text().stripTrailing() : comment.text();
            out.append(indent).append("//");
            if (!text.isEmpty()) {
                out.append(' ').append(text);
            }
            out.append('\n');
            return null;
        }
    }

    private static final ValueVisitor<String> VALUE_RENDERER = new ValueVisitor<>() {

        @Override
        public String visitString(Value.StringValue value) {
            return isBare(value.text()) ? value.text() : quote(value.text());
        }

        @Override
        public String visitNumber(Value.NumberValue value) {
            return value.lexeme();
        }

        @Override
        public String visitBoolean(Value.BooleanValue value) {
            return Boolean.toString(value.value());
        }

        @Override
        public String visitList(Value.ListValue value) {
            return value.items().stream().map(Emitter::render).collect(Collectors.joining(",", "[", "]"));
        }

        @Override
        public String visitInlineMap(Value.InlineMap value) {
            StringBuilder sb = new StringBuilder("[");
            boolean first = true;
            for (Map.Entry<String, Value> entry : value.entries().entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                sb.append(entry.getKey()).append("::").append(render(entry.getValue()));
                first = false;
            }
            return sb.append(']').toString();
        }

        @Override
        public String visitLiteralZone(Value.LiteralZoneValue value) {
            throw new IllegalStateException("literal zones are rendered by their assignment, not inline");
        }

        @Override
        public String visitHolographic(Value.HolographicValue value) {
            Value example = value.example();
            StringBuilder sb = new StringBuilder("[");
            // a bare word example would be read back as part of a flow expression
            sb.append(example instanceof Value.StringValue text ? quote(text.text()) : render(example));
            sb.append('∧').append(value.constraints());
            if (value.target() != null) {
                sb.append("→§").append(value.target());
            }
            return sb.append(']').toString();
        }

        @Override
        public String visitAbsent(Value.Absent value) {
            throw new IllegalStateException("Absent has no textual form and is never emitted");
        }

        @Override
        public String visitNull(Value.Null value) {
            return "null";
        }
    };

    static boolean isBare(String text) {
        if (VARIABLE.matcher(text).matches()) {
            return true;
        }
        if (!BARE.matcher(text).matches()) {
            return false;
        }
        for (String segment : SEGMENT_SPLIT.split(text)) {
            if (RESERVED.contains(segment.toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }

    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
