package io.octavecanon.core.validation;

import io.octavecanon.core.model.Document;
import io.octavecanon.core.model.Node;
import io.octavecanon.core.model.NodeVisitor;
import io.octavecanon.core.model.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattened view of a document addressed by dotted path.
 *
 * <p>
 * META assignments live under {@code META}, top-level assignments under their own key,
 * block children under {@code BLOCK.KEY} and section children under
 * {@code SECTION_NAME.KEY}. When a key repeats in one container the last occurrence
 * wins.
 */
public final class DocumentIndex {

    private final Map<String, Value> values = new LinkedHashMap<>();
    private final Map<String, Set<String>> containers = new LinkedHashMap<>();
    private final List<LiteralZoneReport> literalZones = new ArrayList<>();

    private DocumentIndex() {}

    public static DocumentIndex of(Document doc) {
        DocumentIndex index = new DocumentIndex();
        index.containers.put("META", new LinkedHashSet<>());
        index.containers.put("", new LinkedHashSet<>());
        index.walk(doc.meta(), "META");
        index.walk(doc.body(), "");
        return index;
    }

    /** Value at {@code path}, or {@link Value.Absent}. */
    public Value value(String path) {
        return values.getOrDefault(path, Value.Absent.INSTANCE);
    }

    /** Keys of the container at {@code path} in first-seen order; empty if there is none. */
    public Set<String> keys(String containerPath) {
        return containers.getOrDefault(containerPath, Set.of());
    }

    public boolean hasContainer(String containerPath) {
        return containers.containsKey(containerPath);
    }

    public List<LiteralZoneReport> literalZones() {
        return List.copyOf(literalZones);
    }

    static String join(String parent, String key) {
        return parent.isEmpty() ? key : parent + "." + key;
    }

    private void walk(List<Node> nodes, String parent) {
        Set<String> keys = containers.computeIfAbsent(parent, p -> new LinkedHashSet<>());
        for (Node node : nodes) {
            node.accept(new NodeVisitor<Void>() {
                @Override
                public Void visitAssignment(Node.Assignment assignment) {
                    if (assignment.isBareZone()) {
                        Value.LiteralZoneValue zone = (Value.LiteralZoneValue) assignment.value();
                        literalZones.add(new LiteralZoneReport(parent, zone.infoTag()));
                        return null;
                    }
                    String path = join(parent, assignment.key());
                    keys.add(assignment.key());
                    values.put(path, assignment.value());
                    if (assignment.value() instanceof Value.LiteralZoneValue zone) {
                        literalZones.add(new LiteralZoneReport(path, zone.infoTag()));
                    }
                    return null;
                }

                @Override
                public Void visitBlock(Node.Block block) {
                    keys.add(block.key());
                    walk(block.children(), join(parent, block.key()));
                    return null;
                }

                @Override
                public Void visitSection(Node.Section section) {
                    keys.add(section.name());
                    walk(section.children(), join(parent, section.name()));
                    return null;
                }

                @Override
                public Void visitComment(Node.Comment comment) {
                    return null;
                }
            });
        }
    }
}
