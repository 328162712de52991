package io.octavecanon.core.repair;

import io.octavecanon.core.audit.Diagnostic;
import io.octavecanon.core.audit.PipelineStage;
import io.octavecanon.core.audit.RepairEntry;
import io.octavecanon.core.audit.RepairLog;
import io.octavecanon.core.audit.RepairTier;
import io.octavecanon.core.error.LiteralZoneIntegrityException;
import io.octavecanon.core.model.Document;
import io.octavecanon.core.model.Node;
import io.octavecanon.core.model.NodeVisitor;
import io.octavecanon.core.model.Value;
import io.octavecanon.core.model.ValueVisitor;
import io.octavecanon.core.schema.Constraint;
import io.octavecanon.core.schema.ConstraintChain;
import io.octavecanon.core.schema.FieldDefinition;
import io.octavecanon.core.schema.SchemaDefinition;
import io.octavecanon.core.validation.DocumentIndex;
import java.text.Normalizer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Graduated repair of a parsed document.
 *
 * <p>
 * NORMALIZATION (NFC of keys, section headers, comments and string values) always
 * runs. REPAIR rules run only when {@code apply} is {@code true} and a schema field
 * covers the value:
 * <ul>
 * <li>{@code enum_case_fold}: a string that matches exactly one {@code ENUM} value
 * ignoring case becomes that value.</li>
 * <li>{@code type_coerce_number}: a numeric string under {@code TYPE[NUMBER]} becomes a
 * number.</li>
 * <li>{@code type_coerce_boolean}: {@code "true"}/{@code "false"} in any case under
 * {@code TYPE[BOOLEAN]} becomes a boolean.</li>
 * </ul>
 * A value no rule can repair safely is kept unchanged and reported as
 * {@value #W_REPAIR_MISS}. A missing required field would need an invented value; it
 * is reported as {@value #W_FORBIDDEN_REPAIR} and never filled in.
 *
 * <p>
 * The transform builds a new tree. The log is derived from a {@link TreeDiff} of the
 * input and output trees, and every difference must be explained by a rule decision.
 * Each literal zone gets a preservation receipt with its content hash before and after
 * the stage.
 */
public final class RepairEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RepairEngine.class);

    public static final String W_REPAIR_MISS = "W_REPAIR_MISS";
    public static final String W_FORBIDDEN_REPAIR = "W_FORBIDDEN_REPAIR";

    static final String RULE_NFC = "unicode_nfc";
    static final String RULE_ENUM_CASE_FOLD = "enum_case_fold";
    static final String RULE_COERCE_NUMBER = "type_coerce_number";
    static final String RULE_COERCE_BOOLEAN = "type_coerce_boolean";

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private RepairEngine() {
        // utility class
    }

    /**
     * Repairs {@code doc}.
     *
     * @param doc    parsed or programmatically built document; not modified
     * @param schema schema bounding REPAIR rules, or {@code null} for NORMALIZATION only
     * @param apply  whether REPAIR-tier rules run
     * @throws LiteralZoneIntegrityException if a literal zone changed, which indicates a
     *                                       defect in the engine
     */
    public static RepairResult repair(Document doc, SchemaDefinition schema, boolean apply) {
        Objects.requireNonNull(doc, "doc must not be null");
        List<Zone> zonesBefore = zones(doc);

        Rewriter rewriter = new Rewriter(schema, apply);
        Document repaired = rewriter.document(doc);
        forbidden(repaired, schema, rewriter.warnings);

        RepairLog.Builder log = RepairLog.builder();
        log.addAll(reconcile(TreeDiff.diff(doc, repaired), rewriter.decisions));
        log.addAll(receipts(zonesBefore, zones(repaired)));
        RepairLog result = log.build();

        for (RepairEntry entry : result.byTier(RepairTier.REPAIR)) {
            LOG.info(
                    "repair.applied document={} rule={} location={} before={} after={} semantics_changed={}",
                    repaired.name(),
                    entry.ruleId(),
                    entry.location(),
                    entry.before(),
                    entry.after(),
                    entry.semanticsChanged());
        }
        for (Diagnostic warning : rewriter.warnings) {
            LOG.warn("repair.skipped document={} code={} location={} detail={}",
                    repaired.name(), warning.code(), warning.location(), warning.message());
        }
        LOG.debug(
                "repair.completed document={} apply={} changes={} preserved_zones={} warnings={}",
                repaired.name(),
                apply,
                result.changes().size(),
                result.preserved().size(),
                rewriter.warnings.size());
        return new RepairResult(repaired, result, rewriter.warnings);
    }

    /** A rule decision made while rewriting; matched against the tree diff. */
    private record Decision(
            String location,
            TreeDiff.Aspect aspect,
            String before,
            String after,
            String ruleId,
            RepairTier tier,
            boolean semanticsChanged) {}

    private record Zone(String location, String hash) {}

    /**
     * Turns decisions into log entries, checking that they account for every difference
     * and nothing else. Several decisions on one value must chain from the diff's
     * {@code before} to its {@code after}.
     */
    private static List<RepairEntry> reconcile(List<TreeDiff.Difference> diffs, List<Decision> decisions) {
        Deque<Decision> pending = new ArrayDeque<>(decisions);
        List<RepairEntry> entries = new ArrayList<>();
        for (TreeDiff.Difference diff : diffs) {
            String current = diff.before();
            while (!current.equals(diff.after())) {
                Decision decision = pending.pollFirst();
                if (decision == null
                        || !decision.location().equals(diff.location())
                        || decision.aspect() != diff.aspect()
                        || !decision.before().equals(current)) {
                    throw new IllegalStateException("unexplained change at " + diff.location() + " (" + diff.aspect()
                            + "): " + diff.before() + " -> " + diff.after());
                }
                entries.add(new RepairEntry(
                        PipelineStage.REPAIR,
                        RepairEntry.Kind.CHANGE,
                        decision.location(),
                        decision.ruleId(),
                        decision.before(),
                        decision.after(),
                        decision.tier(),
                        decision.semanticsChanged()));
                current = decision.after();
            }
        }
        if (!pending.isEmpty()) {
            Decision extra = pending.peekFirst();
            throw new IllegalStateException(
                    "decision without a change at " + extra.location() + ": rule " + extra.ruleId());
        }
        return entries;
    }

    private static List<RepairEntry> receipts(List<Zone> before, List<Zone> after) {
        if (before.size() != after.size()) {
            throw new LiteralZoneIntegrityException(
                    "literal zone count changed during repair: " + before.size() + " -> " + after.size());
        }
        List<RepairEntry> entries = new ArrayList<>();
        for (int i = 0; i < before.size(); i++) {
            Zone pre = before.get(i);
            Zone post = after.get(i);
            if (!pre.hash().equals(post.hash())) {
                throw new LiteralZoneIntegrityException(post.location(), pre.hash(), post.hash());
            }
            entries.add(RepairEntry.preserved(PipelineStage.REPAIR, post.location(), pre.hash(), post.hash()));
        }
        return entries;
    }

    private static List<Zone> zones(Document doc) {
        List<Zone> zones = new ArrayList<>();
        collectZones(doc.meta(), "META", zones);
        collectZones(doc.body(), "", zones);
        return zones;
    }

    private static void collectZones(List<Node> nodes, String parent, List<Zone> out) {
        for (Node node : nodes) {
            if (node instanceof Node.Assignment a && a.value() instanceof Value.LiteralZoneValue zone) {
                String location = a.isBareZone() ? parent : TreeDiff.join(parent, a.key());
                out.add(new Zone(location, ContentHash.sha256(zone.content())));
            } else if (node instanceof Node.Block b) {
                collectZones(b.children(), TreeDiff.join(parent, b.key()), out);
            } else if (node instanceof Node.Section s) {
                collectZones(s.children(), TreeDiff.join(parent, s.name()), out);
            }
        }
    }

    private static void forbidden(Document repaired, SchemaDefinition schema, List<Diagnostic> warnings) {
        if (schema == null) {
            return;
        }
        DocumentIndex index = DocumentIndex.of(repaired);
        for (FieldDefinition field : schema.fields()) {
            if (field.chain().isRequired() && index.value(field.path()) instanceof Value.Absent) {
                warnings.add(new Diagnostic(
                        W_FORBIDDEN_REPAIR,
                        "required field is missing; inventing a value would guess intent, so it is left absent",
                        field.path()));
            }
        }
    }

    static String nfc(String text) {
        return Normalizer.normalize(text, Normalizer.Form.NFC);
    }

    /** Builds the repaired tree and records a decision for every rewrite. */
    private static final class Rewriter {

        private final SchemaDefinition schema;
        private final boolean apply;
        private final List<Decision> decisions = new ArrayList<>();
        private final List<Diagnostic> warnings = new ArrayList<>();

        Rewriter(SchemaDefinition schema, boolean apply) {
            this.schema = schema;
            this.apply = apply;
        }

        Document document(Document doc) {
            return new Document(
                    doc.name(),
                    doc.frontmatter(),
                    nodes(doc.meta(), "META"),
                    doc.separator(),
                    nodes(doc.body(), ""));
        }

        private List<Node> nodes(List<Node> nodes, String parent) {
            List<Node> out = new ArrayList<>(nodes.size());
            NodeVisitor<Node> visitor = new NodeVisitor<>() {
                @Override
                public Node visitAssignment(Node.Assignment assignment) {
                    String key = nfc(assignment.key());
                    String path = TreeDiff.join(parent, key);
                    if (!key.equals(assignment.key())) {
                        normalized(path, TreeDiff.Aspect.KEY, assignment.key(), key);
                    }
                    Value original = assignment.value();
                    if (original instanceof Value.LiteralZoneValue) {
                        return key.equals(assignment.key()) ? assignment : new Node.Assignment(key, original);
                    }
                    Value value = original.accept(VALUE_NFC);
                    if (!value.equals(original)) {
                        normalized(path, TreeDiff.Aspect.VALUE, TreeDiff.render(original), TreeDiff.render(value));
                    }
                    value = repairValue(path, value);
                    if (key.equals(assignment.key()) && value.equals(original)) {
                        return assignment;
                    }
                    return new Node.Assignment(key, value);
                }

                @Override
                public Node visitBlock(Node.Block block) {
                    String key = nfc(block.key());
                    String path = TreeDiff.join(parent, key);
                    if (!key.equals(block.key())) {
                        normalized(path, TreeDiff.Aspect.KEY, block.key(), key);
                    }
                    return new Node.Block(key, nodes(block.children(), path));
                }

                @Override
                public Node visitSection(Node.Section section) {
                    String annotation = section.annotation() == null ? null : nfc(section.annotation());
                    Node.Section header =
                            new Node.Section(nfc(section.id()), nfc(section.name()), annotation, List.of());
                    String path = TreeDiff.join(parent, header.name());
                    String before = TreeDiff.section(section);
                    String after = TreeDiff.section(header);
                    if (!before.equals(after)) {
                        normalized(path, TreeDiff.Aspect.SECTION, before, after);
                    }
                    return new Node.Section(
                            header.id(), header.name(), header.annotation(), nodes(section.children(), path));
                }

                @Override
                public Node visitComment(Node.Comment comment) {
                    String text = nfc(comment.text());
                    if (text.equals(comment.text())) {
                        return comment;
                    }
                    normalized(TreeDiff.commentPath(parent), TreeDiff.Aspect.COMMENT, comment.text(), text);
                    return new Node.Comment(text);
                }
            };
            for (Node node : nodes) {
                out.add(node.accept(visitor));
            }
            return out;
        }

        private void normalized(String location, TreeDiff.Aspect aspect, String before, String after) {
            decisions.add(new Decision(location, aspect, before, after, RULE_NFC, RepairTier.NORMALIZATION, false));
        }

        private Value repairValue(String path, Value value) {
            if (schema == null || !(value instanceof Value.StringValue string)) {
                return value;
            }
            FieldDefinition field = schema.field(path).orElse(null);
            if (field == null) {
                return value;
            }
            ConstraintChain chain = field.chain();
            Constraint.EnumOf enumOf = chain.find(Constraint.EnumOf.class);
            if (enumOf != null && !enumOf.allowed().contains(string.text())) {
                return enumCaseFold(path, string, enumOf);
            }
            Constraint.TypeOf type = chain.find(Constraint.TypeOf.class);
            if (type == null) {
                return value;
            }
            switch (type.expected()) {
                case NUMBER:
                    return coerceNumber(path, string);
                case BOOLEAN:
                    return coerceBoolean(path, string);
                default:
                    return value;
            }
        }

        private Value enumCaseFold(String path, Value.StringValue string, Constraint.EnumOf enumOf) {
            List<String> matches = enumOf.caseInsensitiveMatches(string.text());
            if (matches.size() != 1) {
                miss(path, RULE_ENUM_CASE_FOLD, matches.isEmpty()
                        ? "'" + string.text() + "' matches no value of " + enumOf.render()
                        : "'" + string.text() + "' matches several values of " + enumOf.render() + ": " + matches);
                return string;
            }
            return applied(path, string, new Value.StringValue(matches.get(0)), RULE_ENUM_CASE_FOLD, false);
        }

        private Value coerceNumber(String path, Value.StringValue string) {
            String text = string.text().strip();
            if (!NUMBER.matcher(text).matches()) {
                miss(path, RULE_COERCE_NUMBER, "'" + string.text() + "' is not a number");
                return string;
            }
            return applied(path, string, new Value.NumberValue(text), RULE_COERCE_NUMBER, true);
        }

        private Value coerceBoolean(String path, Value.StringValue string) {
            String text = string.text().strip().toLowerCase(Locale.ROOT);
            if (!text.equals("true") && !text.equals("false")) {
                miss(path, RULE_COERCE_BOOLEAN, "'" + string.text() + "' is not a boolean");
                return string;
            }
            return applied(path, string, Value.BooleanValue.of(text.equals("true")), RULE_COERCE_BOOLEAN, true);
        }

        private Value applied(String path, Value before, Value after, String ruleId, boolean semanticsChanged) {
            if (!apply) {
                return before;
            }
            decisions.add(new Decision(
                    path,
                    TreeDiff.Aspect.VALUE,
                    TreeDiff.render(before),
                    TreeDiff.render(after),
                    ruleId,
                    RepairTier.REPAIR,
                    semanticsChanged));
            return after;
        }

        private void miss(String path, String ruleId, String detail) {
            if (apply) {
                warnings.add(new Diagnostic(W_REPAIR_MISS, ruleId + ": " + detail + "; value kept", path));
            }
        }
    }

    private static final ValueVisitor<Value> VALUE_NFC = new ValueVisitor<>() {
        @Override
        public Value visitString(Value.StringValue value) {
            String text = nfc(value.text());
            return text.equals(value.text()) ? value : new Value.StringValue(text);
        }

        @Override
        public Value visitNumber(Value.NumberValue value) {
            return value;
        }

        @Override
        public Value visitBoolean(Value.BooleanValue value) {
            return value;
        }

        @Override
        public Value visitList(Value.ListValue value) {
            List<Value> items = new ArrayList<>(value.items().size());
            for (Value item : value.items()) {
                items.add(item.accept(this));
            }
            return items.equals(value.items()) ? value : new Value.ListValue(items);
        }

        @Override
        public Value visitInlineMap(Value.InlineMap value) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (Map.Entry<String, Value> entry : value.entries().entrySet()) {
                entries.put(nfc(entry.getKey()), entry.getValue().accept(this));
            }
            if (entries.size() != value.entries().size()) {
                // keys that differ only in normalization would collapse
                return value;
            }
            Value.InlineMap normalized = new Value.InlineMap(entries);
            return normalized.equals(value) ? value : normalized;
        }

        @Override
        public Value visitLiteralZone(Value.LiteralZoneValue value) {
            return value;
        }

        @Override
        public Value visitHolographic(Value.HolographicValue value) {
            Value example = value.example().accept(this);
            String constraints = nfc(value.constraints());
            String target = value.target() == null ? null : nfc(value.target());
            Value.HolographicValue normalized = new Value.HolographicValue(example, constraints, target);
            return normalized.equals(value) ? value : normalized;
        }

        @Override
        public Value visitAbsent(Value.Absent value) {
            return value;
        }

        @Override
        public Value visitNull(Value.Null value) {
            return value;
        }
    };
}
