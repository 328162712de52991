package io.octavecanon.core.schema;

import io.octavecanon.core.model.Value;
import io.octavecanon.core.model.ValueKind;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One link of a {@link ConstraintChain}.
 *
 * <p>
 * Only {@link Required} fails on {@link Value.Absent}; every other constraint skips an
 * absent value. The two literal zone constraints, {@link LiteralZone} and
 * {@link Lang}, look at the value's variant and info tag. No constraint ever reads
 * {@link Value.LiteralZoneValue#content()}.
 */
public sealed interface Constraint
        permits Constraint.Required,
                Constraint.Optional,
                Constraint.EnumOf,
                Constraint.Regex,
                Constraint.TypeOf,
                Constraint.LiteralZone,
                Constraint.Lang,
                Constraint.Const {

    /** Checks {@code value}; empty when satisfied. */
    java.util.Optional<Violation> check(Value value);

    /** Constraint in chain syntax, e.g. {@code ENUM[A,B]}. */
    String render();

    /** {@code REQ}: the field must be present. {@link Value.Null} counts as present. */
    record Required() implements Constraint {
        @Override
        public java.util.Optional<Violation> check(Value value) {
            if (value instanceof Value.Absent) {
                return java.util.Optional.of(new Violation(
                        ViolationCode.REQUIRED_MISSING, render(), "present", "ABSENT", "required field is missing"));
            }
            return java.util.Optional.empty();
        }

        @Override
        public String render() {
            return "REQ";
        }
    }

    /** {@code OPT}: the field may be omitted. */
    record Optional() implements Constraint {
        @Override
        public java.util.Optional<Violation> check(Value value) {
            return java.util.Optional.empty();
        }

        @Override
        public String render() {
            return "OPT";
        }
    }

    /** {@code ENUM[A,B]}: scalar text must be one of the listed values, case-sensitively. */
    record EnumOf(List<String> allowed) implements Constraint {
        public EnumOf {
            allowed = List.copyOf(allowed);
            if (allowed.isEmpty()) {
                throw new IllegalArgumentException("ENUM needs at least one value");
            }
        }

        @Override
        public java.util.Optional<Violation> check(Value value) {
            if (skips(value)) {
                return java.util.Optional.empty();
            }
            String text = scalarText(value);
            if (text != null && allowed.contains(text)) {
                return java.util.Optional.empty();
            }
            String got = text != null ? text : ValueKind.of(value).name();
            String message = "value '" + got + "' is not one of " + allowed;
            List<String> folded = caseInsensitiveMatches(got);
            if (text != null && folded.size() == 1) {
                message += " (did you mean '" + folded.get(0) + "'? enum case-folding repair is available)";
            }
            return java.util.Optional.of(
                    new Violation(ViolationCode.ENUM_MISMATCH, render(), String.join("|", allowed), got, message));
        }

        /** Allowed values equal to {@code text} ignoring case. */
        public List<String> caseInsensitiveMatches(String text) {
            String lower = text.toLowerCase(Locale.ROOT);
            return allowed.stream()
                    .filter(a -> a.toLowerCase(Locale.ROOT).equals(lower))
                    .toList();
        }

        @Override
        public String render() {
            return "ENUM[" + String.join(",", allowed) + "]";
        }
    }

    /** {@code REGEX[...]}: string text must contain a match (use anchors for a full match). */
    record Regex(Pattern pattern) implements Constraint {
        public Regex {
            Objects.requireNonNull(pattern, "pattern must not be null");
        }

        @Override
        public java.util.Optional<Violation> check(Value value) {
            if (skips(value)) {
                return java.util.Optional.empty();
            }
            if (!(value instanceof Value.StringValue s)) {
                return java.util.Optional.of(typeMismatch(this, ValueKind.STRING.name(), value));
            }
            if (pattern.matcher(s.text()).find()) {
                return java.util.Optional.empty();
            }
            return java.util.Optional.of(new Violation(
                    ViolationCode.PATTERN_MISMATCH,
                    render(),
                    pattern.pattern(),
                    s.text(),
                    "value '" + s.text() + "' does not match /" + pattern.pattern() + "/"));
        }

        @Override
        public String render() {
            return "REGEX[\"" + pattern.pattern().replace("\\", "\\\\").replace("\"", "\\\"") + "\"]";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Regex other && pattern.pattern().equals(other.pattern.pattern());
        }

        @Override
        public int hashCode() {
            return pattern.pattern().hashCode();
        }
    }

    /** {@code TYPE[STRING|NUMBER|BOOLEAN|LIST|MAP]}: value variant check. */
    record TypeOf(ValueKind expected) implements Constraint {
        public TypeOf {
            Objects.requireNonNull(expected, "expected must not be null");
            if (expected == ValueKind.ABSENT
                    || expected == ValueKind.NULL
                    || expected == ValueKind.LITERAL
                    || expected == ValueKind.PATTERN) {
                throw new IllegalArgumentException("TYPE does not accept " + expected);
            }
        }

        @Override
        public java.util.Optional<Violation> check(Value value) {
            if (value instanceof Value.Absent || ValueKind.of(value) == expected) {
                return java.util.Optional.empty();
            }
            return java.util.Optional.of(typeMismatch(this, expected.name(), value));
        }

        @Override
        public String render() {
            return "TYPE[" + expected.name() + "]";
        }
    }

    /** {@code TYPE[LITERAL]}: value must be a literal zone. Checks the variant only. */
    record LiteralZone() implements Constraint {
        @Override
        public java.util.Optional<Violation> check(Value value) {
            if (value instanceof Value.Absent || value instanceof Value.LiteralZoneValue) {
                return java.util.Optional.empty();
            }
            return java.util.Optional.of(typeMismatch(this, ValueKind.LITERAL.name(), value));
        }

        @Override
        public String render() {
            return "TYPE[LITERAL]";
        }
    }

    /**
     * {@code LANG[tag]}: value must be a literal zone whose info tag equals {@code tag},
     * ignoring case. Checks the info tag only.
     */
    record Lang(String tag) implements Constraint {
        public Lang {
            Objects.requireNonNull(tag, "tag must not be null");
            if (tag.isBlank()) {
                throw new IllegalArgumentException("LANG tag must not be blank");
            }
        }

        @Override
        public java.util.Optional<Violation> check(Value value) {
            if (value instanceof Value.Absent) {
                return java.util.Optional.empty();
            }
            if (!(value instanceof Value.LiteralZoneValue zone)) {
                return java.util.Optional.of(typeMismatch(this, ValueKind.LITERAL.name(), value));
            }
            if (zone.infoTag() != null && zone.infoTag().equalsIgnoreCase(tag)) {
                return java.util.Optional.empty();
            }
            String got = zone.infoTag() == null ? "(none)" : zone.infoTag();
            return java.util.Optional.of(new Violation(
                    ViolationCode.LANG_MISMATCH,
                    render(),
                    tag,
                    got,
                    "literal zone info tag is '" + got + "', expected '" + tag + "'"));
        }

        @Override
        public String render() {
            return "LANG[" + tag + "]";
        }
    }

    /** {@code CONST[value]}: scalar text must equal the given value exactly. */
    record Const(String expected) implements Constraint {
        public Const {
            Objects.requireNonNull(expected, "expected must not be null");
        }

        @Override
        public java.util.Optional<Violation> check(Value value) {
            if (skips(value)) {
                return java.util.Optional.empty();
            }
            String text = scalarText(value);
            if (expected.equals(text)) {
                return java.util.Optional.empty();
            }
            String got = text != null ? text : ValueKind.of(value).name();
            return java.util.Optional.of(new Violation(
                    ViolationCode.CONST_MISMATCH,
                    render(),
                    expected,
                    got,
                    "value '" + got + "' must be exactly '" + expected + "'"));
        }

        @Override
        public String render() {
            return "CONST[" + expected + "]";
        }
    }

    /** Text of a string, number or boolean; {@code null} for any other variant. */
    static String scalarText(Value value) {
        if (value instanceof Value.StringValue s) {
            return s.text();
        }
        if (value instanceof Value.NumberValue n) {
            return n.lexeme();
        }
        if (value instanceof Value.BooleanValue b) {
            return Boolean.toString(b.value());
        }
        return null;
    }

    private static boolean skips(Value value) {
        return value instanceof Value.Absent || value instanceof Value.Null;
    }

    private static Violation typeMismatch(Constraint constraint, String expected, Value value) {
        String got = ValueKind.of(value).name();
        return new Violation(
                ViolationCode.TYPE_MISMATCH,
                constraint.render(),
                expected,
                got,
                "expected " + expected + ", got " + got);
    }
}
