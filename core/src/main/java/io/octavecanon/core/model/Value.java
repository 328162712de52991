package io.octavecanon.core.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Closed set of values an assignment can hold.
 *
 * <p>
 * Consumers match exhaustively through {@link #accept(ValueVisitor)}: adding a variant
 * adds a method to {@link ValueVisitor}, so every consumer that forgets the new case
 * stops compiling.
 *
 * <p>
 * {@link Absent}, {@link Null} and a present value are three different states.
 * {@link LiteralZoneValue#content()} is opaque: nothing in the engine normalizes,
 * escapes or validates it.
 */
public sealed interface Value
        permits Value.Scalar,
                Value.ListValue,
                Value.InlineMap,
                Value.LiteralZoneValue,
                Value.HolographicValue,
                Value.Absent,
                Value.Null {

    <R> R accept(ValueVisitor<R> visitor);

    /** String, number or boolean. */
    sealed interface Scalar extends Value permits StringValue, NumberValue, BooleanValue {}

    /** Text value; normalized to NFC like the rest of the normalizing zone. */
    record StringValue(String text) implements Scalar {
        public StringValue {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    /**
     * Numeric value. The lexeme is kept as written so that {@code 1.50} and {@code 1.5}
     * stay distinct canonical forms.
     */
    record NumberValue(String lexeme) implements Scalar {
        public NumberValue {
            Objects.requireNonNull(lexeme, "lexeme must not be null");
            try {
                new BigDecimal(lexeme);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a number: '" + lexeme + "'", e);
            }
        }

        public BigDecimal decimal() {
            return new BigDecimal(lexeme);
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record BooleanValue(boolean value) implements Scalar {
        public static final BooleanValue TRUE = new BooleanValue(true);
        public static final BooleanValue FALSE = new BooleanValue(false);

        public static BooleanValue of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    /** Ordered sequence. Items may be any value except {@link Absent} and literal zones. */
    record ListValue(List<Value> items) implements Value {
        public ListValue {
            items = List.copyOf(items);
            for (Value item : items) {
                if (item instanceof Absent || item instanceof LiteralZoneValue) {
                    throw new IllegalArgumentException(
                            "list items cannot be " + item.getClass().getSimpleName());
                }
            }
        }

        public static ListValue of(Value... items) {
            return new ListValue(List.of(items));
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitList(this);
        }
    }

    /**
     * Ordered, non-empty mapping of keys to atomic values ({@link Scalar} or
     * {@link Null}). Nesting is not allowed.
     */
    record InlineMap(Map<String, Value> entries) implements Value {
        public InlineMap {
            Objects.requireNonNull(entries, "entries must not be null");
            if (entries.isEmpty()) {
                throw new IllegalArgumentException("inline map must have at least one entry");
            }
            Map<String, Value> copy = new LinkedHashMap<>();
            entries.forEach((key, value) -> {
                Objects.requireNonNull(key, "inline map key must not be null");
                Objects.requireNonNull(value, "inline map value must not be null");
                if (!(value instanceof Scalar) && !(value instanceof Null)) {
                    throw new IllegalArgumentException("inline map value for '" + key + "' must be atomic, got "
                            + value.getClass().getSimpleName());
                }
                copy.put(key, value);
            });
            entries = Collections.unmodifiableMap(copy);
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitInlineMap(this);
        }

        /** Entry order is part of the value. */
        @Override
        public boolean equals(Object o) {
            return o instanceof InlineMap other
                    && List.copyOf(entries.entrySet()).equals(List.copyOf(other.entries.entrySet()));
        }

        @Override
        public int hashCode() {
            return List.copyOf(entries.entrySet()).hashCode();
        }
    }

    /**
     * Fenced literal zone.
     *
     * @param content     verbatim text between the fences, {@code ""} for an empty zone
     * @param infoTag     language or format tag after the opening fence, or {@code null}
     * @param fenceMarker backtick run of length three or more
     */
    record LiteralZoneValue(String content, String infoTag, String fenceMarker) implements Value {
        public LiteralZoneValue {
            Objects.requireNonNull(content, "content must not be null");
            Objects.requireNonNull(fenceMarker, "fenceMarker must not be null");
            if (fenceMarker.length() < 3 || !fenceMarker.chars().allMatch(c -> c == '`')) {
                throw new IllegalArgumentException("fence marker must be three or more backticks: " + fenceMarker);
            }
            if (infoTag != null
                    && (infoTag.isBlank()
                            || !infoTag.equals(infoTag.strip())
                            || infoTag.chars().anyMatch(c -> c == '`' || c == '\n' || c == '\r'))) {
                throw new IllegalArgumentException("invalid info tag: '" + infoTag + "'");
            }
            for (String line : content.split("\n", -1)) {
                if (fenceRun(line) >= fenceMarker.length()) {
                    throw new IllegalArgumentException("content contains a fence line at least as long as "
                            + fenceMarker + "; use a longer fence marker");
                }
            }
        }

        /** Length of the backtick run if {@code line} has the shape of a fence line, else 0. */
        private static int fenceRun(String line) {
            int i = 0;
            while (i < line.length() && line.charAt(i) == ' ') {
                i++;
            }
            int start = i;
            while (i < line.length() && line.charAt(i) == '`') {
                i++;
            }
            int run = i - start;
            if (run < 3 || line.indexOf('`', i) >= 0) {
                return 0;
            }
            return run;
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitLiteralZone(this);
        }

        /** Content is deliberately left out: it may be large or sensitive. */
        @Override
        public String toString() {
            return "LiteralZoneValue[infoTag=" + infoTag + ", fenceMarker=" + fenceMarker + ", length="
                    + content.length() + "]";
        }
    }

    /**
     * Holographic pattern {@code ["ACTIVE"∧REQ∧ENUM[ACTIVE,DRAFT]→§INDEXER]}: an example
     * value, the constraints a real value must meet, and the section it flows to.
     *
     * @param example     example value; a scalar, {@code null} or a list
     * @param constraints constraint chain as written, e.g. {@code REQ∧ENUM[ACTIVE,DRAFT]}
     * @param target      section name after {@code →§}, or {@code null}
     */
    record HolographicValue(Value example, String constraints, String target) implements Value {
        public HolographicValue {
            Objects.requireNonNull(example, "example must not be null");
            Objects.requireNonNull(constraints, "constraints must not be null");
            if (!(example instanceof Scalar || example instanceof Null || example instanceof ListValue)) {
                throw new IllegalArgumentException("pattern example must be a scalar, null or a list");
            }
            if (constraints.isBlank()) {
                throw new IllegalArgumentException("constraints must not be blank");
            }
            if (target != null && target.isBlank()) {
                throw new IllegalArgumentException("target must be null or non-blank");
            }
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitHolographic(this);
        }
    }

    /** Field was never provided. Never emitted and never read back as {@link Null}. */
    record Absent() implements Value {
        public static final Absent INSTANCE = new Absent();

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitAbsent(this);
        }
    }

    /** Field was provided and is explicitly empty. */
    record Null() implements Value {
        public static final Null INSTANCE = new Null();

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitNull(this);
        }
    }
}
