package io.octavecanon.core.model;

/** Kind of a {@link Value}, as named in type constraints and validation messages. */
public enum ValueKind {
    STRING,
    NUMBER,
    BOOLEAN,
    LIST,
    MAP,
    LITERAL,
    PATTERN,
    NULL,
    ABSENT;

    private static final ValueVisitor<ValueKind> CLASSIFIER = new ValueVisitor<>() {
        @Override
        public ValueKind visitString(Value.StringValue value) {
            return STRING;
        }

        @Override
        public ValueKind visitNumber(Value.NumberValue value) {
            return NUMBER;
        }

        @Override
        public ValueKind visitBoolean(Value.BooleanValue value) {
            return BOOLEAN;
        }

        @Override
        public ValueKind visitList(Value.ListValue value) {
            return LIST;
        }

        @Override
        public ValueKind visitInlineMap(Value.InlineMap value) {
            return MAP;
        }

        @Override
        public ValueKind visitLiteralZone(Value.LiteralZoneValue value) {
            return LITERAL;
        }

        @Override
        public ValueKind visitHolographic(Value.HolographicValue value) {
            return PATTERN;
        }

        @Override
        public ValueKind visitAbsent(Value.Absent value) {
            return ABSENT;
        }

        @Override
        public ValueKind visitNull(Value.Null value) {
            return NULL;
        }
    };

    public static ValueKind of(Value value) {
        return value.accept(CLASSIFIER);
    }
}
