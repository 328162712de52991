package io.octavecanon.core.model;

/**
 * Exhaustive match over {@link Value}. One method per variant; implementations that
 * miss a variant do not compile.
 *
 * @param <R> result type
 */
public interface ValueVisitor<R> {

    R visitString(Value.StringValue value);

    R visitNumber(Value.NumberValue value);

    R visitBoolean(Value.BooleanValue value);

    R visitList(Value.ListValue value);

    R visitInlineMap(Value.InlineMap value);

    R visitLiteralZone(Value.LiteralZoneValue value);

    R visitHolographic(Value.HolographicValue value);

    R visitAbsent(Value.Absent value);

    R visitNull(Value.Null value);
}
