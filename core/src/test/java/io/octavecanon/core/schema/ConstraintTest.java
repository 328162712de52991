package io.octavecanon.core.schema;

import static org.assertj.core.api.Assertions.assertThat;

import io.octavecanon.core.model.Value;
import io.octavecanon.core.model.ValueKind;
import java.util.List;
import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConstraintTest {

    private static final Value.LiteralZoneValue PYTHON = new Value.LiteralZoneValue("print(1)", "python", "```");
    private static final Value.LiteralZoneValue JSON = new Value.LiteralZoneValue("{}", "json", "```");

    @Nested
    @DisplayName("Literal zone constraints")
    class LiteralZones {

        private final ConstraintChain pythonZone = ConstraintChain.parse("TYPE[LITERAL]∧LANG[python]");

        @Test
        @DisplayName("A plain string fails the variant check")
        void plainString() {
            List<Violation> violations = pythonZone.check(new Value.StringValue("print(1)"));

            assertThat(violations).extracting(Violation::code).containsOnly(ViolationCode.TYPE_MISMATCH);
            assertThat(violations.get(0).expected()).isEqualTo("LITERAL");
            assertThat(violations.get(0).got()).isEqualTo("STRING");
        }

        @Test
        @DisplayName("A zone with the wrong tag reports a tag mismatch")
        void wrongTag() {
            assertThat(pythonZone.check(JSON))
                    .singleElement()
                    .satisfies(v -> {
                        assertThat(v.code()).isEqualTo(ViolationCode.LANG_MISMATCH);
                        assertThat(v.code().code()).isEqualTo("E011");
                        assertThat(v.expected()).isEqualTo("python");
                        assertThat(v.got()).isEqualTo("json");
                    });
        }

        @Test
        void matchingTag() {
            assertThat(pythonZone.check(PYTHON)).isEmpty();
            assertThat(new Constraint.Lang("PYTHON").check(PYTHON)).isEmpty();
        }

        @Test
        @DisplayName("A zone without a tag reports (none)")
        void missingTag() {
            Value.LiteralZoneValue untagged = new Value.LiteralZoneValue("x", null, "```");

            assertThat(new Constraint.Lang("python").check(untagged))
                    .hasValueSatisfying(v -> assertThat(v.got()).isEqualTo("(none)"));
        }
    }

    @Nested
    @DisplayName("Presence")
    class Presence {

        @Test
        @DisplayName("REQ fails only on absent; null counts as present")
        void required() {
            Constraint.Required req = new Constraint.Required();

            assertThat(req.check(Value.Absent.INSTANCE))
                    .hasValueSatisfying(v -> assertThat(v.code()).isEqualTo(ViolationCode.REQUIRED_MISSING));
            assertThat(req.check(Value.Null.INSTANCE)).isEmpty();
        }

        @Test
        @DisplayName("Other constraints skip absent values")
        void othersSkipAbsent() {
            ConstraintChain chain = ConstraintChain.parse("OPT∧ENUM[A]∧TYPE[STRING]∧REGEX[x]∧LANG[py]∧CONST[A]");

            assertThat(chain.check(Value.Absent.INSTANCE)).isEmpty();
        }

        @Test
        @DisplayName("TYPE does not accept null")
        void typeRejectsNull() {
            assertThat(new Constraint.TypeOf(ValueKind.STRING).check(Value.Null.INSTANCE))
                    .hasValueSatisfying(v -> assertThat(v.got()).isEqualTo("NULL"));
        }
    }

    @Nested
    @DisplayName("Scalar constraints")
    class Scalars {

        @Test
        @DisplayName("ENUM is case-sensitive and hints at the case-folded candidate")
        void enumCaseHint() {
            Constraint.EnumOf mode = new Constraint.EnumOf(List.of("fast", "slow"));

            assertThat(mode.check(new Value.StringValue("fast"))).isEmpty();
            assertThat(mode.check(new Value.StringValue("FAST")))
                    .hasValueSatisfying(v -> {
                        assertThat(v.code()).isEqualTo(ViolationCode.ENUM_MISMATCH);
                        assertThat(v.message()).contains("did you mean 'fast'?");
                    });
            assertThat(mode.check(new Value.StringValue("medium")))
                    .hasValueSatisfying(v -> assertThat(v.message()).doesNotContain("did you mean"));
        }

        @Test
        @DisplayName("ENUM compares numbers and booleans by their text")
        void enumOfNumbers() {
            Constraint.EnumOf versions = new Constraint.EnumOf(List.of("1", "2"));

            assertThat(versions.check(new Value.NumberValue("2"))).isEmpty();
            assertThat(versions.check(Value.ListValue.of())).isPresent();
        }

        @Test
        @DisplayName("REGEX searches, anchors make it a full match")
        void regex() {
            assertThat(new Constraint.Regex(Pattern.compile("\\d+")).check(new Value.StringValue("v12"))).isEmpty();
            assertThat(new Constraint.Regex(Pattern.compile("^\\d+$")).check(new Value.StringValue("v12")))
                    .hasValueSatisfying(v -> assertThat(v.code()).isEqualTo(ViolationCode.PATTERN_MISMATCH));
            assertThat(new Constraint.Regex(Pattern.compile("x")).check(new Value.NumberValue("1")))
                    .hasValueSatisfying(v -> assertThat(v.code()).isEqualTo(ViolationCode.TYPE_MISMATCH));
        }

        @Test
        void typeCheck() {
            assertThat(new Constraint.TypeOf(ValueKind.NUMBER).check(new Value.NumberValue("8080"))).isEmpty();
            assertThat(new Constraint.TypeOf(ValueKind.NUMBER).check(new Value.StringValue("8080")))
                    .hasValueSatisfying(v -> assertThat(v.message()).isEqualTo("expected NUMBER, got STRING"));
        }

        @Test
        void constCheck() {
            assertThat(new Constraint.Const("v1").check(new Value.StringValue("v1"))).isEmpty();
            assertThat(new Constraint.Const("v1").check(new Value.StringValue("v2")))
                    .hasValueSatisfying(v -> assertThat(v.code()).isEqualTo(ViolationCode.CONST_MISMATCH));
        }
    }

    @Test
    @DisplayName("Regex constraints compare by pattern text")
    void regexEquality() {
        assertThat(new Constraint.Regex(Pattern.compile("a+"))).isEqualTo(new Constraint.Regex(Pattern.compile("a+")));
    }
}
