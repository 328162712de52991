package io.octavecanon.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.octavecanon.core.audit.RepairEntry;
import io.octavecanon.core.audit.RepairTier;
import io.octavecanon.core.config.CanonConfig;
import io.octavecanon.core.emit.EmitOptions;
import io.octavecanon.core.error.ErrorCode;
import io.octavecanon.core.error.LexException;
import io.octavecanon.core.error.ParseException;
import io.octavecanon.core.model.Document;
import io.octavecanon.core.model.Value;
import io.octavecanon.core.parser.Parser;
import io.octavecanon.core.schema.SchemaDefinition;
import io.octavecanon.core.schema.UnknownFieldPolicy;
import io.octavecanon.core.schema.ViolationCode;
import io.octavecanon.core.spi.PipelineListener;
import io.octavecanon.core.validation.ValidationError;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CanonEngineTest {

    private static final String SOURCE = "===JOB===\n"
            + "META:\n"
            + "  TYPE::\"task\"\n"
            + "---\n"
            + "MODE::FAST\n"
            + "CODE::\n"
            + "```python\n"
            + "print(1)\n"
            + "```\n"
            + "===END===";

    private static final SchemaDefinition SCHEMA = SchemaDefinition.builder("JOB_SCHEMA", "1.0")
            .field("MODE", "REQ∧ENUM[fast,slow]")
            .field("CODE", "OPT∧LANG[python]")
            .build();

    /** Records every event it receives. */
    static final class RecordingListener implements PipelineListener {
        final List<CanonicalizationCompletedEvent> completed = new ArrayList<>();
        final List<CanonicalizationFailedEvent> failed = new ArrayList<>();
        final List<RepairAppliedEvent> repairs = new ArrayList<>();

        @Override
        public void onCanonicalizationCompleted(CanonicalizationCompletedEvent event) {
            completed.add(event);
        }

        @Override
        public void onCanonicalizationFailed(CanonicalizationFailedEvent event) {
            failed.add(event);
        }

        @Override
        public void onRepairApplied(RepairAppliedEvent event) {
            repairs.add(event);
        }
    }

    @Nested
    @DisplayName("Full pipeline")
    class Pipeline {

        @Test
        @DisplayName("Without repair the enum mismatch is reported by validation")
        void repairOff() {
            CanonicalizationResult result = new CanonEngine().canonicalize(SOURCE, SCHEMA);

            assertThat(result.document().name()).isEqualTo("JOB");
            assertThat(result.validation().valid()).isFalse();
            assertThat(result.validation().errors())
                    .extracting(ValidationError::code, ValidationError::fieldPath)
                    .containsExactly(tuple(ViolationCode.ENUM_MISMATCH, "MODE"));
            assertThat(result.validation().status().label()).isEqualTo("VALIDATED(JOB_SCHEMA, 1.0)");
            assertThat(result.canonicalText()).contains("MODE::FAST");
        }

        @Test
        @DisplayName("With repair the enum is folded and the document validates")
        void repairOn() {
            CanonEngine engine =
                    new CanonEngine(CanonConfig.builder().repairApply(true).build());

            CanonicalizationResult result = engine.canonicalize(SOURCE, SCHEMA);

            assertThat(result.validation().valid()).isTrue();
            assertThat(result.document().bodyValue("MODE")).isEqualTo(new Value.StringValue("fast"));
            assertThat(result.canonicalText()).contains("MODE::fast").doesNotContain("FAST");
            assertThat(result.repairLog().byTier(RepairTier.REPAIR))
                    .extracting(RepairEntry::ruleId)
                    .containsExactly("enum_case_fold");
        }

        @Test
        @DisplayName("Literal zone content reaches the output byte for byte with a receipt")
        void zonePreserved() {
            CanonicalizationResult result = new CanonEngine().canonicalize(SOURCE, SCHEMA);

            assertThat(result.canonicalText()).contains("```python\nprint(1)\n```");
            assertThat(result.repairLog().preserved())
                    .singleElement()
                    .extracting(RepairEntry::location)
                    .isEqualTo("CODE");
            assertThat(result.validation().literalZonesValidated()).isFalse();
            assertThat(result.validation().literalZones()).hasSize(1);
        }

        @Test
        @DisplayName("Without a schema the result is UNVALIDATED and valid")
        void noSchema() {
            CanonicalizationResult result = new CanonEngine().canonicalize(SOURCE);

            assertThat(result.validation().valid()).isTrue();
            assertThat(result.validation().status().label()).isEqualTo("UNVALIDATED");
        }

        @Test
        @DisplayName("Tokenizer and parser normalizations lead the repair log")
        void normalizationsFirst() {
            CanonicalizationResult result = new CanonEngine().canonicalize("A::X->Y");

            assertThat(result.repairLog().changes())
                    .first()
                    .satisfies(entry -> assertThat(entry.tier()).isEqualTo(RepairTier.NORMALIZATION));
            assertThat(result.document().name()).isEqualTo(Parser.INFERRED_NAME);
        }

        @ParameterizedTest
        @DisplayName("Canonicalizing canonical output changes nothing")
        @ValueSource(
                strings = {
                    "A::1",
                    "===DOC===\nB:\n  C::[x, 2 ,true]\n===END===",
                    "KEY::\"hello world\"\n// note",
                    "X::a->b",
                    "CODE::\n````md\n```js\nx\n```\n````",
                    "§1::INTRO\n  TEXT::hi",
                    "§1::INTRO[two words]\n  NOTE:\n    ```\n    raw\n    ```",
                    "STATUS::[\"ACTIVE\"∧REQ∧ENUM[ACTIVE,DRAFT]→§INDEXER]",
                    "RULE::NEVER{A,B}\nPATTERN::x"
                })
        void idempotent(String text) {
            CanonEngine engine = new CanonEngine();
            String once = engine.canonicalize(text).canonicalText();

            assertThat(engine.canonicalize(once).canonicalText()).isEqualTo(once);
        }
    }

    @Test
    @DisplayName("Emit options are passed through to the emitter")
    void emitWithOptions() {
        CanonEngine engine = new CanonEngine();
        Document doc = engine.parse("B::2\n// note\nA::1").document();

        assertThat(engine.emit(doc, EmitOptions.builder().sortKeys(true).stripComments(true).build()))
                .isEqualTo("===INFERRED===\nA::1\nB::2\n===END===\n");
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Lexical errors propagate with no partial result")
        void lexErrorPropagates() {
            assertThatThrownBy(() -> new CanonEngine().canonicalize("A::\t1"))
                    .isInstanceOf(LexException.class)
                    .satisfies(e -> assertThat(((LexException) e).errorCode()).isEqualTo(ErrorCode.TAB));
        }

        @Test
        void parseErrorPropagates() {
            assertThatThrownBy(() -> new CanonEngine().canonicalize("A:1"))
                    .isInstanceOf(ParseException.class);
        }

        @Test
        @DisplayName("Inputs above the configured bound are rejected")
        void maxInputChars() {
            CanonEngine engine = new CanonEngine(CanonConfig.builder().maxInputChars(8).build());

            assertThatThrownBy(() -> engine.canonicalize("LONG::value"))
                    .isInstanceOf(LexException.class)
                    .satisfies(e -> assertThat(((LexException) e).errorCode()).isEqualTo(ErrorCode.INPUT_TOO_LARGE));
            assertThat(engine.canonicalize("A::1").canonicalText()).isEqualTo("===INFERRED===\nA::1\n===END===\n");
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("The unknown-field override replaces the schema's own policy")
        void unknownFieldsOverride() {
            SchemaDefinition warnSchema = SchemaDefinition.builder("S", "1")
                    .field("A", "OPT")
                    .unknownFields(UnknownFieldPolicy.WARN)
                    .build();
            String text = "A::1\nEXTRA::2";

            CanonicalizationResult warned = new CanonEngine().canonicalize(text, warnSchema);
            CanonicalizationResult rejected = new CanonEngine(CanonConfig.builder()
                            .unknownFieldsOverride(UnknownFieldPolicy.REJECT)
                            .build())
                    .canonicalize(text, warnSchema);

            assertThat(warned.validation().valid()).isTrue();
            assertThat(warned.warnings()).anySatisfy(w -> assertThat(w.location()).isEqualTo("EXTRA"));
            assertThat(rejected.validation().valid()).isFalse();
            assertThat(rejected.validation().errors())
                    .singleElement()
                    .satisfies(e -> assertThat(e.code()).isEqualTo(ViolationCode.UNKNOWN_FIELD));
        }

        @Test
        @DisplayName("repair(doc, schema) follows repair.apply")
        void repairFollowsConfig() {
            CanonEngine off = new CanonEngine();
            CanonEngine on = new CanonEngine(CanonConfig.builder().repairApply(true).build());

            assertThat(off.repair(off.parse("MODE::FAST").document(), SCHEMA)
                            .document()
                            .bodyValue("MODE"))
                    .isEqualTo(new Value.StringValue("FAST"));
            assertThat(on.repair(on.parse("MODE::FAST").document(), SCHEMA)
                            .document()
                            .bodyValue("MODE"))
                    .isEqualTo(new Value.StringValue("fast"));
        }
    }

    @Nested
    @DisplayName("Pipeline listener")
    class Listener {

        @Test
        @DisplayName("Completion and applied repairs are reported")
        void completedAndRepairs() {
            RecordingListener listener = new RecordingListener();
            CanonEngine engine =
                    new CanonEngine(CanonConfig.builder().repairApply(true).build(), listener);

            engine.canonicalize(SOURCE, SCHEMA);

            assertThat(listener.completed).singleElement().satisfies(event -> {
                assertThat(event.documentName()).isEqualTo("JOB");
                assertThat(event.repairs()).isEqualTo(1);
                assertThat(event.preservedZones()).isEqualTo(1);
                assertThat(event.valid()).isTrue();
                assertThat(event.validationStatus()).isEqualTo("VALIDATED(JOB_SCHEMA, 1.0)");
            });
            assertThat(listener.repairs).singleElement().satisfies(event -> {
                assertThat(event.location()).isEqualTo("MODE");
                assertThat(event.ruleId()).isEqualTo("enum_case_fold");
                assertThat(event.semanticsChanged()).isFalse();
            });
            assertThat(listener.failed).isEmpty();
        }

        @Test
        @DisplayName("Failures are reported before the exception propagates")
        void failed() {
            RecordingListener listener = new RecordingListener();
            CanonEngine engine = new CanonEngine(CanonConfig.defaults(), listener);

            assertThatThrownBy(() -> engine.canonicalize("A::\t1")).isInstanceOf(LexException.class);

            assertThat(listener.failed).singleElement().satisfies(event -> {
                assertThat(event.code()).isEqualTo("E005");
                assertThat(event.subCode()).isEqualTo("E005_TAB");
                assertThat(event.line()).isEqualTo(1);
            });
            assertThat(listener.completed).isEmpty();
        }

        @Test
        @DisplayName("A throwing listener does not affect the pipeline")
        void throwingListener() {
            PipelineListener broken = new PipelineListener() {
                @Override
                public void onCanonicalizationCompleted(CanonicalizationCompletedEvent event) {
                    throw new IllegalStateException("boom");
                }
            };

            CanonicalizationResult result =
                    new CanonEngine(CanonConfig.defaults(), broken).canonicalize("A::1");

            assertThat(result.canonicalText()).isEqualTo("===INFERRED===\nA::1\n===END===\n");
        }
    }
}
