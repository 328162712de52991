package io.octavecanon.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.octavecanon.core.audit.RepairEntry;
import io.octavecanon.core.error.CanonException;
import io.octavecanon.core.error.ErrorCode;
import io.octavecanon.core.error.LexException;
import io.octavecanon.core.error.ParseException;
import io.octavecanon.core.lexer.Tokenizer;
import io.octavecanon.core.model.Document;
import io.octavecanon.core.model.Node;
import io.octavecanon.core.model.Value;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ParserTest {

    private static ParseResult parse(String text) {
        return Parser.parseWithLog(new Tokenizer().tokenize(text));
    }

    private static Document doc(String text) {
        return parse(text).document();
    }

    static Stream<Arguments> scalars() {
        return Stream.of(
                Arguments.of("42", new Value.NumberValue("42")),
                Arguments.of("-3.5", new Value.NumberValue("-3.5")),
                Arguments.of("true", Value.BooleanValue.TRUE),
                Arguments.of("false", Value.BooleanValue.FALSE),
                Arguments.of("null", Value.Null.INSTANCE),
                Arguments.of("\"42\"", new Value.StringValue("42")),
                Arguments.of("hello big world", new Value.StringValue("hello big world")),
                Arguments.of("A->B+C", new Value.StringValue("A→B⊕C")),
                Arguments.of("$name", new Value.StringValue("$name")),
                Arguments.of("1.0.0", new Value.StringValue("1.0.0")));
    }

    static Stream<Arguments> invalid() {
        return Stream.of(
                Arguments.of("KEY: value", ErrorCode.SINGLE_COLON),
                Arguments.of("KEY::", ErrorCode.MISSING_VALUE),
                Arguments.of("just words", ErrorCode.BARE_LINE),
                Arguments.of("L::[a, b", ErrorCode.UNCLOSED_LIST),
                Arguments.of("L::a]", ErrorCode.UNBALANCED_BRACKET),
                Arguments.of("M::[a::[1]]", ErrorCode.INLINE_MAP_NESTING),
                Arguments.of("M::[a::1, a::2]", ErrorCode.DUPLICATE_INLINE_KEY),
                Arguments.of("A::\"x\" y", ErrorCode.TRAILING_TOKENS),
                Arguments.of("§::X", ErrorCode.MALFORMED_SECTION),
                Arguments.of("P::[\"x\"∧BOGUS]", ErrorCode.MALFORMED_PATTERN),
                Arguments.of("P::[\"x\"∧REQ→TARGET]", ErrorCode.MALFORMED_PATTERN),
                Arguments.of("P::[\"x\"∧REQ, y]", ErrorCode.MALFORMED_PATTERN),
                Arguments.of("P::[\"x\"∧REQ∧OPT]", ErrorCode.MALFORMED_PATTERN),
                Arguments.of("===D===\nA::1\n===END===\nB::2", ErrorCode.CONTENT_AFTER_END),
                Arguments.of("// hi\n===D===\n===END===", ErrorCode.UNEXPECTED_TOKEN));
    }

    @Nested
    @DisplayName("Literal zones")
    class LiteralZones {

        @Test
        @DisplayName("Inline opener yields a zone with content, tag and marker")
        void inlineOpener() {
            Document doc = doc("KEY::```python\nhello\n```");

            assertThat(doc.bodyValue("KEY")).isEqualTo(new Value.LiteralZoneValue("hello", "python", "```"));
        }

        @Test
        @DisplayName("Unclosed fence fails naming the opening line and marker")
        void unclosedFence() {
            assertThatThrownBy(() -> doc("KEY::```\nhello"))
                    .isInstanceOf(LexException.class)
                    .satisfies(e -> {
                        CanonException ce = (CanonException) e;
                        assertThat(ce.errorCode()).isEqualTo(ErrorCode.UNTERMINATED_FENCE);
                        assertThat(ce.line()).isEqualTo(1);
                        assertThat(ce.detail()).contains("```").contains("line 1");
                    });
        }

        @Test
        @DisplayName("A four-backtick fence wraps a three-backtick run unmodified")
        void longerFenceWraps() {
            Document doc = doc("KEY::````\n```\nmore\n````");

            Value.LiteralZoneValue zone = (Value.LiteralZoneValue) doc.bodyValue("KEY");
            assertThat(zone.content()).isEqualTo("```\nmore");
            assertThat(zone.fenceMarker()).isEqualTo("````");
            assertThat(zone.infoTag()).isNull();
        }

        @Test
        @DisplayName("An equal-length fence with trailing text inside a zone is ambiguous")
        void equalLengthInside() {
            assertThatThrownBy(() -> doc("KEY::```\n```python\n```"))
                    .isInstanceOf(LexException.class)
                    .extracting(e -> ((CanonException) e).errorCode())
                    .isEqualTo(ErrorCode.NESTED_FENCE);
        }

        @Test
        @DisplayName("Canonical layout: fence on the line after KEY::")
        void canonicalLayout() {
            Document doc = doc("===D===\nB:\n  C::\n  ```sql\n  SELECT 1\n  ```\n===END===");

            Node.Block block = (Node.Block) doc.body().get(0);
            assertThat(block.children())
                    .containsExactly(new Node.Assignment("C", new Value.LiteralZoneValue("  SELECT 1", "sql", "```")));
        }

        @Test
        void emptyZone() {
            assertThat(doc("K::\n```\n```").bodyValue("K")).isEqualTo(new Value.LiteralZoneValue("", null, "```"));
        }

        @Test
        @DisplayName("A top-level zone that is not an assignment value is rejected")
        void orphanZone() {
            assertThatThrownBy(() -> doc("```\ncode\n```"))
                    .isInstanceOf(ParseException.class)
                    .extracting(e -> ((CanonException) e).errorCode())
                    .isEqualTo(ErrorCode.ORPHAN_LITERAL_ZONE);
            assertThatThrownBy(() -> doc("===D===\n  ```\ncode\n  ```\n===END==="))
                    .isInstanceOf(ParseException.class)
                    .extracting(e -> ((CanonException) e).errorCode())
                    .isEqualTo(ErrorCode.ORPHAN_LITERAL_ZONE);
        }

        @Test
        @DisplayName("A zone directly in a block body becomes a keyless child")
        void bareZoneInBlock() {
            Document doc = doc("===D===\nNOTES:\n  A::1\n  ```md\n  text\n  ```\n  B::2\n===END===");

            Node.Block block = (Node.Block) doc.body().get(0);
            assertThat(block.children())
                    .containsExactly(
                            new Node.Assignment("A", new Value.NumberValue("1")),
                            new Node.Assignment("", new Value.LiteralZoneValue("  text", "md", "```")),
                            new Node.Assignment("B", new Value.NumberValue("2")));
            assertThat(((Node.Assignment) block.children().get(1)).isBareZone()).isTrue();
        }

        @Test
        @DisplayName("Two keyless zones in one block are not duplicate keys")
        void twoBareZones() {
            ParseResult result = parse("===D===\n§1::S\n  ```\n  a\n  ```\n  ```\n  b\n  ```\n===END===");

            assertThat(((Node.Section) result.document().body().get(0)).children()).hasSize(2);
            assertThat(result.warnings()).isEmpty();
        }

        @Test
        @DisplayName("An indented Markdown fence inside a zone is content")
        void indentedFenceInsideZone() {
            Document doc = doc("===D===\nK::\n```\nmarkdown:\n    ```\n    code\n    ```\n```\nN::1\n===END===");

            assertThat(doc.bodyValue("K"))
                    .isEqualTo(new Value.LiteralZoneValue("markdown:\n    ```\n    code\n    ```", null, "```"));
            assertThat(doc.bodyValue("N")).isEqualTo(new Value.NumberValue("1"));
        }

        @Test
        void zoneInList() {
            assertThatThrownBy(() -> doc("L::[\n```\nx\n```\n]"))
                    .isInstanceOf(ParseException.class)
                    .extracting(e -> ((CanonException) e).errorCode())
                    .isEqualTo(ErrorCode.LITERAL_ZONE_IN_LIST);
        }
    }

    @Nested
    @DisplayName("Document structure")
    class Structure {

        @Test
        @DisplayName("Envelope, META block, separator and body")
        void fullDocument() {
            Document doc = doc("===SPEC_DOC===\nMETA:\n  TYPE::SPEC\n  VERSION::\"1.0\"\n---\nA::1\n===END===\n");

            Document expected = new Document(
                    "SPEC_DOC",
                    null,
                    List.of(
                            new Node.Assignment("TYPE", new Value.StringValue("SPEC")),
                            new Node.Assignment("VERSION", new Value.StringValue("1.0"))),
                    true,
                    List.of(new Node.Assignment("A", new Value.NumberValue("1"))));
            assertThat(doc).isEqualTo(expected);
        }

        @Test
        void nestedBlocks() {
            Document doc = doc("===D===\nCONFIG:\n  PORT::8080\n  INNER:\n    MODE::fast\nOTHER::1\n===END===");

            assertThat(doc.body())
                    .containsExactly(
                            new Node.Block(
                                    "CONFIG",
                                    List.of(
                                            new Node.Assignment("PORT", new Value.NumberValue("8080")),
                                            new Node.Block(
                                                    "INNER",
                                                    List.of(new Node.Assignment(
                                                            "MODE", new Value.StringValue("fast")))))),
                            new Node.Assignment("OTHER", new Value.NumberValue("1")));
        }

        @Test
        @DisplayName("Section with id, name and annotation")
        void section() {
            Document doc = doc("===D===\n§1::INTRO[draft]\n  A::1\n===END===");

            assertThat(doc.body())
                    .containsExactly(new Node.Section(
                            "1", "INTRO", "draft", List.of(new Node.Assignment("A", new Value.NumberValue("1")))));
        }

        @Test
        @DisplayName("Comments: own line and trailing become sibling comment nodes")
        void comments() {
            Document doc = doc("===D===\n// header\nA::1 // note\n===END===");

            assertThat(doc.body())
                    .containsExactly(
                            new Node.Comment("header"),
                            new Node.Assignment("A", new Value.NumberValue("1")),
                            new Node.Comment("note"));
        }

        @Test
        @DisplayName("Frontmatter is kept verbatim")
        void frontmatter() {
            Document doc = doc("---\ntitle: x\n---\n===D===\n===END===");

            assertThat(doc.frontmatter()).isEqualTo("title: x");
            assertThat(doc.hasFrontmatter()).isTrue();
        }

        @Test
        @DisplayName("Blank frontmatter is dropped and logged")
        void blankFrontmatter() {
            ParseResult result = parse("---\n\n---\n===D===\n===END===");

            assertThat(result.document().frontmatter()).isNull();
            assertThat(result.normalizations())
                    .extracting(RepairEntry::ruleId)
                    .containsExactly("frontmatter_blank_dropped");
        }

        @Test
        @DisplayName("Missing envelope lines are completed as normalizations")
        void envelopeCompletion() {
            ParseResult result = parse("A::1");

            assertThat(result.document().name()).isEqualTo(Parser.INFERRED_NAME);
            assertThat(result.normalizations())
                    .extracting(RepairEntry::ruleId)
                    .containsExactly("envelope_inferred", "envelope_end_completed");
        }

        @Test
        @DisplayName("Duplicate keys are kept and warned; the last one wins")
        void duplicateKeys() {
            ParseResult result = parse("===D===\nA::1\nA::2\n===END===");

            assertThat(result.document().body()).hasSize(2);
            assertThat(result.document().bodyValue("A")).isEqualTo(new Value.NumberValue("2"));
            assertThat(result.warnings()).extracting(d -> d.code()).containsExactly("W_DUPLICATE_KEY");
        }
    }

    @Nested
    @DisplayName("Values")
    class Values {

        @ParameterizedTest(name = "V::{0}")
        @MethodSource("io.octavecanon.core.parser.ParserTest#scalars")
        void scalarValues(String source, Value expected) {
            assertThat(doc("V::" + source).bodyValue("V")).isEqualTo(expected);
        }

        @Test
        @DisplayName("Null and absent are distinct")
        void nullVersusAbsent() {
            Document doc = doc("A::null");

            assertThat(doc.bodyValue("A")).isEqualTo(Value.Null.INSTANCE);
            assertThat(doc.bodyValue("B")).isEqualTo(Value.Absent.INSTANCE);
        }

        @Test
        void list() {
            assertThat(doc("L::[a, 1, true, null, \"x y\"]").bodyValue("L"))
                    .isEqualTo(Value.ListValue.of(
                            new Value.StringValue("a"),
                            new Value.NumberValue("1"),
                            Value.BooleanValue.TRUE,
                            Value.Null.INSTANCE,
                            new Value.StringValue("x y")));
        }

        @Test
        void emptyList() {
            assertThat(doc("L::[]").bodyValue("L")).isEqualTo(Value.ListValue.of());
        }

        @Test
        @DisplayName("A list of pairs is an inline map with entry order kept")
        void inlineMap() {
            Map<String, Value> entries = new LinkedHashMap<>();
            entries.put("host", new Value.StringValue("localhost"));
            entries.put("port", new Value.NumberValue("80"));

            assertThat(doc("M::[host::localhost, port::80]").bodyValue("M")).isEqualTo(new Value.InlineMap(entries));
        }

        @Test
        @DisplayName("Pairs mixed with plain items become single-entry maps")
        void mixedList() {
            assertThat(doc("M::[a, k::v]").bodyValue("M"))
                    .isEqualTo(Value.ListValue.of(
                            new Value.StringValue("a"),
                            new Value.InlineMap(Map.of("k", new Value.StringValue("v")))));
        }

        @Test
        @DisplayName("Holographic pattern: example, constraints and target section")
        void holographicPattern() {
            assertThat(doc("P::[\"ACTIVE\"∧REQ∧ENUM[ACTIVE,DRAFT]→§INDEXER]").bodyValue("P"))
                    .isEqualTo(new Value.HolographicValue(
                            new Value.StringValue("ACTIVE"), "REQ∧ENUM[ACTIVE,DRAFT]", "INDEXER"));
        }

        @Test
        @DisplayName("Pattern examples may be numbers, lists or null, and the target is optional")
        void patternExamples() {
            Document doc = doc("A::[42∧OPT]\nB::[[a, \"b c\"]∧REQ]\nC::[null∧OPT→§1]");

            assertThat(doc.bodyValue("A"))
                    .isEqualTo(new Value.HolographicValue(new Value.NumberValue("42"), "OPT", null));
            assertThat(doc.bodyValue("B"))
                    .isEqualTo(new Value.HolographicValue(
                            Value.ListValue.of(new Value.StringValue("a"), new Value.StringValue("b c")), "REQ", null));
            assertThat(doc.bodyValue("C")).isEqualTo(new Value.HolographicValue(Value.Null.INSTANCE, "OPT", "1"));
        }

        @Test
        @DisplayName("Quoted constraint arguments keep their quotes")
        void quotedRegexArgument() {
            Value.HolographicValue pattern =
                    (Value.HolographicValue) doc("P::[\"abc\"∧REQ∧REGEX[\"^[a-z]+$\"]]").bodyValue("P");

            assertThat(pattern.constraints()).isEqualTo("REQ∧REGEX[\"^[a-z]+$\"]");
            assertThat(pattern.target()).isNull();
        }

        @Test
        @DisplayName("ASCII operator aliases inside a pattern are normalized")
        void asciiPattern() {
            ParseResult result = parse("P::[\"x\"&REQ->#OUT]");

            assertThat(result.document().bodyValue("P"))
                    .isEqualTo(new Value.HolographicValue(new Value.StringValue("x"), "REQ", "OUT"));
        }

        @Test
        @DisplayName("A bare word before ∧ stays a flow expression, not a pattern")
        void bareWordIsExpression() {
            assertThat(doc("L::[A∧B]").bodyValue("L")).isEqualTo(Value.ListValue.of(new Value.StringValue("A∧B")));
        }

        @Test
        @DisplayName("NAME<qualifier> keys and values are single identifiers")
        void qualifiedIdentifiers() {
            Document doc = doc("RULE<strict>::NEVER<A,B>");

            assertThat(doc.bodyValue("RULE<strict>")).isEqualTo(new Value.StringValue("NEVER<A,B>"));
        }

        @Test
        @DisplayName("Comments inside a list are dropped with a warning")
        void listComment() {
            ParseResult result = parse("L::[a, // c\n  b]");

            assertThat(result.document().bodyValue("L"))
                    .isEqualTo(Value.ListValue.of(new Value.StringValue("a"), new Value.StringValue("b")));
            assertThat(result.warnings()).extracting(d -> d.code()).containsExactly("W_LIST_COMMENT_DROPPED");
            assertThat(result.normalizations()).extracting(RepairEntry::ruleId).contains("list_comment_dropped");
        }
    }

    @Nested
    @DisplayName("Structural errors")
    class Errors {

        @ParameterizedTest(name = "{1}")
        @MethodSource("io.octavecanon.core.parser.ParserTest#invalid")
        void rejected(String source, ErrorCode expected) {
            assertThatThrownBy(() -> doc(source))
                    .isInstanceOf(ParseException.class)
                    .satisfies(e -> {
                        ParseException pe = (ParseException) e;
                        assertThat(pe.errorCode()).isEqualTo(expected);
                        assertThat(pe.phase()).isEqualTo(CanonException.Phase.PARSE);
                        assertThat(pe.remediation()).isNotBlank();
                        assertThat(pe.line()).isPositive();
                    });
        }

        @Test
        @DisplayName("Single colon error points at the value and suggests ::")
        void singleColonRemediation() {
            assertThatThrownBy(() -> doc("===D===\nKEY: value\n===END==="))
                    .isInstanceOf(ParseException.class)
                    .satisfies(e -> {
                        ParseException pe = (ParseException) e;
                        assertThat(pe.line()).isEqualTo(2);
                        assertThat(pe.column()).isEqualTo(6);
                        assertThat(pe.remediation()).contains("KEY::value");
                    });
        }
    }
}
