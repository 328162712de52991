package io.octavecanon.core.lexer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.octavecanon.core.audit.RepairEntry;
import io.octavecanon.core.error.ErrorCode;
import io.octavecanon.core.error.LexException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the single-pass zone scanner: offsets, fence precedence and line endings. */
class ZoneScannerTest {

    @Nested
    @DisplayName("Fence precedence")
    class FencePrecedence {

        @Test
        @DisplayName("Equal length, nothing trailing: closes the zone")
        void equalLengthCloses() {
            ScannedText scanned = ZoneScanner.scan("K::\n```\nbody\n```\nNEXT::1");

            assertThat(scanned.fenceSpans()).hasSize(1);
            FenceSpan span = scanned.fenceSpans().get(0);
            assertThat(span.content()).isEqualTo("body");
            assertThat(span.openLine()).isEqualTo(2);
            assertThat(span.closeLine()).isEqualTo(4);
        }

        @Test
        @DisplayName("Equal length with trailing text: ambiguous nested fence")
        void equalLengthWithTrailingTextFails() {
            assertThatThrownBy(() -> ZoneScanner.scan("K::\n```\n```js\n```"))
                    .isInstanceOf(LexException.class)
                    .satisfies(e -> {
                        LexException lex = (LexException) e;
                        assertThat(lex.errorCode()).isEqualTo(ErrorCode.NESTED_FENCE);
                        assertThat(lex.line()).isEqualTo(3);
                        assertThat(lex.detail()).contains("opened at line 2").contains("trailing text 'js'");
                        assertThat(lex.remediation()).contains("length 4");
                    });
        }

        @Test
        @DisplayName("Longer run: ambiguous nested fence suggesting a longer outer fence")
        void longerRunFails() {
            assertThatThrownBy(() -> ZoneScanner.scan("K::\n```\n````\n```"))
                    .isInstanceOf(LexException.class)
                    .satisfies(e -> {
                        LexException lex = (LexException) e;
                        assertThat(lex.subCode()).isEqualTo("E007_NESTED_FENCE");
                        assertThat(lex.detail()).contains("4-backtick").contains("3-backtick");
                        assertThat(lex.remediation()).contains("length 5").contains("`````");
                    });
        }

        @Test
        @DisplayName("Shorter run: literal content")
        void shorterRunIsContent() {
            ScannedText scanned = ZoneScanner.scan("K::\n````\n```\n````");

            assertThat(scanned.fenceSpans()).singleElement().satisfies(span -> {
                assertThat(span.marker()).isEqualTo("````");
                assertThat(span.content()).isEqualTo("```");
            });
        }

        @Test
        @DisplayName("Fences indented more than three spaces past the opener are content")
        void deeplyIndentedFenceIsContent() {
            String markdown = "markdown:\n    ```\n    code\n    ```";
            ScannedText scanned = ZoneScanner.scan("K::\n```\n" + markdown + "\n```\nNEXT::1");

            assertThat(scanned.fenceSpans()).singleElement().satisfies(span -> {
                assertThat(span.content()).isEqualTo(markdown);
                assertThat(span.closeLine()).isEqualTo(6);
            });
        }

        @Test
        @DisplayName("The three-space allowance is measured from the opening fence")
        void allowanceRelativeToOpener() {
            ScannedText closed = ZoneScanner.scan("A:\n  K::\n  ```\n  x\n     ```");
            assertThat(closed.fenceSpans()).singleElement()
                    .satisfies(span -> assertThat(span.content()).isEqualTo("  x"));

            ScannedText deeper = ZoneScanner.scan("A:\n  K::\n  ```\n      ```\n  ```");
            assertThat(deeper.fenceSpans()).singleElement()
                    .satisfies(span -> assertThat(span.content()).isEqualTo("      ```"));
        }

        @Test
        @DisplayName("Inline openers measure the allowance from the key line")
        void inlineOpenerIndent() {
            ScannedText scanned = ZoneScanner.scan("K::```\n    ```\n```");

            assertThat(scanned.fenceSpans()).singleElement()
                    .satisfies(span -> assertThat(span.content()).isEqualTo("    ```"));
        }

        @Test
        @DisplayName("End of input inside a zone names the opening line and marker")
        void unterminatedFence() {
            assertThatThrownBy(() -> ZoneScanner.scan("A::1\nK::\n```\nhello"))
                    .isInstanceOf(LexException.class)
                    .satisfies(e -> {
                        LexException lex = (LexException) e;
                        assertThat(lex.errorCode()).isEqualTo(ErrorCode.UNTERMINATED_FENCE);
                        assertThat(lex.line()).isEqualTo(3);
                        assertThat(lex.detail()).contains("```").contains("line 3");
                    });
        }
    }

    @Nested
    @DisplayName("Offsets")
    class Offsets {

        @Test
        @DisplayName("Span offsets stay valid when NFC shortens earlier lines")
        void offsetsAgainstNormalizedBuffer() {
            String input = "NAME::\"e\u0301e\u0301\"\nCODE::\n```\ne\u0301\n```\n";

            ScannedText scanned = ZoneScanner.scan(input);

            assertThat(scanned.text()).hasSizeLessThan(input.length());
            FenceSpan span = scanned.fenceSpans().get(0);
            assertThat(scanned.text().substring(span.start(), span.end())).isEqualTo("```\ne\u0301\n```");
            assertThat(span.content()).isEqualTo("e\u0301");
            assertThat(scanned.normalizations())
                    .extracting(RepairEntry::ruleId)
                    .containsExactly("unicode_nfc");
        }

        @Test
        @DisplayName("Inline opener starts the span at the backticks")
        void inlineOpener() {
            ScannedText scanned = ZoneScanner.scan("KEY::```python\nhello\n```");

            FenceSpan span = scanned.fenceSpans().get(0);
            assertThat(span.start()).isEqualTo(5);
            assertThat(span.infoTag()).isEqualTo("python");
            assertThat(scanned.isPreserved(3)).isFalse();
            assertThat(scanned.isPreserved(5)).isTrue();
            assertThat(scanned.normalizations())
                    .extracting(RepairEntry::ruleId)
                    .contains("inline_fence_opener");
        }
    }

    @Nested
    @DisplayName("Line endings and frontmatter")
    class LineEndings {

        @Test
        @DisplayName("CRLF outside zones becomes LF, logged once")
        void crlfNormalized() {
            ScannedText scanned = ZoneScanner.scan("A::1\r\nB::2\r\n");

            assertThat(scanned.text()).isEqualTo("A::1\nB::2\n");
            assertThat(scanned.normalizations())
                    .extracting(RepairEntry::ruleId)
                    .containsExactly("line_ending_lf");
        }

        @Test
        @DisplayName("CR inside a zone is content")
        void crInsideZonePreserved() {
            ScannedText scanned = ZoneScanner.scan("K::\r\n```\r\na\r\n```\r\n");

            assertThat(scanned.fenceSpans().get(0).content()).isEqualTo("a\r");
        }

        @Test
        @DisplayName("Frontmatter is kept verbatim, tabs included")
        void frontmatterVerbatim() {
            ScannedText scanned = ZoneScanner.scan("---\ntitle:\te\u0301\n---\n===D===\n===END===");

            assertThat(scanned.frontmatter()).isNotNull();
            assertThat(scanned.frontmatter().raw()).isEqualTo("title:\te\u0301");
            assertThat(scanned.isPreserved(scanned.text().indexOf('\t'))).isTrue();
        }

        @Test
        @DisplayName("Unclosed frontmatter is a lexical error")
        void unterminatedFrontmatter() {
            assertThatThrownBy(() -> ZoneScanner.scan("---\na: b\n"))
                    .isInstanceOf(LexException.class)
                    .extracting(e -> ((LexException) e).errorCode())
                    .isEqualTo(ErrorCode.UNTERMINATED_FRONTMATTER);
        }
    }
}
