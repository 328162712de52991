package io.octavecanon.core.lexer;

import io.octavecanon.core.audit.Diagnostic;
import io.octavecanon.core.audit.PipelineStage;
import io.octavecanon.core.audit.RepairEntry;
import io.octavecanon.core.error.ErrorCode;
import io.octavecanon.core.error.LexException;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-pass, line-by-line scanner that separates normalizing text from preserving
 * zones.
 *
 * <p>
 * Outside a literal zone each line has its line ending canonicalized and is put into
 * Unicode NFC before being appended to the output buffer. Inside a zone lines are
 * appended verbatim. Fence span offsets are recorded against the output buffer as it
 * grows, so they stay valid even when NFC changes line lengths.
 *
 * <p>
 * Inside an open zone a fence line counts only when it is indented at most three
 * spaces deeper than the line that opened the zone; deeper fences are content, so an
 * embedded Markdown code block can be carried as long as it is indented. Precedence
 * for a counting fence, evaluated in order:
 * <ol>
 * <li>same length as the opening run, nothing else on the line: closes the zone</li>
 * <li>same length with trailing text, or longer: {@link ErrorCode#NESTED_FENCE}</li>
 * <li>shorter: ordinary content</li>
 * </ol>
 */
public final class ZoneScanner {

    /** Whole-line fence: optional space indent, three or more backticks, optional info tag. */
    static final Pattern FENCE_LINE = Pattern.compile("^( *)(`{3,})([^`]*)$");

    /** Fence opened on the same line as its key: {@code KEY::```python}. */
    static final Pattern INLINE_FENCE = Pattern.compile("^( *[^\\s:\"`\\[\\]]+::) *(`{3,})([^`]*)$");

    private static final String DELIMITER = "---";

    /** Extra indentation beyond the opener at which a fence line is still a fence. */
    static final int MAX_FENCE_OFFSET = 3;

    private ZoneScanner() {
        // utility class
    }

    /**
     * Scans {@code input} and returns the normalized text with its zone table.
     *
     * @throws LexException for unterminated or ambiguous literal zones and unterminated
     *                      frontmatter
     */
    public static ScannedText scan(String input) {
        return new Scan(input).run();
    }

    private static final class Scan {

        private final String[] lines;
        private final StringBuilder out;
        private final List<FenceSpan> spans = new ArrayList<>();
        private final List<RepairEntry> log = new ArrayList<>();
        private FrontmatterBlock frontmatter;
        private boolean crlfLogged;

        // open-zone state
        private boolean inFence;
        private int spanStart;
        private String marker;
        private String infoTag;
        private int openLine;
        private int openColumn;
        private int openIndent;
        private boolean openedInline;
        private List<String> contentLines;

        Scan(String input) {
            this.lines = input.split("\n", -1);
            this.out = new StringBuilder(input.length());
        }

        ScannedText run() {
            int first = scanFrontmatter();
            for (int i = first; i < lines.length; i++) {
                int lineNo = i + 1;
                if (inFence) {
                    scanFenceLine(lines[i], lineNo);
                } else {
                    scanNormalLine(lines[i], lineNo);
                }
                if (i < lines.length - 1) {
                    out.append('\n');
                }
            }
            if (inFence) {
                throw unterminated();
            }
            return new ScannedText(out.toString(), spans, frontmatter, log);
        }

        private int scanFrontmatter() {
            if (lines.length < 2 || !stripCr(lines[0]).equals(DELIMITER)) {
                return 0;
            }
            for (int j = 1; j < lines.length; j++) {
                if (stripCr(lines[j]).equals(DELIMITER)) {
                    out.append(DELIMITER).append('\n');
                    StringBuilder raw = new StringBuilder();
                    for (int k = 1; k < j; k++) {
                        if (k > 1) {
                            raw.append('\n');
                        }
                        raw.append(lines[k]);
                    }
                    out.append(raw);
                    if (j > 1) {
                        out.append('\n');
                    }
                    out.append(DELIMITER);
                    frontmatter = new FrontmatterBlock(0, out.length(), raw.toString(), j + 1);
                    if (j < lines.length - 1) {
                        out.append('\n');
                    }
                    return j + 1;
                }
            }
            throw new LexException(
                    ErrorCode.UNTERMINATED_FRONTMATTER,
                    "frontmatter opened with '---' at line 1 is never closed",
                    "add a line containing only '---' after the frontmatter",
                    1,
                    1);
        }

        private void scanNormalLine(String raw, int lineNo) {
            String line = raw;
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
                if (!crlfLogged) {
                    crlfLogged = true;
                    log.add(RepairEntry.normalization(
                            PipelineStage.TOKENIZE, Diagnostic.atLine(lineNo), "line_ending_lf", "CRLF", "LF"));
                }
            }
            String normalized = Normalizer.normalize(line, Normalizer.Form.NFC);
            if (!normalized.equals(line)) {
                log.add(RepairEntry.normalization(
                        PipelineStage.TOKENIZE, Diagnostic.atLine(lineNo), "unicode_nfc", line, normalized));
            }

            Matcher fence = FENCE_LINE.matcher(normalized);
            if (fence.matches()) {
                int indent = fence.group(1).length();
                open(out.length(), fence.group(2), fence.group(3), lineNo, indent + 1, indent, false);
                out.append(normalized);
                return;
            }
            Matcher inline = INLINE_FENCE.matcher(normalized);
            if (inline.matches()) {
                int backticks = normalized.indexOf('`');
                log.add(RepairEntry.normalization(
                        PipelineStage.TOKENIZE,
                        Diagnostic.atLine(lineNo),
                        "inline_fence_opener",
                        normalized,
                        inline.group(1) + "\n" + normalized.substring(backticks)));
                open(out.length() + backticks,
                        inline.group(2),
                        inline.group(3),
                        lineNo,
                        backticks + 1,
                        leadingSpaces(normalized),
                        true);
                out.append(normalized);
                return;
            }
            out.append(normalized);
        }

        private void open(
                int start, String fenceMarker, String trailing, int lineNo, int column, int indent, boolean inline) {
            inFence = true;
            spanStart = start;
            marker = fenceMarker;
            String tag = trailing.strip();
            infoTag = tag.isEmpty() ? null : tag;
            openLine = lineNo;
            openColumn = column;
            openIndent = indent;
            openedInline = inline;
            contentLines = new ArrayList<>();
        }

        private void scanFenceLine(String raw, int lineNo) {
            Matcher m = FENCE_LINE.matcher(raw);
            if (m.matches() && m.group(1).length() <= openIndent + MAX_FENCE_OFFSET) {
                int length = m.group(2).length();
                String trailing = m.group(3).strip();
                if (length == marker.length() && trailing.isEmpty()) {
                    close(stripCr(raw), lineNo, m.group(1).length() + 1);
                    return;
                }
                if (length >= marker.length()) {
                    throw nested(length, trailing, lineNo, m.group(1).length() + 1);
                }
            }
            contentLines.add(raw);
            out.append(raw);
        }

        private void close(String closingLine, int lineNo, int column) {
            out.append(closingLine);
            spans.add(new FenceSpan(
                    spanStart,
                    out.length(),
                    marker,
                    infoTag,
                    openLine,
                    openColumn,
                    lineNo,
                    column,
                    String.join("\n", contentLines)));
            inFence = false;
            contentLines = null;
        }

        private LexException nested(int length, String trailing, int lineNo, int column) {
            int suggested = Math.max(length, marker.length()) + 1;
            String found = trailing.isEmpty()
                    ? String.format("a %d-backtick fence", length)
                    : String.format("a %d-backtick fence with trailing text '%s'", length, trailing);
            return new LexException(
                    ErrorCode.NESTED_FENCE,
                    String.format(
                            "ambiguous nested fence: found %s at line %d inside the %d-backtick literal zone"
                                    + " opened at line %d",
                            found,
                            lineNo,
                            marker.length(),
                            openLine),
                    String.format(
                            "use a fence of length %d (%s) for the outer zone so the inner fence becomes content",
                            suggested,
                            "`".repeat(suggested)),
                    lineNo,
                    column);
        }

        private LexException unterminated() {
            String remediation = String.format(
                    "add a closing line containing exactly %s (%d backticks)", marker, marker.length());
            if (openedInline) {
                remediation += "; the canonical form puts the opening fence on the line after KEY::";
            }
            return new LexException(
                    ErrorCode.UNTERMINATED_FENCE,
                    String.format(
                            "literal zone opened with %s at line %d reached end of input without a closing fence",
                            marker,
                            openLine),
                    remediation,
                    openLine,
                    openColumn);
        }

        private static int leadingSpaces(String line) {
            int n = 0;
            while (n < line.length() && line.charAt(n) == ' ') {
                n++;
            }
            return n;
        }

        private static String stripCr(String line) {
            return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        }
    }
}
