package io.octavecanon.core.lexer;

import java.util.Objects;

/**
 * A literal zone located in the normalized text, from the first backtick of the opening
 * fence (or the start of its line) to the end of the closing fence line.
 *
 * <p>
 * Offsets refer to the text the tokenizer returned, never to the raw input: they are
 * recorded while that text is being built.
 *
 * @param start       inclusive offset of the zone in the normalized text
 * @param end         exclusive offset, just after the closing fence
 * @param marker      backtick run that opened the zone, e.g. {@code ```}
 * @param infoTag     trimmed info tag, or {@code null} when absent
 * @param openLine    1-based line of the opening fence
 * @param openColumn  1-based column of the opening backticks
 * @param closeLine   1-based line of the closing fence
 * @param closeColumn 1-based column of the closing backticks
 * @param content     verbatim zone content, {@code ""} when empty
 */
public record FenceSpan(
        int start,
        int end,
        String marker,
        String infoTag,
        int openLine,
        int openColumn,
        int closeLine,
        int closeColumn,
        String content) {

    public FenceSpan {
        Objects.requireNonNull(marker, "marker must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
    }

    /** Whether {@code offset} falls inside this zone. */
    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    /** Number of backticks in the fence marker. */
    public int fenceLength() {
        return marker.length();
    }
}
