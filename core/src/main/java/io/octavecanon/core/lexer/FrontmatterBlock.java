package io.octavecanon.core.lexer;

import java.util.Objects;

/**
 * A leading {@code --- ... ---} block, captured byte-for-byte and never tokenized.
 *
 * @param start     offset of the opening delimiter, always {@code 0}
 * @param end       exclusive offset just after the closing delimiter
 * @param raw       text between the delimiter lines, verbatim
 * @param closeLine 1-based line of the closing delimiter
 */
public record FrontmatterBlock(int start, int end, String raw, int closeLine) {

    public FrontmatterBlock {
        Objects.requireNonNull(raw, "raw must not be null");
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }
}
