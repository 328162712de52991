package io.octavecanon.core.lexer;

import java.util.Objects;

/**
 * Immutable lexical token.
 *
 * <p>
 * {@code value} depends on the kind: the unescaped text for {@code STRING}, the raw
 * lexeme for {@code NUMBER}, the canonical symbol for operators, the space count for
 * {@code INDENT}, the backtick marker followed by the info tag for {@code FENCE_OPEN},
 * and the verbatim zone content for {@code LITERAL_CONTENT}.
 *
 * @param type   token kind
 * @param value  token payload, never {@code null}
 * @param line   1-based line in the normalized text
 * @param column 1-based column in the normalized text
 */
public record Token(TokenType type, String value, int line, int column) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public boolean is(TokenType kind) {
        return type == kind;
    }

    @Override
    public String toString() {
        return type + "('" + value + "')@" + line + ":" + column;
    }
}
