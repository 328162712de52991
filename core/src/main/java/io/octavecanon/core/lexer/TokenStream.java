package io.octavecanon.core.lexer;

import io.octavecanon.core.audit.Diagnostic;
import io.octavecanon.core.audit.RepairEntry;
import java.util.List;
import java.util.Objects;

/**
 * Result of {@link Tokenizer#tokenize(String)}: the tokens ending in {@code EOF}, the
 * literal zone table, and the audit trail of the tokenize stage.
 *
 * @param tokens         tokens in source order; the last one is always {@code EOF}
 * @param fenceSpans     literal zones, offsets valid for {@code normalizedText}
 * @param normalizedText the text the tokens were read from
 * @param normalizations NORMALIZATION entries recorded by the tokenizer
 * @param warnings       non-fatal findings such as wrong-case literals
 */
public record TokenStream(
        List<Token> tokens,
        List<FenceSpan> fenceSpans,
        String normalizedText,
        List<RepairEntry> normalizations,
        List<Diagnostic> warnings) {

    public TokenStream {
        Objects.requireNonNull(normalizedText, "normalizedText must not be null");
        tokens = List.copyOf(tokens);
        fenceSpans = List.copyOf(fenceSpans);
        normalizations = List.copyOf(normalizations);
        warnings = List.copyOf(warnings);
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("token stream must end with EOF");
        }
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }
}
