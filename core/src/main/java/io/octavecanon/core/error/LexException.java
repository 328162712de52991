package io.octavecanon.core.error;

/**
 * Thrown when input text cannot be tokenized: unterminated or ambiguous literal zones,
 * tabs in a normalizing zone, disallowed characters. Always fatal to the tokenize call.
 */
public final class LexException extends CanonException {

    private static final long serialVersionUID = 1L;

    public LexException(ErrorCode errorCode, String detail, String remediation, int line, int column) {
        super(errorCode, detail, remediation, line, column, Phase.LEX);
    }
}
