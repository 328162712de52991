package io.octavecanon.core.error;

/**
 * Thrown when a token stream does not form a valid document structure. No partial
 * document is ever returned alongside this exception.
 */
public final class ParseException extends CanonException {

    private static final long serialVersionUID = 1L;

    public ParseException(ErrorCode errorCode, String detail, String remediation, int line, int column) {
        super(errorCode, detail, remediation, line, column, Phase.PARSE);
    }
}
