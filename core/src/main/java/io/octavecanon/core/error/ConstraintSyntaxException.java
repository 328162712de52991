package io.octavecanon.core.error;

/**
 * Thrown when a constraint chain such as {@code REQ∧ENUM[A,B]} cannot be parsed, or
 * combines constraints that contradict each other. The line is always {@code 1}; the
 * column points into the chain text.
 */
public final class ConstraintSyntaxException extends CanonException {

    private static final long serialVersionUID = 1L;

    private final String chain;

    public ConstraintSyntaxException(String detail, String remediation, String chain, int column) {
        super(ErrorCode.CONSTRAINT_SYNTAX, detail, remediation, 1, column, Phase.SCHEMA);
        this.chain = chain;
    }

    /** The chain text that failed to parse. */
    public String chain() {
        return chain;
    }
}
