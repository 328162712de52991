package io.octavecanon.core.error;

import java.util.Objects;

/**
 * Abstract base for all canonicalization failures. Never thrown directly; use
 * {@link LexException}, {@link ParseException} or {@link ConstraintSyntaxException}.
 *
 * <p>
 * Every instance carries a stable {@link ErrorCode}, a 1-based source position and a
 * remediation telling the author what change would resolve the error. The formatted
 * {@link #getMessage()} combines all of them; {@link #detail()} returns only the
 * description of what was found.
 */
public abstract class CanonException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline phase in which the error occurred. */
    public enum Phase {
        LEX,
        PARSE,
        SCHEMA
    }

    private final ErrorCode errorCode;
    private final String detail;
    private final String remediation;
    private final int line;
    private final int column;
    private final Phase phase;

    protected CanonException(
            ErrorCode errorCode, String detail, String remediation, int line, int column, Phase phase) {
        super(format(errorCode, detail, remediation, line, column));
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.detail = detail;
        this.remediation = remediation;
        this.line = line;
        this.column = column;
        this.phase = phase;
    }

    private static String format(ErrorCode code, String detail, String remediation, int line, int column) {
        StringBuilder sb = new StringBuilder();
        sb.append(code.family()).append(" [").append(code.subCode()).append("] at line ").append(line);
        if (column > 0) {
            sb.append(", column ").append(column);
        }
        sb.append(": ").append(detail);
        if (remediation != null && !remediation.isEmpty()) {
            sb.append(". Fix: ").append(remediation);
        }
        return sb.toString();
    }

    /** The catalog entry for this error. */
    public ErrorCode errorCode() {
        return errorCode;
    }

    /** Family code, e.g. {@code E007}. */
    public String code() {
        return errorCode.family();
    }

    /** Stable sub-code, e.g. {@code E007_NESTED_FENCE}. */
    public String subCode() {
        return errorCode.subCode();
    }

    /** What was found, without position or remediation. */
    public String detail() {
        return detail;
    }

    /** The correction that would resolve the error. */
    public String remediation() {
        return remediation;
    }

    /** 1-based line number. */
    public int line() {
        return line;
    }

    /** 1-based column, or {@code 0} when the error concerns a whole line. */
    public int column() {
        return column;
    }

    public Phase phase() {
        return phase;
    }
}
