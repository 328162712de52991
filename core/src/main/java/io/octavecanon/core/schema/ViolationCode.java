package io.octavecanon.core.schema;

/** Stable codes for schema violations. Violations are reported as values, never thrown. */
public enum ViolationCode {
    REQUIRED_MISSING("E003"),
    ENUM_MISMATCH("E004"),
    PATTERN_MISMATCH("E009"),
    TYPE_MISMATCH("E010"),
    LANG_MISMATCH("E011"),
    CONST_MISMATCH("E012"),
    UNKNOWN_FIELD("E014");

    private final String code;

    ViolationCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
