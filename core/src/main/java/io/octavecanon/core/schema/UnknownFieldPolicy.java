package io.octavecanon.core.schema;

/** What validation does with a key that no field definition covers. */
public enum UnknownFieldPolicy {
    /** Unknown keys are validation errors ({@link ViolationCode#UNKNOWN_FIELD}). */
    REJECT,
    /** Unknown keys are reported as warnings. */
    WARN,
    /** Unknown keys are not reported. */
    IGNORE
}
