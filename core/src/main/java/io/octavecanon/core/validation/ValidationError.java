package io.octavecanon.core.validation;

import io.octavecanon.core.schema.Violation;
import io.octavecanon.core.schema.ViolationCode;
import java.util.Objects;

/**
 * A schema violation at a field path. Returned as a value, never thrown.
 *
 * @param code       stable violation code
 * @param fieldPath  dotted path of the offending field
 * @param constraint rendered constraint that failed
 * @param expected   what the constraint requires
 * @param got        what the document holds
 * @param message    human-readable summary
 */
public record ValidationError(
        ViolationCode code, String fieldPath, String constraint, String expected, String got, String message) {

    public ValidationError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(fieldPath, "fieldPath must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    static ValidationError of(String fieldPath, Violation violation) {
        return new ValidationError(
                violation.code(),
                fieldPath,
                violation.constraint(),
                violation.expected(),
                violation.got(),
                violation.message());
    }

    @Override
    public String toString() {
        return code.code() + " [" + code + "] " + fieldPath + ": " + message;
    }
}
