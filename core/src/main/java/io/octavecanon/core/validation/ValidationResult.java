package io.octavecanon.core.validation;

import io.octavecanon.core.audit.Diagnostic;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link Validator#validate}.
 *
 * <p>
 * The status is always present. {@link #literalZonesValidated()} is always
 * {@code false}: literal zone content is never checked, and every zone in the document
 * is listed in {@link #literalZones()}.
 *
 * @param valid        whether there are no errors
 * @param errors       violations in schema field order
 * @param warnings     non-fatal findings
 * @param status       {@code VALIDATED(schema, version)} or {@code UNVALIDATED}
 * @param literalZones every literal zone in document order
 */
public record ValidationResult(
        boolean valid,
        List<ValidationError> errors,
        List<Diagnostic> warnings,
        ValidationStatus status,
        List<LiteralZoneReport> literalZones) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        Objects.requireNonNull(status, "status must not be null");
        literalZones = List.copyOf(literalZones);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid must be true exactly when there are no errors");
        }
    }

    public boolean literalZonesValidated() {
        return false;
    }

    public boolean hasLiteralZones() {
        return !literalZones.isEmpty();
    }
}
