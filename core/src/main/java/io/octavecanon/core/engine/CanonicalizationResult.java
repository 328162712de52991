package io.octavecanon.core.engine;

import io.octavecanon.core.audit.Diagnostic;
import io.octavecanon.core.audit.RepairLog;
import io.octavecanon.core.model.Document;
import io.octavecanon.core.validation.ValidationResult;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link CanonEngine#canonicalize}.
 *
 * @param canonicalText emitted canonical form of {@code document}
 * @param document      the repaired document
 * @param repairLog     tokenizer, parser and repair entries in pipeline order
 * @param validation    validation of {@code document}; {@code UNVALIDATED} without a schema
 * @param warnings      warnings from every stage in pipeline order
 */
public record CanonicalizationResult(
        String canonicalText,
        Document document,
        RepairLog repairLog,
        ValidationResult validation,
        List<Diagnostic> warnings) {

    public CanonicalizationResult {
        Objects.requireNonNull(canonicalText, "canonicalText must not be null");
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(repairLog, "repairLog must not be null");
        Objects.requireNonNull(validation, "validation must not be null");
        warnings = List.copyOf(warnings);
    }
}
