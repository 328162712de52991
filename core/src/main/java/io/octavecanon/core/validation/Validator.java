package io.octavecanon.core.validation;

import io.octavecanon.core.audit.Diagnostic;
import io.octavecanon.core.model.Document;
import io.octavecanon.core.model.Value;
import io.octavecanon.core.schema.FieldDefinition;
import io.octavecanon.core.schema.SchemaDefinition;
import io.octavecanon.core.schema.UnknownFieldPolicy;
import io.octavecanon.core.schema.Violation;
import io.octavecanon.core.schema.ViolationCode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a document against a {@link SchemaDefinition}.
 *
 * <p>
 * Violations are collected, never thrown. Fields are checked in schema order, then
 * unknown keys in covered containers are reported according to the schema's
 * {@link UnknownFieldPolicy}. Literal zones are listed in the result; their content is
 * not read.
 *
 * <p>
 * Schema defaults play no part in validation: an absent field with a default still
 * fails {@code REQ}, because defaults exist only at the read boundary
 * ({@link FieldReader}).
 */
public final class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    /** Warning code for unknown keys under {@link UnknownFieldPolicy#WARN}. */
    public static final String W_UNKNOWN_FIELD = "W_UNKNOWN_FIELD";

    private Validator() {
        // utility class
    }

    /**
     * Validates {@code doc}. A {@code null} schema yields an {@code UNVALIDATED} result
     * that still lists the document's literal zones.
     */
    public static ValidationResult validate(Document doc, SchemaDefinition schema) {
        Objects.requireNonNull(doc, "doc must not be null");
        DocumentIndex index = DocumentIndex.of(doc);
        if (schema == null) {
            LOG.debug("validate.skipped document={} reason=no_schema", doc.name());
            return new ValidationResult(
                    true, List.of(), List.of(), ValidationStatus.Unvalidated.INSTANCE, index.literalZones());
        }

        List<ValidationError> errors = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();
        for (FieldDefinition field : schema.fields()) {
            Value value = index.value(field.path());
            for (Violation violation : field.chain().check(value)) {
                errors.add(ValidationError.of(field.path(), violation));
            }
        }
        unknownFields(index, schema, errors, warnings);

        ValidationResult result = new ValidationResult(
                errors.isEmpty(),
                errors,
                warnings,
                new ValidationStatus.Validated(schema.name(), schema.version()),
                index.literalZones());
        LOG.debug(
                "validate.completed document={} schema={} version={} valid={} errors={} warnings={} literal_zones={}",
                doc.name(),
                schema.name(),
                schema.version(),
                result.valid(),
                errors.size(),
                warnings.size(),
                result.literalZones().size());
        return result;
    }

    private static void unknownFields(
            DocumentIndex index, SchemaDefinition schema, List<ValidationError> errors, List<Diagnostic> warnings) {
        UnknownFieldPolicy policy = schema.unknownFields();
        if (policy == UnknownFieldPolicy.IGNORE) {
            return;
        }
        for (String container : schema.coveredContainers()) {
            for (String key : index.keys(container)) {
                String path = DocumentIndex.join(container, key);
                if (isKnown(schema, path)) {
                    continue;
                }
                String message = "field '" + path + "' is not defined by schema " + schema.name();
                if (policy == UnknownFieldPolicy.REJECT) {
                    errors.add(new ValidationError(
                            ViolationCode.UNKNOWN_FIELD, path, "unknown-fields=REJECT", "defined field", path, message));
                } else {
                    warnings.add(new Diagnostic(W_UNKNOWN_FIELD, message, path));
                }
            }
        }
    }

    private static boolean isKnown(SchemaDefinition schema, String path) {
        if (schema.field(path).isPresent()) {
            return true;
        }
        String prefix = path + ".";
        return schema.fields().stream().anyMatch(f -> f.path().startsWith(prefix));
    }
}
