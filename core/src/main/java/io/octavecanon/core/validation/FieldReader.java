package io.octavecanon.core.validation;

import io.octavecanon.core.model.Document;
import io.octavecanon.core.model.Value;
import io.octavecanon.core.schema.FieldDefinition;
import io.octavecanon.core.schema.SchemaDefinition;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads fields from a document, applying schema defaults at the read boundary.
 *
 * <p>
 * Defaults are returned to the caller only. The document is not changed, so an absent
 * field stays absent in canonical output.
 */
public final class FieldReader {

    private final DocumentIndex index;
    private final SchemaDefinition schema;

    public FieldReader(Document doc, SchemaDefinition schema) {
        this.index = DocumentIndex.of(Objects.requireNonNull(doc, "doc must not be null"));
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    public ResolvedValue read(String path) {
        Objects.requireNonNull(path, "path must not be null");
        Value value = index.value(path);
        if (!(value instanceof Value.Absent)) {
            return new ResolvedValue(path, value, Provenance.PRESENT);
        }
        Optional<FieldDefinition> field = schema.field(path);
        if (field.isPresent() && field.get().hasDefault()) {
            return new ResolvedValue(path, field.get().defaultValue(), Provenance.DEFAULTED);
        }
        return new ResolvedValue(path, Value.Absent.INSTANCE, Provenance.ABSENT);
    }
}
