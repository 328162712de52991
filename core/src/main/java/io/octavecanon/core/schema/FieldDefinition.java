package io.octavecanon.core.schema;

import io.octavecanon.core.model.Value;
import java.util.Objects;

/**
 * One schema field.
 *
 * @param path         dotted path such as {@code META.TYPE} or {@code CONFIG.PORT}
 * @param chain        constraints the field's value must satisfy
 * @param defaultValue value readers see when the field is absent; {@code null} when
 *                     the field has no default. Never written into a document.
 */
public record FieldDefinition(String path, ConstraintChain chain, Value defaultValue) {

    public FieldDefinition {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(chain, "chain must not be null");
        if (path.isBlank() || path.startsWith(".") || path.endsWith(".") || path.contains("..")) {
            throw new IllegalArgumentException("invalid field path: '" + path + "'");
        }
        if (defaultValue instanceof Value.Absent) {
            throw new IllegalArgumentException("default of '" + path + "' must not be Absent");
        }
    }

    public static FieldDefinition of(String path, String chain) {
        return new FieldDefinition(path, ConstraintChain.parse(chain), null);
    }

    public FieldDefinition withDefault(Value value) {
        return new FieldDefinition(path, chain, value);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    /** Path of the container holding this field; empty for a top-level field. */
    public String parentPath() {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? "" : path.substring(0, dot);
    }
}
