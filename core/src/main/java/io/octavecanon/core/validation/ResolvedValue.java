package io.octavecanon.core.validation;

import io.octavecanon.core.model.Value;
import java.util.Objects;

/**
 * A field value as seen through {@link FieldReader}.
 *
 * @param path       dotted field path
 * @param value      document value, schema default, or {@link Value.Absent}
 * @param provenance where the value came from
 */
public record ResolvedValue(String path, Value value, Provenance provenance) {

    public ResolvedValue {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(provenance, "provenance must not be null");
        if ((provenance == Provenance.ABSENT) != (value instanceof Value.Absent)) {
            throw new IllegalArgumentException("ABSENT provenance must carry exactly the Absent value");
        }
    }

    public boolean isPresent() {
        return provenance == Provenance.PRESENT;
    }
}
