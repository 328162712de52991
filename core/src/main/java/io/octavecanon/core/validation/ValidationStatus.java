package io.octavecanon.core.validation;

import java.util.Objects;

/** Whether a document was checked against a schema, and which one. */
public sealed interface ValidationStatus permits ValidationStatus.Validated, ValidationStatus.Unvalidated {

    /** {@code VALIDATED(name, version)} or {@code UNVALIDATED}. */
    String label();

    record Validated(String schema, String version) implements ValidationStatus {
        public Validated {
            Objects.requireNonNull(schema, "schema must not be null");
            Objects.requireNonNull(version, "version must not be null");
        }

        @Override
        public String label() {
            return "VALIDATED(" + schema + ", " + version + ")";
        }
    }

    /** No schema was supplied. */
    record Unvalidated() implements ValidationStatus {
        public static final Unvalidated INSTANCE = new Unvalidated();

        @Override
        public String label() {
            return "UNVALIDATED";
        }
    }
}
