package io.octavecanon.core.schema;

import java.util.Objects;

/**
 * A single constraint failure for one value.
 *
 * @param code       stable violation code
 * @param constraint rendered constraint that failed, e.g. {@code LANG[python]}
 * @param expected   what the constraint requires
 * @param got        what the document holds
 * @param message    human-readable summary
 */
public record Violation(ViolationCode code, String constraint, String expected, String got, String message) {

    public Violation {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(constraint, "constraint must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
