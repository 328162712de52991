package io.octavecanon.core.audit;

import java.util.Objects;

/**
 * A non-fatal finding reported alongside a result: wrong-case literals, duplicate keys,
 * repair misses, unknown fields under a lenient policy.
 *
 * @param code     stable warning code, e.g. {@code W_DUPLICATE_KEY}
 * @param message  human-readable description
 * @param location dotted field path or {@code line N, column M}
 */
public record Diagnostic(String code, String message, String location) {

    public Diagnostic {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }

    /** Formats a source position for use as a location. */
    public static String at(int line, int column) {
        return "line " + line + ", column " + column;
    }

    /** Formats a whole-line source position for use as a location. */
    public static String atLine(int line) {
        return "line " + line;
    }
}
