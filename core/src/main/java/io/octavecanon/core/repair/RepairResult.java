package io.octavecanon.core.repair;

import io.octavecanon.core.audit.Diagnostic;
import io.octavecanon.core.audit.RepairLog;
import io.octavecanon.core.model.Document;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link RepairEngine#repair}.
 *
 * @param document repaired document; the input document is never modified
 * @param log      changes derived from the tree diff, then one receipt per literal zone
 * @param warnings repair misses and refused FORBIDDEN candidates
 */
public record RepairResult(Document document, RepairLog log, List<Diagnostic> warnings) {

    public RepairResult {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(log, "log must not be null");
        warnings = List.copyOf(warnings);
    }
}
