package io.octavecanon.core.parser;

import io.octavecanon.core.audit.Diagnostic;
import io.octavecanon.core.audit.RepairEntry;
import io.octavecanon.core.model.Document;
import java.util.List;
import java.util.Objects;

/**
 * A parsed document together with what the parse stage had to say about it.
 *
 * @param document       the AST
 * @param warnings       non-fatal findings (duplicate keys, dropped list comments)
 * @param normalizations structural NORMALIZATION entries (envelope completion and the like)
 */
public record ParseResult(Document document, List<Diagnostic> warnings, List<RepairEntry> normalizations) {

    public ParseResult {
        Objects.requireNonNull(document, "document must not be null");
        warnings = List.copyOf(warnings);
        normalizations = List.copyOf(normalizations);
    }
}
