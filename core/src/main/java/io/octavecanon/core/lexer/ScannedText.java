package io.octavecanon.core.lexer;

import io.octavecanon.core.audit.RepairEntry;
import java.util.List;

/**
 * Output of {@link ZoneScanner}: the normalized text together with the zone table built
 * against it.
 *
 * @param text           normalized text (NFC and LF outside literal zones and frontmatter)
 * @param fenceSpans     literal zones in document order
 * @param frontmatter    leading frontmatter block, or {@code null}
 * @param normalizations NORMALIZATION entries recorded while scanning
 */
public record ScannedText(
        String text, List<FenceSpan> fenceSpans, FrontmatterBlock frontmatter, List<RepairEntry> normalizations) {

    public ScannedText {
        fenceSpans = List.copyOf(fenceSpans);
        normalizations = List.copyOf(normalizations);
    }

    /** Whether {@code offset} lies in a preserving zone (literal zone or frontmatter). */
    public boolean isPreserved(int offset) {
        if (frontmatter != null && frontmatter.contains(offset)) {
            return true;
        }
        for (FenceSpan span : fenceSpans) {
            if (span.contains(offset)) {
                return true;
            }
            if (span.start() > offset) {
                return false;
            }
        }
        return false;
    }
}
