package io.octavecanon.core.validation;

import java.util.Objects;

/**
 * A literal zone found during validation. Content is never part of the report.
 *
 * @param path    dotted path of the assignment holding the zone; for a keyless zone,
 *                the path of the block or section that contains it
 * @param infoTag the zone's info tag, or {@code null}
 */
public record LiteralZoneReport(String path, String infoTag) {

    public LiteralZoneReport {
        Objects.requireNonNull(path, "path must not be null");
    }
}
