package io.octavecanon.core.audit;

import java.util.Objects;

/**
 * One transformation recorded in a {@link RepairLog}.
 *
 * <p>
 * A {@link Kind#CHANGE} entry describes a value or structure that was rewritten:
 * {@code before} and {@code after} hold the old and new representation. A
 * {@link Kind#PRESERVED} entry is a receipt for a literal zone that passed through a
 * stage untouched: {@code before} and {@code after} hold the SHA-256 content hashes
 * taken on either side of the stage, and are always equal.
 *
 * @param stage            stage that performed the transformation
 * @param kind             change or preservation receipt
 * @param location         dotted field path or {@code line N, column M}
 * @param ruleId           stable identifier of the rule that fired
 * @param before           representation before the transformation
 * @param after            representation after the transformation
 * @param tier             NORMALIZATION or REPAIR; FORBIDDEN is rejected
 * @param semanticsChanged whether the transformation changed meaning
 */
public record RepairEntry(
        PipelineStage stage,
        Kind kind,
        String location,
        String ruleId,
        String before,
        String after,
        RepairTier tier,
        boolean semanticsChanged) {

    /** Rule id used for literal zone receipts. */
    public static final String PRESERVED_RULE = "literal_zone_preserved";

    public enum Kind {
        CHANGE,
        PRESERVED
    }

    public RepairEntry {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        if (tier == RepairTier.FORBIDDEN) {
            throw new IllegalArgumentException(
                    "FORBIDDEN transformations are never performed and cannot be logged: " + ruleId + " at " + location);
        }
    }

    /** A NORMALIZATION-tier change; never changes semantics. */
    public static RepairEntry normalization(
            PipelineStage stage, String location, String ruleId, String before, String after) {
        return new RepairEntry(stage, Kind.CHANGE, location, ruleId, before, after, RepairTier.NORMALIZATION, false);
    }

    /** A REPAIR-tier change applied on request. */
    public static RepairEntry repair(
            String location, String ruleId, String before, String after, boolean semanticsChanged) {
        return new RepairEntry(
                PipelineStage.REPAIR, Kind.CHANGE, location, ruleId, before, after, RepairTier.REPAIR, semanticsChanged);
    }

    /** A receipt for a literal zone that passed through a stage untouched. */
    public static RepairEntry preserved(PipelineStage stage, String location, String preHash, String postHash) {
        return new RepairEntry(
                stage, Kind.PRESERVED, location, PRESERVED_RULE, preHash, postHash, RepairTier.NORMALIZATION, false);
    }

    /** Whether this is a literal zone receipt. */
    public boolean isPreserved() {
        return kind == Kind.PRESERVED;
    }
}
