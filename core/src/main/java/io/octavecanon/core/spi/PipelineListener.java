package io.octavecanon.core.spi;

/**
 * SPI for observability hooks on {@code CanonEngine}.
 *
 * <p>
 * Adapters bridge these events to metrics or tracing systems; the core has no
 * telemetry dependency. Events are immutable and never carry literal zone content.
 * Implementations must be thread-safe and non-blocking. Exceptions thrown by a
 * listener are caught and logged by the engine and do not affect the pipeline.
 *
 * <p>
 * All methods have empty defaults so implementations override only what they need.
 */
public interface PipelineListener {

    /** Called after a document was canonicalized. */
    default void onCanonicalizationCompleted(CanonicalizationCompletedEvent event) {}

    /** Called when tokenizing or parsing failed. */
    default void onCanonicalizationFailed(CanonicalizationFailedEvent event) {}

    /** Called once for each REPAIR-tier change that was applied. */
    default void onRepairApplied(RepairAppliedEvent event) {}

    // --- Event records ---

    /** Emitted when canonicalization completes. */
    record CanonicalizationCompletedEvent(
            String documentName,
            int repairs,
            int preservedZones,
            boolean valid,
            String validationStatus,
            long durationMs) {}

    /** Emitted when canonicalization fails with a lexical or structural error. */
    record CanonicalizationFailedEvent(String code, String subCode, int line, long durationMs, String errorDetail) {}

    /** Emitted for each applied REPAIR-tier change. */
    record RepairAppliedEvent(String documentName, String location, String ruleId, boolean semanticsChanged) {}
}
