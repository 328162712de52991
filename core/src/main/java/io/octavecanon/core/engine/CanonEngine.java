package io.octavecanon.core.engine;

import io.octavecanon.core.audit.Diagnostic;
import io.octavecanon.core.audit.RepairEntry;
import io.octavecanon.core.audit.RepairLog;
import io.octavecanon.core.audit.RepairTier;
import io.octavecanon.core.config.CanonConfig;
import io.octavecanon.core.emit.EmitOptions;
import io.octavecanon.core.emit.Emitter;
import io.octavecanon.core.error.CanonException;
import io.octavecanon.core.lexer.TokenStream;
import io.octavecanon.core.lexer.Tokenizer;
import io.octavecanon.core.model.Document;
import io.octavecanon.core.parser.ParseResult;
import io.octavecanon.core.parser.Parser;
import io.octavecanon.core.repair.RepairEngine;
import io.octavecanon.core.repair.RepairResult;
import io.octavecanon.core.schema.SchemaDefinition;
import io.octavecanon.core.spi.PipelineListener;
import io.octavecanon.core.validation.ValidationResult;
import io.octavecanon.core.validation.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pipeline facade: tokenize, parse, repair, validate, emit.
 *
 * <p>
 * Each stage is also exposed on its own. Every call works on its own input and
 * produces new values, so one engine can be shared across threads. Schemas are passed
 * per call; the engine holds no registry.
 *
 * <p>
 * Lexical and structural errors propagate as {@link CanonException} and no partial
 * result is returned. Validation errors are part of the result.
 */
public final class CanonEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CanonEngine.class);

    private final CanonConfig config;
    private final PipelineListener listener; // nullable
    private final Tokenizer tokenizer;

    /** Creates an engine with default settings and no listener. */
    public CanonEngine() {
        this(CanonConfig.defaults(), null);
    }

    public CanonEngine(CanonConfig config) {
        this(config, null);
    }

    /**
     * @param config   engine settings
     * @param listener observability hook, may be {@code null}
     */
    public CanonEngine(CanonConfig config, PipelineListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.listener = listener;
        this.tokenizer = new Tokenizer(config.maxInputChars());
    }

    public CanonConfig config() {
        return config;
    }

    public TokenStream tokenize(String text) {
        return tokenizer.tokenize(text);
    }

    /** Tokenizes and parses {@code text}. */
    public ParseResult parse(String text) {
        return Parser.parseWithLog(tokenize(text));
    }

    public String emit(Document doc) {
        return Emitter.emit(doc);
    }

    public String emit(Document doc, EmitOptions options) {
        return Emitter.emit(doc, options);
    }

    /** Validates {@code doc}, applying the configured unknown-field override. */
    public ValidationResult validate(Document doc, SchemaDefinition schema) {
        return Validator.validate(doc, effective(schema));
    }

    /** Repairs {@code doc} with REPAIR-tier rules on or off as configured. */
    public RepairResult repair(Document doc, SchemaDefinition schema) {
        return repair(doc, schema, config.repairApply());
    }

    public RepairResult repair(Document doc, SchemaDefinition schema, boolean apply) {
        return RepairEngine.repair(doc, effective(schema), apply);
    }

    /** Canonicalizes {@code text} without a schema. */
    public CanonicalizationResult canonicalize(String text) {
        return canonicalize(text, null);
    }

    /**
     * Runs the full pipeline.
     *
     * @param text   document text
     * @param schema schema for repair and validation, or {@code null}
     * @throws CanonException on lexical or structural errors
     */
    public CanonicalizationResult canonicalize(String text, SchemaDefinition schema) {
        Objects.requireNonNull(text, "text must not be null");
        long start = System.nanoTime();

        TokenStream tokens;
        ParseResult parsed;
        try {
            tokens = tokenize(text);
            parsed = Parser.parseWithLog(tokens);
        } catch (CanonException e) {
            long durationMs = elapsedMs(start);
            LOG.warn(
                    "canonicalize.failed code={} sub_code={} line={} column={} detail={}",
                    e.code(),
                    e.subCode(),
                    e.line(),
                    e.column(),
                    e.detail());
            notifyFailed(e, durationMs);
            throw e;
        }

        RepairResult repaired = repair(parsed.document(), schema);
        ValidationResult validation = validate(repaired.document(), schema);
        String canonical = Emitter.emit(repaired.document());

        RepairLog log = RepairLog.builder()
                .addAll(tokens.normalizations())
                .addAll(parsed.normalizations())
                .build()
                .concat(repaired.log());
        List<Diagnostic> warnings = new ArrayList<>(tokens.warnings());
        warnings.addAll(parsed.warnings());
        warnings.addAll(repaired.warnings());
        warnings.addAll(validation.warnings());

        long durationMs = elapsedMs(start);
        Document doc = repaired.document();
        LOG.info(
                "canonicalize.completed document={} tokens={} repairs={} preserved_zones={} valid={} "
                        + "validation_status={} warnings={} duration_ms={}",
                doc.name(),
                tokens.size(),
                log.changes().size(),
                log.preserved().size(),
                validation.valid(),
                validation.status().label(),
                warnings.size(),
                durationMs);

        for (RepairEntry entry : repaired.log().byTier(RepairTier.REPAIR)) {
            notifyRepairApplied(doc, entry);
        }
        notifyCompleted(doc, log, validation, durationMs);
        return new CanonicalizationResult(canonical, doc, log, validation, warnings);
    }

    private SchemaDefinition effective(SchemaDefinition schema) {
        if (schema == null || config.unknownFieldsOverride() == null) {
            return schema;
        }
        return schema.withUnknownFields(config.unknownFieldsOverride());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // --- Listener notification ---
    // Listener exceptions are caught and logged; they never affect the pipeline.

    private void notifyCompleted(Document doc, RepairLog log, ValidationResult validation, long durationMs) {
        if (listener == null) return;
        try {
            listener.onCanonicalizationCompleted(new PipelineListener.CanonicalizationCompletedEvent(
                    doc.name(),
                    log.changes().size(),
                    log.preserved().size(),
                    validation.valid(),
                    validation.status().label(),
                    durationMs));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onCanonicalizationCompleted failed", e);
        }
    }

    private void notifyFailed(CanonException error, long durationMs) {
        if (listener == null) return;
        try {
            listener.onCanonicalizationFailed(new PipelineListener.CanonicalizationFailedEvent(
                    error.code(), error.subCode(), error.line(), durationMs, error.detail()));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onCanonicalizationFailed failed", e);
        }
    }

    private void notifyRepairApplied(Document doc, RepairEntry entry) {
        if (listener == null) return;
        try {
            listener.onRepairApplied(new PipelineListener.RepairAppliedEvent(
                    doc.name(), entry.location(), entry.ruleId(), entry.semanticsChanged()));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onRepairApplied failed", e);
        }
    }
}
