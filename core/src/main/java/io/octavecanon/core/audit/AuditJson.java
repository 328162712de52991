package io.octavecanon.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.octavecanon.core.error.CanonException;
import io.octavecanon.core.validation.LiteralZoneReport;
import io.octavecanon.core.validation.ValidationError;
import io.octavecanon.core.validation.ValidationResult;
import java.util.List;

/**
 * JSON rendering of repair logs, validation results and pipeline errors for audit
 * tooling.
 *
 * <p>
 * Field names are snake_case. {@code validation_status} and
 * {@code literal_zones_validated} are always written. Literal zone content never
 * appears; receipts carry hashes only.
 */
public final class AuditJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private AuditJson() {
        // utility class
    }

    /** {@code [{stage, kind, location, rule, before, after, tier, semantics_changed}, ...]}. */
    public static ArrayNode toJson(RepairLog log) {
        ArrayNode array = NODES.arrayNode();
        for (RepairEntry entry : log.entries()) {
            ObjectNode node = array.addObject();
            node.put("stage", entry.stage().name());
            node.put("kind", entry.kind().name());
            node.put("location", entry.location());
            node.put("rule", entry.ruleId());
            node.put("before", entry.before());
            node.put("after", entry.after());
            node.put("tier", entry.tier().name());
            node.put("semantics_changed", entry.semanticsChanged());
        }
        return array;
    }

    /** {@code {valid, validation_status, literal_zones_validated, literal_zones, errors, warnings}}. */
    public static ObjectNode toJson(ValidationResult result) {
        ObjectNode node = NODES.objectNode();
        node.put("valid", result.valid());
        node.put("validation_status", result.status().label());
        node.put("literal_zones_validated", result.literalZonesValidated());
        ArrayNode zones = node.putArray("literal_zones");
        for (LiteralZoneReport zone : result.literalZones()) {
            ObjectNode z = zones.addObject();
            z.put("path", zone.path());
            if (zone.infoTag() == null) {
                z.putNull("info_tag");
            } else {
                z.put("info_tag", zone.infoTag());
            }
        }
        ArrayNode errors = node.putArray("errors");
        for (ValidationError error : result.errors()) {
            ObjectNode e = errors.addObject();
            e.put("code", error.code().code());
            e.put("kind", error.code().name());
            e.put("field", error.fieldPath());
            e.put("constraint", error.constraint());
            e.put("expected", error.expected());
            e.put("got", error.got());
            e.put("message", error.message());
        }
        node.set("warnings", diagnostics(result.warnings()));
        return node;
    }

    /** {@code {code, sub_code, phase, line, column, detail, remediation}}. */
    public static ObjectNode toJson(CanonException error) {
        ObjectNode node = NODES.objectNode();
        node.put("code", error.code());
        node.put("sub_code", error.subCode());
        node.put("phase", error.phase().name());
        node.put("line", error.line());
        node.put("column", error.column());
        node.put("detail", error.detail());
        node.put("remediation", error.remediation());
        return node;
    }

    public static ArrayNode diagnostics(List<Diagnostic> diagnostics) {
        ArrayNode array = NODES.arrayNode();
        for (Diagnostic diagnostic : diagnostics) {
            ObjectNode d = array.addObject();
            d.put("code", diagnostic.code());
            d.put("location", diagnostic.location());
            d.put("message", diagnostic.message());
        }
        return array;
    }

    /** Compact JSON text. */
    public static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON tree could not be written", e);
        }
    }
}
