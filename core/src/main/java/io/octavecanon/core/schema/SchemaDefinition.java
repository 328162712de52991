package io.octavecanon.core.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Named, versioned set of field definitions passed explicitly to validation and repair.
 *
 * <p>
 * Fields keep the order in which they were added; validation reports errors in that
 * order. The unknown-field policy applies only to containers that hold at least one
 * defined field, plus {@code META}.
 */
public final class SchemaDefinition {

    private final String name;
    private final String version;
    private final Map<String, FieldDefinition> fields;
    private final UnknownFieldPolicy unknownFields;

    private SchemaDefinition(
            String name, String version, Map<String, FieldDefinition> fields, UnknownFieldPolicy unknownFields) {
        this.name = name;
        this.version = version;
        this.fields = Collections.unmodifiableMap(fields);
        this.unknownFields = unknownFields;
    }

    public static Builder builder(String name, String version) {
        return new Builder(name, version);
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public List<FieldDefinition> fields() {
        return List.copyOf(fields.values());
    }

    public Optional<FieldDefinition> field(String path) {
        return Optional.ofNullable(fields.get(path));
    }

    public UnknownFieldPolicy unknownFields() {
        return unknownFields;
    }

    /** Copy of this schema with a different unknown-field policy. */
    public SchemaDefinition withUnknownFields(UnknownFieldPolicy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        return new SchemaDefinition(name, version, new LinkedHashMap<>(fields), policy);
    }

    /** Container paths the unknown-field policy applies to. */
    public Set<String> coveredContainers() {
        Set<String> containers = new TreeSet<>();
        containers.add("META");
        for (FieldDefinition field : fields.values()) {
            containers.add(field.parentPath());
        }
        return containers;
    }

    @Override
    public String toString() {
        return "SchemaDefinition{name=" + name + ", version=" + version + ", fields=" + fields.size()
                + ", unknownFields=" + unknownFields + "}";
    }

    /** Builder; field paths must be unique. */
    public static final class Builder {

        private final String name;
        private final String version;
        private final List<FieldDefinition> fields = new ArrayList<>();
        private UnknownFieldPolicy unknownFields = UnknownFieldPolicy.WARN;

        private Builder(String name, String version) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.version = Objects.requireNonNull(version, "version must not be null");
        }

        public Builder field(FieldDefinition field) {
            fields.add(Objects.requireNonNull(field, "field must not be null"));
            return this;
        }

        public Builder field(String path, String chain) {
            return field(FieldDefinition.of(path, chain));
        }

        public Builder unknownFields(UnknownFieldPolicy policy) {
            this.unknownFields = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        public SchemaDefinition build() {
            Map<String, FieldDefinition> byPath = new LinkedHashMap<>();
            for (FieldDefinition field : fields) {
                if (byPath.putIfAbsent(field.path(), field) != null) {
                    throw new IllegalArgumentException("duplicate field path: '" + field.path() + "'");
                }
            }
            return new SchemaDefinition(name, version, byPath, unknownFields);
        }
    }
}
