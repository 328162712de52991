package io.octavecanon.core.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered sequence of {@link RepairEntry} values. Consumed by audit tooling;
 * entries appear in the order the pipeline produced them.
 */
public final class RepairLog {

    private static final RepairLog EMPTY = new RepairLog(List.of());

    private final List<RepairEntry> entries;

    private RepairLog(List<RepairEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static RepairLog empty() {
        return EMPTY;
    }

    public static RepairLog of(List<RepairEntry> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        return entries.isEmpty() ? EMPTY : new RepairLog(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<RepairEntry> entries() {
        return entries;
    }

    /** Entries that rewrote something. */
    public List<RepairEntry> changes() {
        return entries.stream().filter(e -> !e.isPreserved()).toList();
    }

    /** Literal zone receipts. */
    public List<RepairEntry> preserved() {
        return entries.stream().filter(RepairEntry::isPreserved).toList();
    }

    public List<RepairEntry> byTier(RepairTier tier) {
        return entries.stream()
                .filter(e -> !e.isPreserved() && e.tier() == tier)
                .toList();
    }

    public List<RepairEntry> byStage(PipelineStage stage) {
        return entries.stream().filter(e -> e.stage() == stage).toList();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Returns a new log holding this log's entries followed by {@code other}'s. */
    public RepairLog concat(RepairLog other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<RepairEntry> merged = new ArrayList<>(entries.size() + other.entries.size());
        merged.addAll(entries);
        merged.addAll(other.entries);
        return new RepairLog(merged);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RepairLog other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "RepairLog" + entries;
    }

    /** Accumulates entries while a stage runs. Not thread-safe; one per invocation. */
    public static final class Builder {

        private final List<RepairEntry> entries = new ArrayList<>();

        private Builder() {}

        public Builder add(RepairEntry entry) {
            entries.add(Objects.requireNonNull(entry, "entry must not be null"));
            return this;
        }

        public Builder addAll(List<RepairEntry> more) {
            more.forEach(this::add);
            return this;
        }

        public RepairLog build() {
            return RepairLog.of(entries);
        }
    }
}
