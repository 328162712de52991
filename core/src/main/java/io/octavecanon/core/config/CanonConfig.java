package io.octavecanon.core.config;

import io.octavecanon.core.schema.UnknownFieldPolicy;

/**
 * Engine settings.
 *
 * <p>
 * Defaults: REPAIR-tier rules off, the schema's own unknown-field policy, and no
 * input size bound.
 *
 * @param repairApply          whether REPAIR-tier rules run ({@code repair.apply})
 * @param unknownFieldsOverride policy that replaces the schema's own, or {@code null}
 *                             ({@code validation.unknown-fields})
 * @param maxInputChars        largest accepted input in chars, {@code 0} for no bound
 *                             ({@code input.max-chars})
 */
public record CanonConfig(boolean repairApply, UnknownFieldPolicy unknownFieldsOverride, int maxInputChars) {

    public CanonConfig {
        if (maxInputChars < 0) {
            throw new IllegalArgumentException("maxInputChars must be >= 0, got " + maxInputChars);
        }
    }

    public static CanonConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private boolean repairApply;
        private UnknownFieldPolicy unknownFieldsOverride;
        private int maxInputChars;

        private Builder() {}

        public Builder repairApply(boolean repairApply) {
            this.repairApply = repairApply;
            return this;
        }

        public Builder unknownFieldsOverride(UnknownFieldPolicy policy) {
            this.unknownFieldsOverride = policy;
            return this;
        }

        public Builder maxInputChars(int maxInputChars) {
            this.maxInputChars = maxInputChars;
            return this;
        }

        public CanonConfig build() {
            return new CanonConfig(repairApply, unknownFieldsOverride, maxInputChars);
        }
    }
}
