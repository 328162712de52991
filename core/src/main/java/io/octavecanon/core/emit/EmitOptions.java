package io.octavecanon.core.emit;

/**
 * Layout choices for {@link Emitter#emit(io.octavecanon.core.model.Document, EmitOptions)}.
 *
 * <p>
 * {@link #canonical()} is the layout of
 * {@link Emitter#emit(io.octavecanon.core.model.Document)}. The other settings change
 * only comments, node order and blank lines, so text emitted with any options still
 * parses; with {@code stripComments} or {@code sortKeys} it parses to a document that
 * differs from the input in those nodes.
 *
 * @param stripComments           drop every comment node
 * @param sortKeys                within each container, put assignments first ordered by
 *                                key, then the remaining nodes in their original order
 * @param stripTrailingWhitespace remove trailing spaces and tabs from comment lines
 * @param separateSections        put one blank line before every top-level section
 *                                that follows another top-level section
 */
public record EmitOptions(
        boolean stripComments, boolean sortKeys, boolean stripTrailingWhitespace, boolean separateSections) {

    private static final EmitOptions CANONICAL = builder().build();

    public static EmitOptions canonical() {
        return CANONICAL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private boolean stripComments;
        private boolean sortKeys;
        private boolean stripTrailingWhitespace = true;
        private boolean separateSections;

        private Builder() {}

        public Builder stripComments(boolean stripComments) {
            this.stripComments = stripComments;
            return this;
        }

        public Builder sortKeys(boolean sortKeys) {
            this.sortKeys = sortKeys;
            return this;
        }

        public Builder stripTrailingWhitespace(boolean stripTrailingWhitespace) {
            this.stripTrailingWhitespace = stripTrailingWhitespace;
            return this;
        }

        public Builder separateSections(boolean separateSections) {
            this.separateSections = separateSections;
            return this;
        }

        public EmitOptions build() {
            return new EmitOptions(stripComments, sortKeys, stripTrailingWhitespace, separateSections);
        }
    }
}
