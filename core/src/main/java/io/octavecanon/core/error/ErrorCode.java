package io.octavecanon.core.error;

/**
 * Catalog of stable error codes raised by the tokenizer, parser and schema layer.
 *
 * <p>
 * Each constant carries a <em>family</em> code (e.g. {@code E007}) and a sub-code
 * (e.g. {@code E007_NESTED_FENCE}). Several sub-kinds may share one family; callers
 * that need to tell them apart must compare {@link #subCode()} or the enum constant
 * itself, never the message text.
 */
public enum ErrorCode {

    /** {@code KEY: value} on one line; blocks take no inline value. */
    SINGLE_COLON("E001", "E001_SINGLE_COLON"),
    /** {@code KEY::} followed by nothing. */
    MISSING_VALUE("E001", "E001_MISSING_VALUE"),
    /** A line with a key but neither {@code ::} nor {@code :}. */
    BARE_LINE("E001", "E001_BARE_LINE"),
    /** A token that cannot start a statement or value. */
    UNEXPECTED_TOKEN("E001", "E001_UNEXPECTED_TOKEN"),
    /** Tokens left on the line after a complete value. */
    TRAILING_TOKENS("E001", "E001_TRAILING_TOKENS"),
    /** A fenced zone that is not the value of an assignment. */
    ORPHAN_LITERAL_ZONE("E001", "E001_ORPHAN_LITERAL_ZONE"),
    /** An inline map value that is itself a list or map. */
    INLINE_MAP_NESTING("E001", "E001_INLINE_MAP_NESTING"),
    /** The same key twice inside one inline map. */
    DUPLICATE_INLINE_KEY("E001", "E001_DUPLICATE_INLINE_KEY"),
    /** A fenced zone used as a list item. */
    LITERAL_ZONE_IN_LIST("E001", "E001_LITERAL_ZONE_IN_LIST"),
    /** A {@code §} section header that does not follow {@code §ID::NAME[annotation]}. */
    MALFORMED_SECTION("E001", "E001_MALFORMED_SECTION"),
    /** A {@code ["example"∧REQ→§TARGET]} pattern whose constraint chain or target is malformed. */
    MALFORMED_PATTERN("E001", "E001_MALFORMED_PATTERN"),

    /** Content after {@code ===END===}. */
    CONTENT_AFTER_END("E002", "E002_CONTENT_AFTER_END"),

    /** Tab character in a normalizing zone. */
    TAB("E005", "E005_TAB"),
    /** A character the document format does not allow outside strings. */
    UNEXPECTED_CHARACTER("E005", "E005_UNEXPECTED_CHARACTER"),
    /** A double-quoted string without its closing quote. */
    UNTERMINATED_STRING("E005", "E005_UNTERMINATED_STRING"),
    /** Envelope name that does not match {@code [A-Z_][A-Z0-9_]*}. */
    INVALID_ENVELOPE_ID("E005", "E005_INVALID_ENVELOPE_ID"),
    /** Frontmatter opened with {@code ---} but never closed. */
    UNTERMINATED_FRONTMATTER("E005", "E005_UNTERMINATED_FRONTMATTER"),
    /** Input longer than the configured bound. */
    INPUT_TOO_LARGE("E005", "E005_INPUT_TOO_LARGE"),

    /** End of input reached inside a literal zone. */
    UNTERMINATED_FENCE("E006", "E006_UNTERMINATED_FENCE"),

    /** Equal-or-longer backtick run inside an open literal zone that is not a clean close. */
    NESTED_FENCE("E007", "E007_NESTED_FENCE"),
    /** End of input inside {@code [ ... }. */
    UNCLOSED_LIST("E007", "E007_UNCLOSED_LIST"),
    /** {@code ]} without a matching {@code [}. */
    UNBALANCED_BRACKET("E007", "E007_UNBALANCED_BRACKET"),

    /** Token stream has {@code FENCE_OPEN} without {@code FENCE_CLOSE}; internal inconsistency. */
    MISSING_FENCE_CLOSE("E008", "E008_MISSING_FENCE_CLOSE"),

    /** Constraint chain text that cannot be parsed. */
    CONSTRAINT_SYNTAX("E013", "E013_CONSTRAINT_SYNTAX");

    private final String family;
    private final String subCode;

    ErrorCode(String family, String subCode) {
        this.family = family;
        this.subCode = subCode;
    }

    /** Family code shared by related sub-kinds, e.g. {@code E007}. */
    public String family() {
        return family;
    }

    /** Stable sub-code, unique per constant. */
    public String subCode() {
        return subCode;
    }
}
