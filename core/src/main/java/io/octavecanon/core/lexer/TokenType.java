package io.octavecanon.core.lexer;

/** Closed set of token kinds produced by the {@link Tokenizer}. */
public enum TokenType {
    FRONTMATTER,
    ENVELOPE_START,
    ENVELOPE_END,
    SEPARATOR,

    ASSIGN,
    BLOCK,
    LIST_START,
    LIST_END,
    COMMA,

    IDENTIFIER,
    VARIABLE,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,

    FLOW("→"),
    TENSION("⇌"),
    SYNTHESIS("⊕"),
    CONCAT("⧺"),
    CONSTRAINT("∧"),
    ALTERNATIVE("∨"),
    AT("@"),
    SECTION("§"),

    COMMENT,
    INDENT,
    NEWLINE,

    FENCE_OPEN,
    LITERAL_CONTENT,
    FENCE_CLOSE,

    EOF;

    private final String symbol;

    TokenType() {
        this(null);
    }

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /** Canonical operator symbol, or {@code null} for non-operator kinds. */
    public String symbol() {
        return symbol;
    }

    /** Whether this kind may appear inside a flow expression such as {@code A→B⊕C}. */
    public boolean isExpressionOperator() {
        return symbol != null && this != SECTION;
    }
}
