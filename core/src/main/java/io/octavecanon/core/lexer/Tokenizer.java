package io.octavecanon.core.lexer;

import io.octavecanon.core.audit.Diagnostic;
import io.octavecanon.core.audit.PipelineStage;
import io.octavecanon.core.audit.RepairEntry;
import io.octavecanon.core.error.ErrorCode;
import io.octavecanon.core.error.LexException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Zone-aware tokenizer. Stateless and thread-safe; each call works on its own buffers.
 *
 * <p>
 * Tokenizing runs in three steps:
 * <ol>
 * <li>{@link ZoneScanner} normalizes the text in a single pass and records literal zone
 * and frontmatter spans against the normalized buffer</li>
 * <li>tabs are rejected, consulting that span table so that tabs inside preserving
 * zones are accepted</li>
 * <li>the normalized buffer is lexed; each literal zone becomes the
 * {@code FENCE_OPEN}, optional {@code LITERAL_CONTENT}, {@code FENCE_CLOSE} triple and
 * its content never reaches the general lexing path</li>
 * </ol>
 */
public final class Tokenizer {

    private static final Logger LOG = LoggerFactory.getLogger(Tokenizer.class);

    static final Pattern ENVELOPE_ID = Pattern.compile("[A-Z_][A-Z0-9_]*");
    private static final Pattern ENVELOPE = Pattern.compile("===([^=\\n]*)===");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");
    private static final String OPERATOR_CHARS = "→⇌⊕⧺∧∨§@";

    /** Qualifier after a word: {@code <A>}, {@code <A,B>} or {@code <>}; braces are the repairable form. */
    private static final Pattern QUALIFIER =
            Pattern.compile("([<{])((?:[A-Za-z_](?:[A-Za-z0-9_,]*[A-Za-z0-9_])?)?)([>}])");

    private final int maxInputChars;

    /** Creates a tokenizer without an input size bound. */
    public Tokenizer() {
        this(0);
    }

    /**
     * @param maxInputChars largest accepted input length in chars, {@code 0} for no bound
     */
    public Tokenizer(int maxInputChars) {
        if (maxInputChars < 0) {
            throw new IllegalArgumentException("maxInputChars must be >= 0, got " + maxInputChars);
        }
        this.maxInputChars = maxInputChars;
    }

    /**
     * Tokenizes {@code text}.
     *
     * @throws LexException on any lexical error; no partial stream is returned
     */
    public TokenStream tokenize(String text) {
        Objects.requireNonNull(text, "text must not be null");
        if (maxInputChars > 0 && text.length() > maxInputChars) {
            throw new LexException(
                    ErrorCode.INPUT_TOO_LARGE,
                    String.format("input has %d characters, the configured limit is %d", text.length(), maxInputChars),
                    "split the document or raise input.max-chars",
                    1,
                    0);
        }
        ScannedText scanned = ZoneScanner.scan(text);
        rejectTabs(scanned);
        Lexer lexer = new Lexer(scanned);
        lexer.run();

        List<RepairEntry> normalizations = new ArrayList<>(scanned.normalizations());
        normalizations.addAll(lexer.log);
        LOG.debug(
                "tokenize.completed tokens={} literal_zones={} normalizations={}",
                lexer.tokens.size(),
                scanned.fenceSpans().size(),
                normalizations.size());
        return new TokenStream(
                lexer.tokens, scanned.fenceSpans(), scanned.text(), normalizations, lexer.warnings);
    }

    private static void rejectTabs(ScannedText scanned) {
        String text = scanned.text();
        int tab = text.indexOf('\t');
        while (tab >= 0) {
            if (!scanned.isPreserved(tab)) {
                int line = 1;
                int lineStart = 0;
                for (int i = 0; i < tab; i++) {
                    if (text.charAt(i) == '\n') {
                        line++;
                        lineStart = i + 1;
                    }
                }
                throw new LexException(
                        ErrorCode.TAB,
                        "tab character outside a literal zone",
                        "replace the tab with spaces; indentation uses 2 spaces per level",
                        line,
                        tab - lineStart + 1);
            }
            tab = text.indexOf('\t', tab + 1);
        }
    }

    /** Lexes one normalized buffer. */
    private static final class Lexer {

        private final String text;
        private final List<FenceSpan> spans;
        private final FrontmatterBlock frontmatter;
        private final List<Token> tokens = new ArrayList<>();
        private final List<RepairEntry> log = new ArrayList<>();
        private final List<Diagnostic> warnings = new ArrayList<>();

        private int pos;
        private int line = 1;
        private int column = 1;
        private int nextSpan;
        private boolean lineStart = true;

        Lexer(ScannedText scanned) {
            this.text = scanned.text();
            this.spans = scanned.fenceSpans();
            this.frontmatter = scanned.frontmatter();
        }

        void run() {
            while (pos < text.length()) {
                if (frontmatter != null && pos == frontmatter.start()) {
                    tokens.add(new Token(TokenType.FRONTMATTER, frontmatter.raw(), 1, 1));
                    jumpTo(frontmatter.end(), frontmatter.closeLine());
                    continue;
                }
                if (nextSpan < spans.size() && spans.get(nextSpan).start() == pos) {
                    emitZone(spans.get(nextSpan++));
                    continue;
                }
                if (lineStart) {
                    lineStart = false;
                    indentation();
                    continue;
                }
                lexToken();
            }
            tokens.add(new Token(TokenType.EOF, "", line, column));
        }

        private void indentation() {
            int spaces = 0;
            while (pos + spaces < text.length() && text.charAt(pos + spaces) == ' ') {
                spaces++;
            }
            boolean blank = pos + spaces >= text.length() || text.charAt(pos + spaces) == '\n';
            if (spaces > 0 && !blank && !spanStartsAt(pos + spaces)) {
                tokens.add(new Token(TokenType.INDENT, Integer.toString(spaces), line, column));
            }
            advance(spaces);
        }

        private boolean spanStartsAt(int offset) {
            return nextSpan < spans.size() && spans.get(nextSpan).start() == offset;
        }

        private void emitZone(FenceSpan span) {
            String open = span.infoTag() == null ? span.marker() : span.marker() + span.infoTag();
            tokens.add(new Token(TokenType.FENCE_OPEN, open, span.openLine(), span.openColumn()));
            if (!span.content().isEmpty()) {
                tokens.add(new Token(TokenType.LITERAL_CONTENT, span.content(), span.openLine() + 1, 1));
            }
            tokens.add(new Token(TokenType.FENCE_CLOSE, span.marker(), span.closeLine(), span.closeColumn()));
            jumpTo(span.end(), span.closeLine());
        }

        private void jumpTo(int offset, int lineNo) {
            pos = offset;
            line = lineNo;
            int lineBegin = text.lastIndexOf('\n', offset - 1) + 1;
            column = offset - lineBegin + 1;
            lineStart = false;
        }

        private void lexToken() {
            char c = text.charAt(pos);
            int startLine = line;
            int startColumn = column;

            if (c == '\n') {
                tokens.add(new Token(TokenType.NEWLINE, "\n", startLine, startColumn));
                pos++;
                line++;
                column = 1;
                lineStart = true;
                return;
            }
            if (c == ' ') {
                advance(1);
                return;
            }
            if (text.startsWith("//", pos)) {
                int eol = endOfLine();
                tokens.add(new Token(TokenType.COMMENT, text.substring(pos + 2, eol).strip(), startLine, startColumn));
                advance(eol - pos);
                return;
            }
            if (text.startsWith("===", pos)) {
                envelope(startLine, startColumn);
                return;
            }
            if (startColumn == 1 && text.startsWith("---", pos) && text.substring(pos + 3, endOfLine()).isBlank()) {
                tokens.add(new Token(TokenType.SEPARATOR, "---", startLine, startColumn));
                advance(endOfLine() - pos);
                return;
            }
            if (text.startsWith("::", pos)) {
                simple(TokenType.ASSIGN, "::", 2);
                return;
            }
            if (c == ':') {
                simple(TokenType.BLOCK, ":", 1);
                return;
            }
            if (c == '[') {
                simple(TokenType.LIST_START, "[", 1);
                return;
            }
            if (c == ']') {
                simple(TokenType.LIST_END, "]", 1);
                return;
            }
            if (c == ',') {
                simple(TokenType.COMMA, ",", 1);
                return;
            }
            if (c == '"') {
                string(startLine, startColumn);
                return;
            }
            if (operator()) {
                return;
            }
            if (Character.isDigit(c) || (c == '-' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
                number(startLine, startColumn);
                return;
            }
            if (c == '$' && pos + 1 < text.length() && isIdentifierStart(text.codePointAt(pos + 1))) {
                int end = identifierEnd(pos + 1);
                tokens.add(new Token(TokenType.VARIABLE, text.substring(pos, end), startLine, startColumn));
                advance(end - pos);
                return;
            }
            int cp = text.codePointAt(pos);
            if (isIdentifierStart(cp)) {
                word(startLine, startColumn);
                return;
            }
            throw unexpected(cp, startLine, startColumn);
        }

        private void envelope(int startLine, int startColumn) {
            Matcher m = ENVELOPE.matcher(text).region(pos, text.length());
            if (!m.lookingAt()) {
                throw new LexException(
                        ErrorCode.INVALID_ENVELOPE_ID,
                        "malformed envelope marker",
                        "write the envelope as ===NAME=== on its own line",
                        startLine,
                        startColumn);
            }
            String name = m.group(1);
            if (name.equals("END")) {
                tokens.add(new Token(TokenType.ENVELOPE_END, name, startLine, startColumn));
            } else if (ENVELOPE_ID.matcher(name).matches()) {
                tokens.add(new Token(TokenType.ENVELOPE_START, name, startLine, startColumn));
            } else {
                throw new LexException(
                        ErrorCode.INVALID_ENVELOPE_ID,
                        String.format("envelope name '%s' is not a valid document name", name),
                        "use uppercase letters, digits and underscores starting with a letter or underscore,"
                                + " e.g. ===MY_DOCUMENT===",
                        startLine,
                        startColumn);
            }
            advance(m.end() - pos);
        }

        private void string(int startLine, int startColumn) {
            if (text.startsWith("\"\"\"", pos)) {
                int close = text.indexOf("\"\"\"", pos + 3);
                if (close < 0) {
                    throw unterminatedString(startLine, startColumn, "\"\"\"");
                }
                String value = text.substring(pos + 3, close);
                tokens.add(new Token(TokenType.STRING, value, startLine, startColumn));
                log.add(RepairEntry.normalization(
                        PipelineStage.TOKENIZE,
                        Diagnostic.at(startLine, startColumn),
                        "triple_quote_string",
                        "\"\"\"" + value + "\"\"\"",
                        "\"" + value + "\""));
                int consumed = close + 3 - pos;
                for (int i = pos; i < close + 3; i++) {
                    if (text.charAt(i) == '\n') {
                        line++;
                        column = 1;
                    } else {
                        column++;
                    }
                }
                pos += consumed;
                return;
            }
            StringBuilder value = new StringBuilder();
            int i = pos + 1;
            while (true) {
                if (i >= text.length() || text.charAt(i) == '\n') {
                    throw unterminatedString(startLine, startColumn, "\"");
                }
                char ch = text.charAt(i);
                if (ch == '"') {
                    break;
                }
                if (ch == '\\' && i + 1 < text.length()) {
                    char esc = text.charAt(i + 1);
                    switch (esc) {
                        case 'n' -> value.append('\n');
                        case 't' -> value.append('\t');
                        case 'r' -> value.append('\r');
                        case '"' -> value.append('"');
                        case '\\' -> value.append('\\');
                        default -> value.append('\\').append(esc);
                    }
                    i += 2;
                    continue;
                }
                value.append(ch);
                i++;
            }
            tokens.add(new Token(TokenType.STRING, value.toString(), startLine, startColumn));
            advance(i + 1 - pos);
        }

        private LexException unterminatedString(int startLine, int startColumn, String quote) {
            return new LexException(
                    ErrorCode.UNTERMINATED_STRING,
                    "string starting with " + quote + " is never closed",
                    "close the string with " + quote + " on the same line, or use a literal zone for multi-line text",
                    startLine,
                    startColumn);
        }

        private boolean operator() {
            if (text.startsWith("<->", pos)) {
                alias(TokenType.TENSION, "<->");
                return true;
            }
            if (text.startsWith("->", pos)) {
                alias(TokenType.FLOW, "->");
                return true;
            }
            char c = text.charAt(pos);
            switch (c) {
                case '→' -> simple(TokenType.FLOW, "→", 1);
                case '⇌' -> simple(TokenType.TENSION, "⇌", 1);
                case '⊕' -> simple(TokenType.SYNTHESIS, "⊕", 1);
                case '⧺' -> simple(TokenType.CONCAT, "⧺", 1);
                case '∧' -> simple(TokenType.CONSTRAINT, "∧", 1);
                case '∨' -> simple(TokenType.ALTERNATIVE, "∨", 1);
                case '@' -> simple(TokenType.AT, "@", 1);
                case '§' -> simple(TokenType.SECTION, "§", 1);
                case '+' -> alias(TokenType.SYNTHESIS, "+");
                case '~' -> alias(TokenType.CONCAT, "~");
                case '&' -> alias(TokenType.CONSTRAINT, "&");
                case '|' -> alias(TokenType.ALTERNATIVE, "|");
                case '#' -> alias(TokenType.SECTION, "#");
                default -> {
                    return false;
                }
            }
            return true;
        }

        private void alias(TokenType type, String ascii) {
            log.add(RepairEntry.normalization(
                    PipelineStage.TOKENIZE, Diagnostic.at(line, column), "ascii_operator_alias", ascii, type.symbol()));
            tokens.add(new Token(type, type.symbol(), line, column));
            advance(ascii.length());
        }

        private void number(int startLine, int startColumn) {
            Matcher m = NUMBER.matcher(text).region(pos, text.length());
            if (!m.lookingAt()) {
                throw unexpected(text.codePointAt(pos), startLine, startColumn);
            }
            int end = m.end();
            if (end < text.length() && isIdentifierPart(text, end)) {
                // 1.0.0, 3rd, 2b: a bare word that happens to start with a digit
                int wordEnd = identifierEnd(end);
                tokens.add(new Token(TokenType.IDENTIFIER, text.substring(pos, wordEnd), startLine, startColumn));
                advance(wordEnd - pos);
                return;
            }
            tokens.add(new Token(TokenType.NUMBER, m.group(), startLine, startColumn));
            advance(end - pos);
        }

        private void word(int startLine, int startColumn) {
            int end = identifierEnd(pos);
            String word = text.substring(pos, end);
            if (annotated(word, end, startLine, startColumn)) {
                return;
            }
            switch (word) {
                case "true", "false" -> tokens.add(new Token(TokenType.BOOLEAN, word, startLine, startColumn));
                case "null" -> tokens.add(new Token(TokenType.NULL, word, startLine, startColumn));
                case "vs" -> {
                    log.add(RepairEntry.normalization(
                            PipelineStage.TOKENIZE,
                            Diagnostic.at(startLine, startColumn),
                            "ascii_operator_alias",
                            "vs",
                            TokenType.TENSION.symbol()));
                    tokens.add(new Token(TokenType.TENSION, TokenType.TENSION.symbol(), startLine, startColumn));
                }
                default -> {
                    if (isWrongCaseLiteral(word)) {
                        warnings.add(new Diagnostic(
                                "W_LITERAL_CASE",
                                String.format(
                                        "'%s' is read as an identifier; literals are lowercase (%s)",
                                        word, word.toLowerCase(Locale.ROOT)),
                                Diagnostic.at(startLine, startColumn)));
                    }
                    tokens.add(new Token(TokenType.IDENTIFIER, word, startLine, startColumn));
                }
            }
            advance(end - pos);
        }

        /**
         * {@code NAME<qualifier>} is one identifier. {@code NAME{qualifier}} is accepted
         * and logged as rewritten to the angle form.
         */
        private boolean annotated(String word, int end, int startLine, int startColumn) {
            if (end >= text.length() || word.endsWith("-")) {
                return false;
            }
            Matcher m = QUALIFIER.matcher(text).region(end, text.length());
            if (!m.lookingAt()) {
                return false;
            }
            boolean angle = m.group(1).equals("<");
            if (angle != m.group(3).equals(">")) {
                return false;
            }
            String canonical = word + "<" + m.group(2) + ">";
            if (!angle) {
                log.add(RepairEntry.normalization(
                        PipelineStage.TOKENIZE,
                        Diagnostic.at(startLine, startColumn),
                        "curly_brace_annotation",
                        text.substring(pos, m.end()),
                        canonical));
            }
            tokens.add(new Token(TokenType.IDENTIFIER, canonical, startLine, startColumn));
            advance(m.end() - pos);
            return true;
        }

        private static boolean isWrongCaseLiteral(String word) {
            return word.equalsIgnoreCase("true") || word.equalsIgnoreCase("false") || word.equalsIgnoreCase("null");
        }

        private int identifierEnd(int from) {
            int i = from;
            while (i < text.length() && isIdentifierPart(text, i)) {
                i += Character.charCount(text.codePointAt(i));
            }
            return i;
        }

        private static boolean isIdentifierStart(int cp) {
            if (OPERATOR_CHARS.indexOf(cp) >= 0) {
                return false;
            }
            return Character.isLetter(cp)
                    || cp == '_'
                    || cp == '.'
                    || cp == '/'
                    || Character.getType(cp) == Character.OTHER_SYMBOL;
        }

        private static boolean isIdentifierPart(String text, int i) {
            int cp = text.codePointAt(i);
            if (cp == '-') {
                return i + 1 >= text.length() || text.charAt(i + 1) != '>';
            }
            if (cp == '/') {
                return i + 1 >= text.length() || text.charAt(i + 1) != '/';
            }
            if (isIdentifierStart(cp) || Character.isDigit(cp)) {
                return true;
            }
            int type = Character.getType(cp);
            return type == Character.NON_SPACING_MARK
                    || type == Character.COMBINING_SPACING_MARK
                    || type == Character.ENCLOSING_MARK
                    || type == Character.FORMAT;
        }

        private LexException unexpected(int cp, int startLine, int startColumn) {
            String shown = new String(Character.toChars(cp));
            String remediation = cp == '`'
                    ? "put literal text in a fenced zone on the line after KEY::, or wrap the value in double quotes"
                    : "remove the character or wrap the value in double quotes";
            return new LexException(
                    ErrorCode.UNEXPECTED_CHARACTER,
                    String.format("unexpected character '%s' (U+%04X)", shown, cp),
                    remediation,
                    startLine,
                    startColumn);
        }

        private void simple(TokenType type, String value, int length) {
            tokens.add(new Token(type, value, line, column));
            advance(length);
        }

        private int endOfLine() {
            int eol = text.indexOf('\n', pos);
            return eol < 0 ? text.length() : eol;
        }

        /** Advances over {@code chars} UTF-16 units that contain no line break. */
        private void advance(int chars) {
            int end = pos + chars;
            column += text.codePointCount(pos, end);
            pos = end;
        }
    }
}
