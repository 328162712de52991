package io.octavecanon.core.parser;

import io.octavecanon.core.audit.Diagnostic;
import io.octavecanon.core.audit.PipelineStage;
import io.octavecanon.core.audit.RepairEntry;
import io.octavecanon.core.error.ConstraintSyntaxException;
import io.octavecanon.core.error.ErrorCode;
import io.octavecanon.core.error.ParseException;
import io.octavecanon.core.lexer.Token;
import io.octavecanon.core.lexer.TokenStream;
import io.octavecanon.core.lexer.TokenType;
import io.octavecanon.core.model.Document;
import io.octavecanon.core.model.Node;
import io.octavecanon.core.model.Value;
import io.octavecanon.core.schema.ConstraintChain;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser from a {@link TokenStream} to a {@link Document}.
 *
 * <p>
 * Blocks are built from indentation: the children of {@code KEY:} are the following
 * lines indented deeper than the key. Literal zones are built directly from the
 * {@code FENCE_OPEN}, optional {@code LITERAL_CONTENT}, {@code FENCE_CLOSE} token
 * triple and never pass through general value parsing.
 *
 * <p>
 * Any structural error aborts the parse with a {@link ParseException}; no partial
 * document is returned.
 */
public final class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    /** Envelope name used when the input has no {@code ===NAME===} line. */
    public static final String INFERRED_NAME = "INFERRED";

    private static final String META = "META";

    private Parser() {
        // utility class
    }

    /**
     * Parses {@code tokens} into a document.
     *
     * @throws ParseException on any structural error
     */
    public static Document parse(TokenStream tokens) {
        return parseWithLog(tokens).document();
    }

    /**
     * Parses {@code tokens} and also returns parse-stage warnings and normalizations.
     *
     * @throws ParseException on any structural error
     */
    public static ParseResult parseWithLog(TokenStream tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        ParseResult result = new State(tokens.tokens()).document();
        LOG.debug(
                "parse.completed document={} meta_nodes={} body_nodes={} warnings={}",
                result.document().name(),
                result.document().meta().size(),
                result.document().body().size(),
                result.warnings().size());
        return result;
    }

    /** Cursor over one token list. */
    private static final class State {

        private final List<Token> tokens;
        private final List<Diagnostic> warnings = new ArrayList<>();
        private final List<RepairEntry> log = new ArrayList<>();
        private int index;

        State(List<Token> tokens) {
            this.tokens = tokens;
        }

        ParseResult document() {
            skipNewlines();
            String frontmatter = null;
            if (peek().is(TokenType.FRONTMATTER)) {
                Token fm = next();
                if (fm.value().isBlank()) {
                    log.add(RepairEntry.normalization(
                            PipelineStage.PARSE, Diagnostic.atLine(1), "frontmatter_blank_dropped", fm.value(), ""));
                } else {
                    frontmatter = fm.value();
                }
                skipNewlines();
            }
            if (peekPastIndent().is(TokenType.COMMENT)) {
                Token comment = peekPastIndent();
                throw new ParseException(
                        ErrorCode.UNEXPECTED_TOKEN,
                        "comment before the ===NAME=== envelope",
                        "move the comment inside the envelope",
                        comment.line(),
                        comment.column());
            }

            String name;
            if (peekPastIndent().is(TokenType.ENVELOPE_START)) {
                skipIndent();
                name = next().value();
                endOfLine("the envelope");
            } else {
                name = INFERRED_NAME;
                log.add(RepairEntry.normalization(
                        PipelineStage.PARSE,
                        Diagnostic.atLine(peek().line()),
                        "envelope_inferred",
                        "",
                        "===" + INFERRED_NAME + "==="));
            }

            skipNewlines();
            List<Node> meta = List.of();
            if (startsMeta()) {
                int metaIndent = peek().is(TokenType.INDENT) ? Integer.parseInt(peek().value()) : 0;
                skipIndent();
                Token key = next();
                next(); // BLOCK
                List<Node> children = new ArrayList<>();
                blockHeaderRest(key, children);
                children.addAll(nodes(metaIndent));
                if (children.isEmpty()) {
                    log.add(RepairEntry.normalization(
                            PipelineStage.PARSE, Diagnostic.atLine(key.line()), "empty_meta_dropped", "META:", ""));
                }
                meta = children;
            }

            skipNewlines();
            boolean separator = false;
            if (peekPastIndent().is(TokenType.SEPARATOR)) {
                skipIndent();
                next();
                separator = true;
                endOfLine("the separator");
            }

            List<Node> body = nodes(-1);

            skipNewlines();
            skipIndent();
            Token end = peek();
            if (end.is(TokenType.ENVELOPE_END)) {
                next();
                skipNewlines();
                Token after = peek();
                if (!after.is(TokenType.EOF)) {
                    throw new ParseException(
                            ErrorCode.CONTENT_AFTER_END,
                            "found " + describe(after) + " after ===END===",
                            "move the content inside the envelope or remove it; one document per input",
                            after.line(),
                            after.column());
                }
            } else if (end.is(TokenType.EOF)) {
                log.add(RepairEntry.normalization(
                        PipelineStage.PARSE, Diagnostic.atLine(end.line()), "envelope_end_completed", "", "===END==="));
            } else {
                throw unexpected(end, "start the line with KEY::value, KEY:, §ID::NAME or //");
            }

            return new ParseResult(new Document(name, frontmatter, meta, separator, body), warnings, log);
        }

        private boolean startsMeta() {
            int i = index;
            if (tokens.get(i).is(TokenType.INDENT)) {
                i++;
            }
            return tokens.get(i).is(TokenType.IDENTIFIER)
                    && tokens.get(i).value().equals(META)
                    && tokens.get(i + 1).is(TokenType.BLOCK);
        }

        /**
         * Parses the lines indented deeper than {@code parentIndent}. Stops at a shallower
         * line, the end envelope or end of input.
         */
        private List<Node> nodes(int parentIndent) {
            List<Node> nodes = new ArrayList<>();
            Set<String> keys = new HashSet<>();
            while (true) {
                skipNewlines();
                Token first = peek();
                int indent = first.is(TokenType.INDENT) ? Integer.parseInt(first.value()) : 0;
                if (first.is(TokenType.FENCE_OPEN)) {
                    indent = first.column() - 1;
                }
                Token lead = peekPastIndent();
                if (lead.is(TokenType.EOF) || lead.is(TokenType.ENVELOPE_END) || indent <= parentIndent) {
                    return nodes;
                }
                skipIndent();
                int before = nodes.size();
                statement(indent, parentIndent >= 0, nodes);
                for (int i = before; i < nodes.size(); i++) {
                    String key = keyOf(nodes.get(i));
                    if (key != null && !key.isEmpty() && !keys.add(key)) {
                        warnings.add(new Diagnostic(
                                "W_DUPLICATE_KEY",
                                String.format("key '%s' appears more than once; readers use the last occurrence", key),
                                Diagnostic.atLine(lead.line())));
                    }
                }
            }
        }

        private static String keyOf(Node node) {
            if (node instanceof Node.Assignment a) {
                return a.key();
            }
            if (node instanceof Node.Block b) {
                return b.key();
            }
            return null;
        }

        private void statement(int indent, boolean nested, List<Node> nodes) {
            Token t = peek();
            switch (t.type()) {
                case COMMENT -> {
                    next();
                    nodes.add(new Node.Comment(t.value()));
                    endOfLine("the comment");
                }
                case SECTION -> nodes.add(section(indent));
                case IDENTIFIER -> keyed(indent, nodes);
                case LIST_END -> throw new ParseException(
                        ErrorCode.UNBALANCED_BRACKET,
                        "']' without a matching '['",
                        "remove the ']' or add the missing '['",
                        t.line(),
                        t.column());
                case FENCE_OPEN -> {
                    if (!nested) {
                        throw orphanZone(t);
                    }
                    nodes.add(new Node.Assignment("", literalZone()));
                    endOfLine("the literal zone");
                }
                default -> throw unexpected(t, "start the line with KEY::value, KEY:, §ID::NAME or //");
            }
        }

        /** Top-level zones need a key; inside a block or section a bare zone is a keyless child. */
        private ParseException orphanZone(Token t) {
            return new ParseException(
                    ErrorCode.ORPHAN_LITERAL_ZONE,
                    "literal zone opened at line " + t.line() + " is not the value of an assignment",
                    "put KEY:: on the line before the opening fence, or indent the zone under a block",
                    t.line(),
                    t.column());
        }

        private void keyed(int indent, List<Node> nodes) {
            Token key = next();
            Token op = peek();
            if (op.is(TokenType.ASSIGN)) {
                next();
                Value value = assignmentValue(key);
                nodes.add(new Node.Assignment(key.value(), value));
                valueEnd(key, nodes);
            } else if (op.is(TokenType.BLOCK)) {
                next();
                List<Node> children = new ArrayList<>();
                blockHeaderRest(key, children);
                children.addAll(nodes(indent));
                nodes.add(new Node.Block(key.value(), children));
            } else {
                throw new ParseException(
                        ErrorCode.BARE_LINE,
                        String.format("'%s' is followed by %s instead of '::' or ':'", key.value(), describe(op)),
                        String.format(
                                "write %s::value for an assignment or %s: for a block; quote free text as"
                                        + " KEY::\"text\"",
                                key.value(),
                                key.value()),
                        key.line(),
                        key.column());
            }
        }

        /** After {@code KEY:}: only a comment may share the line; it becomes the first child. */
        private void blockHeaderRest(Token key, List<Node> children) {
            Token after = peek();
            if (after.is(TokenType.COMMENT)) {
                next();
                children.add(new Node.Comment(after.value()));
                after = peek();
            }
            if (after.is(TokenType.NEWLINE)) {
                next();
            } else if (!after.is(TokenType.EOF)) {
                throw new ParseException(
                        ErrorCode.SINGLE_COLON,
                        String.format("'%s:' is followed by a value on the same line", key.value()),
                        String.format(
                                "write %s::value for an assignment (double colon), or move the block's children"
                                        + " to the following indented lines",
                                key.value()),
                        after.line(),
                        after.column());
            }
        }

        private Value assignmentValue(Token key) {
            Token t = peek();
            if (t.is(TokenType.FENCE_OPEN)) {
                return literalZone();
            }
            if (t.is(TokenType.NEWLINE) && peek(1).is(TokenType.FENCE_OPEN)) {
                next();
                return literalZone();
            }
            if (t.is(TokenType.NEWLINE)
                    || t.is(TokenType.EOF)
                    || t.is(TokenType.COMMENT)
                    || t.is(TokenType.ENVELOPE_END)) {
                throw new ParseException(
                        ErrorCode.MISSING_VALUE,
                        String.format("'%s::' has no value", key.value()),
                        String.format(
                                "write %s::null for an explicit empty value, put a fenced literal zone on the next"
                                        + " line, or remove the line",
                                key.value()),
                        key.line(),
                        key.column());
            }
            return value(false);
        }

        private Value literalZone() {
            Token open = next();
            String text = open.value();
            int ticks = 0;
            while (ticks < text.length() && text.charAt(ticks) == '`') {
                ticks++;
            }
            String marker = text.substring(0, ticks);
            String tag = ticks < text.length() ? text.substring(ticks) : null;
            String content = "";
            if (peek().is(TokenType.LITERAL_CONTENT)) {
                content = next().value();
            }
            if (!peek().is(TokenType.FENCE_CLOSE)) {
                throw new ParseException(
                        ErrorCode.MISSING_FENCE_CLOSE,
                        String.format(
                                "literal zone opened with %s at line %d has no closing fence token", marker, open.line()),
                        "the tokenizer validates fence balance, so this is an engine defect; report it with the"
                                + " input document",
                        open.line(),
                        open.column());
            }
            next();
            return new Value.LiteralZoneValue(content, tag, marker);
        }

        /** A value in assignment or list position. */
        private Value value(boolean inList) {
            Token t = peek();
            switch (t.type()) {
                case STRING -> {
                    next();
                    return new Value.StringValue(t.value());
                }
                case LIST_START -> {
                    return list();
                }
                case FENCE_OPEN -> throw new ParseException(
                        ErrorCode.LITERAL_ZONE_IN_LIST,
                        "literal zone used as a list item",
                        "assign the literal zone to its own key",
                        t.line(),
                        t.column());
                case IDENTIFIER, VARIABLE, NUMBER, BOOLEAN, NULL -> {
                    return expression();
                }
                default -> {
                    if (t.type().isExpressionOperator()) {
                        return expression();
                    }
                    throw unexpected(t, inList ? "expected a list item" : "expected a value after '::'");
                }
            }
        }

        /**
         * Joins a run of words and operators into one value. A lone number, boolean or
         * {@code null} keeps its own type.
         */
        private Value expression() {
            List<Token> run = new ArrayList<>();
            while (true) {
                Token t = peek();
                boolean word = isWord(t);
                boolean op = t.type().isExpressionOperator() || t.is(TokenType.BLOCK);
                if (!word && !op) {
                    break;
                }
                if (t.is(TokenType.IDENTIFIER) && peek(1).is(TokenType.ASSIGN) && !run.isEmpty()) {
                    break;
                }
                run.add(next());
            }
            if (run.size() == 1) {
                Token only = run.get(0);
                switch (only.type()) {
                    case NUMBER -> {
                        return new Value.NumberValue(only.value());
                    }
                    case BOOLEAN -> {
                        return Value.BooleanValue.of(Boolean.parseBoolean(only.value()));
                    }
                    case NULL -> {
                        return Value.Null.INSTANCE;
                    }
                    default -> {
                        // joined below
                    }
                }
            }
            return new Value.StringValue(join(run));
        }

        private static boolean isWord(Token t) {
            return switch (t.type()) {
                case IDENTIFIER, VARIABLE, NUMBER, BOOLEAN, NULL -> true;
                default -> false;
            };
        }

        /** Words are separated by one space; operators attach without spaces. */
        private static String join(List<Token> run) {
            StringBuilder sb = new StringBuilder();
            Token previous = null;
            for (Token t : run) {
                if (previous != null && isWord(previous) && isWord(t)) {
                    sb.append(' ');
                }
                sb.append(t.value());
                previous = t;
            }
            return sb.toString();
        }

        private Value list() {
            Token open = next();
            List<Object> items = new ArrayList<>();
            boolean allPairs = true;
            while (true) {
                listTrivia();
                Token t = peek();
                if (t.is(TokenType.LIST_END)) {
                    next();
                    break;
                }
                if (t.is(TokenType.EOF) || t.is(TokenType.ENVELOPE_END)) {
                    throw unclosed(open);
                }
                if (t.is(TokenType.IDENTIFIER) && peek(1).is(TokenType.ASSIGN)) {
                    next();
                    next();
                    Token valueToken = peek();
                    Value value = value(true);
                    if (value instanceof Value.ListValue || value instanceof Value.InlineMap) {
                        throw new ParseException(
                                ErrorCode.INLINE_MAP_NESTING,
                                String.format("inline map value for '%s' is a nested list or map", t.value()),
                                "inline map values must be atomic; move the nested structure to a block",
                                valueToken.line(),
                                valueToken.column());
                    }
                    items.add(new Pair(t, value));
                } else {
                    allPairs = false;
                    if (items.isEmpty() && isLiteralWord(t) && peek(1).is(TokenType.CONSTRAINT)) {
                        return pattern(open, literalWord(next()));
                    }
                    Value item = value(true);
                    if (items.isEmpty()
                            && peek().is(TokenType.CONSTRAINT)
                            && (t.is(TokenType.STRING) || t.is(TokenType.LIST_START))) {
                        return pattern(open, item);
                    }
                    items.add(item);
                }
                listTrivia();
                Token sep = peek();
                if (sep.is(TokenType.COMMA)) {
                    next();
                } else if (sep.is(TokenType.EOF) || sep.is(TokenType.ENVELOPE_END)) {
                    throw unclosed(open);
                } else if (!sep.is(TokenType.LIST_END)) {
                    throw unexpected(sep, "separate list items with ',' and close the list with ']'");
                }
            }
            if (items.isEmpty()) {
                return new Value.ListValue(List.of());
            }
            if (allPairs) {
                return inlineMap(items);
            }
            List<Value> values = new ArrayList<>(items.size());
            for (Object item : items) {
                values.add(item instanceof Pair p ? inlineMap(List.of(p)) : (Value) item);
            }
            return new Value.ListValue(values);
        }

        private static boolean isLiteralWord(Token t) {
            return t.is(TokenType.NUMBER) || t.is(TokenType.BOOLEAN) || t.is(TokenType.NULL);
        }

        private static Value literalWord(Token t) {
            switch (t.type()) {
                case NUMBER -> {
                    return new Value.NumberValue(t.value());
                }
                case BOOLEAN -> {
                    return Value.BooleanValue.of(Boolean.parseBoolean(t.value()));
                }
                default -> {
                    return Value.Null.INSTANCE;
                }
            }
        }

        /** After the example of {@code [example∧CONSTRAINTS→§TARGET]}, at the first {@code ∧}. */
        private Value pattern(Token open, Value example) {
            if (example instanceof Value.InlineMap || example instanceof Value.HolographicValue) {
                throw malformedPattern(open, "a pattern example must be a scalar, null or a list");
            }
            StringBuilder chain = new StringBuilder();
            while (peek().is(TokenType.CONSTRAINT)) {
                next();
                Token name = peek();
                if (!name.is(TokenType.IDENTIFIER)) {
                    throw malformedPattern(name, "expected a constraint name after '∧'");
                }
                next();
                if (chain.length() > 0) {
                    chain.append('∧');
                }
                chain.append(name.value());
                if (peek().is(TokenType.LIST_START)) {
                    constraintArgument(chain);
                }
            }
            String constraints = chain.toString();
            try {
                ConstraintChain.parse(constraints);
            } catch (ConstraintSyntaxException e) {
                throw new ParseException(
                        ErrorCode.MALFORMED_PATTERN,
                        "invalid constraints in pattern: " + e.detail(),
                        e.remediation(),
                        open.line(),
                        open.column());
            }
            String target = null;
            if (peek().is(TokenType.FLOW)) {
                next();
                if (!peek().is(TokenType.SECTION)) {
                    throw malformedPattern(peek(), "expected '§' and a section name after '→'");
                }
                next();
                Token section = peek();
                if (!section.is(TokenType.IDENTIFIER) && !section.is(TokenType.NUMBER)) {
                    throw malformedPattern(section, "expected a section name after '→§'");
                }
                target = next().value();
            }
            Token close = peek();
            if (close.is(TokenType.EOF) || close.is(TokenType.ENVELOPE_END) || close.is(TokenType.NEWLINE)) {
                throw unclosed(open);
            }
            if (!close.is(TokenType.LIST_END)) {
                throw malformedPattern(close, "a pattern ends with ']' after its constraints and optional →§TARGET");
            }
            next();
            return new Value.HolographicValue(example, constraints, target);
        }

        /** Copies {@code [...]} after a constraint name; strings keep their quotes so the text reads back. */
        private void constraintArgument(StringBuilder chain) {
            Token bracket = next();
            chain.append('[');
            boolean previousWord = false;
            while (!peek().is(TokenType.LIST_END)) {
                Token t = peek();
                if (t.is(TokenType.NEWLINE) || t.is(TokenType.EOF) || t.is(TokenType.ENVELOPE_END)) {
                    throw unclosed(bracket);
                }
                if (t.is(TokenType.LIST_START)) {
                    throw malformedPattern(t, "constraint arguments cannot contain '['; quote the argument");
                }
                next();
                boolean word = isWord(t) || t.is(TokenType.STRING);
                if (previousWord && word) {
                    chain.append(' ');
                }
                chain.append(t.is(TokenType.STRING) ? quote(t.value()) : t.value());
                previousWord = word;
            }
            next();
            chain.append(']');
        }

        private ParseException malformedPattern(Token at, String detail) {
            return new ParseException(
                    ErrorCode.MALFORMED_PATTERN,
                    detail + ", found " + describe(at),
                    "write the pattern as [\"example\"∧REQ∧ENUM[A,B]→§TARGET]",
                    at.line(),
                    at.column());
        }

        private static String quote(String text) {
            StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                switch (c) {
                    case '\\' -> sb.append("\\\\");
                    case '"' -> sb.append("\\\"");
                    case '\n' -> sb.append("\\n");
                    case '\t' -> sb.append("\\t");
                    case '\r' -> sb.append("\\r");
                    default -> sb.append(c);
                }
            }
            return sb.append('"').toString();
        }

        private Value.InlineMap inlineMap(List<Object> pairs) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (Object item : pairs) {
                Pair pair = (Pair) item;
                if (entries.putIfAbsent(pair.key().value(), pair.value()) != null) {
                    throw new ParseException(
                            ErrorCode.DUPLICATE_INLINE_KEY,
                            String.format("key '%s' appears twice in one inline map", pair.key().value()),
                            "remove one of the entries or rename the key",
                            pair.key().line(),
                            pair.key().column());
                }
            }
            return new Value.InlineMap(entries);
        }

        private void listTrivia() {
            while (true) {
                Token t = peek();
                if (t.is(TokenType.NEWLINE) || t.is(TokenType.INDENT)) {
                    next();
                } else if (t.is(TokenType.COMMENT)) {
                    next();
                    String location = Diagnostic.at(t.line(), t.column());
                    warnings.add(new Diagnostic(
                            "W_LIST_COMMENT_DROPPED",
                            "comments inside a list are not part of the canonical form and were dropped",
                            location));
                    log.add(RepairEntry.normalization(
                            PipelineStage.PARSE, location, "list_comment_dropped", "// " + t.value(), ""));
                } else {
                    return;
                }
            }
        }

        private Node.Section section(int indent) {
            next(); // §
            Token id = next();
            if (!id.is(TokenType.NUMBER) && !id.is(TokenType.IDENTIFIER)) {
                throw malformedSection(id);
            }
            if (!peek().is(TokenType.ASSIGN)) {
                throw malformedSection(peek());
            }
            next();
            Token name = peek();
            if (!name.is(TokenType.IDENTIFIER)) {
                throw malformedSection(name);
            }
            next();
            String annotation = null;
            if (peek().is(TokenType.LIST_START)) {
                annotation = annotation();
            }
            List<Node> children = new ArrayList<>();
            blockHeaderRest(name, children);
            children.addAll(nodes(indent));
            return new Node.Section(id.value(), name.value(), annotation, children);
        }

        private String annotation() {
            Token open = next();
            List<Token> run = new ArrayList<>();
            while (!peek().is(TokenType.LIST_END)) {
                Token t = peek();
                if (t.is(TokenType.NEWLINE) || t.is(TokenType.EOF)) {
                    throw unclosed(open);
                }
                run.add(next());
            }
            next();
            if (run.isEmpty()) {
                return null;
            }
            StringBuilder sb = new StringBuilder();
            boolean previousWord = false;
            for (Token t : run) {
                boolean word = isWord(t) || t.is(TokenType.STRING);
                if (previousWord && word) {
                    sb.append(' ');
                }
                sb.append(t.value());
                previousWord = word;
            }
            return sb.toString();
        }

        private ParseException malformedSection(Token at) {
            return new ParseException(
                    ErrorCode.MALFORMED_SECTION,
                    "section header has " + describe(at) + " where §ID::NAME was expected",
                    "write the section header as §ID::NAME or §ID::NAME[annotation]",
                    at.line(),
                    at.column());
        }

        /** After a complete value: optional trailing comment, then end of line. */
        private void valueEnd(Token key, List<Node> nodes) {
            Token t = peek();
            if (t.is(TokenType.COMMENT)) {
                next();
                nodes.add(new Node.Comment(t.value()));
                t = peek();
            }
            if (t.is(TokenType.NEWLINE)) {
                next();
                return;
            }
            if (t.is(TokenType.EOF) || t.is(TokenType.ENVELOPE_END)) {
                return;
            }
            if (t.is(TokenType.LIST_END)) {
                throw new ParseException(
                        ErrorCode.UNBALANCED_BRACKET,
                        "']' without a matching '['",
                        "remove the ']' or add the missing '['",
                        t.line(),
                        t.column());
            }
            throw new ParseException(
                    ErrorCode.TRAILING_TOKENS,
                    String.format("unexpected %s after the value of '%s'", describe(t), key.value()),
                    "quote the whole value, e.g. " + key.value() + "::\"...\", or move the extra text to its own line",
                    t.line(),
                    t.column());
        }

        private void endOfLine(String what) {
            Token t = peek();
            if (t.is(TokenType.NEWLINE)) {
                next();
            } else if (!t.is(TokenType.EOF)) {
                throw new ParseException(
                        ErrorCode.TRAILING_TOKENS,
                        "unexpected " + describe(t) + " after " + what,
                        "put " + what + " on a line of its own",
                        t.line(),
                        t.column());
            }
        }

        private ParseException unclosed(Token open) {
            return new ParseException(
                    ErrorCode.UNCLOSED_LIST,
                    String.format("'[' opened at line %d, column %d is never closed", open.line(), open.column()),
                    "add the missing ']'",
                    open.line(),
                    open.column());
        }

        private ParseException unexpected(Token t, String remediation) {
            return new ParseException(
                    ErrorCode.UNEXPECTED_TOKEN, "unexpected " + describe(t), remediation, t.line(), t.column());
        }

        private static String describe(Token t) {
            return switch (t.type()) {
                case EOF -> "end of input";
                case NEWLINE -> "end of line";
                case LITERAL_CONTENT -> "literal zone content";
                default -> t.type() + " '" + t.value() + "'";
            };
        }

        private void skipNewlines() {
            while (peek().is(TokenType.NEWLINE)
                    || (peek().is(TokenType.INDENT) && peek(1).is(TokenType.NEWLINE))) {
                next();
            }
        }

        private void skipIndent() {
            if (peek().is(TokenType.INDENT)) {
                next();
            }
        }

        private Token peekPastIndent() {
            return peek().is(TokenType.INDENT) ? peek(1) : peek();
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token peek(int ahead) {
            int i = Math.min(index + ahead, tokens.size() - 1);
            return tokens.get(i);
        }

        private Token next() {
            Token t = tokens.get(index);
            if (index < tokens.size() - 1) {
                index++;
            }
            return t;
        }
    }

    private record Pair(Token key, Value value) {}
}
