package io.octavecanon.core.schema;

import io.octavecanon.core.error.ConstraintSyntaxException;
import io.octavecanon.core.model.Value;
import io.octavecanon.core.model.ValueKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Ordered constraints that apply to one field, e.g. {@code REQ∧ENUM[A,B]}.
 *
 * <p>
 * {@link #parse(String)} accepts {@code ∧}, {@code &} and whitespace as separators.
 * Separators inside brackets and inside quoted {@code REGEX["..."]} arguments are
 * part of the argument. A chain may not be both {@code REQ} and {@code OPT}.
 */
public record ConstraintChain(List<Constraint> constraints) {

    public ConstraintChain {
        constraints = List.copyOf(constraints);
        boolean required = constraints.stream().anyMatch(c -> c instanceof Constraint.Required);
        boolean optional = constraints.stream().anyMatch(c -> c instanceof Constraint.Optional);
        if (required && optional) {
            throw new ConstraintSyntaxException(
                    "chain is both REQ and OPT",
                    "keep exactly one of REQ or OPT",
                    constraints.stream().map(Constraint::render).collect(Collectors.joining("∧")),
                    1);
        }
    }

    public static ConstraintChain of(Constraint... constraints) {
        return new ConstraintChain(List.of(constraints));
    }

    /**
     * Parses chain text.
     *
     * @throws ConstraintSyntaxException for unknown constraint names, unbalanced brackets,
     *                                   invalid arguments, or contradictory constraints
     */
    public static ConstraintChain parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        List<Constraint> constraints = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (isSeparator(c)) {
                i++;
                continue;
            }
            int start = i;
            int bracket = -1;
            while (i < text.length() && !isSeparator(text.charAt(i))) {
                if (text.charAt(i) == '[') {
                    bracket = i;
                    i = closingBracket(text, i);
                }
                i++;
            }
            constraints.add(constraint(text, start, bracket, i));
        }
        if (constraints.isEmpty()) {
            throw new ConstraintSyntaxException(
                    "empty constraint chain", "write at least one constraint, e.g. OPT", text, 1);
        }
        return new ConstraintChain(constraints);
    }

    /** True when the chain contains {@code REQ}. */
    public boolean isRequired() {
        return constraints.stream().anyMatch(c -> c instanceof Constraint.Required);
    }

    /** Checks {@code value} against every constraint, in chain order. */
    public List<Violation> check(Value value) {
        List<Violation> violations = new ArrayList<>();
        for (Constraint constraint : constraints) {
            constraint.check(value).ifPresent(violations::add);
        }
        return violations;
    }

    /** First constraint of the given type, or {@code null}. */
    public <C extends Constraint> C find(Class<C> type) {
        for (Constraint constraint : constraints) {
            if (type.isInstance(constraint)) {
                return type.cast(constraint);
            }
        }
        return null;
    }

    /** Chain in canonical syntax, joined with {@code ∧}. */
    public String render() {
        return constraints.stream().map(Constraint::render).collect(Collectors.joining("∧"));
    }

    @Override
    public String toString() {
        return render();
    }

    private static boolean isSeparator(char c) {
        return c == '∧' || c == '&' || Character.isWhitespace(c);
    }

    private static int closingBracket(String text, int open) {
        boolean quoted = false;
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ']') {
                return i;
            }
        }
        throw new ConstraintSyntaxException(
                "unclosed '[' in constraint", "add the missing ']'", text, open + 1);
    }

    private static Constraint constraint(String text, int start, int bracket, int end) {
        String name = (bracket < 0 ? text.substring(start, end) : text.substring(start, bracket))
                .toUpperCase(Locale.ROOT);
        if (bracket >= 0 && text.charAt(end - 1) != ']') {
            throw new ConstraintSyntaxException(
                    "unexpected text after ']' in '" + text.substring(start, end) + "'",
                    "separate constraints with ∧",
                    text,
                    start + 1);
        }
        String arg = bracket < 0 ? null : text.substring(bracket + 1, end - 1).trim();
        int column = start + 1;
        switch (name) {
            case "REQ":
                noArgument(name, arg, text, column);
                return new Constraint.Required();
            case "OPT":
                noArgument(name, arg, text, column);
                return new Constraint.Optional();
            case "ENUM":
                return new Constraint.EnumOf(enumValues(requireArgument(name, arg, text, column), text, column));
            case "REGEX":
                return new Constraint.Regex(regex(requireArgument(name, arg, text, column), text, column));
            case "TYPE":
                return type(requireArgument(name, arg, text, column), text, column);
            case "LANG":
                return new Constraint.Lang(unquote(requireArgument(name, arg, text, column)));
            case "CONST":
                return new Constraint.Const(unquote(requireArgument(name, arg, text, column)));
            default:
                throw new ConstraintSyntaxException(
                        "unknown constraint '" + text.substring(start, bracket < 0 ? end : bracket) + "'",
                        "use one of REQ, OPT, ENUM[..], REGEX[..], TYPE[..], LANG[..], CONST[..]",
                        text,
                        column);
        }
    }

    private static void noArgument(String name, String arg, String text, int column) {
        if (arg != null) {
            throw new ConstraintSyntaxException(
                    name + " takes no argument", "write " + name + " without brackets", text, column);
        }
    }

    private static String requireArgument(String name, String arg, String text, int column) {
        if (arg == null || arg.isEmpty()) {
            throw new ConstraintSyntaxException(
                    name + " needs an argument", "write " + name + "[...]", text, column);
        }
        return arg;
    }

    private static List<String> enumValues(String arg, String text, int column) {
        List<String> values = new ArrayList<>();
        for (String part : arg.split(",")) {
            String value = unquote(part.trim());
            if (value.isEmpty()) {
                throw new ConstraintSyntaxException(
                        "empty ENUM value", "remove the extra ',' in ENUM[" + arg + "]", text, column);
            }
            values.add(value);
        }
        return values;
    }

    private static Pattern regex(String arg, String text, int column) {
        String source = arg;
        if (source.length() >= 2 && source.startsWith("\"") && source.endsWith("\"")) {
            source = unescape(source.substring(1, source.length() - 1));
        }
        try {
            return Pattern.compile(source);
        } catch (PatternSyntaxException e) {
            throw new ConstraintSyntaxException(
                    "invalid REGEX '" + source + "': " + e.getDescription(),
                    "fix the regular expression",
                    text,
                    column);
        }
    }

    /** Reads an escaped backslash or quote inside a quoted argument; other backslashes are regex syntax. */
    private static String unescape(String quoted) {
        StringBuilder sb = new StringBuilder(quoted.length());
        for (int i = 0; i < quoted.length(); i++) {
            char c = quoted.charAt(i);
            if (c == '\\' && i + 1 < quoted.length() && (quoted.charAt(i + 1) == '\\' || quoted.charAt(i + 1) == '"')) {
                sb.append(quoted.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static Constraint type(String arg, String text, int column) {
        String upper = arg.toUpperCase(Locale.ROOT);
        if (upper.equals("LITERAL")) {
            return new Constraint.LiteralZone();
        }
        ValueKind kind = null;
        for (ValueKind candidate : ValueKind.values()) {
            if (candidate.name().equals(upper)) {
                kind = candidate;
            }
        }
        if (kind == null || kind == ValueKind.ABSENT || kind == ValueKind.NULL || kind == ValueKind.PATTERN) {
            throw new ConstraintSyntaxException(
                    "unknown TYPE '" + arg + "'",
                    "use one of STRING, NUMBER, BOOLEAN, LIST, MAP, LITERAL",
                    text,
                    column);
        }
        return new Constraint.TypeOf(kind);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
