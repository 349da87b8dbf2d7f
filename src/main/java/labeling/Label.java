package labeling;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed view of a CFG node label such as {@code if1}, {@code elifspexp3} or
 * {@code whilesp5}. The textual form is what flows between the pipeline
 * stages; this class only exposes its category so callers can dispatch on it.
 */
public final class Label {

    public static final String START = "start";
    public static final String END = "end";
    // Destination used by the nested-loop heuristic when a loop token sits in a while range.
    public static final String LOOP_MARKER = "f";

    private static final String NESTED_INFIX = "sp";
    private static final String EXPRESSION_INFIX = "exp";
    private static final Pattern KEYWORD_LABEL =
            Pattern.compile("(if|elif|else|for|while)(sp)?(exp)?(\\d+)");

    public enum Kind {
        START, END, IF, ELIF, ELSE, FOR, WHILE, LOOP_MARKER, UNKNOWN
    }

    private final String text;
    private final Kind kind;
    private final boolean nested;
    private final boolean expression;
    private final int number;

    private Label(String text, Kind kind, boolean nested, boolean expression, int number) {
        this.text = text;
        this.kind = kind;
        this.nested = nested;
        this.expression = expression;
        this.number = number;
    }

    /**
     * Builds the header label for one keyword occurrence.
     */
    public static String header(Keyword keyword, boolean nested, int number) {
        return format(keyword, nested, false, number);
    }

    /**
     * Builds the condition-expression label paired with an if/elif header.
     */
    public static String expression(Keyword keyword, boolean nested, int number) {
        if (!keyword.hasExpression()) {
            throw new IllegalArgumentException("Keyword has no expression node: " + keyword);
        }
        return format(keyword, nested, true, number);
    }

    private static String format(Keyword keyword, boolean nested, boolean expression, int number) {
        if (keyword == Keyword.OTHER) {
            throw new IllegalArgumentException("No label for non-keyword lines");
        }
        StringBuilder sb = new StringBuilder(keyword.getToken());
        if (nested) {
            sb.append(NESTED_INFIX);
        }
        if (expression) {
            sb.append(EXPRESSION_INFIX);
        }
        return sb.append(number).toString();
    }

    /**
     * Parses any label string. Strings outside the label grammar yield
     * {@link Kind#UNKNOWN} rather than an error.
     */
    public static Label parse(String text) {
        Objects.requireNonNull(text, "label");
        switch (text) {
            case START:
                return new Label(text, Kind.START, false, false, 0);
            case END:
                return new Label(text, Kind.END, false, false, 0);
            case LOOP_MARKER:
                return new Label(text, Kind.LOOP_MARKER, false, false, 0);
            default:
                break;
        }
        Matcher m = KEYWORD_LABEL.matcher(text);
        if (!m.matches()) {
            return new Label(text, Kind.UNKNOWN, false, false, 0);
        }
        Kind kind = Kind.valueOf(m.group(1).toUpperCase(Locale.ROOT));
        boolean expression = m.group(3) != null;
        if (expression && kind != Kind.IF && kind != Kind.ELIF) {
            return new Label(text, Kind.UNKNOWN, false, false, 0);
        }
        int number;
        try {
            number = Integer.parseInt(m.group(4));
        } catch (NumberFormatException e) {
            // digits too long for an int
            return new Label(text, Kind.UNKNOWN, false, false, 0);
        }
        return new Label(text, kind, m.group(2) != null, expression, number);
    }

    public String getText() { return text; }
    public Kind getKind() { return kind; }
    public boolean isNested() { return nested; }
    public boolean isExpression() { return expression; }
    public int getNumber() { return number; }

    /**
     * True when {@code other} is the condition-expression node of this
     * if/elif header (same kind, nesting and number).
     */
    public boolean isPairedWith(Label other) {
        return other != null
                && !expression
                && other.expression
                && (kind == Kind.IF || kind == Kind.ELIF)
                && kind == other.kind
                && nested == other.nested
                && number == other.number;
    }

    /**
     * A "next alternative" target of a top-level branch header:
     * a non-nested elif or else header, or the end node.
     */
    public boolean isBranchAlternative() {
        if (kind == Kind.END) {
            return true;
        }
        return !nested && !expression && (kind == Kind.ELIF || kind == Kind.ELSE);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Label)) return false;
        return text.equals(((Label) obj).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() { return text; }
}
