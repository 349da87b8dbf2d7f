package labeling;

/**
 * Keyword recognised at the start of a source line. {@link #OTHER} marks a
 * line that contributes no CFG node.
 */
public enum Keyword {
    IF("if"),
    ELIF("elif"),
    ELSE("else"),
    FOR("for"),
    WHILE("while"),
    OTHER(null);

    private final String token;

    Keyword(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    // if and elif carry a paired condition-expression node
    public boolean hasExpression() {
        return this == IF || this == ELIF;
    }
}
