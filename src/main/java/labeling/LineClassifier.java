package labeling;

import java.util.List;

/**
 * Decides which keyword, if any, a source line starts with.
 *
 * This is plain prefix matching on the stripped line, not tokenisation:
 * a line such as {@code format(x)} is reported as {@link Keyword#FOR}.
 * Matching is case-sensitive and the first keyword in priority order wins.
 */
public class LineClassifier {

    // Priority order; elif must be tested before else.
    private static final List<Keyword> PRIORITY = List.of(
            Keyword.IF, Keyword.ELIF, Keyword.ELSE, Keyword.FOR, Keyword.WHILE);

    private LineClassifier() {
    }

    public static Keyword classify(String line) {
        if (line == null) {
            return Keyword.OTHER;
        }
        String stripped = line.strip();
        for (Keyword keyword : PRIORITY) {
            if (stripped.startsWith(keyword.getToken())) {
                return keyword;
            }
        }
        return Keyword.OTHER;
    }
}
