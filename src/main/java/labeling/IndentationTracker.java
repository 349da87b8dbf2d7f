package labeling;

/**
 * Computes the nesting depth of a source line from its leading whitespace.
 */
public class IndentationTracker {

    public static final int TAB_WIDTH = 4;

    private static final String TAB_AS_SPACES = " ".repeat(TAB_WIDTH);

    private IndentationTracker() {
    }

    /**
     * Returns the number of leading space-equivalent characters of the line.
     * Every tab counts as {@value #TAB_WIDTH} spaces.
     *
     * @param line raw source line
     * @return indentation depth, 0 when the line has no leading whitespace
     */
    public static int depth(String line) {
        if (line == null || line.isEmpty()) {
            return 0;
        }
        String expanded = line.replace("\t", TAB_AS_SPACES);
        int depth = 0;
        while (depth < expanded.length() && expanded.charAt(depth) == ' ') {
            depth++;
        }
        return depth;
    }
}
