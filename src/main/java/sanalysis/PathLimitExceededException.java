package sanalysis;

/**
 * Thrown when path enumeration outgrows one of its configured bounds. No
 * partial result is available when this is raised.
 */
public class PathLimitExceededException extends RuntimeException {

    public enum Limit {
        /** A single path grew longer than the allowed number of nodes. */
        DEPTH,
        /** More complete paths were found than allowed. */
        PATH_COUNT
    }

    private final Limit limit;
    private final int bound;

    public PathLimitExceededException(Limit limit, int bound) {
        super(limit == Limit.DEPTH
                ? "Path length exceeds the maximum of " + bound + " nodes; cyclic structure unsupported"
                : "Path space too large: more than " + bound + " paths");
        this.limit = limit;
        this.bound = bound;
    }

    public Limit getLimit() { return limit; }

    public int getBound() { return bound; }
}
