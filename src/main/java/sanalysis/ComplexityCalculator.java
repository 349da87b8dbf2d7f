package sanalysis;

/**
 * Cyclomatic complexity of a single-component CFG: V = E - N + 2, never below 1.
 */
public class ComplexityCalculator {

    private ComplexityCalculator() {
    }

    public static int cyclomatic(CFGGenerator.ControlFlowGraph cfg) {
        return cyclomatic(cfg.getEdges().size(), cfg.getNodes().size());
    }

    public static int cyclomatic(int edgeCount, int nodeCount) {
        return Math.max(1, edgeCount - nodeCount + 2);
    }
}
