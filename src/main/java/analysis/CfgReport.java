package analysis;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import sanalysis.CFGGenerator;

import java.util.*;

/**
 * Everything one analysis run produced, in the order the pipeline produced it.
 */
public class CfgReport {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final List<String> labels;
    private final List<String> nodes;
    private final List<CFGGenerator.CFGEdge> edges;
    private final List<String> branchTrace;
    private final Map<String, Integer> branchCounts;
    private final int complexity;
    private final List<List<String>> paths;

    public CfgReport(List<String> labels, CFGGenerator.ControlFlowGraph cfg, int complexity, List<List<String>> paths) {
        this.labels = List.copyOf(labels);
        this.nodes = cfg.getNodes();
        this.edges = new ArrayList<>(cfg.getEdges());
        this.branchTrace = new ArrayList<>(cfg.getBranchTrace());
        this.branchCounts = cfg.getBranchCounts();
        this.complexity = complexity;
        this.paths = List.copyOf(paths);
    }

    public List<String> getLabels() { return labels; }
    public List<String> getNodes() { return nodes; }
    public List<CFGGenerator.CFGEdge> getEdges() { return Collections.unmodifiableList(edges); }
    public List<String> getBranchTrace() { return Collections.unmodifiableList(branchTrace); }
    public Map<String, Integer> getBranchCounts() { return Collections.unmodifiableMap(branchCounts); }
    public int getComplexity() { return complexity; }
    public List<List<String>> getPaths() { return paths; }

    public String toJson() {
        return GSON.toJson(this);
    }
}
