package sanalysis;

import labeling.Label;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * CFGGenerator wires the label sequence produced by
 * {@link labeling.TokenLabeler} into a control flow graph.
 *
 * Top-level if/elif/else chains are wired the way the reference diagrams draw
 * them: every header fans out to its own condition-expression node and to the
 * next alternative of the chain, and every expression node (and every else
 * header) goes straight to {@code end}. Loops and nested tokens use a set of
 * positional heuristics; these are only reliable for a single loop level and
 * are kept as they are rather than generalised.
 */
public class CFGGenerator {
    private static final Logger logger = LoggerFactory.getLogger(CFGGenerator.class);

    // CFG Edge Class (equality on both endpoints, so a set drops duplicates)
    public static class CFGEdge {
        public final String from;
        public final String to;
        public CFGEdge(String from, String to) {
            this.from = Objects.requireNonNull(from, "from");
            this.to = Objects.requireNonNull(to, "to");
        }
        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof CFGEdge)) return false;
            CFGEdge other = (CFGEdge) obj;
            return from.equals(other.from) && to.equals(other.to);
        }
        @Override
        public int hashCode() {
            return Objects.hash(from, to);
        }
        @Override
        public String toString() { return from + " -> " + to; }
    }

    public static class ControlFlowGraph {
        private final Set<String> nodes = new LinkedHashSet<>();
        private final Set<CFGEdge> edges = new LinkedHashSet<>(); // insertion order, no duplicates
        private final List<String> branchTrace = new ArrayList<>();

        public void addNode(String label) {
            nodes.add(Objects.requireNonNull(label, "label"));
        }

        public void addEdge(String from, String to) {
            edges.add(new CFGEdge(from, to));
        }

        void recordBranch(String label) {
            branchTrace.add(label);
        }

        public List<String> getNodes() {
            return List.copyOf(nodes);
        }

        public Set<CFGEdge> getEdges() {
            return Collections.unmodifiableSet(edges);
        }

        public boolean hasEdge(String from, String to) {
            return edges.contains(new CFGEdge(from, to));
        }

        /**
         * Branch nodes in the order the if/elif/else wiring visited them.
         */
        public List<String> getBranchTrace() {
            return Collections.unmodifiableList(branchTrace);
        }

        /**
         * How often each node occurs in the branch trace, first occurrence first.
         */
        public Map<String, Integer> getBranchCounts() {
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (String label : branchTrace) {
                counts.merge(label, 1, Integer::sum);
            }
            return counts;
        }

        /**
         * Successor lists keyed by source node, both in edge insertion order.
         * Nodes without outgoing edges have no entry.
         */
        public Map<String, List<String>> getAdjacency() {
            Map<String, List<String>> adjacency = new LinkedHashMap<>();
            for (CFGEdge edge : edges) {
                adjacency.computeIfAbsent(edge.from, k -> new ArrayList<>()).add(edge.to);
            }
            return adjacency;
        }
    }

    // One rule per label category; the first applicable one wins.
    private enum EdgeRule {
        SKIP_EXPRESSION,
        BRANCH_HEADER,
        ELSE_HEADER,
        NESTED_FOR,
        FOR_HEADER,
        WHILE_HEADER,
        NESTED_WHILE,
        FALLBACK
    }

    // Index span from a top-level loop header to the first top-level label after it.
    private static class LoopRange {
        Integer start;
        Integer end;
        boolean contains(int index) {
            return start != null && end != null && start <= index && index <= end;
        }
    }

    /**
     * Builds the graph for one label sequence.
     *
     * @param labels labels as produced by the token labeler, {@code start} first
     * @return a new graph; repeated calls with equal input give equal graphs
     */
    public ControlFlowGraph generateCFG(List<String> labels) {
        Objects.requireNonNull(labels, "labels");
        ControlFlowGraph cfg = new ControlFlowGraph();
        List<Label> parsed = new ArrayList<>(labels.size());
        for (String text : labels) {
            parsed.add(Label.parse(text));
            cfg.addNode(text);
        }

        if (labels.size() >= 2) {
            cfg.addEdge(labels.get(0), labels.get(1));
        }

        // only the while range is consulted by the nested-loop rules
        LoopRange forRange = new LoopRange();
        LoopRange whileRange = new LoopRange();

        for (int i = 1; i < parsed.size() - 1; i++) {
            Label cur = parsed.get(i);
            Label next = parsed.get(i + 1);
            EdgeRule rule = selectRule(cur, next);
            logger.debug("{} -> rule {}", cur, rule);

            switch (rule) {
                case SKIP_EXPRESSION:
                    break;
                case BRANCH_HEADER:
                    wireBranchHeader(i, parsed, cfg);
                    break;
                case ELSE_HEADER:
                    cfg.addEdge(cur.getText(), Label.END);
                    cfg.recordBranch(cur.getText());
                    break;
                case NESTED_FOR:
                    wireNestedFor(i, parsed, cfg, whileRange);
                    break;
                case FOR_HEADER:
                    wireLoopHeader(i, parsed, cfg, forRange);
                    break;
                case WHILE_HEADER:
                    wireLoopHeader(i, parsed, cfg, whileRange);
                    break;
                case NESTED_WHILE:
                    if (whileRange.contains(i)) {
                        linkToLoopMarker(cfg, cur.getText());
                    } else {
                        cfg.addEdge(cur.getText(), next.getText());
                    }
                    cfg.addEdge(cur.getText(), cur.getText());
                    break;
                case FALLBACK:
                default:
                    cfg.addEdge(cur.getText(), next.getText());
                    break;
            }
        }

        logger.debug("Generated CFG with {} nodes and {} edges", cfg.nodes.size(), cfg.edges.size());
        return cfg;
    }

    private static EdgeRule selectRule(Label cur, Label next) {
        switch (cur.getKind()) {
            case IF:
            case ELIF:
                if (cur.isExpression()) {
                    // nested expression nodes keep the fallthrough edge
                    return cur.isNested() ? EdgeRule.FALLBACK : EdgeRule.SKIP_EXPRESSION;
                }
                if (!cur.isNested() && cur.isPairedWith(next)) {
                    return EdgeRule.BRANCH_HEADER;
                }
                return EdgeRule.FALLBACK;
            case ELSE:
                return cur.isNested() ? EdgeRule.FALLBACK : EdgeRule.ELSE_HEADER;
            case FOR:
                return cur.isNested() ? EdgeRule.NESTED_FOR : EdgeRule.FOR_HEADER;
            case WHILE:
                return cur.isNested() ? EdgeRule.NESTED_WHILE : EdgeRule.WHILE_HEADER;
            default:
                return EdgeRule.FALLBACK;
        }
    }

    /**
     * ifN/elifN: header -> own expression, header -> next alternative of the
     * chain (elif, else or end), expression -> end.
     */
    private void wireBranchHeader(int i, List<Label> parsed, ControlFlowGraph cfg) {
        String header = parsed.get(i).getText();
        String expression = parsed.get(i + 1).getText();
        cfg.addEdge(header, expression);
        cfg.recordBranch(header);
        cfg.recordBranch(expression);

        for (int j = i + 2; j < parsed.size(); j++) {
            if (parsed.get(j).isBranchAlternative()) {
                String alternative = parsed.get(j).getText();
                cfg.addEdge(header, alternative);
                cfg.recordBranch(alternative);
                break;
            }
        }

        cfg.addEdge(expression, Label.END);
    }

    /**
     * Top-level for/while header. The exit edge goes to the first top-level
     * label after the header, the entry edge to the immediate successor when
     * that is a different label. A body without nested keywords gets a
     * self-loop, added last so the exit precedes it in the adjacency order.
     */
    private void wireLoopHeader(int i, List<Label> parsed, ControlFlowGraph cfg, LoopRange range) {
        String header = parsed.get(i).getText();
        Label next = parsed.get(i + 1);
        range.start = i;

        for (int k = i + 1; k < parsed.size(); k++) {
            if (!parsed.get(k).isNested()) {
                range.end = k;
                String exit = parsed.get(k).getText();
                cfg.addEdge(header, exit);
                if (!next.getText().equals(exit)) {
                    cfg.addEdge(header, next.getText());
                }
                break;
            }
        }

        if (!next.isNested()) {
            cfg.addEdge(header, header);
        }
    }

    private void wireNestedFor(int i, List<Label> parsed, ControlFlowGraph cfg, LoopRange whileRange) {
        String token = parsed.get(i).getText();
        Label previous = parsed.get(i - 1);
        Label next = parsed.get(i + 1);
        cfg.addEdge(token, token);

        if (previous.getKind() == Label.Kind.FOR) {
            // back to the enclosing for header
            cfg.addEdge(token, previous.getText());
        } else if (next.isNested()) {
            cfg.addEdge(token, next.getText());
        } else if (whileRange.contains(i)) {
            linkToLoopMarker(cfg, token);
        } else {
            cfg.addEdge(token, next.getText());
        }
    }

    private void linkToLoopMarker(ControlFlowGraph cfg, String token) {
        cfg.addNode(Label.LOOP_MARKER);
        cfg.addEdge(token, Label.LOOP_MARKER);
    }
}
