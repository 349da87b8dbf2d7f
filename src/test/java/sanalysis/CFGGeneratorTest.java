package sanalysis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CFGGeneratorTest {

    private static final List<String> BRANCH_CHAIN = Arrays.asList(
            "start", "if1", "ifexp1", "elif2", "elifexp2", "elif3", "elifexp3", "else4", "end");

    private CFGGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new CFGGenerator();
    }

    @Test
    void testBranchChainEdges() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(BRANCH_CHAIN);

        assertEquals(BRANCH_CHAIN, cfg.getNodes());
        assertEquals(Arrays.asList(
                "start -> if1",
                "if1 -> ifexp1",
                "if1 -> elif2",
                "ifexp1 -> end",
                "elif2 -> elifexp2",
                "elif2 -> elif3",
                "elifexp2 -> end",
                "elif3 -> elifexp3",
                "elif3 -> else4",
                "elifexp3 -> end",
                "else4 -> end"), edgeStrings(cfg));
        assertEquals(4, ComplexityCalculator.cyclomatic(cfg));
    }

    @Test
    void testExpressionNodesOnlyLeadToEnd() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(BRANCH_CHAIN);

        for (String exp : Arrays.asList("ifexp1", "elifexp2", "elifexp3")) {
            assertEquals(Collections.singletonList("end"), successors(cfg, exp));
        }
        assertEquals(Collections.singletonList("end"), successors(cfg, "else4"));
    }

    @Test
    void testBranchTraceAndCounts() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(BRANCH_CHAIN);

        assertEquals(Arrays.asList("if1", "ifexp1", "elif2", "elif2", "elifexp2",
                "elif3", "elif3", "elifexp3", "else4", "else4"), cfg.getBranchTrace());

        Map<String, Integer> expected = new LinkedHashMap<>();
        expected.put("if1", 1);
        expected.put("ifexp1", 1);
        expected.put("elif2", 2);
        expected.put("elifexp2", 1);
        expected.put("elif3", 2);
        expected.put("elifexp3", 1);
        expected.put("else4", 2);
        assertEquals(expected, cfg.getBranchCounts());
    }

    @Test
    void testOnlyStartAndEnd() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(Arrays.asList("start", "end"));

        assertEquals(Arrays.asList("start", "end"), cfg.getNodes());
        assertEquals(Collections.singletonList("start -> end"), edgeStrings(cfg));
        assertTrue(cfg.getBranchTrace().isEmpty());
    }

    @Test
    void testTooShortSequences() {
        assertTrue(generator.generateCFG(Collections.emptyList()).getEdges().isEmpty());
        CFGGenerator.ControlFlowGraph single = generator.generateCFG(Collections.singletonList("start"));
        assertEquals(Collections.singletonList("start"), single.getNodes());
        assertTrue(single.getEdges().isEmpty());
    }

    @Test
    void testWhileLoopSelfLoopAndExit() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(Arrays.asList("start", "while1", "end"));

        assertEquals(Arrays.asList(
                "start -> while1",
                "while1 -> end",
                "while1 -> while1"), edgeStrings(cfg));
        assertTrue(cfg.hasEdge("while1", "while1"), "While header should loop on itself");
    }

    @Test
    void testForLoopFollowedByBranch() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(
                Arrays.asList("start", "for1", "if2", "ifexp2", "end"));

        assertEquals(Arrays.asList(
                "start -> for1",
                "for1 -> if2",
                "for1 -> for1",
                "if2 -> ifexp2",
                "if2 -> end",
                "ifexp2 -> end"), edgeStrings(cfg));
    }

    @Test
    void testNestedForClosesBackToHeader() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(
                Arrays.asList("start", "for1", "forsp2", "end"));

        assertEquals(Arrays.asList(
                "start -> for1",
                "for1 -> end",
                "for1 -> forsp2",
                "forsp2 -> forsp2",
                "forsp2 -> for1"), edgeStrings(cfg));
        assertFalse(cfg.hasEdge("for1", "for1"), "Header with a nested body gets no self-loop");
    }

    @Test
    void testNestedWhileInsideWhileUsesLoopMarker() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(
                Arrays.asList("start", "while1", "whilesp2", "end"));

        assertEquals(Arrays.asList(
                "start -> while1",
                "while1 -> end",
                "while1 -> whilesp2",
                "whilesp2 -> f",
                "whilesp2 -> whilesp2"), edgeStrings(cfg));
        assertEquals(Arrays.asList("start", "while1", "whilesp2", "end", "f"), cfg.getNodes());
    }

    @Test
    void testNestedWhileOutsideWhileFallsThrough() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(
                Arrays.asList("start", "if1", "ifexp1", "whilesp2", "end"));

        assertTrue(cfg.hasEdge("whilesp2", "end"));
        assertTrue(cfg.hasEdge("whilesp2", "whilesp2"));
        assertFalse(cfg.getNodes().contains("f"));
    }

    @Test
    void testNestedForInsideWhileRange() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(
                Arrays.asList("start", "while1", "ifsp2", "ifspexp2", "forsp3", "end"));

        assertEquals(Arrays.asList(
                "start -> while1",
                "while1 -> end",
                "while1 -> ifsp2",
                "ifsp2 -> ifspexp2",
                "ifspexp2 -> forsp3",
                "forsp3 -> forsp3",
                "forsp3 -> f"), edgeStrings(cfg));
    }

    @Test
    void testNestedBranchesUseFallthrough() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(
                Arrays.asList("start", "if1", "ifexp1", "ifsp2", "ifspexp2", "else3", "end"));

        assertEquals(Arrays.asList(
                "start -> if1",
                "if1 -> ifexp1",
                "if1 -> else3",
                "ifexp1 -> end",
                "ifsp2 -> ifspexp2",
                "ifspexp2 -> else3",
                "else3 -> end"), edgeStrings(cfg));
    }

    @Test
    void testDuplicateEdgesAreDropped() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(
                Arrays.asList("start", "x", "x", "x", "end"));

        assertEquals(Arrays.asList("start", "x", "end"), cfg.getNodes());
        assertEquals(Arrays.asList("start -> x", "x -> x", "x -> end"), edgeStrings(cfg));
    }

    @Test
    void testEveryEdgeEndpointIsANode() {
        List<List<String>> inputs = Arrays.asList(
                BRANCH_CHAIN,
                Arrays.asList("start", "while1", "whilesp2", "forsp3", "end"),
                Arrays.asList("start", "for1", "forsp2", "ifsp3", "ifspexp3", "while4", "end"));

        for (List<String> labels : inputs) {
            CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(labels);
            Set<String> nodes = new HashSet<>(cfg.getNodes());
            for (CFGGenerator.CFGEdge edge : cfg.getEdges()) {
                assertTrue(nodes.contains(edge.from), "Unknown source in " + edge);
                assertTrue(nodes.contains(edge.to), "Unknown destination in " + edge);
            }
        }
    }

    @Test
    void testGenerationIsDeterministic() {
        List<String> labels = Arrays.asList("start", "while1", "ifsp2", "ifspexp2", "forsp3", "if4", "ifexp4", "end");

        CFGGenerator.ControlFlowGraph first = generator.generateCFG(labels);
        CFGGenerator.ControlFlowGraph second = new CFGGenerator().generateCFG(labels);

        assertEquals(first.getNodes(), second.getNodes());
        assertEquals(edgeStrings(first), edgeStrings(second));
    }

    @Test
    void testAdjacencyKeepsEdgeOrder() {
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(BRANCH_CHAIN);

        Map<String, List<String>> adjacency = cfg.getAdjacency();

        assertEquals(Arrays.asList("ifexp1", "elif2"), adjacency.get("if1"));
        assertEquals(Arrays.asList("elifexp3", "else4"), adjacency.get("elif3"));
        assertFalse(adjacency.containsKey("end"));
    }

    // Helper methods

    private List<String> edgeStrings(CFGGenerator.ControlFlowGraph cfg) {
        return cfg.getEdges().stream()
                .map(CFGGenerator.CFGEdge::toString)
                .collect(Collectors.toList());
    }

    private List<String> successors(CFGGenerator.ControlFlowGraph cfg, String node) {
        return cfg.getEdges().stream()
                .filter(edge -> edge.from.equals(node))
                .map(edge -> edge.to)
                .collect(Collectors.toList());
    }
}
