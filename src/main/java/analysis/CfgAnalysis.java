package analysis;

import config.AnalysisConfig;
import labeling.Label;
import labeling.TokenLabeler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sanalysis.CFGGenerator;
import sanalysis.ComplexityCalculator;
import sanalysis.PathFinder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Runs the whole pipeline: labels, graph, complexity and start-to-end paths.
 */
public class CfgAnalysis {
    private static final Logger logger = LoggerFactory.getLogger(CfgAnalysis.class);

    private final TokenLabeler labeler = new TokenLabeler();
    private final CFGGenerator generator = new CFGGenerator();
    private final PathFinder pathFinder;

    public CfgAnalysis(AnalysisConfig config) {
        this.pathFinder = new PathFinder(Objects.requireNonNull(config, "config"));
    }

    /**
     * @throws sanalysis.PathLimitExceededException if path enumeration exceeds its limits
     */
    public CfgReport analyse(String source) {
        List<String> labels = labeler.label(source);
        CFGGenerator.ControlFlowGraph cfg = generator.generateCFG(labels);
        int complexity = ComplexityCalculator.cyclomatic(cfg);
        List<List<String>> paths = pathFinder.findAllPaths(cfg.getAdjacency(), Label.START, Label.END);

        logger.info("CFG created with {} nodes and {} edges; complexity {}; {} path(s) from start to end",
                cfg.getNodes().size(), cfg.getEdges().size(), complexity, paths.size());
        return new CfgReport(labels, cfg, complexity, paths);
    }

    public CfgReport analyseFile(Path sourceFile) throws IOException {
        logger.info("Analysing {}", sourceFile);
        return analyse(Files.readString(sourceFile, StandardCharsets.UTF_8));
    }
}
