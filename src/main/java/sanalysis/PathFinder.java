package sanalysis;

import config.AnalysisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * PathFinder enumerates every path between two nodes of a CFG given as an
 * adjacency map.
 *
 * The search is a depth-first walk that never revisits a node already on the
 * current path. When a successor is already on the path (a back-edge), the
 * loop is not unrolled; instead, if that node can leave directly for the
 * destination, one extra path {@code prefix + [node, dest]} is recorded
 * ("loop body ran, then control left"). A self-loop seen first in that scan
 * ends it without a path.
 */
public class PathFinder {
    private static final Logger logger = LoggerFactory.getLogger(PathFinder.class);

    private final int maxDepth;
    private final int maxPaths;

    public PathFinder(AnalysisConfig config) {
        this(config.getMaxPathDepth(), config.getMaxPathCount());
    }

    public PathFinder(int maxDepth, int maxPaths) {
        if (maxPaths < 1) {
            throw new IllegalArgumentException("Path limits must be at least 1: depth=" + maxDepth + ", paths=" + maxPaths);
        }
        this.maxDepth = AnalysisConfig.requireDepth(maxDepth);
        this.maxPaths = maxPaths;
    }

    /**
     * Finds all paths from {@code source} to {@code dest}.
     *
     * @param adjacency successors per node, in edge order; missing keys mean no successors
     * @param source    first node of every path
     * @param dest      last node of every path
     * @return complete paths in discovery order
     * @throws PathLimitExceededException if a path or the result grows past the configured bounds
     */
    public List<List<String>> findAllPaths(Map<String, List<String>> adjacency, String source, String dest) {
        Objects.requireNonNull(adjacency, "adjacency");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(dest, "dest");
        List<List<String>> paths = new ArrayList<>();
        search(adjacency, source, dest, Collections.emptyList(), paths);
        logger.debug("Found {} paths from {} to {}", paths.size(), source, dest);
        return paths;
    }

    private void search(Map<String, List<String>> adjacency, String source, String dest,
                        List<String> prefix, List<List<String>> paths) {
        List<String> path = new ArrayList<>(prefix);
        path.add(source);
        if (path.size() > maxDepth) {
            throw new PathLimitExceededException(PathLimitExceededException.Limit.DEPTH, maxDepth);
        }

        if (source.equals(dest)) {
            addPath(paths, path);
            return;
        }

        for (String node : adjacency.getOrDefault(source, Collections.emptyList())) {
            if (path.contains(node)) {
                closeBackEdge(adjacency, node, dest, path, paths);
            } else {
                search(adjacency, node, dest, path, paths);
            }
        }
    }

    private void closeBackEdge(Map<String, List<String>> adjacency, String node, String dest,
                               List<String> path, List<List<String>> paths) {
        for (String successor : adjacency.getOrDefault(node, Collections.emptyList())) {
            if (successor.equals(node)) {
                break;
            }
            if (successor.equals(dest)) {
                List<String> synthetic = new ArrayList<>(path);
                synthetic.add(node);
                synthetic.add(dest);
                logger.debug("Back-edge to {} closed as {}", node, synthetic);
                addPath(paths, synthetic);
                break;
            }
        }
    }

    private void addPath(List<List<String>> paths, List<String> path) {
        if (paths.size() >= maxPaths) {
            throw new PathLimitExceededException(PathLimitExceededException.Limit.PATH_COUNT, maxPaths);
        }
        paths.add(Collections.unmodifiableList(path));
    }
}
