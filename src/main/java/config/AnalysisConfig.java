package config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings for a CFG analysis run, read from {@code config.properties} on the
 * classpath. Missing keys fall back to the defaults below.
 */
public class AnalysisConfig {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisConfig.class);

    public static final String CONFIG_RESOURCE = "config.properties";
    public static final String MAX_DEPTH_KEY = "paths.max.depth";
    public static final String MAX_PATHS_KEY = "paths.max.count";

    public static final int DEFAULT_MAX_DEPTH = 1000;
    public static final int DEFAULT_MAX_PATHS = 10000;
    // the path search recurses once per path node; keeps it inside the default thread stack
    public static final int MAX_ALLOWED_DEPTH = 2000;

    private final int maxPathDepth;
    private final int maxPathCount;

    public AnalysisConfig(int maxPathDepth, int maxPathCount) {
        this.maxPathDepth = requireDepth(maxPathDepth);
        this.maxPathCount = requirePositive(MAX_PATHS_KEY, maxPathCount);
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(DEFAULT_MAX_DEPTH, DEFAULT_MAX_PATHS);
    }

    /**
     * Loads {@value #CONFIG_RESOURCE} from the classpath, or the defaults when
     * the resource is absent or unreadable.
     */
    public static AnalysisConfig load() {
        Properties props = new Properties();
        try (InputStream input = AnalysisConfig.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.warn("{} not found; using default settings.", CONFIG_RESOURCE);
            }
        } catch (IOException e) {
            logger.error("Error loading {}", CONFIG_RESOURCE, e);
        }
        return fromProperties(props);
    }

    public static AnalysisConfig fromProperties(Properties props) {
        int depth = parseInt(props, MAX_DEPTH_KEY, DEFAULT_MAX_DEPTH);
        int paths = parseInt(props, MAX_PATHS_KEY, DEFAULT_MAX_PATHS);
        return new AnalysisConfig(depth, paths);
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static int requirePositive(String key, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(key + " must be at least 1, got " + value);
        }
        return value;
    }

    /**
     * Validates a path depth bound: at least 1 and at most {@value #MAX_ALLOWED_DEPTH}.
     */
    public static int requireDepth(int value) {
        requirePositive(MAX_DEPTH_KEY, value);
        if (value > MAX_ALLOWED_DEPTH) {
            throw new IllegalArgumentException(MAX_DEPTH_KEY + " must be at most " + MAX_ALLOWED_DEPTH + ", got " + value);
        }
        return value;
    }

    /** Longest path (in nodes) the path finder may build. */
    public int getMaxPathDepth() { return maxPathDepth; }

    /** Largest number of paths the path finder may return. */
    public int getMaxPathCount() { return maxPathCount; }

    @Override
    public String toString() {
        return "AnalysisConfig{maxPathDepth=" + maxPathDepth + ", maxPathCount=" + maxPathCount + "}";
    }
}
