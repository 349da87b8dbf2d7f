package analysis;

import config.AnalysisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sanalysis.PathLimitExceededException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_SAMPLE = "samples/branch_chain.py";

    static final int EXIT_OK = 0;
    static final int EXIT_BAD_INPUT = 1;
    static final int EXIT_PATH_LIMIT = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Analyses the file named by the first argument, or the bundled sample
     * when there is none, and prints the JSON report to {@code out}.
     *
     * @return process exit status
     */
    static int run(String[] args, PrintStream out) {
        CfgAnalysis analysis = new CfgAnalysis(AnalysisConfig.load());
        try {
            CfgReport report;
            if (args.length >= 1) {
                report = analysis.analyseFile(Paths.get(args[0]));
            } else {
                logger.info("Usage: java analysis.Main <source_file>");
                logger.info("No source file given, analysing bundled sample {}", DEFAULT_SAMPLE);
                report = analysis.analyse(readSample(DEFAULT_SAMPLE));
            }
            out.println(report.toJson());
            return EXIT_OK;
        } catch (IOException e) {
            logger.error("Error reading source: {}", e.getMessage());
            return EXIT_BAD_INPUT;
        } catch (PathLimitExceededException e) {
            logger.error("Path finding stopped: {}", e.getMessage());
            return EXIT_PATH_LIMIT;
        }
    }

    static String readSample(String resource) throws IOException {
        try (InputStream input = Main.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new IOException("Sample not found on classpath: " + resource);
            }
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
