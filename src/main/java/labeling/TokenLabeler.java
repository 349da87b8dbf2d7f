package labeling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * TokenLabeler turns program text into the ordered label sequence consumed by
 * the CFG generator.
 *
 * Every line that starts with a recognised keyword becomes one node (two for
 * if/elif, which also get a condition-expression node). Nodes are numbered by
 * one counter shared by all keyword kinds, and a node opened inside another
 * keyword's block gets the {@code sp} infix. Block membership is inferred from
 * indentation alone: a block ends as soon as any non-blank line appears at or
 * left of the block header's column.
 */
public class TokenLabeler {
    private static final Logger logger = LoggerFactory.getLogger(TokenLabeler.class);

    // An open block: the header's indentation and the label it produced.
    private static class BlockEntry {
        final int depth;
        final String label;
        BlockEntry(int depth, String label) {
            this.depth = depth;
            this.label = label;
        }
    }

    /**
     * Labels the given source.
     *
     * @param source program text, any line terminators
     * @return labels starting with {@code start} and ending with {@code end}
     */
    public List<String> label(String source) {
        Objects.requireNonNull(source, "source");
        List<String> labels = new ArrayList<>();
        labels.add(Label.START);

        Deque<BlockEntry> blockStack = new ArrayDeque<>();
        int count = 0;

        Iterator<String> lines = source.lines().iterator();
        while (lines.hasNext()) {
            String line = lines.next();
            if (line.isBlank()) {
                continue;
            }
            // any non-blank line at or left of a header's column closes that block
            int depth = IndentationTracker.depth(line);
            while (!blockStack.isEmpty() && blockStack.peek().depth >= depth) {
                blockStack.pop();
            }

            Keyword keyword = LineClassifier.classify(line);
            if (keyword == Keyword.OTHER) {
                continue;
            }
            boolean nested = !blockStack.isEmpty();

            count++;
            String header = Label.header(keyword, nested, count);
            labels.add(header);
            if (keyword.hasExpression()) {
                labels.add(Label.expression(keyword, nested, count));
            }
            if (nested) {
                logger.debug("{} at depth {} nested in {}", header, depth, blockStack.peek().label);
            }
            blockStack.push(new BlockEntry(depth, header));
        }

        labels.add(Label.END);
        logger.debug("Labelled {} keyword lines into {} labels", count, labels.size());
        return labels;
    }
}
