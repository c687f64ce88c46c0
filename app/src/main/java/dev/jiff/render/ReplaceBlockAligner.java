package dev.jiff.render;

import dev.jiff.align.AlignedPair;
import dev.jiff.align.LineAligner;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns replace blocks up to a size limit. Alignment time and memory grow with the product of the
 * block's two line counts, so larger blocks are shown unaligned instead.
 */
public class ReplaceBlockAligner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplaceBlockAligner.class);

    private final LineAligner lineAligner;
    private final long maxCells;

    public ReplaceBlockAligner(LineAligner lineAligner, long maxCells) {
        this.lineAligner = Objects.requireNonNull(lineAligner, "lineAligner");
        if (maxCells <= 0) {
            throw new IllegalArgumentException("maxCells must be greater than zero");
        }
        this.maxCells = maxCells;
    }

    public List<AlignedPair> pairs(List<String> before, List<String> after) {
        long cells = (long) before.size() * after.size();
        if (cells > maxCells) {
            LOGGER.warn("Replace block of {}x{} lines exceeds {} cells; showing it unaligned",
                    before.size(), after.size(), maxCells);
            return unaligned(before, after);
        }
        return lineAligner.align(before, after);
    }

    static List<AlignedPair> unaligned(List<String> before, List<String> after) {
        List<AlignedPair> pairs = new ArrayList<>(before.size() + after.size());
        for (String line : before) {
            pairs.add(AlignedPair.removed(line));
        }
        for (String line : after) {
            pairs.add(AlignedPair.added(line));
        }
        return pairs;
    }
}
