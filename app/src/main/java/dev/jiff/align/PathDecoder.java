package dev.jiff.align;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a solved lattice path into the pairs the renderers consume.
 */
public class PathDecoder {

    public List<AlignedPair> decode(List<MoveNode> path, List<String> before, List<String> after) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");

        List<AlignedPair> pairs = new ArrayList<>(path.size());
        for (MoveNode node : path) {
            AlignedPair pair = switch (node.kind()) {
                case DELETE -> AlignedPair.removed(before.get(node.beforeIndex()));
                case INSERT -> AlignedPair.added(after.get(node.afterIndex()));
                case SUBSTITUTE -> AlignedPair.paired(before.get(node.beforeIndex()), after.get(node.afterIndex()));
            };
            pairs.add(pair);
        }
        return pairs;
    }
}
