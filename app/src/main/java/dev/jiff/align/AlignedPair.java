package dev.jiff.align;

import java.util.Optional;

/**
 * One row of an alignment: a paired before/after line, or a single unpaired line.
 */
public record AlignedPair(Optional<String> before, Optional<String> after) {

    public AlignedPair {
        before = before == null ? Optional.empty() : before;
        after = after == null ? Optional.empty() : after;
        if (before.isEmpty() && after.isEmpty()) {
            throw new IllegalArgumentException("Aligned pair needs at least one side");
        }
    }

    public static AlignedPair paired(String before, String after) {
        return new AlignedPair(Optional.of(before), Optional.of(after));
    }

    public static AlignedPair removed(String before) {
        return new AlignedPair(Optional.of(before), Optional.empty());
    }

    public static AlignedPair added(String after) {
        return new AlignedPair(Optional.empty(), Optional.of(after));
    }

    public boolean isPaired() {
        return before.isPresent() && after.isPresent();
    }
}
