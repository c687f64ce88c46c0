package dev.jiff.diff;

import java.util.List;
import java.util.Objects;

/**
 * A run of tokens sharing one {@link DiffType}. Tokens are lines for line diffs and code points for
 * character diffs. {@code ADD} chunks have no before tokens and {@code REMOVE} chunks no after tokens.
 */
public record DiffChunk(DiffType type, List<String> before, List<String> after) {

    public DiffChunk {
        Objects.requireNonNull(type, "type");
        before = List.copyOf(Objects.requireNonNull(before, "before"));
        after = List.copyOf(Objects.requireNonNull(after, "after"));
        if (type == DiffType.ADD && !before.isEmpty()) {
            throw new IllegalArgumentException("ADD chunk must not carry before tokens");
        }
        if (type == DiffType.REMOVE && !after.isEmpty()) {
            throw new IllegalArgumentException("REMOVE chunk must not carry after tokens");
        }
    }

    public String beforeText() {
        return String.join("", before);
    }

    public String afterText() {
        return String.join("", after);
    }
}
