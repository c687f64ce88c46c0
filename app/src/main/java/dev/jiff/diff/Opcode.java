package dev.jiff.diff;

import java.util.Objects;

/**
 * A contiguous span of both matcher inputs together with how the two sides relate.
 * Ranges are half-open token indexes.
 */
public record Opcode(OpcodeKind kind, int leftStart, int leftEnd, int rightStart, int rightEnd) {

    public Opcode {
        Objects.requireNonNull(kind, "kind");
        if (leftStart < 0 || leftEnd < leftStart || rightStart < 0 || rightEnd < rightStart) {
            throw new IllegalArgumentException("Invalid opcode boundaries");
        }
    }

    public int leftLength() {
        return leftEnd - leftStart;
    }

    public int rightLength() {
        return rightEnd - rightStart;
    }
}
