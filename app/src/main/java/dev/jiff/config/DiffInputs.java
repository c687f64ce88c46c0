package dev.jiff.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The two files to compare and the names shown for them in headers.
 */
public record DiffInputs(Path left, Path right, String leftLabel, String rightLabel) {

    public DiffInputs {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        leftLabel = leftLabel == null || leftLabel.isBlank() ? left.toString() : leftLabel;
        rightLabel = rightLabel == null || rightLabel.isBlank() ? right.toString() : rightLabel;
    }
}
