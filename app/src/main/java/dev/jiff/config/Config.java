package dev.jiff.config;

import java.util.Objects;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        DiffInputs inputs,
        boolean gitDiff,
        Layout layout,
        boolean color,
        int context,
        int terminalWidth,
        long maxAlignmentCells,
        LogFormat logFormat,
        boolean debug
) {

    public Config {
        Objects.requireNonNull(inputs, "inputs");
        layout = layout == null ? Layout.UNIFIED : layout;
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        if (context < 0) {
            throw new IllegalArgumentException("context must be greater than or equal to zero");
        }
        if (terminalWidth <= 0) {
            throw new IllegalArgumentException("terminalWidth must be greater than zero");
        }
        if (maxAlignmentCells <= 0) {
            throw new IllegalArgumentException("maxAlignmentCells must be greater than zero");
        }
    }

    public boolean sideBySide() {
        return layout == Layout.SIDE_BY_SIDE;
    }
}
