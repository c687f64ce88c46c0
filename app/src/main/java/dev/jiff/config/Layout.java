package dev.jiff.config;

/**
 * How the diff is laid out on the terminal.
 */
public enum Layout {
    UNIFIED,
    SIDE_BY_SIDE;

    public static Layout of(boolean sideBySide) {
        return sideBySide ? SIDE_BY_SIDE : UNIFIED;
    }
}
