package dev.jiff.config;

import java.util.OptionalInt;

/**
 * Reports the width of the terminal attached to the process, abstracted so configuration can be tested without one.
 */
@FunctionalInterface
public interface TerminalSizeProvider {

    /** Used when no terminal should be consulted. */
    TerminalSizeProvider NONE = OptionalInt::empty;

    /** Width in columns, or empty when there is no terminal or it reports no usable size. */
    OptionalInt width();
}
