package dev.jiff.render;

import java.util.Objects;

/**
 * Styles for each role a piece of diff output can play.
 */
public record DiffStyling(
        AnsiStyle same,
        AnsiStyle add,
        AnsiStyle addHighlight,
        AnsiStyle remove,
        AnsiStyle removeHighlight
) {

    public static final DiffStyling PLAIN = uniform(AnsiStyle.PLAIN);

    public DiffStyling {
        Objects.requireNonNull(same, "same");
        Objects.requireNonNull(add, "add");
        Objects.requireNonNull(addHighlight, "addHighlight");
        Objects.requireNonNull(remove, "remove");
        Objects.requireNonNull(removeHighlight, "removeHighlight");
    }

    public static DiffStyling uniform(AnsiStyle style) {
        return new DiffStyling(style, style, style, style, style);
    }
}
