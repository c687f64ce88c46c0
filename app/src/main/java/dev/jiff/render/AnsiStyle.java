package dev.jiff.render;

import java.util.Objects;

/**
 * An ANSI SGR style. {@link #PLAIN} emits no escape codes at all.
 */
public record AnsiStyle(String parameters) {

    public static final AnsiStyle PLAIN = new AnsiStyle("");

    /** Offsets into the basic 8-color table. */
    public static final int BLACK = 0;
    public static final int RED = 1;
    public static final int GREEN = 2;

    private static final String ESCAPE = "\u001b[";
    private static final String RESET = "\u001b[0m";

    public AnsiStyle {
        Objects.requireNonNull(parameters, "parameters");
    }

    public static AnsiStyle foreground(int color) {
        return new AnsiStyle(Integer.toString(30 + color));
    }

    public static AnsiStyle foreground256(int color) {
        return new AnsiStyle("38;5;" + color);
    }

    public AnsiStyle background(int color) {
        return with(Integer.toString(40 + color));
    }

    public AnsiStyle bold() {
        return with("1");
    }

    public AnsiStyle reverse() {
        return with("7");
    }

    public boolean isPlain() {
        return parameters.isEmpty();
    }

    public String apply(String text) {
        if (isPlain() || text.isEmpty()) {
            return text;
        }
        return ESCAPE + parameters + 'm' + text + RESET;
    }

    private AnsiStyle with(String parameter) {
        return new AnsiStyle(isPlain() ? parameter : parameters + ';' + parameter);
    }
}
