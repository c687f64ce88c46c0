package dev.jiff.render;

/**
 * The style sets used by the two layouts. Every set collapses to {@link DiffStyling#PLAIN} when color is off.
 */
public record Palette(DiffStyling margins, DiffStyling lines) {

    public static Palette unified(boolean color) {
        if (!color) {
            return new Palette(DiffStyling.PLAIN, DiffStyling.PLAIN);
        }
        DiffStyling lines = new DiffStyling(
                AnsiStyle.PLAIN,
                AnsiStyle.foreground(AnsiStyle.GREEN),
                AnsiStyle.foreground(AnsiStyle.BLACK).background(AnsiStyle.GREEN),
                AnsiStyle.foreground(AnsiStyle.RED),
                AnsiStyle.foreground(AnsiStyle.BLACK).background(AnsiStyle.RED));
        return new Palette(DiffStyling.PLAIN, lines);
    }

    public static Palette sideBySide(boolean color) {
        if (!color) {
            return new Palette(DiffStyling.PLAIN, DiffStyling.PLAIN);
        }
        AnsiStyle addNumber = AnsiStyle.foreground(AnsiStyle.GREEN).bold();
        AnsiStyle removeNumber = AnsiStyle.foreground(AnsiStyle.RED).bold();
        DiffStyling lineNumbers = new DiffStyling(
                AnsiStyle.foreground(AnsiStyle.BLACK).bold(),
                addNumber,
                addNumber,
                removeNumber,
                removeNumber);
        DiffStyling lines = new DiffStyling(
                AnsiStyle.foreground(AnsiStyle.BLACK),
                AnsiStyle.foreground256(157),
                AnsiStyle.foreground256(157).reverse(),
                AnsiStyle.foreground256(217),
                AnsiStyle.foreground256(217).reverse());
        return new Palette(lineNumbers, lines);
    }
}
