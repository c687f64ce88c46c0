package dev.jiff.diff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Splits text into the tokens the matcher compares.
 */
public final class Tokenizer {

    private Tokenizer() {
    }

    /**
     * Splits on {@code \n}. A single trailing terminator does not start another line, and empty text has no lines.
     */
    public static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\n", -1)));
        if (text.endsWith("\n")) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    public static List<String> characters(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return text.codePoints()
                .mapToObj(Character::toString)
                .collect(Collectors.toList());
    }

    public static int characterLength(String text) {
        return text.codePointCount(0, text.length());
    }
}
