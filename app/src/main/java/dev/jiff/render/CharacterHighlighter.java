package dev.jiff.render;

import dev.jiff.diff.DiffCalculator;
import dev.jiff.diff.DiffChunk;
import java.util.Objects;

/**
 * Styles a paired before/after line so that only the characters that differ are highlighted.
 */
public class CharacterHighlighter {

    private final DiffCalculator diffCalculator;

    public CharacterHighlighter(DiffCalculator diffCalculator) {
        this.diffCalculator = Objects.requireNonNull(diffCalculator, "diffCalculator");
    }

    public Highlighted highlight(String before, String after, DiffStyling styling) {
        StyledText beforeText = new StyledText();
        StyledText afterText = new StyledText();
        for (DiffChunk chunk : diffCalculator.calculateCharDiff(before, after)) {
            switch (chunk.type()) {
                case SAME -> {
                    beforeText.append(chunk.beforeText(), styling.remove());
                    afterText.append(chunk.afterText(), styling.add());
                }
                case ADD -> afterText.append(chunk.afterText(), styling.addHighlight());
                case REMOVE -> beforeText.append(chunk.beforeText(), styling.removeHighlight());
                case REPLACE -> {
                    beforeText.append(chunk.beforeText(), styling.removeHighlight());
                    afterText.append(chunk.afterText(), styling.addHighlight());
                }
            }
        }
        return new Highlighted(beforeText, afterText);
    }

    /** Both sides of a highlighted pair. */
    public record Highlighted(StyledText before, StyledText after) {
    }
}
