package dev.jiff.render;

import dev.jiff.align.AlignedPair;
import dev.jiff.diff.DiffChunk;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-column layout: unchanged lines prefixed with two spaces, removals with {@code "- "} and
 * additions with {@code "+ "}. Inside a replace block all removed lines come first, then all added
 * lines, with paired lines highlighted character by character.
 */
public class UnifiedDiffRenderer implements DiffRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnifiedDiffRenderer.class);

    private static final String SAME_MARGIN = "  ";
    private static final String ADD_MARGIN = "+ ";
    private static final String REMOVE_MARGIN = "- ";
    private static final String ELISION = "...";

    private final Palette palette;
    private final ReplaceBlockAligner aligner;
    private final CharacterHighlighter highlighter;
    private final int context;

    public UnifiedDiffRenderer(Palette palette, ReplaceBlockAligner aligner, CharacterHighlighter highlighter, int context) {
        this.palette = Objects.requireNonNull(palette, "palette");
        this.aligner = Objects.requireNonNull(aligner, "aligner");
        this.highlighter = Objects.requireNonNull(highlighter, "highlighter");
        if (context < 0) {
            throw new IllegalArgumentException("context must be zero or greater");
        }
        this.context = context;
    }

    @Override
    public void renderHeader(String leftLabel, String rightLabel, PrintWriter out) {
        DiffStyling lines = palette.lines();
        out.println(lines.remove().apply("--- " + leftLabel));
        out.println(lines.add().apply("+++ " + rightLabel));
    }

    @Override
    public void render(List<DiffChunk> chunks, PrintWriter out) {
        DiffStyling margins = palette.margins();
        DiffStyling lines = palette.lines();
        for (DiffChunk chunk : chunks) {
            LOGGER.debug("Diff: {} (-{} +{})", chunk.type(), chunk.before().size(), chunk.after().size());
            switch (chunk.type()) {
                case SAME -> renderSame(chunk.before(), out);
                case ADD -> {
                    for (String line : chunk.after()) {
                        printLine(out, StyledText.of(ADD_MARGIN, margins.add()).append(line, lines.add()));
                    }
                }
                case REMOVE -> {
                    for (String line : chunk.before()) {
                        printLine(out, StyledText.of(REMOVE_MARGIN, margins.remove()).append(line, lines.remove()));
                    }
                }
                case REPLACE -> renderReplace(chunk, out);
            }
        }
        out.flush();
    }

    private void renderSame(List<String> sameLines, PrintWriter out) {
        DiffStyling margins = palette.margins();
        DiffStyling lines = palette.lines();
        ContextWindow window = ContextWindow.of(sameLines, context);
        for (int i = 0; i < window.head(); i++) {
            printLine(out, StyledText.of(SAME_MARGIN, margins.same()).append(sameLines.get(i), lines.same()));
        }
        if (window.isElided()) {
            printLine(out, StyledText.of(SAME_MARGIN, margins.same()).append(ELISION, lines.same()));
            for (int i = sameLines.size() - window.tail(); i < sameLines.size(); i++) {
                printLine(out, StyledText.of(SAME_MARGIN, margins.same()).append(sameLines.get(i), lines.same()));
            }
        }
    }

    private void renderReplace(DiffChunk chunk, PrintWriter out) {
        DiffStyling margins = palette.margins();
        DiffStyling lines = palette.lines();
        List<StyledText> removed = new ArrayList<>();
        List<StyledText> added = new ArrayList<>();
        for (AlignedPair pair : aligner.pairs(chunk.before(), chunk.after())) {
            LOGGER.debug("Aligned: {}", pair);
            if (pair.isPaired()) {
                CharacterHighlighter.Highlighted highlighted =
                        highlighter.highlight(pair.before().get(), pair.after().get(), lines);
                removed.add(StyledText.of(REMOVE_MARGIN, margins.removeHighlight()).append(highlighted.before()));
                added.add(StyledText.of(ADD_MARGIN, margins.addHighlight()).append(highlighted.after()));
            } else if (pair.before().isPresent()) {
                removed.add(StyledText.of(REMOVE_MARGIN, margins.removeHighlight())
                        .append(pair.before().get(), lines.removeHighlight()));
            } else {
                added.add(StyledText.of(ADD_MARGIN, margins.addHighlight())
                        .append(pair.after().get(), lines.addHighlight()));
            }
        }
        removed.forEach(line -> printLine(out, line));
        added.forEach(line -> printLine(out, line));
    }

    private static void printLine(PrintWriter out, StyledText line) {
        out.println(line.render());
    }
}
