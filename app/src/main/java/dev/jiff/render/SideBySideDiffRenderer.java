package dev.jiff.render;

import dev.jiff.align.AlignedPair;
import dev.jiff.diff.DiffChunk;
import java.io.PrintWriter;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-column layout with per-side line numbers. Long lines are hard-wrapped inside their column,
 * and the paired lines of a replace block share a row.
 */
public class SideBySideDiffRenderer implements DiffRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SideBySideDiffRenderer.class);

    static final String SEPARATOR = "│";
    static final int TAB_SIZE = 4;

    private static final String ELISION = "...";

    private final Palette palette;
    private final ReplaceBlockAligner aligner;
    private final CharacterHighlighter highlighter;
    private final int context;
    private final int terminalWidth;

    public SideBySideDiffRenderer(Palette palette, ReplaceBlockAligner aligner, CharacterHighlighter highlighter,
                                  int context, int terminalWidth) {
        this.palette = Objects.requireNonNull(palette, "palette");
        this.aligner = Objects.requireNonNull(aligner, "aligner");
        this.highlighter = Objects.requireNonNull(highlighter, "highlighter");
        if (context < 0) {
            throw new IllegalArgumentException("context must be zero or greater");
        }
        if (terminalWidth <= 0) {
            throw new IllegalArgumentException("terminalWidth must be greater than zero");
        }
        this.context = context;
        this.terminalWidth = terminalWidth;
    }

    @Override
    public void renderHeader(String leftLabel, String rightLabel, PrintWriter out) {
        DiffStyling lines = palette.lines();
        out.println(lines.remove().apply("--- " + leftLabel));
        out.println(lines.add().apply("+++ " + rightLabel));
    }

    @Override
    public void render(List<DiffChunk> chunks, PrintWriter out) {
        Columns columns = Columns.of(maxLineCount(chunks), terminalWidth);
        Cursor cursor = new Cursor(out, columns);
        for (DiffChunk chunk : chunks) {
            LOGGER.debug("Diff: {} (-{} +{})", chunk.type(), chunk.before().size(), chunk.after().size());
            switch (chunk.type()) {
                case SAME -> renderSame(cursor, chunk.before());
                case ADD -> chunk.after().forEach(cursor::added);
                case REMOVE -> chunk.before().forEach(cursor::removed);
                case REPLACE -> renderReplace(cursor, chunk);
            }
        }
        out.flush();
    }

    private void renderSame(Cursor cursor, List<String> lines) {
        ContextWindow window = ContextWindow.of(lines, context);
        for (int i = 0; i < window.head(); i++) {
            cursor.same(lines.get(i));
        }
        if (window.isElided()) {
            cursor.elide(window.elided());
            for (int i = lines.size() - window.tail(); i < lines.size(); i++) {
                cursor.same(lines.get(i));
            }
        }
    }

    private void renderReplace(Cursor cursor, DiffChunk chunk) {
        for (AlignedPair pair : aligner.pairs(chunk.before(), chunk.after())) {
            LOGGER.debug("Aligned: {}", pair);
            if (pair.isPaired()) {
                cursor.paired(highlighter.highlight(pair.before().get(), pair.after().get(), palette.lines()));
            } else if (pair.before().isPresent()) {
                cursor.removed(pair.before().get());
            } else {
                cursor.added(pair.after().get());
            }
        }
    }

    static int maxLineCount(List<DiffChunk> chunks) {
        int before = 0;
        int after = 0;
        for (DiffChunk chunk : chunks) {
            before += chunk.before().size();
            after += chunk.after().size();
        }
        return Math.max(before, after);
    }

    /** Widths of the line-number margin and of each text column. */
    record Columns(int lineNumberWidth, int lineWidth) {

        static Columns of(int maxLineCount, int terminalWidth) {
            int lineNumberWidth = maxLineCount > 0 ? String.valueOf(maxLineCount).length() : 1;
            int lineWidth = ((terminalWidth - SEPARATOR.length()) / 2) - (lineNumberWidth + 2);
            return new Columns(lineNumberWidth, Math.max(1, lineWidth));
        }

        String number(int lineNumber) {
            return String.format("%" + lineNumberWidth + "d:", lineNumber);
        }

        String blank() {
            return " ".repeat(lineNumberWidth + 1);
        }
    }

    /** Tracks both sides' line numbers while rows are written. */
    private final class Cursor {

        private final PrintWriter out;
        private final Columns columns;
        private int leftLine = 1;
        private int rightLine = 1;

        Cursor(PrintWriter out, Columns columns) {
            this.out = out;
            this.columns = columns;
        }

        void same(String line) {
            DiffStyling numbers = palette.margins();
            DiffStyling lines = palette.lines();
            printRow(StyledText.of(columns.number(leftLine), numbers.same()),
                    StyledText.of(columns.number(rightLine), numbers.same()),
                    StyledText.of(columns.blank(), numbers.same()),
                    StyledText.of(columns.blank(), numbers.same()),
                    StyledText.of(line, lines.same()),
                    StyledText.of(line, lines.same()));
            leftLine++;
            rightLine++;
        }

        void added(String line) {
            DiffStyling numbers = palette.margins();
            printRow(StyledText.of(columns.blank(), numbers.same()),
                    StyledText.of(columns.number(rightLine), numbers.addHighlight()),
                    StyledText.of(columns.blank(), numbers.same()),
                    StyledText.of(columns.blank(), numbers.addHighlight()),
                    new StyledText(),
                    StyledText.of(line, palette.lines().addHighlight()));
            rightLine++;
        }

        void removed(String line) {
            DiffStyling numbers = palette.margins();
            printRow(StyledText.of(columns.number(leftLine), numbers.removeHighlight()),
                    StyledText.of(columns.blank(), numbers.same()),
                    StyledText.of(columns.blank(), numbers.removeHighlight()),
                    StyledText.of(columns.blank(), numbers.same()),
                    StyledText.of(line, palette.lines().removeHighlight()),
                    new StyledText());
            leftLine++;
        }

        void paired(CharacterHighlighter.Highlighted highlighted) {
            DiffStyling numbers = palette.margins();
            printRow(StyledText.of(columns.number(leftLine), numbers.remove()),
                    StyledText.of(columns.number(rightLine), numbers.add()),
                    StyledText.of(columns.blank(), numbers.remove()),
                    StyledText.of(columns.blank(), numbers.add()),
                    highlighted.before(),
                    highlighted.after());
            leftLine++;
            rightLine++;
        }

        void elide(int count) {
            DiffStyling numbers = palette.margins();
            StyledText blank = StyledText.of(columns.blank(), numbers.same());
            printRow(blank, blank, blank, blank,
                    StyledText.of(ELISION, palette.lines().same()),
                    StyledText.of(ELISION, palette.lines().same()));
            leftLine += count;
            rightLine += count;
        }

        private void printRow(StyledText leftMargin, StyledText rightMargin,
                              StyledText leftWrapMargin, StyledText rightWrapMargin,
                              StyledText left, StyledText right) {
            List<StyledText> leftRows = left.expandTabs(TAB_SIZE).wrap(columns.lineWidth());
            List<StyledText> rightRows = right.expandTabs(TAB_SIZE).wrap(columns.lineWidth());
            int rows = Math.max(leftRows.size(), rightRows.size());
            for (int row = 0; row < rows; row++) {
                StyledText leftRow = row < leftRows.size() ? leftRows.get(row) : new StyledText();
                StyledText rightRow = row < rightRows.size() ? rightRows.get(row) : new StyledText();
                StyledText marginLeft = row == 0 ? leftMargin : leftWrapMargin;
                StyledText marginRight = row == 0 ? rightMargin : rightWrapMargin;
                out.println(marginLeft.render() + " "
                        + leftRow.render() + " ".repeat(columns.lineWidth() - leftRow.length())
                        + SEPARATOR
                        + marginRight.render() + " "
                        + rightRow.render());
            }
        }
    }
}
