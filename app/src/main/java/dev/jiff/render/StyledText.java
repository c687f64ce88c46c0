package dev.jiff.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single line of text made of differently styled spans. Lengths and wrap points are counted in
 * code points.
 */
public final class StyledText {

    private final List<Span> spans = new ArrayList<>();

    public static StyledText of(String text, AnsiStyle style) {
        return new StyledText().append(text, style);
    }

    public StyledText append(String text, AnsiStyle style) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(style, "style");
        if (!text.isEmpty()) {
            spans.add(new Span(text, style));
        }
        return this;
    }

    public StyledText append(StyledText other) {
        spans.addAll(other.spans);
        return this;
    }

    public int length() {
        int length = 0;
        for (Span span : spans) {
            length += span.text.codePointCount(0, span.text.length());
        }
        return length;
    }

    public String plainText() {
        StringBuilder builder = new StringBuilder();
        for (Span span : spans) {
            builder.append(span.text);
        }
        return builder.toString();
    }

    public String render() {
        StringBuilder builder = new StringBuilder();
        for (Span span : spans) {
            builder.append(span.style.apply(span.text));
        }
        return builder.toString();
    }

    /** Replaces each tab with spaces up to the next multiple of {@code tabSize} columns. */
    public StyledText expandTabs(int tabSize) {
        if (tabSize <= 0) {
            throw new IllegalArgumentException("tabSize must be greater than zero");
        }
        StyledText expanded = new StyledText();
        int column = 0;
        for (Span span : spans) {
            StringBuilder builder = new StringBuilder(span.text.length());
            int[] codePoints = span.text.codePoints().toArray();
            for (int codePoint : codePoints) {
                if (codePoint == '\t') {
                    int spaces = tabSize - (column % tabSize);
                    builder.append(" ".repeat(spaces));
                    column += spaces;
                } else {
                    builder.appendCodePoint(codePoint);
                    column++;
                }
            }
            expanded.append(builder.toString(), span.style);
        }
        return expanded;
    }

    /**
     * Hard-wraps into rows of at most {@code width} code points, keeping each span's style. Empty
     * text still yields one (empty) row.
     */
    public List<StyledText> wrap(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be greater than zero");
        }
        List<StyledText> rows = new ArrayList<>();
        StyledText row = new StyledText();
        int rowLength = 0;
        for (Span span : spans) {
            int[] codePoints = span.text.codePoints().toArray();
            int offset = 0;
            while (offset < codePoints.length) {
                if (rowLength == width) {
                    rows.add(row);
                    row = new StyledText();
                    rowLength = 0;
                }
                int take = Math.min(width - rowLength, codePoints.length - offset);
                row.append(new String(codePoints, offset, take), span.style);
                rowLength += take;
                offset += take;
            }
        }
        rows.add(row);
        return Collections.unmodifiableList(rows);
    }

    @Override
    public String toString() {
        return plainText();
    }

    private record Span(String text, AnsiStyle style) {
    }
}
