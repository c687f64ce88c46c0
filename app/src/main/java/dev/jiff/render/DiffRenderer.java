package dev.jiff.render;

import dev.jiff.diff.DiffChunk;
import java.io.PrintWriter;
import java.util.List;

/**
 * Writes a line-level diff to a terminal stream.
 */
public interface DiffRenderer {

    void render(List<DiffChunk> chunks, PrintWriter out);

    /** Prints the {@code ---}/{@code +++} file header. */
    void renderHeader(String leftLabel, String rightLabel, PrintWriter out);
}
