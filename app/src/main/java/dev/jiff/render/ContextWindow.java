package dev.jiff.render;

import java.util.List;

/**
 * Decides which lines of an unchanged run stay visible when context is limited.
 */
record ContextWindow(int head, int elided, int tail) {

    static ContextWindow of(List<String> lines, int context) {
        int size = lines.size();
        if (context <= 0 || size <= 2L * context) {
            return new ContextWindow(size, 0, 0);
        }
        return new ContextWindow(context, size - context * 2, context);
    }

    boolean isElided() {
        return elided > 0;
    }
}
