package dev.jiff.diff;

/**
 * Classification of a diff chunk as seen by the renderers.
 */
public enum DiffType {
    SAME,
    ADD,
    REMOVE,
    REPLACE;

    static DiffType of(OpcodeKind kind) {
        return switch (kind) {
            case EQUAL -> SAME;
            case INSERT -> ADD;
            case DELETE -> REMOVE;
            case REPLACE -> REPLACE;
        };
    }
}
