package dev.jiff.align;

/**
 * One step through the alignment lattice and how far it advances each side.
 */
public enum MoveKind {
    /** Consumes one before-line on its own. */
    DELETE(1, 0),
    /** Consumes one after-line on its own. */
    INSERT(0, 1),
    /** Consumes one before-line and one after-line as a pair. */
    SUBSTITUTE(1, 1);

    private final int beforeStep;
    private final int afterStep;

    MoveKind(int beforeStep, int afterStep) {
        this.beforeStep = beforeStep;
        this.afterStep = afterStep;
    }

    public int beforeStep() {
        return beforeStep;
    }

    public int afterStep() {
        return afterStep;
    }
}
