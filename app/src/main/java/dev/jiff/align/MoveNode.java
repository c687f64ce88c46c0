package dev.jiff.align;

/**
 * A lattice vertex: the move of a given kind that lands on consumption state
 * ({@code beforeConsumed}, {@code afterConsumed}).
 *
 * <p>Weight is fixed at construction. Distance and predecessor are written only while the solver
 * relaxes edges; a {@code null} predecessor stands for the implicit origin state (0, 0).
 */
public final class MoveNode {

    static final long UNREACHED = Long.MAX_VALUE;

    private final MoveKind kind;
    private final int beforeConsumed;
    private final int afterConsumed;
    private final long weight;
    private long distance = UNREACHED;
    private MoveNode predecessor;

    MoveNode(MoveKind kind, int beforeConsumed, int afterConsumed, long weight) {
        if (weight < 0) {
            throw new IllegalArgumentException("Move weight must not be negative: " + weight);
        }
        this.kind = kind;
        this.beforeConsumed = beforeConsumed;
        this.afterConsumed = afterConsumed;
        this.weight = weight;
    }

    public MoveKind kind() {
        return kind;
    }

    public int beforeConsumed() {
        return beforeConsumed;
    }

    public int afterConsumed() {
        return afterConsumed;
    }

    /** Index of the before-line this move consumes, or -1 for an insert. */
    public int beforeIndex() {
        return kind.beforeStep() == 1 ? beforeConsumed - 1 : -1;
    }

    /** Index of the after-line this move consumes, or -1 for a delete. */
    public int afterIndex() {
        return kind.afterStep() == 1 ? afterConsumed - 1 : -1;
    }

    public long weight() {
        return weight;
    }

    public long distance() {
        return distance;
    }

    public MoveNode predecessor() {
        return predecessor;
    }

    public boolean isReached() {
        return distance != UNREACHED;
    }

    /**
     * Offers a path through {@code source} (or from the origin when {@code source} is null).
     * Only a strictly shorter path replaces the current one.
     */
    boolean relax(MoveNode source, long sourceDistance) {
        long candidate = sourceDistance + weight;
        if (candidate < distance) {
            distance = candidate;
            predecessor = source;
            return true;
        }
        return false;
    }

    String describe(boolean verbose) {
        String id = kind + "(" + beforeConsumed + "," + afterConsumed + ")";
        if (!verbose) {
            return id + ": " + weight;
        }
        String parent = predecessor == null
                ? "origin"
                : predecessor.kind + "(" + predecessor.beforeConsumed + "," + predecessor.afterConsumed + ")";
        String relaxed = isReached() ? Long.toString(distance) : "inf";
        return id + ": w=" + weight + ", d=" + relaxed + ", p=" + parent;
    }

    @Override
    public String toString() {
        return describe(false);
    }
}
